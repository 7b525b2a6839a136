package org.javai.nlrecon.intent.extract;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.nlrecon.intent.Archetype;
import org.javai.nlrecon.intent.FilterMention;
import org.javai.nlrecon.intent.FilterOperator;
import org.javai.nlrecon.kg.KnowledgeGraph;
import org.javai.nlrecon.kg.TableNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * {@link EntityExtractor} backed by a Spring AI {@link ChatClient}.
 *
 * <p>The system prompt lists the knowledge graph's tables with their aliases and asks for a
 * JSON object. The response may be bare JSON or wrapped in a fenced {@code json} block.</p>
 */
public final class ChatClientEntityExtractor implements EntityExtractor {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientEntityExtractor.class);
	private static final Pattern JSON_BLOCK_PATTERN = Pattern.compile("```(?:json)?\\s*\\n?(\\{.*?\\})\\s*```", Pattern.DOTALL);

	private final ChatClient chatClient;
	private final KnowledgeGraph kg;
	private final ObjectMapper mapper;

	public ChatClientEntityExtractor(ChatClient chatClient, KnowledgeGraph kg) {
		this(chatClient, kg, new ObjectMapper());
	}

	public ChatClientEntityExtractor(ChatClient chatClient, KnowledgeGraph kg, ObjectMapper mapper) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
		this.kg = Objects.requireNonNull(kg, "kg must not be null");
		this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
	}

	@Override
	public ExtractionResult extract(String text) {
		if (text == null || text.isBlank()) {
			return ExtractionResult.empty();
		}
		String content;
		try {
			ChatClient.ChatClientRequestSpec request = chatClient.prompt();
			request.system(systemPrompt());
			request.user(text);
			content = request.call().content();
		}
		catch (RuntimeException e) {
			throw new ExtractionException("Chat model call failed: " + e.getMessage(), e);
		}
		logger.debug("Entity extraction response:\n{}", content);
		return toResult(parse(content));
	}

	String systemPrompt() {
		StringBuilder prompt = new StringBuilder();
		prompt.append("You extract reconciliation entities from a data analyst's request.\n");
		prompt.append("Known tables (physical name: aliases):\n");
		for (TableNode table : kg.tables()) {
			prompt.append("- ").append(table.name());
			if (!table.aliases().isEmpty()) {
				prompt.append(": ").append(String.join(", ", table.aliases()));
			}
			prompt.append('\n');
		}
		prompt.append("""
				Reply with a single JSON object and nothing else:
				{
				  "archetype": one of MATCHED, UNMATCHED_SOURCE, UNMATCHED_TARGET, FILTERED, INACTIVE_COUNT, or null,
				  "source": {"mention": "<words used for the first table>", "confidence": 0.0-1.0},
				  "target": {"mention": "<words used for the second table>", "confidence": 0.0-1.0},
				  "additional": [{"mention": "...", "confidence": 0.0-1.0}],
				  "filters": [{"hint": "<column wording or 'status'>", "operator": "=", "value": "..."}],
				  "confidence": 0.0-1.0
				}
				Use the analyst's own wording for mentions. Never invent column names.
				""");
		return prompt.toString();
	}

	private RawExtraction parse(String content) {
		if (content == null || content.isBlank()) {
			throw new ExtractionException("Chat model returned an empty response");
		}
		String json = extractJson(content.trim())
				.orElseThrow(() -> new ExtractionException("No JSON object found in chat model response"));
		try {
			return mapper.readValue(json, RawExtraction.class);
		}
		catch (JsonProcessingException e) {
			throw new ExtractionException("Malformed extraction JSON: " + e.getOriginalMessage(), e);
		}
	}

	private static Optional<String> extractJson(String content) {
		Matcher matcher = JSON_BLOCK_PATTERN.matcher(content);
		if (matcher.find()) {
			return Optional.of(matcher.group(1));
		}
		int open = content.indexOf('{');
		int close = content.lastIndexOf('}');
		if (open >= 0 && close > open) {
			return Optional.of(content.substring(open, close + 1));
		}
		return Optional.empty();
	}

	private ExtractionResult toResult(RawExtraction raw) {
		List<ExtractedEntity> entities = new ArrayList<>();
		addEntity(entities, ExtractedEntity.Role.SOURCE, raw.source());
		addEntity(entities, ExtractedEntity.Role.TARGET, raw.target());
		if (raw.additional() != null) {
			raw.additional().forEach(entity -> addEntity(entities, ExtractedEntity.Role.ADDITIONAL, entity));
		}

		List<FilterMention> filters = new ArrayList<>();
		if (raw.filters() != null) {
			for (RawFilter filter : raw.filters()) {
				if (filter == null || filter.hint() == null || filter.hint().isBlank() || filter.value() == null) {
					continue;
				}
				FilterOperator operator = FilterOperator.parse(filter.operator()).orElse(FilterOperator.EQ);
				boolean semantic = FilterMention.STATUS_HINT.equalsIgnoreCase(filter.hint().trim());
				filters.add(new FilterMention(filter.hint().trim(), operator, filter.value(), semantic));
			}
		}

		return new ExtractionResult(entities, filters, parseArchetype(raw.archetype()),
				raw.confidence() != null ? raw.confidence() : 0.0);
	}

	private static void addEntity(List<ExtractedEntity> entities, ExtractedEntity.Role role, RawEntity entity) {
		if (entity != null && entity.mention() != null && !entity.mention().isBlank()) {
			entities.add(new ExtractedEntity(role, entity.mention().trim(),
					entity.confidence() != null ? entity.confidence() : 0.0));
		}
	}

	private static Archetype parseArchetype(String value) {
		if (value == null || value.isBlank() || "null".equalsIgnoreCase(value)) {
			return null;
		}
		try {
			return Archetype.valueOf(value.trim().toUpperCase(Locale.ROOT));
		}
		catch (IllegalArgumentException e) {
			logger.debug("Ignoring unknown archetype '{}' from chat model", value);
			return null;
		}
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	record RawExtraction(
			@JsonProperty("archetype") String archetype,
			@JsonProperty("source") RawEntity source,
			@JsonProperty("target") RawEntity target,
			@JsonProperty("additional") List<RawEntity> additional,
			@JsonProperty("filters") List<RawFilter> filters,
			@JsonProperty("confidence") Double confidence
	) {
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	record RawEntity(
			@JsonProperty("mention") String mention,
			@JsonProperty("confidence") Double confidence
	) {
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	record RawFilter(
			@JsonProperty("hint") String hint,
			@JsonProperty("operator") String operator,
			@JsonProperty("value") String value
	) {
	}
}
