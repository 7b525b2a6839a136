package org.javai.nlrecon.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import org.javai.nlrecon.BatchStatistics;
import org.javai.nlrecon.DefinitionOutcome;
import org.javai.nlrecon.ReconciliationReport;
import org.javai.nlrecon.ResolvedMapping;
import org.javai.nlrecon.exec.ExecutionAttempt;
import org.javai.nlrecon.exec.ExecutionResult;
import org.javai.nlrecon.intent.FilterMention;
import org.javai.nlrecon.intent.QueryIntent;

/**
 * Writes a {@link ReconciliationReport} as JSON for whatever stores or displays it.
 *
 * <p>Timestamps are ISO-8601 strings. Sample rows are written as returned by the driver;
 * values Jackson cannot serialise are written as their string form.</p>
 */
public class ReconciliationReportWriter {

	private final ObjectMapper mapper;
	private final boolean prettyPrint;

	public ReconciliationReportWriter() {
		this(true);
	}

	public ReconciliationReportWriter(boolean prettyPrint) {
		this.mapper = new ObjectMapper()
				.registerModule(new JavaTimeModule())
				.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
		this.prettyPrint = prettyPrint;
	}

	public String toJson(ReconciliationReport report) {
		ObjectNode json = reportToJson(report);
		try {
			return prettyPrint
					? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(json)
					: mapper.writeValueAsString(json);
		}
		catch (JsonProcessingException e) {
			throw new UncheckedIOException("Failed to write reconciliation report", e);
		}
	}

	public void write(ReconciliationReport report, Path target) {
		try {
			Files.writeString(target, toJson(report), StandardCharsets.UTF_8);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to write reconciliation report to " + target, e);
		}
	}

	ObjectNode reportToJson(ReconciliationReport report) {
		ObjectNode json = mapper.createObjectNode();
		json.put("kgName", report.kgName());
		json.put("dialect", report.dialect() != null ? report.dialect().name() : null);
		putInstant(json, "startedAt", report.startedAt());
		putInstant(json, "finishedAt", report.finishedAt());
		json.set("statistics", statisticsToJson(report.statistics()));

		ArrayNode outcomes = json.putArray("outcomes");
		for (DefinitionOutcome outcome : report.outcomes()) {
			outcomes.add(outcomeToJson(outcome));
		}
		return json;
	}

	private ObjectNode statisticsToJson(BatchStatistics statistics) {
		ObjectNode json = mapper.createObjectNode();
		json.put("total", statistics.total());
		json.put("successful", statistics.successful());
		json.put("failed", statistics.failed());
		json.put("timedOut", statistics.timedOut());
		json.put("totalRecords", statistics.totalRecords());
		json.put("averageConfidence", statistics.averageConfidence());
		return json;
	}

	private ObjectNode outcomeToJson(DefinitionOutcome outcome) {
		ObjectNode json = mapper.createObjectNode();
		json.put("definition", outcome.definition());
		if (outcome.intent() != null) {
			json.set("intent", intentToJson(outcome.intent()));
		}
		if (outcome.mapping() != null) {
			json.set("mapping", mappingToJson(outcome.mapping()));
		}
		json.put("sql", outcome.sql());
		json.set("result", resultToJson(outcome.result()));
		return json;
	}

	private ObjectNode intentToJson(QueryIntent intent) {
		ObjectNode json = mapper.createObjectNode();
		json.put("archetype", intent.archetype().name());
		json.put("sourceMention", intent.sourceMention());
		json.put("targetMention", intent.targetMention());
		ArrayNode additional = json.putArray("additionalMentions");
		intent.additionalMentions().forEach(additional::add);
		ArrayNode filters = json.putArray("filters");
		for (FilterMention filter : intent.filterMentions()) {
			ObjectNode f = filters.addObject();
			f.put("columnHint", filter.columnHint());
			f.put("operator", filter.operator().sql());
			f.put("value", filter.value());
			f.put("semantic", filter.semantic());
		}
		json.put("confidence", intent.extractionConfidence());
		json.put("llmAssisted", intent.llmAssisted());
		return json;
	}

	private ObjectNode mappingToJson(ResolvedMapping mapping) {
		ObjectNode json = mapper.createObjectNode();
		json.put("sourceTable", mapping.sourceTable());
		json.put("targetTable", mapping.targetTable());
		ArrayNode joins = json.putArray("joinColumns");
		for (ResolvedMapping.ColumnPair pair : mapping.joinColumns()) {
			ObjectNode j = joins.addObject();
			j.put("leftTable", pair.leftTable());
			j.put("leftColumn", pair.leftColumn());
			j.put("rightTable", pair.rightTable());
			j.put("rightColumn", pair.rightColumn());
		}
		ArrayNode additional = json.putArray("additionalTables");
		mapping.additionalTables().forEach(additional::add);
		return json;
	}

	private ObjectNode resultToJson(ExecutionResult result) {
		ObjectNode json = mapper.createObjectNode();
		json.put("status", result.status().name());
		json.put("recordCount", result.recordCount());
		json.put("confidence", result.confidence());
		json.put("errorType", result.errorType() != null ? result.errorType().name() : null);
		json.put("errorMessage", result.errorMessage());

		ArrayNode attempts = json.putArray("attempts");
		for (ExecutionAttempt attempt : result.attempts()) {
			ObjectNode a = attempts.addObject();
			a.put("kind", attempt.kind().name());
			a.put("sql", attempt.sqlText());
			putInstant(a, "startedAt", attempt.startedAt());
			a.put("outcome", attempt.outcome().name());
			a.put("durationMillis", attempt.durationMillis());
			a.put("errorDetails", attempt.errorDetails());
		}

		ArrayNode rows = json.putArray("sampleRecords");
		for (Map<String, Object> row : result.sampleRecords()) {
			ObjectNode r = rows.addObject();
			row.forEach((column, value) -> r.set(column, valueToJson(value)));
		}
		return json;
	}

	private JsonNode valueToJson(Object value) {
		try {
			return mapper.valueToTree(value);
		}
		catch (IllegalArgumentException e) {
			return mapper.getNodeFactory().textNode(String.valueOf(value));
		}
	}

	private static void putInstant(ObjectNode json, String field, Instant instant) {
		json.put(field, instant != null ? instant.toString() : null);
	}
}
