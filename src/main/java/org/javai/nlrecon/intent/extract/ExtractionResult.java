package org.javai.nlrecon.intent.extract;

import java.util.List;
import java.util.Optional;
import org.javai.nlrecon.intent.Archetype;
import org.javai.nlrecon.intent.FilterMention;

/**
 * Output of an {@link EntityExtractor}.
 *
 * @param entities proposed table mentions by slot
 * @param filters proposed filters; column wording is resolved later like any other hint
 * @param archetype proposed archetype, or null when the extractor did not classify
 * @param confidence overall confidence of the extraction
 */
public record ExtractionResult(
		List<ExtractedEntity> entities,
		List<FilterMention> filters,
		Archetype archetype,
		double confidence
) {

	public ExtractionResult {
		entities = entities != null ? List.copyOf(entities) : List.of();
		filters = filters != null ? List.copyOf(filters) : List.of();
		confidence = ExtractedEntity.clamp(confidence);
	}

	public static ExtractionResult empty() {
		return new ExtractionResult(List.of(), List.of(), null, 0.0);
	}

	/**
	 * Highest-confidence entity proposed for the role.
	 */
	public Optional<ExtractedEntity> best(ExtractedEntity.Role role) {
		ExtractedEntity best = null;
		for (ExtractedEntity entity : entities) {
			if (entity.role() == role && (best == null || entity.confidence() > best.confidence())) {
				best = entity;
			}
		}
		return Optional.ofNullable(best);
	}

	public List<ExtractedEntity> all(ExtractedEntity.Role role) {
		return entities.stream().filter(e -> e.role() == role).toList();
	}
}
