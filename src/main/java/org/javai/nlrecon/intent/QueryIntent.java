package org.javai.nlrecon.intent;

import java.util.ArrayList;
import java.util.List;

/**
 * What a definition asks for, before any mention is resolved against the knowledge graph.
 *
 * @param rawText the definition as given
 * @param archetype query shape
 * @param sourceMention first table mention, or null
 * @param targetMention second table mention, or null
 * @param additionalMentions third and later table mentions
 * @param filterMentions filters and semantic hints
 * @param projections extra columns from other tables
 * @param extractionConfidence confidence of the classification
 * @param llmAssisted whether an entity extractor contributed to the result
 */
public record QueryIntent(
		String rawText,
		Archetype archetype,
		String sourceMention,
		String targetMention,
		List<String> additionalMentions,
		List<FilterMention> filterMentions,
		List<ProjectionMention> projections,
		double extractionConfidence,
		boolean llmAssisted
) {

	public QueryIntent {
		if (archetype == null) {
			throw new IllegalArgumentException("archetype must not be null");
		}
		if (Double.isNaN(extractionConfidence) || extractionConfidence < 0.0 || extractionConfidence > 1.0) {
			throw new IllegalArgumentException("extractionConfidence must be within [0, 1]");
		}
		rawText = rawText != null ? rawText : "";
		additionalMentions = additionalMentions != null ? List.copyOf(additionalMentions) : List.of();
		filterMentions = filterMentions != null ? List.copyOf(filterMentions) : List.of();
		projections = projections != null ? List.copyOf(projections) : List.of();
	}

	/**
	 * All table mentions in order: source, target, then the additional ones.
	 */
	public List<String> tableMentions() {
		List<String> mentions = new ArrayList<>();
		if (sourceMention != null) {
			mentions.add(sourceMention);
		}
		if (targetMention != null) {
			mentions.add(targetMention);
		}
		mentions.addAll(additionalMentions);
		return mentions;
	}
}
