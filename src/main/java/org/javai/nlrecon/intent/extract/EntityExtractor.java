package org.javai.nlrecon.intent.extract;

/**
 * Optional semantic assistance for intent classification.
 *
 * <p>Implementations return candidate table mentions and filters with confidence. The
 * classifier treats the result as a second opinion: a failing or absent extractor never
 * prevents classification.</p>
 */
@FunctionalInterface
public interface EntityExtractor {

	/**
	 * @param text the definition text
	 * @return candidate entities and filters
	 * @throws ExtractionException when the extractor cannot produce a result
	 */
	ExtractionResult extract(String text);
}
