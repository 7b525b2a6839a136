package org.javai.nlrecon.intent;

/**
 * A table mention located in the definition text.
 *
 * @param text the mention as written
 * @param start offset of the first character
 * @param end offset after the last character
 * @param confidence how likely the span names a table
 * @param source how the span was found
 */
public record Mention(String text, int start, int end, double confidence, Source source) {

	public enum Source {
		KNOWN_TERM,
		QUOTED,
		CAPITALIZED,
		EXTRACTOR
	}

	boolean overlaps(int otherStart, int otherEnd) {
		return start < otherEnd && otherStart < end;
	}
}
