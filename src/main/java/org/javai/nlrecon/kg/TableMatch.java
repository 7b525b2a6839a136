package org.javai.nlrecon.kg;

/**
 * A table candidate for a mention.
 */
public record TableMatch(TableNode table, MatchStrategy strategy, double confidence) {

	public String tableName() {
		return table.name();
	}
}
