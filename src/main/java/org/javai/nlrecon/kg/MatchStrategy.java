package org.javai.nlrecon.kg;

/**
 * How a business-language mention was matched to a physical name.
 */
public enum MatchStrategy {
	/** Case-insensitive equality with the physical name. */
	EXACT,
	/** Case-insensitive equality with a registered alias. */
	ALIAS,
	/** Equality after stripping punctuation, underscores and case. */
	PATTERN,
	/** Token-set similarity above the configured threshold. */
	FUZZY
}
