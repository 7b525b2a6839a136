package org.javai.nlrecon.intent;

import java.util.Locale;
import java.util.Optional;

/**
 * Comparison operators a filter may use.
 */
public enum FilterOperator {
	EQ("="),
	NE("<>"),
	GT(">"),
	GE(">="),
	LT("<"),
	LE("<="),
	LIKE("LIKE");

	private final String sql;

	FilterOperator(String sql) {
		this.sql = sql;
	}

	public String sql() {
		return sql;
	}

	/**
	 * Maps a written operator ({@code =}, {@code !=}, {@code is not}, {@code equals}, ...) to
	 * an operator.
	 */
	public static Optional<FilterOperator> parse(String token) {
		if (token == null) {
			return Optional.empty();
		}
		String normalized = token.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
		return Optional.ofNullable(switch (normalized) {
			case "=", "==", "is", "equals", "eq" -> EQ;
			case "!=", "<>", "is not", "not equals", "ne" -> NE;
			case ">" -> GT;
			case ">=" -> GE;
			case "<" -> LT;
			case "<=" -> LE;
			case "like", "contains" -> LIKE;
			default -> null;
		});
	}
}
