package org.javai.nlrecon.join;

public enum JoinType {
	INNER("INNER JOIN"),
	LEFT("LEFT JOIN"),
	RIGHT("RIGHT JOIN"),
	FULL("FULL OUTER JOIN");

	private final String keyword;

	JoinType(String keyword) {
		this.keyword = keyword;
	}

	public String keyword() {
		return keyword;
	}
}
