package org.javai.nlrecon.kg;

import java.util.Locale;
import java.util.Map;

/**
 * Inverse relationship types, used when an edge is read from target to source.
 */
final class RelationshipTypes {

	private static final Map<String, String> INVERSES = Map.of(
			"REFERENCES", "REFERENCED_BY",
			"REFERENCED_BY", "REFERENCES",
			"FOREIGN_KEY", "FOREIGN_KEY_TARGET",
			"FOREIGN_KEY_TARGET", "FOREIGN_KEY",
			"CONTAINS", "CONTAINED_BY",
			"CONTAINED_BY", "CONTAINS",
			"MATCHES", "MATCHES",
			"BELONGS_TO", "HAS",
			"HAS", "BELONGS_TO"
	);

	private RelationshipTypes() {
	}

	static String inverse(String type) {
		if (type == null) {
			return RelationshipEdge.DEFAULT_TYPE;
		}
		return INVERSES.getOrDefault(type.toUpperCase(Locale.ROOT), type);
	}
}
