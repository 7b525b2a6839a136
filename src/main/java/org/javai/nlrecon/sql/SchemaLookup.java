package org.javai.nlrecon.sql;

import java.util.Optional;

/**
 * Supplies the schema a table lives in, if known.
 */
@FunctionalInterface
public interface SchemaLookup {

	SchemaLookup NONE = table -> Optional.empty();

	Optional<String> schemaOf(String table);
}
