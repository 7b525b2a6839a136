package org.javai.nlrecon.kg;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A physical table in the knowledge graph.
 *
 * <p>The physical name is the unique key. Aliases compare case-insensitively and may be
 * appended after creation while the owning graph is still open for ingestion.</p>
 */
public final class TableNode {

	private final String name;
	private final String schema;
	private final List<String> aliases = new ArrayList<>();
	private final List<String> columns;

	TableNode(String name, String schema, Collection<String> aliases, List<String> columns) {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("table name must not be blank");
		}
		this.name = name;
		this.schema = (schema == null || schema.isBlank()) ? null : schema;
		this.columns = columns != null ? List.copyOf(columns) : List.of();
		if (aliases != null) {
			aliases.forEach(this::addAlias);
		}
	}

	public String name() {
		return name;
	}

	/**
	 * The owning schema, if the graph records one.
	 */
	public Optional<String> schema() {
		return Optional.ofNullable(schema);
	}

	public List<String> aliases() {
		return Collections.unmodifiableList(aliases);
	}

	public List<String> columns() {
		return columns;
	}

	public boolean hasColumn(String column) {
		return findColumn(column).isPresent();
	}

	/**
	 * Returns the declared spelling of a column, compared case-insensitively.
	 */
	public Optional<String> findColumn(String column) {
		if (column == null) {
			return Optional.empty();
		}
		return columns.stream().filter(c -> c.equalsIgnoreCase(column)).findFirst();
	}

	public boolean matchesName(String candidate) {
		if (candidate == null) {
			return false;
		}
		if (name.equalsIgnoreCase(candidate)) {
			return true;
		}
		return aliases.stream().anyMatch(alias -> alias.equalsIgnoreCase(candidate));
	}

	/**
	 * Qualified name for display, e.g. {@code dbo.brz_lnd_RBP_GPU}.
	 */
	public String qualifiedName() {
		return schema != null ? schema + "." + name : name;
	}

	boolean addAlias(String alias) {
		if (alias == null || alias.isBlank()) {
			return false;
		}
		String trimmed = alias.trim();
		String key = trimmed.toLowerCase(Locale.ROOT);
		boolean known = name.toLowerCase(Locale.ROOT).equals(key)
				|| aliases.stream().anyMatch(existing -> existing.toLowerCase(Locale.ROOT).equals(key));
		if (known) {
			return false;
		}
		aliases.add(trimmed);
		return true;
	}

	@Override
	public String toString() {
		return "TableNode[" + qualifiedName() + ", aliases=" + aliases + ", columns=" + columns + "]";
	}
}
