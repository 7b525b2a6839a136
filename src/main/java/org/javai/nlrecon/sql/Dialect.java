package org.javai.nlrecon.sql;

import java.util.Locale;
import java.util.Optional;

/**
 * Supported database families.
 */
public enum Dialect {
	SQL_SERVER(new SqlServerDialect()),
	MYSQL(new MySqlDialect()),
	POSTGRES(new PostgresDialect()),
	ORACLE(new OracleDialect());

	private final SqlDialect adapter;

	Dialect(SqlDialect adapter) {
		this.adapter = adapter;
	}

	public SqlDialect adapter() {
		return adapter;
	}

	/**
	 * Parses common spellings: {@code sqlserver}, {@code mssql}, {@code mysql},
	 * {@code postgres}, {@code postgresql}, {@code oracle}.
	 */
	public static Optional<Dialect> fromName(String name) {
		if (name == null) {
			return Optional.empty();
		}
		String normalized = name.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s_-]", "");
		return Optional.ofNullable(switch (normalized) {
			case "sqlserver", "mssql", "tsql" -> SQL_SERVER;
			case "mysql", "mariadb" -> MYSQL;
			case "postgres", "postgresql", "pg" -> POSTGRES;
			case "oracle" -> ORACLE;
			default -> null;
		});
	}
}
