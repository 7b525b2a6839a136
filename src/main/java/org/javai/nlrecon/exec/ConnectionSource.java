package org.javai.nlrecon.exec;

import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;

/**
 * Hands out a fresh connection per execution. Callers close what they receive.
 */
@FunctionalInterface
public interface ConnectionSource {

	Connection getConnection() throws SQLException;

	static ConnectionSource of(DataSource dataSource) {
		return dataSource::getConnection;
	}
}
