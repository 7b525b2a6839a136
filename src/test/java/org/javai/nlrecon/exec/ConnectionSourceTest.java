package org.javai.nlrecon.exec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConnectionSource")
class ConnectionSourceTest {

	@Test
	@DisplayName("asks the data source for a new connection each time")
	void dataSource() throws SQLException {
		DataSource dataSource = mock(DataSource.class);
		Connection first = mock(Connection.class);
		Connection second = mock(Connection.class);
		when(dataSource.getConnection()).thenReturn(first, second);

		ConnectionSource source = ConnectionSource.of(dataSource);

		assertThat(source.getConnection()).isSameAs(first);
		assertThat(source.getConnection()).isSameAs(second);
		verify(dataSource, times(2)).getConnection();
	}

	@Test
	@DisplayName("propagates data source failures")
	void failure() throws SQLException {
		DataSource dataSource = mock(DataSource.class);
		when(dataSource.getConnection()).thenThrow(new SQLException("pool exhausted"));

		assertThatThrownBy(() -> ConnectionSource.of(dataSource).getConnection())
				.isInstanceOf(SQLException.class)
				.hasMessage("pool exhausted");
	}
}
