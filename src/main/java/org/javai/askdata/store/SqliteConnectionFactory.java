package org.javai.askdata.store;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import org.sqlite.SQLiteConfig;

/**
 * Opens a SQLite database file in the engine's read-only mode.
 *
 * <p>The database must already exist: opening read-only never creates a file, so a
 * wrong path fails fast instead of silently producing an empty store.</p>
 */
public final class SqliteConnectionFactory implements ReadOnlyConnectionFactory {

	private static final int BUSY_TIMEOUT_MILLIS = 5_000;

	private final Path databasePath;

	public SqliteConnectionFactory(Path databasePath) {
		this.databasePath = Objects.requireNonNull(databasePath, "databasePath must not be null");
	}

	public Path databasePath() {
		return databasePath;
	}

	@Override
	public Connection open() throws SQLException {
		SQLiteConfig config = new SQLiteConfig();
		config.setReadOnly(true);
		config.setBusyTimeout(BUSY_TIMEOUT_MILLIS);
		return DriverManager.getConnection(jdbcUrl(), config.toProperties());
	}

	String jdbcUrl() {
		return "jdbc:sqlite:" + databasePath.toAbsolutePath();
	}

	@Override
	public String toString() {
		return "SqliteConnectionFactory[" + databasePath + "]";
	}
}
