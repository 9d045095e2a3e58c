package org.javai.askdata.store;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens JDBC connections that the database engine itself keeps read-only.
 *
 * <p>This is the layer beneath the validator: even a statement that slipped past text
 * validation cannot modify the store through a connection obtained here. Every call
 * returns a fresh connection owned by the caller.</p>
 */
@FunctionalInterface
public interface ReadOnlyConnectionFactory {

	Connection open() throws SQLException;
}
