package com.hostsentinel.monitor.store;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Unit of work run against a borrowed connection.
 *
 * @param <R> result type
 * @since 1.0.0
 */
@FunctionalInterface
public interface SqlFunction<R> {

    R apply(Connection connection) throws SQLException;
}
