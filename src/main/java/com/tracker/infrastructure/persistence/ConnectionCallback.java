package com.tracker.infrastructure.persistence;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Work performed against the managed connection.
 */
@FunctionalInterface
public interface ConnectionCallback<T> {

    T doInConnection(Connection connection) throws SQLException;
}
