package com.collar.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Работа с БД на выданном пулом соединении.
 *
 * @param <T> Тип результата.
 */
@FunctionalInterface
public interface SqlWork<T> {

  T execute(Connection connection) throws SQLException;
}
