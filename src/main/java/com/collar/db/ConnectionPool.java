package com.collar.db;

import com.collar.config.AppConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Пул соединений с PostgreSQL на базе HikariCP.
 * <p>
 * Создаётся один раз при старте, передаётся в сервисы явно и закрывается при остановке.
 * Единственный разделяемый между запросами ресурс.
 */
public class ConnectionPool implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(ConnectionPool.class);

  private final HikariDataSource dataSource;

  /**
   * Открывает пул по настройкам приложения.
   *
   * @throws RuntimeException если БД недоступна при инициализации пула.
   */
  public ConnectionPool(AppConfig config) {
    this(new HikariDataSource(toHikariConfig(config)));
    logger.info("✅ Пул соединений открыт: {} (max {})", config.getJdbcUrl(), config.getPoolSize());
  }

  ConnectionPool(HikariDataSource dataSource) {
    this.dataSource = dataSource;
  }

  static HikariConfig toHikariConfig(AppConfig config) {
    HikariConfig hikari = new HikariConfig();
    hikari.setPoolName("collar-pool");
    hikari.setJdbcUrl(config.getJdbcUrl());
    if (config.getDbUser() != null) {
      hikari.setUsername(config.getDbUser());
    }
    if (config.getDbPassword() != null) {
      hikari.setPassword(config.getDbPassword());
    }
    hikari.setMaximumPoolSize(config.getPoolSize());
    if (config.isRequireSsl()) {
      // TLS без проверки сертификата сервера
      hikari.addDataSourceProperty("ssl", "true");
      hikari.addDataSourceProperty("sslmode", "require");
      hikari.addDataSourceProperty("sslfactory", "org.postgresql.ssl.NonValidatingFactory");
    }
    return hikari;
  }

  private Connection getConnection() throws SQLException {
    return dataSource.getConnection();
  }

  /**
   * Выполняет работу на одном соединении в режиме autocommit.
   *
   * @throws StoreException при любой ошибке SQL.
   */
  public <T> T withConnection(SqlWork<T> work) {
    try (Connection conn = getConnection()) {
      return work.execute(conn);
    } catch (SQLException e) {
      throw new StoreException(e.getMessage(), e);
    }
  }

  /**
   * Выполняет работу в одной транзакции: commit при успехе, rollback при любом исключении.
   * Соединение возвращается в пул на любом пути выхода.
   *
   * @throws StoreException при ошибке SQL; исключения времени выполнения пробрасываются как есть.
   */
  public <T> T inTransaction(SqlWork<T> work) {
    try (Connection conn = getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        T result = work.execute(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        rollback(conn, e);
        throw e;
      } finally {
        restoreAutoCommit(conn, autoCommit);
      }
    } catch (SQLException e) {
      throw new StoreException(e.getMessage(), e);
    }
  }

  private static void rollback(Connection conn, Exception cause) {
    try {
      conn.rollback();
      logger.warn("↩️ Транзакция откачена: {}", cause.getMessage());
    } catch (SQLException rollbackError) {
      cause.addSuppressed(rollbackError);
      logger.error("❌ Не удалось откатить транзакцию", rollbackError);
    }
  }

  private static void restoreAutoCommit(Connection conn, boolean autoCommit) {
    try {
      conn.setAutoCommit(autoCommit);
    } catch (SQLException e) {
      // Hikari всё равно сбросит состояние соединения при возврате в пул
      logger.warn("Не удалось восстановить autoCommit: {}", e.getMessage());
    }
  }

  @Override
  public void close() {
    if (!dataSource.isClosed()) {
      dataSource.close();
      logger.info("Пул соединений закрыт");
    }
  }
}
