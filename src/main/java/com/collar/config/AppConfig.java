package com.collar.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Неизменяемые настройки приложения, читаются один раз при старте.
 */
public final class AppConfig {

  public static final int DEFAULT_PORT = 8080;
  public static final int DEFAULT_POOL_SIZE = 10;
  public static final int DEFAULT_HISTORY_LIMIT = 100;

  private final String jdbcUrl;
  private final String dbUser;
  private final String dbPassword;
  private final boolean requireSsl;
  private final int poolSize;
  private final int serverPort;
  private final List<String> corsOrigins;
  private final int historyDefaultLimit;

  AppConfig(String jdbcUrl, String dbUser, String dbPassword, boolean requireSsl, int poolSize,
            int serverPort, List<String> corsOrigins, int historyDefaultLimit) {
    this.jdbcUrl = jdbcUrl;
    this.dbUser = dbUser;
    this.dbPassword = dbPassword;
    this.requireSsl = requireSsl;
    this.poolSize = poolSize;
    this.serverPort = serverPort;
    this.corsOrigins = Collections.unmodifiableList(new ArrayList<>(corsOrigins));
    this.historyDefaultLimit = historyDefaultLimit;
  }

  /**
   * Собирает конфигурацию из системных свойств, окружения и application.properties.
   *
   * @throws IllegalStateException если обязательный параметр отсутствует или некорректен.
   */
  public static AppConfig load() {
    DatabaseUrl url = DatabaseUrl.parse(Config.getRequiredProperty("db.url", "DATABASE_URL"));

    // учётные данные из строки подключения важнее db.user / db.password
    String user = url.getUser() != null ? url.getUser() : Config.getProperty("db.user", "DB_USER");
    String password = url.getPassword() != null
        ? url.getPassword()
        : Config.getProperty("db.password", "DB_PASSWORD");

    boolean requireSsl = "require".equalsIgnoreCase(Config.getProperty("db.sslmode", "PGSSLMODE"));
    int poolSize = Config.getIntProperty("db.pool.size", "DB_POOL_SIZE", DEFAULT_POOL_SIZE);
    int port = Config.getIntProperty("server.port", "PORT", DEFAULT_PORT);
    String cors = Config.getProperty("cors.origin", "CORS_ORIGIN");
    int historyLimit = Config.getIntProperty(
        "history.default-limit", "HISTORY_DEFAULT_LIMIT", DEFAULT_HISTORY_LIMIT);

    if (poolSize < 1) {
      throw new IllegalStateException("db.pool.size должен быть положительным: " + poolSize);
    }
    if (port < 0 || port > 65535) {
      throw new IllegalStateException("server.port вне диапазона: " + port);
    }

    return new AppConfig(url.getJdbcUrl(), user, password, requireSsl, poolSize, port,
        parseOrigins(cors), historyLimit);
  }

  /**
   * Разбирает список разрешённых CORS origin.
   * Пустое значение эквивалентно "*".
   */
  static List<String> parseOrigins(String value) {
    List<String> origins = new ArrayList<>();
    if (value == null || value.trim().equals("*")) {
      origins.add("*");
      return origins;
    }
    for (String part : value.split(",")) {
      String origin = part.trim();
      if (!origin.isEmpty()) {
        origins.add(origin);
      }
    }
    if (origins.isEmpty()) {
      origins.add("*");
    }
    return origins;
  }

  public String getJdbcUrl() {
    return jdbcUrl;
  }

  public String getDbUser() {
    return dbUser;
  }

  public String getDbPassword() {
    return dbPassword;
  }

  public boolean isRequireSsl() {
    return requireSsl;
  }

  public int getPoolSize() {
    return poolSize;
  }

  public int getServerPort() {
    return serverPort;
  }

  /** Разрешённые origin; единственный элемент "*" означает любой. */
  public List<String> getCorsOrigins() {
    return corsOrigins;
  }

  public int getHistoryDefaultLimit() {
    return historyDefaultLimit;
  }
}
