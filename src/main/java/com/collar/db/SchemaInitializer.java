package com.collar.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Statement;

/**
 * Создаёт таблицы input_readings и output_metrics, если их ещё нет.
 * <p>
 * Безопасно вызывается при каждом старте. Ошибка здесь фатальна: сервер не должен
 * начинать приём запросов без схемы.
 */
public class SchemaInitializer {

  private static final Logger logger = LoggerFactory.getLogger(SchemaInitializer.class);

  static final String CREATE_READINGS_TABLE = """
      CREATE TABLE IF NOT EXISTS input_readings (
          id BIGSERIAL PRIMARY KEY,
          collar_id TEXT,
          dog_name TEXT NOT NULL,
          breed TEXT,
          coat_type TEXT,
          height NUMERIC,
          weight NUMERIC,
          sex TEXT,
          temperature_irgun NUMERIC,
          collar_orientation TEXT,
          created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
      )
      """;

  // collar_id без внешнего ключа: метрика может прийти раньше показания
  static final String CREATE_METRICS_TABLE = """
      CREATE TABLE IF NOT EXISTS output_metrics (
          id BIGSERIAL PRIMARY KEY,
          collar_id TEXT,
          reading_id BIGINT,
          temperature NUMERIC,
          stepcount BIGINT,
          caloriecount NUMERIC,
          accel_x NUMERIC,
          accel_y NUMERIC,
          accel_z NUMERIC,
          gyro_x NUMERIC,
          gyro_y NUMERIC,
          gyro_z NUMERIC,
          npl_time TIMESTAMPTZ,
          created_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
      )
      """;

  // таблицы, созданные до появления reading_id
  static final String ADD_METRICS_READING_COLUMN =
      "ALTER TABLE output_metrics ADD COLUMN IF NOT EXISTS reading_id BIGINT";

  static final String CREATE_READINGS_INDEX =
      "CREATE INDEX IF NOT EXISTS idx_input_readings_collar ON input_readings (collar_id, created_at DESC)";

  static final String CREATE_METRICS_INDEX =
      "CREATE INDEX IF NOT EXISTS idx_output_metrics_collar ON output_metrics (collar_id, created_at DESC)";

  private final ConnectionPool pool;

  public SchemaInitializer(ConnectionPool pool) {
    this.pool = pool;
  }

  /**
   * Создаёт обе таблицы и индексы по collar_id.
   *
   * @throws StoreException если БД недоступна или DDL не выполнился.
   */
  public void initialize() {
    pool.withConnection(conn -> {
      try (Statement stmt = conn.createStatement()) {
        stmt.execute(CREATE_READINGS_TABLE);
        stmt.execute(CREATE_METRICS_TABLE);
        stmt.execute(ADD_METRICS_READING_COLUMN);
        stmt.execute(CREATE_READINGS_INDEX);
        stmt.execute(CREATE_METRICS_INDEX);
      }
      return null;
    });
    logger.info("✅ Таблицы 'input_readings' и 'output_metrics' созданы или уже существуют.");
  }
}
