package com.collar.db;

import com.collar.model.Metric;
import com.collar.model.MetricInput;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * DAO-класс для операций с таблицей output_metrics.
 */
public class MetricDao {

  private static final String INSERT_SQL = """
      INSERT INTO output_metrics
        (collar_id, reading_id, temperature, stepcount, caloriecount,
         accel_x, accel_y, accel_z, gyro_x, gyro_y, gyro_z, npl_time)
      VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
      RETURNING id, created_at
      """;

  // время наблюдения от устройства важнее времени записи
  private static final String SELECT_LATEST_SQL = """
      SELECT id, collar_id, reading_id, temperature, stepcount, caloriecount,
             accel_x, accel_y, accel_z, gyro_x, gyro_y, gyro_z, npl_time, created_at
      FROM output_metrics
      WHERE collar_id = ?
      ORDER BY COALESCE(npl_time, created_at) DESC, id DESC
      LIMIT 1
      """;

  /**
   * Вставляет метрику для ошейника.
   *
   * @param conn Соединение (при комбинированной записи — та же транзакция, что и для показания).
   * @param collarId Идентификатор ошейника, может быть {@code null}.
   * @param readingId Показание из той же записи /ingest или {@code null}.
   * @param input Поля метрики.
   * @return Сохранённая строка с id и created_at, выданными БД.
   */
  public Metric insert(Connection conn, String collarId, Long readingId, MetricInput input) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
      JdbcSupport.setText(ps, 1, collarId);
      JdbcSupport.setLong(ps, 2, readingId);
      JdbcSupport.setDecimal(ps, 3, input.getTemperature());
      JdbcSupport.setLong(ps, 4, input.getStepcount());
      JdbcSupport.setDecimal(ps, 5, input.getCaloriecount());
      JdbcSupport.setDecimal(ps, 6, input.getAccelX());
      JdbcSupport.setDecimal(ps, 7, input.getAccelY());
      JdbcSupport.setDecimal(ps, 8, input.getAccelZ());
      JdbcSupport.setDecimal(ps, 9, input.getGyroX());
      JdbcSupport.setDecimal(ps, 10, input.getGyroY());
      JdbcSupport.setDecimal(ps, 11, input.getGyroZ());
      JdbcSupport.setTimestamp(ps, 12, input.getNplTime());
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) {
          throw new SQLException("INSERT INTO output_metrics не вернул строку");
        }
        return new Metric(
            rs.getLong("id"),
            collarId,
            readingId,
            input.getTemperature(),
            input.getStepcount(),
            input.getCaloriecount(),
            input.getAccelX(),
            input.getAccelY(),
            input.getAccelZ(),
            input.getGyroX(),
            input.getGyroY(),
            input.getGyroZ(),
            input.getNplTime(),
            JdbcSupport.getTimestamp(rs, "created_at"));
      }
    }
  }

  /**
   * Последняя метрика ошейника: по npl_time, а если его нет — по created_at.
   */
  public Optional<Metric> findLatestByCollarId(Connection conn, String collarId) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(SELECT_LATEST_SQL)) {
      ps.setString(1, collarId);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(map(rs, "")) : Optional.empty();
      }
    }
  }

  /** Метрика из LEFT JOIN; {@code null}, если совпадения не было. */
  static Metric mapNullable(ResultSet rs, String prefix) throws SQLException {
    rs.getLong(prefix + "id");
    return rs.wasNull() ? null : map(rs, prefix);
  }

  static Metric map(ResultSet rs, String prefix) throws SQLException {
    return new Metric(
        rs.getLong(prefix + "id"),
        rs.getString(prefix + "collar_id"),
        JdbcSupport.getLong(rs, prefix + "reading_id"),
        JdbcSupport.getDecimal(rs, prefix + "temperature"),
        JdbcSupport.getLong(rs, prefix + "stepcount"),
        JdbcSupport.getDecimal(rs, prefix + "caloriecount"),
        JdbcSupport.getDecimal(rs, prefix + "accel_x"),
        JdbcSupport.getDecimal(rs, prefix + "accel_y"),
        JdbcSupport.getDecimal(rs, prefix + "accel_z"),
        JdbcSupport.getDecimal(rs, prefix + "gyro_x"),
        JdbcSupport.getDecimal(rs, prefix + "gyro_y"),
        JdbcSupport.getDecimal(rs, prefix + "gyro_z"),
        JdbcSupport.getTimestamp(rs, prefix + "npl_time"),
        JdbcSupport.getTimestamp(rs, prefix + "created_at"));
  }
}
