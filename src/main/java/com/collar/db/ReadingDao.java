package com.collar.db;

import com.collar.model.Reading;
import com.collar.model.ReadingInput;
import com.collar.model.ReadingWithMetric;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * DAO-класс для операций с таблицей input_readings.
 * <p>
 * Методы работают на переданном соединении: транзакциями управляет вызывающий.
 */
public class ReadingDao {

  private static final String INSERT_SQL = """
      INSERT INTO input_readings
        (collar_id, dog_name, breed, coat_type, height, weight, sex, temperature_irgun, collar_orientation)
      VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
      RETURNING id, created_at
      """;

  private static final String SELECT_LATEST_SQL = """
      SELECT id, collar_id, dog_name, breed, coat_type, height, weight, sex,
             temperature_irgun, collar_orientation, created_at
      FROM input_readings
      WHERE collar_id = ?
      ORDER BY created_at DESC, id DESC
      LIMIT 1
      """;

  private static final String SELECT_HISTORY_SQL = """
      SELECT r.id AS r_id, r.collar_id AS r_collar_id, r.dog_name AS r_dog_name, r.breed AS r_breed,
             r.coat_type AS r_coat_type, r.height AS r_height, r.weight AS r_weight, r.sex AS r_sex,
             r.temperature_irgun AS r_temperature_irgun, r.collar_orientation AS r_collar_orientation,
             r.created_at AS r_created_at,
             m.id AS m_id, m.collar_id AS m_collar_id, m.reading_id AS m_reading_id,
             m.temperature AS m_temperature,
             m.stepcount AS m_stepcount, m.caloriecount AS m_caloriecount,
             m.accel_x AS m_accel_x, m.accel_y AS m_accel_y, m.accel_z AS m_accel_z,
             m.gyro_x AS m_gyro_x, m.gyro_y AS m_gyro_y, m.gyro_z AS m_gyro_z,
             m.npl_time AS m_npl_time, m.created_at AS m_created_at
      FROM input_readings r
      LEFT JOIN output_metrics m ON m.collar_id = r.collar_id
      WHERE r.collar_id = ?
      ORDER BY r.created_at DESC, m.created_at DESC NULLS LAST, r.id DESC, m.id DESC
      LIMIT ? OFFSET ?
      """;

  /**
   * Вставляет показание.
   *
   * @param conn Соединение (обычно внутри транзакции).
   * @param input Поля показания после приведения типов.
   * @return Сохранённая строка с id и created_at, выданными БД.
   */
  public Reading insert(Connection conn, ReadingInput input) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
      JdbcSupport.setText(ps, 1, input.getCollarId());
      ps.setString(2, input.getDogName());
      JdbcSupport.setText(ps, 3, input.getBreed());
      JdbcSupport.setText(ps, 4, input.getCoatType());
      JdbcSupport.setDecimal(ps, 5, input.getHeight());
      JdbcSupport.setDecimal(ps, 6, input.getWeight());
      JdbcSupport.setText(ps, 7, input.getSex());
      JdbcSupport.setDecimal(ps, 8, input.getTemperatureIrgun());
      JdbcSupport.setText(ps, 9, input.getCollarOrientation());
      try (ResultSet rs = ps.executeQuery()) {
        if (!rs.next()) {
          throw new SQLException("INSERT INTO input_readings не вернул строку");
        }
        return new Reading(
            rs.getLong("id"),
            input.getCollarId(),
            input.getDogName(),
            input.getBreed(),
            input.getCoatType(),
            input.getHeight(),
            input.getWeight(),
            input.getSex(),
            input.getTemperatureIrgun(),
            input.getCollarOrientation(),
            JdbcSupport.getTimestamp(rs, "created_at"));
      }
    }
  }

  /**
   * Последнее по времени создания показание для ошейника.
   */
  public Optional<Reading> findLatestByCollarId(Connection conn, String collarId) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(SELECT_LATEST_SQL)) {
      ps.setString(1, collarId);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(map(rs, "")) : Optional.empty();
      }
    }
  }

  /**
   * Страница истории: показания ошейника, соединённые с его метриками.
   * Показание без метрик попадает в выборку с {@code output = null}.
   */
  public List<ReadingWithMetric> findHistory(Connection conn, String collarId, int limit, long offset)
      throws SQLException {
    List<ReadingWithMetric> rows = new ArrayList<>();
    try (PreparedStatement ps = conn.prepareStatement(SELECT_HISTORY_SQL)) {
      ps.setString(1, collarId);
      ps.setInt(2, limit);
      ps.setLong(3, offset);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          rows.add(new ReadingWithMetric(map(rs, "r_"), MetricDao.mapNullable(rs, "m_")));
        }
      }
    }
    return rows;
  }

  static Reading map(ResultSet rs, String prefix) throws SQLException {
    return new Reading(
        rs.getLong(prefix + "id"),
        rs.getString(prefix + "collar_id"),
        rs.getString(prefix + "dog_name"),
        rs.getString(prefix + "breed"),
        rs.getString(prefix + "coat_type"),
        JdbcSupport.getDecimal(rs, prefix + "height"),
        JdbcSupport.getDecimal(rs, prefix + "weight"),
        rs.getString(prefix + "sex"),
        JdbcSupport.getDecimal(rs, prefix + "temperature_irgun"),
        rs.getString(prefix + "collar_orientation"),
        JdbcSupport.getTimestamp(rs, prefix + "created_at"));
  }
}
