package com.collar.service;

import com.collar.db.ConnectionPool;
import com.collar.db.MetricDao;
import com.collar.db.ReadingDao;
import com.collar.model.Metric;
import com.collar.model.MetricInput;
import com.collar.model.Reading;
import com.collar.model.ReadingInput;
import com.collar.model.ReadingWithMetric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Реализация сервиса данных ошейников поверх пула соединений и DAO.
 */
public class CollarServiceImpl implements CollarService {

  private static final Logger logger = LoggerFactory.getLogger(CollarServiceImpl.class);

  private final ConnectionPool pool;
  private final ReadingDao readingDao;
  private final MetricDao metricDao;

  /**
   * Конструктор сервиса.
   *
   * @param pool Пул соединений с БД.
   * @param readingDao DAO для input_readings.
   * @param metricDao DAO для output_metrics.
   */
  public CollarServiceImpl(ConnectionPool pool, ReadingDao readingDao, MetricDao metricDao) {
    this.pool = pool;
    this.readingDao = readingDao;
    this.metricDao = metricDao;
  }

  @Override
  public ReadingWithMetric ingest(ReadingInput reading, MetricInput metric) {
    ReadingWithMetric result = pool.inTransaction(conn -> {
      Reading saved = readingDao.insert(conn, reading);
      Metric savedMetric = metric.hasAnyValue()
          ? metricDao.insert(conn, reading.getCollarId(), saved.getId(), metric)
          : null;
      return new ReadingWithMetric(saved, savedMetric);
    });
    logger.info("✅ Показание {} для '{}' (ошейник {}) сохранено, метрика: {}",
        result.getInput().getId(), reading.getDogName(), reading.getCollarId(),
        result.getOutput() == null ? "нет" : result.getOutput().getId());
    return result;
  }

  @Override
  public Reading saveReading(ReadingInput reading) {
    Reading saved = pool.inTransaction(conn -> readingDao.insert(conn, reading));
    logger.info("✅ Показание {} для '{}' (ошейник {}) сохранено",
        saved.getId(), reading.getDogName(), reading.getCollarId());
    return saved;
  }

  @Override
  public Metric recordMetric(String collarId, MetricInput metric) {
    if (!metric.hasAnyValue()) {
      throw new IllegalArgumentException("Metric has no fields to insert");
    }
    Metric saved = pool.withConnection(conn -> metricDao.insert(conn, collarId, null, metric));
    logger.info("✅ Метрика {} для ошейника {} сохранена", saved.getId(), collarId);
    return saved;
  }

  @Override
  public Optional<ReadingWithMetric> findLatest(String collarId) {
    return pool.withConnection(conn -> {
      Optional<Metric> metric = metricDao.findLatestByCollarId(conn, collarId);
      if (metric.isEmpty()) {
        return Optional.empty();
      }
      Reading reading = readingDao.findLatestByCollarId(conn, collarId).orElse(null);
      return Optional.of(new ReadingWithMetric(reading, metric.get()));
    });
  }

  @Override
  public List<ReadingWithMetric> findHistory(String collarId, PageRequest page) {
    return pool.withConnection(
        conn -> readingDao.findHistory(conn, collarId, page.getLimit(), page.getOffset()));
  }

  @Override
  public void checkStore() {
    pool.withConnection(conn -> {
      try (var stmt = conn.createStatement()) {
        stmt.execute("SELECT 1");
      }
      return null;
    });
  }
}
