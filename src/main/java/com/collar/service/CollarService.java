package com.collar.service;

import com.collar.model.Metric;
import com.collar.model.MetricInput;
import com.collar.model.Reading;
import com.collar.model.ReadingInput;
import com.collar.model.ReadingWithMetric;

import java.util.List;
import java.util.Optional;

/**
 * Сервис приёма и выдачи данных ошейников.
 * <p>
 * Все методы бросают {@link com.collar.db.StoreException} при ошибке БД;
 * частично записанных данных после такой ошибки не остаётся.
 */
public interface CollarService {

  /**
   * Записывает показание и, если передано хотя бы одно поле метрики, связанную метрику.
   * Обе вставки выполняются в одной транзакции.
   *
   * @param reading Поля показания.
   * @param metric Поля метрики; пустая метрика не пишется.
   * @return Сохранённое показание и метрика ({@code null}, если не записывалась).
   */
  ReadingWithMetric ingest(ReadingInput reading, MetricInput metric);

  /**
   * Записывает только показание.
   */
  Reading saveReading(ReadingInput reading);

  /**
   * Записывает метрику для ошейника без поиска показания.
   *
   * @throws IllegalArgumentException если у метрики нет ни одного поля.
   */
  Metric recordMetric(String collarId, MetricInput metric);

  /**
   * Последняя метрика ошейника вместе с последним показанием.
   *
   * @return Пусто, если для ошейника нет ни одной метрики. Отсутствие показания ошибкой не считается.
   */
  Optional<ReadingWithMetric> findLatest(String collarId);

  /**
   * Страница истории ошейника, новые показания первыми.
   */
  List<ReadingWithMetric> findHistory(String collarId, PageRequest page);

  /**
   * Проверяет доступность БД.
   */
  void checkStore();
}
