package com.collar.model;

import java.time.OffsetDateTime;

/**
 * Строка таблицы output_metrics: производные показатели и сырые данные IMU.
 * <p>
 * Связана с показаниями через collar_id, а при комбинированной записи ещё и через reading_id.
 * Ссылочная целостность не проверяется.
 */
public final class Metric {

  private final long id;
  private final String collarId;
  private final Long readingId;
  private final Double temperature;
  private final Long stepcount;
  private final Double caloriecount;
  private final Double accelX;
  private final Double accelY;
  private final Double accelZ;
  private final Double gyroX;
  private final Double gyroY;
  private final Double gyroZ;
  private final OffsetDateTime nplTime;
  private final OffsetDateTime createdAt;

  public Metric(long id, String collarId, Long readingId, Double temperature, Long stepcount, Double caloriecount,
                Double accelX, Double accelY, Double accelZ,
                Double gyroX, Double gyroY, Double gyroZ,
                OffsetDateTime nplTime, OffsetDateTime createdAt) {
    this.id = id;
    this.collarId = collarId;
    this.readingId = readingId;
    this.temperature = temperature;
    this.stepcount = stepcount;
    this.caloriecount = caloriecount;
    this.accelX = accelX;
    this.accelY = accelY;
    this.accelZ = accelZ;
    this.gyroX = gyroX;
    this.gyroY = gyroY;
    this.gyroZ = gyroZ;
    this.nplTime = nplTime;
    this.createdAt = createdAt;
  }

  public long getId() {
    return id;
  }

  public String getCollarId() {
    return collarId;
  }

  /** Показание, записанное вместе с метрикой через /ingest; иначе {@code null}. */
  public Long getReadingId() {
    return readingId;
  }

  public Double getTemperature() {
    return temperature;
  }

  public Long getStepcount() {
    return stepcount;
  }

  public Double getCaloriecount() {
    return caloriecount;
  }

  public Double getAccelX() {
    return accelX;
  }

  public Double getAccelY() {
    return accelY;
  }

  public Double getAccelZ() {
    return accelZ;
  }

  public Double getGyroX() {
    return gyroX;
  }

  public Double getGyroY() {
    return gyroY;
  }

  public Double getGyroZ() {
    return gyroZ;
  }

  /** Время наблюдения, переданное устройством; может быть {@code null}. */
  public OffsetDateTime getNplTime() {
    return nplTime;
  }

  public OffsetDateTime getCreatedAt() {
    return createdAt;
  }
}
