package com.collar.model;

import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.Objects;

/**
 * Поля новой метрики после приведения типов. Все поля необязательны.
 */
public final class MetricInput {

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

  private MetricInput(Builder builder) {
    this.temperature = builder.temperature;
    this.stepcount = builder.stepcount;
    this.caloriecount = builder.caloriecount;
    this.accelX = builder.accelX;
    this.accelY = builder.accelY;
    this.accelZ = builder.accelZ;
    this.gyroX = builder.gyroX;
    this.gyroY = builder.gyroY;
    this.gyroZ = builder.gyroZ;
    this.nplTime = builder.nplTime;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Есть ли хотя бы одно непустое поле. Пустая метрика в БД не пишется.
   */
  public boolean hasAnyValue() {
    return Arrays.asList(temperature, stepcount, caloriecount,
            accelX, accelY, accelZ, gyroX, gyroY, gyroZ, nplTime)
        .stream()
        .anyMatch(Objects::nonNull);
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

  public OffsetDateTime getNplTime() {
    return nplTime;
  }

  public static final class Builder {
    private Double temperature;
    private Long stepcount;
    private Double caloriecount;
    private Double accelX;
    private Double accelY;
    private Double accelZ;
    private Double gyroX;
    private Double gyroY;
    private Double gyroZ;
    private OffsetDateTime nplTime;

    private Builder() {}

    public Builder temperature(Double temperature) {
      this.temperature = temperature;
      return this;
    }

    public Builder stepcount(Long stepcount) {
      this.stepcount = stepcount;
      return this;
    }

    public Builder caloriecount(Double caloriecount) {
      this.caloriecount = caloriecount;
      return this;
    }

    public Builder accel(Double x, Double y, Double z) {
      this.accelX = x;
      this.accelY = y;
      this.accelZ = z;
      return this;
    }

    public Builder gyro(Double x, Double y, Double z) {
      this.gyroX = x;
      this.gyroY = y;
      this.gyroZ = z;
      return this;
    }

    public Builder nplTime(OffsetDateTime nplTime) {
      this.nplTime = nplTime;
      return this;
    }

    public MetricInput build() {
      return new MetricInput(this);
    }
  }
}
