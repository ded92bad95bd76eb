package com.collar.model;

import java.time.OffsetDateTime;

/**
 * Строка таблицы input_readings: описание собаки и контекста ошейника на момент приёма.
 * <p>
 * Кличка присутствует всегда, остальные описательные поля могут быть {@code null}.
 */
public final class Reading {

  private final long id;
  private final String collarId;
  private final String dogName;
  private final String breed;
  private final String coatType;
  private final Double height;
  private final Double weight;
  private final String sex;
  private final Double temperatureIrgun;
  private final String collarOrientation;
  private final OffsetDateTime createdAt;

  public Reading(long id, String collarId, String dogName, String breed, String coatType,
                 Double height, Double weight, String sex, Double temperatureIrgun,
                 String collarOrientation, OffsetDateTime createdAt) {
    this.id = id;
    this.collarId = collarId;
    this.dogName = dogName;
    this.breed = breed;
    this.coatType = coatType;
    this.height = height;
    this.weight = weight;
    this.sex = sex;
    this.temperatureIrgun = temperatureIrgun;
    this.collarOrientation = collarOrientation;
    this.createdAt = createdAt;
  }

  public long getId() {
    return id;
  }

  public String getCollarId() {
    return collarId;
  }

  public String getDogName() {
    return dogName;
  }

  public String getBreed() {
    return breed;
  }

  public String getCoatType() {
    return coatType;
  }

  public Double getHeight() {
    return height;
  }

  public Double getWeight() {
    return weight;
  }

  public String getSex() {
    return sex;
  }

  public Double getTemperatureIrgun() {
    return temperatureIrgun;
  }

  public String getCollarOrientation() {
    return collarOrientation;
  }

  public OffsetDateTime getCreatedAt() {
    return createdAt;
  }
}
