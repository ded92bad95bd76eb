package com.collar.model;

/**
 * Поля нового показания после приведения типов.
 * <p>
 * Кличка обязательна: экземпляр без неё создать нельзя.
 */
public final class ReadingInput {

  private final String collarId;
  private final String dogName;
  private final String breed;
  private final String coatType;
  private final Double height;
  private final Double weight;
  private final String sex;
  private final Double temperatureIrgun;
  private final String collarOrientation;

  private ReadingInput(Builder builder) {
    if (builder.dogName == null || builder.dogName.isEmpty()) {
      throw new InvalidInputException("dog_name", "dog_name is required");
    }
    this.collarId = builder.collarId;
    this.dogName = builder.dogName;
    this.breed = builder.breed;
    this.coatType = builder.coatType;
    this.height = builder.height;
    this.weight = builder.weight;
    this.sex = builder.sex;
    this.temperatureIrgun = builder.temperatureIrgun;
    this.collarOrientation = builder.collarOrientation;
  }

  public static Builder builder() {
    return new Builder();
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

  public static final class Builder {
    private String collarId;
    private String dogName;
    private String breed;
    private String coatType;
    private Double height;
    private Double weight;
    private String sex;
    private Double temperatureIrgun;
    private String collarOrientation;

    private Builder() {}

    public Builder collarId(String collarId) {
      this.collarId = collarId;
      return this;
    }

    public Builder dogName(String dogName) {
      this.dogName = dogName;
      return this;
    }

    public Builder breed(String breed) {
      this.breed = breed;
      return this;
    }

    public Builder coatType(String coatType) {
      this.coatType = coatType;
      return this;
    }

    public Builder height(Double height) {
      this.height = height;
      return this;
    }

    public Builder weight(Double weight) {
      this.weight = weight;
      return this;
    }

    public Builder sex(String sex) {
      this.sex = sex;
      return this;
    }

    public Builder temperatureIrgun(Double temperatureIrgun) {
      this.temperatureIrgun = temperatureIrgun;
      return this;
    }

    public Builder collarOrientation(String collarOrientation) {
      this.collarOrientation = collarOrientation;
      return this;
    }

    /**
     * @throws InvalidInputException если кличка не задана.
     */
    public ReadingInput build() {
      return new ReadingInput(this);
    }
  }
}
