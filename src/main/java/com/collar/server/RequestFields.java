package com.collar.server;

import com.collar.model.InvalidInputException;
import com.collar.model.MetricInput;
import com.collar.model.ReadingInput;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Именованные поля запроса независимо от источника (строка запроса или JSON-тело).
 * <p>
 * Здесь сосредоточено приведение типов: текст, дробные и целые числа, метки времени.
 */
public final class RequestFields {

  // не короче 10 цифр: "2024" не должен стать 1970-01-01T00:00:02.024Z
  private static final Pattern EPOCH_MILLIS = Pattern.compile("^\\d{10,15}$");

  // ISO-8601 со смещением или без него (тогда UTC)
  private static final DateTimeFormatter TIMESTAMP = new DateTimeFormatterBuilder()
      .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
      .optionalStart()
      .appendOffsetId()
      .optionalEnd()
      .toFormatter();

  private final Function<String, Object> source;

  private RequestFields(Function<String, Object> source) {
    this.source = source;
  }

  /**
   * Поля из параметров строки запроса; берётся первое значение параметра.
   */
  public static RequestFields ofQuery(Map<String, List<String>> parameters) {
    return new RequestFields(name -> {
      List<String> values = parameters.get(name);
      return values == null || values.isEmpty() ? null : values.get(0);
    });
  }

  /**
   * Поля из JSON-объекта. Если тело не объект, все поля считаются отсутствующими.
   */
  public static RequestFields ofJson(JsonNode body) {
    return new RequestFields(name -> {
      JsonNode node = body == null || !body.isObject() ? null : body.get(name);
      if (node == null || node.isNull() || !node.isValueNode()) {
        return null;
      }
      return node.isNumber() ? node.numberValue() : node.asText();
    });
  }

  /** Строковое поле; пустая строка считается отсутствием значения. */
  public String text(String name) {
    Object value = source.apply(name);
    if (value == null) {
      return null;
    }
    String text = value.toString();
    return text.isEmpty() ? null : text;
  }

  public Double decimal(String name) {
    return NumericCoercion.toDouble(source.apply(name));
  }

  public Long integer(String name) {
    return NumericCoercion.toLong(source.apply(name));
  }

  /**
   * Метка времени: ISO-8601 со смещением, ISO-8601 без смещения (UTC) или миллисекунды epoch
   * (от 10 до 15 цифр).
   *
   * @throws InvalidInputException если значение задано, но не распознано.
   */
  public OffsetDateTime timestamp(String name) {
    String value = text(name);
    if (value == null) {
      return null;
    }
    value = value.trim();
    if (EPOCH_MILLIS.matcher(value).matches()) {
      return Instant.ofEpochMilli(Long.parseLong(value)).atOffset(ZoneOffset.UTC);
    }
    try {
      TemporalAccessor parsed = TIMESTAMP.parseBest(value, OffsetDateTime::from, LocalDateTime::from);
      if (parsed instanceof OffsetDateTime) {
        return (OffsetDateTime) parsed;
      }
      return ((LocalDateTime) parsed).atOffset(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      throw new InvalidInputException(name, name + " is not a valid timestamp");
    }
  }

  /**
   * Поля показания.
   *
   * @throws InvalidInputException если не задана кличка (dog_name).
   */
  public ReadingInput toReading() {
    return ReadingInput.builder()
        .collarId(text("collar_id"))
        .dogName(text("dog_name"))
        .breed(text("breed"))
        .coatType(text("coat_type"))
        .height(decimal("height"))
        .weight(decimal("weight"))
        .sex(text("sex"))
        .temperatureIrgun(decimal("temperature_irgun"))
        .collarOrientation(text("collar_orientation"))
        .build();
  }

  /**
   * Поля метрики.
   *
   * @throws InvalidInputException если npl_time задан, но не распознан.
   */
  public MetricInput toMetric() {
    return MetricInput.builder()
        .temperature(decimal("temperature"))
        .stepcount(integer("stepcount"))
        .caloriecount(decimal("caloriecount"))
        .accel(decimal("accel_x"), decimal("accel_y"), decimal("accel_z"))
        .gyro(decimal("gyro_x"), decimal("gyro_y"), decimal("gyro_z"))
        .nplTime(timestamp("npl_time"))
        .build();
  }
}
