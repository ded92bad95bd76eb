package com.collar.model;

/**
 * Пара показание/метрика. Используется для ответа GET /{n}, для истории
 * по ошейнику и как результат комбинированной записи.
 */
public final class ReadingWithMetric {

  private final Reading input;
  private final Metric output;

  public ReadingWithMetric(Reading input, Metric output) {
    this.input = input;
    this.output = output;
  }

  /** Показание; {@code null}, если для ошейника нет ни одного показания. */
  public Reading getInput() {
    return input;
  }

  /** Метрика; {@code null}, если метрика не записывалась или не найдена. */
  public Metric getOutput() {
    return output;
  }
}
