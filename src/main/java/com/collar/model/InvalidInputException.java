package com.collar.model;

/**
 * Некорректный или неполный входной запрос. Соответствует ответу 400.
 */
public class InvalidInputException extends RuntimeException {

  private final String field;

  public InvalidInputException(String field, String message) {
    super(message);
    this.field = field;
  }

  /** Имя поля запроса, из-за которого запрос отклонён. */
  public String getField() {
    return field;
  }
}
