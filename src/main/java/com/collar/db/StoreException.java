package com.collar.db;

/**
 * Ошибка при работе с БД: нет соединения, нарушено ограничение, сбой транзакции.
 * <p>
 * Сообщение повторяет сообщение исходного {@link java.sql.SQLException}.
 */
public class StoreException extends RuntimeException {

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
