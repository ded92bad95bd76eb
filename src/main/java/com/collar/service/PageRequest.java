package com.collar.service;

import java.util.regex.Pattern;

/**
 * Параметры страницы истории. limit ограничен диапазоном [1, 1000], offset не меньше 0.
 */
public final class PageRequest {

  public static final int MAX_LIMIT = 1000;

  private static final Pattern INTEGER = Pattern.compile("^[+-]?\\d+$");

  private final int limit;
  private final long offset;

  private PageRequest(int limit, long offset) {
    this.limit = limit;
    this.offset = offset;
  }

  public static PageRequest of(long limit, long offset) {
    return new PageRequest((int) Math.max(1, Math.min(MAX_LIMIT, limit)), Math.max(0, offset));
  }

  /**
   * Разбирает сырые параметры запроса. Отсутствующее или нечисловое значение
   * заменяется значением по умолчанию, число вне диапазона long насыщается до его границы,
   * затем всё ограничивается.
   */
  public static PageRequest parse(String limit, String offset, int defaultLimit) {
    return of(parseLong(limit, defaultLimit), parseLong(offset, 0));
  }

  private static long parseLong(String value, long defaultValue) {
    if (value == null) {
      return defaultValue;
    }
    String trimmed = value.trim();
    if (!INTEGER.matcher(trimmed).matches()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(trimmed);
    } catch (NumberFormatException e) {
      // только цифры, но не помещается в long
      return trimmed.startsWith("-") ? Long.MIN_VALUE : Long.MAX_VALUE;
    }
  }

  public int getLimit() {
    return limit;
  }

  public long getOffset() {
    return offset;
  }
}
