package com.collar.server;

import java.math.BigDecimal;

/**
 * Приведение слабо типизированных входных значений (строки запроса, JSON) к числам.
 * <p>
 * Отсутствующее, пустое, нечисловое или бесконечное значение превращается в {@code null},
 * а не в ноль.
 */
public final class NumericCoercion {

  private NumericCoercion() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * @param value {@link Number}, строка или {@code null}.
   * @return Конечное число или {@code null}.
   */
  public static Double toDouble(Object value) {
    BigDecimal decimal = toDecimal(value);
    if (decimal == null) {
      return null;
    }
    double result = decimal.doubleValue();
    return Double.isFinite(result) ? result : null;
  }

  /**
   * Как {@link #toDouble(Object)}, но для целых полей: дробное значение
   * или значение вне диапазона long считается отсутствующим.
   */
  public static Long toLong(Object value) {
    BigDecimal decimal = toDecimal(value);
    if (decimal == null) {
      return null;
    }
    try {
      return decimal.longValueExact();
    } catch (ArithmeticException e) {
      return null;
    }
  }

  private static BigDecimal toDecimal(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof BigDecimal) {
      return (BigDecimal) value;
    }
    if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      return Double.isFinite(d) ? BigDecimal.valueOf(d) : null;
    }
    String text = value.toString().trim();
    if (text.isEmpty()) {
      return null;
    }
    try {
      // BigDecimal не принимает "NaN", "Infinity" и суффиксы вида "1d"
      return new BigDecimal(text);
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
