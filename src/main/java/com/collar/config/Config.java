package com.collar.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Утилитарный класс для чтения параметров конфигурации.
 * <p>
 * Значение ищется в порядке: системное свойство JVM, переменная окружения,
 * classpath-файл "application.properties". Пустые значения считаются отсутствующими.
 */
public final class Config {

  private static final Properties PROPS = new Properties();

  static {
    try (InputStream input = Config.class.getClassLoader()
        .getResourceAsStream("application.properties")) {
      if (input == null) {
        throw new IllegalStateException("Файл application.properties не найден в classpath.");
      }
      PROPS.load(input);
    } catch (IOException e) {
      throw new IllegalStateException("Не удалось загрузить application.properties", e);
    }
  }

  /**
   * Возвращает значение параметра или {@code null}, если он нигде не задан.
   *
   * @param key Ключ параметра (например, "db.url").
   * @param envVar Имя переменной окружения (например, "DATABASE_URL"), может быть {@code null}.
   * @return Обрезанное значение или {@code null}.
   */
  public static String getProperty(String key, String envVar) {
    String sysValue = trimToNull(System.getProperty(key));
    if (sysValue != null) {
      return sysValue;
    }
    if (envVar != null) {
      String envValue = trimToNull(System.getenv(envVar));
      if (envValue != null) {
        return envValue;
      }
    }
    return trimToNull(PROPS.getProperty(key));
  }

  /**
   * Возвращает значение обязательного параметра.
   *
   * @throws IllegalStateException если параметр не задан или пуст.
   */
  public static String getRequiredProperty(String key, String envVar) {
    String value = getProperty(key, envVar);
    if (value == null) {
      throw new IllegalStateException("Обязательный параметр '" + key + "' (" + envVar
          + ") не задан ни в системных свойствах, ни в окружении, ни в application.properties");
    }
    return value;
  }

  /**
   * Возвращает целочисленный параметр или значение по умолчанию.
   *
   * @throws IllegalStateException если значение задано, но не является целым числом.
   */
  public static int getIntProperty(String key, String envVar, int defaultValue) {
    String value = getProperty(key, envVar);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Параметр '" + key + "' должен быть целым числом: " + value, e);
    }
  }

  private static String trimToNull(String value) {
    if (value == null || value.trim().isEmpty()) {
      return null;
    }
    return value.trim();
  }

  // Запрещаем создание экземпляров
  private Config() {
    throw new UnsupportedOperationException("Utility class");
  }
}
