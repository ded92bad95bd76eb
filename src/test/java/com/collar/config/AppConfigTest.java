package com.collar.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AppConfigTest {

  @AfterEach
  void clearProperties() {
    System.clearProperty("db.url");
    System.clearProperty("server.port");
    System.clearProperty("cors.origin");
    System.clearProperty("db.sslmode");
  }

  @Test
  @DisplayName("Системные свойства важнее application.properties")
  void shouldPreferSystemProperties() {
    System.setProperty("db.url", "postgres://u:p@db.example:6543/pets");
    System.setProperty("server.port", "9090");
    System.setProperty("cors.origin", "http://a.example, http://b.example");
    System.setProperty("db.sslmode", "require");

    AppConfig config = AppConfig.load();

    assertThat(config.getJdbcUrl()).isEqualTo("jdbc:postgresql://db.example:6543/pets");
    assertThat(config.getDbUser()).isEqualTo("u");
    assertThat(config.getDbPassword()).isEqualTo("p");
    assertThat(config.getServerPort()).isEqualTo(9090);
    assertThat(config.getCorsOrigins()).containsExactly("http://a.example", "http://b.example");
    assertThat(config.isRequireSsl()).isTrue();
  }

  @Test
  @DisplayName("Нечисловой порт → IllegalStateException")
  void shouldRejectInvalidPort() {
    System.setProperty("server.port", "eighty");

    assertThatThrownBy(AppConfig::load).isInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("Пустой список origin эквивалентен '*'")
  void shouldDefaultCorsToAnyOrigin() {
    assertThat(AppConfig.parseOrigins(null)).containsExactly("*");
    assertThat(AppConfig.parseOrigins(" * ")).containsExactly("*");
    assertThat(AppConfig.parseOrigins(" , ")).containsExactly("*");
  }
}
