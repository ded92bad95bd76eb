package com.collar.server;

import com.collar.db.StoreException;
import com.collar.model.Metric;
import com.collar.model.MetricInput;
import com.collar.model.Reading;
import com.collar.model.ReadingInput;
import com.collar.model.ReadingWithMetric;
import com.collar.service.CollarService;
import com.collar.service.PageRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.handler.codec.http.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Модульные тесты для HttpServerHandler.
 * <p>
 * Проверяют HTTP-уровень: маршрутизацию, валидацию, коды ответа и формат JSON.
 * CollarService замокан.
 */
class HttpServerHandlerTest {

  private static final OffsetDateTime NOW = OffsetDateTime.of(2024, 5, 1, 12, 0, 0, 0, ZoneOffset.UTC);

  @Mock
  private CollarService collarService;

  @Mock
  private ChannelHandlerContext ctx;

  @Mock
  private ChannelPromise channelPromise;

  private final ObjectMapper objectMapper = new ObjectMapper();

  private HttpServerHandler handler;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    handler = new HttpServerHandler(collarService);

    when(ctx.writeAndFlush(any())).thenReturn(channelPromise);
    when(channelPromise.addListener(any())).thenReturn(channelPromise);
  }

  private FullHttpResponse send(HttpMethod method, String uri, String body) {
    FullHttpRequest request = new DefaultFullHttpRequest(
        HttpVersion.HTTP_1_1,
        method,
        uri,
        body == null ? Unpooled.EMPTY_BUFFER : Unpooled.wrappedBuffer(body.getBytes(StandardCharsets.UTF_8))
    );
    if (body != null) {
      request.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json");
      request.headers().set(HttpHeaderNames.CONTENT_LENGTH, request.content().readableBytes());
    }

    handler.channelRead0(ctx, request);

    ArgumentCaptor<FullHttpResponse> responseCaptor = ArgumentCaptor.forClass(FullHttpResponse.class);
    verify(ctx).writeAndFlush(responseCaptor.capture());
    return responseCaptor.getValue();
  }

  private JsonNode json(FullHttpResponse response) throws Exception {
    return objectMapper.readTree(response.content().toString(StandardCharsets.UTF_8));
  }

  private static Reading reading(long id, String collarId) {
    return new Reading(id, collarId, "Muffin", "Indie", null, 45.0, 18.0, "male", null, "top", NOW);
  }

  private static Metric metric(long id, String collarId, Double temperature) {
    return new Metric(id, collarId, null, temperature, 1200L, null, null, null, null, null, null, null, null, NOW);
  }

  @Test
  @DisplayName("GET / → 200 с подсказкой по использованию")
  void shouldReturnUsageOnRoot() throws Exception {
    FullHttpResponse response = send(HttpMethod.GET, "/", null);

    assertThat(response.status()).isEqualTo(HttpResponseStatus.OK);
    JsonNode body = json(response);
    assertThat(body.get("ok").asBoolean()).isTrue();
    assertThat(body.get("msg").asText()).contains("POST /app");
    verifyNoInteractions(collarService);
  }

  @Test
  @DisplayName("GET /ingest без dog_name → 400, в сервис ничего не передаётся")
  void shouldRejectIngestWithoutDogName() throws Exception {
    FullHttpResponse response = send(HttpMethod.GET, "/ingest?collar_id=1&temperature=38.2", null);

    assertThat(response.status()).isEqualTo(HttpResponseStatus.BAD_REQUEST);
    JsonNode body = json(response);
    assertThat(body.get("ok").asBoolean()).isFalse();
    assertThat(body.get("error").asText()).isEqualTo("dog_name is required");
    verifyNoInteractions(collarService);
  }

  @Test
  @DisplayName("GET /ingest → поля приводятся к типам и передаются в сервис")
  void shouldCoerceIngestFields() throws Exception {
    when(collarService.ingest(any(), any()))
        .thenReturn(new ReadingWithMetric(reading(7, "C1"), metric(3, "C1", 38.2)));

    FullHttpResponse response = send(HttpMethod.GET,
        "/ingest?dog_name=Muffin&collar_id=C1&height=45&weight=abc&temperature=38.2&stepcount=1200", null);

    ArgumentCaptor<ReadingInput> readingCaptor = ArgumentCaptor.forClass(ReadingInput.class);
    ArgumentCaptor<MetricInput> metricCaptor = ArgumentCaptor.forClass(MetricInput.class);
    verify(collarService).ingest(readingCaptor.capture(), metricCaptor.capture());

    ReadingInput reading = readingCaptor.getValue();
    assertThat(reading.getDogName()).isEqualTo("Muffin");
    assertThat(reading.getCollarId()).isEqualTo("C1");
    assertThat(reading.getHeight()).isEqualTo(45.0);
    assertThat(reading.getWeight()).isNull();
    assertThat(reading.getBreed()).isNull();

    MetricInput metric = metricCaptor.getValue();
    assertThat(metric.getTemperature()).isEqualTo(38.2);
    assertThat(metric.getStepcount()).isEqualTo(1200L);
    assertThat(metric.getCaloriecount()).isNull();

    assertThat(response.status()).isEqualTo(HttpResponseStatus.OK);
    JsonNode inserted = json(response).get("inserted");
    assertThat(inserted.get("input").get("id").asLong()).isEqualTo(7);
    assertThat(inserted.get("input").get("collar_id").asText()).isEqualTo("C1");
    assertThat(inserted.get("input").get("created_at").asText()).startsWith("2024-05-01T12:00");
    assertThat(inserted.get("output").get("id").asLong()).isEqualTo(3);
    assertThat(inserted.get("output").get("temperature").asDouble()).isEqualTo(38.2);
  }

  @Test
  @DisplayName("GET /ingest без полей метрики → output = null")
  void shouldReturnNullOutputWhenNoMetricWritten() throws Exception {
    when(collarService.ingest(any(), any())).thenReturn(new ReadingWithMetric(reading(8, null), null));

    FullHttpResponse response = send(HttpMethod.GET, "/ingest?dog_name=Muffin", null);

    assertThat(response.status()).isEqualTo(HttpResponseStatus.OK);
    JsonNode inserted = json(response).get("inserted");
    assertThat(inserted.get("input").get("collar_id").isNull()).isTrue();
    assertThat(inserted.get("output").isNull()).isTrue();
  }

  @Test
  @DisplayName("Ошибка БД → 500 с исходным сообщением")
  void shouldReturn500WithStoreMessage() throws Exception {
    when(collarService.ingest(any(), any()))
        .thenThrow(new StoreException("connection refused", new SQLException("connection refused")));

    FullHttpResponse response = send(HttpMethod.GET, "/ingest?dog_name=Muffin&temperature=38.2", null);

    assertThat(response.status()).isEqualTo(HttpResponseStatus.INTERNAL_SERVER_ERROR);
    JsonNode body = json(response);
    assertThat(body.get("ok").asBoolean()).isFalse();
    assertThat(body.get("error").asText()).isEqualTo("connection refused");
  }

  @Test
  @DisplayName("POST /app с JSON → сохраняет показание, числа из строк приводятся")
  void shouldSaveReadingFromJsonBody() throws Exception {
    when(collarService.saveReading(any())).thenReturn(reading(11, "C123"));

    String json = "{\"collar_id\":\"C123\",\"dog_name\":\"Muffin\",\"breed\":\"Indie\","
        + "\"height\":\"45\",\"weight\":18,\"temperature_irgun\":\"\",\"collar_orientation\":\"top\"}";
    FullHttpResponse response = send(HttpMethod.POST, "/app", json);

    ArgumentCaptor<ReadingInput> captor = ArgumentCaptor.forClass(ReadingInput.class);
    verify(collarService).saveReading(captor.capture());
    ReadingInput input = captor.getValue();
    assertThat(input.getCollarId()).isEqualTo("C123");
    assertThat(input.getHeight()).isEqualTo(45.0);
    assertThat(input.getWeight()).isEqualTo(18.0);
    assertThat(input.getTemperatureIrgun()).isNull();
    assertThat(input.getCollarOrientation()).isEqualTo("top");

    assertThat(response.status()).isEqualTo(HttpResponseStatus.OK);
    JsonNode inserted = json(response).get("inserted");
    assertThat(inserted.get("id").asLong()).isEqualTo(11);
    assertThat(inserted.get("collar_id").asText()).isEqualTo("C123");
  }

  @Test
  @DisplayName("POST /app без dog_name → 400")
  void shouldRejectAppWithoutDogName() throws Exception {
    FullHttpResponse response = send(HttpMethod.POST, "/app", "{\"breed\":\"Indie\"}");

    assertThat(response.status()).isEqualTo(HttpResponseStatus.BAD_REQUEST);
    assertThat(json(response).get("error").asText()).isEqualTo("dog_name is required");
    verifyNoInteractions(collarService);
  }

  @Test
  @DisplayName("POST /app с невалидным JSON → 400")
  void shouldReturn400WhenJsonIsInvalid() throws Exception {
    FullHttpResponse response = send(HttpMethod.POST, "/app", "{invalid");

    assertThat(response.status()).isEqualTo(HttpResponseStatus.BAD_REQUEST);
    assertThat(json(response).get("error").asText()).isEqualTo("invalid JSON body");
    verifyNoInteractions(collarService);
  }

  @Test
  @DisplayName("GET /collar без collar_id → 400")
  void shouldRejectCollarWithoutId() throws Exception {
    FullHttpResponse response = send(HttpMethod.GET, "/collar?temperature=38", null);

    assertThat(response.status()).isEqualTo(HttpResponseStatus.BAD_REQUEST);
    assertThat(json(response).get("error").asText()).isEqualTo("collar_id is required");
    verifyNoInteractions(collarService);
  }

  @Test
  @DisplayName("GET /collar без полей метрики → 405, ничего не пишется")
  void shouldRejectCollarReadAttempt() throws Exception {
    FullHttpResponse response = send(HttpMethod.GET, "/collar?collar_id=1&limit=10", null);

    assertThat(response.status()).isEqualTo(HttpResponseStatus.METHOD_NOT_ALLOWED);
    assertThat(json(response).get("error").asText()).isEqualTo(HttpServerHandler.COLLAR_INSERT_ONLY);
    verifyNoInteractions(collarService);
  }

  @Test
  @DisplayName("GET /collar с метриками → 200 и вставленная строка")
  void shouldRecordMetric() throws Exception {
    when(collarService.recordMetric(eq("2"), any())).thenReturn(metric(5, "2", 37.9));

    FullHttpResponse response = send(HttpMethod.GET,
        "/collar?collar_id=2&temperature=37.9&accel_x=0.1&gyro_z=-2&npl_time=2024-05-01T10:00:00Z", null);

    ArgumentCaptor<MetricInput> captor = ArgumentCaptor.forClass(MetricInput.class);
    verify(collarService).recordMetric(eq("2"), captor.capture());
    assertThat(captor.getValue().getAccelX()).isEqualTo(0.1);
    assertThat(captor.getValue().getGyroZ()).isEqualTo(-2.0);
    assertThat(captor.getValue().getNplTime())
        .isEqualTo(OffsetDateTime.of(2024, 5, 1, 10, 0, 0, 0, ZoneOffset.UTC));

    assertThat(response.status()).isEqualTo(HttpResponseStatus.OK);
    JsonNode output = json(response).get("output");
    assertThat(output.get("id").asLong()).isEqualTo(5);
    assertThat(output.get("collar_id").asText()).isEqualTo("2");
    assertThat(output.get("stepcount").asLong()).isEqualTo(1200);
  }

  @Test
  @DisplayName("GET /collar с нераспознанным npl_time → 400")
  void shouldRejectInvalidObservationTime() throws Exception {
    FullHttpResponse response = send(HttpMethod.GET, "/collar?collar_id=2&temperature=37&npl_time=yesterday", null);

    assertThat(response.status()).isEqualTo(HttpResponseStatus.BAD_REQUEST);
    assertThat(json(response).get("error").asText()).isEqualTo("npl_time is not a valid timestamp");
    verifyNoInteractions(collarService);
  }

  @Test
  @DisplayName("GET /1 без метрик → 404")
  void shouldReturn404WhenNoMetricForCollar() throws Exception {
    when(collarService.findLatest("1")).thenReturn(Optional.empty());

    FullHttpResponse response = send(HttpMethod.GET, "/1", null);

    assertThat(response.status()).isEqualTo(HttpResponseStatus.NOT_FOUND);
    assertThat(json(response).get("error").asText()).isEqualTo("no output data for collar_id");
  }

  @Test
  @DisplayName("GET /3 → последняя метрика, показание может отсутствовать")
  void shouldReturnLatestWithNullReading() throws Exception {
    when(collarService.findLatest("3")).thenReturn(Optional.of(new ReadingWithMetric(null, metric(9, "3", 38.0))));

    FullHttpResponse response = send(HttpMethod.GET, "/3", null);

    assertThat(response.status()).isEqualTo(HttpResponseStatus.OK);
    JsonNode body = json(response);
    assertThat(body.get("input").isNull()).isTrue();
    assertThat(body.get("output").get("id").asLong()).isEqualTo(9);
  }

  @Test
  @DisplayName("GET /7 не входит в короткие маршруты → 404")
  void shouldNotRouteOutOfRangeShortPath() throws Exception {
    FullHttpResponse response = send(HttpMethod.GET, "/7", null);

    assertThat(response.status()).isEqualTo(HttpResponseStatus.NOT_FOUND);
    assertThat(json(response).get("error").asText()).isEqualTo("not found");
    verifyNoInteractions(collarService);
  }

  @Test
  @DisplayName("GET /by-collar без collar_id → 400")
  void shouldRejectHistoryWithoutCollarId() throws Exception {
    FullHttpResponse response = send(HttpMethod.GET, "/by-collar?limit=5", null);

    assertThat(response.status()).isEqualTo(HttpResponseStatus.BAD_REQUEST);
    verifyNoInteractions(collarService);
  }

  @Test
  @DisplayName("GET /by-collar → limit ограничивается, ответ содержит count и data")
  void shouldClampHistoryPage() throws Exception {
    when(collarService.findHistory(eq("C1"), any()))
        .thenReturn(List.of(new ReadingWithMetric(reading(1, "C1"), metric(2, "C1", 38.0)),
            new ReadingWithMetric(reading(3, "C1"), null)));

    FullHttpResponse response = send(HttpMethod.GET, "/by-collar?collar_id=C1&limit=2000&offset=-5", null);

    ArgumentCaptor<PageRequest> captor = ArgumentCaptor.forClass(PageRequest.class);
    verify(collarService).findHistory(eq("C1"), captor.capture());
    assertThat(captor.getValue().getLimit()).isEqualTo(1000);
    assertThat(captor.getValue().getOffset()).isZero();

    JsonNode body = json(response);
    assertThat(body.get("count").asInt()).isEqualTo(2);
    assertThat(body.get("data")).hasSize(2);
    assertThat(body.get("data").get(0).get("input").get("dog_name").asText()).isEqualTo("Muffin");
    assertThat(body.get("data").get(1).get("output").isNull()).isTrue();
  }

  @Test
  @DisplayName("Неподдерживаемый метод на известном пути → 405")
  void shouldReturn405ForWrongMethod() throws Exception {
    FullHttpResponse response = send(HttpMethod.GET, "/app", null);

    assertThat(response.status()).isEqualTo(HttpResponseStatus.METHOD_NOT_ALLOWED);
    assertThat(json(response).get("error").asText()).isEqualTo("method not allowed");
  }

  @Test
  @DisplayName("Неверный URI → 404 Not Found")
  void shouldReturn404ForUnknownPath() throws Exception {
    FullHttpResponse response = send(HttpMethod.POST, "/unknown", null);

    assertThat(response.status()).isEqualTo(HttpResponseStatus.NOT_FOUND);
    assertThat(json(response).get("ok").asBoolean()).isFalse();
  }

  @Test
  @DisplayName("GET /health при недоступной БД → 503")
  void shouldReportStoreDown() throws Exception {
    doThrow(new StoreException("timeout", new SQLException("timeout"))).when(collarService).checkStore();

    FullHttpResponse response = send(HttpMethod.GET, "/health", null);

    assertThat(response.status()).isEqualTo(HttpResponseStatus.SERVICE_UNAVAILABLE);
    assertThat(json(response).get("db").asText()).isEqualTo("down");
  }

  @Test
  @DisplayName("Непредвиденное исключение → 500 без подробностей")
  void shouldHideUnexpectedErrors() throws Exception {
    when(collarService.findLatest(anyString())).thenThrow(new IllegalStateException("boom"));

    FullHttpResponse response = send(HttpMethod.GET, "/4", null);

    assertThat(response.status()).isEqualTo(HttpResponseStatus.INTERNAL_SERVER_ERROR);
    assertThat(json(response).get("error").asText()).isEqualTo("internal error");
  }
}
