package com.collar.server;

import com.collar.config.AppConfig;
import com.collar.db.StoreException;
import com.collar.model.InvalidInputException;
import com.collar.model.Metric;
import com.collar.model.MetricInput;
import com.collar.model.Reading;
import com.collar.model.ReadingInput;
import com.collar.model.ReadingWithMetric;
import com.collar.service.CollarService;
import com.collar.service.PageRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import io.netty.util.CharsetUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Обработчик HTTP-запросов приёма и выдачи данных ошейников.
 * <p>
 * Разбирает запрос, приводит поля к типам и делегирует работу
 * {@link com.collar.service.CollarService}. Каждый ответ — JSON-объект с полем {@code ok}.
 * Обработчик не хранит состояния и разделяется между каналами.
 */
@ChannelHandler.Sharable
public class HttpServerHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

  private static final Logger logger = LoggerFactory.getLogger(HttpServerHandler.class);

  // короткие маршруты /1 .. /6 — последние данные ошейника с этим номером
  private static final Pattern SHORT_ROUTE = Pattern.compile("^/([1-6])$");

  static final String USAGE = "Use POST /app to store input_readings, GET /ingest to store a reading "
      + "with metrics, GET /collar to send output metrics, GET /1../6 for the latest data "
      + "and GET /by-collar?collar_id= for history";

  static final String COLLAR_INSERT_ONLY =
      "GET /collar is insert-only; provide output metric query parameters to insert";

  private final CollarService collarService;
  private final ObjectMapper objectMapper;
  private final int historyDefaultLimit;

  /**
   * Конструктор обработчика.
   *
   * @param collarService Сервис данных ошейников.
   * @param objectMapper Маппер для ответов, см. {@link JsonSupport#createObjectMapper()}.
   * @param historyDefaultLimit Размер страницы истории, если limit не передан.
   */
  public HttpServerHandler(CollarService collarService, ObjectMapper objectMapper, int historyDefaultLimit) {
    this.collarService = collarService;
    this.objectMapper = objectMapper;
    this.historyDefaultLimit = historyDefaultLimit;
  }

  public HttpServerHandler(CollarService collarService) {
    this(collarService, JsonSupport.createObjectMapper(), AppConfig.DEFAULT_HISTORY_LIMIT);
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
    HttpMethod method = request.method();
    QueryStringDecoder decoder = new QueryStringDecoder(request.uri());
    logger.info("📥 {} {}", method, request.uri());

    FullHttpResponse response;
    try {
      response = route(method, decoder, request);
    } catch (InvalidInputException e) {
      logger.warn("Отклонён {} {}: {}", method, decoder.path(), e.getMessage());
      response = createErrorResponse(HttpResponseStatus.BAD_REQUEST, e.getMessage());
    } catch (StoreException e) {
      logger.error("❌ Ошибка БД при обработке {} {}", method, decoder.path(), e);
      response = createErrorResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    } catch (Exception e) {
      logger.error("❌ Непредвиденная ошибка при обработке {} {}", method, decoder.path(), e);
      response = createErrorResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR, "internal error");
    }

    ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
  }

  private FullHttpResponse route(HttpMethod method, QueryStringDecoder decoder, FullHttpRequest request) {
    String path = decoder.path();
    Map<String, List<String>> params = decoder.parameters();
    boolean get = HttpMethod.GET.equals(method);
    boolean post = HttpMethod.POST.equals(method);

    if (HttpMethod.OPTIONS.equals(method)) {
      return createEmptyResponse(HttpResponseStatus.NO_CONTENT);
    }

    switch (path) {
      case "/":
        return get ? usage() : methodNotAllowed();
      case "/health":
        return get ? health() : methodNotAllowed();
      case "/ingest":
        return get || post ? ingest(RequestFields.ofQuery(params)) : methodNotAllowed();
      case "/app":
        return post ? saveReading(request) : methodNotAllowed();
      case "/collar":
        return get || post ? recordMetric(RequestFields.ofQuery(params)) : methodNotAllowed();
      case "/by-collar":
        return get ? history(RequestFields.ofQuery(params)) : methodNotAllowed();
      default:
        Matcher shortRoute = SHORT_ROUTE.matcher(path);
        if (!shortRoute.matches()) {
          return createErrorResponse(HttpResponseStatus.NOT_FOUND, "not found");
        }
        return get ? latest(shortRoute.group(1)) : methodNotAllowed();
    }
  }

  private FullHttpResponse usage() {
    ObjectNode body = okBody();
    body.put("msg", USAGE);
    return createJsonResponse(HttpResponseStatus.OK, body);
  }

  private FullHttpResponse health() {
    try {
      collarService.checkStore();
    } catch (StoreException e) {
      logger.warn("БД недоступна: {}", e.getMessage());
      ObjectNode body = objectMapper.createObjectNode();
      body.put("ok", false);
      body.put("db", "down");
      body.put("error", e.getMessage());
      return createJsonResponse(HttpResponseStatus.SERVICE_UNAVAILABLE, body);
    }
    ObjectNode body = okBody();
    body.put("db", "up");
    return createJsonResponse(HttpResponseStatus.OK, body);
  }

  /** Показание и, при наличии полей, метрика в одной транзакции. */
  private FullHttpResponse ingest(RequestFields fields) {
    ReadingInput reading = fields.toReading();
    MetricInput metric = fields.toMetric();

    ReadingWithMetric saved = collarService.ingest(reading, metric);

    ObjectNode inserted = objectMapper.createObjectNode();
    inserted.set("input", readingSummary(saved.getInput()));
    inserted.set("output", toTree(saved.getOutput()));
    ObjectNode body = okBody();
    body.set("inserted", inserted);
    return createJsonResponse(HttpResponseStatus.OK, body);
  }

  private FullHttpResponse saveReading(FullHttpRequest request) {
    Reading saved = collarService.saveReading(RequestFields.ofJson(readBody(request)).toReading());
    ObjectNode body = okBody();
    body.set("inserted", readingSummary(saved));
    return createJsonResponse(HttpResponseStatus.OK, body);
  }

  private FullHttpResponse recordMetric(RequestFields fields) {
    String collarId = fields.text("collar_id");
    if (collarId == null) {
      throw new InvalidInputException("collar_id", "collar_id is required");
    }
    MetricInput metric = fields.toMetric();
    if (!metric.hasAnyValue()) {
      return createErrorResponse(HttpResponseStatus.METHOD_NOT_ALLOWED, COLLAR_INSERT_ONLY);
    }

    Metric saved = collarService.recordMetric(collarId, metric);
    ObjectNode body = okBody();
    body.set("output", toTree(saved));
    return createJsonResponse(HttpResponseStatus.OK, body);
  }

  private FullHttpResponse latest(String collarId) {
    Optional<ReadingWithMetric> latest = collarService.findLatest(collarId);
    if (latest.isEmpty()) {
      return createErrorResponse(HttpResponseStatus.NOT_FOUND, "no output data for collar_id");
    }
    ObjectNode body = okBody();
    body.set("input", toTree(latest.get().getInput()));
    body.set("output", toTree(latest.get().getOutput()));
    return createJsonResponse(HttpResponseStatus.OK, body);
  }

  private FullHttpResponse history(RequestFields fields) {
    String collarId = fields.text("collar_id");
    if (collarId == null) {
      throw new InvalidInputException("collar_id", "collar_id is required");
    }
    PageRequest page = PageRequest.parse(fields.text("limit"), fields.text("offset"), historyDefaultLimit);

    List<ReadingWithMetric> rows = collarService.findHistory(collarId, page);
    ObjectNode body = okBody();
    body.put("count", rows.size());
    body.put("limit", page.getLimit());
    body.put("offset", page.getOffset());
    body.set("data", toTree(rows));
    return createJsonResponse(HttpResponseStatus.OK, body);
  }

  private JsonNode readBody(FullHttpRequest request) {
    String body = request.content().toString(CharsetUtil.UTF_8);
    if (body.isBlank()) {
      return objectMapper.createObjectNode();
    }
    try {
      return objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new InvalidInputException("body", "invalid JSON body");
    }
  }

  private ObjectNode readingSummary(Reading reading) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("id", reading.getId());
    node.set("created_at", toTree(reading.getCreatedAt()));
    node.put("collar_id", reading.getCollarId());
    return node;
  }

  private JsonNode toTree(Object value) {
    return value == null ? NullNode.getInstance() : objectMapper.valueToTree(value);
  }

  private ObjectNode okBody() {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("ok", true);
    return body;
  }

  private FullHttpResponse methodNotAllowed() {
    return createErrorResponse(HttpResponseStatus.METHOD_NOT_ALLOWED, "method not allowed");
  }

  private FullHttpResponse createErrorResponse(HttpResponseStatus status, String message) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("ok", false);
    body.put("error", message == null ? status.reasonPhrase() : message);
    return createJsonResponse(status, body);
  }

  private FullHttpResponse createJsonResponse(HttpResponseStatus status, JsonNode body) {
    byte[] bytes;
    try {
      bytes = objectMapper.writeValueAsBytes(body);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Не удалось сериализовать ответ", e);
    }
    FullHttpResponse res = new DefaultFullHttpResponse(
        HttpVersion.HTTP_1_1,
        status,
        Unpooled.wrappedBuffer(bytes)
    );
    res.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json; charset=UTF-8");
    res.headers().set(HttpHeaderNames.CONTENT_LENGTH, res.content().readableBytes());
    res.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
    return res;
  }

  private FullHttpResponse createEmptyResponse(HttpResponseStatus status) {
    FullHttpResponse res = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, Unpooled.EMPTY_BUFFER);
    res.headers().set(HttpHeaderNames.CONTENT_LENGTH, 0);
    res.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
    return res;
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    logger.error("Ошибка канала", cause);
    ctx.close();
  }
}
