package com.collar;

import com.collar.config.AppConfig;
import com.collar.db.ConnectionPool;
import com.collar.db.MetricDao;
import com.collar.db.ReadingDao;
import com.collar.db.SchemaInitializer;
import com.collar.server.HttpServer;
import com.collar.server.HttpServerHandler;
import com.collar.server.JsonSupport;
import com.collar.service.CollarServiceImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Точка входа в приложение.
 * <p>
 * Читает конфигурацию, открывает пул, создаёт таблицы и только затем открывает порт.
 * Любая ошибка до открытия порта завершает процесс с кодом 1.
 */
public final class Application {

  private static final Logger logger = LoggerFactory.getLogger(Application.class);

  private Application() {
  }

  public static void main(String[] args) throws InterruptedException {
    ConnectionPool pool = null;
    HttpServer server;
    try {
      AppConfig config = AppConfig.load();
      pool = new ConnectionPool(config);
      server = start(config, pool);
    } catch (Exception e) {
      logger.error("❌ Ошибка запуска", e);
      if (pool != null) {
        pool.close();
      }
      System.exit(1);
      return;
    }

    ConnectionPool openedPool = pool;
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      server.stop();
      openedPool.close();
    }, "shutdown"));

    server.awaitTermination();
  }

  /**
   * Создаёт схему и открывает порт. Сервер не создаётся, если схему создать не удалось.
   *
   * @param config Настройки приложения.
   * @param pool Открытый пул соединений.
   * @return Запущенный сервер.
   * @throws com.collar.db.StoreException если БД недоступна или DDL не выполнился.
   * @throws InterruptedException если поток прерван во время bind.
   */
  static HttpServer start(AppConfig config, ConnectionPool pool) throws InterruptedException {
    new SchemaInitializer(pool).initialize();

    CollarServiceImpl service = new CollarServiceImpl(pool, new ReadingDao(), new MetricDao());
    HttpServerHandler handler = new HttpServerHandler(
        service, JsonSupport.createObjectMapper(), config.getHistoryDefaultLimit());
    HttpServer server = new HttpServer(
        config.getServerPort(), handler, HttpServer.corsConfig(config.getCorsOrigins()), config.getPoolSize());
    server.start();
    return server;
  }
}
