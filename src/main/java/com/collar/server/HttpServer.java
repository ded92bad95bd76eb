package com.collar.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.cors.CorsConfig;
import io.netty.handler.codec.http.cors.CorsConfigBuilder;
import io.netty.handler.codec.http.cors.CorsHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.List;

/**
 * HTTP-сервер на Netty.
 * <p>
 * Запросы к БД блокирующие, поэтому обработчик выполняется на отдельной группе потоков,
 * а не на event loop.
 */
public class HttpServer {

  private static final Logger logger = LoggerFactory.getLogger(HttpServer.class);

  private static final int MAX_CONTENT_LENGTH = 65536;

  private final int port;
  private final HttpServerHandler handler;
  private final CorsConfig corsConfig;
  private final int handlerThreads;

  private EventLoopGroup bossGroup;
  private EventLoopGroup workerGroup;
  private EventExecutorGroup handlerGroup;
  private Channel serverChannel;

  /**
   * Конструктор HTTP-сервера.
   *
   * @param port Порт, 0 — любой свободный.
   * @param handler Обработчик запросов.
   * @param corsConfig Настройки CORS, см. {@link #corsConfig(List)}.
   * @param handlerThreads Число потоков для обработчика; разумно не больше размера пула БД.
   */
  public HttpServer(int port, HttpServerHandler handler, CorsConfig corsConfig, int handlerThreads) {
    this.port = port;
    this.handler = handler;
    this.corsConfig = corsConfig;
    this.handlerThreads = handlerThreads;
  }

  /**
   * Настройки CORS: "*" разрешает любой origin, иначе только перечисленные.
   */
  public static CorsConfig corsConfig(List<String> origins) {
    CorsConfigBuilder builder = origins.contains("*")
        ? CorsConfigBuilder.forAnyOrigin()
        : CorsConfigBuilder.forOrigins(origins.toArray(new String[0]));
    return builder
        .allowedRequestMethods(HttpMethod.GET, HttpMethod.POST, HttpMethod.OPTIONS)
        .allowedRequestHeaders("Content-Type", "Authorization")
        .allowCredentials()
        .build();
  }

  /**
   * Открывает порт и возвращает управление, не дожидаясь остановки.
   *
   * @throws InterruptedException если поток прерван во время bind.
   */
  public void start() throws InterruptedException {
    bossGroup = new NioEventLoopGroup(1);
    workerGroup = new NioEventLoopGroup();
    handlerGroup = new DefaultEventExecutorGroup(handlerThreads);

    ServerBootstrap b = new ServerBootstrap();
    b.group(bossGroup, workerGroup)
        .channel(NioServerSocketChannel.class)
        .childHandler(new ChannelInitializer<SocketChannel>() {
          @Override
          public void initChannel(SocketChannel ch) {
            ch.pipeline()
                .addLast(new HttpServerCodec())
                .addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH))
                .addLast(new CorsHandler(corsConfig))
                .addLast(handlerGroup, "collarHandler", handler);
          }
        })
        .option(ChannelOption.SO_BACKLOG, 128)
        .childOption(ChannelOption.SO_KEEPALIVE, true);

    try {
      serverChannel = b.bind(port).sync().channel();
    } catch (InterruptedException | RuntimeException e) {
      stop();
      throw e;
    }
    logger.info("🚀 Сервер запущен на http://localhost:{}", getPort());
  }

  /** Фактический порт после {@link #start()}. */
  public int getPort() {
    return ((InetSocketAddress) serverChannel.localAddress()).getPort();
  }

  /**
   * Блокирует поток до закрытия серверного канала.
   */
  public void awaitTermination() throws InterruptedException {
    serverChannel.closeFuture().sync();
  }

  /**
   * Закрывает порт и освобождает потоки.
   */
  public void stop() {
    if (serverChannel != null) {
      serverChannel.close().syncUninterruptibly();
    }
    if (handlerGroup != null) {
      handlerGroup.shutdownGracefully();
    }
    if (workerGroup != null) {
      workerGroup.shutdownGracefully();
    }
    if (bossGroup != null) {
      bossGroup.shutdownGracefully();
    }
    logger.info("Сервер остановлен");
  }
}
