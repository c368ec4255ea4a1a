package io.github.themoah.hoverlog;

import io.github.themoah.hoverlog.analyzer.AnomalyAnalyzer;
import io.github.themoah.hoverlog.api.QueryLogsHandler;
import io.github.themoah.hoverlog.config.AnalysisConfig;
import io.github.themoah.hoverlog.config.AppConfig;
import io.github.themoah.hoverlog.health.HealthCheckHandler;
import io.github.themoah.hoverlog.health.StoreHealthMonitor;
import io.github.themoah.hoverlog.metrics.MetricsConfig;
import io.github.themoah.hoverlog.metrics.MetricsReporter;
import io.github.themoah.hoverlog.metrics.MicrometerConfig;
import io.github.themoah.hoverlog.metrics.MicrometerReporter;
import io.github.themoah.hoverlog.metrics.PrometheusHandler;
import io.github.themoah.hoverlog.resilience.ResilienceClassifier;
import io.github.themoah.hoverlog.service.LogQueryService;
import io.github.themoah.hoverlog.store.ClickHouseConfig;
import io.github.themoah.hoverlog.store.ClickHouseTemplateStore;
import io.github.themoah.hoverlog.store.SchemaProvisioner;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.CorsHandler;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main verticle for Hoverlog.
 * Wires the ClickHouse store, the analysis service and the HTTP server.
 */
public class MainVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(MainVerticle.class);

  private ClickHouseTemplateStore store;
  private StoreHealthMonitor healthMonitor;
  private HttpServer httpServer;

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting Hoverlog MainVerticle");

    AppConfig appConfig = AppConfig.fromEnvironment();
    AnalysisConfig analysisConfig = AnalysisConfig.fromEnvironment();
    MetricsConfig metricsConfig = MetricsConfig.fromEnvironment();
    ClickHouseConfig clickHouseConfig = loadClickHouseConfig();

    store = new ClickHouseTemplateStore(vertx, clickHouseConfig);
    healthMonitor = new StoreHealthMonitor(vertx, store, appConfig.healthCheckIntervalMs());

    Router router = Router.router(vertx);
    router.route().handler(CorsHandler.create()
      .allowedMethods(Set.of(HttpMethod.POST, HttpMethod.GET, HttpMethod.OPTIONS))
      .allowedHeaders(Set.of("Content-Type", "Authorization")));

    new HealthCheckHandler(healthMonitor).registerRoutes(router);

    MetricsReporter metricsReporter = createMetricsReporter(metricsConfig, router);

    AnomalyAnalyzer analyzer = new AnomalyAnalyzer(store, analysisConfig.smoothing(), analysisConfig.topK());
    LogQueryService queryService = new LogQueryService(analyzer, new ResilienceClassifier(), metricsReporter);
    new QueryLogsHandler(vertx, queryService, appConfig.requestTimeoutMs()).registerRoutes(router);

    router.route().handler(ctx -> {
      ctx.response()
        .setStatusCode(404)
        .putHeader("content-type", "application/json")
        .end("{\"error\": \"Not Found\"}");
    });

    SchemaProvisioner provisioner = new SchemaProvisioner(
      vertx, store.getPool(), store.getErrorClassifier(), appConfig.schemaAutoProvision());

    verifyTables(provisioner)
      .compose(v -> healthMonitor.start())
      .compose(v -> startHttpServer(router, appConfig.httpHost(), appConfig.httpPort()))
      .onSuccess(server -> {
        httpServer = server;
        log.info("Hoverlog started successfully on http://{}:{}", appConfig.httpHost(), server.actualPort());
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to start Hoverlog", err);
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping Hoverlog MainVerticle");

    Future<Void> stopHealthMonitor = (healthMonitor != null)
      ? healthMonitor.stop()
      : Future.succeededFuture();

    Future<Void> stopHttpServer = (httpServer != null)
      ? httpServer.close()
      : Future.succeededFuture();

    Future<Void> closeStore = (store != null)
      ? store.close()
      : Future.succeededFuture();

    stopHealthMonitor
      .compose(v -> stopHttpServer)
      .compose(v -> closeStore)
      .onSuccess(v -> {
        log.info("Hoverlog stopped successfully");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during Hoverlog shutdown", err);
        stopPromise.fail(err);
      });
  }

  /**
   * Table verification never blocks startup: queries degrade to placeholder data until
   * the store is reachable and provisioned.
   */
  private Future<Void> verifyTables(SchemaProvisioner provisioner) {
    return provisioner.verifyTables()
      .recover(err -> {
        log.warn("Failed to verify ClickHouse tables: {}", err.getMessage());
        log.warn("Server will continue and return placeholder data while ClickHouse is unavailable");
        return Future.succeededFuture();
      });
  }

  private Future<HttpServer> startHttpServer(Router router, String host, int port) {
    return vertx.createHttpServer()
      .requestHandler(router)
      .listen(port, host)
      .onSuccess(server -> log.info("HTTP server started on {}:{}", host, server.actualPort()))
      .onFailure(err -> log.error("Failed to start HTTP server", err));
  }

  private ClickHouseConfig loadClickHouseConfig() {
    try {
      return ClickHouseConfig.fromClasspath();
    } catch (Exception e) {
      log.info("No classpath config found, loading from environment: {}", e.getMessage());
      return ClickHouseConfig.fromEnvironment();
    }
  }

  private MetricsReporter createMetricsReporter(MetricsConfig config, Router router) {
    if (!config.isEnabled()) {
      log.info("Metrics reporting is disabled");
      return MetricsReporter.noop();
    }

    MeterRegistry registry = MicrometerConfig.createRegistry(config.reporterType());
    if (registry == null) {
      log.warn("Failed to create meter registry for type: {}", config.reporterType());
      return MetricsReporter.noop();
    }

    if (config.jvmMetricsEnabled()) {
      MicrometerConfig.bindJvmMetrics(registry);
      log.info("JVM metrics enabled");
    }

    if (registry instanceof PrometheusMeterRegistry prometheusRegistry) {
      new PrometheusHandler(prometheusRegistry).registerRoutes(router);
    }

    return new MicrometerReporter(registry);
  }
}
