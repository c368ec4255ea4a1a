package io.github.themoah.hoverlog.api;

import io.github.themoah.hoverlog.analyzer.AnalysisCancelledException;
import io.github.themoah.hoverlog.analyzer.CancellationToken;
import io.github.themoah.hoverlog.model.AnalysisResult;
import io.github.themoah.hoverlog.model.ValidationException;
import io.github.themoah.hoverlog.service.LogQueryRequest;
import io.github.themoah.hoverlog.service.LogQueryService;
import io.vertx.core.AsyncResult;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP handler for the {@code POST /query_logs} endpoint.
 */
public class QueryLogsHandler {

  private static final Logger log = LoggerFactory.getLogger(QueryLogsHandler.class);

  static final String PATH = "/query_logs";
  private static final String CONTENT_TYPE_JSON = "application/json";
  private static final long MAX_BODY_BYTES = 64 * 1024;

  private final Vertx vertx;
  private final LogQueryService service;
  private final long requestTimeoutMs;

  public QueryLogsHandler(Vertx vertx, LogQueryService service, long requestTimeoutMs) {
    this.vertx = vertx;
    this.service = service;
    this.requestTimeoutMs = requestTimeoutMs;
  }

  /**
   * Registers the query route on the router. Other methods on the path get a 405.
   *
   * @param router the Vert.x router
   */
  public void registerRoutes(Router router) {
    router.post(PATH)
      .handler(BodyHandler.create().setBodyLimit(MAX_BODY_BYTES))
      .handler(this::handleQueryLogs);
    router.route(PATH).handler(this::handleMethodNotAllowed);
    log.info("Query route registered: POST {}", PATH);
  }

  private void handleQueryLogs(RoutingContext ctx) {
    LogQueryRequest request;
    try {
      request = QueryLogsCodec.decodeRequest(readJson(ctx));
    } catch (ValidationException e) {
      log.info("Rejected malformed log query: {}", e.getMessage());
      writeJson(ctx, 400, ErrorResponse.validation(e).toJson());
      return;
    }

    log.info("Processing log query - org: {}, dashboard: {}, panel: {}, metric: {}, time range: {} to {}",
      request.org(), request.dashboard(), request.panelTitle(), request.metricName(),
      request.startTime(), request.endTime());

    CancellationToken token = CancellationToken.withDeadline(vertx, requestTimeoutMs);
    ctx.response().closeHandler(v -> {
      if (token.cancel("client connection closed")) {
        log.info("Client disconnected before the log query completed");
      }
    });

    service.queryLogs(request, token)
      .onComplete(ar -> {
        token.release();
        respond(ctx, ar);
      });
  }

  private void respond(RoutingContext ctx, AsyncResult<AnalysisResult> ar) {
    HttpServerResponse response = ctx.response();
    if (response.closed() || response.ended()) {
      return;
    }
    if (ar.succeeded()) {
      if (ar.result().isDegraded()) {
        log.info("Serving {} placeholder log groups", ar.result().logGroups().size());
      }
      writeJson(ctx, 200, QueryLogsCodec.encodeResult(ar.result()));
      return;
    }

    Throwable err = ar.cause();
    if (err instanceof ValidationException validation) {
      writeJson(ctx, 400, ErrorResponse.validation(validation).toJson());
    } else if (err instanceof AnalysisCancelledException) {
      writeJson(ctx, 504, ErrorResponse.cancelled(err.getMessage()).toJson());
    } else {
      log.error("Unexpected failure while serving log query", err);
      writeJson(ctx, 500, new ErrorResponse("Internal error", String.valueOf(err.getMessage()), 500, null).toJson());
    }
  }

  private void handleMethodNotAllowed(RoutingContext ctx) {
    writeJson(ctx, 405, new ErrorResponse("Method not allowed", "Only POST is allowed", 405, null).toJson());
  }

  private static JsonObject readJson(RoutingContext ctx) {
    try {
      return ctx.body().asJsonObject();
    } catch (RuntimeException e) {
      throw new ValidationException(ValidationException.Category.MALFORMED_REQUEST,
        "Request body is not valid JSON: " + e.getMessage());
    }
  }

  private static void writeJson(RoutingContext ctx, int status, JsonObject body) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(status)
      .end(body.encode());
  }
}
