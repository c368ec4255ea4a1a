package io.github.themoah.hoverlog.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.hoverlog.analyzer.AnomalyAnalyzer;
import io.github.themoah.hoverlog.analyzer.CancellationToken;
import io.github.themoah.hoverlog.metrics.MetricsReporter;
import io.github.themoah.hoverlog.model.TemplateCounts;
import io.github.themoah.hoverlog.model.TimeWindow;
import io.github.themoah.hoverlog.resilience.ResilienceClassifier;
import io.github.themoah.hoverlog.service.LogQueryService;
import io.github.themoah.hoverlog.store.FakeTemplateStore;
import io.github.themoah.hoverlog.store.StorageException;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpClient;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * HTTP-level tests for QueryLogsHandler against an in-memory store.
 */
@ExtendWith(VertxExtension.class)
public class QueryLogsHandlerTest {

  private static final Instant T0 = Instant.parse("2026-10-19T10:00:00Z");

  private HttpServer server;
  private HttpClient client;

  @AfterEach
  void tearDown() {
    if (client != null) {
      client.close();
    }
    if (server != null) {
      server.close();
    }
  }

  private Future<Integer> start(Vertx vertx, FakeTemplateStore store, long timeoutMs) {
    LogQueryService service = new LogQueryService(
      new AnomalyAnalyzer(store, 1e-10, 10), new ResilienceClassifier(), MetricsReporter.noop());
    Router router = Router.router(vertx);
    new QueryLogsHandler(vertx, service, timeoutMs).registerRoutes(router);
    client = vertx.createHttpClient();
    return vertx.createHttpServer()
      .requestHandler(router)
      .listen(0, "127.0.0.1")
      .map(s -> {
        server = s;
        return s.actualPort();
      });
  }

  private Future<HttpClientResponse> send(int port, HttpMethod method, String body, Promise<Buffer> bodyOut) {
    return client.request(method, port, "127.0.0.1", QueryLogsHandler.PATH)
      .compose(req -> req.putHeader("Content-Type", "application/json").send(body))
      .onSuccess(resp -> resp.body().onComplete(bodyOut));
  }

  private static String query(Instant start, Instant end) {
    return new JsonObject()
      .put("org", "acme")
      .put("dashboard", "checkout")
      .put("panel_title", "Latency p99")
      .put("metric_name", "http_latency")
      .put("start_time", start.toString())
      .put("end_time", end.toString())
      .encode();
  }

  @Test
  void validQuery_returnsLogGroups(Vertx vertx, VertxTestContext testContext) {
    FakeTemplateStore store = new FakeTemplateStore()
      .withCounts(new TimeWindow(T0.minusSeconds(600), T0), Map.of("A", 100L))
      .withCounts(new TimeWindow(T0, T0.plusSeconds(600)), Map.of("A", 90L, "N", 10L))
      .withRepresentatives("N", "OutOfMemoryError on worker-7")
      .withRepresentatives("A", "GET /health 200");
    Promise<Buffer> body = Promise.promise();

    start(vertx, store, 5_000)
      .compose(port -> send(port, HttpMethod.POST, query(T0, T0.plusSeconds(600)), body))
      .onComplete(testContext.succeeding(resp -> body.future().onComplete(testContext.succeeding(buf ->
        testContext.verify(() -> {
          assertEquals(200, resp.statusCode());
          JsonArray groups = buf.toJsonObject().getJsonArray("log_groups");
          assertEquals(2, groups.size());
          assertEquals("OutOfMemoryError on worker-7",
            groups.getJsonObject(0).getJsonArray("representative_logs").getString(0));
          assertTrue(groups.getJsonObject(0).getDouble("relative_change") > 1e6);
          testContext.completeNow();
        })))));
  }

  @Test
  void emptyTimeRange_badRequest(Vertx vertx, VertxTestContext testContext) {
    FakeTemplateStore store = new FakeTemplateStore();
    Promise<Buffer> body = Promise.promise();

    start(vertx, store, 5_000)
      .compose(port -> send(port, HttpMethod.POST, query(T0, T0), body))
      .onComplete(testContext.succeeding(resp -> body.future().onComplete(testContext.succeeding(buf ->
        testContext.verify(() -> {
          assertEquals(400, resp.statusCode());
          JsonObject json = buf.toJsonObject();
          assertEquals("Invalid time range", json.getString("error"));
          assertEquals("invalid_time_range", json.getString("category"));
          assertEquals(0, store.countCalls());
          testContext.completeNow();
        })))));
  }

  @Test
  void invalidJson_badRequest(Vertx vertx, VertxTestContext testContext) {
    Promise<Buffer> body = Promise.promise();

    start(vertx, new FakeTemplateStore(), 5_000)
      .compose(port -> send(port, HttpMethod.POST, "{not json", body))
      .onComplete(testContext.succeeding(resp -> body.future().onComplete(testContext.succeeding(buf ->
        testContext.verify(() -> {
          assertEquals(400, resp.statusCode());
          assertEquals("malformed_request", buf.toJsonObject().getString("category"));
          testContext.completeNow();
        })))));
  }

  @Test
  void unreachableStore_degradedOk(Vertx vertx, VertxTestContext testContext) {
    FakeTemplateStore store = new FakeTemplateStore()
      .failCountsWith(StorageException.unavailable("Connection refused", null));
    Promise<Buffer> body = Promise.promise();

    start(vertx, store, 5_000)
      .compose(port -> send(port, HttpMethod.POST, query(T0, T0.plusSeconds(600)), body))
      .onComplete(testContext.succeeding(resp -> body.future().onComplete(testContext.succeeding(buf ->
        testContext.verify(() -> {
          assertEquals(200, resp.statusCode());
          JsonArray groups = buf.toJsonObject().getJsonArray("log_groups");
          assertEquals(3, groups.size());
          assertTrue(groups.getJsonObject(0).getJsonArray("representative_logs").getString(0)
            .startsWith(ResilienceClassifier.MOCK_MARKER));
          testContext.completeNow();
        })))));
  }

  @Test
  void deadlineExceeded_gatewayTimeout(Vertx vertx, VertxTestContext testContext) {
    Promise<TemplateCounts> never = Promise.promise();
    FakeTemplateStore store = new FakeTemplateStore().hangCounts(never.future());
    Promise<Buffer> body = Promise.promise();

    start(vertx, store, 100)
      .compose(port -> send(port, HttpMethod.POST, query(T0, T0.plusSeconds(600)), body))
      .onComplete(testContext.succeeding(resp -> body.future().onComplete(testContext.succeeding(buf ->
        testContext.verify(() -> {
          assertEquals(504, resp.statusCode());
          assertEquals("cancelled", buf.toJsonObject().getString("category"));
          testContext.completeNow();
        })))));
  }

  @Test
  void clientDisconnect_cancelsAnalysisWithoutResponse(Vertx vertx, VertxTestContext testContext) {
    Promise<TemplateCounts> never = Promise.promise();
    FakeTemplateStore store = new FakeTemplateStore().hangCounts(never.future());
    AtomicBoolean disconnected = new AtomicBoolean();

    start(vertx, store, 60_000)
      .compose(port -> client.request(HttpMethod.POST, port, "127.0.0.1", QueryLogsHandler.PATH))
      .onComplete(testContext.succeeding(req -> {
        req.response().onSuccess(resp ->
          testContext.failNow(new AssertionError("Unexpected response " + resp.statusCode())));
        req.putHeader("Content-Type", "application/json").end(query(T0, T0.plusSeconds(600)));

        vertx.setPeriodic(20, timerId -> {
          CancellationToken token = store.lastToken();
          if (token == null) {
            return;
          }
          if (disconnected.compareAndSet(false, true)) {
            req.connection().close();
            return;
          }
          if (!token.isCancelled()) {
            return;
          }
          vertx.cancelTimer(timerId);
          testContext.verify(() -> {
            assertTrue(token.cause().getMessage().contains("client connection closed"));
            assertFalse(never.future().isComplete());
            assertEquals(2, store.countCalls());
            assertTrue(store.representativeRequests().isEmpty());
          });
          vertx.setTimer(200, id -> testContext.completeNow());
        });
      }));
  }

  @Test
  void otherMethod_notAllowed(Vertx vertx, VertxTestContext testContext) {
    Promise<Buffer> body = Promise.promise();

    start(vertx, new FakeTemplateStore(), 5_000)
      .compose(port -> send(port, HttpMethod.GET, "", body))
      .onComplete(testContext.succeeding(resp -> testContext.verify(() -> {
        assertEquals(405, resp.statusCode());
        testContext.completeNow();
      })));
  }
}
