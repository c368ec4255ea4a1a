package io.github.themoah.hoverlog.store;

import io.github.themoah.hoverlog.analyzer.CancellationToken;
import io.github.themoah.hoverlog.model.Identity;
import io.github.themoah.hoverlog.model.TemplateCounts;
import io.github.themoah.hoverlog.model.TimeWindow;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.jdbcclient.JDBCConnectOptions;
import io.vertx.jdbcclient.JDBCPool;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.PoolOptions;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.Tuple;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implementation of TemplateStore on a pooled Vert.x JDBC client against ClickHouse.
 */
public class ClickHouseTemplateStore implements TemplateStore {

  private static final Logger log = LoggerFactory.getLogger(ClickHouseTemplateStore.class);

  static final String COUNTS_QUERY =
      "SELECT template_id, toInt64(count()) AS cnt"
      + " FROM log_template_ids"
      + " WHERE org = ?"
      + " AND dashboard = ?"
      + " AND panel_title = ?"
      + " AND metric_name = ?"
      + " AND timestamp >= ?"
      + " AND timestamp < ?"
      + " GROUP BY template_id";

  static final String REPRESENTATIVES_QUERY_PREFIX =
      "SELECT template_id, argMax(representative_logs, updated_at) AS latest_logs"
      + " FROM log_template_representatives"
      + " WHERE org = ?"
      + " AND dashboard = ?"
      + " AND panel_title = ?"
      + " AND metric_name = ?"
      + " AND template_id IN (";

  /** One row per template: the representative set with the latest updated_at. */
  static final String REPRESENTATIVES_QUERY_SUFFIX = " GROUP BY template_id";

  private final Pool pool;
  private final int representativesMax;
  private final ClickHouseErrorClassifier errorClassifier;

  /**
   * Creates a new ClickHouseTemplateStore with its own connection pool.
   *
   * @param vertx  the Vert.x instance
   * @param config the ClickHouse configuration
   */
  public ClickHouseTemplateStore(Vertx vertx, ClickHouseConfig config) {
    Objects.requireNonNull(vertx, "vertx cannot be null");
    Objects.requireNonNull(config, "config cannot be null");
    log.info("Creating ClickHouse pool for {} (max size {})", config.getJdbcUrl(), config.getPoolMaxSize());

    JDBCConnectOptions connectOptions = new JDBCConnectOptions()
      .setJdbcUrl(config.getJdbcUrl())
      .setUser(config.getUser())
      .setPassword(config.getPassword());
    PoolOptions poolOptions = new PoolOptions().setMaxSize(config.getPoolMaxSize());

    this.pool = JDBCPool.pool(vertx, connectOptions, poolOptions);
    this.representativesMax = config.getRepresentativesMax();
    this.errorClassifier = new ClickHouseErrorClassifier();
  }

  /**
   * Creates a new ClickHouseTemplateStore over an existing pool (for testing).
   */
  ClickHouseTemplateStore(Pool pool, int representativesMax, ClickHouseErrorClassifier errorClassifier) {
    this.pool = Objects.requireNonNull(pool, "pool cannot be null");
    this.representativesMax = representativesMax;
    this.errorClassifier = Objects.requireNonNull(errorClassifier, "errorClassifier cannot be null");
  }

  /**
   * Returns the underlying pool, shared with schema provisioning.
   */
  public Pool getPool() {
    return pool;
  }

  public ClickHouseErrorClassifier getErrorClassifier() {
    return errorClassifier;
  }

  @Override
  public Future<TemplateCounts> fetchTemplateCounts(Identity identity, TimeWindow window, CancellationToken token) {
    if (token.isCancelled()) {
      return Future.failedFuture(token.cause());
    }
    log.debug("Fetching template counts for {} in [{}, {})", identity, window.start(), window.end());

    Tuple params = Tuple.of(
      identity.org(),
      identity.dashboard(),
      identity.panelTitle(),
      identity.metricName(),
      toUtc(window.start()),
      toUtc(window.end())
    );

    return pool.preparedQuery(COUNTS_QUERY)
      .execute(params)
      .map(rows -> {
        Map<String, Long> counts = new HashMap<>();
        for (Row row : rows) {
          counts.merge(row.getString(0), row.getLong(1), Long::sum);
        }
        log.debug("Retrieved {} template counts", counts.size());
        return TemplateCounts.of(counts);
      })
      .recover(err -> Future.failedFuture(errorClassifier.classify(err, "Query log_template_ids")))
      .onFailure(err -> log.error("Failed to fetch template counts: {}", err.getMessage()));
  }

  @Override
  public Future<Map<String, List<String>>> fetchRepresentativeLogs(
      Identity identity,
      Set<String> templateIds,
      CancellationToken token
  ) {
    if (templateIds == null || templateIds.isEmpty()) {
      return Future.succeededFuture(Map.of());
    }
    if (token.isCancelled()) {
      return Future.failedFuture(token.cause());
    }
    log.debug("Fetching representative logs for {} templates", templateIds.size());

    List<Object> values = new ArrayList<>(4 + templateIds.size());
    values.add(identity.org());
    values.add(identity.dashboard());
    values.add(identity.panelTitle());
    values.add(identity.metricName());
    values.addAll(templateIds);

    return pool.preparedQuery(representativesQuery(templateIds.size()))
      .execute(Tuple.wrap(values))
      .map(rows -> {
        Map<String, List<String>> representatives = new HashMap<>();
        for (Row row : rows) {
          List<String> logs = toLogLines(row.getValue(1), representativesMax);
          if (!logs.isEmpty()) {
            representatives.putIfAbsent(row.getString(0), logs);
          }
        }
        log.debug("Retrieved representative logs for {} templates", representatives.size());
        return Collections.unmodifiableMap(representatives);
      })
      .recover(err -> Future.failedFuture(errorClassifier.classify(err, "Query log_template_representatives")))
      .onFailure(err -> log.error("Failed to fetch representative logs: {}", err.getMessage()));
  }

  @Override
  public Future<Void> ping() {
    return pool.query("SELECT 1")
      .execute()
      .<Void>mapEmpty()
      .recover(err -> Future.failedFuture(errorClassifier.classify(err, "Ping")));
  }

  @Override
  public Future<Void> close() {
    log.info("Closing ClickHouse pool");
    return pool.close()
      .onSuccess(v -> log.info("ClickHouse pool closed"))
      .onFailure(err -> log.error("Failed to close ClickHouse pool", err));
  }

  static String representativesQuery(int idCount) {
    String placeholders = String.join(", ", Collections.nCopies(idCount, "?"));
    return REPRESENTATIVES_QUERY_PREFIX + placeholders + ")" + REPRESENTATIVES_QUERY_SUFFIX;
  }

  /**
   * Normalizes the driver's representation of an {@code Array(String)} column.
   */
  static List<String> toLogLines(Object value, int limit) {
    List<String> lines = new ArrayList<>();
    if (value == null) {
      return lines;
    }
    if (value instanceof Object[] array) {
      for (Object item : array) {
        addLine(lines, item, limit);
      }
    } else if (value instanceof Iterable<?> iterable) {
      for (Object item : iterable) {
        addLine(lines, item, limit);
      }
    } else {
      addLine(lines, value, limit);
    }
    return lines;
  }

  private static void addLine(List<String> lines, Object item, int limit) {
    if (item != null && lines.size() < limit) {
      lines.add(item.toString());
    }
  }

  private static OffsetDateTime toUtc(Instant instant) {
    return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
  }
}
