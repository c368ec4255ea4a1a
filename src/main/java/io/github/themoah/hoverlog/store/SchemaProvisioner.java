package io.github.themoah.hoverlog.store;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.sqlclient.Pool;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that the required ClickHouse tables exist and creates them from the bundled
 * schema when they are missing.
 */
public class SchemaProvisioner {

  private static final Logger log = LoggerFactory.getLogger(SchemaProvisioner.class);

  static final List<String> REQUIRED_TABLES = List.of("log_template_ids", "log_template_representatives");
  static final String SCHEMA_RESOURCE = "schema/clickhouse_schema.sql";

  private final Vertx vertx;
  private final Pool pool;
  private final ClickHouseErrorClassifier errorClassifier;
  private final boolean autoProvision;

  public SchemaProvisioner(Vertx vertx, Pool pool, ClickHouseErrorClassifier errorClassifier, boolean autoProvision) {
    this.vertx = Objects.requireNonNull(vertx, "vertx cannot be null");
    this.pool = Objects.requireNonNull(pool, "pool cannot be null");
    this.errorClassifier = Objects.requireNonNull(errorClassifier, "errorClassifier cannot be null");
    this.autoProvision = autoProvision;
  }

  /**
   * Verifies the required tables, creating missing ones if auto-provisioning is enabled.
   *
   * @return Future that completes once every required table exists
   */
  public Future<Void> verifyTables() {
    List<String> missing = new ArrayList<>();
    Future<Void> chain = Future.succeededFuture();
    for (String table : REQUIRED_TABLES) {
      chain = chain.compose(v -> tableExists(table).map(exists -> {
        if (exists) {
          log.info("Table '{}' exists", table);
        } else {
          log.warn("Table '{}' does not exist", table);
          missing.add(table);
        }
        return null;
      }));
    }

    return chain.compose(v -> {
      if (missing.isEmpty()) {
        log.info("All required ClickHouse tables exist");
        return Future.succeededFuture();
      }
      if (!autoProvision) {
        return Future.failedFuture(StorageException.schemaMissing(
          "Missing tables " + missing + " and schema auto-provisioning is disabled", null));
      }
      log.info("Missing tables: {}. Creating them now...", missing);
      return createTables().compose(created -> verifyCreated(missing));
    });
  }

  private Future<Boolean> tableExists(String table) {
    return pool.query("SELECT 1 FROM " + table + " LIMIT 0")
      .execute()
      .map(rows -> true)
      .recover(err -> {
        StorageException classified = errorClassifier.classify(err, "Check table '" + table + "'");
        if (classified.getKind() == StorageException.Kind.SCHEMA_MISSING) {
          return Future.succeededFuture(false);
        }
        return Future.failedFuture(classified);
      });
  }

  private Future<Void> createTables() {
    return vertx.executeBlocking(SchemaProvisioner::loadSchema, false)
      .compose(schema -> {
        List<String> statements = splitStatements(schema);
        log.info("Found {} SQL statements in schema", statements.size());

        Future<Void> chain = Future.succeededFuture();
        for (int i = 0; i < statements.size(); i++) {
          int index = i + 1;
          String statement = statements.get(i);
          chain = chain.compose(v -> {
            log.info("Executing SQL statement {} of {}...", index, statements.size());
            return pool.query(statement).execute()
              .<Void>mapEmpty()
              .recover(err -> Future.failedFuture(
                errorClassifier.classify(err, "Schema statement " + index)));
          });
        }
        return chain.onSuccess(v -> log.info("Successfully executed all schema statements"));
      });
  }

  private Future<Void> verifyCreated(List<String> tables) {
    Future<Void> chain = Future.succeededFuture();
    for (String table : tables) {
      chain = chain.compose(v -> tableExists(table).compose(exists -> exists
        ? Future.<Void>succeededFuture()
        : Future.<Void>failedFuture(StorageException.schemaMissing(
            "Table '" + table + "' still missing after creation", null))));
    }
    return chain.onSuccess(v -> log.info("Successfully verified all created tables"));
  }

  static String loadSchema() throws IOException {
    try (InputStream is = SchemaProvisioner.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
      if (is == null) {
        throw new IOException("Resource not found on classpath: " + SCHEMA_RESOURCE);
      }
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  /**
   * Splits a SQL script into statements. Blank lines and {@code --} comment lines are
   * skipped; a statement ends at a line whose trimmed text ends with a semicolon.
   *
   * @param schema the SQL script
   * @return statements without trailing semicolons
   */
  static List<String> splitStatements(String schema) {
    List<String> statements = new ArrayList<>();
    StringBuilder current = new StringBuilder();

    for (String line : schema.split("\\R")) {
      String trimmed = line.strip();
      if (trimmed.isEmpty() || trimmed.startsWith("--")) {
        continue;
      }
      current.append(line).append('\n');
      if (trimmed.endsWith(";")) {
        String statement = current.toString().strip();
        statements.add(statement.substring(0, statement.length() - 1).strip());
        current.setLength(0);
      }
    }

    String rest = current.toString().strip();
    if (!rest.isEmpty()) {
      statements.add(rest);
    }
    return statements;
  }
}
