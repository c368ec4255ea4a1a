package io.github.themoah.hoverlog.store;

import io.github.themoah.hoverlog.analyzer.CancellationToken;
import io.github.themoah.hoverlog.model.Identity;
import io.github.themoah.hoverlog.model.TemplateCounts;
import io.github.themoah.hoverlog.model.TimeWindow;
import io.vertx.core.Future;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Data-access contract for template counts and representative log lines.
 * All methods return Vert.x Futures; failures are {@link StorageException}s.
 */
public interface TemplateStore {

  /**
   * Counts occurrences per template ID within the window, scoped to the identity.
   *
   * @param identity query scope
   * @param window half-open time window
   * @param token cancellation signal of the calling request
   * @return Future containing the counts
   */
  Future<TemplateCounts> fetchTemplateCounts(Identity identity, TimeWindow window, CancellationToken token);

  /**
   * Fetches example log lines for the given templates. Templates without stored examples
   * are absent from the result.
   *
   * @param identity query scope
   * @param templateIds templates to look up
   * @param token cancellation signal of the calling request
   * @return Future containing template ID to ordered example lines
   */
  Future<Map<String, List<String>>> fetchRepresentativeLogs(
    Identity identity,
    Set<String> templateIds,
    CancellationToken token
  );

  /**
   * Lightweight round trip to the store, used for health checks.
   *
   * @return Future that completes when the store answered
   */
  Future<Void> ping();

  /**
   * Releases pooled connections.
   *
   * @return Future that completes when the store is closed
   */
  Future<Void> close();
}
