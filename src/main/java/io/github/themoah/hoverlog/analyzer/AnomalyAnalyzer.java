package io.github.themoah.hoverlog.analyzer;

import io.github.themoah.hoverlog.model.AnalysisResult;
import io.github.themoah.hoverlog.model.Identity;
import io.github.themoah.hoverlog.model.LogGroup;
import io.github.themoah.hoverlog.model.TemplateCounts;
import io.github.themoah.hoverlog.model.TemplateScore;
import io.github.themoah.hoverlog.model.TimeWindow;
import io.github.themoah.hoverlog.store.TemplateStore;
import io.vertx.core.Future;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the log templates whose share shifted the most between a window and its baseline.
 *
 * <p>Algorithm:
 * <ol>
 *   <li>Plan the baseline window (same duration, immediately before the current one)</li>
 *   <li>Fetch template counts for both windows concurrently</li>
 *   <li>Score every template by KL contribution and relative change</li>
 *   <li>Keep the top templates by KL contribution</li>
 *   <li>Fetch representative logs for those templates only</li>
 * </ol>
 *
 * <p>Store failures are returned as failed futures untouched; converting them into
 * fallback data is the caller's job.
 */
public class AnomalyAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(AnomalyAnalyzer.class);

  private final TemplateStore store;
  private final WindowPlanner windowPlanner;
  private final DivergenceEngine divergenceEngine;
  private final Ranker ranker;
  private final int topK;

  public AnomalyAnalyzer(TemplateStore store, double smoothing, int topK) {
    this(store, new WindowPlanner(), new DivergenceEngine(smoothing), new Ranker(), topK);
  }

  public AnomalyAnalyzer(
      TemplateStore store,
      WindowPlanner windowPlanner,
      DivergenceEngine divergenceEngine,
      Ranker ranker,
      int topK
  ) {
    this.store = Objects.requireNonNull(store, "store cannot be null");
    this.windowPlanner = Objects.requireNonNull(windowPlanner, "windowPlanner cannot be null");
    this.divergenceEngine = Objects.requireNonNull(divergenceEngine, "divergenceEngine cannot be null");
    this.ranker = Objects.requireNonNull(ranker, "ranker cannot be null");
    if (topK <= 0) {
      throw new IllegalArgumentException("topK must be positive, got " + topK);
    }
    this.topK = topK;
  }

  /**
   * Analyzes the window for anomalous templates.
   *
   * @param identity query scope
   * @param current the window to analyze
   * @param token cancellation signal of the calling request
   * @return Future containing the ranked log groups
   */
  public Future<AnalysisResult> analyze(Identity identity, TimeWindow current, CancellationToken token) {
    TimeWindow baseline = windowPlanner.plan(current);

    log.info("Analyzing logs - org: {}, dashboard: {}, panel: {}, metric: {}, current: {} to {}, baseline: {} to {}",
      identity.org(), identity.dashboard(), identity.panelTitle(), identity.metricName(),
      current.start(), current.end(), baseline.start(), baseline.end());

    Future<TemplateCounts> currentCounts =
      token.guard(() -> store.fetchTemplateCounts(identity, current, token));
    Future<TemplateCounts> baselineCounts =
      token.guard(() -> store.fetchTemplateCounts(identity, baseline, token));

    return Future.all(currentCounts, baselineCounts)
      .compose(composite -> {
        TemplateCounts currentResult = composite.resultAt(0);
        TemplateCounts baselineResult = composite.resultAt(1);
        log.debug("Found {} current templates, {} baseline templates",
          currentResult.size(), baselineResult.size());
        return rankAndDescribe(identity, currentResult, baselineResult, token);
      });
  }

  private Future<AnalysisResult> rankAndDescribe(
      Identity identity,
      TemplateCounts current,
      TemplateCounts baseline,
      CancellationToken token
  ) {
    Map<String, TemplateScore> scores = divergenceEngine.score(current, baseline);
    List<String> selected = ranker.topK(scores, topK);

    if (selected.isEmpty()) {
      log.info("No templates found with significant KL divergence");
      return Future.succeededFuture(AnalysisResult.empty());
    }

    return token.guard(() -> store.fetchRepresentativeLogs(identity, new LinkedHashSet<>(selected), token))
      .map(representatives -> assemble(selected, scores, representatives));
  }

  static AnalysisResult assemble(
      List<String> selected,
      Map<String, TemplateScore> scores,
      Map<String, List<String>> representatives
  ) {
    List<LogGroup> groups = new ArrayList<>(selected.size());
    for (String templateId : selected) {
      List<String> logs = representatives.get(templateId);
      if (logs == null || logs.isEmpty()) {
        log.debug("Dropping template {}: no representative logs stored", templateId);
        continue;
      }
      TemplateScore score = scores.get(templateId);
      groups.add(new LogGroup(templateId, logs, score.relativeChange(), score.klContribution()));
    }
    log.info("Returning {} log groups", groups.size());
    return new AnalysisResult(groups);
  }
}
