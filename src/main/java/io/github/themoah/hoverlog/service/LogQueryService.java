package io.github.themoah.hoverlog.service;

import io.github.themoah.hoverlog.analyzer.AnalysisCancelledException;
import io.github.themoah.hoverlog.analyzer.AnomalyAnalyzer;
import io.github.themoah.hoverlog.analyzer.CancellationToken;
import io.github.themoah.hoverlog.metrics.AnalysisOutcome;
import io.github.themoah.hoverlog.metrics.MetricsReporter;
import io.github.themoah.hoverlog.model.AnalysisResult;
import io.github.themoah.hoverlog.model.Identity;
import io.github.themoah.hoverlog.model.TimeWindow;
import io.github.themoah.hoverlog.model.ValidationException;
import io.github.themoah.hoverlog.resilience.FallbackCategory;
import io.github.themoah.hoverlog.resilience.ResilienceClassifier;
import io.vertx.core.Future;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Boundary of the analysis: validates the request, runs the analyzer and degrades every
 * failure except validation and cancellation into a marked fallback result.
 */
public class LogQueryService {

  private static final Logger log = LoggerFactory.getLogger(LogQueryService.class);

  private final AnomalyAnalyzer analyzer;
  private final ResilienceClassifier resilienceClassifier;
  private final MetricsReporter metricsReporter;

  public LogQueryService(
      AnomalyAnalyzer analyzer,
      ResilienceClassifier resilienceClassifier,
      MetricsReporter metricsReporter
  ) {
    this.analyzer = Objects.requireNonNull(analyzer, "analyzer cannot be null");
    this.resilienceClassifier = Objects.requireNonNull(resilienceClassifier, "resilienceClassifier cannot be null");
    this.metricsReporter = Objects.requireNonNull(metricsReporter, "metricsReporter cannot be null");
  }

  /**
   * Runs a log query.
   *
   * @param request raw query parameters
   * @param token cancellation signal of the request
   * @return Future with the result; fails only with {@link ValidationException} or
   *     {@link AnalysisCancelledException}
   */
  public Future<AnalysisResult> queryLogs(LogQueryRequest request, CancellationToken token) {
    long startNanos = System.nanoTime();

    Identity identity;
    TimeWindow window;
    try {
      identity = request.identity();
      window = request.window();
    } catch (ValidationException e) {
      log.info("Rejected log query: {}", e.getMessage());
      record(AnalysisOutcome.REJECTED, startNanos, 0);
      return Future.failedFuture(e);
    }

    Future<AnalysisResult> analysis;
    try {
      analysis = analyzer.analyze(identity, window, token);
    } catch (RuntimeException e) {
      analysis = Future.failedFuture(e);
    }

    return analysis.compose(
      result -> {
        record(AnalysisOutcome.SUCCESS, startNanos, result.logGroups().size());
        return Future.succeededFuture(result);
      },
      err -> {
        if (token.isCancelled() || err instanceof AnalysisCancelledException) {
          log.info("Log query cancelled: {}", err.getMessage());
          record(AnalysisOutcome.CANCELLED, startNanos, 0);
          return Future.failedFuture(token.isCancelled() ? token.cause() : err);
        }
        log.error("Error analyzing logs: {}", err.getMessage(), err);
        FallbackCategory category = resilienceClassifier.classify(err);
        AnalysisResult fallback = resilienceClassifier.fallbackFor(err);
        record(AnalysisOutcome.degraded(category), startNanos, fallback.logGroups().size());
        return Future.succeededFuture(fallback);
      }
    );
  }

  private void record(AnalysisOutcome outcome, long startNanos, int logGroups) {
    metricsReporter.recordAnalysis(outcome, Duration.ofNanos(System.nanoTime() - startNanos), logGroups);
  }
}
