package io.github.themoah.hoverlog.analyzer;

/**
 * Signals that an analysis was cancelled by its caller or ran past its deadline.
 * Distinct from storage failures: it is never converted into fallback data.
 */
public class AnalysisCancelledException extends RuntimeException {

  public AnalysisCancelledException(String message) {
    super(message);
  }
}
