package io.github.themoah.hoverlog.model;

import java.util.List;

/**
 * Outcome of one analysis, ordered by descending KL contribution.
 *
 * @param logGroups ranked log groups, possibly empty
 */
public record AnalysisResult(List<LogGroup> logGroups) {

  private static final AnalysisResult EMPTY = new AnalysisResult(List.of());

  public AnalysisResult {
    logGroups = List.copyOf(logGroups);
  }

  public static AnalysisResult empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return logGroups.isEmpty();
  }

  /**
   * Returns true if the result carries only synthetic placeholder groups.
   */
  public boolean isDegraded() {
    return !logGroups.isEmpty() && logGroups.stream().allMatch(LogGroup::isPlaceholder);
  }
}
