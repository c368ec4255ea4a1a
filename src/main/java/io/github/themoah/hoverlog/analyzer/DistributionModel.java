package io.github.themoah.hoverlog.analyzer;

import io.github.themoah.hoverlog.model.TemplateCounts;

/**
 * Turns raw template counts into additively smoothed probabilities.
 *
 * <p>{@code p(t) = (count(t) + eps) / (total + eps * universeSize)}, where the universe
 * is the union of template IDs seen in either window. Templates absent from this window
 * still get a non-zero probability.
 */
public final class DistributionModel {

  private final double smoothing;

  public DistributionModel(double smoothing) {
    if (!(smoothing > 0.0) || Double.isInfinite(smoothing)) {
      throw new IllegalArgumentException("smoothing must be a positive finite value, got " + smoothing);
    }
    this.smoothing = smoothing;
  }

  public double smoothing() {
    return smoothing;
  }

  /**
   * Builds the smoothed distribution of a window.
   *
   * @param counts raw counts of the window
   * @param universeSize number of distinct template IDs across both windows
   * @return the distribution, empty when the window has no occurrences
   */
  public Distribution probabilities(TemplateCounts counts, int universeSize) {
    long total = counts.total();
    if (total == 0L) {
      return Distribution.EMPTY;
    }
    int universe = Math.max(universeSize, counts.size());
    double denominator = total + smoothing * universe;
    return new Distribution(counts, smoothing, denominator);
  }

  /**
   * Smoothed probability mass of one window.
   */
  public static final class Distribution {

    static final Distribution EMPTY = new Distribution(TemplateCounts.empty(), 0.0, 0.0);

    private final TemplateCounts counts;
    private final double smoothing;
    private final double denominator;

    private Distribution(TemplateCounts counts, double smoothing, double denominator) {
      this.counts = counts;
      this.smoothing = smoothing;
      this.denominator = denominator;
    }

    public boolean isEmpty() {
      return denominator == 0.0;
    }

    /**
     * Probability of a template, including templates with no occurrences in this window.
     */
    public double probability(String templateId) {
      if (isEmpty()) {
        return 0.0;
      }
      return (counts.count(templateId) + smoothing) / denominator;
    }
  }
}
