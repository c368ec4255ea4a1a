package io.github.themoah.hoverlog.analyzer;

import io.github.themoah.hoverlog.analyzer.DistributionModel.Distribution;
import io.github.themoah.hoverlog.model.TemplateCounts;
import io.github.themoah.hoverlog.model.TemplateScore;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Scores every template by its pointwise forward KL contribution (current relative to
 * baseline) and by its relative frequency change.
 */
public final class DivergenceEngine {

  private final DistributionModel distributionModel;

  public DivergenceEngine(double smoothing) {
    this(new DistributionModel(smoothing));
  }

  public DivergenceEngine(DistributionModel distributionModel) {
    this.distributionModel = distributionModel;
  }

  /**
   * Scores the union of template IDs of both windows.
   *
   * @param current counts of the current window
   * @param baseline counts of the baseline window
   * @return scores keyed by template ID in ascending ID order, empty if either window is empty
   */
  public Map<String, TemplateScore> score(TemplateCounts current, TemplateCounts baseline) {
    long currentTotal = current.total();
    long baselineTotal = baseline.total();
    if (currentTotal == 0L || baselineTotal == 0L) {
      return Map.of();
    }

    SortedSet<String> universe = new TreeSet<>(current.templateIds());
    universe.addAll(baseline.templateIds());

    Distribution pCurrent = distributionModel.probabilities(current, universe.size());
    Distribution pBaseline = distributionModel.probabilities(baseline, universe.size());
    double smoothing = distributionModel.smoothing();

    Map<String, TemplateScore> scores = new LinkedHashMap<>();
    for (String templateId : universe) {
      double pc = pCurrent.probability(templateId);
      double pb = pBaseline.probability(templateId);
      double kl = pc * Math.log(pc / pb);

      double freqCurrent = (double) current.count(templateId) / currentTotal;
      double freqBaseline = (double) baseline.count(templateId) / baselineTotal;
      double relativeChange = (freqCurrent - freqBaseline) / (freqBaseline + smoothing);

      scores.put(templateId, new TemplateScore(templateId, kl, relativeChange));
    }
    return Collections.unmodifiableMap(scores);
  }
}
