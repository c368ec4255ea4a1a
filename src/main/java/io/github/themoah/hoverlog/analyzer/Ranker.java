package io.github.themoah.hoverlog.analyzer;

import io.github.themoah.hoverlog.model.TemplateScore;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Orders templates by KL contribution (highest first) and keeps the top {@code k}.
 * Equal contributions are ordered by template ID so the ranking is reproducible.
 */
public final class Ranker {

  static final Comparator<TemplateScore> RANKING = Comparator
    .comparingDouble(TemplateScore::klContribution).reversed()
    .thenComparing(TemplateScore::templateId);

  public List<String> topK(Map<String, TemplateScore> scores, int k) {
    if (k <= 0) {
      throw new IllegalArgumentException("k must be positive, got " + k);
    }
    return scores.values().stream()
      .sorted(RANKING)
      .limit(k)
      .map(TemplateScore::templateId)
      .collect(Collectors.toList());
  }
}
