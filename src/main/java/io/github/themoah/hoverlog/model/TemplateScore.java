package io.github.themoah.hoverlog.model;

/**
 * Divergence score of a single template between the current and baseline windows.
 *
 * @param templateId the template ID
 * @param klContribution pointwise KL term, negative for under-represented templates
 * @param relativeChange relative frequency change against the baseline
 */
public record TemplateScore(
  String templateId,
  double klContribution,
  double relativeChange
) {}
