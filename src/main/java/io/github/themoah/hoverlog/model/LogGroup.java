package io.github.themoah.hoverlog.model;

import java.util.List;

/**
 * A ranked template together with example log lines.
 *
 * @param templateId template ID, or a reserved ID for synthetic groups
 * @param representativeLogs example log lines in store order
 * @param relativeChange relative frequency change against the baseline
 * @param klContribution pointwise KL term used for ranking
 */
public record LogGroup(
  String templateId,
  List<String> representativeLogs,
  double relativeChange,
  double klContribution
) {

  /** Template ID used by synthetic error groups. */
  public static final String ERROR_TEMPLATE_ID = "error";

  /** Prefix of template IDs used by synthetic example groups. */
  public static final String MOCK_TEMPLATE_PREFIX = "mock_";

  public LogGroup {
    representativeLogs = List.copyOf(representativeLogs);
  }

  /**
   * Returns true if this group is degraded-mode output rather than a real finding.
   */
  public boolean isPlaceholder() {
    return ERROR_TEMPLATE_ID.equals(templateId)
      || (templateId != null && templateId.startsWith(MOCK_TEMPLATE_PREFIX));
  }
}
