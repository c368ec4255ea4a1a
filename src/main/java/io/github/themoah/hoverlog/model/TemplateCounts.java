package io.github.themoah.hoverlog.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Occurrence count per template ID within one window for one identity.
 * A missing key means a count of zero.
 */
public record TemplateCounts(Map<String, Long> counts) {

  private static final TemplateCounts EMPTY = new TemplateCounts(Map.of());

  public TemplateCounts {
    Map<String, Long> copy = new HashMap<>();
    for (Map.Entry<String, Long> entry : counts.entrySet()) {
      long value = entry.getValue() == null ? 0L : entry.getValue();
      if (value < 0) {
        throw new IllegalArgumentException(
          "Negative count for template " + entry.getKey() + ": " + value);
      }
      copy.put(entry.getKey(), value);
    }
    counts = Collections.unmodifiableMap(copy);
  }

  public static TemplateCounts empty() {
    return EMPTY;
  }

  public static TemplateCounts of(Map<String, Long> counts) {
    return new TemplateCounts(counts);
  }

  public long count(String templateId) {
    return counts.getOrDefault(templateId, 0L);
  }

  public long total() {
    long total = 0L;
    for (long value : counts.values()) {
      total = Math.addExact(total, value);
    }
    return total;
  }

  public Set<String> templateIds() {
    return counts.keySet();
  }

  public int size() {
    return counts.size();
  }
}
