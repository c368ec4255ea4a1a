package io.github.themoah.hoverlog.resilience;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.hoverlog.model.AnalysisResult;
import io.github.themoah.hoverlog.model.LogGroup;
import io.github.themoah.hoverlog.store.StorageException;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ResilienceClassifier.
 */
public class ResilienceClassifierTest {

  private final ResilienceClassifier classifier = new ResilienceClassifier();

  private static void assertMarked(AnalysisResult result) {
    assertTrue(result.isDegraded());
    for (LogGroup group : result.logGroups()) {
      assertTrue(group.isPlaceholder(), "unexpected template id " + group.templateId());
      for (String line : group.representativeLogs()) {
        assertTrue(line.startsWith(ResilienceClassifier.MOCK_MARKER)
          || line.startsWith(ResilienceClassifier.ERROR_MARKER), "unmarked line: " + line);
      }
    }
  }

  @Test
  void classify_byStorageKind() {
    assertEquals(FallbackCategory.CONNECTIVITY,
      classifier.classify(StorageException.unavailable("refused", null)));
    assertEquals(FallbackCategory.SCHEMA_MISSING,
      classifier.classify(StorageException.schemaMissing("missing", null)));
    assertEquals(FallbackCategory.UNCLASSIFIED,
      classifier.classify(StorageException.unclassified("syntax", null)));
  }

  @Test
  void classify_findsStorageErrorInCauseChain() {
    Throwable wrapped = new CompletionException(StorageException.unavailable("refused", null));

    assertEquals(FallbackCategory.CONNECTIVITY, classifier.classify(wrapped));
  }

  @Test
  void classify_nonStorageErrorIsUnclassified() {
    assertEquals(FallbackCategory.UNCLASSIFIED,
      classifier.classify(new IllegalStateException("connection refused")));
  }

  @Test
  void connectivityFallback_threeMockGroups() {
    AnalysisResult result = classifier.fallbackFor(StorageException.unavailable("refused", null));

    List<String> ids = result.logGroups().stream().map(LogGroup::templateId).collect(Collectors.toList());
    assertEquals(List.of("mock_error_template", "mock_warning_template", "mock_info_template"), ids);
    assertEquals(4, result.logGroups().get(0).representativeLogs().size());
    assertEquals(2.5, result.logGroups().get(0).relativeChange());
    assertEquals(0.8, result.logGroups().get(0).klContribution());
    assertMarked(result);
  }

  @Test
  void schemaMissingFallback_singleErrorGroup() {
    AnalysisResult result = classifier.fallbackFor(StorageException.schemaMissing("missing", null));

    assertEquals(1, result.logGroups().size());
    LogGroup group = result.logGroups().get(0);
    assertEquals(LogGroup.ERROR_TEMPLATE_ID, group.templateId());
    assertEquals(0.0, group.relativeChange());
    assertTrue(group.representativeLogs().get(0).contains("Required tables missing"));
    assertMarked(result);
  }

  @Test
  void unclassifiedFallback_carriesErrorDetails() {
    AnalysisResult result = classifier.fallbackFor(StorageException.unclassified("Syntax error at position 12", null));

    LogGroup group = result.logGroups().get(0);
    assertEquals(LogGroup.ERROR_TEMPLATE_ID, group.templateId());
    assertEquals(List.of(
      "[ERROR] Hover log database encountered an error. Please contact support.",
      "[ERROR] Error details: Syntax error at position 12"
    ), group.representativeLogs());
    assertMarked(result);
  }

  @Test
  void unclassifiedFallback_messagelessErrorUsesTypeName() {
    AnalysisResult result = classifier.fallbackFor(new NullPointerException());

    assertEquals("[ERROR] Error details: NullPointerException",
      result.logGroups().get(0).representativeLogs().get(1));
  }
}
