package io.github.themoah.hoverlog.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for SchemaProvisioner script handling.
 */
public class SchemaProvisionerTest {

  @Test
  void splitStatements_skipsCommentsAndStripsSemicolons() {
    String script = String.join("\n",
      "-- first table",
      "CREATE TABLE a",
      "(",
      "  x String",
      ");",
      "",
      "  -- second",
      "CREATE TABLE b (y UInt8);");

    List<String> statements = SchemaProvisioner.splitStatements(script);

    assertEquals(2, statements.size());
    assertEquals("CREATE TABLE a\n(\n  x String\n)", statements.get(0));
    assertEquals("CREATE TABLE b (y UInt8)", statements.get(1));
  }

  @Test
  void splitStatements_keepsUnterminatedTail() {
    List<String> statements = SchemaProvisioner.splitStatements("SELECT 1;\r\nSELECT 2");

    assertEquals(List.of("SELECT 1", "SELECT 2"), statements);
  }

  @Test
  void bundledSchema_createsEveryRequiredTable() throws Exception {
    List<String> statements = SchemaProvisioner.splitStatements(SchemaProvisioner.loadSchema());

    assertEquals(SchemaProvisioner.REQUIRED_TABLES.size(), statements.size());
    for (int i = 0; i < statements.size(); i++) {
      assertTrue(statements.get(i).startsWith(
        "CREATE TABLE IF NOT EXISTS " + SchemaProvisioner.REQUIRED_TABLES.get(i)));
    }
  }
}
