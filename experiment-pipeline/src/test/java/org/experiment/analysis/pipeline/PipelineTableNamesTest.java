package org.experiment.analysis.pipeline;

import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class PipelineTableNamesTest {

  @Test
  void testValidIdsAreKept() {
    Assertions.assertEquals(
        "exp_pipeline_exp_checkout_snp_1", PipelineTableNames.unitsTable("exp_checkout", "snp_1"));
    Assertions.assertEquals(
        "exp_pipeline_exp_checkout_snp_1_metrics",
        PipelineTableNames.metricsTable("exp_pipeline_exp_checkout_snp_1"));
  }

  @Test
  void testSanitizedIdsGetHash() {
    String name = PipelineTableNames.unitsTable("Exp-Checkout.v2", "snp_1");

    Assertions.assertTrue(name.startsWith("exp_pipeline_exp_checkout_v2_snp_1_"));
    Assertions.assertEquals("exp_pipeline_exp_checkout_v2_snp_1".length() + 9, name.length());
    Assertions.assertTrue(name.matches("[a-z0-9_]+"));
    Assertions.assertEquals(name, PipelineTableNames.unitsTable("Exp-Checkout.v2", "snp_1"));
  }

  @Test
  void testIdsDifferingOnlyInCaseOrPunctuationDoNotShareTables() {
    Set<String> names =
        Set.of("exp-1", "exp_1", "Exp_1", "exp.1").stream()
            .map(id -> PipelineTableNames.unitsTable(id, "incremental"))
            .collect(Collectors.toSet());

    Assertions.assertEquals(4, names.size());
    Assertions.assertTrue(names.contains("exp_pipeline_exp_1_incremental"));
  }

  @Test
  void testLongIdsAreTruncatedWithHash() {
    String experimentId = "exp_" + "a".repeat(80);
    String first = PipelineTableNames.unitsTable(experimentId, "snp_1");
    String second = PipelineTableNames.unitsTable(experimentId, "snp_2");

    Assertions.assertEquals(PipelineTableNames.MAX_UNITS_TABLE_LENGTH, first.length());
    Assertions.assertTrue(first.startsWith(PipelineTableNames.PREFIX));
    Assertions.assertTrue(first.matches("[a-z0-9_]+"));
    Assertions.assertNotEquals(first, second);
    Assertions.assertEquals(first, PipelineTableNames.unitsTable(experimentId, "snp_1"));
    Assertions.assertTrue(
        PipelineTableNames.metricsTable(first).length()
            <= PipelineTableNames.MAX_IDENTIFIER_LENGTH);
  }
}
