package org.experiment.analysis.warehouse.compiler;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SqlTemplatesTest {
  private static final Instant START = Instant.parse("2023-12-25T06:00:00Z");
  private static final Instant END = Instant.parse("2024-01-08T00:00:00Z");

  private final SqlTemplates templates = new SqlTemplates(new DuckDbDialect());

  @Test
  void testDateVariables() {
    Assertions.assertEquals(
        "ts >= '2023-12-25 06:00:00' AND ts <= '2024-01-08 00:00:00'",
        templates.compile("ts >= '{{startDate}}' AND ts <= '{{ endDate }}'", START, END));
    Assertions.assertEquals(
        "events_2023 / events_2024 / 1703484000",
        templates.compile(
            "events_{{startYear}} / events_{{endYear}} / {{startDateUnix}}", START, END));
  }

  @Test
  void testExtraVariables() {
    Assertions.assertEquals(
        "WHERE event = 'purchase' AND experiment = 'exp_1'",
        templates.compile(
            "WHERE event = '{{eventName}}' AND experiment = '{{ experimentId }}'",
            START,
            END,
            Map.of("eventName", "purchase", "experimentId", "exp_1")));
  }

  @Test
  void testUnknownPlaceholdersAreKept() {
    Assertions.assertEquals("{{unknown}}", templates.compile("{{unknown}}", START, END));
  }

  @Test
  void testMissingDatesAreNotReplaced() {
    Assertions.assertEquals("{{startDate}}", templates.compile("{{startDate}}", null, null));
  }
}
