package org.experiment.analysis.warehouse.compiler;

import java.time.Instant;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SqlDialectTest {
  private final SqlDialect postgres = new PostgresDialect();
  private final SqlDialect redshift = new PostgresDialect(true);
  private final SqlDialect duckdb = new DuckDbDialect();

  @Test
  void testFormatDialect() {
    Assertions.assertEquals("postgresql", postgres.formatDialect());
    Assertions.assertEquals("redshift", redshift.formatDialect());
    Assertions.assertEquals("duckdb", duckdb.formatDialect());
  }

  @Test
  void testTypes() {
    Assertions.assertEquals("DOUBLE PRECISION", postgres.floatType());
    Assertions.assertEquals("DOUBLE", duckdb.floatType());
    Assertions.assertEquals("VARCHAR", postgres.stringType());
    Assertions.assertEquals("VARCHAR(256)", redshift.stringType());
  }

  @Test
  void testDateFormatting() {
    Assertions.assertEquals("to_char(d, 'YYYY-MM-DD')", postgres.formatDate("d"));
    Assertions.assertEquals("strftime(d, '%Y-%m-%d')", duckdb.formatDate("d"));
    Assertions.assertEquals(
        "CAST('2024-03-05 07:08:09' AS TIMESTAMP)",
        duckdb.toTimestamp(Instant.parse("2024-03-05T07:08:09.750Z")));
  }

  @Test
  void testAddHours() {
    Assertions.assertEquals("ts", postgres.addHours("ts", 0));
    Assertions.assertEquals("(ts + INTERVAL '5400 seconds')", postgres.addHours("ts", 1.5));
    Assertions.assertEquals("(ts - INTERVAL '86400 seconds')", postgres.addHours("ts", -24));
  }

  @Test
  void testEscaping() {
    Assertions.assertEquals("'it''s'", postgres.escapeLiteral("it's"));
    Assertions.assertEquals("\"a\"\"b\"", postgres.quoteIdentifier("a\"b"));
  }

  @Test
  void testGenerateTablePath() {
    Assertions.assertEquals(
        "db.analytics.units", postgres.generateTablePath("units", "analytics", "db"));
    Assertions.assertEquals(
        "analytics.units", postgres.generateTablePath("units", "analytics", null));
    Assertions.assertEquals("units", postgres.generateTablePath("units", "", null));
  }
}
