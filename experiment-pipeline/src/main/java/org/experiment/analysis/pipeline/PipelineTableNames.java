package org.experiment.analysis.pipeline;

import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import org.experiment.analysis.warehouse.compiler.SqlQueryCompiler;

/**
 * Physical table names for pipeline runs. Names are lowercase, contain only {@code [a-z0-9_]} and
 * stay within 63 characters including the metrics table suffix.
 */
public class PipelineTableNames {
  static final String PREFIX = "exp_pipeline_";
  static final int MAX_IDENTIFIER_LENGTH = 63;
  static final int MAX_UNITS_TABLE_LENGTH =
      MAX_IDENTIFIER_LENGTH - SqlQueryCompiler.METRICS_TABLE_SUFFIX.length();
  private static final int HASH_LENGTH = 8;

  private PipelineTableNames() {}

  public static String unitsTable(String experimentId, String snapshotId) {
    String experiment = sanitize(experimentId);
    String snapshot = sanitize(snapshotId);
    String name = PREFIX + experiment + "_" + snapshot;
    boolean lossy = !experiment.equals(experimentId) || !snapshot.equals(snapshotId);
    if (!lossy && name.length() <= MAX_UNITS_TABLE_LENGTH) {
      return name;
    }
    // rewritten or truncated ids get a hash of the original ids so names stay unique
    String hash =
        Hashing.murmur3_32_fixed()
            .hashString(experimentId + "\u0000" + snapshotId, StandardCharsets.UTF_8)
            .toString()
            .substring(0, HASH_LENGTH);
    int maxNameLength = MAX_UNITS_TABLE_LENGTH - HASH_LENGTH - 1;
    if (name.length() > maxNameLength) {
      name = name.substring(0, maxNameLength);
    }
    return name + "_" + hash;
  }

  public static String metricsTable(String unitsTable) {
    return SqlQueryCompiler.metricsTableName(unitsTable);
  }

  static String sanitize(String id) {
    return id.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
  }
}
