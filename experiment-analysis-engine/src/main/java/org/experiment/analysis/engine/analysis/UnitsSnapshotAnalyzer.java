package org.experiment.analysis.engine.analysis;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.apache.commons.math3.stat.inference.ChiSquareTest;
import org.experiment.analysis.datamodel.analysis.AnalysisResultDimension;
import org.experiment.analysis.datamodel.analysis.AnalysisSnapshot;
import org.experiment.analysis.datamodel.analysis.VariationResult;
import org.experiment.analysis.datamodel.experiment.ExperimentSnapshotSettings;
import org.experiment.analysis.datamodel.experiment.Variation;
import org.experiment.analysis.datamodel.rows.AggregateUnitsRow;

/**
 * Builds a snapshot from per-variation unit counts. The unsliced counts come first, followed by
 * one result per dimension value. Each result carries the sample ratio mismatch p-value of a
 * chi-squared goodness of fit test against the variation weights.
 */
public class UnitsSnapshotAnalyzer {
  static final String ALL_DIMENSION = "All";

  private final ChiSquareTest chiSquareTest = new ChiSquareTest();

  public AnalysisSnapshot analyze(
      ExperimentSnapshotSettings settings,
      String snapshotId,
      Instant dateCreated,
      List<AggregateUnitsRow> rows) {
    Map<String, Map<String, Long>> unitsByDimension = new LinkedHashMap<>();
    unitsByDimension.put(ALL_DIMENSION, new LinkedHashMap<>());
    for (AggregateUnitsRow row : rows) {
      unitsByDimension
          .computeIfAbsent(dimensionName(row), k -> new LinkedHashMap<>())
          .merge(row.getVariation(), row.getUnits(), Long::sum);
    }

    Map<String, Long> all = unitsByDimension.get(ALL_DIMENSION);
    AnalysisSnapshot.AnalysisSnapshotBuilder snapshot =
        AnalysisSnapshot.builder()
            .experimentId(settings.getExperimentId())
            .snapshotId(snapshotId)
            .dateCreated(dateCreated)
            .multipleExposures(all.getOrDefault(AggregateUnitsRow.MULTIPLE_EXPOSURES, 0L));
    List<Variation> variations = variations(settings, all);
    for (Map.Entry<String, Map<String, Long>> entry : unitsByDimension.entrySet()) {
      snapshot.result(result(entry.getKey(), variations, entry.getValue()));
    }
    return snapshot.build();
  }

  /**
   * P-value of the observed split given the expected weights. Variations without weight are left
   * out; fewer than two weighted variations or no users yield 1.
   */
  public double srm(long[] users, double[] weights) {
    List<Long> observed = new ArrayList<>();
    List<Double> expectedWeights = new ArrayList<>();
    double totalWeight = 0;
    long totalUsers = 0;
    for (int i = 0; i < users.length; i++) {
      if (weights[i] > 0) {
        observed.add(users[i]);
        expectedWeights.add(weights[i]);
        totalWeight += weights[i];
        totalUsers += users[i];
      }
    }
    if (observed.size() < 2 || totalUsers == 0) {
      return 1.0;
    }

    double[] expected = new double[observed.size()];
    long[] counts = new long[observed.size()];
    for (int i = 0; i < expected.length; i++) {
      expected[i] = expectedWeights.get(i) / totalWeight * totalUsers;
      counts[i] = observed.get(i);
    }
    return chiSquareTest.chiSquareTest(expected, counts);
  }

  private AnalysisResultDimension result(
      String name, List<Variation> variations, Map<String, Long> units) {
    long[] users = new long[variations.size()];
    double[] weights = new double[variations.size()];
    AnalysisResultDimension.AnalysisResultDimensionBuilder result =
        AnalysisResultDimension.builder().name(name);
    for (int i = 0; i < variations.size(); i++) {
      Variation variation = variations.get(i);
      users[i] = units.getOrDefault(variation.getId(), 0L);
      weights[i] = variation.getWeight();
      result.variation(
          VariationResult.builder().variationId(variation.getId()).users(users[i]).build());
    }
    return result.srm(srm(users, weights)).build();
  }

  // configured variations, or an even split over the observed ones
  private static List<Variation> variations(
      ExperimentSnapshotSettings settings, Map<String, Long> units) {
    boolean weighted =
        settings.getVariations().stream().anyMatch(variation -> variation.getWeight() > 0);
    List<Variation> variations = new ArrayList<>();
    if (weighted) {
      variations.addAll(settings.getVariations());
      return variations;
    }

    TreeSet<String> ids = new TreeSet<>(units.keySet());
    settings.getVariations().forEach(variation -> ids.add(variation.getId()));
    ids.remove(AggregateUnitsRow.MULTIPLE_EXPOSURES);
    for (String id : ids) {
      variations.add(Variation.builder().id(id).weight(1.0 / ids.size()).build());
    }
    return variations;
  }

  private static String dimensionName(AggregateUnitsRow row) {
    if (row.getDimensionName() == null || row.getDimensionName().isEmpty()) {
      return ALL_DIMENSION;
    }
    return row.getDimensionName() + ": " + row.getDimensionValue();
  }
}
