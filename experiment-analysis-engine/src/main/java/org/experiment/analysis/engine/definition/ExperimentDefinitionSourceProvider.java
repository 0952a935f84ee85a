package org.experiment.analysis.engine.definition;

import com.typesafe.config.Config;

public class ExperimentDefinitionSourceProvider {
  private static final String SOURCE_TYPE = "type";
  private static final String SOURCE_TYPE_FS = "fs";

  public static ExperimentDefinitionSource getProvider(Config sourceConfig) {
    String sourceType = sourceConfig.getString(SOURCE_TYPE);
    switch (sourceType) {
      case SOURCE_TYPE_FS:
        return new FSExperimentDefinitionSource(sourceConfig.getConfig(SOURCE_TYPE_FS));
      default:
        throw new RuntimeException(
            String.format("Invalid experiment definition source type:%s", sourceType));
    }
  }
}
