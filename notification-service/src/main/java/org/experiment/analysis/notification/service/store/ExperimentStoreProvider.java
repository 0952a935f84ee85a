package org.experiment.analysis.notification.service.store;

import com.typesafe.config.Config;

public class ExperimentStoreProvider {
  private static final String STORE_TYPE = "type";
  private static final String STORE_TYPE_FS = "fs";

  public static ExperimentStore getExperimentStore(Config experimentStoreConfig) {
    String storeType = experimentStoreConfig.getString(STORE_TYPE);
    switch (storeType) {
      case STORE_TYPE_FS:
        return new FileSystemExperimentStore(experimentStoreConfig.getConfig(STORE_TYPE_FS));
      default:
        throw new RuntimeException(String.format("Invalid experiment store type:%s", storeType));
    }
  }
}
