package org.experiment.analysis.notification.service;

import com.typesafe.config.Config;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** Organization level notification settings. Unset thresholds fall back to the defaults. */
@Value
@Builder
public class OrganizationSettings {
  public static final double DEFAULT_SRM_THRESHOLD = 0.001;
  public static final double DEFAULT_MULTIPLE_EXPOSURE_MIN_PERCENT = 0.01;

  static final String ORGANIZATION_ID_CONFIG = "id";
  static final String SRM_THRESHOLD_CONFIG = "srmThreshold";
  static final String MULTIPLE_EXPOSURE_MIN_PERCENT_CONFIG = "multipleExposureMinPercent";
  static final String ENVIRONMENTS_CONFIG = "environments";

  String organizationId;
  @Builder.Default double srmThreshold = DEFAULT_SRM_THRESHOLD;
  @Builder.Default double multipleExposureMinPercent = DEFAULT_MULTIPLE_EXPOSURE_MIN_PERCENT;
  @Singular List<String> environments;

  public static OrganizationSettings fromConfig(Config organizationConfig) {
    return OrganizationSettings.builder()
        .organizationId(
            organizationConfig.hasPath(ORGANIZATION_ID_CONFIG)
                ? organizationConfig.getString(ORGANIZATION_ID_CONFIG)
                : "default")
        .srmThreshold(
            organizationConfig.hasPath(SRM_THRESHOLD_CONFIG)
                ? organizationConfig.getDouble(SRM_THRESHOLD_CONFIG)
                : DEFAULT_SRM_THRESHOLD)
        .multipleExposureMinPercent(
            organizationConfig.hasPath(MULTIPLE_EXPOSURE_MIN_PERCENT_CONFIG)
                ? organizationConfig.getDouble(MULTIPLE_EXPOSURE_MIN_PERCENT_CONFIG)
                : DEFAULT_MULTIPLE_EXPOSURE_MIN_PERCENT)
        .environments(
            organizationConfig.hasPath(ENVIRONMENTS_CONFIG)
                ? organizationConfig.getStringList(ENVIRONMENTS_CONFIG)
                : List.of())
        .build();
  }
}
