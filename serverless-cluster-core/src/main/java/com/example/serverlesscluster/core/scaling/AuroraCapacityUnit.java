package com.example.serverlesscluster.core.scaling;

import com.example.serverlesscluster.core.ClusterConfigurationException;
import java.util.Arrays;

/**
 * Aurora capacity units (ACUs). Each ACU is a combination of processing and memory capacity.
 *
 * @see <a
 *     href="https://docs.aws.amazon.com/AmazonRDS/latest/AuroraUserGuide/aurora-serverless.setting-capacity.html">Setting
 *     the capacity</a>
 */
public enum AuroraCapacityUnit {
  ACU_1(1),
  ACU_2(2),
  ACU_8(8),
  ACU_16(16),
  ACU_32(32),
  ACU_64(64),
  ACU_128(128),
  ACU_192(192),
  ACU_256(256),
  ACU_384(384);

  private static final int[] VALUES =
      Arrays.stream(values()).mapToInt(AuroraCapacityUnit::value).toArray();

  private final int value;

  AuroraCapacityUnit(final int value) {
    this.value = value;
  }

  public int value() {
    return value;
  }

  /**
   * Looks up the unit for a raw capacity value.
   *
   * @param value capacity value
   * @return matching unit
   * @throws ClusterConfigurationException if {@code value} is not a valid capacity unit
   */
  public static AuroraCapacityUnit of(final int value) {
    return Arrays.stream(values())
        .filter(unit -> unit.value == value)
        .findFirst()
        .orElseThrow(
            () ->
                new ClusterConfigurationException(
                    "Invalid Aurora capacity unit: "
                        + value
                        + ", expected one of "
                        + Arrays.toString(VALUES)));
  }
}
