package com.example.serverlesscluster.core.scaling;

import com.example.serverlesscluster.core.ClusterConfigurationException;
import java.time.Duration;

/** Validates {@link ServerlessScalingOptions} and renders a {@link ScalingConfiguration}. */
public final class ScalingConfigurationRenderer {

  private ScalingConfigurationRenderer() {}

  /**
   * Renders scaling options.
   *
   * <p>An auto-pause of exactly zero seconds renders as {@code autoPause=false} without a seconds
   * value. Any other duration renders as enabled with its seconds; no duration renders as enabled
   * with no seconds.
   *
   * @param options scaling options
   * @return rendered configuration
   * @throws ClusterConfigurationException if minimum capacity is greater than maximum capacity
   */
  public static ScalingConfiguration render(final ServerlessScalingOptions options) {
    final var min = options.minCapacity();
    final var max = options.maxCapacity();

    if (min.isPresent() && max.isPresent() && min.get().value() > max.get().value()) {
      throw new ClusterConfigurationException(
          "maximum capacity must be greater than or equal to minimum capacity.");
    }

    final var pause = options.autoPause();
    final var disabled = pause.filter(Duration::isZero).isPresent();

    return new ScalingConfiguration(
        !disabled,
        min.map(AuroraCapacityUnit::value).orElse(null),
        max.map(AuroraCapacityUnit::value).orElse(null),
        disabled ? null : pause.map(Duration::toSeconds).orElse(null));
  }
}
