package com.example.serverlesscluster.core.scaling;

import java.util.Objects;
import java.util.Optional;

/** Rendered scaling configuration as sent to RDS. Unset values leave the provider default. */
public final class ScalingConfiguration {

  private final boolean autoPause;
  private final Integer minCapacity;
  private final Integer maxCapacity;
  private final Long secondsUntilAutoPause;

  /**
   * @param autoPause whether the cluster pauses when idle
   * @param minCapacity minimum ACUs, {@code null} for the provider default
   * @param maxCapacity maximum ACUs, {@code null} for the provider default
   * @param secondsUntilAutoPause pause delay, {@code null} when disabled or left to the provider
   */
  public ScalingConfiguration(
      final boolean autoPause,
      final Integer minCapacity,
      final Integer maxCapacity,
      final Long secondsUntilAutoPause) {
    this.autoPause = autoPause;
    this.minCapacity = minCapacity;
    this.maxCapacity = maxCapacity;
    this.secondsUntilAutoPause = secondsUntilAutoPause;
  }

  public boolean autoPause() {
    return autoPause;
  }

  public Optional<Integer> minCapacity() {
    return Optional.ofNullable(minCapacity);
  }

  public Optional<Integer> maxCapacity() {
    return Optional.ofNullable(maxCapacity);
  }

  public Optional<Long> secondsUntilAutoPause() {
    return Optional.ofNullable(secondsUntilAutoPause);
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) return true;
    if (!(o instanceof ScalingConfiguration)) return false;
    final var that = (ScalingConfiguration) o;
    return autoPause == that.autoPause
        && Objects.equals(minCapacity, that.minCapacity)
        && Objects.equals(maxCapacity, that.maxCapacity)
        && Objects.equals(secondsUntilAutoPause, that.secondsUntilAutoPause);
  }

  @Override
  public int hashCode() {
    return Objects.hash(autoPause, minCapacity, maxCapacity, secondsUntilAutoPause);
  }

  @Override
  public String toString() {
    return "ScalingConfiguration[autoPause="
        + autoPause
        + ", minCapacity="
        + minCapacity
        + ", maxCapacity="
        + maxCapacity
        + ", secondsUntilAutoPause="
        + secondsUntilAutoPause
        + "]";
  }
}
