package com.example.serverlesscluster.core.scaling;

import java.time.Duration;
import java.util.Optional;

/**
 * Scaling options of a serverless cluster. Absent values leave the choice to Aurora.
 *
 * <p>A cluster can only pause when idle. An auto-pause of {@link Duration#ZERO} disables pausing;
 * when absent, pausing is enabled with the provider default (5 minutes).
 */
public final class ServerlessScalingOptions {

  private final AuroraCapacityUnit minCapacity;
  private final AuroraCapacityUnit maxCapacity;
  private final Duration autoPause;

  private ServerlessScalingOptions(final Builder builder) {
    this.minCapacity = builder.minCapacity;
    this.maxCapacity = builder.maxCapacity;
    this.autoPause = builder.autoPause;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<AuroraCapacityUnit> minCapacity() {
    return Optional.ofNullable(minCapacity);
  }

  public Optional<AuroraCapacityUnit> maxCapacity() {
    return Optional.ofNullable(maxCapacity);
  }

  public Optional<Duration> autoPause() {
    return Optional.ofNullable(autoPause);
  }

  public static class Builder {
    private AuroraCapacityUnit minCapacity;
    private AuroraCapacityUnit maxCapacity;
    private Duration autoPause;

    private Builder() {}

    public Builder minCapacity(final AuroraCapacityUnit minCapacity) {
      this.minCapacity = minCapacity;
      return this;
    }

    public Builder maxCapacity(final AuroraCapacityUnit maxCapacity) {
      this.maxCapacity = maxCapacity;
      return this;
    }

    /**
     * Sets the idle time before the cluster pauses.
     *
     * @param autoPause pause delay in whole seconds, {@link Duration#ZERO} to disable
     * @return this builder
     */
    public Builder autoPause(final Duration autoPause) {
      this.autoPause = autoPause;
      return this;
    }

    /**
     * Builds the options.
     *
     * @return the options
     * @throws IllegalArgumentException if the auto-pause is negative or not a whole number of
     *     seconds
     */
    public ServerlessScalingOptions build() {
      if (autoPause != null && autoPause.isNegative())
        throw new IllegalArgumentException("autoPause must be non-negative");
      if (autoPause != null && autoPause.getNano() != 0)
        throw new IllegalArgumentException(
            "autoPause must be a whole number of seconds, got " + autoPause);
      return new ServerlessScalingOptions(this);
    }
  }
}
