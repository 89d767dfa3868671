package com.example.serverlesscluster.core.engine;

import java.util.Objects;
import java.util.Optional;

/** What an engine contributes when bound to a cluster. */
public final class EngineBindConfig {

  private final ParameterGroup parameterGroup;

  /** @param parameterGroup parameter group the engine wants, {@code null} for none */
  public EngineBindConfig(final ParameterGroup parameterGroup) {
    this.parameterGroup = parameterGroup;
  }

  public Optional<ParameterGroup> parameterGroup() {
    return Optional.ofNullable(parameterGroup);
  }

  @Override
  public boolean equals(final Object o) {
    return this == o
        || (o instanceof EngineBindConfig
            && Objects.equals(parameterGroup, ((EngineBindConfig) o).parameterGroup));
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(parameterGroup);
  }
}
