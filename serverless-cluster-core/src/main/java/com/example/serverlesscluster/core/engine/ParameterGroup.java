package com.example.serverlesscluster.core.engine;

import java.util.Objects;

/**
 * A cluster parameter group holding database engine settings.
 *
 * @param parameterGroupName name of the group
 */
public record ParameterGroup(String parameterGroupName) {

  public ParameterGroup {
    Objects.requireNonNull(parameterGroupName, "parameterGroupName");
  }
}
