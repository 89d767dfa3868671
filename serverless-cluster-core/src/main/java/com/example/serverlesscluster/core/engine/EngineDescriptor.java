package com.example.serverlesscluster.core.engine;

import com.example.serverlesscluster.core.rotation.SecretRotationApplication;
import java.util.Objects;
import java.util.Optional;

/**
 * Plain {@link ClusterEngine} described by its values.
 *
 * @param engineType RDS engine type
 * @param version full engine version, {@code null} for the provider default
 * @param singleUserRotationApplication rotation application for the master user
 * @param multiUserRotationApplication rotation application for additional users
 * @param defaultParameterGroup group requested when the cluster configures none, may be {@code
 *     null}
 */
public record EngineDescriptor(
    String engineType,
    String version,
    SecretRotationApplication singleUserRotationApplication,
    SecretRotationApplication multiUserRotationApplication,
    ParameterGroup defaultParameterGroup)
    implements ClusterEngine {

  public EngineDescriptor {
    Objects.requireNonNull(engineType, "engineType");
    Objects.requireNonNull(singleUserRotationApplication, "singleUserRotationApplication");
    Objects.requireNonNull(multiUserRotationApplication, "multiUserRotationApplication");
  }

  public static EngineDescriptor auroraMysql(final String version) {
    return new EngineDescriptor(
        "aurora-mysql",
        version,
        SecretRotationApplication.MYSQL_ROTATION_SINGLE_USER,
        SecretRotationApplication.MYSQL_ROTATION_MULTI_USER,
        null);
  }

  public static EngineDescriptor auroraPostgres(final String version) {
    return new EngineDescriptor(
        "aurora-postgresql",
        version,
        SecretRotationApplication.POSTGRES_ROTATION_SINGLE_USER,
        SecretRotationApplication.POSTGRES_ROTATION_MULTI_USER,
        null);
  }

  public EngineDescriptor withDefaultParameterGroup(final ParameterGroup parameterGroup) {
    return new EngineDescriptor(
        engineType,
        version,
        singleUserRotationApplication,
        multiUserRotationApplication,
        parameterGroup);
  }

  @Override
  public Optional<String> engineVersion() {
    return Optional.ofNullable(version);
  }

  @Override
  public EngineBindConfig bindToCluster(final Optional<ParameterGroup> parameterGroup) {
    return new EngineBindConfig(parameterGroup.isPresent() ? null : defaultParameterGroup);
  }
}
