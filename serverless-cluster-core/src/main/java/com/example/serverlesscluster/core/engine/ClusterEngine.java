package com.example.serverlesscluster.core.engine;

import com.example.serverlesscluster.core.rotation.SecretRotationApplication;
import java.util.Optional;

/**
 * Metadata of a database engine that can run in serverless mode. Engine catalogs live outside
 * this library; {@link EngineDescriptor} covers the common case.
 */
public interface ClusterEngine {

  /** Engine type sent to RDS, e.g. {@code aurora-mysql}. */
  String engineType();

  /** Full engine version, empty for the provider default. */
  Optional<String> engineVersion();

  SecretRotationApplication singleUserRotationApplication();

  SecretRotationApplication multiUserRotationApplication();

  /**
   * Binds the engine to a cluster.
   *
   * @param parameterGroup parameter group explicitly configured on the cluster, if any
   * @return the engine contribution; its parameter group is only used when none was configured
   */
  EngineBindConfig bindToCluster(Optional<ParameterGroup> parameterGroup);
}
