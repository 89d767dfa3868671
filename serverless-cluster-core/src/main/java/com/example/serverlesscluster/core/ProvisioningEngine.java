package com.example.serverlesscluster.core;

/**
 * External engine that stands up the cluster described by a {@link ClusterDescription}.
 *
 * <p>Failures are irrecoverable for the build and are raised as unchecked exceptions.
 */
@FunctionalInterface
public interface ProvisioningEngine {
  /**
   * Declares a cluster.
   *
   * @param description fully resolved cluster description
   * @return identifier and endpoint attributes of the declared cluster
   */
  ProvisionedAttributes declare(final ClusterDescription description);
}
