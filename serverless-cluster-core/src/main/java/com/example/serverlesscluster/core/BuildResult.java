package com.example.serverlesscluster.core;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link ServerlessClusterBuilder#build(String, ServerlessClusterSpec)}.
 *
 * <p>The cluster and its description are always present; configuration errors found on the way
 * are listed in {@link #errors()} so all of them can be reported in one pass.
 *
 * @param cluster the built cluster
 * @param description description submitted to the provisioning engine
 * @param errors configuration errors, empty when valid
 */
public record BuildResult(
    ManagedServerlessCluster cluster, ClusterDescription description, List<ClusterError> errors) {

  public BuildResult {
    Objects.requireNonNull(cluster, "cluster");
    Objects.requireNonNull(description, "description");
    errors = List.copyOf(errors);
  }

  public boolean isValid() {
    return errors.isEmpty();
  }
}
