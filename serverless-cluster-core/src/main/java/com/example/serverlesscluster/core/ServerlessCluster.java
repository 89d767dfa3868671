package com.example.serverlesscluster.core;

import com.example.serverlesscluster.core.network.Connections;
import com.example.serverlesscluster.core.secrets.AttachmentTargetType;
import com.example.serverlesscluster.core.secrets.SecretAttachmentTarget;

/**
 * Capabilities shared by clusters created here ({@link ManagedServerlessCluster}) and clusters
 * imported from attributes ({@link ImportedServerlessCluster}).
 *
 * <p>Endpoint accessors never return {@code null}: they either hold an {@link Endpoint} or a
 * {@link ClusterError.Kind#PRECONDITION precondition} error naming what is missing.
 */
public interface ServerlessCluster {

  /** Identifier of the cluster. */
  String clusterIdentifier();

  /** The endpoint to use for read/write operations. */
  Result<Endpoint> clusterEndpoint();

  /** The endpoint to use for load-balanced read-only operations. */
  Result<Endpoint> clusterReadEndpoint();

  /** Security groups and default port of the cluster. */
  Connections connections();

  ClusterState state();

  /**
   * Secret attachment target of this cluster.
   *
   * @return target keyed by the cluster identifier
   */
  default SecretAttachmentTarget asSecretAttachmentTarget() {
    return new SecretAttachmentTarget(clusterIdentifier(), AttachmentTargetType.RDS_DB_CLUSTER);
  }
}
