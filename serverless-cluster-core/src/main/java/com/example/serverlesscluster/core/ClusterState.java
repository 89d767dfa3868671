package com.example.serverlesscluster.core;

/** Lifecycle state of a {@link ServerlessCluster}. */
public enum ClusterState {
  /** Description resolved, engine attributes not yet bound. */
  UNBOUND,
  /** Identifier and endpoints returned by the provisioning engine. */
  PROVISIONED,
  /** Imported cluster; its state is whatever attributes were supplied. */
  ATTRIBUTES_KNOWN
}
