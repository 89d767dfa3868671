package com.example.serverlesscluster.core.network;

/**
 * Creates security groups on behalf of the cluster builder. Implemented by whatever manages the
 * network layer.
 */
@FunctionalInterface
public interface SecurityGroupFactory {
  /**
   * Creates a new security group in the given VPC.
   *
   * @param scopeId logical id of the owning cluster
   * @param vpc VPC to create the group in
   * @param description group description
   * @return the created group
   */
  SecurityGroup create(final String scopeId, final Vpc vpc, final String description);
}
