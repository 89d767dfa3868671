package com.example.serverlesscluster.core.network;

import java.util.Objects;

/**
 * A security group attached to the cluster.
 *
 * @param securityGroupId id of the group
 * @param description free-form description
 * @param vpcId VPC the group belongs to, may be {@code null} for imported groups
 */
public record SecurityGroup(String securityGroupId, String description, String vpcId) {

  public SecurityGroup {
    Objects.requireNonNull(securityGroupId, "securityGroupId");
  }

  public static SecurityGroup fromId(final String securityGroupId) {
    return new SecurityGroup(securityGroupId, null, null);
  }
}
