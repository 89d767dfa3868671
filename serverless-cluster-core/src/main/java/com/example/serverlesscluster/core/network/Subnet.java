package com.example.serverlesscluster.core.network;

import java.util.Objects;

/**
 * A subnet of a {@link Vpc}.
 *
 * @param subnetId subnet id
 * @param availabilityZone availability zone the subnet lives in
 * @param type routing category
 */
public record Subnet(String subnetId, String availabilityZone, SubnetType type) {

  public Subnet {
    Objects.requireNonNull(subnetId, "subnetId");
    Objects.requireNonNull(availabilityZone, "availabilityZone");
    Objects.requireNonNull(type, "type");
  }
}
