package com.example.serverlesscluster.core.network;

import java.util.List;

/**
 * Result of {@link Vpc#selectSubnets(SubnetSelection)}.
 *
 * @param subnetIds ids of the selected subnets, in VPC order
 * @param availabilityZones distinct zones covered by the selection
 */
public record SelectedSubnets(List<String> subnetIds, List<String> availabilityZones) {

  public SelectedSubnets {
    subnetIds = List.copyOf(subnetIds);
    availabilityZones = List.copyOf(availabilityZones);
  }

  public int size() {
    return subnetIds.size();
  }
}
