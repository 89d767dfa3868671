package com.example.serverlesscluster.core.network;

import java.util.List;
import java.util.Optional;

/**
 * Criteria for picking subnets out of a {@link Vpc}.
 *
 * <p>Explicit subnets win over every other criterion. Otherwise subnets are filtered by type
 * (the VPC default strategy when absent) and then by availability zone.
 *
 * @param subnetType type of subnets to select, {@code null} for the VPC default strategy
 * @param availabilityZones zones to restrict the selection to, empty for all
 * @param subnets explicit subnets, empty to select by criteria
 */
public record SubnetSelection(
    SubnetType subnetType, List<String> availabilityZones, List<Subnet> subnets) {

  public SubnetSelection {
    availabilityZones = availabilityZones == null ? List.of() : List.copyOf(availabilityZones);
    subnets = subnets == null ? List.of() : List.copyOf(subnets);
  }

  public static SubnetSelection ofType(final SubnetType subnetType) {
    return new SubnetSelection(subnetType, List.of(), List.of());
  }

  public static SubnetSelection ofSubnets(final List<Subnet> subnets) {
    return new SubnetSelection(null, List.of(), subnets);
  }

  public SubnetSelection inAvailabilityZones(final List<String> zones) {
    return new SubnetSelection(subnetType, zones, subnets);
  }

  public Optional<SubnetType> type() {
    return Optional.ofNullable(subnetType);
  }
}
