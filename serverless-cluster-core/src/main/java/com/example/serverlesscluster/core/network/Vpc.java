package com.example.serverlesscluster.core.network;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Network a cluster is placed in.
 *
 * @param vpcId id of the VPC
 * @param subnets all subnets of the VPC
 */
public record Vpc(String vpcId, List<Subnet> subnets) {

  private static final List<SubnetType> DEFAULT_TYPE_ORDER =
      List.of(SubnetType.PRIVATE_WITH_EGRESS, SubnetType.PRIVATE_ISOLATED, SubnetType.PUBLIC);

  public Vpc {
    Objects.requireNonNull(vpcId, "vpcId");
    subnets = subnets == null ? List.of() : List.copyOf(subnets);
  }

  /**
   * Selects subnets matching the given criteria. Without a type the first non-empty group of
   * private, isolated and public subnets is used.
   *
   * @param selection criteria, or {@code null} for the default strategy
   * @return selected subnet ids and zones; may be empty
   */
  public SelectedSubnets selectSubnets(final SubnetSelection selection) {
    final var criteria =
        Optional.ofNullable(selection).orElseGet(() -> new SubnetSelection(null, null, null));

    var chosen =
        !criteria.subnets().isEmpty()
            ? criteria.subnets()
            : criteria.type().map(this::subnetsOfType).orElseGet(this::defaultSubnets);

    if (!criteria.availabilityZones().isEmpty()) {
      chosen =
          chosen.stream()
              .filter(s -> criteria.availabilityZones().contains(s.availabilityZone()))
              .collect(Collectors.toList());
    }

    return new SelectedSubnets(
        chosen.stream().map(Subnet::subnetId).collect(Collectors.toList()),
        chosen.stream().map(Subnet::availabilityZone).distinct().collect(Collectors.toList()));
  }

  private List<Subnet> subnetsOfType(final SubnetType type) {
    return subnets.stream().filter(s -> s.type() == type).collect(Collectors.toList());
  }

  private List<Subnet> defaultSubnets() {
    return DEFAULT_TYPE_ORDER.stream()
        .map(this::subnetsOfType)
        .filter(group -> !group.isEmpty())
        .findFirst()
        .orElse(List.of());
  }
}
