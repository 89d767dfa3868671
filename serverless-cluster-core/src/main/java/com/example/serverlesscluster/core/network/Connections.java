package com.example.serverlesscluster.core.network;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Network connection descriptor of a cluster: the security groups guarding it and the port
 * clients connect to.
 */
public final class Connections {

  private final List<SecurityGroup> securityGroups;
  private final Integer defaultPort;

  /**
   * @param securityGroups groups attached to the cluster
   * @param defaultPort port used when opening access, {@code null} when unknown
   */
  public Connections(final List<SecurityGroup> securityGroups, final Integer defaultPort) {
    this.securityGroups = securityGroups == null ? List.of() : List.copyOf(securityGroups);
    this.defaultPort = defaultPort;
  }

  public List<SecurityGroup> securityGroups() {
    return securityGroups;
  }

  public Optional<Integer> defaultPort() {
    return Optional.ofNullable(defaultPort);
  }

  public List<String> securityGroupIds() {
    return securityGroups.stream().map(SecurityGroup::securityGroupId).collect(Collectors.toList());
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) return true;
    if (!(o instanceof Connections)) return false;
    final var that = (Connections) o;
    return securityGroups.equals(that.securityGroups)
        && Objects.equals(defaultPort, that.defaultPort);
  }

  @Override
  public int hashCode() {
    return Objects.hash(securityGroups, defaultPort);
  }

  @Override
  public String toString() {
    return "Connections[securityGroups="
        + securityGroupIds()
        + ", defaultPort="
        + defaultPort
        + "]";
  }
}
