package com.example.serverlesscluster.core;

import com.example.serverlesscluster.core.network.SecurityGroup;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Properties that describe an existing serverless cluster. Only the identifier is required.
 *
 * @param clusterIdentifier identifier of the cluster
 * @param port database port, {@code null} when unknown
 * @param securityGroups security groups of the cluster
 * @param clusterEndpointAddress read/write endpoint address, {@code null} when unknown
 * @param readerEndpointAddress reader endpoint address, {@code null} when unknown
 */
public record ServerlessClusterAttributes(
    String clusterIdentifier,
    Integer port,
    List<SecurityGroup> securityGroups,
    String clusterEndpointAddress,
    String readerEndpointAddress) {

  public ServerlessClusterAttributes {
    Objects.requireNonNull(clusterIdentifier, "clusterIdentifier");
    securityGroups = securityGroups == null ? List.of() : List.copyOf(securityGroups);
  }

  public static ServerlessClusterAttributes of(final String clusterIdentifier) {
    return new ServerlessClusterAttributes(clusterIdentifier, null, List.of(), null, null);
  }

  public ServerlessClusterAttributes withPort(final int port) {
    return new ServerlessClusterAttributes(
        clusterIdentifier, port, securityGroups, clusterEndpointAddress, readerEndpointAddress);
  }

  public ServerlessClusterAttributes withSecurityGroups(final List<SecurityGroup> groups) {
    return new ServerlessClusterAttributes(
        clusterIdentifier, port, groups, clusterEndpointAddress, readerEndpointAddress);
  }

  public ServerlessClusterAttributes withClusterEndpointAddress(final String address) {
    return new ServerlessClusterAttributes(
        clusterIdentifier, port, securityGroups, address, readerEndpointAddress);
  }

  public ServerlessClusterAttributes withReaderEndpointAddress(final String address) {
    return new ServerlessClusterAttributes(
        clusterIdentifier, port, securityGroups, clusterEndpointAddress, address);
  }

  /** The port, empty when unset or not a positive number. */
  public Optional<Integer> portIfKnown() {
    return Optional.ofNullable(port).filter(p -> p > 0);
  }

  /** The read/write endpoint address, empty when unset or blank. */
  public Optional<String> clusterEndpointAddressIfKnown() {
    return Optional.ofNullable(clusterEndpointAddress).filter(a -> !a.isBlank());
  }

  /** The reader endpoint address, empty when unset or blank. */
  public Optional<String> readerEndpointAddressIfKnown() {
    return Optional.ofNullable(readerEndpointAddress).filter(a -> !a.isBlank());
  }
}
