package com.example.serverlesscluster.core;

import com.example.serverlesscluster.core.network.Connections;
import java.util.Objects;

/**
 * A serverless cluster known only through {@link ServerlessClusterAttributes}.
 *
 * <p>Importing with partial attributes is legal; endpoint accessors check for the address and
 * port they need on every call and return a precondition error when either is missing. A blank
 * address or a port that is not positive counts as missing.
 */
public final class ImportedServerlessCluster implements ServerlessCluster {

  private final ServerlessClusterAttributes attributes;
  private final Connections connections;

  private ImportedServerlessCluster(final ServerlessClusterAttributes attributes) {
    this.attributes = attributes;
    this.connections =
        new Connections(attributes.securityGroups(), attributes.portIfKnown().orElse(null));
  }

  /**
   * Imports an existing cluster.
   *
   * @param attributes what is known about the cluster
   * @return imported cluster
   */
  public static ImportedServerlessCluster fromAttributes(
      final ServerlessClusterAttributes attributes) {
    return new ImportedServerlessCluster(Objects.requireNonNull(attributes, "attributes"));
  }

  @Override
  public String clusterIdentifier() {
    return attributes.clusterIdentifier();
  }

  @Override
  public Result<Endpoint> clusterEndpoint() {
    final var address = attributes.clusterEndpointAddressIfKnown();
    final var port = attributes.portIfKnown();
    if (address.isEmpty() || port.isEmpty()) {
      return Result.error(
          ClusterError.precondition(
              "Cannot access `clusterEndpoint` of an imported cluster without an endpoint address"
                  + " and port"));
    }
    return Result.ok(new Endpoint(address.get(), port.get()));
  }

  @Override
  public Result<Endpoint> clusterReadEndpoint() {
    final var address = attributes.readerEndpointAddressIfKnown();
    final var port = attributes.portIfKnown();
    if (address.isEmpty() || port.isEmpty()) {
      return Result.error(
          ClusterError.precondition(
              "Cannot access `clusterReadEndpoint` of an imported cluster without a"
                  + " readerEndpointAddress and port"));
    }
    return Result.ok(new Endpoint(address.get(), port.get()));
  }

  @Override
  public Connections connections() {
    return connections;
  }

  @Override
  public ClusterState state() {
    return ClusterState.ATTRIBUTES_KNOWN;
  }
}
