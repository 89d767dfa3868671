package com.example.serverlesscluster.core;

import java.util.Objects;

/**
 * Attributes returned by a {@link ProvisioningEngine} once the cluster is declared. The reader
 * endpoint shares the writer port.
 *
 * @param clusterIdentifier identifier assigned to the cluster
 * @param endpointAddress read/write endpoint address
 * @param endpointPort port of both endpoints
 * @param readEndpointAddress reader endpoint address
 */
public record ProvisionedAttributes(
    String clusterIdentifier,
    String endpointAddress,
    int endpointPort,
    String readEndpointAddress) {

  public ProvisionedAttributes {
    Objects.requireNonNull(clusterIdentifier, "clusterIdentifier");
    Objects.requireNonNull(endpointAddress, "endpointAddress");
    Objects.requireNonNull(readEndpointAddress, "readEndpointAddress");
  }
}
