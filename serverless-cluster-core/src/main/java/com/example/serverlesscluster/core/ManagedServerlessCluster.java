package com.example.serverlesscluster.core;

import com.example.serverlesscluster.core.engine.ClusterEngine;
import com.example.serverlesscluster.core.network.Connections;
import com.example.serverlesscluster.core.network.SecurityGroup;
import com.example.serverlesscluster.core.network.SubnetSelection;
import com.example.serverlesscluster.core.network.Vpc;
import com.example.serverlesscluster.core.secrets.AttachedSecret;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A serverless cluster created by {@link ServerlessClusterBuilder}.
 *
 * <p>Starts {@link ClusterState#UNBOUND} and becomes {@link ClusterState#PROVISIONED} once the
 * provisioning engine returned its attributes. Only provisioned clusters leave the builder.
 */
public final class ManagedServerlessCluster implements ServerlessCluster {

  private final String id;
  private final ClusterEngine engine;
  private final Vpc vpc;
  private final SubnetSelection vpcSubnets;
  private final List<SecurityGroup> securityGroups;

  private ClusterState state = ClusterState.UNBOUND;
  private String clusterIdentifier;
  private Endpoint clusterEndpoint;
  private Endpoint clusterReadEndpoint;
  private Connections connections;
  private AttachedSecret secret;

  ManagedServerlessCluster(
      final String id,
      final ClusterEngine engine,
      final Vpc vpc,
      final Optional<SubnetSelection> vpcSubnets,
      final List<SecurityGroup> securityGroups) {
    this.id = Objects.requireNonNull(id, "id");
    this.engine = Objects.requireNonNull(engine, "engine");
    this.vpc = Objects.requireNonNull(vpc, "vpc");
    this.vpcSubnets = vpcSubnets.orElse(null);
    this.securityGroups = List.copyOf(securityGroups);
  }

  /** Binds the attributes returned by the provisioning engine. */
  void bind(final ProvisionedAttributes attributes) {
    if (state != ClusterState.UNBOUND)
      throw new IllegalStateException("Cluster " + id + " is already provisioned");
    final var port = attributes.endpointPort();
    this.clusterIdentifier = attributes.clusterIdentifier();
    this.clusterEndpoint = new Endpoint(attributes.endpointAddress(), port);
    this.clusterReadEndpoint = new Endpoint(attributes.readEndpointAddress(), port);
    this.connections = new Connections(securityGroups, port);
    this.state = ClusterState.PROVISIONED;
  }

  void attachSecret(final AttachedSecret secret) {
    this.secret = secret;
  }

  /** Logical id the cluster was built under. */
  public String id() {
    return id;
  }

  @Override
  public String clusterIdentifier() {
    requireProvisioned("clusterIdentifier");
    return clusterIdentifier;
  }

  @Override
  public Result<Endpoint> clusterEndpoint() {
    return state == ClusterState.PROVISIONED
        ? Result.ok(clusterEndpoint)
        : Result.error(unbound("clusterEndpoint"));
  }

  @Override
  public Result<Endpoint> clusterReadEndpoint() {
    return state == ClusterState.PROVISIONED
        ? Result.ok(clusterReadEndpoint)
        : Result.error(unbound("clusterReadEndpoint"));
  }

  @Override
  public Connections connections() {
    requireProvisioned("connections");
    return connections;
  }

  @Override
  public ClusterState state() {
    return state;
  }

  /** The secret attached to this cluster, if credentials are backed by one. */
  public Optional<AttachedSecret> secret() {
    return Optional.ofNullable(secret);
  }

  public ClusterEngine engine() {
    return engine;
  }

  public Vpc vpc() {
    return vpc;
  }

  public Optional<SubnetSelection> vpcSubnets() {
    return Optional.ofNullable(vpcSubnets);
  }

  private void requireProvisioned(final String accessor) {
    if (state != ClusterState.PROVISIONED)
      throw new IllegalStateException(unbound(accessor).message());
  }

  private ClusterError unbound(final String accessor) {
    return ClusterError.precondition(
        "Cannot access `" + accessor + "` of cluster " + id + " before it is provisioned");
  }
}
