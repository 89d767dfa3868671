package com.example.serverlesscluster.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.example.serverlesscluster.core.engine.ParameterGroup;
import com.example.serverlesscluster.core.network.SecurityGroup;
import com.example.serverlesscluster.core.network.SecurityGroupFactory;
import com.example.serverlesscluster.core.network.SecurityGroupResolver;
import com.example.serverlesscluster.core.network.SubnetGroupResolver;
import com.example.serverlesscluster.core.scaling.ScalingConfiguration;
import com.example.serverlesscluster.core.scaling.ScalingConfigurationRenderer;
import com.example.serverlesscluster.core.scaling.ServerlessScalingOptions;
import com.example.serverlesscluster.core.secrets.CredentialResolver;
import com.example.serverlesscluster.core.secrets.ManagedSecretFactory;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Resolves a {@link ServerlessClusterSpec} into a {@link ClusterDescription}, declares it with the
 * {@link ProvisioningEngine} and returns the resulting {@link ManagedServerlessCluster}.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * var builder = ServerlessClusterBuilder.builder()
 *     .provisioningEngine(new RdsProvisioningEngine(rdsClient, secrets))
 *     .secretFactory(secrets)
 *     .securityGroupFactory((id, vpc, description) -> createSecurityGroup(vpc, description))
 *     .build();
 *
 * var result = builder.build("Orders", spec);
 * if (!result.isValid()) {
 *     result.errors().forEach(e -> log(e.message()));
 * }
 * }</pre>
 *
 * <p>Configuration problems (too few subnets, inverted capacity range) are collected on the
 * {@link BuildResult} and do not stop the build. Failures of the collaborators abort it.
 */
public final class ServerlessClusterBuilder {

  private static final System.Logger LOGGER =
      System.getLogger(ServerlessClusterBuilder.class.getName());

  private final ProvisioningEngine provisioningEngine;
  private final CredentialResolver credentialResolver;
  private final SecurityGroupResolver securityGroupResolver;

  private ServerlessClusterBuilder(final Builder builder) {
    this.provisioningEngine = builder.provisioningEngine;
    this.credentialResolver = new CredentialResolver(builder.secretFactory);
    this.securityGroupResolver = new SecurityGroupResolver(builder.securityGroupFactory);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Builder for {@link ServerlessClusterBuilder}; all collaborators are required. */
  public static class Builder {
    private ProvisioningEngine provisioningEngine;
    private ManagedSecretFactory secretFactory;
    private SecurityGroupFactory securityGroupFactory;

    private Builder() {}

    public Builder provisioningEngine(final ProvisioningEngine provisioningEngine) {
      this.provisioningEngine = provisioningEngine;
      return this;
    }

    /**
     * Sets the factory used when credentials carry no password source.
     *
     * @param secretFactory managed secret factory
     * @return this builder
     */
    public Builder secretFactory(final ManagedSecretFactory secretFactory) {
      this.secretFactory = secretFactory;
      return this;
    }

    /**
     * Sets the factory used when the cluster options name no security groups.
     *
     * @param securityGroupFactory security group factory
     * @return this builder
     */
    public Builder securityGroupFactory(final SecurityGroupFactory securityGroupFactory) {
      this.securityGroupFactory = securityGroupFactory;
      return this;
    }

    public ServerlessClusterBuilder build() {
      if (provisioningEngine == null)
        throw new IllegalStateException("provisioningEngine is required");
      if (secretFactory == null) throw new IllegalStateException("secretFactory is required");
      if (securityGroupFactory == null)
        throw new IllegalStateException("securityGroupFactory is required");
      return new ServerlessClusterBuilder(this);
    }
  }

  /**
   * Builds a cluster.
   *
   * @param id logical id of the cluster, used to scope derived resources
   * @param spec cluster options
   * @return the provisioned cluster, its description and any configuration errors
   */
  public BuildResult build(final String id, final ServerlessClusterSpec spec) {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("id is required");

    final List<ClusterError> errors = new ArrayList<>();

    // AZ distinctness cannot be checked here, only the count.
    final var selected = spec.vpc().selectSubnets(spec.vpcSubnets().orElse(null));
    if (selected.size() < 2) {
      errors.add(
          ClusterError.configuration(
              "Cluster requires at least 2 subnets, got " + selected.size()));
    }

    final var subnetGroup =
        SubnetGroupResolver.resolve(id, spec.subnetGroup(), selected, spec.removalPolicy());

    final var credentials = credentialResolver.resolve(id, spec.credentials());

    final var bindConfig = spec.engine().bindToCluster(spec.parameterGroup());
    final var parameterGroup = spec.parameterGroup().or(bindConfig::parameterGroup);

    final var securityGroups =
        securityGroupResolver.resolve(id, spec.vpc(), spec.securityGroups());

    final var scaling = spec.scaling().flatMap(options -> renderScaling(options, errors));

    final var description =
        ClusterDescription.builder()
            .logicalId(id)
            .dbClusterIdentifier(spec.clusterIdentifier().orElse(null))
            .engine(spec.engine().engineType())
            .engineVersion(spec.engine().engineVersion().orElse(null))
            .backupRetentionDays(spec.backupRetention().map(Duration::toDays).orElse(null))
            .databaseName(spec.defaultDatabaseName().orElse(null))
            .dbClusterParameterGroupName(
                parameterGroup.map(ParameterGroup::parameterGroupName).orElse(null))
            .subnetGroup(subnetGroup)
            .deletionProtection(spec.deletionProtection().orElse(null))
            .enableHttpEndpoint(spec.enableHttpEndpoint())
            .kmsKeyId(spec.storageEncryptionKey().map(EncryptionKey::keyArn).orElse(null))
            .masterUsername(credentials.username())
            .masterUserPassword(credentials.passwordSource())
            .scalingConfiguration(scaling.orElse(null))
            .vpcSecurityGroupIds(
                securityGroups.stream()
                    .map(SecurityGroup::securityGroupId)
                    .collect(Collectors.toList()))
            .removalPolicy(spec.removalPolicy())
            .build();

    errors.forEach(e -> LOGGER.log(WARNING, "Cluster {0}: {1}", id, e.message()));

    final var cluster =
        new ManagedServerlessCluster(
            id, spec.engine(), spec.vpc(), spec.vpcSubnets(), securityGroups);

    LOGGER.log(
        DEBUG, "Declaring cluster {0} with subnet group {1}", id, subnetGroup.subnetGroupName());
    cluster.bind(provisioningEngine.declare(description));
    LOGGER.log(INFO, "Cluster {0} provisioned as {1}", id, cluster.clusterIdentifier());

    final var target = cluster.asSecretAttachmentTarget();
    credentials.secret().ifPresent(secret -> cluster.attachSecret(secret.attach(target)));

    return new BuildResult(cluster, description, errors);
  }

  private static Optional<ScalingConfiguration> renderScaling(
      final ServerlessScalingOptions options, final List<ClusterError> errors) {
    try {
      return Optional.of(ScalingConfigurationRenderer.render(options));
    } catch (final ClusterConfigurationException e) {
      errors.add(e.toError());
      return Optional.empty();
    }
  }
}
