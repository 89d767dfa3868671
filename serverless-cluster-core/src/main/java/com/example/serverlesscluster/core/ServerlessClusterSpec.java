package com.example.serverlesscluster.core;

import com.example.serverlesscluster.core.engine.ClusterEngine;
import com.example.serverlesscluster.core.engine.ParameterGroup;
import com.example.serverlesscluster.core.network.SecurityGroup;
import com.example.serverlesscluster.core.network.SubnetGroup;
import com.example.serverlesscluster.core.network.SubnetSelection;
import com.example.serverlesscluster.core.network.Vpc;
import com.example.serverlesscluster.core.scaling.ServerlessScalingOptions;
import com.example.serverlesscluster.core.secrets.Credentials;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Declarative options of an Aurora Serverless cluster. Read-only once built.
 *
 * <h2>Example</h2>
 *
 * <pre>{@code
 * var spec = ServerlessClusterSpec.builder()
 *     .engine(EngineDescriptor.auroraMysql("5.7.mysql_aurora.2.08.3"))
 *     .vpc(vpc)
 *     .scaling(ServerlessScalingOptions.builder()
 *         .minCapacity(AuroraCapacityUnit.ACU_2)
 *         .maxCapacity(AuroraCapacityUnit.ACU_8)
 *         .autoPause(Duration.ZERO)
 *         .build())
 *     .build();
 * }</pre>
 */
public final class ServerlessClusterSpec {

  private final ClusterEngine engine;
  private final Credentials credentials;
  private final String clusterIdentifier;
  private final Duration backupRetention;
  private final String defaultDatabaseName;
  private final Boolean deletionProtection;
  private final boolean enableHttpEndpoint;
  private final Vpc vpc;
  private final SubnetSelection vpcSubnets;
  private final ServerlessScalingOptions scaling;
  private final RemovalPolicy removalPolicy;
  private final List<SecurityGroup> securityGroups;
  private final EncryptionKey storageEncryptionKey;
  private final ParameterGroup parameterGroup;
  private final SubnetGroup subnetGroup;

  private ServerlessClusterSpec(final Builder builder) {
    this.engine = builder.engine;
    this.credentials = builder.credentials;
    this.clusterIdentifier = builder.clusterIdentifier;
    this.backupRetention = builder.backupRetention;
    this.defaultDatabaseName = builder.defaultDatabaseName;
    this.deletionProtection = builder.deletionProtection;
    this.enableHttpEndpoint = builder.enableHttpEndpoint;
    this.vpc = builder.vpc;
    this.vpcSubnets = builder.vpcSubnets;
    this.scaling = builder.scaling;
    this.removalPolicy = builder.removalPolicy;
    this.securityGroups =
        builder.securityGroups == null ? null : List.copyOf(builder.securityGroups);
    this.storageEncryptionKey = builder.storageEncryptionKey;
    this.parameterGroup = builder.parameterGroup;
    this.subnetGroup = builder.subnetGroup;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ClusterEngine engine() {
    return engine;
  }

  public Credentials credentials() {
    return credentials;
  }

  public Optional<String> clusterIdentifier() {
    return Optional.ofNullable(clusterIdentifier);
  }

  public Optional<Duration> backupRetention() {
    return Optional.ofNullable(backupRetention);
  }

  public Optional<String> defaultDatabaseName() {
    return Optional.ofNullable(defaultDatabaseName);
  }

  public Optional<Boolean> deletionProtection() {
    return Optional.ofNullable(deletionProtection);
  }

  public boolean enableHttpEndpoint() {
    return enableHttpEndpoint;
  }

  public Vpc vpc() {
    return vpc;
  }

  public Optional<SubnetSelection> vpcSubnets() {
    return Optional.ofNullable(vpcSubnets);
  }

  public Optional<ServerlessScalingOptions> scaling() {
    return Optional.ofNullable(scaling);
  }

  public RemovalPolicy removalPolicy() {
    return removalPolicy;
  }

  public Optional<List<SecurityGroup>> securityGroups() {
    return Optional.ofNullable(securityGroups);
  }

  public Optional<EncryptionKey> storageEncryptionKey() {
    return Optional.ofNullable(storageEncryptionKey);
  }

  public Optional<ParameterGroup> parameterGroup() {
    return Optional.ofNullable(parameterGroup);
  }

  public Optional<SubnetGroup> subnetGroup() {
    return Optional.ofNullable(subnetGroup);
  }

  /** Builder for {@link ServerlessClusterSpec}. {@code engine} and {@code vpc} are required. */
  public static class Builder {
    private ClusterEngine engine;
    private Credentials credentials = Credentials.fromUsername("admin");
    private String clusterIdentifier;
    private Duration backupRetention;
    private String defaultDatabaseName;
    private Boolean deletionProtection;
    private boolean enableHttpEndpoint = false;
    private Vpc vpc;
    private SubnetSelection vpcSubnets;
    private ServerlessScalingOptions scaling;
    private RemovalPolicy removalPolicy = RemovalPolicy.SNAPSHOT;
    private List<SecurityGroup> securityGroups;
    private EncryptionKey storageEncryptionKey;
    private ParameterGroup parameterGroup;
    private SubnetGroup subnetGroup;

    private Builder() {}

    public Builder engine(final ClusterEngine engine) {
      this.engine = engine;
      return this;
    }

    /**
     * Sets the master user credentials.
     *
     * <p>Default: username {@code admin} with a generated password stored in a secret
     *
     * @param credentials credentials
     * @return this builder
     */
    public Builder credentials(final Credentials credentials) {
      this.credentials = credentials;
      return this;
    }

    public Builder clusterIdentifier(final String clusterIdentifier) {
      this.clusterIdentifier = clusterIdentifier;
      return this;
    }

    /**
     * Sets how long automatic snapshots are kept. Must be whole days; zero disables backups.
     *
     * @param backupRetention retention period
     * @return this builder
     */
    public Builder backupRetention(final Duration backupRetention) {
      this.backupRetention = backupRetention;
      return this;
    }

    public Builder defaultDatabaseName(final String defaultDatabaseName) {
      this.defaultDatabaseName = defaultDatabaseName;
      return this;
    }

    public Builder deletionProtection(final Boolean deletionProtection) {
      this.deletionProtection = deletionProtection;
      return this;
    }

    public Builder enableHttpEndpoint(final boolean enableHttpEndpoint) {
      this.enableHttpEndpoint = enableHttpEndpoint;
      return this;
    }

    public Builder vpc(final Vpc vpc) {
      this.vpc = vpc;
      return this;
    }

    public Builder vpcSubnets(final SubnetSelection vpcSubnets) {
      this.vpcSubnets = vpcSubnets;
      return this;
    }

    public Builder scaling(final ServerlessScalingOptions scaling) {
      this.scaling = scaling;
      return this;
    }

    /**
     * Sets the removal policy.
     *
     * <p>Default: {@link RemovalPolicy#SNAPSHOT}
     *
     * @param removalPolicy removal policy
     * @return this builder
     */
    public Builder removalPolicy(final RemovalPolicy removalPolicy) {
      this.removalPolicy = removalPolicy;
      return this;
    }

    /**
     * Sets the security groups. When never set a single new group is created.
     *
     * @param securityGroups security groups
     * @return this builder
     */
    public Builder securityGroups(final List<SecurityGroup> securityGroups) {
      this.securityGroups = securityGroups;
      return this;
    }

    public Builder storageEncryptionKey(final EncryptionKey storageEncryptionKey) {
      this.storageEncryptionKey = storageEncryptionKey;
      return this;
    }

    public Builder parameterGroup(final ParameterGroup parameterGroup) {
      this.parameterGroup = parameterGroup;
      return this;
    }

    public Builder subnetGroup(final SubnetGroup subnetGroup) {
      this.subnetGroup = subnetGroup;
      return this;
    }

    /**
     * Builds the spec.
     *
     * @return the spec
     * @throws IllegalStateException if a required field is missing
     * @throws IllegalArgumentException if the backup retention is negative or not in whole days
     */
    public ServerlessClusterSpec build() {
      if (engine == null) throw new IllegalStateException("engine is required");
      if (vpc == null) throw new IllegalStateException("vpc is required");
      if (credentials == null) throw new IllegalStateException("credentials cannot be null");
      if (removalPolicy == null) throw new IllegalStateException("removalPolicy cannot be null");
      if (backupRetention != null
          && (backupRetention.isNegative()
              || !backupRetention.equals(Duration.ofDays(backupRetention.toDays()))))
        throw new IllegalArgumentException(
            "backupRetention must be a non-negative number of whole days");
      return new ServerlessClusterSpec(this);
    }
  }
}
