package com.example.serverlesscluster.core;

import com.example.serverlesscluster.core.network.SubnetGroup;
import com.example.serverlesscluster.core.scaling.ScalingConfiguration;
import com.example.serverlesscluster.core.secrets.PasswordSource;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Fully resolved description of a serverless cluster, submitted to the {@link ProvisioningEngine}.
 *
 * <p>Optional properties are empty when the provider default applies.
 */
public final class ClusterDescription {

  public static final String ENGINE_MODE = "serverless";

  private final String logicalId;
  private final String dbClusterIdentifier;
  private final String engine;
  private final String engineVersion;
  private final Long backupRetentionDays;
  private final String databaseName;
  private final String dbClusterParameterGroupName;
  private final SubnetGroup subnetGroup;
  private final Boolean deletionProtection;
  private final boolean enableHttpEndpoint;
  private final String kmsKeyId;
  private final String masterUsername;
  private final PasswordSource masterUserPassword;
  private final ScalingConfiguration scalingConfiguration;
  private final List<String> vpcSecurityGroupIds;
  private final RemovalPolicy removalPolicy;

  private ClusterDescription(final Builder builder) {
    this.logicalId = builder.logicalId;
    this.dbClusterIdentifier = builder.dbClusterIdentifier;
    this.engine = builder.engine;
    this.engineVersion = builder.engineVersion;
    this.backupRetentionDays = builder.backupRetentionDays;
    this.databaseName = builder.databaseName;
    this.dbClusterParameterGroupName = builder.dbClusterParameterGroupName;
    this.subnetGroup = builder.subnetGroup;
    this.deletionProtection = builder.deletionProtection;
    this.enableHttpEndpoint = builder.enableHttpEndpoint;
    this.kmsKeyId = builder.kmsKeyId;
    this.masterUsername = builder.masterUsername;
    this.masterUserPassword = builder.masterUserPassword;
    this.scalingConfiguration = builder.scalingConfiguration;
    this.vpcSecurityGroupIds = List.copyOf(builder.vpcSecurityGroupIds);
    this.removalPolicy = builder.removalPolicy;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Logical id of the cluster. */
  public String logicalId() {
    return logicalId;
  }

  /** Explicit identifier, empty to let the provider generate one. */
  public Optional<String> dbClusterIdentifier() {
    return Optional.ofNullable(dbClusterIdentifier);
  }

  public String engine() {
    return engine;
  }

  public Optional<String> engineVersion() {
    return Optional.ofNullable(engineVersion);
  }

  /** Days automatic snapshots are kept. */
  public Optional<Long> backupRetentionDays() {
    return Optional.ofNullable(backupRetentionDays);
  }

  public Optional<String> databaseName() {
    return Optional.ofNullable(databaseName);
  }

  public Optional<String> dbClusterParameterGroupName() {
    return Optional.ofNullable(dbClusterParameterGroupName);
  }

  public SubnetGroup subnetGroup() {
    return subnetGroup;
  }

  /** Explicit deletion protection; empty means the flag is not sent. */
  public Optional<Boolean> deletionProtection() {
    return Optional.ofNullable(deletionProtection);
  }

  /** Whether the Data API endpoint is enabled. */
  public boolean enableHttpEndpoint() {
    return enableHttpEndpoint;
  }

  /** Storage encryption key, empty for the default key. */
  public Optional<String> kmsKeyId() {
    return Optional.ofNullable(kmsKeyId);
  }

  public String masterUsername() {
    return masterUsername;
  }

  public PasswordSource masterUserPassword() {
    return masterUserPassword;
  }

  public Optional<ScalingConfiguration> scalingConfiguration() {
    return Optional.ofNullable(scalingConfiguration);
  }

  public List<String> vpcSecurityGroupIds() {
    return vpcSecurityGroupIds;
  }

  public RemovalPolicy removalPolicy() {
    return removalPolicy;
  }

  public String engineMode() {
    return ENGINE_MODE;
  }

  /** Storage of a serverless cluster is always encrypted. */
  public boolean storageEncrypted() {
    return true;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) return true;
    if (!(o instanceof ClusterDescription)) return false;
    final var that = (ClusterDescription) o;
    return enableHttpEndpoint == that.enableHttpEndpoint
        && logicalId.equals(that.logicalId)
        && Objects.equals(dbClusterIdentifier, that.dbClusterIdentifier)
        && engine.equals(that.engine)
        && Objects.equals(engineVersion, that.engineVersion)
        && Objects.equals(backupRetentionDays, that.backupRetentionDays)
        && Objects.equals(databaseName, that.databaseName)
        && Objects.equals(dbClusterParameterGroupName, that.dbClusterParameterGroupName)
        && subnetGroup.equals(that.subnetGroup)
        && Objects.equals(deletionProtection, that.deletionProtection)
        && Objects.equals(kmsKeyId, that.kmsKeyId)
        && masterUsername.equals(that.masterUsername)
        && masterUserPassword.equals(that.masterUserPassword)
        && Objects.equals(scalingConfiguration, that.scalingConfiguration)
        && vpcSecurityGroupIds.equals(that.vpcSecurityGroupIds)
        && removalPolicy == that.removalPolicy;
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        logicalId,
        dbClusterIdentifier,
        engine,
        engineVersion,
        backupRetentionDays,
        databaseName,
        dbClusterParameterGroupName,
        subnetGroup,
        deletionProtection,
        enableHttpEndpoint,
        kmsKeyId,
        masterUsername,
        masterUserPassword,
        scalingConfiguration,
        vpcSecurityGroupIds,
        removalPolicy);
  }

  @Override
  public String toString() {
    return "ClusterDescription[logicalId="
        + logicalId
        + ", dbClusterIdentifier="
        + dbClusterIdentifier
        + ", engine="
        + engine
        + ", engineVersion="
        + engineVersion
        + ", subnetGroup="
        + subnetGroup.subnetGroupName()
        + ", masterUsername="
        + masterUsername
        + ", masterUserPassword="
        + masterUserPassword
        + ", scalingConfiguration="
        + scalingConfiguration
        + ", vpcSecurityGroupIds="
        + vpcSecurityGroupIds
        + ", removalPolicy="
        + removalPolicy
        + "]";
  }

  /**
   * Builder for {@link ClusterDescription}. {@code logicalId}, {@code engine}, {@code
   * subnetGroup}, {@code masterUsername}, {@code masterUserPassword} and {@code removalPolicy} are
   * required; every other property may be left unset or set to {@code null}.
   */
  public static class Builder {
    private String logicalId;
    private String dbClusterIdentifier;
    private String engine;
    private String engineVersion;
    private Long backupRetentionDays;
    private String databaseName;
    private String dbClusterParameterGroupName;
    private SubnetGroup subnetGroup;
    private Boolean deletionProtection;
    private boolean enableHttpEndpoint = false;
    private String kmsKeyId;
    private String masterUsername;
    private PasswordSource masterUserPassword;
    private ScalingConfiguration scalingConfiguration;
    private List<String> vpcSecurityGroupIds = List.of();
    private RemovalPolicy removalPolicy;

    private Builder() {}

    public Builder logicalId(final String logicalId) {
      this.logicalId = logicalId;
      return this;
    }

    public Builder dbClusterIdentifier(final String dbClusterIdentifier) {
      this.dbClusterIdentifier = dbClusterIdentifier;
      return this;
    }

    public Builder engine(final String engine) {
      this.engine = engine;
      return this;
    }

    public Builder engineVersion(final String engineVersion) {
      this.engineVersion = engineVersion;
      return this;
    }

    public Builder backupRetentionDays(final Long backupRetentionDays) {
      this.backupRetentionDays = backupRetentionDays;
      return this;
    }

    public Builder databaseName(final String databaseName) {
      this.databaseName = databaseName;
      return this;
    }

    public Builder dbClusterParameterGroupName(final String dbClusterParameterGroupName) {
      this.dbClusterParameterGroupName = dbClusterParameterGroupName;
      return this;
    }

    public Builder subnetGroup(final SubnetGroup subnetGroup) {
      this.subnetGroup = subnetGroup;
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

    public Builder kmsKeyId(final String kmsKeyId) {
      this.kmsKeyId = kmsKeyId;
      return this;
    }

    public Builder masterUsername(final String masterUsername) {
      this.masterUsername = masterUsername;
      return this;
    }

    public Builder masterUserPassword(final PasswordSource masterUserPassword) {
      this.masterUserPassword = masterUserPassword;
      return this;
    }

    public Builder scalingConfiguration(final ScalingConfiguration scalingConfiguration) {
      this.scalingConfiguration = scalingConfiguration;
      return this;
    }

    public Builder vpcSecurityGroupIds(final List<String> vpcSecurityGroupIds) {
      this.vpcSecurityGroupIds = vpcSecurityGroupIds;
      return this;
    }

    public Builder removalPolicy(final RemovalPolicy removalPolicy) {
      this.removalPolicy = removalPolicy;
      return this;
    }

    public ClusterDescription build() {
      if (logicalId == null) throw new IllegalStateException("logicalId is required");
      if (engine == null) throw new IllegalStateException("engine is required");
      if (subnetGroup == null) throw new IllegalStateException("subnetGroup is required");
      if (masterUsername == null) throw new IllegalStateException("masterUsername is required");
      if (masterUserPassword == null)
        throw new IllegalStateException("masterUserPassword is required");
      if (removalPolicy == null) throw new IllegalStateException("removalPolicy is required");
      if (vpcSecurityGroupIds == null)
        throw new IllegalStateException("vpcSecurityGroupIds cannot be null");
      return new ClusterDescription(this);
    }
  }
}
