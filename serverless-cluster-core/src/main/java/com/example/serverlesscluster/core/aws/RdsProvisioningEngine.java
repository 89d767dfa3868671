package com.example.serverlesscluster.core.aws;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import com.example.serverlesscluster.core.ClusterDescription;
import com.example.serverlesscluster.core.ProvisionedAttributes;
import com.example.serverlesscluster.core.ProvisioningEngine;
import com.example.serverlesscluster.core.scaling.ScalingConfiguration;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.rds.model.CreateDbClusterRequest;
import software.amazon.awssdk.services.rds.model.CreateDbSubnetGroupRequest;

/**
 * {@link ProvisioningEngine} that creates the cluster through the RDS API.
 *
 * <p>Creates an owned subnet group first, resolves a secret-backed master password through
 * Secrets Manager and returns the attributes RDS reports for the new cluster. RDS exceptions are
 * propagated unchanged.
 */
public class RdsProvisioningEngine implements ProvisioningEngine {

  private static final System.Logger LOGGER =
      System.getLogger(RdsProvisioningEngine.class.getName());

  private final Supplier<RdsClient> client;
  private final SecretsManagerSecrets secrets;

  /** Uses the shared clients from {@link AwsClientProvider}. */
  public RdsProvisioningEngine() {
    this(AwsClientProvider::rds, new SecretsManagerSecrets());
  }

  public RdsProvisioningEngine(
      final Supplier<RdsClient> client, final SecretsManagerSecrets secrets) {
    this.client = Objects.requireNonNull(client, "client");
    this.secrets = Objects.requireNonNull(secrets, "secrets");
  }

  @Override
  public ProvisionedAttributes declare(final ClusterDescription description) {
    final var subnetGroup = description.subnetGroup();
    if (subnetGroup.owned()) {
      LOGGER.log(DEBUG, "Creating subnet group {0}", subnetGroup.subnetGroupName());
      client
          .get()
          .createDBSubnetGroup(
              CreateDbSubnetGroupRequest.builder()
                  .dbSubnetGroupName(subnetGroup.subnetGroupName())
                  .dbSubnetGroupDescription(subnetGroup.description())
                  .subnetIds(subnetGroup.subnetIds())
                  .build());
    }

    var username = description.masterUsername();
    var password = description.masterUserPassword().plaintext();
    final var secret = description.masterUserPassword().secretReference();
    if (secret.isPresent()) {
      final var stored = secrets.read(secret.get());
      username = Objects.requireNonNullElse(stored.username(), username);
      password = stored.password();
    }

    final var request =
        CreateDbClusterRequest.builder()
            .dbClusterIdentifier(clusterIdentifier(description))
            .engine(description.engine())
            .engineVersion(description.engineVersion().orElse(null))
            .engineMode(description.engineMode())
            .backupRetentionPeriod(
                description.backupRetentionDays().map(Math::toIntExact).orElse(null))
            .databaseName(description.databaseName().orElse(null))
            .dbClusterParameterGroupName(description.dbClusterParameterGroupName().orElse(null))
            .dbSubnetGroupName(subnetGroup.subnetGroupName())
            .deletionProtection(description.deletionProtection().orElse(null))
            .enableHttpEndpoint(description.enableHttpEndpoint())
            .kmsKeyId(description.kmsKeyId().orElse(null))
            .masterUsername(username)
            .masterUserPassword(password)
            .scalingConfiguration(
                description.scalingConfiguration().map(RdsProvisioningEngine::scaling).orElse(null))
            .storageEncrypted(description.storageEncrypted())
            .vpcSecurityGroupIds(description.vpcSecurityGroupIds())
            .build();

    final var cluster = client.get().createDBCluster(request).dbCluster();
    LOGGER.log(
        INFO, "Created cluster {0} at {1}", cluster.dbClusterIdentifier(), cluster.endpoint());
    return new ProvisionedAttributes(
        cluster.dbClusterIdentifier(),
        cluster.endpoint(),
        cluster.port(),
        cluster.readerEndpoint());
  }

  /** RDS requires an identifier; derive one from the logical id when none was configured. */
  static String clusterIdentifier(final ClusterDescription description) {
    return description
        .dbClusterIdentifier()
        .orElseGet(
            () ->
                description
                    .logicalId()
                    .toLowerCase(Locale.ROOT)
                    .replaceAll("[^a-z0-9-]", "-")
                    .replaceAll("^[^a-z]+", "")
                    .replaceAll("-{2,}", "-"));
  }

  private static software.amazon.awssdk.services.rds.model.ScalingConfiguration scaling(
      final ScalingConfiguration scaling) {
    return software.amazon.awssdk.services.rds.model.ScalingConfiguration.builder()
        .autoPause(scaling.autoPause())
        .minCapacity(scaling.minCapacity().orElse(null))
        .maxCapacity(scaling.maxCapacity().orElse(null))
        .secondsUntilAutoPause(scaling.secondsUntilAutoPause().map(Math::toIntExact).orElse(null))
        .build();
  }
}
