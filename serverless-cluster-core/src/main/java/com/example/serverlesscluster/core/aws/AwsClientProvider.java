package com.example.serverlesscluster.core.aws;

import static java.lang.System.Logger.Level.WARNING;

import java.net.URI;
import java.util.Optional;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.SdkClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.rds.RdsClient;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;

/**
 * Provides lazily configured AWS Secrets Manager and RDS clients.
 *
 * <p>Configuration can be supplied via system properties or environment variables:
 *
 * <ul>
 *   <li>aws.region / AWS_REGION (default us-east-1)
 *   <li>aws.sm.endpoint / AWS_SM_ENDPOINT (useful for Localstack)
 *   <li>aws.rds.endpoint / AWS_RDS_ENDPOINT
 *   <li>aws.accessKeyId / AWS_ACCESS_KEY_ID
 *   <li>aws.secretAccessKey / AWS_SECRET_ACCESS_KEY
 * </ul>
 */
public final class AwsClientProvider {

  private static final System.Logger LOGGER = System.getLogger(AwsClientProvider.class.getName());

  private static volatile SecretsManagerClient secretsManager;
  private static volatile RdsClient rds;

  static {
    Runtime.getRuntime().addShutdownHook(new Thread(AwsClientProvider::resetClients));
  }

  private AwsClientProvider() {}

  /** Lazily gets the SecretsManagerClient, building it if necessary. */
  public static synchronized SecretsManagerClient secretsManager() {
    return Optional.ofNullable(secretsManager)
        .orElseGet(() -> secretsManager = buildSecretsManagerClient());
  }

  /** Lazily gets the RdsClient, building it if necessary. */
  public static synchronized RdsClient rds() {
    return Optional.ofNullable(rds).orElseGet(() -> rds = buildRdsClient());
  }

  /** Closes both clients; the next access rebuilds them with the current configuration. */
  public static synchronized void resetClients() {
    close(secretsManager);
    close(rds);
    secretsManager = null;
    rds = null;
  }

  static SecretsManagerClient buildSecretsManagerClient() {
    final var builder =
        SecretsManagerClient.builder().region(region()).credentialsProvider(credentials());
    property("aws.sm.endpoint", "AWS_SM_ENDPOINT")
        .map(URI::create)
        .ifPresent(builder::endpointOverride);
    return builder.build();
  }

  static RdsClient buildRdsClient() {
    final var builder = RdsClient.builder().region(region()).credentialsProvider(credentials());
    property("aws.rds.endpoint", "AWS_RDS_ENDPOINT")
        .map(URI::create)
        .ifPresent(builder::endpointOverride);
    return builder.build();
  }

  static Region region() {
    return property("aws.region", "AWS_REGION").map(Region::of).orElse(Region.US_EAST_1);
  }

  /** Static credentials when both keys are configured, else the default provider chain. */
  static AwsCredentialsProvider credentials() {
    return property("aws.accessKeyId", "AWS_ACCESS_KEY_ID")
        .flatMap(
            accessKey ->
                property("aws.secretAccessKey", "AWS_SECRET_ACCESS_KEY")
                    .map(secretKey -> AwsBasicCredentials.create(accessKey, secretKey)))
        .<AwsCredentialsProvider>map(StaticCredentialsProvider::create)
        .orElseGet(() -> DefaultCredentialsProvider.builder().build());
  }

  static Optional<String> property(final String systemProperty, final String environmentVariable) {
    return Optional.ofNullable(System.getProperty(systemProperty))
        .or(() -> Optional.ofNullable(System.getenv(environmentVariable)))
        .map(String::trim)
        .filter(value -> !value.isEmpty());
  }

  private static void close(final SdkClient client) {
    if (client == null) return;
    try {
      client.close();
    } catch (final RuntimeException e) {
      LOGGER.log(WARNING, "Failed to close " + client.serviceName() + " client", e);
    }
  }
}
