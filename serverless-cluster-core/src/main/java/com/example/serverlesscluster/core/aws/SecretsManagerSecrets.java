package com.example.serverlesscluster.core.aws;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import com.example.serverlesscluster.core.BuildResult;
import com.example.serverlesscluster.core.EncryptionKey;
import com.example.serverlesscluster.core.rotation.RotationJob;
import com.example.serverlesscluster.core.secrets.DatabaseSecret;
import com.example.serverlesscluster.core.secrets.DbSecret;
import com.example.serverlesscluster.core.secrets.ManagedSecretFactory;
import com.example.serverlesscluster.core.secrets.SecretReference;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Objects;
import java.util.function.Supplier;
import software.amazon.awssdk.services.secretsmanager.SecretsManagerClient;
import software.amazon.awssdk.services.secretsmanager.model.CreateSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetRandomPasswordRequest;
import software.amazon.awssdk.services.secretsmanager.model.GetSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.PutSecretValueRequest;
import software.amazon.awssdk.services.secretsmanager.model.RotateSecretRequest;
import software.amazon.awssdk.services.secretsmanager.model.RotationRulesType;

/**
 * AWS Secrets Manager backed secret operations.
 *
 * <p>Creates generated database secrets, reads them back as {@link DbSecret}, stores cluster
 * connection details in attached secrets and schedules rotation jobs.
 */
public class SecretsManagerSecrets implements ManagedSecretFactory {

  private static final System.Logger LOGGER =
      System.getLogger(SecretsManagerSecrets.class.getName());

  private final Supplier<SecretsManagerClient> client;
  private final ObjectMapper mapper;

  /** Uses the shared client from {@link AwsClientProvider}. */
  public SecretsManagerSecrets() {
    this(AwsClientProvider::secretsManager, new ObjectMapper());
  }

  public SecretsManagerSecrets(
      final Supplier<SecretsManagerClient> client, final ObjectMapper mapper) {
    this.client = Objects.requireNonNull(client, "client");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /**
   * Generates a password and stores it with the username as a new secret.
   *
   * @param scopeId logical id of the owning cluster
   * @param request generation parameters
   * @return reference (ARN) of the created secret
   */
  @Override
  public SecretReference create(final String scopeId, final DatabaseSecret request) {
    final var password =
        client
            .get()
            .getRandomPassword(
                GetRandomPasswordRequest.builder()
                    .passwordLength((long) request.passwordLength())
                    .excludeCharacters(request.excludeCharacters())
                    .build())
            .randomPassword();

    final var document = mapper.createObjectNode();
    document.put("username", request.username());
    document.put(request.generateStringKey(), password);

    final var response =
        client
            .get()
            .createSecret(
                CreateSecretRequest.builder()
                    .name(secretName(scopeId))
                    .description("Master credentials of the " + scopeId + " database cluster")
                    .secretString(write(document))
                    .kmsKeyId(request.encryptionKey().map(EncryptionKey::keyArn).orElse(null))
                    .build());
    LOGGER.log(INFO, "Created secret {0}", response.arn());
    return new SecretReference(response.arn());
  }

  /**
   * Reads a secret's JSON document.
   *
   * @param secret the secret
   * @return the parsed {@link DbSecret}
   * @throws RuntimeException if the secret cannot be fetched or parsed
   */
  public DbSecret read(final SecretReference secret) {
    try {
      final var value =
          client
              .get()
              .getSecretValue(GetSecretValueRequest.builder().secretId(secret.secretId()).build())
              .secretString();
      return mapper.readValue(value, DbSecret.class);
    } catch (final Exception exception) {
      throw new RuntimeException("Failed to load DB secret " + secret.secretId(), exception);
    }
  }

  /**
   * Writes the connection details of a built cluster into its attached secret, as the rotation
   * functions expect them. Does nothing when no secret is attached.
   *
   * @param result build result of the cluster
   */
  public void storeConnectionDetails(final BuildResult result) {
    final var cluster = result.cluster();
    cluster
        .secret()
        .ifPresent(
            attached -> {
              final var current = read(attached.secret());
              final var endpoint = cluster.clusterEndpoint().orElseThrow();
              final var updated =
                  new DbSecret(
                      current.username(),
                      current.password(),
                      result.description().engine(),
                      endpoint.hostname(),
                      endpoint.port(),
                      result.description().databaseName().orElse(current.dbname()),
                      attached.target().targetId());
              client
                  .get()
                  .putSecretValue(
                      PutSecretValueRequest.builder()
                          .secretId(attached.secret().secretId())
                          .secretString(write(updated))
                          .build());
              LOGGER.log(
                  DEBUG, "Stored connection details of {0} in secret", cluster.clusterIdentifier());
            });
  }

  /**
   * Enables rotation of the job's secret using a deployed rotation function.
   *
   * @param job rotation job
   * @param rotationFunctionArn ARN of the deployed rotation function for the job's application
   * @return version id of the rotation started by Secrets Manager
   */
  public String scheduleRotation(final RotationJob job, final String rotationFunctionArn) {
    final var response =
        client
            .get()
            .rotateSecret(
                RotateSecretRequest.builder()
                    .secretId(job.secret().secretId())
                    .rotationLambdaARN(rotationFunctionArn)
                    .rotationRules(
                        RotationRulesType.builder()
                            .automaticallyAfterDays(job.automaticallyAfter().toDays())
                            .build())
                    .build());
    LOGGER.log(
        INFO,
        "Scheduled rotation {0} of {1} every {2} days",
        job.id(),
        job.secret().secretId(),
        job.automaticallyAfter().toDays());
    return response.versionId();
  }

  static String secretName(final String scopeId) {
    return scopeId.replaceAll("[^A-Za-z0-9/_+=.@-]", "-") + "/master-credentials";
  }

  private String write(final Object document) {
    try {
      return mapper.writeValueAsString(document);
    } catch (final JsonProcessingException exception) {
      throw new RuntimeException("Failed to serialize secret", exception);
    }
  }
}
