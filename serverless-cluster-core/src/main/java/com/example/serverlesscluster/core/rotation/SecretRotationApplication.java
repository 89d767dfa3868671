package com.example.serverlesscluster.core.rotation;

import java.util.Objects;

/**
 * A serverless application implementing a Secrets Manager rotation procedure.
 *
 * @param applicationId application id in the serverless application repository
 * @param semanticVersion deployed version
 */
public record SecretRotationApplication(String applicationId, String semanticVersion) {

  public static final SecretRotationApplication MYSQL_ROTATION_SINGLE_USER =
      new SecretRotationApplication("SecretsManagerRDSMySQLRotationSingleUser", "1.1.60");
  public static final SecretRotationApplication MYSQL_ROTATION_MULTI_USER =
      new SecretRotationApplication("SecretsManagerRDSMySQLRotationMultiUser", "1.1.60");
  public static final SecretRotationApplication POSTGRES_ROTATION_SINGLE_USER =
      new SecretRotationApplication("SecretsManagerRDSPostgreSQLRotationSingleUser", "1.1.60");
  public static final SecretRotationApplication POSTGRES_ROTATION_MULTI_USER =
      new SecretRotationApplication("SecretsManagerRDSPostgreSQLRotationMultiUser", "1.1.60");

  public SecretRotationApplication {
    Objects.requireNonNull(applicationId, "applicationId");
    Objects.requireNonNull(semanticVersion, "semanticVersion");
  }

  /**
   * ARN of the application in the given partition's serverless application repository.
   *
   * @param partition AWS partition, e.g. {@code aws}
   * @return application ARN
   */
  public String applicationArn(final String partition) {
    return "arn:"
        + partition
        + ":serverlessrepo:us-east-1:297356227824:applications/"
        + applicationId;
  }
}
