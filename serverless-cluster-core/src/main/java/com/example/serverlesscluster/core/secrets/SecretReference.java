package com.example.serverlesscluster.core.secrets;

import java.util.Objects;

/**
 * Reference to a secret stored in AWS Secrets Manager.
 *
 * @param secretId ARN or name of the secret
 */
public record SecretReference(String secretId) {

  public SecretReference {
    Objects.requireNonNull(secretId, "secretId");
    if (secretId.isBlank()) throw new IllegalArgumentException("secretId must not be blank");
  }

  /**
   * Dynamic reference resolving to a single JSON field of the secret at deployment time.
   *
   * @param jsonField field of the secret's JSON document
   * @return {@code {{resolve:secretsmanager:...}}} reference string
   */
  public String valueFromJson(final String jsonField) {
    return "{{resolve:secretsmanager:" + secretId + ":SecretString:" + jsonField + "::}}";
  }

  /**
   * Attaches this secret to a target so rotation knows how to reach it.
   *
   * @param target the database the secret belongs to
   * @return the attached secret
   */
  public AttachedSecret attach(final SecretAttachmentTarget target) {
    return new AttachedSecret(this, target);
  }
}
