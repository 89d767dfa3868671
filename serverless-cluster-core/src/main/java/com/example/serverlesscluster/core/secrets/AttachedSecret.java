package com.example.serverlesscluster.core.secrets;

import java.util.Objects;

/**
 * A secret bound to the resource it grants access to. The password it resolves to is never
 * changed by either side once attached.
 *
 * @param secret the secret
 * @param target where it is attached
 */
public record AttachedSecret(SecretReference secret, SecretAttachmentTarget target) {

  public AttachedSecret {
    Objects.requireNonNull(secret, "secret");
    Objects.requireNonNull(target, "target");
  }
}
