package com.example.serverlesscluster.core.secrets;

import java.util.Objects;

/**
 * Target a secret is attached to.
 *
 * @param targetId identifier of the target resource
 * @param targetType type tag telling the rotation function how to reach the target
 */
public record SecretAttachmentTarget(String targetId, AttachmentTargetType targetType) {

  public SecretAttachmentTarget {
    Objects.requireNonNull(targetId, "targetId");
    Objects.requireNonNull(targetType, "targetType");
  }
}
