package com.example.serverlesscluster.core;

import java.util.Objects;

/**
 * Reference to a KMS key.
 *
 * @param keyArn ARN (or alias/id) of the key
 */
public record EncryptionKey(String keyArn) {

  public EncryptionKey {
    Objects.requireNonNull(keyArn, "keyArn");
  }
}
