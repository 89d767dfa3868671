package com.example.serverlesscluster.core.secrets;

import java.util.Objects;
import java.util.Optional;

/**
 * Canonical credentials after resolution.
 *
 * @param username master username (plain or a dynamic reference into the secret)
 * @param passwordSource the one active password source
 */
public record ResolvedCredentials(String username, PasswordSource passwordSource) {

  public ResolvedCredentials {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(passwordSource, "passwordSource");
  }

  public Optional<SecretReference> secret() {
    return passwordSource.secretReference();
  }
}
