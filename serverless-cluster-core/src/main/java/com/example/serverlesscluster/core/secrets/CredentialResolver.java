package com.example.serverlesscluster.core.secrets;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import java.util.Objects;

/**
 * Turns {@link Credentials} into {@link ResolvedCredentials}, creating a managed secret when the
 * credentials carry no password source. Never reads or rotates secret values.
 */
public final class CredentialResolver {

  private static final System.Logger LOGGER = System.getLogger(CredentialResolver.class.getName());

  private final ManagedSecretFactory secretFactory;

  public CredentialResolver(final ManagedSecretFactory secretFactory) {
    this.secretFactory = Objects.requireNonNull(secretFactory, "secretFactory");
  }

  /**
   * Resolves credentials.
   *
   * @param scopeId logical id of the cluster the credentials belong to
   * @param credentials credentials to resolve
   * @return resolved credentials with exactly one password source
   */
  public ResolvedCredentials resolve(final String scopeId, final Credentials credentials) {
    if (credentials.secret().isPresent()) {
      LOGGER.log(DEBUG, "Using existing secret for {0}", scopeId);
      return new ResolvedCredentials(
          credentials.username(), PasswordSource.fromSecret(credentials.secret().get()));
    }
    if (credentials.password().isPresent()) {
      LOGGER.log(DEBUG, "Using plaintext password for {0}", scopeId);
      return new ResolvedCredentials(
          credentials.username(), PasswordSource.plaintext(credentials.password().get()));
    }

    final var secret =
        secretFactory.create(
            scopeId,
            DatabaseSecret.forUsername(
                credentials.username(), credentials.encryptionKey().orElse(null)));
    LOGGER.log(INFO, "Created managed secret {0} for {1}", secret.secretId(), scopeId);
    return new ResolvedCredentials(credentials.username(), PasswordSource.fromSecret(secret));
  }
}
