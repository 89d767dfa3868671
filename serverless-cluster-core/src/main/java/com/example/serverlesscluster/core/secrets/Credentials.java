package com.example.serverlesscluster.core.secrets;

import com.example.serverlesscluster.core.EncryptionKey;
import java.util.Objects;
import java.util.Optional;

/**
 * Master user credentials of a cluster.
 *
 * <ul>
 *   <li>{@link #fromPassword(String, String)}: explicit username and plaintext password
 *   <li>{@link #fromSecret(SecretReference)}: username and password read from an existing secret
 *   <li>{@link #fromUsername(String)}: username only; a managed secret is generated
 * </ul>
 */
public final class Credentials {

  private final String username;
  private final String password;
  private final SecretReference secret;
  private final EncryptionKey encryptionKey;

  private Credentials(
      final String username,
      final String password,
      final SecretReference secret,
      final EncryptionKey encryptionKey) {
    this.username = Objects.requireNonNull(username, "username");
    this.password = password;
    this.secret = secret;
    this.encryptionKey = encryptionKey;
  }

  public static Credentials fromUsername(final String username) {
    return new Credentials(username, null, null, null);
  }

  /**
   * Username with a generated password stored in a secret encrypted with the given key.
   *
   * @param username master username
   * @param encryptionKey key for the generated secret
   * @return credentials
   */
  public static Credentials fromUsername(final String username, final EncryptionKey encryptionKey) {
    return new Credentials(username, null, null, encryptionKey);
  }

  public static Credentials fromPassword(final String username, final String password) {
    return new Credentials(username, Objects.requireNonNull(password, "password"), null, null);
  }

  /**
   * Credentials read from an existing secret. The secret must be a JSON document with {@code
   * username} and {@code password} fields.
   *
   * @param secret the secret
   * @return credentials
   */
  public static Credentials fromSecret(final SecretReference secret) {
    Objects.requireNonNull(secret, "secret");
    return new Credentials(secret.valueFromJson("username"), null, secret, null);
  }

  public String username() {
    return username;
  }

  public Optional<String> password() {
    return Optional.ofNullable(password);
  }

  public Optional<SecretReference> secret() {
    return Optional.ofNullable(secret);
  }

  public Optional<EncryptionKey> encryptionKey() {
    return Optional.ofNullable(encryptionKey);
  }
}
