package com.example.serverlesscluster.core.secrets;

import com.example.serverlesscluster.core.EncryptionKey;
import java.util.Objects;
import java.util.Optional;

/**
 * Request for a generated database secret. The secret holds a JSON document with the username
 * and a random password under {@link #generateStringKey()}.
 */
public final class DatabaseSecret {

  /** Characters that break connection strings or shell quoting in common RDS clients. */
  public static final String DEFAULT_EXCLUDE_CHARACTERS = " %+~`#$&*()|[]{}:;<>?!'/@\"\\";

  public static final int DEFAULT_PASSWORD_LENGTH = 30;

  private final String username;
  private final EncryptionKey encryptionKey;
  private final int passwordLength;
  private final String excludeCharacters;
  private final String generateStringKey;

  /**
   * @param username master username stored in the secret
   * @param encryptionKey key for the secret, {@code null} for the account default
   * @param passwordLength length of the generated password
   * @param excludeCharacters characters never used in the generated password
   * @param generateStringKey JSON field receiving the generated password
   */
  public DatabaseSecret(
      final String username,
      final EncryptionKey encryptionKey,
      final int passwordLength,
      final String excludeCharacters,
      final String generateStringKey) {
    this.username = Objects.requireNonNull(username, "username");
    if (passwordLength < 1) throw new IllegalArgumentException("passwordLength must be >= 1");
    this.encryptionKey = encryptionKey;
    this.passwordLength = passwordLength;
    this.excludeCharacters = excludeCharacters;
    this.generateStringKey = generateStringKey;
  }

  public static DatabaseSecret forUsername(
      final String username, final EncryptionKey encryptionKey) {
    return new DatabaseSecret(
        username, encryptionKey, DEFAULT_PASSWORD_LENGTH, DEFAULT_EXCLUDE_CHARACTERS, "password");
  }

  public String username() {
    return username;
  }

  public Optional<EncryptionKey> encryptionKey() {
    return Optional.ofNullable(encryptionKey);
  }

  public int passwordLength() {
    return passwordLength;
  }

  public String excludeCharacters() {
    return excludeCharacters;
  }

  public String generateStringKey() {
    return generateStringKey;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) return true;
    if (!(o instanceof DatabaseSecret)) return false;
    final var that = (DatabaseSecret) o;
    return passwordLength == that.passwordLength
        && username.equals(that.username)
        && Objects.equals(encryptionKey, that.encryptionKey)
        && Objects.equals(excludeCharacters, that.excludeCharacters)
        && Objects.equals(generateStringKey, that.generateStringKey);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        username, encryptionKey, passwordLength, excludeCharacters, generateStringKey);
  }

  @Override
  public String toString() {
    return "DatabaseSecret[username=" + username + ", passwordLength=" + passwordLength + "]";
  }
}
