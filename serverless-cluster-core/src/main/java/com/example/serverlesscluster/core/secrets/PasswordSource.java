package com.example.serverlesscluster.core.secrets;

import java.util.Objects;
import java.util.Optional;

/**
 * The single place a master password comes from: either a plaintext value or a secret.
 *
 * @param plaintext plaintext password, {@code null} when backed by a secret
 * @param secret backing secret, {@code null} for a plaintext password
 */
public record PasswordSource(String plaintext, SecretReference secret) {

  public PasswordSource {
    if ((plaintext == null) == (secret == null))
      throw new IllegalArgumentException("exactly one of plaintext or secret must be set");
  }

  public static PasswordSource plaintext(final String password) {
    return new PasswordSource(Objects.requireNonNull(password, "password"), null);
  }

  public static PasswordSource fromSecret(final SecretReference secret) {
    return new PasswordSource(null, Objects.requireNonNull(secret, "secret"));
  }

  public Optional<SecretReference> secretReference() {
    return Optional.ofNullable(secret);
  }

  /**
   * Value placed in the resource description: the plaintext, or a dynamic reference to the
   * secret's {@code password} field.
   *
   * @return rendered password value
   */
  public String render() {
    return plaintext != null ? plaintext : secret.valueFromJson("password");
  }

  @Override
  public String toString() {
    return plaintext != null
        ? "PasswordSource[plaintext=****]"
        : "PasswordSource[secret=" + secret + "]";
  }
}
