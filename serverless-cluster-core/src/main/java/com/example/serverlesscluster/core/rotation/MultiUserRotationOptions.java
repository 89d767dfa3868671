package com.example.serverlesscluster.core.rotation;

import com.example.serverlesscluster.core.secrets.SecretReference;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Options for a multi-user rotation.
 *
 * @param secret secret of the user to rotate; must hold a JSON document with {@code username},
 *     {@code password} and the connection fields of the cluster
 * @param automaticallyAfter time between rotations, {@code null} for 30 days
 */
public record MultiUserRotationOptions(SecretReference secret, Duration automaticallyAfter) {

  public MultiUserRotationOptions {
    Objects.requireNonNull(secret, "secret");
  }

  public static MultiUserRotationOptions of(final SecretReference secret) {
    return new MultiUserRotationOptions(secret, null);
  }

  public Optional<Duration> cadence() {
    return Optional.ofNullable(automaticallyAfter);
  }
}
