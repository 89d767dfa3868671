package com.example.serverlesscluster.core;

import java.util.Objects;

/**
 * A problem found while resolving or using a cluster.
 *
 * <p>Configuration errors are collected on a {@link BuildResult}; precondition and
 * already-exists errors are returned from the single call that failed.
 *
 * @param kind category of the error
 * @param message human readable description
 */
public record ClusterError(Kind kind, String message) {

  public ClusterError {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(message, "message");
  }

  /** Error categories. */
  public enum Kind {
    /** Invalid cluster options; reported with the build result, the build itself continues. */
    CONFIGURATION,
    /** A required piece of state (secret, endpoint attribute) is missing. */
    PRECONDITION,
    /** A registration under the same identity already exists. */
    ALREADY_EXISTS
  }

  public static ClusterError configuration(final String message) {
    return new ClusterError(Kind.CONFIGURATION, message);
  }

  public static ClusterError precondition(final String message) {
    return new ClusterError(Kind.PRECONDITION, message);
  }

  public static ClusterError alreadyExists(final String message) {
    return new ClusterError(Kind.ALREADY_EXISTS, message);
  }
}
