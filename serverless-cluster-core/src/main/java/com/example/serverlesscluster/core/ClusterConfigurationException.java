package com.example.serverlesscluster.core;

/**
 * Thrown when a configuration value cannot be accepted, e.g. a capacity that is not an Aurora
 * capacity unit or an inverted capacity range.
 */
public class ClusterConfigurationException extends RuntimeException {

  public ClusterConfigurationException(final String message) {
    super(message);
  }

  /**
   * Converts this exception to a batched configuration error.
   *
   * @return configuration error with the same message
   */
  public ClusterError toError() {
    return ClusterError.configuration(getMessage());
  }
}
