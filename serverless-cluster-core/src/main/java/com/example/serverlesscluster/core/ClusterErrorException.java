package com.example.serverlesscluster.core;

/** Raised when a failed {@link Result} is unwrapped. */
public class ClusterErrorException extends RuntimeException {

  private final ClusterError error;

  public ClusterErrorException(final ClusterError error) {
    super(error.message());
    this.error = error;
  }

  public ClusterError getError() {
    return error;
  }
}
