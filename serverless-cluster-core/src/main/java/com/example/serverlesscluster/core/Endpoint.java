package com.example.serverlesscluster.core;

import java.util.Objects;

/**
 * Connection endpoint of a database cluster.
 *
 * @param hostname DNS name or address of the endpoint
 * @param port TCP port of the endpoint, 1 to 65535
 */
public record Endpoint(String hostname, int port) {

  public Endpoint {
    Objects.requireNonNull(hostname, "hostname");
    if (hostname.isBlank()) throw new IllegalArgumentException("hostname must not be blank");
    if (port < 1 || port > 65535)
      throw new IllegalArgumentException("Port must be an integer between [1, 65535], got " + port);
  }

  /**
   * The combination of {@code hostname:port}.
   *
   * @return socket address string
   */
  public String socketAddress() {
    return hostname + ":" + port;
  }
}
