package com.example.serverlesscluster.core.secrets;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON document of an RDS cluster secret in AWS Secrets Manager. Rotation functions read and
 * write this shape.
 *
 * @param username database username
 * @param password database password
 * @param engine database engine identifier (e.g., aurora-mysql)
 * @param host cluster endpoint address
 * @param port cluster port
 * @param dbname default database name
 * @param dbClusterIdentifier identifier of the cluster
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record DbSecret(
    String username,
    String password,
    String engine,
    String host,
    Integer port,
    String dbname,
    String dbClusterIdentifier) {

  public static DbSecret of(final String username, final String password) {
    return new DbSecret(username, password, null, null, null, null, null);
  }
}
