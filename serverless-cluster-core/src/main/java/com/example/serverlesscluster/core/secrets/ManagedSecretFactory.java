package com.example.serverlesscluster.core.secrets;

/** Creates generated secrets. Backed by Secrets Manager in production. */
@FunctionalInterface
public interface ManagedSecretFactory {
  /**
   * Creates a managed secret.
   *
   * @param scopeId logical id of the owning cluster, used to name the secret
   * @param request generation parameters
   * @return reference to the created secret
   */
  SecretReference create(final String scopeId, final DatabaseSecret request);
}
