/**
 * AWS SDK backed implementations of the builder's collaborators: {@link
 * com.example.serverlesscluster.core.aws.SecretsManagerSecrets} for generated secrets and
 * rotation, {@link com.example.serverlesscluster.core.aws.RdsProvisioningEngine} for cluster
 * creation, and {@link com.example.serverlesscluster.core.aws.AwsClientProvider} for client
 * configuration.
 */
package com.example.serverlesscluster.core.aws;
