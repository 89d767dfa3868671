/**
 * Resource model of an Aurora Serverless database cluster.
 *
 * <p>A {@link com.example.serverlesscluster.core.ServerlessClusterSpec} is resolved by the {@link
 * com.example.serverlesscluster.core.ServerlessClusterBuilder} into a {@link
 * com.example.serverlesscluster.core.ClusterDescription}, declared with a {@link
 * com.example.serverlesscluster.core.ProvisioningEngine}, and returned as a {@link
 * com.example.serverlesscluster.core.ManagedServerlessCluster}. Existing clusters are imported as
 * {@link com.example.serverlesscluster.core.ImportedServerlessCluster}; both share the {@link
 * com.example.serverlesscluster.core.ServerlessCluster} capabilities.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@code network} – VPC, subnet selection, subnet and security group resolution.
 *   <li>{@code engine} – engine metadata and parameter groups.
 *   <li>{@code scaling} – capacity units and scaling configuration rendering.
 *   <li>{@code secrets} – credentials, password sources and secret attachment.
 *   <li>{@code rotation} – single-user and multi-user rotation jobs.
 *   <li>{@code template} – {@code AWS::RDS::DBCluster} template rendering.
 *   <li>{@code aws} – Secrets Manager and RDS backed collaborators.
 * </ul>
 */
package com.example.serverlesscluster.core;
