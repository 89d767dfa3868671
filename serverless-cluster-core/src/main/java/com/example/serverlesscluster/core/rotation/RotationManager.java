package com.example.serverlesscluster.core.rotation;

import static java.lang.System.Logger.Level.INFO;

import com.example.serverlesscluster.core.ClusterError;
import com.example.serverlesscluster.core.ManagedServerlessCluster;
import com.example.serverlesscluster.core.Result;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Attaches credential rotation jobs to clusters.
 *
 * <p>Keeps a registry of jobs per cluster identifier: one single-user job at most, and any number
 * of multi-user jobs with distinct ids.
 */
public final class RotationManager {

  /** Id of the single-user rotation job; a cluster has at most one. */
  public static final String SINGLE_USER_ROTATION_ID = "RotationSingleUser";

  public static final Duration DEFAULT_AUTOMATICALLY_AFTER = Duration.ofDays(30);

  private static final System.Logger LOGGER = System.getLogger(RotationManager.class.getName());

  private final Set<String> registered = ConcurrentHashMap.newKeySet();

  /**
   * Adds single-user rotation of the master password, every 30 days.
   *
   * @param cluster cluster to rotate the master secret of
   * @return the job, or a precondition / already-exists error
   */
  public Result<RotationJob> addSingleUserRotation(final ManagedServerlessCluster cluster) {
    return addSingleUserRotation(cluster, null);
  }

  /**
   * Adds single-user rotation of the master password.
   *
   * @param cluster cluster to rotate the master secret of
   * @param automaticallyAfter time between rotations, {@code null} for 30 days
   * @return the job, or a precondition / already-exists error
   * @throws IllegalArgumentException if the cadence is not a whole number of days between 1 and
   *     1000
   */
  public Result<RotationJob> addSingleUserRotation(
      final ManagedServerlessCluster cluster, final Duration automaticallyAfter) {
    final var cadence = cadence(automaticallyAfter);
    final var secret = cluster.secret();
    if (secret.isEmpty()) {
      return Result.error(
          ClusterError.precondition(
              "Cannot add single user rotation for a cluster without secret."));
    }
    if (!register(cluster, SINGLE_USER_ROTATION_ID)) {
      return Result.error(
          ClusterError.alreadyExists("A single user rotation was already added to this cluster."));
    }

    final var job =
        new RotationJob(
            SINGLE_USER_ROTATION_ID,
            secret.get().secret(),
            null,
            cluster.engine().singleUserRotationApplication(),
            cluster.asSecretAttachmentTarget(),
            cadence,
            cluster.vpc(),
            cluster.vpcSubnets().orElse(null));
    LOGGER.log(INFO, "Added single user rotation to {0}", cluster.clusterIdentifier());
    return Result.ok(job);
  }

  /**
   * Adds multi-user rotation of another user's secret. The cluster's own secret is used as the
   * master secret.
   *
   * @param cluster cluster the user belongs to
   * @param id identifier of the job, unique per cluster
   * @param options secret to rotate and cadence
   * @return the job, or a precondition / already-exists error
   * @throws IllegalArgumentException if the id is blank or the cadence is not a whole number of
   *     days between 1 and 1000
   */
  public Result<RotationJob> addMultiUserRotation(
      final ManagedServerlessCluster cluster,
      final String id,
      final MultiUserRotationOptions options) {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("id is required");
    final var cadence = cadence(options.automaticallyAfter());
    final var masterSecret = cluster.secret();
    if (masterSecret.isEmpty()) {
      return Result.error(
          ClusterError.precondition(
              "Cannot add multi user rotation for a cluster without secret."));
    }
    if (!register(cluster, id)) {
      return Result.error(
          ClusterError.alreadyExists(
              "A rotation with id " + id + " was already added to this cluster."));
    }

    final var job =
        new RotationJob(
            id,
            options.secret(),
            masterSecret.get().secret(),
            cluster.engine().multiUserRotationApplication(),
            cluster.asSecretAttachmentTarget(),
            cadence,
            cluster.vpc(),
            cluster.vpcSubnets().orElse(null));
    LOGGER.log(INFO, "Added multi user rotation {0} to {1}", id, cluster.clusterIdentifier());
    return Result.ok(job);
  }

  /**
   * Whether a job with the given id is registered for the cluster.
   *
   * @param cluster cluster
   * @param id job id
   * @return {@code true} if registered
   */
  public boolean isRegistered(final ManagedServerlessCluster cluster, final String id) {
    return registered.contains(key(cluster, id));
  }

  private boolean register(final ManagedServerlessCluster cluster, final String id) {
    return registered.add(key(cluster, id));
  }

  private static String key(final ManagedServerlessCluster cluster, final String id) {
    return cluster.clusterIdentifier() + "/" + id;
  }

  /** Secrets Manager accepts rotation intervals of 1 to 1000 whole days. */
  private static Duration cadence(final Duration automaticallyAfter) {
    final var cadence = Optional.ofNullable(automaticallyAfter).orElse(DEFAULT_AUTOMATICALLY_AFTER);
    if (!cadence.equals(Duration.ofDays(cadence.toDays())))
      throw new IllegalArgumentException(
          "automaticallyAfter must be a whole number of days, got " + cadence);
    if (cadence.toDays() < 1 || cadence.toDays() > 1000)
      throw new IllegalArgumentException(
          "automaticallyAfter must be between 1 and 1000 days, got " + cadence.toDays());
    return cadence;
  }
}
