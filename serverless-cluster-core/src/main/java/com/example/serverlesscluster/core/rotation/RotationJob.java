package com.example.serverlesscluster.core.rotation;

import com.example.serverlesscluster.core.network.SubnetSelection;
import com.example.serverlesscluster.core.network.Vpc;
import com.example.serverlesscluster.core.secrets.SecretAttachmentTarget;
import com.example.serverlesscluster.core.secrets.SecretReference;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Scheduled rotation of a secret against a cluster.
 *
 * <p>The rotation function runs inside the cluster's VPC and subnets so it can reach the database.
 * Multi-user rotation uses the master secret to change the password of the rotated user.
 */
public final class RotationJob {

  private final String id;
  private final SecretReference secret;
  private final SecretReference masterSecret;
  private final SecretRotationApplication application;
  private final SecretAttachmentTarget target;
  private final Duration automaticallyAfter;
  private final Vpc vpc;
  private final SubnetSelection vpcSubnets;

  /**
   * @param id identifier of the job within its cluster
   * @param secret secret being rotated
   * @param masterSecret secret of the master user, {@code null} for single-user rotation
   * @param application rotation procedure
   * @param target cluster the secret belongs to
   * @param automaticallyAfter time between rotations
   * @param vpc VPC the rotation function runs in
   * @param vpcSubnets subnets the rotation function runs in, {@code null} for the VPC default
   */
  public RotationJob(
      final String id,
      final SecretReference secret,
      final SecretReference masterSecret,
      final SecretRotationApplication application,
      final SecretAttachmentTarget target,
      final Duration automaticallyAfter,
      final Vpc vpc,
      final SubnetSelection vpcSubnets) {
    this.id = Objects.requireNonNull(id, "id");
    this.secret = Objects.requireNonNull(secret, "secret");
    this.masterSecret = masterSecret;
    this.application = Objects.requireNonNull(application, "application");
    this.target = Objects.requireNonNull(target, "target");
    this.automaticallyAfter = Objects.requireNonNull(automaticallyAfter, "automaticallyAfter");
    this.vpc = Objects.requireNonNull(vpc, "vpc");
    this.vpcSubnets = vpcSubnets;
  }

  public String id() {
    return id;
  }

  public SecretReference secret() {
    return secret;
  }

  public Optional<SecretReference> masterSecret() {
    return Optional.ofNullable(masterSecret);
  }

  public SecretRotationApplication application() {
    return application;
  }

  public SecretAttachmentTarget target() {
    return target;
  }

  /** Time between rotations, always a whole number of days. */
  public Duration automaticallyAfter() {
    return automaticallyAfter;
  }

  public Vpc vpc() {
    return vpc;
  }

  public Optional<SubnetSelection> vpcSubnets() {
    return Optional.ofNullable(vpcSubnets);
  }

  public boolean isMultiUser() {
    return masterSecret != null;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) return true;
    if (!(o instanceof RotationJob)) return false;
    final var that = (RotationJob) o;
    return id.equals(that.id)
        && secret.equals(that.secret)
        && Objects.equals(masterSecret, that.masterSecret)
        && application.equals(that.application)
        && target.equals(that.target)
        && automaticallyAfter.equals(that.automaticallyAfter)
        && vpc.equals(that.vpc)
        && Objects.equals(vpcSubnets, that.vpcSubnets);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        id, secret, masterSecret, application, target, automaticallyAfter, vpc, vpcSubnets);
  }

  @Override
  public String toString() {
    return "RotationJob[id="
        + id
        + ", secret="
        + secret.secretId()
        + ", application="
        + application.applicationId()
        + ", target="
        + target.targetId()
        + ", automaticallyAfter="
        + automaticallyAfter
        + "]";
  }
}
