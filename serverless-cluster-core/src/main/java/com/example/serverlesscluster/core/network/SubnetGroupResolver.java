package com.example.serverlesscluster.core.network;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.serverlesscluster.core.RemovalPolicy;
import java.util.Locale;
import java.util.Optional;

/**
 * Reuses a caller-supplied subnet group or derives a new one scoped to the cluster id.
 *
 * <p>A derived group is retained on delete if and only if the cluster itself is retained.
 */
public final class SubnetGroupResolver {

  private static final System.Logger LOGGER = System.getLogger(SubnetGroupResolver.class.getName());

  private SubnetGroupResolver() {}

  public static SubnetGroup resolve(
      final String scopeId,
      final Optional<SubnetGroup> supplied,
      final SelectedSubnets selected,
      final RemovalPolicy clusterRemovalPolicy) {
    return supplied.orElseGet(
        () -> {
          final var name = subnetGroupName(scopeId);
          LOGGER.log(DEBUG, "Deriving subnet group {0} from {1} subnets", name, selected.size());
          return new SubnetGroup(
              name,
              "Subnets for " + scopeId + " database",
              selected.subnetIds(),
              clusterRemovalPolicy == RemovalPolicy.RETAIN ? RemovalPolicy.RETAIN : null,
              true);
        });
  }

  /** RDS stores subnet group names lowercased and accepts only a limited character set. */
  static String subnetGroupName(final String scopeId) {
    return (scopeId + "-subnets").toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._ -]", "-");
  }
}
