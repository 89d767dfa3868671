package com.example.serverlesscluster.core.network;

import static java.lang.System.Logger.Level.DEBUG;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Picks the caller-supplied security groups or creates the single default group. */
public final class SecurityGroupResolver {

  static final String DEFAULT_DESCRIPTION = "RDS security group";

  private static final System.Logger LOGGER =
      System.getLogger(SecurityGroupResolver.class.getName());

  private final SecurityGroupFactory factory;

  public SecurityGroupResolver(final SecurityGroupFactory factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  public List<SecurityGroup> resolve(
      final String scopeId, final Vpc vpc, final Optional<List<SecurityGroup>> supplied) {
    return supplied
        .map(List::copyOf)
        .orElseGet(
            () -> {
              LOGGER.log(DEBUG, "Creating default security group for {0}", scopeId);
              return List.of(factory.create(scopeId, vpc, DEFAULT_DESCRIPTION));
            });
  }
}
