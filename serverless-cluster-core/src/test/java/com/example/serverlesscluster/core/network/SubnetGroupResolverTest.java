package com.example.serverlesscluster.core.network;

import static org.junit.jupiter.api.Assertions.*;

import com.example.serverlesscluster.core.RemovalPolicy;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class SubnetGroupResolverTest {

  private static final SelectedSubnets SELECTED =
      new SelectedSubnets(List.of("subnet-a", "subnet-b"), List.of("us-east-1a", "us-east-1b"));

  @Test
  @DisplayName("Should derive a group named after the cluster")
  void shouldDeriveGroup() {
    final var group =
        SubnetGroupResolver.resolve("Orders", Optional.empty(), SELECTED, RemovalPolicy.SNAPSHOT);

    assertEquals("orders-subnets", group.subnetGroupName());
    assertEquals("Subnets for Orders database", group.description());
    assertEquals(List.of("subnet-a", "subnet-b"), group.subnetIds());
    assertEquals(Optional.empty(), group.removalPolicy());
    assertTrue(group.owned());
  }

  @Test
  @DisplayName("Should retain the group only with a retained cluster")
  void shouldFollowRetainPolicy() {
    assertEquals(
        Optional.of(RemovalPolicy.RETAIN),
        SubnetGroupResolver.resolve("Orders", Optional.empty(), SELECTED, RemovalPolicy.RETAIN)
            .removalPolicy());
    assertEquals(
        Optional.empty(),
        SubnetGroupResolver.resolve("Orders", Optional.empty(), SELECTED, RemovalPolicy.DESTROY)
            .removalPolicy());
  }

  @Test
  @DisplayName("Should return a supplied group unchanged")
  void shouldReuseSuppliedGroup() {
    final var existing = SubnetGroup.fromName("shared");

    assertSame(
        existing,
        SubnetGroupResolver.resolve(
            "Orders", Optional.of(existing), SELECTED, RemovalPolicy.RETAIN));
    assertFalse(existing.owned());
  }

  @Test
  @DisplayName("Should replace characters RDS does not accept in names")
  void shouldSanitizeName() {
    assertEquals("app-orders-db-subnets", SubnetGroupResolver.subnetGroupName("App/Orders:DB"));
  }
}
