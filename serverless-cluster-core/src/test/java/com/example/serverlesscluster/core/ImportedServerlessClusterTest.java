package com.example.serverlesscluster.core;

import static org.junit.jupiter.api.Assertions.*;

import com.example.serverlesscluster.core.network.SecurityGroup;
import com.example.serverlesscluster.core.secrets.AttachmentTargetType;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

public class ImportedServerlessClusterTest {

  private static final String WRITER = "orders.cluster-abc.us-east-1.rds.amazonaws.com";
  private static final String READER = "orders.cluster-ro-abc.us-east-1.rds.amazonaws.com";

  @Nested
  @DisplayName("Endpoints")
  class Endpoints {

    @Test
    @DisplayName("Should return exact endpoints when address and port are known")
    void shouldReturnEndpoints() {
      final var cluster =
          ImportedServerlessCluster.fromAttributes(
              ServerlessClusterAttributes.of("orders")
                  .withPort(5432)
                  .withClusterEndpointAddress(WRITER)
                  .withReaderEndpointAddress(READER));

      assertEquals(new Endpoint(WRITER, 5432), cluster.clusterEndpoint().orElseThrow());
      assertEquals(new Endpoint(READER, 5432), cluster.clusterReadEndpoint().orElseThrow());
    }

    @Test
    @DisplayName("Should fail both endpoints when nothing is known")
    void shouldFailWithoutAddressAndPort() {
      final var cluster =
          ImportedServerlessCluster.fromAttributes(ServerlessClusterAttributes.of("orders"));

      final var writer = cluster.clusterEndpoint().error().orElseThrow();
      final var reader = cluster.clusterReadEndpoint().error().orElseThrow();
      assertEquals(ClusterError.Kind.PRECONDITION, writer.kind());
      assertEquals(ClusterError.Kind.PRECONDITION, reader.kind());
      assertEquals(
          "Cannot access `clusterEndpoint` of an imported cluster without an endpoint address"
              + " and port",
          writer.message());
    }

    @Test
    @DisplayName("Should fail when the address is known but the port is not")
    void shouldFailWithoutPort() {
      final var cluster =
          ImportedServerlessCluster.fromAttributes(
              ServerlessClusterAttributes.of("orders").withClusterEndpointAddress(WRITER));

      assertFalse(cluster.clusterEndpoint().isOk());
    }

    @Test
    @DisplayName("Should check the reader address independently of the writer")
    void shouldCheckReaderIndependently() {
      final var cluster =
          ImportedServerlessCluster.fromAttributes(
              ServerlessClusterAttributes.of("orders")
                  .withPort(5432)
                  .withClusterEndpointAddress(WRITER));

      assertTrue(cluster.clusterEndpoint().isOk());
      assertFalse(cluster.clusterReadEndpoint().isOk());
    }

    @Test
    @DisplayName("Should treat port 0 as unknown")
    void shouldTreatZeroPortAsUnknown() {
      final var cluster =
          ImportedServerlessCluster.fromAttributes(
              ServerlessClusterAttributes.of("orders")
                  .withPort(0)
                  .withClusterEndpointAddress(WRITER)
                  .withReaderEndpointAddress(READER));

      assertEquals(
          ClusterError.Kind.PRECONDITION, cluster.clusterEndpoint().error().orElseThrow().kind());
      assertEquals(
          ClusterError.Kind.PRECONDITION,
          cluster.clusterReadEndpoint().error().orElseThrow().kind());
      assertEquals(Optional.empty(), cluster.connections().defaultPort());
    }

    @Test
    @DisplayName("Should treat blank addresses as unknown")
    void shouldTreatBlankAddressAsUnknown() {
      final var cluster =
          ImportedServerlessCluster.fromAttributes(
              ServerlessClusterAttributes.of("orders")
                  .withPort(5432)
                  .withClusterEndpointAddress("")
                  .withReaderEndpointAddress("  "));

      assertEquals(
          ClusterError.Kind.PRECONDITION, cluster.clusterEndpoint().error().orElseThrow().kind());
      assertEquals(
          ClusterError.Kind.PRECONDITION,
          cluster.clusterReadEndpoint().error().orElseThrow().kind());
      assertEquals(Optional.of(5432), cluster.connections().defaultPort());
    }
  }

  @Nested
  @DisplayName("Connections")
  class ConnectionsDescriptor {

    @Test
    @DisplayName("Should carry supplied security groups and the port as default")
    void shouldCarrySecurityGroupsAndPort() {
      final var cluster =
          ImportedServerlessCluster.fromAttributes(
              ServerlessClusterAttributes.of("orders")
                  .withPort(5432)
                  .withSecurityGroups(List.of(SecurityGroup.fromId("sg-1"))));

      assertEquals(List.of("sg-1"), cluster.connections().securityGroupIds());
      assertEquals(Optional.of(5432), cluster.connections().defaultPort());
    }

    @Test
    @DisplayName("Should have no default port when the port is unknown")
    void shouldHaveNoDefaultPort() {
      final var cluster =
          ImportedServerlessCluster.fromAttributes(ServerlessClusterAttributes.of("orders"));

      assertEquals(Optional.empty(), cluster.connections().defaultPort());
      assertTrue(cluster.connections().securityGroups().isEmpty());
    }
  }

  @Test
  @DisplayName("Should expose identifier, state and attachment target")
  void shouldExposeIdentity() {
    final ServerlessCluster cluster =
        ImportedServerlessCluster.fromAttributes(ServerlessClusterAttributes.of("orders"));

    assertEquals("orders", cluster.clusterIdentifier());
    assertEquals(ClusterState.ATTRIBUTES_KNOWN, cluster.state());
    assertEquals("orders", cluster.asSecretAttachmentTarget().targetId());
    assertEquals(
        AttachmentTargetType.RDS_DB_CLUSTER, cluster.asSecretAttachmentTarget().targetType());
  }
}
