package com.example.serverlesscluster.core.template;

import static com.example.serverlesscluster.core.TestClusters.ENGINE;
import static com.example.serverlesscluster.core.TestClusters.vpc;
import static org.junit.jupiter.api.Assertions.*;

import com.example.serverlesscluster.core.ClusterDescription;
import com.example.serverlesscluster.core.RemovalPolicy;
import com.example.serverlesscluster.core.ServerlessClusterSpec;
import com.example.serverlesscluster.core.TestClusters;
import com.example.serverlesscluster.core.TestClusters.CountingSecretFactory;
import com.example.serverlesscluster.core.TestClusters.RecordingEngine;
import com.example.serverlesscluster.core.scaling.AuroraCapacityUnit;
import com.example.serverlesscluster.core.scaling.ServerlessScalingOptions;
import com.example.serverlesscluster.core.secrets.Credentials;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class ClusterTemplateRendererTest {

  private final ClusterTemplateRenderer renderer = new ClusterTemplateRenderer();

  private static ClusterDescription describe(final ServerlessClusterSpec.Builder spec) {
    return TestClusters.builder(new RecordingEngine(), new CountingSecretFactory())
        .build("Orders", spec.engine(ENGINE).vpc(vpc(2)).build())
        .description();
  }

  @Test
  @DisplayName("Should render type, policies and required properties")
  void shouldRenderRequiredProperties() {
    final var resource = renderer.toResource(describe(ServerlessClusterSpec.builder()));

    assertEquals("AWS::RDS::DBCluster", resource.get("Type").asText());
    assertEquals("Snapshot", resource.get("DeletionPolicy").asText());
    assertEquals("Snapshot", resource.get("UpdateReplacePolicy").asText());

    final var properties = resource.get("Properties");
    assertEquals("aurora-mysql", properties.get("Engine").asText());
    assertEquals("serverless", properties.get("EngineMode").asText());
    assertTrue(properties.get("StorageEncrypted").asBoolean());
    assertFalse(properties.get("EnableHttpEndpoint").asBoolean());
    assertEquals("orders-subnets", properties.get("DBSubnetGroupName").asText());
    assertEquals("admin", properties.get("MasterUsername").asText());
    assertEquals(
        "{{resolve:secretsmanager:arn:aws:secretsmanager:us-east-1:123456789012:secret:Orders"
            + ":SecretString:password::}}",
        properties.get("MasterUserPassword").asText());
    assertEquals("sg-orders", properties.get("VpcSecurityGroupIds").get(0).asText());
  }

  @Test
  @DisplayName("Should omit absent optional properties")
  void shouldOmitAbsentProperties() {
    final var properties =
        renderer.toResource(describe(ServerlessClusterSpec.builder())).get("Properties");

    assertFalse(properties.has("DeletionProtection"));
    assertFalse(properties.has("BackupRetentionPeriod"));
    assertFalse(properties.has("ScalingConfiguration"));
    assertFalse(properties.has("KmsKeyId"));
    assertFalse(properties.has("DBClusterIdentifier"));
  }

  @Test
  @DisplayName("Should render optional properties and scaling")
  void shouldRenderOptionalProperties() {
    final var resource =
        renderer.toResource(
            describe(
                ServerlessClusterSpec.builder()
                    .removalPolicy(RemovalPolicy.DESTROY)
                    .deletionProtection(false)
                    .backupRetention(Duration.ofDays(14))
                    .credentials(Credentials.fromPassword("root", "s3cret"))
                    .scaling(
                        ServerlessScalingOptions.builder()
                            .minCapacity(AuroraCapacityUnit.ACU_2)
                            .maxCapacity(AuroraCapacityUnit.ACU_8)
                            .autoPause(Duration.ofMinutes(5))
                            .build())));

    assertEquals("Delete", resource.get("DeletionPolicy").asText());
    final var properties = resource.get("Properties");
    assertFalse(properties.get("DeletionProtection").asBoolean());
    assertEquals(14, properties.get("BackupRetentionPeriod").asInt());
    assertEquals("s3cret", properties.get("MasterUserPassword").asText());

    final var scaling = properties.get("ScalingConfiguration");
    assertTrue(scaling.get("AutoPause").asBoolean());
    assertEquals(2, scaling.get("MinCapacity").asInt());
    assertEquals(8, scaling.get("MaxCapacity").asInt());
    assertEquals(300, scaling.get("SecondsUntilAutoPause").asInt());
  }

  @Test
  @DisplayName("Should render parseable JSON")
  void shouldRenderJson() throws Exception {
    final var description = describe(ServerlessClusterSpec.builder());

    final var parsed = new ObjectMapper().readTree(renderer.render(description));

    assertEquals(renderer.toResource(description), parsed);
  }
}
