package com.example.serverlesscluster.core.engine;

import static org.junit.jupiter.api.Assertions.*;

import com.example.serverlesscluster.core.rotation.SecretRotationApplication;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

public class EngineDescriptorTest {

  @Test
  @DisplayName("Should describe aurora-postgresql with the postgres rotation applications")
  void shouldDescribePostgres() {
    final var engine = EngineDescriptor.auroraPostgres(null);

    assertEquals("aurora-postgresql", engine.engineType());
    assertEquals(Optional.empty(), engine.engineVersion());
    assertEquals(
        SecretRotationApplication.POSTGRES_ROTATION_SINGLE_USER,
        engine.singleUserRotationApplication());
    assertEquals(
        SecretRotationApplication.POSTGRES_ROTATION_MULTI_USER,
        engine.multiUserRotationApplication());
  }

  @Test
  @DisplayName("Should offer the default parameter group only when none is configured")
  void shouldBindDefaultParameterGroup() {
    final var group = new ParameterGroup("default.aurora-mysql5.7");
    final var engine = EngineDescriptor.auroraMysql("5.7").withDefaultParameterGroup(group);

    assertEquals(Optional.of(group), engine.bindToCluster(Optional.empty()).parameterGroup());
    assertEquals(
        Optional.empty(),
        engine.bindToCluster(Optional.of(new ParameterGroup("custom"))).parameterGroup());
  }

  @Test
  @DisplayName("Should bind nothing without a default parameter group")
  void shouldBindNothingWithoutDefault() {
    assertEquals(
        Optional.empty(),
        EngineDescriptor.auroraMysql("5.7").bindToCluster(Optional.empty()).parameterGroup());
  }
}
