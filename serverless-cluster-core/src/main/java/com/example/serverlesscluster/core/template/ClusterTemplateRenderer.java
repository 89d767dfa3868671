package com.example.serverlesscluster.core.template;

import com.example.serverlesscluster.core.ClusterDescription;
import com.example.serverlesscluster.core.scaling.ScalingConfiguration;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * Renders a {@link ClusterDescription} as an {@code AWS::RDS::DBCluster} template resource.
 *
 * <p>Property names follow CloudFormation. Absent optional values are left out so the provider
 * default applies.
 */
public final class ClusterTemplateRenderer {

  public static final String RESOURCE_TYPE = "AWS::RDS::DBCluster";

  private final ObjectMapper mapper;

  public ClusterTemplateRenderer() {
    this(new ObjectMapper());
  }

  public ClusterTemplateRenderer(final ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  /**
   * Builds the resource node.
   *
   * @param description cluster description
   * @return resource node with {@code Type}, deletion policies and {@code Properties}
   */
  public ObjectNode toResource(final ClusterDescription description) {
    final var resource = mapper.createObjectNode();
    resource.put("Type", RESOURCE_TYPE);
    resource.put("DeletionPolicy", description.removalPolicy().deletionPolicy());
    resource.put("UpdateReplacePolicy", description.removalPolicy().deletionPolicy());

    final var properties = resource.putObject("Properties");
    description.backupRetentionDays().ifPresent(d -> properties.put("BackupRetentionPeriod", d));
    description.databaseName().ifPresent(n -> properties.put("DatabaseName", n));
    description.dbClusterIdentifier().ifPresent(i -> properties.put("DBClusterIdentifier", i));
    description
        .dbClusterParameterGroupName()
        .ifPresent(n -> properties.put("DBClusterParameterGroupName", n));
    properties.put("DBSubnetGroupName", description.subnetGroup().subnetGroupName());
    description.deletionProtection().ifPresent(p -> properties.put("DeletionProtection", p));
    properties.put("Engine", description.engine());
    description.engineVersion().ifPresent(v -> properties.put("EngineVersion", v));
    properties.put("EngineMode", description.engineMode());
    properties.put("EnableHttpEndpoint", description.enableHttpEndpoint());
    description.kmsKeyId().ifPresent(k -> properties.put("KmsKeyId", k));
    properties.put("MasterUsername", description.masterUsername());
    properties.put("MasterUserPassword", description.masterUserPassword().render());
    description
        .scalingConfiguration()
        .ifPresent(s -> properties.set("ScalingConfiguration", scaling(s)));
    properties.put("StorageEncrypted", description.storageEncrypted());
    final var groups = properties.putArray("VpcSecurityGroupIds");
    description.vpcSecurityGroupIds().forEach(groups::add);
    return resource;
  }

  /**
   * Renders the resource as pretty-printed JSON.
   *
   * @param description cluster description
   * @return JSON document
   * @throws RuntimeException if serialization fails
   */
  public String render(final ClusterDescription description) {
    try {
      return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toResource(description));
    } catch (final JsonProcessingException exception) {
      throw new RuntimeException("Failed to render cluster template", exception);
    }
  }

  private ObjectNode scaling(final ScalingConfiguration scaling) {
    final var node = mapper.createObjectNode();
    node.put("AutoPause", scaling.autoPause());
    scaling.minCapacity().ifPresent(c -> node.put("MinCapacity", c));
    scaling.maxCapacity().ifPresent(c -> node.put("MaxCapacity", c));
    scaling.secondsUntilAutoPause().ifPresent(s -> node.put("SecondsUntilAutoPause", s));
    return node;
  }
}
