package com.example.serverlesscluster.core.secrets;

/** Kind of resource a secret can be attached to. */
public enum AttachmentTargetType {
  RDS_DB_INSTANCE("AWS::RDS::DBInstance"),
  RDS_DB_CLUSTER("AWS::RDS::DBCluster");

  private final String resourceType;

  AttachmentTargetType(final String resourceType) {
    this.resourceType = resourceType;
  }

  public String resourceType() {
    return resourceType;
  }
}
