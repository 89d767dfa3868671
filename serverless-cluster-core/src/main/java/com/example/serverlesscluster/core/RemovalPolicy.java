package com.example.serverlesscluster.core;

/** What happens to a resource when it is removed from its definition or replaced. */
public enum RemovalPolicy {
  DESTROY("Delete"),
  RETAIN("Retain"),
  SNAPSHOT("Snapshot");

  private final String deletionPolicy;

  RemovalPolicy(final String deletionPolicy) {
    this.deletionPolicy = deletionPolicy;
  }

  /**
   * Name of the matching CloudFormation {@code DeletionPolicy} value.
   *
   * @return deletion policy name
   */
  public String deletionPolicy() {
    return deletionPolicy;
  }
}
