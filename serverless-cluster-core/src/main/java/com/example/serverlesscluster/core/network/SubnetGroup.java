package com.example.serverlesscluster.core.network;

import com.example.serverlesscluster.core.RemovalPolicy;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** A named set of subnets the cluster may be placed in. */
public final class SubnetGroup {

  private final String subnetGroupName;
  private final String description;
  private final List<String> subnetIds;
  private final RemovalPolicy removalPolicy;
  private final boolean owned;

  /**
   * @param subnetGroupName name of the group
   * @param description description, {@code null} for existing groups
   * @param subnetIds member subnets, empty for existing groups
   * @param removalPolicy explicit removal policy, {@code null} for the provider default
   * @param owned whether the group is created together with the cluster
   */
  public SubnetGroup(
      final String subnetGroupName,
      final String description,
      final List<String> subnetIds,
      final RemovalPolicy removalPolicy,
      final boolean owned) {
    this.subnetGroupName = Objects.requireNonNull(subnetGroupName, "subnetGroupName");
    this.description = description;
    this.subnetIds = subnetIds == null ? List.of() : List.copyOf(subnetIds);
    this.removalPolicy = removalPolicy;
    this.owned = owned;
  }

  /**
   * References a subnet group that already exists.
   *
   * @param subnetGroupName name of the existing group
   * @return subnet group reference
   */
  public static SubnetGroup fromName(final String subnetGroupName) {
    return new SubnetGroup(subnetGroupName, null, List.of(), null, false);
  }

  public String subnetGroupName() {
    return subnetGroupName;
  }

  public String description() {
    return description;
  }

  public List<String> subnetIds() {
    return subnetIds;
  }

  public Optional<RemovalPolicy> removalPolicy() {
    return Optional.ofNullable(removalPolicy);
  }

  public boolean owned() {
    return owned;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) return true;
    if (!(o instanceof SubnetGroup)) return false;
    final var that = (SubnetGroup) o;
    return owned == that.owned
        && subnetGroupName.equals(that.subnetGroupName)
        && Objects.equals(description, that.description)
        && subnetIds.equals(that.subnetIds)
        && removalPolicy == that.removalPolicy;
  }

  @Override
  public int hashCode() {
    return Objects.hash(subnetGroupName, description, subnetIds, removalPolicy, owned);
  }

  @Override
  public String toString() {
    return "SubnetGroup[subnetGroupName="
        + subnetGroupName
        + ", subnetIds="
        + subnetIds
        + ", removalPolicy="
        + removalPolicy
        + ", owned="
        + owned
        + "]";
  }
}
