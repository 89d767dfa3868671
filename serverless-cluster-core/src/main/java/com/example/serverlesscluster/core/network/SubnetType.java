package com.example.serverlesscluster.core.network;

/** Routing category of a subnet. */
public enum SubnetType {
  PUBLIC,
  PRIVATE_WITH_EGRESS,
  PRIVATE_ISOLATED
}
