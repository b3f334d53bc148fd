package io.crisisintel.coordination.inventory;

public enum AllocationStatus {
  ALLOCATED,
  REVERTED
}
