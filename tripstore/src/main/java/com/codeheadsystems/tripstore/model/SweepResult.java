package com.codeheadsystems.tripstore.model;

import org.immutables.value.Value;

/**
 * Rows removed by one sweep cycle.
 */
@Value.Immutable
public interface SweepResult {

  int expiredEntries();

  int expiredItems();

  int staleDirtyEntries();

  /**
   * Total int.
   *
   * @return the int
   */
  @Value.Derived
  default int total() {
    return expiredEntries() + expiredItems() + staleDirtyEntries();
  }
}
