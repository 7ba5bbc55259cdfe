package com.feedrelay.tais.state;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Facilities updated since the last broadcast cycle.
 *
 * <p>Coalesces any number of updates per facility into one pending flag, drained once per cycle.
 */
@Component
public class DirtyTracker {
  private final Set<String> dirty = ConcurrentHashMap.newKeySet();

  public void markDirty(String facility) {
    dirty.add(facility);
  }

  /**
   * Returns and clears the pending facilities.
   *
   * <p>A facility marked while the drain is in progress is either returned now or kept for the
   * next drain, never lost.
   */
  public List<String> drainDirty() {
    List<String> drained = new ArrayList<>();
    for (String facility : dirty) {
      if (dirty.remove(facility)) {
        drained.add(facility);
      }
    }
    return drained;
  }

  public boolean isDirty(String facility) {
    return dirty.contains(facility);
  }
}
