/* Repute © 2025 Repute Devs — MIT */
package dev.repute.ledger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** Participants excluded from voting. */
public final class DisabledVoters {
  private final Set<Long> ids = ConcurrentHashMap.newKeySet();

  public boolean contains(long userId) {
    return ids.contains(userId);
  }

  /**
   * Flips a participant's membership.
   *
   * @return {@code true} if the participant is now disabled
   */
  public synchronized boolean toggle(long userId) {
    if (ids.remove(userId)) {
      return false;
    }
    ids.add(userId);
    return true;
  }

  /** Sorted copy. */
  public synchronized List<Long> ids() {
    List<Long> out = new ArrayList<>(ids);
    out.sort(null);
    return out;
  }

  public synchronized void load(Collection<Long> userIds) {
    ids.clear();
    ids.addAll(userIds);
  }
}
