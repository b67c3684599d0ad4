/* Repute © 2025 Repute Devs — MIT */
package dev.repute.ledger;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Guild ID to the channel receiving that guild's audit entries. */
public final class AuditSinks {
  private final ConcurrentMap<Long, Long> channels = new ConcurrentHashMap<>();

  public void set(long guildId, long channelId) {
    channels.put(guildId, channelId);
  }

  public Optional<Long> find(long guildId) {
    return Optional.ofNullable(channels.get(guildId));
  }

  /** Sorted copy. */
  public Map<Long, Long> asMap() {
    return new TreeMap<>(channels);
  }

  public synchronized void load(Map<Long, Long> sinks) {
    channels.clear();
    channels.putAll(sinks);
  }
}
