/*
 * Copyright (C) 2026  The Async Tablet Authors.  All rights reserved.
 * This file is part of Async Tablet.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *   - Redistributions of source code must retain the above copyright notice,
 *     this list of conditions and the following disclaimer.
 *   - Redistributions in binary form must reproduce the above copyright notice,
 *     this list of conditions and the following disclaimer in the documentation
 *     and/or other materials provided with the distribution.
 *   - Neither the name of the StumbleUpon nor the names of its contributors
 *     may be used to endorse or promote products derived from this software
 *     without specific prior written permission.
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS"
 * AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE
 * IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE
 * ARE DISCLAIMED.  IN NO EVENT SHALL THE COPYRIGHT HOLDER OR CONTRIBUTORS BE
 * LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR
 * CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF
 * SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS; OR BUSINESS
 * INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN
 * CONTRACT, STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE)
 * ARISING IN ANY WAY OUT OF THE USE OF THIS SOFTWARE, EVEN IF ADVISED OF THE
 * POSSIBILITY OF SUCH DAMAGE.
 */
package org.tablet.async;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableSortedMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Local view of which servers host which tablets.
 *
 * <h1>Layout</h1>
 * There are three maps:
 * <ul>
 *   <li>{@code tablets}: tablet ID to {@link TabletInfo}.  Records are
 *   immutable and replaced wholesale, so a reader holding one never sees
 *   a half-updated replica list.</li>
 *   <li>{@code tables}: table name to a {@link KeyIndex}, which maps the
 *   start key of each tablet to its ID.  The index itself is an immutable
 *   sorted map that gets swapped on every change of the table.</li>
 *   <li>{@code servers}: the server directory, UUID to {@link TabletServer}.
 *   Tablet records only hold UUIDs, so a server is shared by every tablet
 *   it hosts and updated in place.</li>
 * </ul>
 *
 * <h1>Concurrency</h1>
 * Lookups never lock.  Writers of a given table serialize on its
 * {@link KeyIndex}, so refreshing one table never blocks another.  When a
 * table is refreshed, records are installed first, then the index is
 * swapped, then vanished tablets are removed.  A reader racing with that
 * sequence may find a record through the old index: it's still a complete
 * record, just an older one.
 * <p>
 * Invalidations don't take the table lock: they compare-and-swap the record
 * for an invalidated copy of itself.
 */
final class LocationCache {

  private static final Logger LOG = LoggerFactory.getLogger(LocationCache.class);

  /** Start key to tablet ID, for one table.  */
  private static final class KeyIndex {
    /** Immutable snapshot, replaced while holding this object's lock.  */
    volatile ImmutableSortedMap<byte[], String> by_start_key =
      ImmutableSortedMap.<byte[], String>orderedBy(Bytes.MEMCMP).build();
  }

  private final Ticker ticker;
  private final long staleness_nanos;
  private final long eviction_grace_nanos;

  private final ConcurrentHashMap<String, TabletInfo> tablets =
    new ConcurrentHashMap<String, TabletInfo>();

  private final ConcurrentHashMap<String, KeyIndex> tables =
    new ConcurrentHashMap<String, KeyIndex>();

  private final ConcurrentHashMap<String, TabletServer> servers =
    new ConcurrentHashMap<String, TabletServer>();

  /** Rotation cursor for {@link ReplicaSelection#ANY_AVAILABLE}.  */
  private final AtomicInteger cursor = new AtomicInteger();

  private final Counter tablets_refreshed = new Counter();
  private final Counter tablets_removed = new Counter();
  private final Counter invalidations = new Counter();
  private final Counter tablet_changes = new Counter();
  private final Counter servers_evicted = new Counter();

  /**
   * Constructor.
   * @param ticker Where to read the time from.
   * @param staleness_ms How long a record can be used without refreshing it.
   * @param eviction_grace_ms How long a server nobody refers to stays in
   * the directory.
   */
  LocationCache(final Ticker ticker, final long staleness_ms,
                final long eviction_grace_ms) {
    if (staleness_ms <= 0) {
      throw new IllegalArgumentException("Staleness must be positive: "
                                         + staleness_ms);
    }
    if (eviction_grace_ms < 0) {
      throw new IllegalArgumentException("Negative eviction grace: "
                                         + eviction_grace_ms);
    }
    this.ticker = ticker;
    this.staleness_nanos = TimeUnit.MILLISECONDS.toNanos(staleness_ms);
    this.eviction_grace_nanos = TimeUnit.MILLISECONDS.toNanos(eviction_grace_ms);
  }

  // ------- //
  // Lookups //
  // ------- //

  /**
   * Finds the tablet of a table that contains the given key.
   * @return The record, fresh or not, or {@code null} if we don't know of
   * any tablet for this key.
   */
  TabletInfo lookupByKey(final String table, final byte[] key) {
    final KeyIndex index = tables.get(table);
    if (index == null) {
      return null;
    }
    final Map.Entry<byte[], String> entry = index.by_start_key.floorEntry(key);
    if (entry == null) {
      return null;
    }
    final TabletInfo tablet = tablets.get(entry.getValue());
    // The tablet may have been removed (or may have shrunk) since we read
    // the index, in which case the new index doesn't point to it anymore.
    if (tablet == null || !tablet.containsKey(key)) {
      return null;
    }
    return tablet;
  }

  /**
   * Finds a tablet by ID.
   * @return The record, fresh or not, or {@code null} if we don't know of
   * this tablet or if it belongs to another table.
   */
  TabletInfo lookupById(final String table, final String tablet_id) {
    final TabletInfo tablet = tablets.get(tablet_id);
    if (tablet == null || !tablet.table().equals(table)) {
      return null;
    }
    return tablet;
  }

  /** Returns {@code true} if the given record can be used as-is.  */
  boolean isFresh(final TabletInfo tablet) {
    return tablet.isFresh(ticker.read(), staleness_nanos);
  }

  /**
   * Picks a replica of a tablet.
   * @param tablet The tablet to route to.
   * @param locality Who's asking.
   * @param policy How to choose.
   * @param excluded UUIDs of servers not to choose, possibly {@code null}.
   * @throws NoAvailableReplicaException if no replica can be used.
   * @throws NoLeaderKnownException if we want the leader but don't know it.
   */
  TabletLocation select(final TabletInfo tablet,
                        final ClientLocality locality,
                        final ReplicaSelection policy,
                        final Set<String> excluded) {
    final ReplicaChoice choice =
      ReplicaSelector.select(tablet.tabletId(), resolve(tablet), locality,
                             policy, excluded,
                             policy == ReplicaSelection.ANY_AVAILABLE
                             ? cursor.getAndIncrement() : 0);
    return new TabletLocation(tablet, choice);
  }

  /** Turns the UUIDs of a tablet's replicas into directory entries.  */
  private List<RemoteReplica> resolve(final TabletInfo tablet) {
    final List<TabletInfo.Replica> replicas = tablet.replicas();
    final List<RemoteReplica> resolved =
      new ArrayList<RemoteReplica>(replicas.size());
    for (final TabletInfo.Replica replica : replicas) {
      final TabletServer server = servers.get(replica.serverUuid());
      if (server == null) {
        // Only happens if the entry got evicted right as the tablet was
        // refreshed.  The next refresh will bring it back.
        LOG.warn("Server " + replica.serverUuid() + " of " + tablet
                 + " isn't in the directory, ignoring that replica");
        continue;
      }
      resolved.add(new RemoteReplica(server, replica.role()));
    }
    return resolved;
  }

  // --------- //
  // Refreshes //
  // --------- //

  /**
   * Installs what the metadata authority told us about every tablet of a
   * table.
   * <p>
   * The payload must cover the whole key space of the table without gaps
   * or overlaps, otherwise nothing is installed.  Tablets we knew of that
   * aren't in the payload anymore are forgotten.
   * @param table The table the payload is about.
   * @param locations Every tablet of the table, in any order.
   * @return The new records, sorted by start key.
   * @throws BrokenMetadataException if the payload is inconsistent.
   */
  List<TabletInfo> refreshTable(final String table,
                                final List<TabletLocations> locations) {
    final List<TabletLocations> sorted = checkCoverage(table, locations);
    final KeyIndex index = indexOf(table);
    final List<TabletInfo> installed =
      new ArrayList<TabletInfo>(sorted.size());
    synchronized (index) {
      final long now = ticker.read();
      final ImmutableSortedMap.Builder<byte[], String> builder =
        ImmutableSortedMap.orderedBy(Bytes.MEMCMP);
      final Set<String> present = new HashSet<String>(sorted.size());
      for (final TabletLocations location : sorted) {
        installed.add(install(table, location, now));
        builder.put(location.getStartKey(), location.getTabletId());
        present.add(location.getTabletId());
      }
      final ImmutableSortedMap<byte[], String> old = index.by_start_key;
      index.by_start_key = builder.build();
      for (final String tablet_id : old.values()) {
        if (!present.contains(tablet_id)) {
          forget(tablet_id, now);
        }
      }
    }
    return installed;
  }

  /**
   * Installs what the metadata authority told us about a single tablet.
   * <p>
   * Tablets of the same table whose range intersects the new one are
   * assumed to have been split or merged into it and are forgotten, so
   * cached ranges never overlap.
   * @param table The table the tablet belongs to.
   * @param location Where the tablet lives.
   * @return The new record.
   * @throws BrokenMetadataException if the payload is inconsistent.
   */
  TabletInfo refresh(final String table, final TabletLocations location) {
    checkReplicas(table, location);
    final KeyIndex index = indexOf(table);
    synchronized (index) {
      final long now = ticker.read();
      final TabletInfo tablet = install(table, location, now);
      final ImmutableSortedMap.Builder<byte[], String> builder =
        ImmutableSortedMap.orderedBy(Bytes.MEMCMP);
      final List<String> overlapped = new ArrayList<String>();
      for (final Map.Entry<byte[], String> entry
           : index.by_start_key.entrySet()) {
        final String tablet_id = entry.getValue();
        if (tablet_id.equals(tablet.tabletId())) {
          continue;  // Its start key may have moved, re-added below.
        }
        final TabletInfo other = tablets.get(tablet_id);
        if (other == null || tablet.overlaps(other)) {
          overlapped.add(tablet_id);
          continue;
        }
        builder.put(entry.getKey(), tablet_id);
      }
      builder.put(tablet.startKey(), tablet.tabletId());
      index.by_start_key = builder.build();
      for (final String tablet_id : overlapped) {
        forget(tablet_id, now);
      }
      return tablet;
    }
  }

  /**
   * Builds and swaps in a new record for a tablet, creating or updating
   * the directory entries of its replicas.
   * Must be called with the lock of the table's index held.
   */
  private TabletInfo install(final String table,
                             final TabletLocations location,
                             final long now) {
    final List<TabletLocations.Replica> incoming = location.getReplicas();
    final List<TabletInfo.Replica> replicas =
      new ArrayList<TabletInfo.Replica>(incoming.size());
    for (final TabletLocations.Replica replica : incoming) {
      updateServer(replica, now);
      replicas.add(new TabletInfo.Replica(replica.getServerUuid(),
                                          replica.getRole()));
    }
    final String tablet_id = location.getTabletId();
    final TabletInfo old = tablets.get(tablet_id);
    final TabletInfo tablet = new TabletInfo(table, tablet_id,
                                             location.getStartKey(),
                                             location.getEndKey(),
                                             replicas,
                                             old == null ? 1 : old.epoch() + 1,
                                             now);
    // Only invalidations can race with us, and they're superseded by this.
    tablets.put(tablet_id, tablet);
    tablets_refreshed.increment();
    if (old == null) {
      LOG.info("Discovered " + tablet);
    } else {
      if (old.isInvalidated()) {
        tabletChanged(new TabletChangeEvent(old, tablet,
                                            resolvedAt(old, now)));
      }
      if (LOG.isDebugEnabled()) {
        LOG.debug("Refreshed " + tablet + ", replacing " + old);
      }
    }
    return tablet;
  }

  /**
   * Forgets a tablet that's no longer part of its table.
   * Must be called with the lock of the table's index held.
   */
  private void forget(final String tablet_id, final long now) {
    final TabletInfo old = tablets.remove(tablet_id);
    if (old == null) {
      return;
    }
    tablets_removed.increment();
    LOG.info("Removed " + old + ", it's no longer part of its table");
    if (old.isInvalidated()) {
      tabletChanged(new TabletChangeEvent(old, null, resolvedAt(old, now)));
    }
  }

  /**
   * Returns when the change to an invalidated record got resolved.
   * {@link #invalidate} doesn't take the lock of the table, so it can stamp
   * a record after the refresh replacing it read the clock.
   */
  private static long resolvedAt(final TabletInfo old, final long now) {
    return old.invalidatedNanos() - now > 0 ? old.invalidatedNanos() : now;
  }

  private void tabletChanged(final TabletChangeEvent event) {
    tablet_changes.increment();
    LOG.info("Stale routing resolved: " + event);
  }

  /** Creates or updates the directory entry of a replica's server.  */
  private TabletServer updateServer(final TabletLocations.Replica replica,
                                    final long now) {
    final String uuid = replica.getServerUuid();
    TabletServer server = servers.get(uuid);
    if (server == null) {
      server = new TabletServer(uuid, replica.getAddresses(),
                                replica.getCloudInfo(), now);
      final TabletServer existing = servers.putIfAbsent(uuid, server);
      if (existing == null) {
        LOG.info("Discovered " + server);
        return server;
      }
      server = existing;  // Lost a race with another table's refresh.
    }
    if (server.update(replica.getAddresses(), replica.getCloudInfo(), now)) {
      LOG.info("Server " + uuid + " changed: " + server);
    }
    return server;
  }

  private KeyIndex indexOf(final String table) {
    KeyIndex index = tables.get(table);
    if (index == null) {
      index = new KeyIndex();
      final KeyIndex existing = tables.putIfAbsent(table, index);
      if (existing != null) {
        index = existing;
      }
    }
    return index;
  }

  /** Sorts tablets by start key.  */
  private static final Comparator<TabletLocations> BY_START_KEY =
    new Comparator<TabletLocations>() {
      @Override
      public int compare(final TabletLocations a, final TabletLocations b) {
        return Bytes.memcmp(a.getStartKey(), b.getStartKey());
      }
    };

  /**
   * Makes sure the tablets of a table cover its whole key space, each key
   * belonging to exactly one tablet.
   * @return The tablets sorted by start key.
   * @throws BrokenMetadataException if they don't.
   */
  static List<TabletLocations> checkCoverage(final String table,
                                             final List<TabletLocations> locations) {
    if (locations == null || locations.isEmpty()) {
      throw new BrokenMetadataException(table, "No tablet at all");
    }
    final List<TabletLocations> sorted =
      new ArrayList<TabletLocations>(locations);
    Collections.sort(sorted, BY_START_KEY);
    final Set<String> ids = new HashSet<String>(sorted.size());
    byte[] expected_start = TabletLocator.EMPTY_ARRAY;
    for (int i = 0; i < sorted.size(); i++) {
      final TabletLocations location = sorted.get(i);
      checkReplicas(table, location);
      if (!ids.add(location.getTabletId())) {
        throw new BrokenMetadataException(table, "Tablet "
          + location.getTabletId() + " is listed more than once");
      }
      if (Bytes.memcmp(location.getStartKey(), expected_start) != 0) {
        throw new BrokenMetadataException(table, (i == 0
          ? "The first tablet should start at the beginning of the table: "
          : "Gap or overlap between tablets: expected start_key="
            + Bytes.pretty(expected_start) + " but got ") + location);
      }
      final byte[] end_key = location.getEndKey();
      final boolean last = i == sorted.size() - 1;
      if (end_key.length == 0 && !last) {
        throw new BrokenMetadataException(table, "Only the last tablet can"
          + " extend to the end of the table: " + location);
      } else if (end_key.length != 0
                 && Bytes.memcmp(location.getStartKey(), end_key) >= 0) {
        throw new BrokenMetadataException(table, "Empty or inverted key"
          + " range: " + location);
      }
      expected_start = end_key;
    }
    if (expected_start.length != 0) {
      throw new BrokenMetadataException(table, "The last tablet should"
        + " extend to the end of the table: " + sorted.get(sorted.size() - 1));
    }
    return sorted;
  }

  /** Makes sure every replica of a tablet has an identity and an address. */
  private static void checkReplicas(final String table,
                                    final TabletLocations location) {
    for (final TabletLocations.Replica replica : location.getReplicas()) {
      final String uuid = replica.getServerUuid();
      if (uuid == null || uuid.isEmpty()) {
        throw new BrokenMetadataException(table, "Replica without a UUID in "
                                          + location);
      } else if (replica.getAddresses().isEmpty()) {
        throw new BrokenMetadataException(table, "Replica " + uuid
                                          + " without an address in "
                                          + location);
      } else if (replica.getRole() == null) {
        throw new BrokenMetadataException(table, "Replica " + uuid
                                          + " without a role in " + location);
      }
    }
  }

  // ------------- //
  // Invalidations //
  // ------------- //

  /**
   * Marks a tablet's record as stale without forgetting it.
   * <p>
   * The next lookup will refresh it, and the old record remains usable as
   * a fallback if the refresh fails.
   * @return {@code false} if we didn't know of this tablet.
   */
  boolean invalidate(final String tablet_id) {
    final long now = ticker.read();
    while (true) {
      final TabletInfo old = tablets.get(tablet_id);
      if (old == null) {
        return false;
      } else if (old.isInvalidated()) {
        return true;
      } else if (tablets.replace(tablet_id, old, old.invalidate(now))) {
        invalidations.increment();
        LOG.info("Invalidated " + old);
        return true;
      }
      // Lost a race with a refresh or another invalidation, try again.
    }
  }

  /**
   * Records what the transport learned about a server's health.
   * @return {@code false} if this server isn't in the directory.
   */
  boolean setServerHealth(final String uuid,
                          final TabletServer.Health health) {
    final TabletServer server = servers.get(uuid);
    if (server == null) {
      return false;
    }
    if (server.getHealth() != health) {
      LOG.info("Server " + uuid + " is now " + health);
    }
    server.setHealth(health);
    return true;
  }

  // -------- //
  // Eviction //
  // -------- //

  /**
   * Removes from the directory the servers no tablet has referred to for
   * longer than the grace period.
   * @return The number of servers evicted.
   */
  int evictUnreferencedServers() {
    final long now = ticker.read();
    final Set<String> referenced = referencedServers();
    int evicted = 0;
    for (final TabletServer server : servers.values()) {
      if (referenced.contains(server.getUuid())) {
        server.markReferenced();
        continue;
      }
      final long since = server.markUnreferenced(now);
      if (now - since < eviction_grace_nanos
          || !servers.remove(server.getUuid(), server)) {
        continue;
      }
      // A refresh may have started to use it again since we looked.
      if (referencedServers().contains(server.getUuid())
          && servers.putIfAbsent(server.getUuid(), server) == null) {
        server.markReferenced();
        continue;
      }
      evicted++;
      servers_evicted.increment();
      LOG.info("Evicted " + server + ", no tablet referred to it for "
               + TimeUnit.NANOSECONDS.toMillis(now - since) + "ms and the"
               + " metadata authority last listed it "
               + TimeUnit.NANOSECONDS.toMillis(now - server.lastSeenNanos())
               + "ms ago");
    }
    return evicted;
  }

  private Set<String> referencedServers() {
    final Set<String> uuids = new HashSet<String>(servers.size());
    for (final TabletInfo tablet : tablets.values()) {
      for (final TabletInfo.Replica replica : tablet.replicas()) {
        uuids.add(replica.serverUuid());
      }
    }
    return uuids;
  }

  // ----- //
  // Stats //
  // ----- //

  TabletServer server(final String uuid) {
    return servers.get(uuid);
  }

  int numTablets() {
    return tablets.size();
  }

  int numServers() {
    return servers.size();
  }

  /** Returns the ID of every tablet we know of for this table, in order. */
  List<String> tabletIds(final String table) {
    final KeyIndex index = tables.get(table);
    if (index == null) {
      return Collections.emptyList();
    }
    return new ArrayList<String>(index.by_start_key.values());
  }

  long tabletsRefreshed() {
    return tablets_refreshed.get();
  }

  long tabletsRemoved() {
    return tablets_removed.get();
  }

  long invalidations() {
    return invalidations.get();
  }

  long tabletChanges() {
    return tablet_changes.get();
  }

  long serversEvicted() {
    return servers_evicted.get();
  }

}
