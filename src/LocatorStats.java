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

/**
 * {@link TabletLocator} usage statistics.
 * <p>
 * This is an immutable snapshot of usage statistics of the locator.
 * Please note that not all the numbers in the snapshot are collected
 * atomically, so although each individual number is up-to-date as of
 * the time this object is created, small inconsistencies between numbers
 * can arise.
 */
public final class LocatorStats {

  private final long cache_hits;
  private final long cache_misses;
  private final long stale_fallbacks;
  private final long lookups;
  private final long coalesced_lookups;
  private final long lookup_retries;
  private final long lookup_timeouts;
  private final long throttled_lookups;
  private final long invalidations;
  private final long tablets_refreshed;
  private final long tablets_removed;
  private final long tablet_changes;
  private final long servers_evicted;
  private final int cached_tablets;
  private final int known_servers;
  private final int inflight_lookups;

  /** Package-private constructor.  */
  LocatorStats(final long cache_hits,
               final long cache_misses,
               final long stale_fallbacks,
               final long lookups,
               final long coalesced_lookups,
               final long lookup_retries,
               final long lookup_timeouts,
               final long throttled_lookups,
               final long invalidations,
               final long tablets_refreshed,
               final long tablets_removed,
               final long tablet_changes,
               final long servers_evicted,
               final int cached_tablets,
               final int known_servers,
               final int inflight_lookups) {
    this.cache_hits = cache_hits;
    this.cache_misses = cache_misses;
    this.stale_fallbacks = stale_fallbacks;
    this.lookups = lookups;
    this.coalesced_lookups = coalesced_lookups;
    this.lookup_retries = lookup_retries;
    this.lookup_timeouts = lookup_timeouts;
    this.throttled_lookups = throttled_lookups;
    this.invalidations = invalidations;
    this.tablets_refreshed = tablets_refreshed;
    this.tablets_removed = tablets_removed;
    this.tablet_changes = tablet_changes;
    this.servers_evicted = servers_evicted;
    this.cached_tablets = cached_tablets;
    this.known_servers = known_servers;
    this.inflight_lookups = inflight_lookups;
  }

  /** Number of routing requests answered from a fresh cached record.  */
  public long cacheHits() {
    return cache_hits;
  }

  /**
   * Number of routing requests that found no record, or only a stale one,
   * and had to wait for a lookup.
   */
  public long cacheMisses() {
    return cache_misses;
  }

  /**
   * Returns how many routing requests were answered from a stale record
   * because the lookup that was supposed to refresh it failed.
   * <p>
   * A steadily increasing number here means the metadata authority is
   * struggling to keep up or is unreachable.
   */
  public long staleFallbacks() {
    return stale_fallbacks;
  }

  /**
   * Returns how many lookups were sent to the metadata authority.
   * <p>
   * Retries of the same lookup aren't counted here, see
   * {@link #lookupRetries}.
   */
  public long lookups() {
    return lookups;
  }

  /**
   * Returns how many callers joined a lookup that was already in flight
   * instead of starting their own.
   */
  public long coalescedLookups() {
    return coalesced_lookups;
  }

  /** Number of times a lookup was retried after a transient failure.  */
  public long lookupRetries() {
    return lookup_retries;
  }

  /** Number of callers that gave up waiting for a lookup.  */
  public long lookupTimeouts() {
    return lookup_timeouts;
  }

  /** Number of callers turned away because a lookup had too many waiters. */
  public long throttledLookups() {
    return throttled_lookups;
  }

  /** Number of tablets invalidated because of stale routing.  */
  public long invalidations() {
    return invalidations;
  }

  /** Number of tablet records installed by refreshes.  */
  public long tabletsRefreshed() {
    return tablets_refreshed;
  }

  /** Number of tablets dropped because they vanished from their table.  */
  public long tabletsRemoved() {
    return tablets_removed;
  }

  /**
   * Number of invalidated tablets whose refresh revealed how they changed.
   * Each of them was logged at the INFO level.
   */
  public long tabletChanges() {
    return tablet_changes;
  }

  /** Number of servers evicted from the directory.  */
  public long serversEvicted() {
    return servers_evicted;
  }

  /** Number of tablets in the cache right now.  */
  public int cachedTablets() {
    return cached_tablets;
  }

  /** Number of servers in the directory right now.  */
  public int knownServers() {
    return known_servers;
  }

  /** Number of tables being looked up right now.  */
  public int inflightLookups() {
    return inflight_lookups;
  }

  @Override
  public String toString() {
    return "LocatorStats(cache_hits=" + cache_hits
      + ", cache_misses=" + cache_misses
      + ", stale_fallbacks=" + stale_fallbacks
      + ", lookups=" + lookups
      + ", coalesced_lookups=" + coalesced_lookups
      + ", lookup_retries=" + lookup_retries
      + ", lookup_timeouts=" + lookup_timeouts
      + ", throttled_lookups=" + throttled_lookups
      + ", invalidations=" + invalidations
      + ", tablets_refreshed=" + tablets_refreshed
      + ", tablets_removed=" + tablets_removed
      + ", tablet_changes=" + tablet_changes
      + ", servers_evicted=" + servers_evicted
      + ", cached_tablets=" + cached_tablets
      + ", known_servers=" + known_servers
      + ", inflight_lookups=" + inflight_lookups
      + ')';
  }

}
