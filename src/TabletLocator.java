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

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import java.util.Set;

import com.google.common.base.Ticker;
import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import org.jboss.netty.util.HashedWheelTimer;
import org.jboss.netty.util.Timeout;
import org.jboss.netty.util.TimerTask;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tells you which server to send a request to, for a given key or tablet.
 * <p>
 * This class is thread-safe.  You need one instance per cluster, and you
 * should share it across all your threads.  It keeps a local cache of where
 * the tablets of each table are, and only talks to the
 * {@link MetadataAuthority} when the cache doesn't know, or when what it
 * knows is too old or was proven wrong.
 *
 * <h1>Usage</h1>
 * <pre>{@code
 *   TabletLocator locator = new TabletLocator(authority, config);
 *   locator.route("users", key).addCallbacks(sendToServer, handleError);
 * }</pre>
 * All methods that may need to talk to the metadata authority return a
 * {@link Deferred}.  Don't {@code join()} it on a latency-sensitive thread
 * unless you're fine with blocking for up to the timeout of the call.
 *
 * <h1>Stale routing</h1>
 * When a server rejects a request because it no longer hosts the tablet,
 * or isn't the leader anymore, the transport should report it with
 * {@link #handleStaleRouting} and route the request again once the
 * returned {@code Deferred} completes.  Until then, the stale record is
 * kept around: if the metadata authority can't be reached, we'll keep
 * routing with what we know rather than fail every request.
 *
 * <h1>Errors</h1>
 * Every failure is delivered through the errback chain of the returned
 * {@code Deferred}, as a {@link TabletException}:
 * <ul>
 *   <li>{@link TableNotFoundException} and {@link TabletNotFoundException}
 *   when what you asked for doesn't exist.</li>
 *   <li>{@link NoAvailableReplicaException} when every replica is excluded
 *   or dead, {@link NoLeaderKnownException} when you asked for the leader
 *   and we don't know which replica it is.  Retrying after a refresh
 *   (which {@link #handleStaleRouting} triggers) may help.</li>
 *   <li>{@link LookupTimeoutException} when we couldn't get the locations
 *   in time and had nothing cached to fall back on.</li>
 *   <li>{@link PleaseThrottleException} when too many callers are waiting
 *   for the same lookup.</li>
 * </ul>
 */
public final class TabletLocator {

  private static final Logger LOG = LoggerFactory.getLogger(TabletLocator.class);

  /** An empty byte array you can use.  Means "first key" of a table.  */
  public static final byte[] EMPTY_ARRAY = new byte[0];

  private final Config config;

  /**
   * Timer we use to handle all our timeouts.
   * <p>
   * This is package-private so that tests can replace it.
   */
  final HashedWheelTimer timer;

  private final Ticker ticker;

  private final LocationCache cache;

  private final LookupCoordinator coordinator;

  /** Who we are, unless the caller says otherwise.  */
  private final ClientLocality default_locality;

  /** How to pick replicas, unless the caller says otherwise.  */
  private final ReplicaSelection default_selection;

  /** In milliseconds.  */
  private final long default_timeout_ms;

  /** Whether {@link #shutdown} was called.  */
  private volatile boolean shutting_down;

  private final Counter cache_hits = new Counter();
  private final Counter cache_misses = new Counter();
  private final Counter stale_fallbacks = new Counter();

  /**
   * Constructor, using the default configuration.
   * @param authority Where to look up tablet locations.
   */
  public TabletLocator(final MetadataAuthority authority) {
    this(authority, new Config());
  }

  /**
   * Constructor.
   * @param authority Where to look up tablet locations.
   * @param config The configuration, see {@link Config} for the settings.
   */
  public TabletLocator(final MetadataAuthority authority,
                       final Config config) {
    this(authority, config, newTimer(config), Ticker.systemTicker());
  }

  /** Constructor for tests, to control time.  */
  TabletLocator(final MetadataAuthority authority,
                final Config config,
                final HashedWheelTimer timer,
                final Ticker ticker) {
    if (authority == null) {
      throw new NullPointerException("authority");
    }
    this.config = config;
    this.timer = timer;
    this.ticker = ticker;
    cache = new LocationCache(ticker,
      config.getLong("tablet.cache.staleness_ms"),
      config.getLong("tablet.directory.eviction_grace_ms"));
    coordinator = new LookupCoordinator(authority, cache, timer, config);
    default_locality = ClientLocality.fromConfig(config);
    default_selection = ReplicaSelection.valueOf(
      config.getString("tablet.client.replica_selection"));
    default_timeout_ms = config.getLong("tablet.lookup.timeout_ms");
    if (default_timeout_ms <= 0) {
      throw new IllegalArgumentException("tablet.lookup.timeout_ms must be"
                                         + " positive: " + default_timeout_ms);
    }
    scheduleEviction();
  }

  private static HashedWheelTimer newTimer(final Config config) {
    return new HashedWheelTimer(config.getInt("tablet.timer.tick"),
                                MILLISECONDS,
                                config.getInt("tablet.timer.ticks_per_wheel"));
  }

  /**
   * Returns the configuration of this locator.
   * Changing it after the locator was created has no effect.
   */
  public Config getConfig() {
    return config;
  }

  // --------- //
  // Routing.  //
  // --------- //

  /**
   * Finds where to send a request for the given key, using the locality,
   * replica selection and timeout from the configuration.
   * @param table The table the key belongs to.
   * @param key The key of the request.
   * @return A deferred location, see {@link #route(String, byte[],
   * ClientLocality, ReplicaSelection, Set, long)}.
   */
  public Deferred<TabletLocation> route(final String table, final byte[] key) {
    return route(table, key, default_locality, default_selection, null,
                 default_timeout_ms);
  }

  /**
   * Finds where to send a request for the given key.
   * @param table The table the key belongs to.
   * @param key The key of the request.
   * @param locality Where the caller is.
   * @param policy How to choose among the replicas of the tablet.
   * @param excluded UUIDs of servers not to choose, typically because they
   * just failed.  Can be {@code null}.
   * @param timeout_ms How long to wait for the metadata authority, if the
   * cache can't answer right away.
   * @return A deferred location.  Failures are {@link TabletException}s,
   * see the class documentation.
   */
  public Deferred<TabletLocation> route(final String table,
                                        final byte[] key,
                                        final ClientLocality locality,
                                        final ReplicaSelection policy,
                                        final Set<String> excluded,
                                        final long timeout_ms) {
    if (key == null) {
      throw new NullPointerException("key");
    }
    return locate(new Request(table, key, null, locality, policy, excluded),
                  timeout_ms);
  }

  /**
   * Finds where to send a request for the given tablet, using the locality,
   * replica selection and timeout from the configuration.
   * @param table The table the tablet belongs to.
   * @param tablet_id The ID of the tablet.
   */
  public Deferred<TabletLocation> routeToTablet(final String table,
                                                final String tablet_id) {
    return routeToTablet(table, tablet_id, default_locality,
                         default_selection, null, default_timeout_ms);
  }

  /**
   * Finds where to send a request for the given tablet.
   * @see #route(String, byte[], ClientLocality, ReplicaSelection, Set, long)
   */
  public Deferred<TabletLocation> routeToTablet(final String table,
                                                final String tablet_id,
                                                final ClientLocality locality,
                                                final ReplicaSelection policy,
                                                final Set<String> excluded,
                                                final long timeout_ms) {
    if (tablet_id == null) {
      throw new NullPointerException("tablet_id");
    }
    return locate(new Request(table, null, tablet_id, locality, policy,
                              excluded),
                  timeout_ms);
  }

  /** Everything we need to route one request.  */
  private static final class Request {
    final String table;
    final byte[] key;          // Either this...
    final String tablet_id;    // ... or that is set.
    final ClientLocality locality;
    final ReplicaSelection policy;
    final Set<String> excluded;

    Request(final String table, final byte[] key, final String tablet_id,
            final ClientLocality locality, final ReplicaSelection policy,
            final Set<String> excluded) {
      if (table == null) {
        throw new NullPointerException("table");
      } else if (locality == null) {
        throw new NullPointerException("locality");
      } else if (policy == null) {
        throw new NullPointerException("policy");
      }
      this.table = table;
      this.key = key;
      this.tablet_id = tablet_id;
      this.locality = locality;
      this.policy = policy;
      this.excluded = excluded;
    }

    String what() {
      return key != null ? "key " + Bytes.pretty(key) : "tablet " + tablet_id;
    }
  }

  private Deferred<TabletLocation> locate(final Request request,
                                          final long timeout_ms) {
    final TabletInfo cached = lookup(request);
    if (cached != null && cache.isFresh(cached)) {
      cache_hits.increment();
      return select(cached, request);
    }
    cache_misses.increment();
    if (LOG.isDebugEnabled()) {
      LOG.debug("Need to look up " + request.table + " for "
                + request.what() + ", cached=" + cached);
    }
    final Deadline deadline = Deadline.after(ticker, timeout_ms);

    final class RouteAfterLookupCB
      implements Callback<Deferred<TabletLocation>, Object> {
      public Deferred<TabletLocation> call(final Object arg) {
        final TabletInfo tablet = lookup(request);
        if (arg instanceof Exception) {
          final Exception e = (Exception) arg;
          final TabletInfo stale = tablet != null ? tablet : cached;
          if (stale != null && canFallBack(e)) {
            stale_fallbacks.increment();
            LOG.warn("Couldn't refresh the locations of " + request.table
                     + ", routing " + request.what() + " with stale " + stale
                     + ": " + e.getMessage());
            return select(stale, request);
          }
          return Deferred.fromError(e);
        }
        if (tablet == null) {
          return Deferred.fromError(new TabletNotFoundException(
            request.table, request.tablet_id, request.what()));
        }
        return select(tablet, request);
      }
      public String toString() {
        return "route " + request.what() + " of " + request.table
          + " after lookup";
      }
    }

    return coordinator.ensureFresh(request.table, deadline)
      .addBothDeferring(new RouteAfterLookupCB());
  }

  /**
   * Returns {@code true} if a failed refresh can be papered over with
   * stale locations.
   * Missing tables and broken metadata must surface.
   */
  private static boolean canFallBack(final Exception e) {
    return e instanceof LookupTimeoutException
      || e instanceof RecoverableException;
  }

  private TabletInfo lookup(final Request request) {
    return request.key != null
      ? cache.lookupByKey(request.table, request.key)
      : cache.lookupById(request.table, request.tablet_id);
  }

  private Deferred<TabletLocation> select(final TabletInfo tablet,
                                          final Request request) {
    try {
      return Deferred.fromResult(cache.select(tablet, request.locality,
                                              request.policy,
                                              request.excluded));
    } catch (TabletException e) {
      return Deferred.fromError(e);
    }
  }

  // ---------------------------- //
  // Signals from the data path.  //
  // ---------------------------- //

  /**
   * Handles a stale routing error reported by a server.
   * <p>
   * The tablet is invalidated and the locations of its table are refreshed.
   * Route the request again once the returned {@code Deferred} completes,
   * whether it succeeded or not: if the refresh failed, routing will fall
   * back to the stale locations.
   * @param e The error reported by the server.
   * @return A deferred that completes with {@code null} once the locations
   * are refreshed, or fails like a lookup does.
   */
  public Deferred<Object> handleStaleRouting(final StaleRoutingException e) {
    return handleStaleRouting(e, default_timeout_ms);
  }

  /**
   * Handles a stale routing error reported by a server.
   * @param e The error reported by the server.
   * @param timeout_ms How long to wait for the refresh.
   * @see #handleStaleRouting(StaleRoutingException)
   */
  public Deferred<Object> handleStaleRouting(final StaleRoutingException e,
                                             final long timeout_ms) {
    return coordinator.handleStaleRouting(e, Deadline.after(ticker,
                                                            timeout_ms));
  }

  /**
   * Records what the transport learned about a server.
   * <p>
   * {@link TabletServer.Health#DEAD DEAD} servers are skipped when choosing
   * replicas, until a refresh lists them again or they're reported
   * {@link TabletServer.Health#ALIVE ALIVE}.
   * @param uuid The UUID of the server.
   * @param health Its health.
   */
  public void reportServerHealth(final String uuid,
                                 final TabletServer.Health health) {
    if (!cache.setServerHealth(uuid, health) && LOG.isDebugEnabled()) {
      LOG.debug("Ignoring health " + health + " of unknown server " + uuid);
    }
  }

  /**
   * Returns what we know about a server.
   * @return A possibly {@code null} entry, if we don't know the server.
   */
  public TabletServer getServer(final String uuid) {
    return cache.server(uuid);
  }

  // ---------- //
  // Lifecycle. //
  // ---------- //

  /**
   * Returns a snapshot of usage statistics for this locator.
   */
  public LocatorStats stats() {
    return new LocatorStats(cache_hits.get(),
                            cache_misses.get(),
                            stale_fallbacks.get(),
                            coordinator.lookups(),
                            coordinator.coalesced(),
                            coordinator.retries(),
                            coordinator.timeouts(),
                            coordinator.throttled(),
                            cache.invalidations(),
                            cache.tabletsRefreshed(),
                            cache.tabletsRemoved(),
                            cache.tabletChanges(),
                            cache.serversEvicted(),
                            cache.numTablets(),
                            cache.numServers(),
                            coordinator.numInflight());
  }

  /**
   * Stops the timer of this locator.
   * <p>
   * Lookups in flight won't be retried anymore, and their callers won't
   * time out either, so make sure nothing is waiting on this locator.
   * @return A deferred that completes once the timer is stopped.
   */
  public Deferred<Object> shutdown() {
    shutting_down = true;
    LOG.debug("Stopping the timer");
    timer.stop();
    return Deferred.fromResult(null);
  }

  private void scheduleEviction() {
    final long interval_ms =
      config.getLong("tablet.directory.eviction_interval_ms");
    if (interval_ms <= 0) {
      LOG.info("Directory eviction is disabled");
      return;
    }

    final class EvictionTimer implements TimerTask {
      public void run(final Timeout timeout) {
        if (shutting_down) {
          return;
        }
        final int evicted = cache.evictUnreferencedServers();
        if (evicted > 0 && LOG.isDebugEnabled()) {
          LOG.debug("Evicted " + evicted + " servers from the directory");
        }
        if (!shutting_down) {
          timer.newTimeout(this, interval_ms, MILLISECONDS);
        }
      }
      public String toString() {
        return "evict unreferenced servers";
      }
    }

    timer.newTimeout(new EvictionTimer(), interval_ms, MILLISECONDS);
  }

  /** Package-private so tests can reach inside.  */
  LocationCache cache() {
    return cache;
  }

}
