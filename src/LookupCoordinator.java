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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import com.stumbleupon.async.Callback;
import com.stumbleupon.async.Deferred;

import org.jboss.netty.util.Timeout;
import org.jboss.netty.util.Timer;
import org.jboss.netty.util.TimerTask;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches table locations from the metadata authority into the cache.
 *
 * <h1>Coalescing</h1>
 * The authority returns every tablet of a table at once, so there is at most
 * one lookup in flight per table.  Callers that need the same table while a
 * lookup is outstanding join it as waiters instead of issuing their own
 * call, and every waiter gets the outcome of that one call.  Otherwise a
 * server going down would have every client thread hammer the authority
 * about the same tablets at the same time.
 *
 * <h1>Retries and deadlines</h1>
 * Transient failures ({@link RecoverableException}) are retried with the
 * same backoff ladder we use for stale routing retries: linear at first,
 * exponential after a few attempts.  A lookup keeps retrying as long as the
 * latest deadline of its waiters allows it.  Each waiter also has its own
 * timer: when it fires, that waiter gets a {@link LookupTimeoutException}
 * and leaves, without disturbing the lookup or the other waiters.  A lookup
 * left without waiters stops retrying.
 */
final class LookupCoordinator {

  private static final Logger LOG =
    LoggerFactory.getLogger(LookupCoordinator.class);

  private final MetadataAuthority authority;
  private final LocationCache cache;
  private final Timer timer;
  private final int waiters_high_watermark;
  private final long backoff_base_ms;
  private final long backoff_max_ms;

  /** Table name to the lookup currently in flight for it.  */
  private final ConcurrentHashMap<String, InflightLookup> inflight =
    new ConcurrentHashMap<String, InflightLookup>();

  private final Counter lookups = new Counter();
  private final Counter coalesced = new Counter();
  private final Counter retries = new Counter();
  private final Counter timeouts = new Counter();
  private final Counter throttled = new Counter();

  /**
   * Constructor.
   * @param authority Where to fetch locations from.
   * @param cache Where to install them.
   * @param timer Timer to schedule retries and waiter timeouts.
   * @param config Reads the {@code tablet.lookup.*} settings.
   */
  LookupCoordinator(final MetadataAuthority authority,
                    final LocationCache cache,
                    final Timer timer,
                    final Config config) {
    this.authority = authority;
    this.cache = cache;
    this.timer = timer;
    waiters_high_watermark =
      config.getInt("tablet.lookup.waiters_high_watermark");
    backoff_base_ms = config.getLong("tablet.lookup.backoff_base_ms");
    backoff_max_ms = config.getLong("tablet.lookup.backoff_max_ms");
    if (waiters_high_watermark <= 0) {
      throw new IllegalArgumentException("Waiters high watermark must be"
        + " positive: " + waiters_high_watermark);
    }
    if (backoff_base_ms <= 0 || backoff_max_ms < backoff_base_ms) {
      throw new IllegalArgumentException("Invalid backoff: base="
        + backoff_base_ms + "ms, max=" + backoff_max_ms + "ms");
    }
  }

  /**
   * Makes sure the cache has up-to-date locations for a table.
   * <p>
   * Joins the lookup in flight for this table if there is one, otherwise
   * starts one.
   * @param table The table to look up.
   * @param deadline When to give up.
   * @return A deferred that completes with {@code null} once the locations
   * are installed in the cache, or with one of the following exceptions:
   * {@link TableNotFoundException}, {@link BrokenMetadataException},
   * {@link LookupTimeoutException} or {@link PleaseThrottleException}.  Any
   * other non-recoverable error from the authority is passed on as-is.
   */
  Deferred<Object> ensureFresh(final String table, final Deadline deadline) {
    if (deadline.timedOut()) {
      timeouts.increment();
      return Deferred.fromError(new LookupTimeoutException(table,
        "Deadline expired before looking up " + table, null));
    }
    final Waiter waiter = new Waiter(table, deadline);
    while (true) {
      InflightLookup lookup = inflight.get(table);
      if (lookup == null) {
        final InflightLookup mine = new InflightLookup(table);
        mine.join(waiter);  // Can't fail, nobody else knows of it yet.
        lookup = inflight.putIfAbsent(table, mine);
        if (lookup == null) {
          lookups.increment();
          waiter.arm();
          if (LOG.isDebugEnabled()) {
            LOG.debug("Looking up " + table + ", " + deadline);
          }
          mine.attempt();
          return waiter.deferred;
        }
        // Someone else started a lookup in the meantime, join theirs.
      }
      try {
        if (lookup.join(waiter)) {
          coalesced.increment();
          waiter.arm();
          return waiter.deferred;
        }
      } catch (PleaseThrottleException e) {
        throttled.increment();
        return Deferred.fromError(e);
      }
      // That lookup just completed, remove it if it's still there and loop.
      inflight.remove(table, lookup);
    }
  }

  /**
   * Handles a stale routing signal from the data path: invalidates the
   * tablet and refreshes its table.
   * @param e What the data path reported.
   * @param deadline When to give up.
   * @return A deferred that completes once the refresh is done, see
   * {@link #ensureFresh}.
   */
  Deferred<Object> handleStaleRouting(final StaleRoutingException e,
                                      final Deadline deadline) {
    if (!cache.invalidate(e.getTabletId())) {
      LOG.info("Stale routing on unknown tablet " + e.getTabletId()
               + " of " + e.getTable() + ", refreshing the table anyway");
    }
    return ensureFresh(e.getTable(), deadline);
  }

  /**
   * Returns how long to wait before the given attempt.
   * Linear backoff followed by exponential backoff, capped.
   * @param attempt The number of attempts that already failed, from 1.
   */
  long backoffMs(final int attempt) {
    final long wait_ms = attempt < 4
      ? backoff_base_ms * (attempt + 2)            // 3, 4, 5 times the base
      : backoff_base_ms * 5 + (1L << Math.min(attempt, 30));  // + 16, 32, ..
    return Math.min(wait_ms, backoff_max_ms);
  }

  /** Returns the number of tables being looked up right now.  */
  int numInflight() {
    return inflight.size();
  }

  long lookups() {
    return lookups.get();
  }

  long coalesced() {
    return coalesced.get();
  }

  long retries() {
    return retries.get();
  }

  long timeouts() {
    return timeouts.get();
  }

  long throttled() {
    return throttled.get();
  }

  /** A lookup in flight for one table and the callers waiting on it.  */
  private final class InflightLookup {

    private final String table;

    /** Who's waiting.  Guarded by {@code this}.  */
    private final ArrayList<Waiter> waiters = new ArrayList<Waiter>();

    /** Latest deadline of all the waiters.  Guarded by {@code this}.  */
    private Deadline deadline;

    /**
     * Whether this lookup stopped accepting waiters, either because it
     * completed or because everybody left.  Guarded by {@code this}.
     */
    private boolean done;

    /** Number of calls made to the authority so far.  */
    private volatile int attempt;

    /** Last transient error from the authority, if any.  */
    private volatile Exception last_error;

    InflightLookup(final String table) {
      this.table = table;
    }

    /**
     * Adds a waiter to this lookup.
     * @return {@code false} if this lookup is done and can't be joined.
     * @throws PleaseThrottleException if there are too many waiters already.
     */
    synchronized boolean join(final Waiter waiter) {
      if (done) {
        return false;
      }
      if (waiters.size() >= waiters_high_watermark) {
        throw new PleaseThrottleException(table, "There are already "
          + waiters.size() + " callers waiting on the lookup of " + table);
      }
      waiters.add(waiter);
      waiter.lookup = this;
      deadline = deadline == null ? waiter.deadline
                                  : deadline.latest(waiter.deadline);
      return true;
    }

    /** Called when a waiter timed out.  */
    void abandon(final Waiter waiter) {
      synchronized (this) {
        waiters.remove(waiter);
        if (done || !waiters.isEmpty()) {
          return;
        }
        done = true;
      }
      // Nobody's waiting anymore: a new caller should start a new lookup
      // rather than join one that may be stuck in backoff.  The call to the
      // authority may still be outstanding, its result will be installed.
      inflight.remove(table, this);
      LOG.info("Everybody waiting on the lookup of " + table + " timed out");
    }

    /** Issues one call to the authority.  */
    void attempt() {
      attempt++;
      final Deferred<List<TabletLocations>> d;
      try {
        d = authority.getTableLocations(table);
      } catch (RuntimeException e) {
        // Treat as if the authority returned the error asynchronously.
        handleError(e);
        return;
      }
      d.addCallbacks(new InstallCB(), new ErrorCB());
    }

    /** Installs the locations in the cache.  */
    final class InstallCB implements Callback<Object, List<TabletLocations>> {
      public Object call(final List<TabletLocations> locations) {
        final List<TabletInfo> installed;
        try {
          installed = cache.refreshTable(table, locations);
        } catch (BrokenMetadataException e) {
          LOG.error("Got broken locations for " + table + " from "
                    + authority + ": " + locations, e);
          complete(e);
          return null;
        } catch (RuntimeException e) {
          // The errback of the same deferred doesn't see what we throw.
          LOG.error("Failed to install the locations of " + table, e);
          complete(e);
          return null;
        }
        if (LOG.isDebugEnabled()) {
          LOG.debug("Installed " + installed.size() + " tablets of " + table
                    + " after " + attempt + " attempt(s)");
        }
        complete(null);
        return null;
      }
      public String toString() {
        return "install locations of " + table;
      }
    }

    /** Decides whether to retry.  */
    final class ErrorCB implements Callback<Object, Exception> {
      public Object call(final Exception e) {
        handleError(e);
        return null;
      }
      public String toString() {
        return "handle lookup error on " + table;
      }
    }

    private void handleError(final Exception e) {
      if (!(e instanceof RecoverableException)) {
        if (!(e instanceof TableNotFoundException)) {
          LOG.warn("Lookup of " + table + " failed", e);
        }
        complete(e);
        return;
      }
      last_error = e;
      final Deadline deadline;
      synchronized (this) {
        if (done) {
          LOG.info("Not retrying the lookup of " + table
                   + ", nobody is waiting for it anymore: " + e.getMessage());
          return;
        }
        deadline = this.deadline;
      }
      final long wait_ms = backoffMs(attempt);
      if (deadline.wouldSleepingTimeout(wait_ms)) {
        complete(new LookupTimeoutException(table, "Gave up looking up "
          + table + " after " + attempt + " attempt(s), the next one would"
          + " happen after the deadline", e));
        return;
      }
      retries.increment();
      LOG.warn("Lookup of " + table + " failed (attempt " + attempt
               + "), retrying in " + wait_ms + "ms: " + e.getMessage());
      timer.newTimeout(new RetryTimer(), wait_ms, MILLISECONDS);
    }

    final class RetryTimer implements TimerTask {
      public void run(final Timeout timeout) {
        synchronized (InflightLookup.this) {
          if (done) {
            return;
          }
        }
        attempt();
      }
      public String toString() {
        return "retry lookup of " + table;
      }
    }

    /**
     * Hands the outcome of this lookup to every waiter.
     * @param result {@code null} on success, an exception otherwise.
     */
    private void complete(final Object result) {
      final ArrayList<Waiter> waiters;
      synchronized (this) {
        done = true;
        waiters = new ArrayList<Waiter>(this.waiters);
        this.waiters.clear();
      }
      // Remove ourselves first, so a waiter whose callback needs another
      // lookup starts a new one.
      inflight.remove(table, this);
      for (final Waiter waiter : waiters) {
        waiter.resolve(result);
      }
    }

    /** Returns the last transient error, if any.  */
    Exception lastError() {
      return last_error;
    }

    public String toString() {
      return "InflightLookup(table=" + table + ", attempt=" + attempt + ')';
    }

  }

  /** One caller waiting on a lookup.  */
  private final class Waiter implements TimerTask {

    private final String table;
    final Deadline deadline;
    final Deferred<Object> deferred = new Deferred<Object>();
    private final AtomicBoolean done = new AtomicBoolean();

    /** The lookup we joined.  Set before {@link #arm} is called.  */
    volatile InflightLookup lookup;

    /** Guarded by {@code this}.  */
    private Timeout timeout;

    Waiter(final String table, final Deadline deadline) {
      this.table = table;
      this.deadline = deadline;
    }

    /** Starts the timer of this waiter, unless it's already resolved.  */
    void arm() {
      synchronized (this) {
        if (done.get()) {
          return;
        }
        timeout = timer.newTimeout(this, deadline.remainingMillis(),
                                   MILLISECONDS);
      }
    }

    /** Hands the outcome of the lookup to this waiter, unless it left.  */
    void resolve(final Object result) {
      if (!done.compareAndSet(false, true)) {
        return;  // Timed out already.
      }
      synchronized (this) {
        if (timeout != null) {
          timeout.cancel();
        }
      }
      deferred.callback(result);
    }

    /** Called when the deadline of this waiter expires.  */
    public void run(final Timeout timeout) {
      if (!done.compareAndSet(false, true)) {
        return;  // The lookup completed first.
      }
      timeouts.increment();
      final InflightLookup lookup = this.lookup;
      final Exception cause = lookup == null ? null : lookup.lastError();
      if (lookup != null) {
        lookup.abandon(this);
      }
      deferred.callback(new LookupTimeoutException(table, "Timed out after "
        + "waiting for the locations of " + table + " ("
        + (lookup == null ? "no lookup" : lookup.toString()) + ')', cause));
    }

    public String toString() {
      return "lookup timeout of " + table;
    }

  }

}
