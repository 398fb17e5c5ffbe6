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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import com.stumbleupon.async.Deferred;

import org.junit.Before;
import org.junit.Test;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.stubbing.Answer;
import org.powermock.reflect.Whitebox;

public class TestLookupCoordinator extends BaseTestLocator {

  private LocationCache cache;
  private LookupCoordinator coordinator;

  @Before
  public void beforeLocal() {
    cache = new LocationCache(ticker, 60000, 300000);
    coordinator = newCoordinator();
  }

  private LookupCoordinator newCoordinator() {
    return new LookupCoordinator(authority, cache, timer, config);
  }

  private Deadline deadline(final long timeout_ms) {
    return Deadline.after(ticker, timeout_ms);
  }

  private Map<String, ?> inflight() {
    return Whitebox.getInternalState(coordinator, "inflight");
  }

  @Test
  public void lookupInstallsIntoTheCache() {
    when(authority.getTableLocations(TABLE))
      .thenReturn(locations(threeTablets()));
    final Outcome<Object> outcome =
      Outcome.of(coordinator.ensureFresh(TABLE, deadline(1000)));
    assertTrue(outcome.isDone());
    assertNull(outcome.get());
    assertEquals("tablet-b", cache.lookupByKey(TABLE, key("h")).tabletId());
    assertEquals(1, coordinator.lookups());
    assertTrue(inflight().isEmpty());
  }

  @Test
  public void concurrentCallersShareOneLookup() {
    final Deferred<List<TabletLocations>> pending =
      new Deferred<List<TabletLocations>>();
    when(authority.getTableLocations(TABLE)).thenReturn(pending);
    final List<Outcome<Object>> outcomes = new ArrayList<Outcome<Object>>();
    for (int i = 0; i < 5; i++) {
      outcomes.add(Outcome.of(coordinator.ensureFresh(TABLE, deadline(1000))));
    }
    verify(authority, times(1)).getTableLocations(TABLE);
    assertEquals(1, inflight().size());
    for (final Outcome<Object> outcome : outcomes) {
      assertFalse(outcome.isDone());
    }

    pending.callback(threeTablets());
    for (final Outcome<Object> outcome : outcomes) {
      assertTrue(outcome.isDone());
      assertNull(outcome.get());
    }
    assertEquals(1, coordinator.lookups());
    assertEquals(4, coordinator.coalesced());
    assertTrue(inflight().isEmpty());
  }

  @Test
  public void concurrentCallersShareTheFailure() {
    final Deferred<List<TabletLocations>> pending =
      new Deferred<List<TabletLocations>>();
    when(authority.getTableLocations(TABLE)).thenReturn(pending);
    final Outcome<Object> first =
      Outcome.of(coordinator.ensureFresh(TABLE, deadline(1000)));
    final Outcome<Object> second =
      Outcome.of(coordinator.ensureFresh(TABLE, deadline(1000)));
    final TableNotFoundException e = new TableNotFoundException(TABLE);
    pending.callback(e);
    assertSame(e, first.error(TableNotFoundException.class));
    assertSame(e, second.error(TableNotFoundException.class));
  }

  @Test
  public void callersOnManyThreadsShareOneLookup() throws Exception {
    final int rounds = 50;
    final int threads = 8;
    // Every call to the authority gets its own pending answer.
    final List<Deferred<List<TabletLocations>>> calls =
      Collections.synchronizedList(
        new ArrayList<Deferred<List<TabletLocations>>>());
    when(authority.getTableLocations(TABLE)).thenAnswer(
      new Answer<Deferred<List<TabletLocations>>>() {
        public Deferred<List<TabletLocations>> answer(
            final InvocationOnMock invocation) {
          final Deferred<List<TabletLocations>> d =
            new Deferred<List<TabletLocations>>();
          calls.add(d);
          return d;
        }
      });
    final TableNotFoundException e = new TableNotFoundException(TABLE);

    for (int round = 1; round <= rounds; round++) {
      final CountDownLatch start = new CountDownLatch(1);
      final AtomicReference<Throwable> failure =
        new AtomicReference<Throwable>();
      @SuppressWarnings("unchecked")
      final Outcome<Object>[] outcomes = new Outcome[threads];
      final Thread[] callers = new Thread[threads];
      for (int i = 0; i < threads; i++) {
        final int n = i;
        callers[i] = new Thread("caller-" + i) {
          public void run() {
            try {
              start.await();
              outcomes[n] =
                Outcome.of(coordinator.ensureFresh(TABLE, deadline(10000)));
            } catch (Throwable t) {
              failure.compareAndSet(null, t);
            }
          }
        };
        callers[i].start();
      }
      start.countDown();
      for (final Thread caller : callers) {
        caller.join();
      }
      assertNull(failure.get());
      assertEquals(round, calls.size());
      assertEquals(1, coordinator.numInflight());
      for (final Outcome<Object> outcome : outcomes) {
        assertFalse(outcome.isDone());
      }

      if (round % 2 == 0) {
        calls.get(round - 1).callback(threeTablets());
        for (final Outcome<Object> outcome : outcomes) {
          assertNull(outcome.get());
        }
      } else {
        calls.get(round - 1).callback(e);
        for (final Outcome<Object> outcome : outcomes) {
          assertSame(e, outcome.error(TableNotFoundException.class));
        }
      }
      assertTrue(inflight().isEmpty());
    }
    assertEquals(rounds, coordinator.lookups());
    assertEquals(rounds * (threads - 1), coordinator.coalesced());
  }

  @Test
  public void differentTablesDontShare() {
    when(authority.getTableLocations(anyString()))
      .thenReturn(new Deferred<List<TabletLocations>>());
    coordinator.ensureFresh(TABLE, deadline(1000));
    coordinator.ensureFresh("other", deadline(1000));
    verify(authority).getTableLocations(TABLE);
    verify(authority).getTableLocations("other");
    assertEquals(2, coordinator.numInflight());
  }

  @Test
  public void newLookupAfterCompletion() {
    when(authority.getTableLocations(TABLE))
      .thenAnswer(always(threeTablets()));
    Outcome.of(coordinator.ensureFresh(TABLE, deadline(1000))).get();
    Outcome.of(coordinator.ensureFresh(TABLE, deadline(1000))).get();
    verify(authority, times(2)).getTableLocations(TABLE);
    assertEquals(0, coordinator.coalesced());
  }

  @Test
  public void invalidationRacingTheInstallResolvesEveryWaiter() {
    final HookedTicker hooked = new HookedTicker(ticker);
    cache = new LocationCache(hooked, 60000, 300000);
    coordinator = newCoordinator();
    final Deferred<List<TabletLocations>> pending =
      new Deferred<List<TabletLocations>>();
    when(authority.getTableLocations(TABLE))
      .thenReturn(locations(threeTablets()))
      .thenReturn(pending);
    Outcome.of(coordinator.ensureFresh(TABLE, deadline(1000))).get();

    final Outcome<Object> first =
      Outcome.of(coordinator.ensureFresh(TABLE, deadline(1000)));
    final Outcome<Object> second =
      Outcome.of(coordinator.ensureFresh(TABLE, deadline(1000)));
    // The data path reports tablet-b right after the install read the clock.
    hooked.afterNextRead(new Runnable() {
      public void run() {
        ticker.advance(5, TimeUnit.MILLISECONDS);
        cache.invalidate("tablet-b");
      }
    });
    pending.callback(Arrays.asList(
      tablet("tablet-a", EMPTY, G, replicas(0)),
      tablet("tablet-b", G, P, replicas(2)),
      tablet("tablet-c", P, EMPTY, replicas(2))));

    assertNull(first.get());
    assertNull(second.get());
    assertTrue(inflight().isEmpty());
    assertEquals(2, cache.lookupById(TABLE, "tablet-b").epoch());
    assertEquals(2, cache.lookupById(TABLE, "tablet-c").epoch());
    assertEquals("ts-2", cache.lookupByKey(TABLE, key("h")).leaderUuid());
    assertEquals(1, cache.tabletChanges());
  }

  @Test
  public void unexpectedInstallFailureReachesEveryWaiter() {
    final HookedTicker hooked = new HookedTicker(ticker);
    cache = new LocationCache(hooked, 60000, 300000);
    coordinator = newCoordinator();
    final Deferred<List<TabletLocations>> pending =
      new Deferred<List<TabletLocations>>();
    when(authority.getTableLocations(TABLE)).thenReturn(pending);
    final Outcome<Object> first =
      Outcome.of(coordinator.ensureFresh(TABLE, deadline(1000)));
    final Outcome<Object> second =
      Outcome.of(coordinator.ensureFresh(TABLE, deadline(1000)));

    final IllegalStateException e = new IllegalStateException("No clock");
    hooked.afterNextRead(new Runnable() {
      public void run() {
        throw e;
      }
    });
    pending.callback(threeTablets());

    assertSame(e, first.error(IllegalStateException.class));
    assertSame(e, second.error(IllegalStateException.class));
    assertTrue(inflight().isEmpty());
    assertEquals(0, cache.numTablets());
    assertEquals(0, coordinator.retries());
  }

  @Test
  public void tableNotFoundIsNotRetried() {
    when(authority.getTableLocations(TABLE))
      .thenReturn(failure(new TableNotFoundException(TABLE)));
    final Outcome<Object> outcome =
      Outcome.of(coordinator.ensureFresh(TABLE, deadline(1000)));
    assertEquals(TABLE, outcome.error(TableNotFoundException.class)
                 .getTable());
    verify(authority, times(1)).getTableLocations(TABLE);
    assertEquals(0, coordinator.retries());
  }

  @Test
  public void brokenMetadataIsNotRetried() {
    when(authority.getTableLocations(TABLE)).thenReturn(locations(
      Arrays.asList(tablet("tablet-b", G, EMPTY, replicas(1)))));
    final Outcome<Object> outcome =
      Outcome.of(coordinator.ensureFresh(TABLE, deadline(1000)));
    outcome.error(BrokenMetadataException.class);
    verify(authority, times(1)).getTableLocations(TABLE);
    assertEquals(0, cache.numTablets());
  }

  @Test
  public void transientErrorsAreRetried() throws Exception {
    when(authority.getTableLocations(TABLE))
      .thenReturn(failure(new MetadataUnavailableException("Leader election")))
      .thenReturn(failure(new MetadataUnavailableException("Still electing")))
      .thenReturn(locations(threeTablets()));
    final Outcome<Object> outcome =
      Outcome.of(coordinator.ensureFresh(TABLE, deadline(10000)));
    // Timer has the waiter's timeout and the first retry.
    assertEquals(2, timer.size());
    assertEquals(10000, timer.delay(0));
    assertEquals(600, timer.delay(1));
    assertFalse(outcome.isDone());

    ticker.advance(600, TimeUnit.MILLISECONDS);
    timer.run(1);
    assertEquals(3, timer.size());
    assertEquals(800, timer.delay(2));
    assertFalse(outcome.isDone());

    ticker.advance(800, TimeUnit.MILLISECONDS);
    timer.run(2);
    assertTrue(outcome.isDone());
    assertNull(outcome.get());
    verify(authority, times(3)).getTableLocations(TABLE);
    assertEquals(2, coordinator.retries());
    // The waiter's timeout was cancelled.
    verify(timer.timeouts.get(0)).cancel();
  }

  @Test
  public void authorityThrowingIsLikeFailing() throws Exception {
    when(authority.getTableLocations(TABLE))
      .thenThrow(new MetadataUnavailableException("Connection refused"))
      .thenReturn(locations(threeTablets()));
    final Outcome<Object> outcome =
      Outcome.of(coordinator.ensureFresh(TABLE, deadline(10000)));
    assertFalse(outcome.isDone());
    timer.runLast();
    assertNull(outcome.get());
  }

  @Test
  public void noRetryPastTheDeadline() {
    final MetadataUnavailableException cause =
      new MetadataUnavailableException("Leader election");
    when(authority.getTableLocations(TABLE)).thenReturn(failure(cause));
    // The first retry would happen in 600ms.
    final Outcome<Object> outcome =
      Outcome.of(coordinator.ensureFresh(TABLE, deadline(500)));
    final LookupTimeoutException e =
      outcome.error(LookupTimeoutException.class);
    assertSame(cause, e.getCause());
    assertEquals(TABLE, e.getTable());
    verify(authority, times(1)).getTableLocations(TABLE);
    assertEquals(0, coordinator.retries());
    assertTrue(inflight().isEmpty());
  }

  @Test
  public void expiredDeadline() {
    final Deadline deadline = deadline(100);
    ticker.advance(100, TimeUnit.MILLISECONDS);
    final Outcome<Object> outcome =
      Outcome.of(coordinator.ensureFresh(TABLE, deadline));
    outcome.error(LookupTimeoutException.class);
    verify(authority, never()).getTableLocations(anyString());
    assertEquals(1, coordinator.timeouts());
  }

  @Test
  public void waiterTimeoutDoesntAffectOthers() throws Exception {
    final Deferred<List<TabletLocations>> pending =
      new Deferred<List<TabletLocations>>();
    when(authority.getTableLocations(TABLE)).thenReturn(pending);
    final Outcome<Object> impatient =
      Outcome.of(coordinator.ensureFresh(TABLE, deadline(100)));
    final Outcome<Object> patient =
      Outcome.of(coordinator.ensureFresh(TABLE, deadline(5000)));
    assertEquals(100, timer.delay(0));
    assertEquals(5000, timer.delay(1));

    ticker.advance(100, TimeUnit.MILLISECONDS);
    timer.run(0);
    impatient.error(LookupTimeoutException.class);
    assertFalse(patient.isDone());
    assertEquals(1, inflight().size());

    pending.callback(threeTablets());
    assertNull(patient.get());
    verify(authority, times(1)).getTableLocations(TABLE);
    assertEquals(1, coordinator.timeouts());
  }

  @Test
  public void lookupOutlivesItsFirstWaiter() throws Exception {
    // The lookup keeps retrying for as long as the latest waiter allows.
    when(authority.getTableLocations(TABLE))
      .thenReturn(failure(new MetadataUnavailableException("Busy")))
      .thenReturn(locations(threeTablets()));
    final Outcome<Object> impatient =
      Outcome.of(coordinator.ensureFresh(TABLE, deadline(700)));
    // Retry scheduled in 600ms since the deadline allows it.
    assertEquals(600, timer.delay(1));
    final Outcome<Object> patient =
      Outcome.of(coordinator.ensureFresh(TABLE, deadline(5000)));
    ticker.advance(600, TimeUnit.MILLISECONDS);
    timer.run(1);
    assertNull(impatient.get());
    assertNull(patient.get());
  }

  @Test
  public void lateResultIsInstalledWhenEverybodyLeft() throws Exception {
    final Deferred<List<TabletLocations>> pending =
      new Deferred<List<TabletLocations>>();
    when(authority.getTableLocations(TABLE)).thenReturn(pending)
      .thenReturn(new Deferred<List<TabletLocations>>());
    final Outcome<Object> outcome =
      Outcome.of(coordinator.ensureFresh(TABLE, deadline(100)));
    ticker.advance(100, TimeUnit.MILLISECONDS);
    timer.run(0);
    outcome.error(LookupTimeoutException.class);
    // Nobody's waiting anymore, a new caller starts a new lookup.
    assertTrue(inflight().isEmpty());
    coordinator.ensureFresh(TABLE, deadline(100));
    verify(authority, times(2)).getTableLocations(TABLE);

    // The first call finally answers.
    pending.callback(threeTablets());
    assertNotNull(cache.lookupByKey(TABLE, key("h")));
    assertEquals(1, inflight().size());  // The second lookup is unaffected.
  }

  @Test
  public void noRetryWhenEverybodyLeft() throws Exception {
    when(authority.getTableLocations(TABLE))
      .thenReturn(failure(new MetadataUnavailableException("Busy")));
    final Outcome<Object> outcome =
      Outcome.of(coordinator.ensureFresh(TABLE, deadline(1000)));
    assertEquals(600, timer.delay(1));
    ticker.advance(1000, TimeUnit.MILLISECONDS);
    timer.run(0);  // Waiter times out.
    // Carries the last error.
    assertTrue(outcome.error(LookupTimeoutException.class).getCause()
               instanceof MetadataUnavailableException);
    timer.run(1);  // Retry does nothing.
    verify(authority, times(1)).getTableLocations(TABLE);
  }

  @Test
  public void tooManyWaiters() {
    config.overrideConfig("tablet.lookup.waiters_high_watermark", "2");
    coordinator = newCoordinator();
    when(authority.getTableLocations(anyString()))
      .thenReturn(new Deferred<List<TabletLocations>>());
    final Outcome<Object> first =
      Outcome.of(coordinator.ensureFresh(TABLE, deadline(1000)));
    final Outcome<Object> second =
      Outcome.of(coordinator.ensureFresh(TABLE, deadline(1000)));
    final Outcome<Object> third =
      Outcome.of(coordinator.ensureFresh(TABLE, deadline(1000)));
    assertFalse(first.isDone());
    assertFalse(second.isDone());
    assertEquals(TABLE, third.error(PleaseThrottleException.class).getTable());
    assertEquals(1, coordinator.throttled());
    // Other tables aren't affected.
    assertFalse(Outcome.of(coordinator.ensureFresh("other", deadline(1000)))
                .isDone());
  }

  @Test
  public void staleRoutingInvalidatesAndRefreshes() {
    when(authority.getTableLocations(TABLE))
      .thenReturn(locations(threeTablets()))
      .thenReturn(new Deferred<List<TabletLocations>>());
    Outcome.of(coordinator.ensureFresh(TABLE, deadline(1000))).get();

    final Outcome<Object> outcome = Outcome.of(coordinator.handleStaleRouting(
      new StaleRoutingException(TABLE, "tablet-b", "ts-1", "Not the leader"),
      deadline(1000)));
    assertFalse(outcome.isDone());
    assertTrue(cache.lookupById(TABLE, "tablet-b").isInvalidated());
    assertFalse(cache.lookupById(TABLE, "tablet-a").isInvalidated());
    verify(authority, times(2)).getTableLocations(TABLE);
  }

  @Test
  public void staleRoutingOnUnknownTablet() {
    when(authority.getTableLocations(TABLE))
      .thenReturn(locations(threeTablets()));
    final Outcome<Object> outcome = Outcome.of(coordinator.handleStaleRouting(
      new StaleRoutingException(TABLE, "tablet-z", "ts-1", "Tablet moved"),
      deadline(1000)));
    assertNull(outcome.get());
    assertEquals(3, cache.numTablets());
  }

  @Test
  public void backoffLadder() {
    assertEquals(600, coordinator.backoffMs(1));
    assertEquals(800, coordinator.backoffMs(2));
    assertEquals(1000, coordinator.backoffMs(3));
    assertEquals(1016, coordinator.backoffMs(4));
    assertEquals(1032, coordinator.backoffMs(5));
    assertEquals(1064, coordinator.backoffMs(6));
    assertEquals(5000, coordinator.backoffMs(12));
    assertEquals(5000, coordinator.backoffMs(1000));
  }

  @Test
  public void backoffFollowsTheConfiguration() {
    config.overrideConfig("tablet.lookup.backoff_base_ms", "10");
    config.overrideConfig("tablet.lookup.backoff_max_ms", "45");
    coordinator = newCoordinator();
    assertEquals(30, coordinator.backoffMs(1));
    assertEquals(45, coordinator.backoffMs(3));
  }

  @Test(expected=IllegalArgumentException.class)
  public void invalidBackoff() {
    config.overrideConfig("tablet.lookup.backoff_max_ms", "10");
    newCoordinator();
  }

}
