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

import java.util.Arrays;
import java.util.List;

import com.google.common.testing.EqualsTester;

import org.junit.Test;

public class TestTabletChangeEvent {
  static final byte[] G = { 'g' };
  static final byte[] P = { 'p' };
  static final byte[] EMPTY = TabletLocator.EMPTY_ARRAY;
  static final long DETECTED = 1000000000L;  // 1s

  static TabletInfo.Replica leader(final String uuid) {
    return new TabletInfo.Replica(uuid, ReplicaRole.LEADER);
  }

  static TabletInfo.Replica follower(final String uuid) {
    return new TabletInfo.Replica(uuid, ReplicaRole.FOLLOWER);
  }

  static TabletInfo tablet(final byte[] start_key, final byte[] end_key,
                           final long epoch,
                           final TabletInfo.Replica... replicas) {
    final List<TabletInfo.Replica> list = Arrays.asList(replicas);
    return new TabletInfo("users", "tablet-b", start_key, end_key, list,
                          epoch, 0L);
  }

  static final TabletInfo OLD = tablet(G, P, 3, leader("ts-1"),
                                       follower("ts-2")).invalidate(DETECTED);

  @Test(expected=IllegalArgumentException.class)
  public void constructorNullOldTablet() {
    new TabletChangeEvent(null, OLD, DETECTED);
  }

  @Test(expected=IllegalArgumentException.class)
  public void constructorOldTabletNotInvalidated() {
    final TabletInfo valid = tablet(G, P, 3, leader("ts-1"));
    new TabletChangeEvent(valid, valid, DETECTED);
  }

  @Test(expected=IllegalArgumentException.class)
  public void constructorResolvedBeforeDetected() {
    new TabletChangeEvent(OLD, tablet(G, P, 4, leader("ts-1")), DETECTED - 1);
  }

  @Test
  public void constructorIntegrated() {
    final TabletInfo moved = tablet(G, P, 4, leader("ts-3"), follower("ts-2"));
    final TabletChangeEvent event =
      new TabletChangeEvent(OLD, moved, DETECTED + 250000000L);
    assertEquals("tablet-b", event.getTabletId());
    assertEquals(TabletChangeEvent.Reason.MOVED, event.getReason());
    assertEquals(3, event.getOldEpoch());
    assertEquals(4, event.getNewEpoch());
    assertEquals(250, event.getDurationMs());
  }

  @Test
  public void tabletIsGone() {
    final TabletChangeEvent event = new TabletChangeEvent(OLD, null, DETECTED);
    assertEquals(TabletChangeEvent.Reason.SPLIT_OR_MERGED, event.getReason());
    assertEquals(-1, event.getNewEpoch());
    assertEquals(0, event.getDurationMs());
  }

  @Test
  public void whyUnchanged() {
    assertEquals(TabletChangeEvent.Reason.UNCHANGED, TabletChangeEvent.why(
      OLD, tablet(G, P, 4, leader("ts-1"), follower("ts-2"))));
    // Replica order doesn't matter.
    assertEquals(TabletChangeEvent.Reason.UNCHANGED, TabletChangeEvent.why(
      OLD, tablet(G, P, 4, follower("ts-2"), leader("ts-1"))));
  }

  @Test
  public void whyLeaderChanged() {
    assertEquals(TabletChangeEvent.Reason.LEADER_CHANGED,
      TabletChangeEvent.why(OLD, tablet(G, P, 4, follower("ts-1"),
                                        leader("ts-2"))));
    // Losing the leader counts as a change too.
    assertEquals(TabletChangeEvent.Reason.LEADER_CHANGED,
      TabletChangeEvent.why(OLD, tablet(G, P, 4, follower("ts-1"),
                                        follower("ts-2"))));
  }

  @Test
  public void whyMoved() {
    assertEquals(TabletChangeEvent.Reason.MOVED,
      TabletChangeEvent.why(OLD, tablet(G, P, 4, leader("ts-1"))));
    assertEquals(TabletChangeEvent.Reason.MOVED,
      TabletChangeEvent.why(OLD, tablet(G, P, 4, leader("ts-1"),
                                        follower("ts-2"), follower("ts-3"))));
  }

  @Test
  public void whySplitOrMerged() {
    assertEquals(TabletChangeEvent.Reason.SPLIT_OR_MERGED,
      TabletChangeEvent.why(OLD, tablet(G, EMPTY, 4, leader("ts-1"),
                                        follower("ts-2"))));
    assertEquals(TabletChangeEvent.Reason.SPLIT_OR_MERGED,
      TabletChangeEvent.why(OLD, tablet(EMPTY, P, 4, leader("ts-1"),
                                        follower("ts-2"))));
    assertEquals(TabletChangeEvent.Reason.SPLIT_OR_MERGED,
      TabletChangeEvent.why(OLD, null));
  }

  @Test
  public void equalsAndHashCode() {
    final TabletInfo same = tablet(G, P, 4, leader("ts-1"), follower("ts-2"));
    final TabletInfo moved = tablet(G, P, 4, leader("ts-3"));
    new EqualsTester()
      .addEqualityGroup(new TabletChangeEvent(OLD, same, DETECTED),
                        new TabletChangeEvent(OLD, same, DETECTED))
      .addEqualityGroup(new TabletChangeEvent(OLD, same, DETECTED + 1))
      .addEqualityGroup(new TabletChangeEvent(OLD, moved, DETECTED))
      .addEqualityGroup(new TabletChangeEvent(OLD, null, DETECTED))
      .testEquals();
  }

}
