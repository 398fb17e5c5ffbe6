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

import java.util.HashSet;
import java.util.Set;

import com.google.common.base.Objects;

/**
 * Description of how a tablet changed after the data path told us we were
 * routing to it with stale information.
 * <p>
 * Given the record that was invalidated and the one that replaced it, this
 * class determines a likely reason for the stale routing and how long it
 * took us to find out where the tablet went.
 */
public final class TabletChangeEvent {

  /** Probable reason for the stale routing.  */
  public enum Reason {
    /** Nothing changed, the server probably was momentarily unavailable.  */
    UNCHANGED,
    /** Same replicas, different leader.  */
    LEADER_CHANGED,
    /** Same key range, different set of servers.  */
    MOVED,
    /** The key range changed, or the tablet is gone.  */
    SPLIT_OR_MERGED;
  }

  private final String tablet_id;
  private final Reason reason;
  private final long old_epoch;
  private final long new_epoch;
  private final long detection_nanos;
  private final long resolution_nanos;

  /**
   * Create a new event.
   * @param old_tablet The record that was invalidated.
   * @param new_tablet The record that replaced it, or {@code null} if the
   * tablet no longer exists.
   * @param resolution_nanos When the new record was installed, in ticker
   * nanoseconds.
   */
  TabletChangeEvent(final TabletInfo old_tablet, final TabletInfo new_tablet,
                    final long resolution_nanos) {
    if (old_tablet == null) {
      throw new IllegalArgumentException("old tablet can't be null");
    }
    if (!old_tablet.isInvalidated()) {
      throw new IllegalArgumentException("old tablet wasn't invalidated: "
                                         + old_tablet);
    }
    if (old_tablet.invalidatedNanos() - resolution_nanos > 0) {
      throw new IllegalArgumentException("resolution can't happen before "
                                         + "the invalidation");
    }
    tablet_id = old_tablet.tabletId();
    reason = why(old_tablet, new_tablet);
    old_epoch = old_tablet.epoch();
    new_epoch = new_tablet == null ? -1 : new_tablet.epoch();
    detection_nanos = old_tablet.invalidatedNanos();
    this.resolution_nanos = resolution_nanos;
  }

  /**
   * Given the record from before and after the refresh, attempts to
   * determine why routing to the tablet went stale.
   * @param old_tablet The record that was invalidated.
   * @param new_tablet The record that replaced it, possibly {@code null}.
   */
  static Reason why(final TabletInfo old_tablet, final TabletInfo new_tablet) {
    if (new_tablet == null
        || Bytes.memcmp(old_tablet.startKey(), new_tablet.startKey()) != 0
        || Bytes.memcmp(old_tablet.endKey(), new_tablet.endKey()) != 0) {
      return Reason.SPLIT_OR_MERGED;
    }
    if (!servers(old_tablet).equals(servers(new_tablet))) {
      return Reason.MOVED;
    }
    if (!Objects.equal(old_tablet.leaderUuid(), new_tablet.leaderUuid())) {
      return Reason.LEADER_CHANGED;
    }
    return Reason.UNCHANGED;
  }

  private static Set<String> servers(final TabletInfo tablet) {
    final Set<String> uuids = new HashSet<String>();
    for (final TabletInfo.Replica replica : tablet.replicas()) {
      uuids.add(replica.serverUuid());
    }
    return uuids;
  }

  /** @return the ID of the affected tablet. */
  public String getTabletId() {
    return tablet_id;
  }

  /** @return likely reason for the stale routing. */
  public Reason getReason() {
    return reason;
  }

  /** @return the epoch of the record that was invalidated. */
  public long getOldEpoch() {
    return old_epoch;
  }

  /** @return the epoch of the new record, or -1 if the tablet is gone. */
  public long getNewEpoch() {
    return new_epoch;
  }

  /** @return how long, in milliseconds, we routed to the tablet blindly. */
  public long getDurationMs() {
    return (resolution_nanos - detection_nanos) / 1000000L;
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(tablet_id, reason, old_epoch, new_epoch,
                            detection_nanos, resolution_nanos);
  }

  @Override
  public boolean equals(final Object other) {
    if (null == other) {
      return false;
    }
    if (this == other) {
      return true;
    }
    if (getClass() != other.getClass()) {
      return false;
    }

    final TabletChangeEvent event = (TabletChangeEvent) other;
    return Objects.equal(tablet_id, event.tablet_id)
      && reason == event.reason
      && old_epoch == event.old_epoch
      && new_epoch == event.new_epoch
      && detection_nanos == event.detection_nanos
      && resolution_nanos == event.resolution_nanos;
  }

  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder();
    buf.append("tabletId=")
       .append(tablet_id)
       .append(", reason=")
       .append(reason)
       .append(", oldEpoch=")
       .append(old_epoch)
       .append(", newEpoch=")
       .append(new_epoch)
       .append(", duration=")
       .append(getDurationMs())
       .append("ms");
    return buf.toString();
  }
}
