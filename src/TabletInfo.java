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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Stores what we know about a tablet: its key range and where its replicas
 * are.
 * <p>
 * Instances are immutable.  Every refresh builds a brand new instance with a
 * higher epoch that replaces the previous one wholesale, which is what lets
 * readers use a {@code TabletInfo} without any locking: they see either the
 * old replica list or the new one, never a mix of both.
 * <p>
 * Replicas refer to servers by UUID.  The {@link LocationCache} resolves
 * them through its server directory.
 */
final class TabletInfo {

  /** One replica of the tablet: a reference into the directory and a role. */
  static final class Replica {
    private final String server_uuid;
    private final ReplicaRole role;

    Replica(final String server_uuid, final ReplicaRole role) {
      this.server_uuid = server_uuid;
      this.role = role;
    }

    String serverUuid() {
      return server_uuid;
    }

    ReplicaRole role() {
      return role;
    }

    public String toString() {
      return server_uuid + '/' + role;
    }
  }

  private final String table;
  private final String tablet_id;
  private final byte[] start_key;
  private final byte[] end_key;
  private final ImmutableList<Replica> replicas;
  private final long epoch;
  private final long refreshed_nanos;
  private final boolean invalidated;
  /** When this record was invalidated, meaningless unless invalidated.  */
  private final long invalidated_nanos;

  /**
   * Constructor.
   * @param table The table this tablet belongs to.
   * @param tablet_id The unique ID of this tablet.
   * @param start_key The start key (inclusive) of the tablet.  An empty
   * array means the tablet is the first of its table.
   * @param end_key The end key (exclusive) of the tablet.  An empty array
   * means the tablet is the last of its table.
   * @param replicas The replicas, in the order given by the authority.
   * @param epoch The refresh generation of this record.
   * @param refreshed_nanos When this record was built, in ticker nanoseconds.
   */
  TabletInfo(final String table, final String tablet_id,
             final byte[] start_key, final byte[] end_key,
             final List<Replica> replicas, final long epoch,
             final long refreshed_nanos) {
    this(table, tablet_id, start_key, end_key, ImmutableList.copyOf(replicas),
         epoch, refreshed_nanos, false, 0);
  }

  private TabletInfo(final String table, final String tablet_id,
                     final byte[] start_key, final byte[] end_key,
                     final ImmutableList<Replica> replicas, final long epoch,
                     final long refreshed_nanos, final boolean invalidated,
                     final long invalidated_nanos) {
    this.table = table;
    this.tablet_id = tablet_id;
    // Makes comparisons easier: we can do == instead of a length check.
    this.start_key = start_key.length == 0 ? TabletLocator.EMPTY_ARRAY
                                           : start_key;
    this.end_key = end_key.length == 0 ? TabletLocator.EMPTY_ARRAY : end_key;
    this.replicas = replicas;
    this.epoch = epoch;
    this.refreshed_nanos = refreshed_nanos;
    this.invalidated = invalidated;
    this.invalidated_nanos = invalidated_nanos;
  }

  /**
   * Returns a copy of this record whose freshness has expired.
   * <p>
   * The copy keeps the same epoch and replicas, so it can still be used as
   * a fallback if the refresh it triggers fails.
   * @param now_nanos The current time, as read from the ticker.
   */
  TabletInfo invalidate(final long now_nanos) {
    if (invalidated) {
      return this;  // Keep the time of the first invalidation.
    }
    return new TabletInfo(table, tablet_id, start_key, end_key, replicas,
                          epoch, refreshed_nanos, true, now_nanos);
  }

  /**
   * Returns {@code true} if this record can be used without refreshing it.
   * @param now_nanos The current time, as read from the ticker.
   * @param staleness_nanos How long a record stays fresh.
   */
  boolean isFresh(final long now_nanos, final long staleness_nanos) {
    return !invalidated && now_nanos - refreshed_nanos < staleness_nanos;
  }

  /** Returns {@code true} if the given key falls in this tablet.  */
  boolean containsKey(final byte[] key) {
    return Bytes.memcmp(start_key, key) <= 0
      && (end_key == TabletLocator.EMPTY_ARRAY
          || Bytes.memcmp(key, end_key) < 0);
  }

  /**
   * Returns the UUID of the leader replica.
   * @return A possibly {@code null} UUID, if no replica is the leader.
   */
  String leaderUuid() {
    for (final Replica replica : replicas) {
      if (replica.role() == ReplicaRole.LEADER) {
        return replica.serverUuid();
      }
    }
    return null;
  }

  /** Returns {@code true} if the two key ranges have a key in common.  */
  boolean overlaps(final TabletInfo other) {
    return (end_key == TabletLocator.EMPTY_ARRAY
            || Bytes.memcmp(other.start_key, end_key) < 0)
      && (other.end_key == TabletLocator.EMPTY_ARRAY
          || Bytes.memcmp(start_key, other.end_key) < 0);
  }

  String table() {
    return table;
  }

  String tabletId() {
    return tablet_id;
  }

  byte[] startKey() {
    return start_key;
  }

  byte[] endKey() {
    return end_key;
  }

  List<Replica> replicas() {
    return replicas;
  }

  long epoch() {
    return epoch;
  }

  long refreshedNanos() {
    return refreshed_nanos;
  }

  boolean isInvalidated() {
    return invalidated;
  }

  long invalidatedNanos() {
    return invalidated_nanos;
  }

  public String toString() {
    final StringBuilder buf = new StringBuilder(64 + tablet_id.length()
      + start_key.length * 2 + end_key.length * 2 + replicas.size() * 40);
    buf.append("TabletInfo(table=").append(table)
      .append(", tablet_id=").append(tablet_id)
      .append(", start_key=");
    Bytes.pretty(buf, start_key);
    buf.append(", end_key=");
    Bytes.pretty(buf, end_key);
    buf.append(", replicas=").append(replicas)
      .append(", epoch=").append(epoch);
    if (invalidated) {
      buf.append(", invalidated");
    }
    buf.append(')');
    return buf.toString();
  }

}
