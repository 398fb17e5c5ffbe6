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
import com.google.common.net.HostAndPort;

/**
 * An entry of the server directory: what we know about one tablet server.
 * <p>
 * There's exactly one instance per server UUID, owned by the
 * {@link LocationCache}.  Tablets refer to servers by UUID and never own
 * them, so a single entry is shared by every tablet the server hosts.  The
 * address and placement of a server can change from one refresh to the
 * next; they're updated in place.  Each field is individually immutable and
 * published through a volatile reference, so readers never need a lock.
 */
public final class TabletServer {

  /** What we believe about the server's health.  */
  public enum Health {
    /** Nobody told us anything yet.  */
    UNKNOWN,
    /** The data path recently talked to it successfully.  */
    ALIVE,
    /** The data path failed to talk to it.  */
    DEAD;
  }

  private final String uuid;
  private volatile ImmutableList<HostAndPort> addresses;
  private volatile CloudInfo cloud_info;
  private volatile Health health = Health.UNKNOWN;

  /** When we last heard of this server, in ticker nanoseconds.  */
  private volatile long last_seen_nanos;

  /** Whether some tablet referred to this server during the last sweep.  */
  private boolean referenced = true;

  /**
   * Since when no tablet refers to this server, in ticker nanoseconds.
   * Only meaningful when {@link #referenced} is {@code false}.
   */
  private long unreferenced_since_nanos;

  /**
   * Constructor.
   * @param uuid The permanent UUID of the server.
   * @param addresses The addresses at which the server can be reached.
   * Must contain at least one address.
   * @param cloud_info Where the server lives.
   * @param now_nanos The current time, as read from the ticker.
   */
  TabletServer(final String uuid, final List<HostAndPort> addresses,
               final CloudInfo cloud_info, final long now_nanos) {
    if (uuid == null || uuid.isEmpty()) {
      throw new IllegalArgumentException("A server must have a UUID");
    }
    checkAddresses(uuid, addresses);
    this.uuid = uuid;
    this.addresses = ImmutableList.copyOf(addresses);
    this.cloud_info = cloud_info == null ? CloudInfo.UNKNOWN : cloud_info;
    this.last_seen_nanos = now_nanos;
  }

  private static void checkAddresses(final String uuid,
                                     final List<HostAndPort> addresses) {
    if (addresses == null || addresses.isEmpty()) {
      throw new IllegalArgumentException("Server " + uuid
                                         + " doesn't have any address");
    }
  }

  /**
   * Updates the address and placement of this server, as reported by the
   * metadata authority.
   * <p>
   * A server that we believed to be dead but that the authority still lists
   * goes back to {@link Health#UNKNOWN}, so it gets another chance.
   * @param new_addresses The addresses the authority reported.
   * @param new_cloud_info The placement the authority reported.
   * @param now_nanos The current time, as read from the ticker.
   * @return {@code true} if the address or placement changed.
   */
  synchronized boolean update(final List<HostAndPort> new_addresses,
                              final CloudInfo new_cloud_info,
                              final long now_nanos) {
    checkAddresses(uuid, new_addresses);
    boolean changed = false;
    if (!addresses.equals(new_addresses)) {
      addresses = ImmutableList.copyOf(new_addresses);
      changed = true;
    }
    final CloudInfo cloud = new_cloud_info == null
      ? CloudInfo.UNKNOWN : new_cloud_info;
    if (!cloud_info.equals(cloud)) {
      cloud_info = cloud;
      changed = true;
    }
    if (health == Health.DEAD) {
      health = Health.UNKNOWN;
    }
    touch(now_nanos);
    return changed;
  }

  /** Records that we just heard of this server.  */
  synchronized void touch(final long now_nanos) {
    last_seen_nanos = now_nanos;
    referenced = true;
  }

  /** Changes our belief about this server's health.  */
  void setHealth(final Health health) {
    this.health = health;
  }

  /** Returns the permanent UUID of this server.  */
  public String getUuid() {
    return uuid;
  }

  /** Returns all the addresses of this server, in order of preference.  */
  public List<HostAndPort> getAddresses() {
    return addresses;
  }

  /** Returns the preferred host name of this server.  */
  public String getHostname() {
    return addresses.get(0).getHost();
  }

  /** Returns the port on the preferred address of this server.  */
  public int getPort() {
    return addresses.get(0).getPort();
  }

  /** Returns where this server lives.  */
  public CloudInfo getCloudInfo() {
    return cloud_info;
  }

  /** Returns what we believe about the health of this server.  */
  public Health getHealth() {
    return health;
  }

  /** Returns when we last heard of this server, in ticker nanoseconds.  */
  long lastSeenNanos() {
    return last_seen_nanos;
  }

  /**
   * Records that no tablet refers to this server anymore.
   * @param now_nanos The current time, as read from the ticker.
   * @return Since when the server has been unreferenced.  Calling this
   * repeatedly doesn't reset the clock.
   */
  synchronized long markUnreferenced(final long now_nanos) {
    if (referenced) {
      referenced = false;
      unreferenced_since_nanos = now_nanos;
    }
    return unreferenced_since_nanos;
  }

  synchronized void markReferenced() {
    referenced = true;
  }

  @Override
  public String toString() {
    return "TabletServer(uuid=" + uuid + ", addresses=" + addresses
      + ", cloud_info=" + cloud_info + ", health=" + health + ')';
  }

}
