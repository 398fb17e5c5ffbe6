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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Where to send a request: the result of {@link TabletLocator#route}.
 * <p>
 * Carries the server the request should go to, the other replicas to fall
 * back on (best first) and a description of the tablet.  All the arrays
 * are copies so modifications will not affect the locator.
 */
public final class TabletLocation {

  /** A server that hosts a replica of the tablet.  */
  public static final class Endpoint {
    private final String uuid;
    private final String host;
    private final int port;
    private final ReplicaRole role;

    Endpoint(final RemoteReplica replica) {
      final TabletServer server = replica.server();
      uuid = server.getUuid();
      host = server.getHostname();
      port = server.getPort();
      role = replica.role();
    }

    /** Returns the permanent UUID of the server.  */
    public String getUuid() {
      return uuid;
    }

    /** Returns the host name to connect to.  */
    public String getHostname() {
      return host;
    }

    /** Returns the port to connect to.  */
    public int getPort() {
      return port;
    }

    /** Returns the role of the replica on this server.  */
    public ReplicaRole getRole() {
      return role;
    }

    public String toString() {
      return uuid + '@' + host + ':' + port + '/' + role;
    }
  }

  private final String table;
  private final String tablet_id;
  private final byte[] start_key;
  private final byte[] end_key;
  private final long epoch;
  private final Endpoint server;
  private final List<Endpoint> fallbacks;

  /**
   * Package private ctor as we want read-only information for the caller.
   * @param tablet The tablet we routed to.
   * @param choice The replicas chosen by the {@link ReplicaSelector}.
   */
  TabletLocation(final TabletInfo tablet, final ReplicaChoice choice) {
    table = tablet.table();
    tablet_id = tablet.tabletId();
    start_key = Arrays.copyOf(tablet.startKey(), tablet.startKey().length);
    end_key = Arrays.copyOf(tablet.endKey(), tablet.endKey().length);
    epoch = tablet.epoch();
    server = new Endpoint(choice.chosen());
    final List<Endpoint> others =
      new ArrayList<Endpoint>(choice.fallbacks().size());
    for (final RemoteReplica replica : choice.fallbacks()) {
      others.add(new Endpoint(replica));
    }
    fallbacks = Collections.unmodifiableList(others);
  }

  /** Returns the name of the table.  */
  public String getTable() {
    return table;
  }

  /** Returns the ID of the tablet.  */
  public String getTabletId() {
    return tablet_id;
  }

  /**
   * The start key for this tablet.  If this is the first (or only) tablet
   * of the table, the key is empty but never null.
   */
  public byte[] startKey() {
    return start_key;
  }

  /**
   * The end key (exclusive) for this tablet.  If this is the last (or only)
   * tablet of the table, the key is empty but never null.
   */
  public byte[] endKey() {
    return end_key;
  }

  /**
   * Returns the refresh generation of the cached tablet this location was
   * computed from.
   */
  public long getEpoch() {
    return epoch;
  }

  /** Returns the server the request should be sent to.  */
  public Endpoint getServer() {
    return server;
  }

  /** Returns the UUID of the server the request should be sent to.  */
  public String getServerUuid() {
    return server.getUuid();
  }

  /** Returns the host the request should be sent to.  */
  public String getHostname() {
    return server.getHostname();
  }

  /** Returns the port the request should be sent to.  */
  public int getPort() {
    return server.getPort();
  }

  /**
   * Returns the other servers that can serve the request if the chosen one
   * fails, best first.  Empty when the request must go to the leader.
   */
  public List<Endpoint> getFallbacks() {
    return fallbacks;
  }

  @Override
  public String toString() {
    return "TabletLocation(table=" + table
      + ", tablet_id=" + tablet_id
      + ", server=" + server
      + ", fallbacks=" + fallbacks
      + ", start_key=" + Bytes.pretty(start_key)
      + ", end_key=" + Bytes.pretty(end_key)
      + ", epoch=" + epoch + ')';
  }

}
