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

import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.net.HostAndPort;

/**
 * The locations of one tablet, as returned by the metadata authority.
 * <p>
 * This is how {@link MetadataAuthority} implementations hand their answers
 * to the locator; it's decoupled from whatever wire format they use.
 */
public final class TabletLocations {

  /** One replica of the tablet, with everything we know about its server. */
  public static final class Replica {
    private final String server_uuid;
    private final ImmutableList<HostAndPort> addresses;
    private final CloudInfo cloud_info;
    private final ReplicaRole role;

    /**
     * Constructor.
     * @param server_uuid The permanent UUID of the server hosting the replica.
     * @param addresses The addresses of the server, in order of preference.
     * @param cloud_info Where the server lives.
     * @param role The role of this replica.
     */
    public Replica(final String server_uuid,
                   final List<HostAndPort> addresses,
                   final CloudInfo cloud_info, final ReplicaRole role) {
      this.server_uuid = server_uuid;
      this.addresses = ImmutableList.copyOf(addresses);
      this.cloud_info = cloud_info;
      this.role = role;
    }

    /** Shorthand for a server with a single address.  */
    public Replica(final String server_uuid, final String host,
                   final int port, final CloudInfo cloud_info,
                   final ReplicaRole role) {
      this(server_uuid, ImmutableList.of(HostAndPort.fromParts(host, port)),
           cloud_info, role);
    }

    public String getServerUuid() {
      return server_uuid;
    }

    public List<HostAndPort> getAddresses() {
      return addresses;
    }

    public CloudInfo getCloudInfo() {
      return cloud_info;
    }

    public ReplicaRole getRole() {
      return role;
    }

    public String toString() {
      return "Replica(uuid=" + server_uuid + ", addresses=" + addresses
        + ", cloud_info=" + cloud_info + ", role=" + role + ')';
    }
  }

  private final String tablet_id;
  private final byte[] start_key;
  private final byte[] end_key;
  private final ImmutableList<Replica> replicas;

  /**
   * Constructor.
   * @param tablet_id The unique ID of the tablet.
   * @param start_key The start key (inclusive), empty for the first tablet.
   * @param end_key The end key (exclusive), empty for the last tablet.
   * @param replicas The replicas of the tablet.
   */
  public TabletLocations(final String tablet_id, final byte[] start_key,
                         final byte[] end_key, final List<Replica> replicas) {
    if (tablet_id == null || tablet_id.isEmpty()) {
      throw new IllegalArgumentException("A tablet must have an ID");
    }
    this.tablet_id = tablet_id;
    this.start_key = Arrays.copyOf(start_key, start_key.length);
    this.end_key = Arrays.copyOf(end_key, end_key.length);
    this.replicas = ImmutableList.copyOf(replicas);
  }

  public String getTabletId() {
    return tablet_id;
  }

  public byte[] getStartKey() {
    return start_key;
  }

  public byte[] getEndKey() {
    return end_key;
  }

  public List<Replica> getReplicas() {
    return replicas;
  }

  public String toString() {
    return "TabletLocations(tablet_id=" + tablet_id
      + ", start_key=" + Bytes.pretty(start_key)
      + ", end_key=" + Bytes.pretty(end_key)
      + ", replicas=" + replicas + ')';
  }

}
