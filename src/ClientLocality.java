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

import com.google.common.base.Strings;

/**
 * Describes the caller of {@link TabletLocator#route}, so that the closest
 * replica can be picked for it.
 * <p>
 * When the caller is itself a tablet server, its permanent UUID lets us
 * route to the local replica, if there's one.  This class is immutable and
 * isn't persisted anywhere: it's supplied with every call.
 */
public final class ClientLocality {

  /** A caller we know nothing about.  */
  public static final ClientLocality NONE =
    new ClientLocality(null, CloudInfo.UNKNOWN);

  private final String uuid;
  private final CloudInfo cloud_info;

  /**
   * Constructor.
   * @param uuid The permanent UUID of the caller, if it's a tablet server,
   * otherwise {@code null} or an empty string.
   * @param cloud_info Where the caller lives.
   */
  public ClientLocality(final String uuid, final CloudInfo cloud_info) {
    if (cloud_info == null) {
      throw new NullPointerException("cloud_info");
    }
    this.uuid = Strings.emptyToNull(uuid);
    this.cloud_info = cloud_info;
  }

  /**
   * Helper to build a locality out of its components.
   * @param uuid The UUID of the caller, can be {@code null}.
   * @param cloud The cloud of the caller, can be {@code null}.
   * @param region The region of the caller, can be {@code null}.
   * @param zone The zone of the caller, can be {@code null}.
   */
  public static ClientLocality of(final String uuid, final String cloud,
                                  final String region, final String zone) {
    return new ClientLocality(uuid, new CloudInfo(cloud, region, zone));
  }

  /**
   * Builds the locality of this client from the {@code tablet.client.*}
   * settings of the given configuration.
   * @param config The configuration to read from.
   */
  static ClientLocality fromConfig(final Config config) {
    return of(config.getString("tablet.client.uuid"),
              config.getString("tablet.client.cloud"),
              config.getString("tablet.client.region"),
              config.getString("tablet.client.zone"));
  }

  /**
   * Returns the UUID of the caller.
   * @return A possibly {@code null} UUID, if the caller isn't a server.
   */
  public String getUuid() {
    return uuid;
  }

  /** Returns where the caller lives.  */
  public CloudInfo getCloudInfo() {
    return cloud_info;
  }

  @Override
  public String toString() {
    return "ClientLocality(uuid=" + uuid + ", cloud_info=" + cloud_info + ')';
  }

}
