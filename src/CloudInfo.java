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

import com.google.common.base.Objects;

/**
 * Where a node lives: a {@code cloud / region / zone} triple.
 * <p>
 * Each component is an opaque string, and an empty string means "unknown".
 * Two unknown components never match each other.  This class is immutable.
 */
public final class CloudInfo {

  /** Placement about which nothing is known.  */
  public static final CloudInfo UNKNOWN = new CloudInfo("", "", "");

  private final String cloud;
  private final String region;
  private final String zone;

  /**
   * Constructor.
   * @param cloud The cloud, e.g. {@code "aws"}.  {@code null} means unknown.
   * @param region The region, e.g. {@code "us-west-2"}.  {@code null} means
   * unknown.
   * @param zone The zone, e.g. {@code "us-west-2a"}.  {@code null} means
   * unknown.
   */
  public CloudInfo(final String cloud, final String region, final String zone) {
    this.cloud = cloud == null ? "" : cloud;
    this.region = region == null ? "" : region;
    this.zone = zone == null ? "" : zone;
  }

  /** Returns the cloud, or an empty string if unknown.  */
  public String getCloud() {
    return cloud;
  }

  /** Returns the region, or an empty string if unknown.  */
  public String getRegion() {
    return region;
  }

  /** Returns the zone, or an empty string if unknown.  */
  public String getZone() {
    return zone;
  }

  /** Returns true if both sides know their zone and it's the same.  */
  boolean sameZone(final CloudInfo other) {
    return !zone.isEmpty() && zone.equals(other.zone);
  }

  /** Returns true if both sides know their region and it's the same.  */
  boolean sameRegion(final CloudInfo other) {
    return !region.isEmpty() && region.equals(other.region);
  }

  /** Returns true if both sides know their cloud and it's the same.  */
  boolean sameCloud(final CloudInfo other) {
    return !cloud.isEmpty() && cloud.equals(other.cloud);
  }

  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof CloudInfo)) {
      return false;
    }
    final CloudInfo that = (CloudInfo) other;
    return cloud.equals(that.cloud)
      && region.equals(that.region)
      && zone.equals(that.zone);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(cloud, region, zone);
  }

  @Override
  public String toString() {
    return cloud + '.' + region + '.' + zone;
  }

}
