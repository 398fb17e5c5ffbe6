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

/**
 * Thrown when every known replica of a tablet is either excluded by the
 * caller or known to be dead.
 * <p>
 * Retrying after the tablet's locations were refreshed may succeed.
 */
public final class NoAvailableReplicaException extends RecoverableException {

  private final String tablet_id;

  /**
   * Constructor.
   * @param tablet_id The ID of the tablet we tried to route to.
   * @param msg Why no replica could be chosen.
   */
  NoAvailableReplicaException(final String tablet_id, final String msg) {
    super(msg + " for tablet " + tablet_id);
    this.tablet_id = tablet_id;
  }

  /** Returns the ID of the tablet we tried to route to.  */
  public String getTabletId() {
    return tablet_id;
  }

  @Override
  NoAvailableReplicaException make(final Object tablet_id) {
    return new NoAvailableReplicaException((String) tablet_id,
                                           "No replica available");
  }

  private static final long serialVersionUID = 1761829206;

}
