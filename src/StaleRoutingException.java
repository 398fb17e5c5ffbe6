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
 * Reported by the data path when a server told us it's no longer the right
 * place for a tablet (the tablet moved, or the server isn't the leader).
 * <p>
 * This is the only signal, outside of the regular refresh cadence, that
 * invalidates a cached tablet.  Hand it to
 * {@link TabletLocator#handleStaleRouting} and retry the request once the
 * returned {@code Deferred} completes.
 */
public final class StaleRoutingException extends RecoverableException {

  private final String table;
  private final String tablet_id;
  private final String server_uuid;

  /**
   * Constructor.
   * @param table The table of the tablet.
   * @param tablet_id The ID of the tablet the request was sent to.
   * @param server_uuid The server that rejected the request, or {@code null}.
   * @param msg What the server said.
   */
  public StaleRoutingException(final String table, final String tablet_id,
                               final String server_uuid, final String msg) {
    super(msg + " (tablet " + tablet_id + " on " + server_uuid + ')');
    this.table = table;
    this.tablet_id = tablet_id;
    this.server_uuid = server_uuid;
  }

  /** Returns the table of the tablet.  */
  public String getTable() {
    return table;
  }

  /** Returns the ID of the tablet the request was sent to.  */
  public String getTabletId() {
    return tablet_id;
  }

  /**
   * Returns the server that rejected the request.
   * @return A possibly {@code null} server UUID.
   */
  public String getServerUuid() {
    return server_uuid;
  }

  @Override
  StaleRoutingException make(final Object tablet_id) {
    return new StaleRoutingException(table, (String) tablet_id, server_uuid,
                                     "Stale routing");
  }

  private static final long serialVersionUID = 1761829210;

}
