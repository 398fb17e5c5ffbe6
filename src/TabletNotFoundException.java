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
 * Exception thrown when a tablet can't be found, even after the locations
 * of its table were refreshed from the metadata authority.
 */
public final class TabletNotFoundException extends NonRecoverableException {

  private final String table;
  private final String tablet_id;

  /**
   * Constructor.
   * @param table The table we were looking into.
   * @param tablet_id The ID of the tablet, or {@code null} if we were
   * looking the tablet up by key.
   * @param what A short description of what we were looking for.
   */
  TabletNotFoundException(final String table, final String tablet_id,
                          final String what) {
    super("No tablet of table " + table + " for " + what);
    this.table = table;
    this.tablet_id = tablet_id;
  }

  /** Returns the table we were looking into.  */
  public String getTable() {
    return table;
  }

  /**
   * Returns the tablet ID that wasn't found.
   * @return A possibly {@code null} ID, when the lookup was done by key.
   */
  public String getTabletId() {
    return tablet_id;
  }

  @Override
  TabletNotFoundException make(final Object tablet_id) {
    return new TabletNotFoundException(table, (String) tablet_id,
                                       "tablet " + tablet_id);
  }

  private static final long serialVersionUID = 1761829205;

}
