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
 * Indicates that the metadata authority returned tablet locations that
 * can't possibly be right, e.g. partitions that overlap or leave a hole in
 * the key space.  Nothing from such a response is installed in the cache.
 */
public final class BrokenMetadataException extends NonRecoverableException {

  private final String table;

  /**
   * Constructor.
   * @param table The table we were refreshing.
   * @param msg A message describing as precisely as possible what's wrong
   * with the metadata.
   */
  BrokenMetadataException(final String table, final String msg) {
    super("The locations of " + table + " seem broken.  " + msg);
    this.table = table;
  }

  /** Returns the table whose metadata is broken.  */
  public String getTable() {
    return table;
  }

  private static final long serialVersionUID = 1761829211;

}
