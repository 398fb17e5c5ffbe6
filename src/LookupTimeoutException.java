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
 * Thrown when the locations of a table couldn't be fetched from the metadata
 * authority before the caller's deadline.
 * <p>
 * This is fatal to the call that timed out, but not to the lookup itself:
 * the in-flight request may still complete for other callers waiting on it.
 */
public final class LookupTimeoutException extends NonRecoverableException {

  private final String table;

  /**
   * Constructor.
   * @param table The table whose locations we were looking up.
   * @param msg The message of the exception.
   * @param cause The last error returned by the metadata authority, if any
   * (can be {@code null}).
   */
  LookupTimeoutException(final String table, final String msg,
                         final Throwable cause) {
    super(msg, cause);
    this.table = table;
  }

  /** Returns the table whose locations we were looking up.  */
  public String getTable() {
    return table;
  }

  @Override
  LookupTimeoutException make(final Object table) {
    return new LookupTimeoutException((String) table, getMessage(), getCause());
  }

  private static final long serialVersionUID = 1761829208;

}
