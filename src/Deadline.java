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

import java.util.concurrent.TimeUnit;

import com.google.common.base.Ticker;

/**
 * Tracks how much of a top-level call's time budget is left.
 * <p>
 * A deadline is created once, when the call enters the locator, and is
 * handed down to every lookup and retry it triggers so that nothing keeps
 * going past the caller's budget.  This class is immutable.
 */
final class Deadline {

  /**
   * Longest timeout we honor, about a century.  Longer ones, such as
   * {@code Long.MAX_VALUE}, are shortened to this so that the absolute
   * deadline and the delays we give the timer don't overflow.
   */
  static final long MAX_TIMEOUT_MS = TimeUnit.DAYS.toMillis(36500);

  private final Ticker ticker;
  private final long deadline_nanos;

  private Deadline(final Ticker ticker, final long deadline_nanos) {
    this.ticker = ticker;
    this.deadline_nanos = deadline_nanos;
  }

  /**
   * Creates a deadline that expires after the given timeout.
   * @param ticker The source of time.
   * @param timeout_ms How many milliseconds from now before we time out.
   * Must be strictly positive.
   * @throws IllegalArgumentException if the timeout isn't positive.
   */
  static Deadline after(final Ticker ticker, final long timeout_ms) {
    if (timeout_ms <= 0) {
      throw new IllegalArgumentException("Timeout must be positive: "
                                         + timeout_ms);
    }
    return new Deadline(ticker, ticker.read() + TimeUnit.MILLISECONDS.toNanos(
      Math.min(timeout_ms, MAX_TIMEOUT_MS)));
  }

  /** Returns {@code true} if the deadline has passed.  */
  boolean timedOut() {
    return remainingNanos() <= 0;
  }

  /**
   * Returns how many nanoseconds are left, negative once we've timed out.
   */
  long remainingNanos() {
    return deadline_nanos - ticker.read();
  }

  /**
   * Returns how many milliseconds are left, rounded up, or 0 once we've
   * timed out.
   */
  long remainingMillis() {
    final long nanos = remainingNanos();
    if (nanos <= 0) {
      return 0;
    }
    return nanos / 1000000L + (nanos % 1000000L == 0 ? 0 : 1);
  }

  /**
   * Checks whether sleeping for the given amount of time would make us time
   * out before we wake up.
   * @param sleep_ms How long we'd like to sleep, in milliseconds.
   */
  boolean wouldSleepingTimeout(final long sleep_ms) {
    return remainingNanos() - TimeUnit.MILLISECONDS.toNanos(sleep_ms) <= 0;
  }

  /**
   * Returns whichever of the two deadlines expires last.
   * @param other Another deadline, built with the same ticker.
   */
  Deadline latest(final Deadline other) {
    return other.deadline_nanos - deadline_nanos > 0 ? other : this;
  }

  public String toString() {
    final long nanos = remainingNanos();
    return nanos <= 0 ? "Deadline(expired)"
      : "Deadline(" + TimeUnit.NANOSECONDS.toMillis(nanos) + "ms left)";
  }

}
