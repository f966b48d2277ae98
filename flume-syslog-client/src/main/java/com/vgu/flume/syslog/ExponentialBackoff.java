/*
   Copyright 2013 Vincent.Gu

   Licensed under the Apache License, Version 2.0 (the "License");
   you may not use this file except in compliance with the License.
   You may obtain a copy of the License at

       http://www.apache.org/licenses/LICENSE-2.0

   Unless required by applicable law or agreed to in writing, software
   distributed under the License is distributed on an "AS IS" BASIS,
   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
   See the License for the specific language governing permissions and
   limitations under the License.
 */
package com.vgu.flume.syslog;

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Delays grow as {@code initialDelay * multiplier^n}, optionally spread by a
 * jitter factor, and never exceed {@code maxDelay}.
 *
 * <pre>{@code
 * Backoff backoff = ExponentialBackoff.builder()
 *     .initialDelayMillis(1000)
 *     .maxDelayMillis(60000)
 *     .jitterFactor(0.1)
 *     .build();
 * }</pre>
 */
public class ExponentialBackoff implements Backoff {
  public static final long DEFAULT_INITIAL_DELAY_MILLIS = 5000;
  public static final long DEFAULT_MAX_DELAY_MILLIS = 120000;
  public static final double DEFAULT_MULTIPLIER = 2.0;

  private final long initialDelayMillis;
  private final long maxDelayMillis;
  private final double multiplier;
  private final double jitterFactor;
  private int attempt;

  private ExponentialBackoff(Builder builder) {
    this.initialDelayMillis = builder.initialDelayMillis;
    this.maxDelayMillis = builder.maxDelayMillis;
    this.multiplier = builder.multiplier;
    this.jitterFactor = builder.jitterFactor;
  }

  private ExponentialBackoff(ExponentialBackoff prototype) {
    this.initialDelayMillis = prototype.initialDelayMillis;
    this.maxDelayMillis = prototype.maxDelayMillis;
    this.multiplier = prototype.multiplier;
    this.jitterFactor = prototype.jitterFactor;
  }

  /** A policy that never delays a reconnect. */
  public static ExponentialBackoff none() {
    return builder().initialDelayMillis(0).maxDelayMillis(0).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public long nextDelayMillis() {
    double delay = initialDelayMillis * Math.pow(multiplier, attempt);
    if (delay < maxDelayMillis) {
      attempt++;
    }
    long capped = (long) Math.min(delay, (double) maxDelayMillis);
    if (jitterFactor > 0 && capped > 0) {
      double jitter = ThreadLocalRandom.current()
          .nextDouble(-jitterFactor, jitterFactor);
      capped = Math.min(maxDelayMillis,
          Math.max(0, (long) (capped * (1 + jitter))));
    }
    return capped;
  }

  @Override
  public void reset() {
    attempt = 0;
  }

  @Override
  public String toString() {
    return "ExponentialBackoff{initialDelayMillis=" + initialDelayMillis +
        ", maxDelayMillis=" + maxDelayMillis + ", multiplier=" + multiplier +
        ", jitterFactor=" + jitterFactor + "}";
  }

  public static class Builder {
    private long initialDelayMillis = DEFAULT_INITIAL_DELAY_MILLIS;
    private long maxDelayMillis = DEFAULT_MAX_DELAY_MILLIS;
    private double multiplier = DEFAULT_MULTIPLIER;
    private double jitterFactor;

    public Builder initialDelayMillis(long initialDelayMillis) {
      Preconditions.checkArgument(initialDelayMillis >= 0,
          "initial delay must not be negative");
      this.initialDelayMillis = initialDelayMillis;
      return this;
    }

    public Builder maxDelayMillis(long maxDelayMillis) {
      Preconditions.checkArgument(maxDelayMillis >= 0,
          "max delay must not be negative");
      this.maxDelayMillis = maxDelayMillis;
      return this;
    }

    public Builder multiplier(double multiplier) {
      Preconditions.checkArgument(multiplier >= 1.0,
          "multiplier must be at least 1.0");
      this.multiplier = multiplier;
      return this;
    }

    public Builder jitterFactor(double jitterFactor) {
      Preconditions.checkArgument(jitterFactor >= 0 && jitterFactor <= 1,
          "jitter factor out of range");
      this.jitterFactor = jitterFactor;
      return this;
    }

    public ExponentialBackoff build() {
      Preconditions.checkArgument(initialDelayMillis <= maxDelayMillis,
          "initial delay exceeds max delay");
      return new ExponentialBackoff(this);
    }

    /** Hands out a fresh policy with these settings on every call. */
    public Supplier<ExponentialBackoff> buildSupplier() {
      final ExponentialBackoff prototype = build();
      return new Supplier<ExponentialBackoff>() {
        @Override
        public ExponentialBackoff get() {
          return new ExponentialBackoff(prototype);
        }
      };
    }
  }
}
