/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package org.slquery.config;

import java.time.Duration;

/**
 * Reconnection policy of a query client.
 *
 * <p>When the connection drops for any reason other than the client closing it, the client
 * reconnects and repeats the handshake. Each consecutive failure increments an attempt counter
 * that a successful handshake resets. Once the counter exceeds {@link #getMaxRetries()} the
 * client gives up and closes itself.
 *
 * <p>The default policy, {@link #immediate()}, retries without any delay, up to 10 times.
 */
public final class RetryPolicy {

    public static final int DEFAULT_MAX_RETRIES = 10;

    private final int maxRetries;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;

    private RetryPolicy(int maxRetries, Duration initialDelay, Duration maxDelay, double multiplier) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Retry delays must not be negative");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
        this.maxRetries = maxRetries;
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
    }

    /**
     * Creates the default policy: up to {@value #DEFAULT_MAX_RETRIES} retries, no delay.
     *
     * @return a RetryPolicy retrying immediately
     */
    public static RetryPolicy immediate() {
        return immediate(DEFAULT_MAX_RETRIES);
    }

    /**
     * Creates a policy retrying immediately.
     *
     * @param maxRetries the maximum number of consecutive retries
     * @return a RetryPolicy retrying immediately
     */
    public static RetryPolicy immediate(int maxRetries) {
        return new RetryPolicy(maxRetries, Duration.ZERO, Duration.ZERO, 1.0);
    }

    /**
     * Creates a retry policy with exponential backoff using default parameters.
     *
     * <p>Default configuration:
     * <ul>
     *   <li>Max retries: 10</li>
     *   <li>Initial delay: 100ms</li>
     *   <li>Max delay: 5s</li>
     *   <li>Multiplier: 2.0</li>
     * </ul>
     *
     * @return a RetryPolicy with exponential backoff configuration
     */
    public static RetryPolicy exponentialBackoff() {
        return new RetryPolicy(DEFAULT_MAX_RETRIES, Duration.ofMillis(100), Duration.ofSeconds(5), 2.0);
    }

    /**
     * Creates a retry policy with exponential backoff and custom parameters.
     *
     * @param maxRetries   the maximum number of consecutive retries
     * @param initialDelay the delay before the first retry
     * @param maxDelay     the maximum delay between retries
     * @param multiplier   the multiplier for exponential backoff
     * @return a RetryPolicy with custom exponential backoff configuration
     */
    public static RetryPolicy exponentialBackoff(
            int maxRetries, Duration initialDelay, Duration maxDelay, double multiplier) {
        return new RetryPolicy(maxRetries, initialDelay, maxDelay, multiplier);
    }

    /**
     * Creates a retry policy with fixed delay between retries.
     *
     * @param maxRetries the maximum number of consecutive retries
     * @param delay      the fixed delay between retries
     * @return a RetryPolicy with fixed delay configuration
     */
    public static RetryPolicy fixedDelay(int maxRetries, Duration delay) {
        return new RetryPolicy(maxRetries, delay, delay, 1.0);
    }

    /**
     * Creates a policy without retries: after losing its connection the client reconnects once
     * and closes itself if that attempt fails.
     *
     * @return a RetryPolicy that does not retry
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 1.0);
    }

    /**
     * Returns the delay before the retry with the given zero-based index.
     *
     * @param attempt the number of consecutive failures before this retry
     * @return the delay, never longer than {@link #getMaxDelay()}
     */
    public Duration delayFor(int attempt) {
        if (initialDelay.isZero()) {
            return Duration.ZERO;
        }
        double millis = initialDelay.toMillis() * Math.pow(multiplier, Math.max(0, attempt));
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    /**
     * Gets the maximum number of consecutive retry attempts.
     *
     * @return the maximum number of retries
     */
    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public double getMultiplier() {
        return multiplier;
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxRetries=" + maxRetries + ", initialDelay=" + initialDelay + ", maxDelay=" + maxDelay
                + ", multiplier=" + multiplier + "}";
    }
}
