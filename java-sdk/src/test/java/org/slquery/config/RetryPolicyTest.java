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

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Nested
    class Immediate {

        @Test
        void shouldDefaultToTenRetriesWithoutDelay() {
            // when
            RetryPolicy policy = RetryPolicy.immediate();

            // then
            assertThat(policy.getMaxRetries()).isEqualTo(10);
            assertThat(policy.delayFor(0)).isZero();
            assertThat(policy.delayFor(9)).isZero();
        }

        @Test
        void noRetryShouldHaveZeroBudget() {
            assertThat(RetryPolicy.noRetry().getMaxRetries()).isZero();
        }
    }

    @Nested
    class Backoff {

        @Test
        void shouldGrowExponentiallyUpToMaxDelay() {
            // given
            RetryPolicy policy = RetryPolicy.exponentialBackoff(5, Duration.ofMillis(100), Duration.ofMillis(500), 2.0);

            // then
            assertThat(policy.delayFor(0)).isEqualTo(Duration.ofMillis(100));
            assertThat(policy.delayFor(1)).isEqualTo(Duration.ofMillis(200));
            assertThat(policy.delayFor(2)).isEqualTo(Duration.ofMillis(400));
            assertThat(policy.delayFor(3)).isEqualTo(Duration.ofMillis(500));
            assertThat(policy.delayFor(30)).isEqualTo(Duration.ofMillis(500));
        }

        @Test
        void fixedDelayShouldNotGrow() {
            // given
            RetryPolicy policy = RetryPolicy.fixedDelay(3, Duration.ofMillis(250));

            // then
            assertThat(policy.delayFor(0)).isEqualTo(Duration.ofMillis(250));
            assertThat(policy.delayFor(2)).isEqualTo(Duration.ofMillis(250));
        }
    }

    @Nested
    class Validation {

        @Test
        void shouldRejectNegativeRetries() {
            assertThatThrownBy(() -> RetryPolicy.immediate(-1)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldRejectMultiplierBelowOne() {
            assertThatThrownBy(() ->
                            RetryPolicy.exponentialBackoff(3, Duration.ofMillis(1), Duration.ofMillis(2), 0.5))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
