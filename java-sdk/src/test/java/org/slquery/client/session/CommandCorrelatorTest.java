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

package org.slquery.client.session;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slquery.client.CommandResponse;
import org.slquery.exception.QueryClientClosedException;
import org.slquery.exception.QueryCommandExecutionException;
import org.slquery.exception.QueryConnectionLostException;
import org.slquery.exception.QueryTimeoutException;
import org.slquery.protocol.DecodedMessage;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandCorrelatorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final Duration WAIT = Duration.ofSeconds(2);

    private ScheduledExecutorService timer;
    private CommandCorrelator correlator;
    private final CompletableFuture<QueryConnection> connected =
            CompletableFuture.completedFuture(new FakeConnection("server"));
    private final List<String> transmitted = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        timer = Executors.newSingleThreadScheduledExecutor();
        correlator = new CommandCorrelator(timer);
    }

    @AfterEach
    void tearDown() {
        timer.shutdownNow();
    }

    private Function<QueryConnection, CompletableFuture<Void>> recording(String command) {
        return connection -> {
            transmitted.add(command);
            return CompletableFuture.completedFuture(null);
        };
    }

    private CompletableFuture<CommandResponse> submit(String command) {
        return correlator.submit(command, TIMEOUT, () -> connected, recording(command));
    }

    private static DecodedMessage success(String content) {
        return DecodedMessage.of(3, content);
    }

    @Nested
    class Resolution {

        @Test
        void shouldCompleteWithSuccessfulResponse() {
            // given
            CompletableFuture<CommandResponse> response = submit("/players");

            // when
            boolean resolved = correlator.resolve(success("2 players online"));

            // then
            assertThat(resolved).isTrue();
            assertThat(response).succeedsWithin(WAIT).isEqualTo(new CommandResponse("2 players online", true));
            assertThat(correlator.hasPending()).isFalse();
        }

        @Test
        void shouldCompleteWithUnsuccessfulResponse() {
            // given
            CompletableFuture<CommandResponse> response = submit("/ban");

            // when
            correlator.resolve(DecodedMessage.of(4, "Missing arguments"));

            // then
            assertThat(response).succeedsWithin(WAIT).isEqualTo(new CommandResponse("Missing arguments", false));
        }

        @Test
        void shouldFailWithCommandException() {
            // given
            CompletableFuture<CommandResponse> response = submit("/crash");

            // when
            correlator.resolve(DecodedMessage.of(1, "NullReferenceException"));

            // then
            assertThat(response)
                    .failsWithin(WAIT)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(QueryCommandExecutionException.class)
                    .withMessageContaining("NullReferenceException");
        }

        @Test
        void shouldDropResponseWithoutPendingCommand() {
            assertThat(correlator.resolve(success("stray"))).isFalse();
        }

        @Test
        void shouldRejectMessagesThatAreNotCommandResults() {
            // given
            submit("/players");

            // then
            assertThatThrownBy(() -> correlator.resolve(DecodedMessage.of(0, "console line")))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(correlator.hasPending()).isTrue();
        }
    }

    @Nested
    class Serialization {

        @Test
        void shouldTransmitNextCommandOnlyAfterPreviousResolved() {
            // given
            CompletableFuture<CommandResponse> first = submit("/first");
            CompletableFuture<CommandResponse> second = submit("/second");

            // then
            assertThat(transmitted).containsExactly("/first");
            assertThat(second).isNotDone();

            // when
            correlator.resolve(success("one"));

            // then
            assertThat(first).succeedsWithin(WAIT).extracting(CommandResponse::content).isEqualTo("one");
            assertThat(transmitted).containsExactly("/first", "/second");

            // when
            correlator.resolve(success("two"));

            // then
            assertThat(second).succeedsWithin(WAIT).extracting(CommandResponse::content).isEqualTo("two");
        }

        @Test
        void shouldRunManySequentialCommandsWithoutDeadlock() {
            for (int i = 0; i < 50; i++) {
                // given
                CompletableFuture<CommandResponse> response = submit("/cmd " + i);

                // when
                correlator.resolve(success("reply " + i));

                // then
                assertThat(response).succeedsWithin(WAIT).extracting(CommandResponse::content).isEqualTo("reply " + i);
            }
        }
    }

    @Nested
    class Timeouts {

        @Test
        void shouldFailAfterTimeoutAndReleasePermit() {
            // given
            CompletableFuture<CommandResponse> slow =
                    correlator.submit("/slow", Duration.ofMillis(50), () -> connected, recording("/slow"));

            // then
            assertThat(slow)
                    .failsWithin(WAIT)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(QueryTimeoutException.class);
            assertThat(correlator.hasPending()).isFalse();

            // when
            CompletableFuture<CommandResponse> next = submit("/next");
            correlator.resolve(success("fine"));

            // then
            assertThat(next).succeedsWithin(WAIT).extracting(CommandResponse::success).isEqualTo(true);
        }

        @Test
        void shouldNotTimeOutResolvedCommand() throws InterruptedException {
            // given
            CompletableFuture<CommandResponse> response =
                    correlator.submit("/fast", Duration.ofMillis(100), () -> connected, recording("/fast"));
            correlator.resolve(success("done"));

            // when
            Thread.sleep(200);

            // then
            assertThat(response).isCompletedWithValue(new CommandResponse("done", true));
        }

        @Test
        void commandTimedOutWhileAwaitingConnectionShouldNeverBeSent() {
            // given
            CompletableFuture<QueryConnection> reconnecting = new CompletableFuture<>();
            CompletableFuture<CommandResponse> stale =
                    correlator.submit("/stale", Duration.ofMillis(100), () -> reconnecting, recording("/stale"));
            assertThat(stale)
                    .failsWithin(WAIT)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(QueryTimeoutException.class);
            CompletableFuture<CommandResponse> next =
                    correlator.submit("/next", TIMEOUT, () -> reconnecting, recording("/next"));

            // when
            reconnecting.complete(new FakeConnection("server"));
            correlator.resolve(success("answer for next"));

            // then
            assertThat(transmitted).containsExactly("/next");
            assertThat(next).succeedsWithin(WAIT).isEqualTo(new CommandResponse("answer for next", true));
        }

        @Test
        void timeoutShouldCoverWaitingForConnection() {
            // given
            CompletableFuture<QueryConnection> reconnecting = new CompletableFuture<>();

            // when
            CompletableFuture<CommandResponse> response =
                    correlator.submit("/players", Duration.ofMillis(100), () -> reconnecting, recording("/players"));

            // then
            assertThat(response)
                    .failsWithin(WAIT)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(QueryTimeoutException.class);
            assertThat(correlator.hasPending()).isFalse();
            assertThat(transmitted).isEmpty();
        }
    }

    @Nested
    class Failures {

        @Test
        void shouldFailWhenTransmitFails() {
            // given
            QueryConnectionLostException lost = new QueryConnectionLostException("gone");

            // when
            CompletableFuture<CommandResponse> response =
                    correlator.submit(
                    "/players", TIMEOUT, () -> connected, connection -> CompletableFuture.failedFuture(lost));

            // then
            assertThat(response)
                    .failsWithin(WAIT)
                    .withThrowableOfType(ExecutionException.class)
                    .withCause(lost);
            assertThat(correlator.hasPending()).isFalse();
        }

        @Test
        void shouldFailWhenTransmitThrows() {
            // when
            CompletableFuture<CommandResponse> response = correlator.submit("/players", TIMEOUT, () -> connected, connection -> {
                throw new IllegalStateException("broken");
            });

            // then
            assertThat(response)
                    .failsWithin(WAIT)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(IllegalStateException.class);
        }

        @Test
        void failPendingShouldFailOnlyThePendingCommand() {
            // given
            CompletableFuture<CommandResponse> pending = submit("/first");
            CompletableFuture<CommandResponse> queued = submit("/second");

            // when
            correlator.failPending(new QueryConnectionLostException("Connection lost"));

            // then
            assertThat(pending)
                    .failsWithin(WAIT)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(QueryConnectionLostException.class);
            assertThat(transmitted).containsExactly("/first", "/second");
            assertThat(queued).isNotDone();
        }

        @Test
        void closeShouldFailPendingAndQueuedCommands() {
            // given
            CompletableFuture<CommandResponse> pending = submit("/first");
            CompletableFuture<CommandResponse> queued = submit("/second");

            // when
            correlator.close(new QueryClientClosedException());

            // then
            assertThat(pending)
                    .failsWithin(WAIT)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(QueryClientClosedException.class);
            assertThat(queued)
                    .failsWithin(WAIT)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(QueryClientClosedException.class);
            assertThat(transmitted).containsExactly("/first");
        }

        @Test
        void closeShouldFailLongQueueWithoutNesting() {
            // given
            CompletableFuture<CommandResponse> pending = submit("/first");
            List<CompletableFuture<CommandResponse>> queued = new ArrayList<>();
            for (int i = 0; i < 50_000; i++) {
                queued.add(submit("/queued " + i));
            }

            // when
            correlator.close(new QueryClientClosedException());

            // then
            assertThat(pending).isCompletedExceptionally();
            assertThat(queued).allSatisfy(response -> assertThat(response)
                    .failsWithin(WAIT)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(QueryClientClosedException.class));
            assertThat(transmitted).containsExactly("/first");
        }

        @Test
        void shouldFailCommandsSubmittedAfterClose() {
            // given
            correlator.close(new QueryClientClosedException());

            // when
            CompletableFuture<CommandResponse> response = submit("/late");

            // then
            assertThat(response)
                    .failsWithin(WAIT)
                    .withThrowableOfType(ExecutionException.class)
                    .withCauseInstanceOf(QueryClientClosedException.class);
            assertThat(transmitted).isEmpty();
        }
    }
}
