/*
 * Copyright (c) 2023, salesforce.com, inc.
 * All rights reserved.
 * SPDX-License-Identifier: BSD-3-Clause
 * For full license text, see the LICENSE file in the repo root or https://opensource.org/licenses/BSD-3-Clause
 */
package com.salesforce.courier.channels.mpsc;

import static com.salesforce.courier.channels.Utils.fork;
import static com.salesforce.courier.channels.Utils.waitForParked;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.codahale.metrics.MetricRegistry;
import com.salesforce.courier.channels.ChannelMetricsImpl;

/**
 * @author hal.hildebrand
 *
 */
public class MpscTest {

    @Test
    public void basicNonBlocking() {
        var channel = Mpsc.<Integer>create(10);
        assertTrue(channel.receiver().tryRecv().isEmpty());
        assertEquals(SendResult.SUCCESS, channel.sender().trySend(42));
        assertEquals(1, channel.receiver().size());
        assertEquals(Optional.of(42), channel.receiver().tryRecv());
    }

    @Test
    public void blockingSendWaitsForRoom() throws Exception {
        var channel = Mpsc.<Integer>create(1);
        assertEquals(SendResult.SUCCESS, channel.sender().send(1));
        var name = "mpsc-blocked-send";
        CompletableFuture<SendResult> send = fork(name, () -> channel.sender().send(2));
        assertTrue(waitForParked(name));
        assertFalse(send.isDone());
        assertEquals(Optional.of(1), channel.receiver().recv());
        assertEquals(SendResult.SUCCESS, send.get(5, TimeUnit.SECONDS));
        assertEquals(Optional.of(2), channel.receiver().recv());
    }

    @Test
    public void capacityBound() {
        var channel = Mpsc.<Integer>create(1);
        assertEquals(SendResult.SUCCESS, channel.sender().trySend(42));
        assertEquals(SendResult.FAILURE, channel.sender().trySend(43));
        assertEquals(Optional.of(42), channel.receiver().tryRecv());
        assertEquals(SendResult.SUCCESS, channel.sender().trySend(43));

        var wide = Mpsc.<Integer>create(5);
        for (int i = 0; i < 5; i++) {
            assertEquals(SendResult.SUCCESS, wide.sender().trySend(i));
        }
        assertEquals(SendResult.FAILURE, wide.sender().trySend(5));
        assertEquals(Optional.of(0), wide.receiver().tryRecv());
        assertEquals(SendResult.SUCCESS, wide.sender().trySend(5));
    }

    @Test
    public void cloneDeliversToOriginalReceiver() {
        var channel = Mpsc.<Integer>create(10);
        var tx2 = channel.sender().clone();
        assertEquals(SendResult.SUCCESS, channel.sender().trySend(1));
        assertEquals(SendResult.SUCCESS, tx2.trySend(2));
        assertEquals(Optional.of(1), channel.receiver().tryRecv());
        assertEquals(Optional.of(2), channel.receiver().tryRecv());
    }

    @Test
    public void closedSenderCannotClone() {
        var channel = Mpsc.<Integer>create(1);
        channel.sender().close();
        assertThrows(IllegalStateException.class, () -> channel.sender().clone());
        assertEquals(SendResult.FAILURE, channel.sender().trySend(1));
        assertTrue(channel.sender().isClosed());
    }

    @Test
    public void fifoAcrossSenders() {
        var channel = Mpsc.<Integer>create(100);
        var tx2 = channel.sender().clone();
        var tx3 = tx2.clone();
        var senders = List.of(channel.sender(), tx2, tx3);
        for (int i = 0; i < 30; i++) {
            assertEquals(SendResult.SUCCESS, senders.get(i % 3).trySend(i));
        }
        for (int i = 0; i < 30; i++) {
            assertEquals(Optional.of(i), channel.receiver().tryRecv());
        }
    }

    @Test
    public void invalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> Mpsc.create(0));
        assertThrows(IllegalArgumentException.class, () -> Mpsc.newBuilder().setCapacity(-1));
    }

    @Test
    public void lastSenderCloseEndsStream() throws Exception {
        var channel = Mpsc.<Integer>create(4);
        var tx2 = channel.sender().clone();
        channel.sender().trySend(1);
        channel.sender().close();
        tx2.trySend(2);
        assertFalse(channel.receiver().isClosed());
        tx2.close();
        assertEquals(Optional.of(1), channel.receiver().recv());
        assertEquals(Optional.of(2), channel.receiver().recv());
        assertTrue(channel.receiver().recv().isEmpty());
        assertTrue(channel.receiver().recvTimeout(Duration.ofSeconds(5)).isEmpty());
        assertTrue(channel.receiver().isClosed());
    }

    @Test
    public void lastSenderCloseReleasesReceiver() throws Exception {
        var channel = Mpsc.<Integer>create(4);
        var name = "mpsc-receiver-released";
        CompletableFuture<Optional<Integer>> recv = fork(name, () -> channel.receiver().recv());
        assertTrue(waitForParked(name));
        channel.sender().close();
        assertTrue(recv.get(5, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    public void metricsTrackTraffic() throws Exception {
        var registry = new MetricRegistry();
        var metrics = new ChannelMetricsImpl("mpsc", registry);
        try (var channel = Mpsc.<Integer>newBuilder().setCapacity(1).setMetrics(metrics).build()) {
            channel.sender().trySend(1);
            channel.sender().trySend(2);
            assertEquals(SendResult.TIMEOUT, channel.sender().sendTimeout(3, Duration.ofMillis(10)));
            channel.receiver().tryRecv();
        }
        assertEquals(1, metrics.sent().getCount());
        assertEquals(1, metrics.failedSends().getCount());
        assertEquals(1, metrics.timeouts().getCount());
        assertEquals(1, metrics.received().getCount());
        assertEquals(1, metrics.blocked().getCount());
        assertEquals(2, metrics.closed().getCount());
        assertEquals(1, registry.meter(MetricRegistry.name("mpsc", "sent")).getCount());
    }

    @Test
    public void producersKeepTheirOrder() throws Exception {
        var channel = Mpsc.<int[]>create(8);
        var producers = new ArrayList<Thread>();
        final var perProducer = 1_000;
        for (int p = 0; p < 4; p++) {
            final var producer = p;
            final var tx = channel.sender().clone();
            var t = new Thread(() -> {
                try (tx) {
                    for (int i = 0; i < perProducer; i++) {
                        tx.send(new int[] { producer, i });
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            producers.add(t);
            t.start();
        }
        channel.sender().close();

        var last = new HashMap<Integer, Integer>();
        var count = 0;
        Optional<int[]> next;
        while ((next = channel.receiver().recvTimeout(Duration.ofSeconds(10))).isPresent()) {
            var value = next.get();
            var previous = last.getOrDefault(value[0], -1);
            assertEquals(previous + 1, value[1], "out of order from producer " + value[0]);
            last.put(value[0], value[1]);
            count++;
        }
        for (var t : producers) {
            t.join();
        }
        assertEquals(4 * perProducer, count);
    }

    @Test
    public void receiverCloseFailsSenders() throws Exception {
        var channel = Mpsc.<Integer>create(1);
        channel.sender().trySend(1);
        var name = "mpsc-sender-released";
        CompletableFuture<SendResult> send = fork(name, () -> channel.sender().send(2));
        assertTrue(waitForParked(name));
        channel.receiver().close();
        assertEquals(SendResult.FAILURE, send.get(5, TimeUnit.SECONDS));
        assertEquals(SendResult.FAILURE, channel.sender().trySend(3));
        assertEquals(SendResult.FAILURE, channel.sender().sendTimeout(3, Duration.ofMillis(10)));
        assertTrue(channel.sender().isClosed());
        assertTrue(channel.receiver().tryRecv().isEmpty());
    }

    @Test
    public void timeoutsBeyondNanosecondRange() throws Exception {
        var forever = ChronoUnit.CENTURIES.getDuration().multipliedBy(5);
        var channel = Mpsc.<Integer>create(1);
        assertEquals(SendResult.SUCCESS, channel.sender().sendTimeout(1, forever));

        var name = "mpsc-long-send";
        CompletableFuture<SendResult> send = fork(name, () -> channel.sender().sendTimeout(2, forever));
        assertTrue(waitForParked(name));
        assertEquals(Optional.of(1), channel.receiver().recvTimeout(forever));
        assertEquals(SendResult.SUCCESS, send.get(5, TimeUnit.SECONDS));
        assertEquals(Optional.of(2), channel.receiver().recvTimeout(forever));

        var receiving = "mpsc-long-recv";
        CompletableFuture<Optional<Integer>> recv = fork(receiving, () -> channel.receiver().recvTimeout(forever));
        assertTrue(waitForParked(receiving));
        channel.sender().trySend(3);
        assertEquals(Optional.of(3), recv.get(5, TimeUnit.SECONDS));
    }

    @Test
    public void timeouts() throws Exception {
        var channel = Mpsc.<Integer>create(1);
        assertTrue(channel.receiver().recvTimeout(Duration.ofMillis(20)).isEmpty());
        assertEquals(SendResult.SUCCESS, channel.sender().sendTimeout(1, Duration.ofMillis(20)));
        assertEquals(SendResult.TIMEOUT, channel.sender().sendTimeout(2, Duration.ofMillis(20)));
        assertEquals(Optional.of(1), channel.receiver().recvTimeout(Duration.ofMillis(20)));
        assertTrue(channel.receiver().tryRecv().isEmpty());
    }

    @Test
    public void timedReceiveWakesOnSend() throws Exception {
        var channel = Mpsc.<Integer>create(1);
        var name = "mpsc-timed-recv";
        CompletableFuture<Optional<Integer>> recv = fork(name,
                                                         () -> channel.receiver().recvTimeout(Duration.ofSeconds(30)));
        assertTrue(waitForParked(name));
        channel.sender().trySend(9);
        assertEquals(Optional.of(9), recv.get(5, TimeUnit.SECONDS));
    }
}
