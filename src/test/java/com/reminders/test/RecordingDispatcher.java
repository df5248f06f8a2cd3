package com.reminders.test;

import com.reminders.core.DeliveryFailedException;
import com.reminders.core.Dispatcher;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Dispatcher that records every call. Can be told to fail, or to block until released.
 */
public class RecordingDispatcher implements Dispatcher {

    public static final class Delivery {
        private final long ownerId;
        private final long channelId;
        private final String taskName;
        private final Instant at;

        Delivery(long ownerId, long channelId, String taskName, Instant at) {
            this.ownerId = ownerId;
            this.channelId = channelId;
            this.taskName = taskName;
            this.at = at;
        }

        public long getOwnerId() { return ownerId; }

        public long getChannelId() { return channelId; }

        public String getTaskName() { return taskName; }

        public Instant getAt() { return at; }
    }

    private final List<Delivery> deliveries = new CopyOnWriteArrayList<>();
    private volatile CountDownLatch expected = new CountDownLatch(0);
    private volatile CountDownLatch gate;
    private volatile CountDownLatch entered = new CountDownLatch(1);
    private volatile boolean failing;
    private volatile boolean throwUnchecked;

    public void expect(int count) {
        expected = new CountDownLatch(count);
    }

    public boolean await(Duration timeout) throws InterruptedException {
        return expected.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void failDeliveries() {
        failing = true;
    }

    public void throwUnchecked() {
        throwUnchecked = true;
    }

    /**
     * Make every dispatch block until {@link #release()} is called.
     */
    public void hold() {
        gate = new CountDownLatch(1);
        entered = new CountDownLatch(1);
    }

    public boolean awaitEntered(Duration timeout) throws InterruptedException {
        return entered.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void release() {
        CountDownLatch current = gate;
        if (current != null) {
            current.countDown();
        }
    }

    @Override
    public void dispatch(long ownerId, long channelId, String taskName) throws DeliveryFailedException {
        deliveries.add(new Delivery(ownerId, channelId, taskName, Instant.now()));
        entered.countDown();
        try {
            CountDownLatch current = gate;
            if (current != null) {
                try {
                    current.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            if (throwUnchecked) {
                throw new IllegalStateException("dispatcher exploded");
            }
            if (failing) {
                throw new DeliveryFailedException("channel gone");
            }
        } finally {
            expected.countDown();
        }
    }

    public List<Delivery> getDeliveries() {
        return new ArrayList<>(deliveries);
    }

    public int count() {
        return deliveries.size();
    }
}
