package com.example.chatty.gateway.fanout;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded hand-off between the backbone subscription and the dispatcher thread.
 * When full, the oldest queued element is discarded to make room for the newest.
 */
public class DropOldestInbox<T> {

    private final BlockingQueue<T> queue;
    private final AtomicLong dropped = new AtomicLong();

    public DropOldestInbox(int capacity) {
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * @return {@code true} if an older element had to be discarded
     */
    public boolean offer(T element) {
        boolean discarded = false;
        while (!queue.offer(element)) {
            if (queue.poll() != null) {
                dropped.incrementAndGet();
                discarded = true;
            }
        }
        return discarded;
    }

    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public int size() {
        return queue.size();
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public void clear() {
        queue.clear();
    }
}
