package com.molcollab.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Serial executor backing a room actor: tasks run one at a time in submission order on a
 * shared pool, and different mailboxes drain independently.
 * <p>
 * A task submitted from inside a running task is queued behind it, so the mailbox is safe to
 * use with a same-thread executor.
 */
public class RoomMailbox implements Executor {

    private static final Logger logger = LoggerFactory.getLogger(RoomMailbox.class);

    private final String name;
    private final Executor executor;
    private final Queue<Runnable> tasks = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);

    public RoomMailbox(String name, Executor executor) {
        this.name = name;
        this.executor = executor;
    }

    @Override
    public void execute(Runnable task) {
        tasks.add(task);
        scheduleDrain();
    }

    private void scheduleDrain() {
        if (draining.compareAndSet(false, true)) {
            try {
                executor.execute(this::drain);
            } catch (RuntimeException e) {
                draining.set(false);
                logger.error("Mailbox {} rejected by executor, {} tasks pending", name, tasks.size(), e);
            }
        }
    }

    private void drain() {
        try {
            Runnable task;
            while ((task = tasks.poll()) != null) {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    logger.error("Unhandled error in mailbox {}", name, e);
                }
            }
        } finally {
            draining.set(false);
        }
        // A task may have arrived between the last poll and the flag reset.
        if (!tasks.isEmpty()) {
            scheduleDrain();
        }
    }
}
