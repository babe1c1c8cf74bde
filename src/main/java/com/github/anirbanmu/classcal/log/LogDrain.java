package com.github.anirbanmu.classcal.log;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

// single consumer writing queued lines in batches; lines offered while the queue is full are dropped
final class LogDrain implements Runnable {
    private static final int CAPACITY = 4096;
    private static final int BATCH = 128;

    private final BlockingQueue<String> queue = new ArrayBlockingQueue<>(CAPACITY);
    private final AtomicInteger pending = new AtomicInteger();
    private final OutputStream out;
    private final Thread thread;

    LogDrain(OutputStream out, String name) {
        this.out = out;
        this.thread = new Thread(this, name);
        this.thread.setDaemon(true);
    }

    void start() {
        thread.start();
        // daemon thread, so drain what is left on exit
        Runtime.getRuntime().addShutdownHook(new Thread(this::stop, thread.getName() + "-stop"));
    }

    boolean offer(String line) {
        pending.incrementAndGet();
        if (queue.offer(line)) {
            return true;
        }
        pending.decrementAndGet();
        return false;
    }

    // true once every accepted line has been written
    boolean awaitEmpty(long timeoutMillis) {
        long deadline = System.currentTimeMillis() + timeoutMillis;
        while (pending.get() > 0) {
            if (System.currentTimeMillis() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(2);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    void stop() {
        thread.interrupt();
        try {
            thread.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void run() {
        List<String> batch = new ArrayList<>(BATCH);
        try {
            while (!Thread.currentThread().isInterrupted()) {
                batch.add(queue.take());
                queue.drainTo(batch, BATCH - 1);
                write(batch);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            queue.drainTo(batch);
            write(batch);
        }
    }

    private void write(List<String> batch) {
        if (batch.isEmpty()) {
            return;
        }
        StringBuilder chunk = new StringBuilder(batch.size() * 128);
        for (String line : batch) {
            chunk.append(line).append('\n');
        }
        try {
            out.write(chunk.toString().getBytes(StandardCharsets.UTF_8));
            out.flush();
        } catch (IOException e) {
            System.err.println("classcal: log write failed: " + e.getMessage());
        } finally {
            pending.addAndGet(-batch.size());
            batch.clear();
        }
    }
}
