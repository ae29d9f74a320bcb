package com.work.bridge.core.execution;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.work.bridge.core.support.ValidationUtils.requireNonNull;

/**
 * worker-queue 模式：hash(lane) -> 固定 worker（单线程）队列，同一条链的操作严格串行。
 * <p>
 * 有界队列；队列满或等待超时以显式异常返回给调用方。
 */
public class WorkerQueueChainExecutor implements ChainExecutor, AutoCloseable {

    public static final class DispatchRejectedException extends RuntimeException {
        public DispatchRejectedException(String message, Throwable cause) { super(message, cause); }
    }

    public static final class DispatchTimeoutException extends RuntimeException {
        public DispatchTimeoutException(String message, Throwable cause) { super(message, cause); }
    }

    private final ThreadPoolExecutor[] workers;
    private final int workerCount;
    private final Duration dispatchTimeout;

    public WorkerQueueChainExecutor(int workerCount,
                                    int queueCapacity,
                                    Duration dispatchTimeout,
                                    String threadNamePrefix) {
        if (workerCount <= 0) throw new IllegalArgumentException("workerCount must be > 0");
        if (queueCapacity <= 0) throw new IllegalArgumentException("queueCapacity must be > 0");
        this.workerCount = workerCount;
        this.dispatchTimeout = requireNonNull(dispatchTimeout, "dispatchTimeout");
        if (dispatchTimeout.isNegative() || dispatchTimeout.isZero()) {
            throw new IllegalArgumentException("dispatchTimeout must be > 0");
        }
        final String prefix = (threadNamePrefix == null || threadNamePrefix.trim().isEmpty())
                ? "bridge-lane-"
                : threadNamePrefix.trim();

        this.workers = new ThreadPoolExecutor[workerCount];
        for (int i = 0; i < workerCount; i++) {
            final int idx = i;
            ThreadFactory tf = r -> {
                Thread t = new Thread(r);
                t.setName(prefix + idx);
                t.setDaemon(true);
                return t;
            };
            ThreadPoolExecutor exec = new ThreadPoolExecutor(
                    1, 1,
                    0L, TimeUnit.MILLISECONDS,
                    new ArrayBlockingQueue<>(queueCapacity),
                    tf,
                    (r, e) -> { throw new RejectedExecutionException("lane queue is full"); }
            );
            exec.prestartAllCoreThreads();
            workers[i] = exec;
        }
    }

    @Override
    public <T> T execute(long lane, Callable<T> work) {
        requireNonNull(work, "work");
        Future<T> f;
        try {
            f = workers[workerIndex(lane)].submit(work);
        } catch (RejectedExecutionException e) {
            throw new DispatchRejectedException("lane dispatch rejected for lane=" + lane, e);
        }

        try {
            return f.get(dispatchTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            f.cancel(true);
            throw new DispatchTimeoutException("lane dispatch timeout for lane=" + lane + ", timeout=" + dispatchTimeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("lane dispatch interrupted for lane=" + lane, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            String msg = (cause != null && cause.getMessage() != null) ? cause.getMessage() : "lane execution failed";
            throw new IllegalStateException(msg, cause);
        }
    }

    int workerIndex(long lane) {
        return positiveHash(lane) % workerCount;
    }

    // FNV-1a 32-bit，按 lane 的 8 个字节（大端）计算
    private static int positiveHash(long lane) {
        int hash = 0x811c9dc5;
        for (int shift = 56; shift >= 0; shift -= 8) {
            hash ^= (int) ((lane >>> shift) & 0xff);
            hash *= 0x01000193;
        }
        return hash & 0x7fffffff;
    }

    @Override
    public void close() {
        for (ThreadPoolExecutor e : workers) {
            if (e == null) continue;
            e.shutdown();
        }
    }
}
