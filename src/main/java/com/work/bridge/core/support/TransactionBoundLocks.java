package com.work.bridge.core.support;

import org.springframework.core.Ordered;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 一组按 key 划分的进程内排他锁，加锁后一直持有到当前事务结束（提交或回滚）才释放，
 * 供内存实现模拟数据库 {@code SELECT ... FOR UPDATE} 的行锁语义。
 * <p>
 * 释放发生在 {@link UndoLog} 执行完逆操作之后，其他事务拿到锁时看到的一定是已提交或已回滚完毕的数据。
 * 同一事务内对同一 key 重复加锁直接返回；当前线程没有激活的事务同步时不加锁。
 */
public final class TransactionBoundLocks<K> {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final Map<K, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final String name;
    private final Duration timeout;

    public TransactionBoundLocks(String name) {
        this(name, DEFAULT_TIMEOUT);
    }

    public TransactionBoundLocks(String name, Duration timeout) {
        this.name = ValidationUtils.requireNonEmpty(name, "name");
        this.timeout = ValidationUtils.requireNonNull(timeout, "timeout");
    }

    /**
     * @throws CannotAcquireLockException 等待超时或线程被中断
     */
    public void lockUntilCompletion(K key) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        if (lock.isHeldByCurrentThread()) {
            return;
        }
        boolean locked;
        try {
            locked = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CannotAcquireLockException("等待" + name + "锁被中断: key=" + key, e);
        }
        if (!locked) {
            throw new CannotAcquireLockException("获取" + name + "锁超时: key=" + key + ", timeout=" + timeout);
        }
        TransactionSynchronizationManager.registerSynchronization(new Release(lock));
    }

    /**
     * 当前线程是否持有该 key 的锁，测试与诊断用。
     */
    public boolean isHeldByCurrentThread(K key) {
        ReentrantLock lock = locks.get(key);
        return lock != null && lock.isHeldByCurrentThread();
    }

    private static final class Release implements TransactionSynchronization {

        private final ReentrantLock lock;

        private Release(ReentrantLock lock) {
            this.lock = lock;
        }

        @Override
        public int getOrder() {
            return Ordered.LOWEST_PRECEDENCE;
        }

        @Override
        public void afterCompletion(int status) {
            lock.unlock();
        }
    }
}
