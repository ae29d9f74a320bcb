package com.work.bridge.core.support;

import org.springframework.core.Ordered;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 绑定在当前事务上的撤销日志，供纯内存实现（内存仓储、mock 代币账本）获得与数据库一致的回滚语义。
 * <p>
 * 写操作在修改前调用 {@link #record(Runnable)} 登记逆操作；事务未提交（回滚或未知）时按 LIFO 顺序执行。
 * 当前线程没有激活的事务同步时直接忽略，调用方自行承担非事务语义。
 * 逆操作先于 {@link TransactionBoundLocks} 的释放执行。
 */
public final class UndoLog {

    private static final Object RESOURCE_KEY = new Object();

    private UndoLog() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static void record(Runnable undo) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        Entries entries = (Entries) TransactionSynchronizationManager.getResource(RESOURCE_KEY);
        if (entries == null) {
            entries = new Entries();
            TransactionSynchronizationManager.bindResource(RESOURCE_KEY, entries);
            TransactionSynchronizationManager.registerSynchronization(entries);
        }
        entries.undo.push(undo);
    }

    private static final class Entries implements TransactionSynchronization {

        private final Deque<Runnable> undo = new ArrayDeque<>();

        @Override
        public int getOrder() {
            return Ordered.HIGHEST_PRECEDENCE;
        }

        @Override
        public void suspend() {
            TransactionSynchronizationManager.unbindResource(RESOURCE_KEY);
        }

        @Override
        public void resume() {
            TransactionSynchronizationManager.bindResource(RESOURCE_KEY, this);
        }

        @Override
        public void afterCompletion(int status) {
            TransactionSynchronizationManager.unbindResourceIfPossible(RESOURCE_KEY);
            if (status == STATUS_COMMITTED) {
                undo.clear();
                return;
            }
            while (!undo.isEmpty()) {
                undo.pop().run();
            }
        }
    }
}
