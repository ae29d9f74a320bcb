package com.work.bridge.core.support;

import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.AbstractPlatformTransactionManager;
import org.springframework.transaction.support.DefaultTransactionStatus;
import org.springframework.transaction.support.SmartTransactionObject;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * 纯内存事务管理器，方便在没有 Postgres 的环境下演示组件行为。
 * <p>
 * 自身不持有任何数据，只负责开启事务同步并维护“是否已有事务 / 是否 rollback-only”；
 * 真正的回滚由各内存实现登记到 {@link UndoLog} 的逆操作完成。
 * 支持 PROPAGATION_REQUIRED 的嵌套加入，不支持挂起（REQUIRES_NEW / NOT_SUPPORTED）。
 */
public class InMemoryTransactionManager extends AbstractPlatformTransactionManager {

    @Override
    protected Object doGetTransaction() {
        return new InMemoryTransactionObject((TransactionHolder) TransactionSynchronizationManager.getResource(this));
    }

    @Override
    protected boolean isExistingTransaction(Object transaction) {
        return ((InMemoryTransactionObject) transaction).holder != null;
    }

    @Override
    protected void doBegin(Object transaction, TransactionDefinition definition) {
        InMemoryTransactionObject txObject = (InMemoryTransactionObject) transaction;
        txObject.holder = new TransactionHolder();
        txObject.newHolder = true;
        TransactionSynchronizationManager.bindResource(this, txObject.holder);
    }

    @Override
    protected void doCommit(DefaultTransactionStatus status) {
        // 数据已写入内存，提交时无需额外动作
    }

    @Override
    protected void doRollback(DefaultTransactionStatus status) {
        // 回滚由 UndoLog 在 afterCompletion 阶段执行
    }

    @Override
    protected void doSetRollbackOnly(DefaultTransactionStatus status) {
        ((InMemoryTransactionObject) status.getTransaction()).holder.rollbackOnly = true;
    }

    @Override
    protected void doCleanupAfterCompletion(Object transaction) {
        InMemoryTransactionObject txObject = (InMemoryTransactionObject) transaction;
        if (txObject.newHolder) {
            TransactionSynchronizationManager.unbindResourceIfPossible(this);
        }
    }

    private static final class TransactionHolder {
        private volatile boolean rollbackOnly;
    }

    private static final class InMemoryTransactionObject implements SmartTransactionObject {

        private TransactionHolder holder;
        private boolean newHolder;

        private InMemoryTransactionObject(TransactionHolder holder) {
            this.holder = holder;
        }

        @Override
        public boolean isRollbackOnly() {
            return holder != null && holder.rollbackOnly;
        }

        @Override
        public void flush() {
        }
    }
}
