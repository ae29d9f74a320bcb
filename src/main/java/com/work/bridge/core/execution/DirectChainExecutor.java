package com.work.bridge.core.execution;

import java.util.Objects;
import java.util.concurrent.Callable;

import static com.work.bridge.core.support.ValidationUtils.requireNonNull;

/**
 * direct 模式：不做节点内串行化，直接在当前线程执行，依赖存储层行锁保证一致性。
 */
public class DirectChainExecutor implements ChainExecutor {

    @Override
    public <T> T execute(long lane, Callable<T> work) {
        requireNonNull(work, "work");
        try {
            return work.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(Objects.requireNonNullElse(e.getMessage(), "direct execute failed"), e);
        }
    }
}
