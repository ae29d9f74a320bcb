package com.work.bridge.core.execution;

import java.util.concurrent.Callable;

import static com.work.bridge.core.support.ValidationUtils.requireNonNull;

/**
 * 统一的"按链执行"入口。
 * <p>
 * 同一 lane（目标链 chainId）上的写操作可以被串行化，不同链之间并行；
 * lane 0 保留给全局配置（fee、角色、暂停等）。direct / worker-queue 两种模式对调用方保持一致。
 */
public interface ChainExecutor {

    long GLOBAL_LANE = 0L;

    <T> T execute(long lane, Callable<T> work);

    default void execute(long lane, Runnable work) {
        requireNonNull(work, "work");
        execute(lane, () -> {
            work.run();
            return null;
        });
    }
}
