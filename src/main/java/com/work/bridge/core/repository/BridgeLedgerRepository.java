package com.work.bridge.core.repository;

import com.work.bridge.core.model.ChainLedgerState;
import com.work.bridge.core.model.FeeSettings;
import com.work.bridge.core.model.OperationMode;
import com.work.bridge.core.model.Relocation;

import java.util.List;
import java.util.Optional;

/**
 * 抽象出账本的全部持久化操作，生产环境由 MyBatis-Plus + PostgreSQL 实现。
 * <p>
 * 所有写方法都必须在事务中调用，事务边界由 Service 层统一管理。
 * 读方法返回的对象是副本，修改后必须显式 save 才会生效。
 */
public interface BridgeLedgerRepository {

    /**
     * 以 {@code SELECT ... FOR UPDATE} 的语义读取一条链的计数器，不存在则初始化。
     */
    ChainLedgerState lockAndLoadChainState(long chainId);

    /**
     * 只读查询，不加锁；不存在时返回全零状态。
     */
    ChainLedgerState findChainState(long chainId);

    void updateChainState(ChainLedgerState state);

    Optional<Relocation> findRelocation(long chainId, long nonce);

    /**
     * 查询 [fromNonce, fromNonce + count) 范围内已存在的 relocation，按 nonce 升序。
     */
    List<Relocation> findRelocations(long chainId, long fromNonce, int count);

    void insertRelocation(Relocation relocation);

    /**
     * 只更新可变字段：status、newNonce、updatedAt。
     */
    void updateRelocation(Relocation relocation);

    OperationMode findRelocationMode(long chainId, String token);

    void saveRelocationMode(long chainId, String token, OperationMode mode);

    OperationMode findAccommodationMode(long chainId, String token);

    void saveAccommodationMode(long chainId, String token, OperationMode mode);

    FeeSettings loadFeeSettings();

    /**
     * 加锁读取 fee 配置，同一时刻只有一个事务可以修改 oracle / collector。
     */
    FeeSettings lockAndLoadFeeSettings();

    void saveFeeSettings(FeeSettings settings);
}
