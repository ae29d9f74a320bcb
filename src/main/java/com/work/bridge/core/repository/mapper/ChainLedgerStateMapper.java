package com.work.bridge.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.bridge.core.repository.entity.ChainLedgerStateEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.Instant;

/**
 * 链计数器表 Mapper。
 */
public interface ChainLedgerStateMapper extends BaseMapper<ChainLedgerStateEntity> {

    /**
     * 使用 SELECT FOR UPDATE 锁定并加载状态，不存在则返回 null。
     */
    @Select("SELECT chain_id, pending_relocation_count, last_processed_relocation_nonce, last_accommodation_nonce, updated_at " +
            "FROM bridge_chain_state WHERE chain_id = #{chainId} FOR UPDATE")
    ChainLedgerStateEntity lockAndLoad(@Param("chainId") long chainId);

    @Select("SELECT chain_id, pending_relocation_count, last_processed_relocation_nonce, last_accommodation_nonce, updated_at " +
            "FROM bridge_chain_state WHERE chain_id = #{chainId}")
    ChainLedgerStateEntity selectByChainId(@Param("chainId") long chainId);

    /**
     * 插入全零状态（如果不存在），并发初始化时由 ON CONFLICT 吸收。
     */
    @Insert("INSERT INTO bridge_chain_state(chain_id, pending_relocation_count, last_processed_relocation_nonce, last_accommodation_nonce, updated_at) " +
            "VALUES(#{chainId}, 0, 0, 0, #{updatedAt}) ON CONFLICT(chain_id) DO NOTHING")
    int insertIfNotExists(@Param("chainId") long chainId, @Param("updatedAt") Instant updatedAt);

    @Update("UPDATE bridge_chain_state SET pending_relocation_count = #{pendingRelocationCount}, " +
            "last_processed_relocation_nonce = #{lastProcessedRelocationNonce}, " +
            "last_accommodation_nonce = #{lastAccommodationNonce}, updated_at = #{updatedAt} " +
            "WHERE chain_id = #{chainId}")
    int updateCounters(ChainLedgerStateEntity entity);
}
