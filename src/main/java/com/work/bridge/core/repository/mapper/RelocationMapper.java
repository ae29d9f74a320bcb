package com.work.bridge.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.bridge.core.repository.entity.RelocationEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

/**
 * relocation 记录表 Mapper
 */
public interface RelocationMapper extends BaseMapper<RelocationEntity> {

    @Select("SELECT id, chain_id, nonce, token, account, amount, fee, status, old_nonce, new_nonce, updated_at, created_at " +
            "FROM bridge_relocation WHERE chain_id = #{chainId} AND nonce = #{nonce}")
    RelocationEntity selectByChainAndNonce(@Param("chainId") long chainId, @Param("nonce") long nonce);

    /**
     * 查询 [fromNonce, toNonce) 区间，按 nonce 升序
     */
    @Select("SELECT id, chain_id, nonce, token, account, amount, fee, status, old_nonce, new_nonce, updated_at, created_at " +
            "FROM bridge_relocation WHERE chain_id = #{chainId} AND nonce >= #{fromNonce} AND nonce < #{toNonce} " +
            "ORDER BY nonce ASC")
    List<RelocationEntity> selectRange(@Param("chainId") long chainId,
                                       @Param("fromNonce") long fromNonce,
                                       @Param("toNonce") long toNonce);

    @Update("UPDATE bridge_relocation SET status = #{status}, new_nonce = #{newNonce}, updated_at = #{updatedAt} " +
            "WHERE chain_id = #{chainId} AND nonce = #{nonce}")
    int updateStatus(RelocationEntity entity);
}
