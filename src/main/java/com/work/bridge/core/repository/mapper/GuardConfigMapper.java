package com.work.bridge.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.bridge.core.repository.entity.GuardConfigEntity;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

/**
 * accommodation guard 配置表 Mapper。
 */
public interface GuardConfigMapper extends BaseMapper<GuardConfigEntity> {

    @Select("SELECT chain_id, token, time_frame, volume_limit, current_volume, last_reset_time FROM bridge_guard_config " +
            "WHERE chain_id = #{chainId} AND token = #{token} FOR UPDATE")
    GuardConfigEntity lockAndLoad(@Param("chainId") long chainId, @Param("token") String token);

    @Select("SELECT chain_id, token, time_frame, volume_limit, current_volume, last_reset_time FROM bridge_guard_config " +
            "WHERE chain_id = #{chainId} AND token = #{token}")
    GuardConfigEntity selectByChainAndToken(@Param("chainId") long chainId, @Param("token") String token);

    @Insert("INSERT INTO bridge_guard_config(chain_id, token, time_frame, volume_limit, current_volume, last_reset_time) " +
            "VALUES(#{chainId}, #{token}, #{timeFrame}, #{volumeLimit}, #{currentVolume}, #{lastResetTime}) " +
            "ON CONFLICT(chain_id, token) DO UPDATE SET time_frame = #{timeFrame}, volume_limit = #{volumeLimit}, " +
            "current_volume = #{currentVolume}, last_reset_time = #{lastResetTime}")
    int upsert(GuardConfigEntity entity);

    @Delete("DELETE FROM bridge_guard_config WHERE chain_id = #{chainId} AND token = #{token}")
    int deleteByChainAndToken(@Param("chainId") long chainId, @Param("token") String token);
}
