package com.work.bridge.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.bridge.core.repository.entity.BridgeSettingEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.Instant;

/**
 * 全局配置表 Mapper。读取直接使用 BaseMapper#selectById。
 */
public interface BridgeSettingMapper extends BaseMapper<BridgeSettingEntity> {

    @Insert("INSERT INTO bridge_setting(setting_key, setting_value, updated_at) VALUES(#{key}, #{value}, #{updatedAt}) " +
            "ON CONFLICT(setting_key) DO UPDATE SET setting_value = #{value}, updated_at = #{updatedAt}")
    int upsert(@Param("key") String key, @Param("value") String value, @Param("updatedAt") Instant updatedAt);

    @Insert("INSERT INTO bridge_setting(setting_key, setting_value, updated_at) VALUES(#{key}, NULL, #{updatedAt}) " +
            "ON CONFLICT(setting_key) DO NOTHING")
    int insertIfNotExists(@Param("key") String key, @Param("updatedAt") Instant updatedAt);

    @Select("SELECT setting_key, setting_value, updated_at FROM bridge_setting WHERE setting_key = #{key} FOR UPDATE")
    BridgeSettingEntity lockAndLoad(@Param("key") String key);
}
