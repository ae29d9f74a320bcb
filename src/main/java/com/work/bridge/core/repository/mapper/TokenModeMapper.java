package com.work.bridge.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.bridge.core.repository.entity.TokenModeEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

/**
 * token 模式表 Mapper。
 */
public interface TokenModeMapper extends BaseMapper<TokenModeEntity> {

    @Select("SELECT chain_id, token, relocation_mode, accommodation_mode FROM bridge_token_mode " +
            "WHERE chain_id = #{chainId} AND token = #{token}")
    TokenModeEntity selectByChainAndToken(@Param("chainId") long chainId, @Param("token") String token);

    @Insert("INSERT INTO bridge_token_mode(chain_id, token, relocation_mode, accommodation_mode) " +
            "VALUES(#{chainId}, #{token}, #{mode}, 'UNSUPPORTED') " +
            "ON CONFLICT(chain_id, token) DO UPDATE SET relocation_mode = #{mode}")
    int upsertRelocationMode(@Param("chainId") long chainId, @Param("token") String token, @Param("mode") String mode);

    @Insert("INSERT INTO bridge_token_mode(chain_id, token, relocation_mode, accommodation_mode) " +
            "VALUES(#{chainId}, #{token}, 'UNSUPPORTED', #{mode}) " +
            "ON CONFLICT(chain_id, token) DO UPDATE SET accommodation_mode = #{mode}")
    int upsertAccommodationMode(@Param("chainId") long chainId, @Param("token") String token, @Param("mode") String mode);
}
