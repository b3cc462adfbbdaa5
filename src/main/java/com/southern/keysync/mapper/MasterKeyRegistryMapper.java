package com.southern.keysync.mapper;

import com.southern.keysync.pojo.entity.MasterKeyRecord;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.SelectKey;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;
import java.util.List;

@Mapper
public interface MasterKeyRegistryMapper {

    @Insert("INSERT INTO master_key_registry (master_key, normalized_key, source_system, source_key, status, " +
            "provisioning_strategy, created_at, run_id) " +
            "VALUES (#{masterKey}, #{normalizedKey}, #{sourceSystem}, #{sourceKey}, #{status}, " +
            "#{provisioningStrategy}, #{createdAt}, #{runId})")
    @SelectKey(statement = "SELECT last_insert_rowid()", keyProperty = "masterKeyId", before = false, resultType = Long.class)
    void insertMasterKey(MasterKeyRecord record);

    /**
     * 把某次运行下所有 proposed 的主键置为 active
     */
    @Update("UPDATE master_key_registry SET status = 'active', activated_at = #{activatedAt} " +
            "WHERE run_id = #{runId} AND status = 'proposed'")
    int activateProposedForRun(@Param("runId") Long runId, @Param("activatedAt") LocalDateTime activatedAt);

    @Update("UPDATE master_key_registry SET status = 'deprecated', deprecated_at = #{deprecatedAt} " +
            "WHERE master_key_id = #{masterKeyId} AND status IN ('proposed', 'active')")
    int deprecate(@Param("masterKeyId") Long masterKeyId, @Param("deprecatedAt") LocalDateTime deprecatedAt);

    @Select("SELECT * FROM master_key_registry WHERE master_key_id = #{masterKeyId}")
    MasterKeyRecord selectById(@Param("masterKeyId") Long masterKeyId);

    @Select("<script>" +
            "SELECT * FROM master_key_registry " +
            "<where>" +
            "<if test='status != null'>status = #{status}</if>" +
            "</where>" +
            " ORDER BY created_at DESC, master_key_id DESC" +
            "</script>")
    List<MasterKeyRecord> selectByStatus(@Param("status") String status);

    @Select("SELECT * FROM master_key_registry WHERE run_id = #{runId} ORDER BY master_key_id")
    List<MasterKeyRecord> selectByRunId(@Param("runId") Long runId);

    /**
     * 已被 proposed / active 主键占用的归一化键，不再重复提议
     */
    @Select("SELECT DISTINCT normalized_key FROM master_key_registry WHERE status IN ('proposed', 'active')")
    List<String> selectReservedNormalizedKeys();

    @Select("SELECT COUNT(*) FROM master_key_registry WHERE master_key = #{masterKey}")
    int countByMasterKey(@Param("masterKey") String masterKey);

    @Select("SELECT COUNT(*) FROM master_key_registry WHERE status = #{status}")
    int countByStatus(@Param("status") String status);
}
