package com.southern.keysync.mapper;

import com.southern.keysync.pojo.entity.KeyTrackingEntry;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface KeyTrackingMapper {

    /**
     * 批量写入，(system_name, normalized_key) 冲突时只更新 last_seen_at 和 run_id
     * first_seen_at 与 key_value 保留首次写入的值
     */
    @Insert("<script>" +
            "INSERT INTO key_tracking (system_name, key_value, normalized_key, first_seen_at, last_seen_at, run_id) VALUES " +
            "<foreach collection='entries' item='e' separator=','>" +
            "(#{e.systemName}, #{e.keyValue}, #{e.normalizedKey}, #{e.firstSeenAt}, #{e.lastSeenAt}, #{e.runId})" +
            "</foreach>" +
            " ON CONFLICT(system_name, normalized_key) DO UPDATE SET " +
            "last_seen_at = excluded.last_seen_at, run_id = excluded.run_id" +
            "</script>")
    int upsertBatch(@Param("entries") List<KeyTrackingEntry> entries);

    @Select("SELECT * FROM key_tracking WHERE system_name = #{systemName} ORDER BY normalized_key")
    List<KeyTrackingEntry> selectBySystem(@Param("systemName") String systemName);

    @Select("SELECT COUNT(*) FROM key_tracking")
    int countAll();
}
