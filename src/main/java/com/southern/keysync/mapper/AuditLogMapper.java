package com.southern.keysync.mapper;

import com.southern.keysync.pojo.entity.AuditEvent;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.SelectKey;

import java.util.List;

@Mapper
public interface AuditLogMapper {

    @Insert("INSERT INTO audit_log (timestamp, run_id, event_type, event_details, system_name, key_value, action_taken, result) " +
            "VALUES (#{timestamp}, #{runId}, #{eventType}, #{eventDetails}, #{systemName}, #{keyValue}, #{actionTaken}, #{result})")
    @SelectKey(statement = "SELECT last_insert_rowid()", keyProperty = "auditId", before = false, resultType = Long.class)
    void insertEvent(AuditEvent event);

    @Select("SELECT * FROM audit_log WHERE run_id = #{runId} ORDER BY audit_id")
    List<AuditEvent> selectByRunId(@Param("runId") Long runId);
}
