package com.southern.keysync.mapper;

import com.southern.keysync.pojo.entity.ReconciliationRun;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.SelectKey;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;
import java.util.List;

@Mapper
public interface ReconciliationRunMapper {

    @Insert("INSERT INTO reconciliation_runs (run_timestamp, run_mode, execution_mode, status, config_snapshot) " +
            "VALUES (#{runTimestamp}, #{runMode}, #{executionMode}, #{status}, #{configSnapshot})")
    @SelectKey(statement = "SELECT last_insert_rowid()", keyProperty = "runId", before = false, resultType = Long.class)
    void insertRun(ReconciliationRun run);

    /**
     * 只有 running 状态的运行可以结束
     *
     * @return 受影响的行数，0 表示运行不存在或已结束
     */
    @Update("UPDATE reconciliation_runs SET status = #{status}, stats_json = #{statsJson}, " +
            "error_message = #{errorMessage}, completed_at = #{completedAt} " +
            "WHERE run_id = #{runId} AND status = 'running'")
    int completeRun(@Param("runId") Long runId,
                    @Param("status") String status,
                    @Param("statsJson") String statsJson,
                    @Param("errorMessage") String errorMessage,
                    @Param("completedAt") LocalDateTime completedAt);

    @Update("UPDATE reconciliation_runs SET checkpoint_data = #{checkpointData} WHERE run_id = #{runId}")
    int updateCheckpointData(@Param("runId") Long runId, @Param("checkpointData") String checkpointData);

    @Select("SELECT * FROM reconciliation_runs WHERE run_id = #{runId}")
    ReconciliationRun selectById(@Param("runId") Long runId);

    @Select("SELECT * FROM reconciliation_runs WHERE status = 'completed' " +
            "ORDER BY completed_at DESC, run_id DESC LIMIT 1")
    ReconciliationRun selectLastSuccessful();

    /**
     * 分页由 PageHelper 处理
     */
    @Select("SELECT * FROM reconciliation_runs ORDER BY run_id DESC")
    List<ReconciliationRun> selectAll();

    @Select("SELECT COUNT(*) FROM reconciliation_runs WHERE status = #{status}")
    int countByStatus(@Param("status") String status);
}
