package com.sunny.conduit.job.scheduler.store.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.conduit.job.scheduler.store.entity.TriggerExecutionEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

/**
 * 触发执行记录 Mapper
 *
 * @author SunnyX6
 * @date 2026-03-05
 */
@Mapper
public interface TriggerExecutionMapper extends BaseMapper<TriggerExecutionEntity> {

    /**
     * 查询触发器运行中的执行
     */
    @Select("""
            SELECT id, trigger_id, job_id, tenant_id, status, attempt, started_at, finished_at,
                   error_detail AS error, event_sample
            FROM conduit_trigger_execution
            WHERE trigger_id = #{triggerId} AND status = 'running'
            ORDER BY id DESC
            LIMIT 1
            """)
    TriggerExecutionEntity selectRunning(@Param("triggerId") long triggerId);

    @Update("""
            UPDATE conduit_trigger_execution
            SET status = #{status},
                error_detail = #{error,jdbcType=VARCHAR},
                finished_at = #{finishedAt,jdbcType=BIGINT}
            WHERE id = #{id}
            """)
    int updateResult(@Param("id") long id,
                     @Param("status") String status,
                     @Param("error") String error,
                     @Param("finishedAt") Long finishedAt);

    /**
     * 把运行中的执行置为失败，已是终态的记录不受影响
     */
    @Update("""
            UPDATE conduit_trigger_execution
            SET status = 'failed',
                error_detail = #{error,jdbcType=VARCHAR},
                finished_at = #{finishedAt}
            WHERE id = #{id} AND status = 'running'
            """)
    int abandon(@Param("id") long id,
                @Param("error") String error,
                @Param("finishedAt") long finishedAt);

    /**
     * 查询任务最近的执行记录
     */
    @Select("""
            SELECT id, trigger_id, job_id, tenant_id, status, attempt, started_at, finished_at,
                   error_detail AS error, event_sample
            FROM conduit_trigger_execution
            WHERE job_id = #{jobId} AND tenant_id = #{tenantId}
            ORDER BY started_at DESC, id DESC
            LIMIT #{limit}
            """)
    List<TriggerExecutionEntity> selectRecentByJob(@Param("jobId") long jobId,
                                                   @Param("tenantId") String tenantId,
                                                   @Param("limit") int limit);
}
