package com.sunny.conduit.job.scheduler.store.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.conduit.job.scheduler.store.entity.TriggerEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;

/**
 * 触发器 Mapper
 * <p>
 * 到期查询走 (status, next_run_at) 组合索引
 *
 * @author SunnyX6
 * @date 2026-03-05
 */
@Mapper
public interface TriggerMapper extends BaseMapper<TriggerEntity> {

    /**
     * 查询到期的启用触发器
     *
     * @param now   当前时间（毫秒）
     * @param limit 最大返回条数
     * @return 按 next_run_at、id 升序
     */
    @Select("""
            SELECT id, tenant_id, name, kind, status, next_run_at, rule_expression, condition_source,
                   match_mode, condition_json, check_interval_ms, job_id, job_params, pass_event_data,
                   max_attempts, backoff_base_ms, timeout_ms, failed_attempts, last_error,
                   condition_watermark, created_at, updated_at
            FROM conduit_trigger
            WHERE status = 'enabled' AND next_run_at <= #{now}
            ORDER BY next_run_at ASC, id ASC
            LIMIT #{limit}
            """)
    List<TriggerEntity> selectDue(@Param("now") long now, @Param("limit") int limit);

    /**
     * 比较更新下次运行时间
     *
     * @return 影响行数，0 表示已被其他轮次认领
     */
    @Update("""
            UPDATE conduit_trigger
            SET next_run_at = #{nextRunAt}, updated_at = #{updatedAt}
            WHERE id = #{id} AND next_run_at = #{expected}
            """)
    int claim(@Param("id") long id,
              @Param("expected") long expected,
              @Param("nextRunAt") long nextRunAt,
              @Param("updatedAt") long updatedAt);

    @Update("""
            UPDATE conduit_trigger
            SET next_run_at = #{nextRunAt}, updated_at = #{updatedAt}
            WHERE id = #{id}
            """)
    int updateNextRun(@Param("id") long id,
                      @Param("nextRunAt") long nextRunAt,
                      @Param("updatedAt") long updatedAt);

    /**
     * 推进条件观测水位，新水位不大于当前值时不修改
     */
    @Update("""
            UPDATE conduit_trigger
            SET condition_watermark = #{watermark}, updated_at = #{updatedAt}
            WHERE id = #{id} AND condition_watermark < #{watermark}
            """)
    int advanceWatermark(@Param("id") long id,
                         @Param("watermark") long watermark,
                         @Param("updatedAt") long updatedAt);

    /**
     * 更新重试状态，nextRunAt 为 null 时不修改下次运行时间
     */
    @Update("""
            <script>
            UPDATE conduit_trigger
            SET failed_attempts = #{failedAttempts},
                last_error = #{lastError,jdbcType=VARCHAR},
                <if test="nextRunAt != null">next_run_at = #{nextRunAt},</if>
                updated_at = #{updatedAt}
            WHERE id = #{id}
            </script>
            """)
    int updateRetryState(@Param("id") long id,
                         @Param("failedAttempts") int failedAttempts,
                         @Param("nextRunAt") Long nextRunAt,
                         @Param("lastError") String lastError,
                         @Param("updatedAt") long updatedAt);

    @Update("""
            UPDATE conduit_trigger
            SET next_run_at = #{nextRunAt}, last_error = #{lastError,jdbcType=VARCHAR}, updated_at = #{updatedAt}
            WHERE id = #{id}
            """)
    int updateEvaluationError(@Param("id") long id,
                              @Param("nextRunAt") long nextRunAt,
                              @Param("lastError") String lastError,
                              @Param("updatedAt") long updatedAt);
}
