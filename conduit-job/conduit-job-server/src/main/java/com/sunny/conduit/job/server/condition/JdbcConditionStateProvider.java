package com.sunny.conduit.job.server.condition;

import com.sunny.conduit.job.core.model.Observation;
import com.sunny.conduit.job.core.spi.ConditionStateProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 从观测表读取水位之后的最新一行作为条件状态
 * <p>
 * source 即表名，表需要 tenant_id 与自增 id 列，id 即观测水位；列名统一转为小写作为条件字段
 *
 * @author SunnyX6
 * @date 2026-03-07
 */
public class JdbcConditionStateProvider implements ConditionStateProvider {

    private static final Logger log = LoggerFactory.getLogger(JdbcConditionStateProvider.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,63}");

    private final JdbcTemplate jdbcTemplate;

    public JdbcConditionStateProvider(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * @throws IllegalArgumentException 表名不是合法标识符
     * @throws DataAccessException      查询失败，例如表不存在
     */
    @Override
    public Optional<Observation> latest(String tenantId, String source, long afterWatermark) {
        if (source == null || !IDENTIFIER.matcher(source).matches()) {
            throw new IllegalArgumentException("非法的观测源: " + source);
        }
        String sql = "SELECT * FROM " + source + " WHERE tenant_id = ? AND id > ? ORDER BY id DESC LIMIT 1";
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, tenantId, afterWatermark);
        if (rows.isEmpty()) {
            log.debug("观测源没有新数据: tenantId={}, source={}, afterWatermark={}", tenantId, source, afterWatermark);
            return Optional.empty();
        }
        Map<String, Object> row = new LinkedHashMap<>();
        rows.get(0).forEach((column, value) -> row.put(column.toLowerCase(Locale.ROOT), value));
        if (!(row.get("id") instanceof Number id)) {
            throw new IllegalStateException("观测源缺少数值型 id 列: " + source);
        }
        return Optional.of(new Observation(id.longValue(), row));
    }
}
