package com.sunny.conduit.job.realtime.broker;

import com.sunny.conduit.job.core.common.Assert;
import com.sunny.conduit.job.core.common.Constants;

import java.util.regex.Pattern;

/**
 * 租户 Topic 命名
 * <p>
 * 每个租户一个 Topic：conduit.tenant.&lt;tenantId&gt;.events
 *
 * @author SunnyX6
 * @date 2026-03-06
 */
public final class TenantTopics {

    private static final Pattern TENANT_PATTERN = Pattern.compile("[A-Za-z0-9_-]+");

    private TenantTopics() {
    }

    public static String topicOf(String tenantId) {
        Assert.notBlank(tenantId, "租户 ID 不能为空");
        Assert.isTrue(TENANT_PATTERN.matcher(tenantId).matches(), "租户 ID 含非法字符: " + tenantId);
        return Constants.TENANT_TOPIC_PREFIX + tenantId + Constants.TENANT_TOPIC_SUFFIX;
    }
}
