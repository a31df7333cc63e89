package com.sunny.conduit.job.server.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.sunny.conduit.job.core.model.JobRunResult;
import com.sunny.conduit.job.core.spi.JobRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Map;

/**
 * 通过 HTTP 调用任务执行端
 * <p>
 * POST {baseUrl}/jobs/{jobId}/run，请求体为任务参数。
 * 2xx 且响应体没有 {"success": false} 视为成功；其余情况返回失败结果，不抛异常
 *
 * @author SunnyX6
 * @date 2026-03-07
 */
public class HttpJobRunner implements JobRunner {

    private static final Logger log = LoggerFactory.getLogger(HttpJobRunner.class);

    static final String TIMEOUT_HEADER = "X-Conduit-Timeout-Ms";
    private static final String RUN_PATH = "/jobs/{jobId}/run";

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public HttpJobRunner(RestTemplate restTemplate, String baseUrl) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public JobRunResult runJob(long jobId, Map<String, Object> params, Duration timeout) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (timeout != null) {
            headers.set(TIMEOUT_HEADER, String.valueOf(timeout.toMillis()));
        }
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(params == null ? Map.of() : params, headers);

        log.debug("调用任务执行端: jobId={}, url={}", jobId, baseUrl + RUN_PATH);
        try {
            ResponseEntity<JsonNode> response = restTemplate.postForEntity(
                    baseUrl + RUN_PATH, request, JsonNode.class, jobId);
            return toResult(response.getBody());
        } catch (RestClientResponseException e) {
            log.warn("任务执行端返回错误: jobId={}, status={}", jobId, e.getStatusCode().value());
            return JobRunResult.failed("HTTP " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString());
        } catch (ResourceAccessException e) {
            log.warn("任务执行端不可达: jobId={}, error={}", jobId, e.getMessage());
            return JobRunResult.failed("任务执行端不可达: " + e.getMessage());
        } catch (RestClientException e) {
            log.error("调用任务执行端失败: jobId={}", jobId, e);
            return JobRunResult.failed(e.getMessage());
        }
    }

    private static JobRunResult toResult(JsonNode body) {
        if (body == null || !body.isObject() || !body.has("success")) {
            return JobRunResult.ok();
        }
        if (body.get("success").asBoolean(false)) {
            return JobRunResult.ok();
        }
        JsonNode error = body.get("error");
        return JobRunResult.failed(error == null || error.isNull() ? "任务执行失败" : error.asText());
    }
}
