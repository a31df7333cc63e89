package com.sunny.conduit.job.server.runner;

import com.sunny.conduit.job.core.model.JobRunResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpJobRunnerTest {

    private MockRestServiceServer mockServer;
    private HttpJobRunner runner;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        mockServer = MockRestServiceServer.createServer(restTemplate);
        runner = new HttpJobRunner(restTemplate, "http://runner.local/");
    }

    @Test
    void runJob_shouldPostParamsAndSucceedOn2xx() {
        mockServer.expect(requestTo("http://runner.local/jobs/3/run"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpJobRunner.TIMEOUT_HEADER, "5000"))
                .andExpect(content().json("{\"table\":\"orders\"}"))
                .andRespond(withSuccess("{\"success\":true}", MediaType.APPLICATION_JSON));

        JobRunResult result = runner.runJob(3L, Map.of("table", "orders"), Duration.ofSeconds(5));

        assertTrue(result.succeeded());
        mockServer.verify();
    }

    @Test
    void runJob_emptyBodyShouldCountAsSuccess() {
        mockServer.expect(requestTo("http://runner.local/jobs/3/run"))
                .andRespond(withStatus(HttpStatus.NO_CONTENT));

        assertTrue(runner.runJob(3L, null, null).succeeded());
    }

    @Test
    void runJob_businessFailureShouldCarryError() {
        mockServer.expect(requestTo("http://runner.local/jobs/3/run"))
                .andRespond(withSuccess("{\"success\":false,\"error\":\"source table missing\"}",
                        MediaType.APPLICATION_JSON));

        JobRunResult result = runner.runJob(3L, Map.of(), Duration.ofSeconds(5));

        assertFalse(result.succeeded());
        assertEquals("source table missing", result.error());
    }

    @Test
    void runJob_httpErrorShouldBecomeFailedResult() {
        mockServer.expect(requestTo("http://runner.local/jobs/3/run"))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY).body("upstream down"));

        JobRunResult result = runner.runJob(3L, Map.of(), Duration.ofSeconds(5));

        assertFalse(result.succeeded());
        assertEquals("HTTP 502: upstream down", result.error());
    }

    @Test
    void runJob_unreachableRunnerShouldBecomeFailedResult() {
        mockServer.expect(requestTo("http://runner.local/jobs/3/run"))
                .andRespond(withException(new IOException("connection refused")));

        JobRunResult result = runner.runJob(3L, Map.of(), Duration.ofSeconds(5));

        assertFalse(result.succeeded());
        assertTrue(result.error().startsWith("任务执行端不可达"));
    }
}
