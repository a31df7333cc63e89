package com.sunny.conduit.job.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.conduit.job.server.runner.HttpJobRunner;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 任务执行端配置
 * <p>
 * 读超时取任务超时，调度器自己的超时先到时会中断调用线程
 *
 * @author SunnyX6
 * @date 2026-03-07
 */
@Configuration
public class RunnerConfig {

    @Value("${conduit.runner.base-url:http://127.0.0.1:8090}")
    private String baseUrl;

    @Value("${conduit.runner.connect-timeout-ms:3000}")
    private long connectTimeoutMs;

    @Value("${conduit.scheduler.job-timeout-ms:300000}")
    private long jobTimeoutMs;

    @Bean
    public RestTemplate runnerRestTemplate(RestTemplateBuilder builder, ObjectMapper objectMapper) {
        RestTemplate restTemplate = builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(jobTimeoutMs))
                .build();

        List<HttpMessageConverter<?>> converters = new ArrayList<>(restTemplate.getMessageConverters());
        converters.removeIf(c -> c instanceof MappingJackson2HttpMessageConverter);
        converters.add(new MappingJackson2HttpMessageConverter(objectMapper));
        restTemplate.setMessageConverters(converters);

        return restTemplate;
    }

    @Bean
    public HttpJobRunner httpJobRunner(RestTemplate runnerRestTemplate) {
        return new HttpJobRunner(runnerRestTemplate, baseUrl);
    }
}
