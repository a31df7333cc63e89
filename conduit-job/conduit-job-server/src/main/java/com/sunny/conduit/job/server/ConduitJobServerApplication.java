package com.sunny.conduit.job.server;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Conduit Job Server 启动类
 * <p>
 * 单进程承载触发器调度、执行事件发布与实时推送
 *
 * @author SunnyX6
 * @date 2026-03-07
 */
@SpringBootApplication
@MapperScan("com.sunny.conduit.job.scheduler.store.mapper")
public class ConduitJobServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConduitJobServerApplication.class, args);
    }
}
