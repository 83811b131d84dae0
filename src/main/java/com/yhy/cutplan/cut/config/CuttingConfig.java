package com.yhy.cutplan.cut.config;

import cn.hutool.core.thread.NamedThreadFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(CuttingProperties.class)
public class CuttingConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService cuttingExecutor(CuttingProperties properties) {
        int threads = Math.max(1, properties.getBatch().getParallelism());
        return Executors.newFixedThreadPool(threads, new NamedThreadFactory("cut-worker-", true));
    }
}
