package com.nei10u.cosmic.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 引擎层的共享资源：指纹构建线程池、远程星历 HTTP 客户端、时钟。
 */
@Configuration
@EnableConfigurationProperties(EphemerisProperties.class)
public class CosmicEngineConfig {

    @Bean(name = "fingerprintExecutor", destroyMethod = "shutdown")
    public ExecutorService fingerprintExecutor(@Value("${cosmic.fingerprint.pool-size:5}") int poolSize) {
        return Executors.newFixedThreadPool(Math.max(1, poolSize), threadFactory("fingerprint-"));
    }

    @Bean
    public HttpClient ephemerisHttpClient(EphemerisProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getRemote().getTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
