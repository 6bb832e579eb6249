package com.tripplanner.server.config;

import com.tripplanner.common.properties.PlannerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 规划相关线程池，容器关闭时由 Spring 调用 shutdownNow。
 * <ul>
 *   <li>planningExecutor：承载 submit() 提交的整次规划；</li>
 *   <li>upstreamExecutor：承载各品类拉取与叙述调用。规划线程阻塞等待这些任务，
 *   因此不能与 planningExecutor 共用。</li>
 * </ul>
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class PlanningExecutorConfig {

    private final PlannerProperties plannerProperties;

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService planningExecutor() {
        int threads = Math.max(1, plannerProperties.getExecutorThreads());
        log.info("创建规划线程池, threads={}", threads);
        return Executors.newFixedThreadPool(threads, daemonThreads("planning-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService upstreamExecutor() {
        int threads = Math.max(4, plannerProperties.getUpstreamThreads());
        log.info("创建上游调用线程池, threads={}", threads);
        return Executors.newFixedThreadPool(threads, daemonThreads("upstream-"));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
