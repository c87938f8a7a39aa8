package com.surveyaudit.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 检测引擎的线程池与公共组件。
 * <ul>
 *     <li>detectionExecutor：检查任务与派生数据任务，有界队列，满时拒绝（运行中止）</li>
 *     <li>adaptationExecutor：模型增量训练，与检测互不抢占</li>
 *     <li>checkWatchdog：单线程定时器，负责检查项耗时预算</li>
 * </ul>
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    public static final String DETECTION_EXECUTOR = "detectionExecutor";
    public static final String ADAPTATION_EXECUTOR = "adaptationExecutor";
    public static final String CHECK_WATCHDOG = "checkWatchdog";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = DETECTION_EXECUTOR)
    public ThreadPoolTaskExecutor detectionExecutor(EngineProperties properties) {
        EngineProperties.Scheduler cfg = properties.getScheduler();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cfg.getWorkerThreads());
        executor.setMaxPoolSize(cfg.getWorkerThreads());
        executor.setQueueCapacity(cfg.getQueueCapacity());
        executor.setThreadNamePrefix("detect-");
        executor.setRejectedExecutionHandler(new AbortWithLogging());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();

        log.info("初始化检测线程池 - 线程: {}, 队列: {}", cfg.getWorkerThreads(), cfg.getQueueCapacity());
        return executor;
    }

    @Bean(name = ADAPTATION_EXECUTOR)
    public ThreadPoolTaskExecutor adaptationExecutor(EngineProperties properties) {
        int threads = Math.max(1, properties.getAdaptation().getThreads());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("adapt-");
        executor.setRejectedExecutionHandler(new AbortWithLogging());
        // 停机时等待训练任务写完
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();

        log.info("初始化模型训练线程池 - 线程: {}", threads);
        return executor;
    }

    @Bean(name = CHECK_WATCHDOG, destroyMethod = "shutdownNow")
    public ScheduledExecutorService checkWatchdog() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "check-watchdog-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 队列满时拒绝并记录线程池状态
     */
    private static class AbortWithLogging implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            log.error("任务被拒绝，线程池已满 - 线程: {}, 活跃: {}, 队列: {}",
                    executor.getPoolSize(),
                    executor.getActiveCount(),
                    executor.getQueue().size());
            throw new RejectedExecutionException("线程池已满，无法提交任务");
        }
    }
}
