package com.expertrelay.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置。
 * <p>
 * 外部调用（知识检索、渠道投递、专家通知）各自使用独立线程池，互不挤占：
 * <ul>
 *   <li>retrievalWorker：单次提问的检索调用，调用方带超时等待</li>
 *   <li>knowledgeSourceWorker：检索内部对各知识源的并行扇出，与 retrievalWorker 分开避免嵌套等待耗尽线程</li>
 *   <li>deliveryWorker：渠道投递，调用方带超时等待</li>
 *   <li>notifyWorker：专家通知，异步发送不等待结果</li>
 * </ul>
 * </p>
 */
@Slf4j
@Configuration
public class ThreadPoolConfig {

    @Bean(name = "retrievalWorker", destroyMethod = "shutdown")
    public ThreadPoolExecutor retrievalWorker(
            @Value("${executor.retrieval.core-size:4}") int coreSize,
            @Value("${executor.retrieval.max-size:16}") int maxSize,
            @Value("${executor.retrieval.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${executor.retrieval.queue-capacity:0}") int queueCapacity,
            @Value("${executor.retrieval.rejection-policy:AbortPolicy}") String rejectionPolicy) {
        return buildExecutor(coreSize, maxSize, keepAliveSeconds, queueCapacity, rejectionPolicy, "relay-retrieval-");
    }

    @Bean(name = "knowledgeSourceWorker", destroyMethod = "shutdown")
    public ThreadPoolExecutor knowledgeSourceWorker(
            @Value("${executor.knowledge-source.core-size:4}") int coreSize,
            @Value("${executor.knowledge-source.max-size:32}") int maxSize,
            @Value("${executor.knowledge-source.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${executor.knowledge-source.queue-capacity:0}") int queueCapacity,
            @Value("${executor.knowledge-source.rejection-policy:AbortPolicy}") String rejectionPolicy) {
        return buildExecutor(coreSize, maxSize, keepAliveSeconds, queueCapacity, rejectionPolicy, "relay-knowledge-");
    }

    @Bean(name = "deliveryWorker", destroyMethod = "shutdown")
    public ThreadPoolExecutor deliveryWorker(
            @Value("${executor.delivery.core-size:4}") int coreSize,
            @Value("${executor.delivery.max-size:16}") int maxSize,
            @Value("${executor.delivery.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${executor.delivery.queue-capacity:0}") int queueCapacity,
            @Value("${executor.delivery.rejection-policy:AbortPolicy}") String rejectionPolicy) {
        return buildExecutor(coreSize, maxSize, keepAliveSeconds, queueCapacity, rejectionPolicy, "relay-delivery-");
    }

    /**
     * 通知允许排队，队列满时由调用线程发送，保证通知不丢。
     */
    @Bean(name = "notifyWorker", destroyMethod = "shutdown")
    public ThreadPoolExecutor notifyWorker(
            @Value("${executor.notify.core-size:2}") int coreSize,
            @Value("${executor.notify.max-size:4}") int maxSize,
            @Value("${executor.notify.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${executor.notify.queue-capacity:1000}") int queueCapacity,
            @Value("${executor.notify.rejection-policy:CallerRunsPolicy}") String rejectionPolicy) {
        return buildExecutor(coreSize, maxSize, keepAliveSeconds, queueCapacity, rejectionPolicy, "relay-notify-");
    }

    private ThreadPoolExecutor buildExecutor(int coreSize,
                                             int maxSize,
                                             long keepAliveSeconds,
                                             int queueCapacity,
                                             String rejectionPolicy,
                                             String threadNamePrefix) {
        int normalizedCoreSize = Math.max(coreSize, 1);
        int normalizedMaxSize = Math.max(maxSize, normalizedCoreSize);
        int normalizedQueueCapacity = Math.max(queueCapacity, 0);
        BlockingQueue<Runnable> queue = normalizedQueueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(normalizedQueueCapacity);
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadNamePrefix + threadIndex.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
        return new ThreadPoolExecutor(
                normalizedCoreSize,
                normalizedMaxSize,
                Math.max(keepAliveSeconds, 0L),
                TimeUnit.SECONDS,
                queue,
                threadFactory,
                buildRejectedExecutionHandler(rejectionPolicy));
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("DiscardPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardPolicy();
        }
        if ("DiscardOldestPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardOldestPolicy();
        }
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        log.warn("Unknown rejection policy '{}', fallback to AbortPolicy", policy);
        return new ThreadPoolExecutor.AbortPolicy();
    }

}
