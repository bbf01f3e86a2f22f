package com.expertrelay.trigger.application.common;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 进程内迁移锁注册表：按 Query / 会话维度串行化状态迁移。
 * <p>
 * 锁对象以弱引用缓存，持有期间由调用栈强引用，释放后可被回收。
 * 加锁顺序固定为 Query 锁在外；会话行只做定向列更新，不在 Query 锁内获取会话锁。
 * </p>
 */
@Slf4j
@Component
public class QueryLockRegistry {

    private static final String QUERY_PREFIX = "query:";
    private static final String CONVERSATION_PREFIX = "conversation:";

    private final LoadingCache<String, ReentrantLock> locks = CacheBuilder.newBuilder()
            .weakValues()
            .build(new CacheLoader<String, ReentrantLock>() {
                @Override
                public ReentrantLock load(String key) {
                    return new ReentrantLock();
                }
            });

    public static String queryKey(Long queryId) {
        return QUERY_PREFIX + queryId;
    }

    public static String conversationKey(String conversationId) {
        return CONVERSATION_PREFIX + conversationId;
    }

    public <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = locks.getUnchecked(key);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 限时加锁；等待超时返回 onBusy 的结果，不执行 action。
     */
    public <T> T tryWithLock(String key, long waitMs, Supplier<T> action, Supplier<T> onBusy) {
        ReentrantLock lock = locks.getUnchecked(key);
        boolean acquired;
        try {
            acquired = lock.tryLock(Math.max(waitMs, 0L), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            acquired = false;
        }
        if (!acquired) {
            log.debug("Lock busy, skip. key={}, waitMs={}", key, waitMs);
            return onBusy.get();
        }
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
