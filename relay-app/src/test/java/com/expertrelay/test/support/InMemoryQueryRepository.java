package com.expertrelay.test.support;

import com.expertrelay.domain.conversation.adapter.repository.IQueryRepository;
import com.expertrelay.domain.conversation.model.entity.QueryEntity;
import com.expertrelay.types.enums.ResponseCode;
import com.expertrelay.types.exception.AppException;
import org.springframework.beans.BeanUtils;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * 内存 Query 仓储。保存与读取都复制实体，未 update 的修改对其他读取方不可见；
 * update 按版本号做乐观锁校验。
 */
public class InMemoryQueryRepository implements IQueryRepository {

    private final Map<Long, QueryEntity> store = new LinkedHashMap<>();
    private final AtomicInteger updateCount = new AtomicInteger();
    private final Set<Long> conflictingIds = new HashSet<>();
    private long nextId = 1;
    private volatile boolean unavailable;

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    /**
     * 之后对该 Query 的 update 一律抛出 STORE_CONFLICT。
     */
    public synchronized void conflictOnUpdate(Long id) {
        conflictingIds.add(id);
    }

    public int updateCount() {
        return updateCount.get();
    }

    public synchronized int size() {
        return store.size();
    }

    public synchronized List<QueryEntity> findAll() {
        return store.values().stream().map(InMemoryQueryRepository::copy).collect(Collectors.toList());
    }

    @Override
    public synchronized QueryEntity save(QueryEntity entity) {
        checkAvailable();
        entity.validate();
        if (entity.getId() == null) {
            entity.setId(nextId++);
        }
        store.put(entity.getId(), copy(entity));
        return entity;
    }

    @Override
    public synchronized QueryEntity update(QueryEntity entity) {
        checkAvailable();
        entity.validate();
        QueryEntity stored = store.get(entity.getId());
        if (stored == null || conflictingIds.contains(entity.getId())) {
            throw new AppException(ResponseCode.STORE_CONFLICT, "query missing: " + entity.getId());
        }
        if (stored.normalizedVersion() != entity.normalizedVersion()) {
            throw new AppException(ResponseCode.STORE_CONFLICT, "query version changed: " + entity.getId());
        }
        entity.incrementVersion();
        store.put(entity.getId(), copy(entity));
        updateCount.incrementAndGet();
        return entity;
    }

    @Override
    public synchronized QueryEntity findById(Long id) {
        checkAvailable();
        QueryEntity stored = store.get(id);
        return stored == null ? null : copy(stored);
    }

    @Override
    public synchronized List<QueryEntity> findPendingDelivery(int limit) {
        checkAvailable();
        return store.values().stream()
                .filter(QueryEntity::hasPendingDelivery)
                .limit(limit)
                .map(InMemoryQueryRepository::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<QueryEntity> findStalledBefore(LocalDateTime cutoff, int limit) {
        checkAvailable();
        return store.values().stream()
                .filter(QueryEntity::isRetrievalOpen)
                .filter(query -> query.getUpdatedAt() != null && query.getUpdatedAt().isBefore(cutoff))
                .sorted(Comparator.comparing(QueryEntity::getUpdatedAt))
                .limit(limit)
                .map(InMemoryQueryRepository::copy)
                .collect(Collectors.toList());
    }

    private void checkAvailable() {
        if (unavailable) {
            throw new AppException(ResponseCode.STORE_UNAVAILABLE, "query store down");
        }
    }

    private static QueryEntity copy(QueryEntity source) {
        QueryEntity target = new QueryEntity();
        BeanUtils.copyProperties(source, target);
        return target;
    }
}
