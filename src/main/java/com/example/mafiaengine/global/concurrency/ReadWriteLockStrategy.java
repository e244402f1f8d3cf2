package com.example.mafiaengine.global.concurrency;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * ReentrantReadWriteLock 기반 락 전략
 *
 * 게임 하나당 writer 하나, reader 여러 개.
 * 단일 JVM 안에서만 동작하며 게임끼리는 락을 공유하지 않는다.
 */
@Component
public class ReadWriteLockStrategy implements LockStrategy {

    // lockKey별로 별도의 락 객체를 관리 (같은 키에 대해서만 동기화)
    private final Map<String, ReentrantReadWriteLock> lockMap = new ConcurrentHashMap<>();

    @Override
    public <T> T executeWithLock(String lockKey, Supplier<T> action) {
        return runLocked(lockFor(lockKey).writeLock(), action);
    }

    @Override
    public <T> T executeWithReadLock(String lockKey, Supplier<T> action) {
        return runLocked(lockFor(lockKey).readLock(), action);
    }

    private ReentrantReadWriteLock lockFor(String lockKey) {
        return lockMap.computeIfAbsent(lockKey, k -> new ReentrantReadWriteLock(true));
    }

    private <T> T runLocked(Lock lock, Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String getStrategyName() {
        return "READ_WRITE";
    }
}
