package com.example.mafiaengine.global.concurrency;

import java.util.function.Supplier;

/**
 * 게임 단위 동시성 제어 전략 인터페이스
 *
 * 사용법:
 * - 상태를 바꾸는 요청(큐 등록, 해결, 페이즈 전환, 채팅 작성)은 executeWithLock
 * - 조회 요청(개요, 능력 목록, 채팅 읽기)은 executeWithReadLock
 */
public interface LockStrategy {

    /**
     * 배타 락을 획득하고 비즈니스 로직을 실행
     *
     * @param lockKey 락을 식별하는 키 (예: "game:game_1")
     * @param action  락 보호 하에 실행할 로직
     * @return 로직 실행 결과
     */
    <T> T executeWithLock(String lockKey, Supplier<T> action);

    /**
     * 공유 락을 획득하고 조회 로직을 실행
     * 같은 키의 배타 락이 잡혀 있는 동안에는 대기한다.
     */
    <T> T executeWithReadLock(String lockKey, Supplier<T> action);

    /**
     * 반환값 없는 로직용 오버로드
     */
    default void executeWithLock(String lockKey, Runnable action) {
        executeWithLock(lockKey, () -> {
            action.run();
            return null;
        });
    }

    /**
     * 전략 이름 반환 (로깅용)
     */
    String getStrategyName();
}
