package com.example.mafiaengine.game.queue;

import com.example.mafiaengine.game.ability.AbilityInstance;
import com.example.mafiaengine.game.domain.GamePhase;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 해결 대기 중인 능력 사용. (능력, 사용자) 하나당 하나만 존재한다.
 */
@Getter
@Builder
public class QueuedAbility {

    private final AbilityInstance instance;
    private final String user;
    private final List<String> targets;

    // 큐에 넣은 시점의 일차 / 페이즈
    private final int dayNo;
    private final GamePhase phase;

    // 같은 우선순위 안에서의 삽입 순서
    private final long sequence;

    public QueueKey key() {
        return new QueueKey(instance.getKey(), user);
    }

    public boolean isStampedFor(int dayNo, GamePhase phase) {
        return this.dayNo == dayNo && this.phase == phase;
    }
}
