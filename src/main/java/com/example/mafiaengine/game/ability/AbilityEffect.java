package com.example.mafiaengine.game.ability;

import com.example.mafiaengine.game.resolution.EffectResult;
import com.example.mafiaengine.game.resolution.PendingAction;
import com.example.mafiaengine.game.resolution.ResolutionContext;

/**
 * 능력 효과 전략 (Strategy Pattern)
 */
@FunctionalInterface
public interface AbilityEffect {

    /**
     * 해결 시점에 효과 적용
     *
     * @param context 이번 해결 패스의 상태
     * @param action  해결 중인 행동 (대상은 리다이렉트로 바뀌었을 수 있음)
     * @return 결과 (성공, 막힘, 실패)
     */
    EffectResult apply(ResolutionContext context, PendingAction action);
}
