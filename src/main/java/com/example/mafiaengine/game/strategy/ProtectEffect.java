package com.example.mafiaengine.game.strategy;

import com.example.mafiaengine.game.ability.AbilityEffect;
import com.example.mafiaengine.game.domain.GamePlayer;
import com.example.mafiaengine.game.resolution.EffectResult;
import com.example.mafiaengine.game.resolution.PendingAction;
import com.example.mafiaengine.game.resolution.ResolutionContext;

/**
 * 보호 효과
 * - 이후에 해결되는 살해만 막는다
 * - limit: 막을 수 있는 횟수 (null이면 무제한)
 * - diesInstead: 보디가드처럼 대신 죽음
 */
public class ProtectEffect implements AbilityEffect {

    private final Integer limit;
    private final boolean diesInstead;

    public ProtectEffect(Integer limit, boolean diesInstead) {
        this.limit = limit;
        this.diesInstead = diesInstead;
    }

    @Override
    public EffectResult apply(ResolutionContext context, PendingAction action) {
        for (GamePlayer target : action.getTargets()) {
            context.protect(action, target, limit, diesInstead);
        }
        return EffectResult.success("protecting " + String.join(", ", action.targetNames()));
    }
}
