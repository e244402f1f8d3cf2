package com.example.mafiaengine.game.strategy;

import com.example.mafiaengine.game.ability.AbilityEffect;
import com.example.mafiaengine.game.domain.GamePlayer;
import com.example.mafiaengine.game.resolution.EffectResult;
import com.example.mafiaengine.game.resolution.PendingAction;
import com.example.mafiaengine.game.resolution.ResolutionContext;
import com.example.mafiaengine.game.resolution.ResolutionOutcome;

/**
 * 살해 효과
 * - 보호 여부는 해결되는 순간에 확인
 */
public class KillEffect implements AbilityEffect {

    private final String cause;

    public KillEffect(String cause) {
        this.cause = cause;
    }

    @Override
    public EffectResult apply(ResolutionContext context, PendingAction action) {
        EffectResult result = EffectResult.failed("no target");
        for (GamePlayer target : action.getTargets()) {
            EffectResult attempt = context.attemptKill(action, target, cause);
            if (result.outcome() != ResolutionOutcome.SUCCESS) {
                result = attempt;
            }
        }
        return result;
    }
}
