package com.example.mafiaengine.game.strategy;

import com.example.mafiaengine.game.ability.AbilityEffect;
import com.example.mafiaengine.game.domain.GamePlayer;
import com.example.mafiaengine.game.resolution.EffectResult;
import com.example.mafiaengine.game.resolution.PendingAction;
import com.example.mafiaengine.game.resolution.ResolutionContext;

/**
 * 롤블락 효과
 * - 대상의 아직 해결되지 않은 능력을 막는다 (패시브, Unstoppable 제외)
 */
public class RoleblockEffect implements AbilityEffect {

    @Override
    public EffectResult apply(ResolutionContext context, PendingAction action) {
        int blocked = 0;
        for (GamePlayer target : action.getTargets()) {
            blocked += context.block(action, target);
        }
        return EffectResult.success("blocked " + blocked + " action(s)");
    }
}
