package com.example.mafiaengine.game.strategy;

import com.example.mafiaengine.game.ability.AbilityEffect;
import com.example.mafiaengine.game.domain.GamePlayer;
import com.example.mafiaengine.game.resolution.EffectResult;
import com.example.mafiaengine.game.resolution.PendingAction;
import com.example.mafiaengine.game.resolution.ResolutionContext;

/**
 * 리다이렉트 효과
 * - 대상 [from, to]: from의 아직 해결되지 않은 능력 대상을 to로 바꾼다
 */
public class RedirectEffect implements AbilityEffect {

    @Override
    public EffectResult apply(ResolutionContext context, PendingAction action) {
        GamePlayer from = action.getTargets().get(0);
        GamePlayer to = action.getTargets().get(1);
        int redirected = context.redirect(action, from, to);
        return EffectResult.success("redirected " + redirected + " action(s) of " + from.getName()
                + " to " + to.getName());
    }
}
