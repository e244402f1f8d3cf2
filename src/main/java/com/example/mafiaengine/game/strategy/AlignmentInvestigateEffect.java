package com.example.mafiaengine.game.strategy;

import com.example.mafiaengine.game.ability.AbilityEffect;
import com.example.mafiaengine.game.domain.GamePlayer;
import com.example.mafiaengine.game.knowledge.KnowledgeFact;
import com.example.mafiaengine.game.resolution.EffectResult;
import com.example.mafiaengine.game.resolution.PendingAction;
import com.example.mafiaengine.game.resolution.ResolutionContext;

/**
 * 경찰 조사 효과
 * - 대상의 진영을 알아내고 결과를 개인 수신함으로 받는다
 */
public class AlignmentInvestigateEffect implements AbilityEffect {

    @Override
    public EffectResult apply(ResolutionContext context, PendingAction action) {
        GamePlayer user = action.getUser();
        for (GamePlayer target : action.getTargets()) {
            String alignment = target.getAlignment().getId();
            context.learn(user, target, KnowledgeFact.alignment(alignment));
            context.notify(user, target.getName() + " is aligned with the " + alignment + ".");
        }
        return EffectResult.success(user.getName() + " investigated " + String.join(", ", action.targetNames()));
    }
}
