package com.example.mafiaengine.game.strategy;

import com.example.mafiaengine.game.ability.AbilityEffect;
import com.example.mafiaengine.game.domain.GamePlayer;
import com.example.mafiaengine.game.knowledge.KnowledgeFact;
import com.example.mafiaengine.game.resolution.EffectResult;
import com.example.mafiaengine.game.resolution.PendingAction;
import com.example.mafiaengine.game.resolution.ResolutionContext;

/**
 * 공개 효과 (Innocent Child)
 * - 사용자의 진영을 전체 채팅에 공지하고 모든 플레이어가 그 사실을 알게 된다
 */
public class RevealEffect implements AbilityEffect {

    @Override
    public EffectResult apply(ResolutionContext context, PendingAction action) {
        GamePlayer user = action.getUser();
        String alignment = user.getAlignment().getId();
        context.announce(user.getName() + " is aligned with the " + alignment + ".");
        for (GamePlayer observer : context.getGame().getPlayers().values()) {
            if (observer != user) {
                context.learn(observer, user, KnowledgeFact.alignment(alignment));
            }
        }
        return EffectResult.success(user.getName() + " revealed as " + alignment);
    }
}
