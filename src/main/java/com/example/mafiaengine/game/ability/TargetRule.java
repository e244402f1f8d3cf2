package com.example.mafiaengine.game.ability;

import com.example.mafiaengine.game.domain.GamePlayer;
import com.example.mafiaengine.game.knowledge.KnowledgeFact;

@FunctionalInterface
public interface TargetRule {

    boolean test(AbilityContext context, GamePlayer target);

    default TargetRule and(TargetRule other) {
        return (context, target) -> test(context, target) && other.test(context, target);
    }

    /**
     * 자신을 제외한 생존자
     */
    static TargetRule otherLivingPlayers() {
        return (context, target) -> target.isAlive() && target != context.user();
    }

    static TargetRule anyLivingPlayer() {
        return (context, target) -> target.isAlive();
    }

    /**
     * 같은 진영이라고 알고 있는 플레이어는 제외
     */
    static TargetRule notKnownAlly() {
        return (context, target) -> context.game().getKnowledge()
                .knows(context.user().getName(), target.getName())
                .map(KnowledgeFact::alignmentId)
                .map(id -> !id.equals(context.user().getAlignment().getId()))
                .orElse(true);
    }
}
