package com.example.mafiaengine.game.ability;

import com.example.mafiaengine.game.domain.GamePhase;
import com.example.mafiaengine.game.domain.GamePlayer;
import com.example.mafiaengine.game.resolution.EffectResult;
import com.example.mafiaengine.game.resolution.PendingAction;
import com.example.mafiaengine.game.resolution.ResolutionContext;

import java.util.Set;

/**
 * 모든 능력(액션, 공유 액션, 패시브)이 구현하는 단일 인터페이스.
 * 큐 검증과 해결은 이 메서드들만 통해서 이뤄진다.
 */
public interface Ability {

    String getId();

    AbilityKind getKind();

    /**
     * 사용 가능한 페이즈. null이면 모든 페이즈
     */
    GamePhase getPhase();

    /**
     * true면 큐에 넣는 즉시 해결된다
     */
    boolean isImmediate();

    int getTargetCount();

    /**
     * 낮을수록 먼저 해결
     */
    int getPriority();

    AbilityCategory getCategory();

    Set<String> getTags();

    boolean isUsableAfterDeath();

    /**
     * 사용자, 페이즈, 수식어 조건 검사.
     * context의 targets가 비어 있으면 대상과 무관한 조건만 본다.
     */
    boolean isEligible(AbilityContext context);

    boolean isValidTarget(AbilityContext context, GamePlayer target);

    EffectResult resolve(ResolutionContext context, PendingAction action);

    default boolean hasTag(String tag) {
        return getTags().contains(tag);
    }

    default boolean isActiveIn(GamePhase phase) {
        return getPhase() == null || getPhase() == phase;
    }
}
