package com.example.mafiaengine.game.ability;

import com.example.mafiaengine.game.domain.GamePhase;
import com.example.mafiaengine.game.domain.GamePlayer;
import com.example.mafiaengine.game.resolution.EffectResult;
import com.example.mafiaengine.game.resolution.PendingAction;
import com.example.mafiaengine.game.resolution.ResolutionContext;
import lombok.Builder;
import lombok.Getter;

import java.util.HashSet;
import java.util.Set;

/**
 * 불변 능력 정의. 수식어는 toBuilder()로 새 정의를 만들어 감싼다.
 */
@Getter
@Builder(toBuilder = true)
public class AbilityDefinition implements Ability {

    private final String id;

    private final String description;

    @Builder.Default
    private final AbilityKind kind = AbilityKind.ACTION;

    @Builder.Default
    private final GamePhase phase = GamePhase.NIGHT;

    private final boolean immediate;

    @Builder.Default
    private final int targetCount = 1;

    private final int priority;

    private final AbilityCategory category;

    @Builder.Default
    private final Set<String> tags = Set.of();

    private final boolean usableAfterDeath;

    @Builder.Default
    private final Eligibility eligibility = Eligibility.always();

    @Builder.Default
    private final TargetRule targetRule = TargetRule.otherLivingPlayers();

    private final AbilityEffect effect;

    @Override
    public boolean isEligible(AbilityContext context) {
        if (!usableAfterDeath && !context.user().isAlive()) {
            return false;
        }
        if (!isActiveIn(context.game().getGamePhase())) {
            return false;
        }
        return eligibility.test(context);
    }

    @Override
    public boolean isValidTarget(AbilityContext context, GamePlayer target) {
        return targetRule.test(context, target);
    }

    @Override
    public EffectResult resolve(ResolutionContext context, PendingAction action) {
        return effect.apply(context, action);
    }

    public AbilityDefinition withTag(String tag) {
        Set<String> merged = new HashSet<>(tags);
        merged.add(tag);
        return toBuilder().tags(Set.copyOf(merged)).build();
    }
}
