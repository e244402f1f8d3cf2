package com.example.mafiaengine.game.catalog;

import com.example.mafiaengine.game.ability.AbilityCategory;
import com.example.mafiaengine.game.ability.AbilityDefinition;
import com.example.mafiaengine.game.ability.AbilityKind;
import com.example.mafiaengine.game.ability.AbilityTags;
import com.example.mafiaengine.game.ability.TargetRule;
import com.example.mafiaengine.game.strategy.AlignmentInvestigateEffect;
import com.example.mafiaengine.game.strategy.KillEffect;
import com.example.mafiaengine.game.strategy.ProtectEffect;
import com.example.mafiaengine.game.strategy.RedirectEffect;
import com.example.mafiaengine.game.strategy.RevealEffect;
import com.example.mafiaengine.game.strategy.RoleblockEffect;
import com.example.mafiaengine.game.strategy.WatchEffect;

import java.util.Set;

/**
 * 표준 능력 정의
 */
public final class StandardAbilities {

    // 해결 우선순위 (낮을수록 먼저)
    public static final int ROLEBLOCK_PRIORITY = 10;
    public static final int REDIRECT_PRIORITY = 15;
    public static final int PROTECT_PRIORITY = 20;
    public static final int INVESTIGATE_PRIORITY = 30;
    public static final int KILL_PRIORITY = 40;
    public static final int WATCH_PRIORITY = 50;

    private StandardAbilities() {
    }

    public static AbilityDefinition kill(String id, String cause) {
        return AbilityDefinition.builder()
                .id(id)
                .description("Kill a player at night.")
                .priority(KILL_PRIORITY)
                .category(AbilityCategory.OFFENSIVE)
                .tags(Set.of(AbilityTags.KILL))
                .effect(new KillEffect(cause))
                .build();
    }

    /**
     * 진영 공유 살해. 같은 진영으로 알고 있는 플레이어는 대상 불가
     */
    public static AbilityDefinition factionalKill() {
        return kill("Factional Kill", "Killed by the Mafia").toBuilder()
                .kind(AbilityKind.SHARED_ACTION)
                .description("One member of the faction may kill a player at night.")
                .targetRule(TargetRule.otherLivingPlayers().and(TargetRule.notKnownAlly()))
                .build();
    }

    public static AbilityDefinition investigate() {
        return AbilityDefinition.builder()
                .id("Investigate")
                .description("Learn the alignment of a player.")
                .priority(INVESTIGATE_PRIORITY)
                .category(AbilityCategory.INFORMATIONAL)
                .tags(Set.of(AbilityTags.INVESTIGATE))
                .effect(new AlignmentInvestigateEffect())
                .build();
    }

    public static AbilityDefinition protect() {
        return AbilityDefinition.builder()
                .id("Protect")
                .description("Protect a player from one kill tonight.")
                .priority(PROTECT_PRIORITY)
                .category(AbilityCategory.PROTECTIVE)
                .tags(Set.of(AbilityTags.PROTECT))
                .effect(new ProtectEffect(1, false))
                .build();
    }

    public static AbilityDefinition guard() {
        return protect().toBuilder()
                .id("Guard")
                .description("Protect a player from one kill tonight, dying in their place.")
                .effect(new ProtectEffect(1, true))
                .build();
    }

    /**
     * 항상 발동하는 자기 보호 패시브
     */
    public static AbilityDefinition bulletproof() {
        return protect().toBuilder()
                .id("Bulletproof")
                .description("Survive every night kill.")
                .kind(AbilityKind.PASSIVE)
                .targetCount(0)
                .tags(Set.of(AbilityTags.PROTECT, AbilityTags.SELF_TARGETED))
                .effect(new ProtectEffect(null, false))
                .build();
    }

    public static AbilityDefinition roleblock() {
        return AbilityDefinition.builder()
                .id("Roleblock")
                .description("Stop a player's abilities tonight.")
                .priority(ROLEBLOCK_PRIORITY)
                .category(AbilityCategory.CONTROL)
                .tags(Set.of(AbilityTags.ROLEBLOCK))
                .effect(new RoleblockEffect())
                .build();
    }

    public static AbilityDefinition redirect() {
        return AbilityDefinition.builder()
                .id("Redirect")
                .description("Make the first player's abilities target the second player.")
                .targetCount(2)
                .priority(REDIRECT_PRIORITY)
                .category(AbilityCategory.CONTROL)
                .tags(Set.of(AbilityTags.REDIRECT))
                .targetRule(TargetRule.anyLivingPlayer())
                .effect(new RedirectEffect())
                .build();
    }

    public static AbilityDefinition watch() {
        return AbilityDefinition.builder()
                .id("Watch")
                .description("Learn who visited a player tonight.")
                .priority(WATCH_PRIORITY)
                .category(AbilityCategory.INFORMATIONAL)
                .effect(new WatchEffect())
                .build();
    }

    /**
     * 즉시 발동, 아무 페이즈에서나 사용
     */
    public static AbilityDefinition reveal() {
        return AbilityDefinition.builder()
                .id("Reveal")
                .description("Reveal your alignment to everyone.")
                .phase(null)
                .immediate(true)
                .targetCount(0)
                .category(AbilityCategory.INFORMATIONAL)
                .effect(new RevealEffect())
                .build();
    }
}
