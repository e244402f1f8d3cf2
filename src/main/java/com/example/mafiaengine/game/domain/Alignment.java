package com.example.mafiaengine.game.domain;

import com.example.mafiaengine.game.ability.AbilityDefinition;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 진영 템플릿 (Town, Mafia, Serial Killer ...)
 * 게임 전체에서 같은 진영의 플레이어들이 공유한다.
 */
@Getter
@Builder
public class Alignment {

    private final String id;

    @Builder.Default
    private final Set<String> tags = Set.of();

    // 진영원 중 한 명만 사용할 수 있는 공유 능력 (마피아 살해 등)
    @Builder.Default
    private final List<AbilityDefinition> sharedActions = List.of();

    // 진영원 각자에게 주어지는 능력
    @Builder.Default
    private final List<AbilityDefinition> actions = List.of();

    @Builder.Default
    private final List<AbilityDefinition> passives = List.of();

    private final String demonym;

    // 역할 id -> 표시 이름 ("Vanilla" -> "Mafia Goon")
    @Builder.Default
    private final Map<String, String> roleNames = Map.of();

    private final WinCondition winCondition;

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    public String getDemonym() {
        return demonym != null ? demonym : id + "ie";
    }
}
