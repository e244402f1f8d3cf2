package com.example.mafiaengine.game.domain;

import com.example.mafiaengine.game.ability.AbilityDefinition;
import com.example.mafiaengine.game.modifier.Modifier;
import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 역할 템플릿. 능력 묶음 + 순서가 정해진 수식어 목록.
 * 플레이어 생성 시 {@link #composeAbilities()}로 수식어를 순서대로 적용한 능력을 얻는다.
 */
@Getter
@Builder(toBuilder = true)
public class Role {

    private final String id;

    private final String description;

    @Builder.Default
    private final List<AbilityDefinition> actions = List.of();

    @Builder.Default
    private final List<AbilityDefinition> passives = List.of();

    @Builder.Default
    private final Set<String> tags = Set.of();

    // true면 역할 이름을 "{role} {demonym}" 형태로 표시 (Vanilla Townie)
    private final boolean adjective;

    @Builder.Default
    private final List<Modifier> modifiers = List.of();

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    /**
     * 수식어를 덧붙인 새 역할 ("1-Shot Vigilante")
     */
    public Role withModifiers(List<Modifier> added) {
        if (added.isEmpty()) {
            return this;
        }
        List<Modifier> combined = new ArrayList<>(modifiers);
        combined.addAll(added);
        String prefix = added.stream().map(Modifier::getId).collect(Collectors.joining(" "));
        return toBuilder()
                .id(prefix + " " + id)
                .modifiers(List.copyOf(combined))
                .build();
    }

    /**
     * 역할 능력(액션 + 패시브)에 수식어를 선언 순서대로 적용
     */
    public List<AbilityDefinition> composeAbilities() {
        List<AbilityDefinition> composed = new ArrayList<>();
        List<AbilityDefinition> base = new ArrayList<>(actions);
        base.addAll(passives);
        for (AbilityDefinition ability : base) {
            AbilityDefinition current = ability;
            for (Modifier modifier : modifiers) {
                current = modifier.apply(current);
            }
            composed.add(current);
        }
        return composed;
    }
}
