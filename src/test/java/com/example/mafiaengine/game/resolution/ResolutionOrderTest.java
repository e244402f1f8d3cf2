package com.example.mafiaengine.game.resolution;

import com.example.mafiaengine.game.ability.AbilityCategory;
import com.example.mafiaengine.game.ability.AbilityDefinition;
import com.example.mafiaengine.game.ability.AbilityInstance;
import com.example.mafiaengine.game.domain.GamePlayer;
import com.example.mafiaengine.global.config.EngineProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResolutionOrderTest {

    private final GamePlayer user = GamePlayer.builder().name("Alice").build();

    @Test
    @DisplayName("카테고리 순서에 빠진 항목이나 중복이 있으면 거부한다")
    void rejectsPartialOrder() {
        assertThatThrownBy(() -> new ResolutionOrder(List.of(AbilityCategory.CONTROL, AbilityCategory.OFFENSIVE)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ResolutionOrder(List.of(
                AbilityCategory.CONTROL, AbilityCategory.CONTROL, AbilityCategory.PROTECTIVE,
                AbilityCategory.INFORMATIONAL, AbilityCategory.OFFENSIVE)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ResolutionOrder(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("우선순위 -> 카테고리 -> 삽입 순서로 정렬한다")
    void sortsByPriorityThenCategoryThenSequence() {
        // given
        ResolutionOrder order = new ResolutionOrder(EngineProperties.defaults().categoryOrder());
        PendingAction lateKill = action("late kill", 40, AbilityCategory.OFFENSIVE, 1);
        PendingAction protect = action("protect", 40, AbilityCategory.PROTECTIVE, 2);
        PendingAction block = action("block", 10, AbilityCategory.CONTROL, 5);
        PendingAction earlyKill = action("early kill", 40, AbilityCategory.OFFENSIVE, 0);
        List<PendingAction> actions = new ArrayList<>(List.of(lateKill, protect, block, earlyKill));

        // when
        actions.sort(order);

        // then
        assertThat(actions).containsExactly(block, protect, earlyKill, lateKill);
    }

    @Test
    @DisplayName("설정한 카테고리 순서를 그대로 따른다")
    void honoursConfiguredCategoryOrder() {
        // given
        ResolutionOrder order = new ResolutionOrder(List.of(
                AbilityCategory.OFFENSIVE, AbilityCategory.CONTROL, AbilityCategory.PROTECTIVE,
                AbilityCategory.INFORMATIONAL, AbilityCategory.CLEANUP));
        PendingAction protect = action("protect", 40, AbilityCategory.PROTECTIVE, 0);
        PendingAction kill = action("kill", 40, AbilityCategory.OFFENSIVE, 1);

        // when & then
        assertThat(order.compare(kill, protect)).isNegative();
        assertThat(order.getCategoryOrder()).startsWith(AbilityCategory.OFFENSIVE);
    }

    private PendingAction action(String id, int priority, AbilityCategory category, long sequence) {
        AbilityDefinition definition = AbilityDefinition.builder()
                .id(id)
                .priority(priority)
                .category(category)
                .build();
        return PendingAction.queued(new AbilityInstance(user.getName(), definition), user, List.of(), sequence);
    }
}
