package com.example.mafiaengine.game.domain;

import com.example.mafiaengine.game.ability.AbilityInstance;
import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Getter
@Builder
public class GamePlayer {

    private final String name;
    private final Role role;
    private final Alignment alignment;

    // 사망 원인 (비어 있으면 생존)
    @Builder.Default
    private final List<String> deathCauses = new ArrayList<>();

    @Builder.Default
    private final List<AbilityInstance> actions = new ArrayList<>();

    // 진영 공유 능력 (같은 인스턴스를 진영원이 함께 참조)
    @Builder.Default
    private final List<AbilityInstance> sharedActions = new ArrayList<>();

    @Builder.Default
    private final List<AbilityInstance> passives = new ArrayList<>();

    public boolean isAlive() {
        return deathCauses.isEmpty();
    }

    public void kill(String cause) {
        deathCauses.add(cause);
    }

    public List<String> getDeathCauses() {
        return Collections.unmodifiableList(deathCauses);
    }

    public String getRoleName() {
        return RoleNames.of(role, alignment);
    }

    public boolean hasTag(String tag) {
        return role.hasTag(tag) || alignment.hasTag(tag);
    }

    public boolean isTown() {
        return alignment.hasTag("town");
    }

    public boolean isAlliedWith(GamePlayer other) {
        return alignment == other.alignment;
    }
}
