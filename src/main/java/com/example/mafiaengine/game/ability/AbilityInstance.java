package com.example.mafiaengine.game.ability;

import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * 게임 안에서 특정 소유자(플레이어 또는 진영)가 가진 능력의 가변 상태
 */
@Getter
@Setter
public class AbilityInstance {

    // 플레이어 이름 또는 "alignment:{id}"
    private final String owner;
    private final AbilityDefinition definition;

    private int uses;
    private Integer lastUsedDay;
    private List<String> lastTargets = List.of();
    private boolean active = true;

    // 공유 능력을 이번 페이즈에 예약한 진영원
    private String usedBy;

    public AbilityInstance(String owner, AbilityDefinition definition) {
        this.owner = owner;
        this.definition = definition;
    }

    public String getKey() {
        return owner + ":" + definition.getId();
    }

    public String getAbilityId() {
        return definition.getId();
    }

    public boolean isShared() {
        return definition.getKind() == AbilityKind.SHARED_ACTION;
    }

    public boolean isPassive() {
        return definition.getKind() == AbilityKind.PASSIVE;
    }

    public void recordUse(int dayNo, List<String> targets) {
        uses++;
        lastUsedDay = dayNo;
        lastTargets = List.copyOf(targets);
    }
}
