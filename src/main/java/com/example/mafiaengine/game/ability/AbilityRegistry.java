package com.example.mafiaengine.game.ability;

import com.example.mafiaengine.game.domain.GamePlayer;
import com.example.mafiaengine.global.error.ErrorCode;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * 게임별 능력 인스턴스 색인 (key = owner:abilityId)
 */
public class AbilityRegistry {

    private final Map<String, AbilityInstance> instances = new LinkedHashMap<>();

    public void register(AbilityInstance instance) {
        AbilityInstance existing = instances.putIfAbsent(instance.getKey(), instance);
        if (existing != null && existing != instance) {
            throw new IllegalStateException("duplicate ability instance: " + instance.getKey());
        }
    }

    public Optional<AbilityInstance> get(String key) {
        return Optional.ofNullable(instances.get(key));
    }

    public Collection<AbilityInstance> all() {
        return Collections.unmodifiableCollection(instances.values());
    }

    /**
     * 플레이어가 큐에 넣을 수 있는 능력(액션, 공유 액션)을 id로 찾는다.
     * 패시브는 큐 대상이 아니다.
     */
    public AbilityInstance lookup(GamePlayer user, String abilityId) {
        return Stream.concat(user.getActions().stream(), user.getSharedActions().stream())
                .filter(instance -> instance.getAbilityId().equals(abilityId))
                .findFirst()
                .orElseThrow(() -> ErrorCode.UNKNOWN_ABILITY.commonException(abilityId));
    }
}
