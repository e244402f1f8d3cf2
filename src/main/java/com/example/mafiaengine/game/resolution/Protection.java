package com.example.mafiaengine.game.resolution;

import com.example.mafiaengine.game.ability.AbilityTags;
import lombok.Builder;
import lombok.Getter;

/**
 * 이번 해결 패스 동안 대상에게 걸린 보호
 */
@Getter
@Builder
public class Protection {

    private final PendingAction source;

    // 막을 수 있는 남은 횟수, null이면 무제한
    private Integer remaining;

    // 보디가드: 대신 죽는다
    private final boolean diesInstead;

    public boolean isExhausted() {
        return remaining != null && remaining <= 0;
    }

    /**
     * Personal 보호는 진영 공유 능력을 막지 못한다
     */
    public boolean covers(PendingAction attack) {
        return !(source.getAbility().hasTag(AbilityTags.PERSONAL) && attack.getInstance().isShared());
    }

    public void consume() {
        if (remaining != null) {
            remaining--;
        }
        source.markUsed();
    }
}
