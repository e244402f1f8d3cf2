package com.example.mafiaengine.game.dto.response;

import com.example.mafiaengine.game.domain.GamePhase;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AbilityStatusView(
        String id,
        String description,
        GamePhase phase,
        int targetCount,
        boolean immediate,
        boolean eligible,
        int uses,
        // 예약된 대상 (예약 없으면 null)
        List<String> queued,
        // 공유 능력을 예약한 진영원
        String usedBy) {
}
