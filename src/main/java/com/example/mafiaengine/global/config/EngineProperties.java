package com.example.mafiaengine.global.config;

import com.example.mafiaengine.game.ability.AbilityCategory;
import com.example.mafiaengine.game.domain.GamePhase;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Set;

@ConfigurationProperties(prefix = "mafia.engine")
public record EngineProperties(
        // 게임 생성 기본값
        GamePhase defaultPhase,   // 시작 페이즈
        int defaultDayNo,         // 시작 일차

        // 해결 순서 (같은 우선순위일 때의 카테고리 순서)
        List<AbilityCategory> categoryOrder,

        // 채팅 / 투표 허용 페이즈
        Set<GamePhase> chatPhases,
        Set<GamePhase> votingPhases,

        int messagePageSize       // limit 미지정 시 기본 페이지 크기
) {

    public static EngineProperties defaults() {
        return new EngineProperties(
                GamePhase.DAY,
                1,
                List.of(AbilityCategory.CONTROL, AbilityCategory.PROTECTIVE, AbilityCategory.INFORMATIONAL,
                        AbilityCategory.OFFENSIVE, AbilityCategory.CLEANUP),
                Set.of(GamePhase.DAY),
                Set.of(GamePhase.DAY),
                25);
    }
}
