package com.example.mafiaengine.game.state;

import com.example.mafiaengine.game.domain.GamePhase;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 페이즈별 상태를 제공하는 Factory
 */
@Component
@RequiredArgsConstructor
public class GamePhaseFactory {

    private final DayPhaseState dayPhaseState;
    private final NightPhaseState nightPhaseState;

    /**
     * 현재 페이즈에 맞는 상태 객체 반환
     */
    public GamePhaseState getState(GamePhase phase) {
        return switch (phase) {
            case DAY -> dayPhaseState;
            case NIGHT -> nightPhaseState;
        };
    }
}
