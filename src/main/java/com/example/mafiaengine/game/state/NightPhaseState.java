package com.example.mafiaengine.game.state;

import com.example.mafiaengine.game.domain.GamePhase;
import com.example.mafiaengine.game.domain.GameState;
import org.springframework.stereotype.Component;

/**
 * 밤 페이즈 상태
 */
@Component
public class NightPhaseState implements GamePhaseState {

    /**
     * 일차는 그대로 두고 페이즈만 바꾼다
     */
    @Override
    public void enter(GameState gameState) {
        gameState.setGamePhase(GamePhase.NIGHT);
    }

    @Override
    public void onExit(GameState gameState) {
        gameState.getVotes().clear();
    }

    @Override
    public GamePhaseState nextState(GameState gameState) {
        // dayNo 증가는 DayPhaseState.enter()에서 처리
        return new DayPhaseState();
    }

    @Override
    public GamePhase getGamePhase() {
        return GamePhase.NIGHT;
    }
}
