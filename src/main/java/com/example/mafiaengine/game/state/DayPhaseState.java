package com.example.mafiaengine.game.state;

import com.example.mafiaengine.game.domain.GamePhase;
import com.example.mafiaengine.game.domain.GameState;
import org.springframework.stereotype.Component;

/**
 * 낮 페이즈 상태
 */
@Component
public class DayPhaseState implements GamePhaseState {

    /**
     * 밤에서 넘어올 때 호출되므로 일차를 하나 올린다
     */
    @Override
    public void enter(GameState gameState) {
        gameState.setDayNo(gameState.getDayNo() + 1);
        gameState.setGamePhase(GamePhase.DAY);
    }

    @Override
    public void onExit(GameState gameState) {
        // 낮 페이즈 데이터 정리
        gameState.getVotes().clear();
    }

    @Override
    public GamePhaseState nextState(GameState gameState) {
        return new NightPhaseState();
    }

    @Override
    public GamePhase getGamePhase() {
        return GamePhase.DAY;
    }
}
