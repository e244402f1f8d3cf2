package com.example.mafiaengine.game.state;

import com.example.mafiaengine.game.domain.GamePhase;
import com.example.mafiaengine.game.domain.GameState;

/**
 * 게임 페이즈 상태 인터페이스 (State Pattern)
 */
public interface GamePhaseState {

    /**
     * 현재 페이즈 진입 시 처리
     *
     * @param gameState 게임 상태
     */
    void enter(GameState gameState);

    /**
     * 현재 페이즈 종료 시 정리 (투표 초기화 등)
     * nextPhase에서 다음 페이즈로 넘어가기 전에 호출됨
     *
     * @param gameState 게임 상태
     */
    void onExit(GameState gameState);

    /**
     * 다음 페이즈 상태
     */
    GamePhaseState nextState(GameState gameState);

    /**
     * 현재 페이즈 종류 반환
     */
    GamePhase getGamePhase();
}
