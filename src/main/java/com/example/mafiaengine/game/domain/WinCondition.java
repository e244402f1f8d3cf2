package com.example.mafiaengine.game.domain;

/**
 * 진영 승리 조건. 해결이 끝날 때마다 현재 플레이어 상태로 평가된다.
 */
@FunctionalInterface
public interface WinCondition {

    boolean isSatisfied(GameState gameState, Alignment alignment);
}
