package com.example.mafiaengine.game.domain;

import java.util.List;

public final class WinConditions {

    private WinConditions() {
    }

    /**
     * 자기 진영이 살아있고 다른 진영은 모두 죽었을 때
     */
    public static WinCondition lastStanding() {
        return (gameState, alignment) -> {
            List<GamePlayer> alive = gameState.alivePlayers();
            return alive.stream().anyMatch(p -> p.getAlignment() == alignment)
                    && alive.stream().allMatch(p -> p.getAlignment() == alignment);
        };
    }

    /**
     * lastStanding + 아무도 살아있지 않은 경우도 승리 (연쇄살인마)
     */
    public static WinCondition lastStandingOrNobodyAlive() {
        WinCondition lastStanding = lastStanding();
        return (gameState, alignment) -> gameState.alivePlayers().isEmpty()
                || lastStanding.isSatisfied(gameState, alignment);
    }
}
