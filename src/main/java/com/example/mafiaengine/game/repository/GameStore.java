package com.example.mafiaengine.game.repository;

import com.example.mafiaengine.game.domain.GameState;
import com.example.mafiaengine.global.error.ErrorCode;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 메모리 게임 저장소. 게임은 프로세스가 살아있는 동안 유지된다.
 */
@Repository
public class GameStore {

    // Game id Prefix
    private static final String KEY_PREFIX = "game_";

    private final Map<String, GameState> games = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public String nextId() {
        return KEY_PREFIX + sequence.incrementAndGet();
    }

    public void save(GameState gameState) {
        games.put(gameState.getGameId(), gameState);
    }

    public Optional<GameState> findById(String gameId) {
        return Optional.ofNullable(games.get(gameId));
    }

    public GameState getById(String gameId) {
        return findById(gameId).orElseThrow(() -> ErrorCode.GAME_NOT_FOUND.commonException(gameId));
    }
}
