package com.example.mafiaengine.game.state;

import com.example.mafiaengine.game.domain.GamePhase;
import com.example.mafiaengine.game.domain.GameState;
import com.example.mafiaengine.global.error.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * DAY(n) -> NIGHT(n) -> DAY(n+1) ... 전환. RESOLVED는 종착 상태.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GameStateMachine {

    private final GamePhaseFactory gamePhaseFactory;

    public void nextPhase(GameState game) {
        if (game.isResolved()) {
            throw ErrorCode.ILLEGAL_PHASE_TRANSITION.commonException("game is resolved");
        }
        boolean unresolved = game.getQueue().snapshot().stream()
                .anyMatch(queued -> queued.isStampedFor(game.getDayNo(), game.getGamePhase()));
        if (unresolved) {
            throw ErrorCode.ILLEGAL_PHASE_TRANSITION.commonException("resolve the current phase first");
        }

        GamePhaseState current = gamePhaseFactory.getState(game.getGamePhase());
        current.onExit(game);
        game.clearQueue();
        GamePhaseState next = current.nextState(game);
        next.enter(game);

        log.info("[페이즈] 전환: gameId={}, {} -> {}, day={}",
                game.getGameId(), current.getGamePhase(), next.getGamePhase(), game.getDayNo());
    }

    /**
     * 모더레이터가 일차/페이즈를 직접 지정
     */
    public void setTime(GameState game, GamePhase phase, int dayNo) {
        if (game.isResolved()) {
            throw ErrorCode.ILLEGAL_PHASE_TRANSITION.commonException("game is resolved");
        }
        if (dayNo < 1) {
            throw ErrorCode.ILLEGAL_PHASE_TRANSITION.commonException("day number must be at least 1");
        }
        gamePhaseFactory.getState(game.getGamePhase()).onExit(game);
        game.clearQueue();
        game.setGamePhase(phase);
        game.setDayNo(dayNo);

        log.info("[페이즈] 직접 지정: gameId={}, phase={}, day={}", game.getGameId(), phase, dayNo);
    }
}
