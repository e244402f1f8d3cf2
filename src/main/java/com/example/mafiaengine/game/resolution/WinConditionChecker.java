package com.example.mafiaengine.game.resolution;

import com.example.mafiaengine.game.domain.Alignment;
import com.example.mafiaengine.game.domain.GamePlayer;
import com.example.mafiaengine.game.domain.GameState;
import com.example.mafiaengine.game.domain.GameStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Slf4j
@Component
public class WinConditionChecker {

    /**
     * 승리 조건을 만족하는 진영이 정확히 하나면 게임을 RESOLVED로 전환
     */
    public Optional<Alignment> check(GameState game) {
        List<Alignment> satisfied = game.getPlayers().values().stream()
                .map(GamePlayer::getAlignment)
                .distinct()
                .filter(alignment -> alignment.getWinCondition() != null)
                .filter(alignment -> alignment.getWinCondition().isSatisfied(game, alignment))
                .toList();

        if (satisfied.size() > 1) {
            log.warn("[승리판정] 여러 진영이 동시에 조건 충족, 게임 계속: gameId={}, alignments={}",
                    game.getGameId(), satisfied.stream().map(Alignment::getId).toList());
            return Optional.empty();
        }
        if (satisfied.isEmpty()) {
            return Optional.empty();
        }

        Alignment winner = satisfied.get(0);
        game.setStatus(GameStatus.RESOLVED);
        game.setWinner(winner.getId());
        game.getChats().announce("The " + winner.getId() + " has won!");
        log.info("[승리판정] 게임 종료: gameId={}, winner={}", game.getGameId(), winner.getId());
        return Optional.of(winner);
    }
}
