package com.example.mafiaengine.game.service;

import com.example.mafiaengine.game.domain.GamePlayer;
import com.example.mafiaengine.game.domain.GameState;
import com.example.mafiaengine.game.dto.response.VoteTallyResponse.VoteCount;
import com.example.mafiaengine.global.error.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 투표 서비스
 * - 낮 처형 투표, 투표 취소, 집계
 * - 호출자가 게임 락을 잡은 상태에서 호출한다
 */
@Slf4j
@Service
public class VoteService {

    public static final String NO_ELIMINATION = "No Elimination";

    // ================= 투표 처리 =================

    /**
     * @param targetName null이면 처형 없음
     */
    public void vote(GameState game, String voterName, String targetName) {
        requireVotingOpen(game);
        GamePlayer voter = requireLivingVoter(game, voterName);
        if (targetName != null) {
            game.findPlayer(targetName)
                    .filter(GamePlayer::isAlive)
                    .orElseThrow(() -> ErrorCode.INVALID_TARGET.commonException(targetName));
        }

        game.getVotes().put(voter.getName(), targetName);
        game.getChats().announce(voter.getName() + " voted for "
                + (targetName == null ? "no elimination" : targetName) + ".");
        log.debug("[투표] 성공: gameId={}, voter={}, target={}", game.getGameId(), voterName, targetName);
    }

    public void unvote(GameState game, String voterName) {
        requireVotingOpen(game);
        GamePlayer voter = requireLivingVoter(game, voterName);
        if (!game.getVotes().containsKey(voter.getName())) {
            return;
        }
        game.getVotes().remove(voter.getName());
        game.getChats().announce(voter.getName() + " removed their vote.");
        log.debug("[투표] 취소: gameId={}, voter={}", game.getGameId(), voterName);
    }

    public void clearVotes(GameState game) {
        game.getVotes().clear();
        log.debug("[투표] 초기화: gameId={}", game.getGameId());
    }

    // ================= 투표 결과 계산 =================

    /**
     * 득표 많은 순, 같으면 먼저 표를 받은 순
     */
    public List<VoteCount> tally(GameState game) {
        Map<String, List<String>> votersByTarget = new LinkedHashMap<>();
        game.getVotes().forEach((voter, target) -> votersByTarget
                .computeIfAbsent(target == null ? NO_ELIMINATION : target, k -> new ArrayList<>())
                .add(voter));
        return votersByTarget.entrySet().stream()
                .map(entry -> new VoteCount(entry.getKey(), entry.getValue().size(), List.copyOf(entry.getValue())))
                .sorted(Comparator.comparingInt(VoteCount::count).reversed())
                .toList();
    }

    /**
     * 현재 집계를 전체 채팅에 공지
     */
    public void postVoteCount(GameState game) {
        List<VoteCount> counts = tally(game);
        String body = counts.isEmpty()
                ? "No votes."
                : counts.stream()
                        .map(count -> count.target() + " (" + count.count() + "): " + String.join(", ", count.voters()))
                        .collect(Collectors.joining("\n"));
        game.getChats().announce("Vote count:\n" + body);
    }

    private void requireVotingOpen(GameState game) {
        if (game.isResolved()) {
            throw ErrorCode.GAME_ALREADY_RESOLVED.commonException();
        }
        if (!game.getVotingPhases().contains(game.getGamePhase())) {
            throw ErrorCode.NOT_VOTING_PHASE.commonException();
        }
    }

    private GamePlayer requireLivingVoter(GameState game, String voterName) {
        GamePlayer voter = game.getPlayer(voterName);
        if (!voter.isAlive()) {
            throw ErrorCode.FORBIDDEN.commonException("dead players cannot vote");
        }
        return voter;
    }
}
