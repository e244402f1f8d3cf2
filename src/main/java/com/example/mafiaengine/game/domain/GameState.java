package com.example.mafiaengine.game.domain;

import com.example.mafiaengine.chat.domain.ChatRegistry;
import com.example.mafiaengine.game.ability.AbilityInstance;
import com.example.mafiaengine.game.ability.AbilityRegistry;
import com.example.mafiaengine.game.knowledge.KnowledgeBase;
import com.example.mafiaengine.game.queue.AbilityQueue;
import com.example.mafiaengine.game.resolution.ResolutionLogEntry;
import com.example.mafiaengine.global.error.ErrorCode;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 게임 하나의 전체 상태. 게임 락 안에서만 읽고 쓴다.
 */
@Getter
@Setter
@Builder
public class GameState {

    private String gameId;
    private String modToken;

    @Builder.Default
    private GameStatus status = GameStatus.IN_PROGRESS;

    @Builder.Default
    private GamePhase gamePhase = GamePhase.DAY;

    @Builder.Default
    private int dayNo = 1;

    // 승리 진영 id
    private String winner;

    // 이름 -> 플레이어 (생성 순서 유지)
    @Builder.Default
    private Map<String, GamePlayer> players = new LinkedHashMap<>();

    @Builder.Default
    private AbilityRegistry abilityRegistry = new AbilityRegistry();

    @Builder.Default
    private AbilityQueue queue = new AbilityQueue();

    @Builder.Default
    private KnowledgeBase knowledge = new KnowledgeBase();

    private ChatRegistry chats;

    // 투표자 -> 대상 (null = 처형 없음)
    @Builder.Default
    private Map<String, String> votes = new LinkedHashMap<>();

    @Builder.Default
    private List<ResolutionLogEntry> resolutionLog = new ArrayList<>();

    @Builder.Default
    private Set<GamePhase> chatPhases = Set.of(GamePhase.DAY);

    @Builder.Default
    private Set<GamePhase> votingPhases = Set.of(GamePhase.DAY);

    private long sequence;

    public long nextSequence() {
        return ++sequence;
    }

    /**
     * 큐를 비우고 공유 능력의 예약자도 해제
     */
    public void clearQueue() {
        queue.clear();
        abilityRegistry.all().stream()
                .filter(AbilityInstance::isShared)
                .forEach(instance -> instance.setUsedBy(null));
    }

    public boolean isResolved() {
        return status == GameStatus.RESOLVED;
    }

    public void addPlayer(GamePlayer player) {
        players.put(player.getName(), player);
    }

    public Optional<GamePlayer> findPlayer(String name) {
        return Optional.ofNullable(name).map(players::get);
    }

    public GamePlayer getPlayer(String name) {
        return findPlayer(name).orElseThrow(() -> ErrorCode.PLAYER_NOT_FOUND.commonException(name));
    }

    public List<GamePlayer> alivePlayers() {
        return players.values().stream().filter(GamePlayer::isAlive).toList();
    }
}
