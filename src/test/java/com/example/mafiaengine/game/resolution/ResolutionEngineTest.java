package com.example.mafiaengine.game.resolution;

import com.example.mafiaengine.chat.domain.ChatMessage;
import com.example.mafiaengine.chat.domain.ChatRegistry;
import com.example.mafiaengine.game.TestGames;
import com.example.mafiaengine.game.ability.AbilityCategory;
import com.example.mafiaengine.game.catalog.RoleCatalog;
import com.example.mafiaengine.game.catalog.StandardAbilities;
import com.example.mafiaengine.game.domain.GamePhase;
import com.example.mafiaengine.game.domain.GameState;
import com.example.mafiaengine.game.domain.GameStatus;
import com.example.mafiaengine.game.domain.Role;
import com.example.mafiaengine.game.knowledge.KnowledgeFact;
import com.example.mafiaengine.game.queue.AbilityQueueService;
import com.example.mafiaengine.global.error.CommonException;
import com.example.mafiaengine.global.error.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResolutionEngineTest {

    private final ResolutionEngine engine = TestGames.engine();
    private final AbilityQueueService queueService = TestGames.queueService();

    @Test
    @DisplayName("경찰이 마피아를 조사하면 진영을 알게 되고 다음 페이즈는 DAY(2)")
    void copLearnsAlignment() {
        // given
        GameState game = TestGames.game(GamePhase.NIGHT, 1,
                "Alice:Town:Cop", "Bob:Town:Vanilla", "Eve:Mafia:Vanilla");
        queueService.queue(game, "Alice", "Investigate", List.of("Eve"));

        // when
        engine.resolve(game);
        TestGames.stateMachine().nextPhase(game);

        // then
        assertThat(game.getKnowledge().knows("Alice", "Eve"))
                .map(KnowledgeFact::alignmentId)
                .contains("Mafia");
        assertThat(lastMessage(game, ChatRegistry.inboxId("Alice")))
                .isEqualTo("Eve is aligned with the Mafia.");
        assertThat(game.getGamePhase()).isEqualTo(GamePhase.DAY);
        assertThat(game.getDayNo()).isEqualTo(2);
    }

    @Test
    @DisplayName("의사가 먼저 보호하면 마피아 살해는 BLOCKED로 기록되고 대상은 산다")
    void doctorBlocksFactionalKill() {
        // given
        GameState game = TestGames.game(GamePhase.NIGHT, 1,
                "Alice:Town:Cop", "Bob:Town:Doctor", "Eve:Mafia:Vanilla");
        queueService.queue(game, "Eve", "Factional Kill", List.of("Alice"));
        queueService.queue(game, "Bob", "Protect", List.of("Alice"));

        // when
        List<ResolutionLogEntry> entries = engine.resolve(game);

        // then
        assertThat(game.getPlayer("Alice").isAlive()).isTrue();
        assertThat(outcomes(entries))
                .containsEntry("Protect", ResolutionOutcome.SUCCESS)
                .containsEntry("Factional Kill", ResolutionOutcome.BLOCKED);
        assertThat(entries).extracting(ResolutionLogEntry::abilityId)
                .containsExactly("Protect", "Factional Kill");
    }

    @Test
    @DisplayName("살해 이후에 해결되는 보호는 효과가 없다")
    void protectionAfterKillHasNoEffect() {
        // given
        RoleCatalog catalog = TestGames.catalog();
        catalog.registerRole(Role.builder()
                .id("Late Doctor")
                .actions(List.of(StandardAbilities.protect().toBuilder()
                        .priority(StandardAbilities.KILL_PRIORITY + 10)
                        .build()))
                .build());
        GameState game = TestGames.game(catalog, GamePhase.NIGHT, 1,
                "Alice:Town:Cop", "Bob:Town:Late Doctor", "Carol:Town:Vanilla", "Eve:Mafia:Vanilla");
        queueService.queue(game, "Bob", "Protect", List.of("Alice"));
        queueService.queue(game, "Eve", "Factional Kill", List.of("Alice"));

        // when
        List<ResolutionLogEntry> entries = engine.resolve(game);

        // then
        assertThat(game.getPlayer("Alice").isAlive()).isFalse();
        assertThat(outcomes(entries))
                .containsEntry("Factional Kill", ResolutionOutcome.SUCCESS)
                .containsEntry("Protect", ResolutionOutcome.FIZZLED);
    }

    @Test
    @DisplayName("우선순위가 같으면 카테고리 순서가 결과를 결정한다")
    void categoryOrderBreaksPriorityTies() {
        // given
        RoleCatalog catalog = TestGames.catalog();
        catalog.registerRole(Role.builder()
                .id("Even Doctor")
                .actions(List.of(StandardAbilities.protect().toBuilder()
                        .priority(StandardAbilities.KILL_PRIORITY)
                        .build()))
                .build());
        String[] players = {"Alice:Town:Cop", "Bob:Town:Even Doctor", "Carol:Town:Vanilla", "Eve:Mafia:Vanilla"};

        GameState protectFirst = TestGames.game(catalog, GamePhase.NIGHT, 1, players);
        queueService.queue(protectFirst, "Eve", "Factional Kill", List.of("Alice"));
        queueService.queue(protectFirst, "Bob", "Protect", List.of("Alice"));

        GameState killFirst = TestGames.game(catalog, GamePhase.NIGHT, 1, players);
        queueService.queue(killFirst, "Eve", "Factional Kill", List.of("Alice"));
        queueService.queue(killFirst, "Bob", "Protect", List.of("Alice"));
        ResolutionEngine offensiveFirst = new ResolutionEngine(new ResolutionOrder(List.of(
                AbilityCategory.CONTROL, AbilityCategory.OFFENSIVE, AbilityCategory.PROTECTIVE,
                AbilityCategory.INFORMATIONAL, AbilityCategory.CLEANUP)), new WinConditionChecker());

        // when
        engine.resolve(protectFirst);
        offensiveFirst.resolve(killFirst);

        // then
        assertThat(protectFirst.getPlayer("Alice").isAlive()).isTrue();
        assertThat(killFirst.getPlayer("Alice").isAlive()).isFalse();
    }

    @Test
    @DisplayName("롤블락이 먼저 해결되면 대상의 능력은 FIZZLED로 기록된다")
    void roleblockFizzlesTargetAction() {
        // given
        GameState game = TestGames.game(GamePhase.NIGHT, 1,
                "Rita:Town:Roleblocker", "Alice:Town:Cop", "Bob:Town:Vanilla", "Eve:Mafia:Vanilla");
        queueService.queue(game, "Eve", "Factional Kill", List.of("Alice"));
        queueService.queue(game, "Rita", "Roleblock", List.of("Eve"));

        // when
        List<ResolutionLogEntry> entries = engine.resolve(game);

        // then
        assertThat(game.getPlayer("Alice").isAlive()).isTrue();
        ResolutionLogEntry kill = entries.stream()
                .filter(entry -> entry.abilityId().equals("Factional Kill"))
                .findFirst()
                .orElseThrow();
        assertThat(kill.outcome()).isEqualTo(ResolutionOutcome.FIZZLED);
        assertThat(kill.detail()).contains("roleblocked by Rita");
        // 막혀도 사용 횟수는 소모된다
        assertThat(game.getAbilityRegistry().get("alignment:Mafia:Factional Kill").orElseThrow().getUses())
                .isEqualTo(1);
    }

    @Test
    @DisplayName("막힌 조사는 \"No result\"를 받고 아무것도 알지 못한다")
    void blockedInvestigationReportsNoResult() {
        // given
        GameState game = TestGames.game(GamePhase.NIGHT, 1,
                "Rita:Mafia:Roleblocker", "Alice:Town:Cop", "Bob:Town:Vanilla");
        queueService.queue(game, "Alice", "Investigate", List.of("Rita"));
        queueService.queue(game, "Rita", "Roleblock", List.of("Alice"));

        // when
        engine.resolve(game);

        // then
        assertThat(game.getKnowledge().knows("Alice", "Rita")).isEmpty();
        assertThat(lastMessage(game, ChatRegistry.inboxId("Alice"))).isEqualTo("No result");
    }

    @Test
    @DisplayName("같은 큐 스냅샷을 해결하면 로그와 플레이어 상태가 항상 같다")
    void resolutionIsDeterministic() {
        // given
        GameState first = deterministicScenario();
        GameState second = deterministicScenario();

        // when
        List<ResolutionLogEntry> firstLog = engine.resolve(first);
        List<ResolutionLogEntry> secondLog = engine.resolve(second);

        // then
        assertThat(firstLog).isEqualTo(secondLog);
        assertThat(aliveMap(first)).isEqualTo(aliveMap(second));
    }

    private GameState deterministicScenario() {
        GameState game = TestGames.game(GamePhase.NIGHT, 1,
                "Rita:Town:Roleblocker", "Dan:Town:Doctor", "Vic:Town:Vigilante", "Alice:Town:Cop",
                "Eve:Mafia:Vanilla", "Sam:Mafia:Roleblocker");
        queueService.queue(game, "Vic", "Kill", List.of("Sam"));
        queueService.queue(game, "Eve", "Factional Kill", List.of("Alice"));
        queueService.queue(game, "Dan", "Protect", List.of("Alice"));
        queueService.queue(game, "Sam", "Roleblock", List.of("Dan"));
        queueService.queue(game, "Rita", "Roleblock", List.of("Vic"));
        queueService.queue(game, "Alice", "Investigate", List.of("Eve"));
        return game;
    }

    @Test
    @DisplayName("앞선 해결로 죽은 대상을 노린 능력은 FIZZLED")
    void abilityOnDeadTargetFizzles() {
        // given
        GameState game = TestGames.game(GamePhase.NIGHT, 1,
                "Vic:Town:Vigilante", "Alice:Town:Vanilla", "Bob:Town:Vanilla", "Eve:Mafia:Vanilla");
        queueService.queue(game, "Vic", "Kill", List.of("Bob"));
        queueService.queue(game, "Eve", "Factional Kill", List.of("Bob"));

        // when
        List<ResolutionLogEntry> entries = engine.resolve(game);

        // then
        assertThat(entries).extracting(ResolutionLogEntry::outcome)
                .containsExactly(ResolutionOutcome.SUCCESS, ResolutionOutcome.FIZZLED);
        assertThat(entries.get(1).detail()).contains("Bob is dead");
        assertThat(game.getPlayer("Bob").getDeathCauses()).containsExactly("Shot by a Vigilante");
    }

    @Test
    @DisplayName("리다이렉트는 아직 해결되지 않은 능력의 대상을 바꾼다")
    void redirectRetargetsPendingAction() {
        // given
        GameState game = TestGames.game(GamePhase.NIGHT, 1,
                "Red:Town:Redirector", "Alice:Town:Vanilla", "Bob:Town:Vanilla", "Eve:Mafia:Vanilla");
        queueService.queue(game, "Eve", "Factional Kill", List.of("Alice"));
        queueService.queue(game, "Red", "Redirect", List.of("Eve", "Bob"));

        // when
        List<ResolutionLogEntry> entries = engine.resolve(game);

        // then
        assertThat(game.getPlayer("Alice").isAlive()).isTrue();
        assertThat(game.getPlayer("Bob").isAlive()).isFalse();
        assertThat(entries.get(1).targets()).containsExactly("Bob");
    }

    @Test
    @DisplayName("보디가드는 대상 대신 죽는다")
    void bodyguardDiesInstead() {
        // given
        GameState game = TestGames.game(GamePhase.NIGHT, 1,
                "Gus:Town:Bodyguard", "Alice:Town:Vanilla", "Bob:Town:Vanilla", "Eve:Mafia:Vanilla");
        queueService.queue(game, "Gus", "Guard", List.of("Alice"));
        queueService.queue(game, "Eve", "Factional Kill", List.of("Alice"));

        // when
        List<ResolutionLogEntry> entries = engine.resolve(game);

        // then
        assertThat(game.getPlayer("Alice").isAlive()).isTrue();
        assertThat(game.getPlayer("Gus").getDeathCauses()).containsExactly("Died protecting Alice");
        assertThat(outcomes(entries)).containsEntry("Factional Kill", ResolutionOutcome.BLOCKED);
    }

    @Test
    @DisplayName("방탄 패시브는 큐 없이 발동해서 밤 살해를 막는다")
    void bulletproofPassiveFires() {
        // given
        GameState game = TestGames.game(GamePhase.NIGHT, 1,
                "Bea:Town:Bulletproof", "Alice:Town:Vanilla", "Eve:Mafia:Vanilla");
        queueService.queue(game, "Eve", "Factional Kill", List.of("Bea"));

        // when
        List<ResolutionLogEntry> entries = engine.resolve(game);

        // then
        assertThat(game.getPlayer("Bea").isAlive()).isTrue();
        assertThat(outcomes(entries))
                .containsEntry("Bulletproof", ResolutionOutcome.SUCCESS)
                .containsEntry("Factional Kill", ResolutionOutcome.BLOCKED);
    }

    @Test
    @DisplayName("감시자는 대상을 방문한 플레이어를 이름순으로 받는다")
    void watcherSeesVisitors() {
        // given
        GameState game = TestGames.game(GamePhase.NIGHT, 1,
                "Wendy:Town:Watcher", "Dan:Town:Doctor", "Bob:Town:Vanilla", "Eve:Mafia:Vanilla");
        queueService.queue(game, "Wendy", "Watch", List.of("Bob"));
        queueService.queue(game, "Eve", "Factional Kill", List.of("Bob"));
        queueService.queue(game, "Dan", "Protect", List.of("Bob"));

        // when
        engine.resolve(game);

        // then
        assertThat(lastMessage(game, ChatRegistry.inboxId("Wendy"))).isEqualTo("Bob was visited by Dan, Eve.");
    }

    @Test
    @DisplayName("다른 일차에 예약된 항목은 EXPIRED로 기록되고 해결되지 않는다")
    void staleEntriesExpire() {
        // given
        GameState game = TestGames.game(GamePhase.NIGHT, 1,
                "Alice:Town:Cop", "Bob:Town:Vanilla", "Eve:Mafia:Vanilla");
        queueService.queue(game, "Alice", "Investigate", List.of("Eve"));
        game.setDayNo(2);

        // when
        List<ResolutionLogEntry> entries = engine.resolve(game);

        // then
        assertThat(entries).extracting(ResolutionLogEntry::outcome).containsExactly(ResolutionOutcome.EXPIRED);
        assertThat(game.getKnowledge().knows("Alice", "Eve")).isEmpty();
        assertThat(game.getQueue().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("승리 조건을 만족하면 RESOLVED가 되고 이후 큐/해결은 거부된다")
    void winConditionResolvesGame() {
        // given
        GameState game = TestGames.game(GamePhase.NIGHT, 1,
                "Vic:Town:Vigilante", "Bob:Town:Vanilla", "Eve:Mafia:Vanilla");
        queueService.queue(game, "Vic", "Kill", List.of("Eve"));

        // when
        engine.resolve(game);

        // then
        assertThat(game.getStatus()).isEqualTo(GameStatus.RESOLVED);
        assertThat(game.getWinner()).isEqualTo("Town");
        assertThat(lastMessage(game, ChatRegistry.GLOBAL_ID)).isEqualTo("The Town has won!");
        assertThatThrownBy(() -> queueService.queue(game, "Vic", "Kill", List.of("Bob")))
                .isInstanceOfSatisfying(CommonException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.GAME_ALREADY_RESOLVED));
        assertThatThrownBy(() -> engine.resolve(game))
                .isInstanceOfSatisfying(CommonException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.GAME_ALREADY_RESOLVED));
    }

    @Test
    @DisplayName("연쇄살인마는 아무도 살아남지 않아도 승리한다")
    void serialKillerWinsWhenNobodyIsAlive() {
        // given
        GameState game = TestGames.game(GamePhase.NIGHT, 1,
                "Vic:Town:Vigilante:Weak", "Sid:Serial Killer:Vanilla");
        queueService.queue(game, "Vic", "Kill", List.of("Sid"));

        // when
        engine.resolve(game);

        // then
        assertThat(game.alivePlayers()).isEmpty();
        assertThat(game.getWinner()).isEqualTo("Serial Killer");
    }

    @Test
    @DisplayName("해결 후 공유 능력 예약자가 해제된다")
    void sharedActionIsReleasedAfterResolution() {
        // given
        GameState game = TestGames.game(GamePhase.NIGHT, 1,
                "Alice:Town:Vanilla", "Bob:Town:Vanilla", "Carol:Town:Vanilla",
                "Eve:Mafia:Vanilla", "Sam:Mafia:Vanilla");
        queueService.queue(game, "Sam", "Factional Kill", List.of("Alice"));

        // when
        engine.resolve(game);

        // then
        assertThat(game.getAbilityRegistry().get("alignment:Mafia:Factional Kill").orElseThrow().getUsedBy())
                .isNull();
        assertThat(game.getPlayer("Alice").getDeathCauses()).containsExactly("Killed by the Mafia");
    }

    private Map<String, ResolutionOutcome> outcomes(List<ResolutionLogEntry> entries) {
        return entries.stream().collect(Collectors.toMap(ResolutionLogEntry::abilityId, ResolutionLogEntry::outcome));
    }

    private Map<String, Boolean> aliveMap(GameState game) {
        return game.getPlayers().values().stream()
                .collect(Collectors.toMap(player -> player.getName(), player -> player.isAlive()));
    }

    private String lastMessage(GameState game, String chatId) {
        List<ChatMessage> messages = game.getChats().find(chatId).orElseThrow().getMessages();
        return messages.get(messages.size() - 1).getContent();
    }
}
