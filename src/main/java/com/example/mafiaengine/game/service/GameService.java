package com.example.mafiaengine.game.service;

import com.example.mafiaengine.chat.domain.ChatRegistry;
import com.example.mafiaengine.chat.dto.ChatSummaryResponse;
import com.example.mafiaengine.game.ability.AbilityContext;
import com.example.mafiaengine.game.ability.AbilityInstance;
import com.example.mafiaengine.game.catalog.RoleCatalog;
import com.example.mafiaengine.game.domain.GamePlayer;
import com.example.mafiaengine.game.domain.GameState;
import com.example.mafiaengine.game.domain.Viewer;
import com.example.mafiaengine.game.dto.request.CreateGameRequest;
import com.example.mafiaengine.game.dto.request.GameAction;
import com.example.mafiaengine.game.dto.request.QueueAbilitiesRequest;
import com.example.mafiaengine.game.dto.request.UpdateGameRequest;
import com.example.mafiaengine.game.dto.response.AbilityListResponse;
import com.example.mafiaengine.game.dto.response.AbilityStatusView;
import com.example.mafiaengine.game.dto.response.CatalogResponse;
import com.example.mafiaengine.game.dto.response.CreateGameResponse;
import com.example.mafiaengine.game.dto.response.GameOverviewResponse;
import com.example.mafiaengine.game.dto.response.PlayerView;
import com.example.mafiaengine.game.dto.response.VoteTallyResponse;
import com.example.mafiaengine.game.knowledge.VisibilityPolicy;
import com.example.mafiaengine.game.queue.AbilityQueueService;
import com.example.mafiaengine.game.queue.QueuedAbility;
import com.example.mafiaengine.game.repository.GameStore;
import com.example.mafiaengine.game.resolution.ResolutionEngine;
import com.example.mafiaengine.game.resolution.ResolutionLogEntry;
import com.example.mafiaengine.game.state.GameStateMachine;
import com.example.mafiaengine.global.concurrency.LockStrategy;
import com.example.mafiaengine.global.config.EngineProperties;
import com.example.mafiaengine.global.error.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.function.Function;

/**
 * 게임 파사드.
 * 모든 상태 변경은 게임 단위 배타 락, 조회는 공유 락 안에서 실행된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameService {

    private static final String LOCK_PREFIX = "game:";

    private final GameStore gameStore;
    private final GameValidator gameValidator;
    private final RoleAssigner roleAssigner;
    private final AbilityQueueService abilityQueueService;
    private final ResolutionEngine resolutionEngine;
    private final GameStateMachine gameStateMachine;
    private final VoteService voteService;
    private final VisibilityPolicy visibilityPolicy;
    private final RoleCatalog roleCatalog;
    private final LockStrategy lockStrategy;
    private final EngineProperties engineProperties;
    private final Clock clock;
    private final Random random;

    // ================= 게임 생성 =================

    public CreateGameResponse createGame(CreateGameRequest request) {
        gameValidator.validateCreateGame(request);

        GameState game = GameState.builder()
                .gameId(gameStore.nextId())
                .modToken(newModToken())
                .gamePhase(request.phase() != null ? request.phase() : engineProperties.defaultPhase())
                .dayNo(request.dayNo() != null ? request.dayNo() : engineProperties.defaultDayNo())
                .chats(new ChatRegistry(clock))
                .chatPhases(Set.copyOf(engineProperties.chatPhases()))
                .votingPhases(Set.copyOf(engineProperties.votingPhases()))
                .build();
        roleAssigner.assignRoles(game, request.players(), request.roles(), request.shuffleRoles());
        gameStore.save(game);

        log.info("[게임생성] gameId={}, players={}, phase={}, day={}",
                game.getGameId(), game.getPlayers().size(), game.getGamePhase(), game.getDayNo());
        return new CreateGameResponse(game.getGameId(), game.getModToken());
    }

    // ================= 권한 =================

    /**
     * 헤더 값으로 요청자 권한을 결정. 모더레이터 토큰이 우선한다.
     */
    public Viewer resolveViewer(String gameId, String modToken, String playerName) {
        return read(gameId, game -> {
            if (modToken != null && modToken.equals(game.getModToken())) {
                return Viewer.moderator();
            }
            if (playerName != null && !playerName.isBlank()) {
                if (game.findPlayer(playerName).isEmpty()) {
                    throw ErrorCode.NOT_AUTHENTICATED.commonException(playerName);
                }
                return Viewer.player(playerName);
            }
            return Viewer.none();
        });
    }

    // ================= 조회 =================

    public GameOverviewResponse getOverview(String gameId, Viewer viewer) {
        return read(gameId, game -> overview(game, viewer));
    }

    public List<PlayerView> getPlayers(String gameId, Viewer viewer) {
        return read(gameId, game -> playerViews(game, viewer));
    }

    public List<ResolutionLogEntry> getResolutionLog(String gameId, Viewer viewer) {
        requireModerator(viewer);
        return read(gameId, game -> List.copyOf(game.getResolutionLog()));
    }

    public AbilityListResponse getAbilities(String gameId, Viewer viewer, String playerName) {
        requireSelfOrModerator(viewer, playerName);
        return read(gameId, game -> abilityList(game, game.getPlayer(playerName)));
    }

    public VoteTallyResponse getVotes(String gameId) {
        return read(gameId, game -> new VoteTallyResponse(new LinkedHashMap<>(game.getVotes()), voteService.tally(game)));
    }

    public CatalogResponse catalog() {
        return new CatalogResponse(
                roleCatalog.roles().stream()
                        .map(role -> new CatalogResponse.RoleSummary(role.getId(), role.getDescription()))
                        .toList(),
                roleCatalog.alignments().stream().map(alignment -> alignment.getId()).toList(),
                roleCatalog.modifierIds());
    }

    // ================= 모더레이터 조작 =================

    public GameOverviewResponse setTime(String gameId, Viewer viewer, UpdateGameRequest request) {
        requireModerator(viewer);
        return write(gameId, game -> {
            gameStateMachine.setTime(game, request.phase(), request.dayNo());
            return overview(game, viewer);
        });
    }

    /**
     * resolve는 항상 next_phase보다 먼저 적용. 나머지는 요청 순서 유지.
     * 도중에 게임이 끝나면 남은 조작은 건너뛴다.
     */
    public GameOverviewResponse applyActions(String gameId, Viewer viewer, List<GameAction> actions) {
        requireModerator(viewer);
        List<GameAction> ordered = actions.stream()
                .sorted(Comparator.comparingInt(action -> action == GameAction.RESOLVE ? 0 : 1))
                .toList();
        return write(gameId, game -> {
            if (game.isResolved()) {
                throw ErrorCode.GAME_ALREADY_RESOLVED.commonException();
            }
            for (GameAction action : ordered) {
                if (game.isResolved()) {
                    log.info("[조작] 게임 종료로 남은 조작 생략: gameId={}, action={}", gameId, action);
                    break;
                }
                switch (action) {
                    case DEQUEUE -> commitQueue(game);
                    case RESOLVE -> resolutionEngine.resolve(game);
                    case NEXT_PHASE -> gameStateMachine.nextPhase(game);
                    case CLEAR_VOTES -> voteService.clearVotes(game);
                    case POST_VOTE_COUNT -> voteService.postVoteCount(game);
                }
            }
            return overview(game, viewer);
        });
    }

    // ================= 플레이어 조작 =================

    public AbilityListResponse queueAbilities(String gameId, Viewer viewer, String playerName,
            QueueAbilitiesRequest request) {
        requireSelfOrModerator(viewer, playerName);
        return write(gameId, game -> {
            abilityQueueService.queueAll(game, playerName, request.merged());
            return abilityList(game, game.getPlayer(playerName));
        });
    }

    public VoteTallyResponse vote(String gameId, Viewer viewer, String playerName, String target) {
        requireSelfOrModerator(viewer, playerName);
        return write(gameId, game -> {
            voteService.vote(game, playerName, target);
            return new VoteTallyResponse(new LinkedHashMap<>(game.getVotes()), voteService.tally(game));
        });
    }

    public VoteTallyResponse unvote(String gameId, Viewer viewer, String playerName) {
        requireSelfOrModerator(viewer, playerName);
        return write(gameId, game -> {
            voteService.unvote(game, playerName);
            return new VoteTallyResponse(new LinkedHashMap<>(game.getVotes()), voteService.tally(game));
        });
    }

    // ================= 응답 조립 =================

    /**
     * 현재 페이즈 예약을 확정한다. 지난 페이즈 예약은 버리고, 그 예약을 잡고 있던 공유 능력은 풀어준다.
     */
    private void commitQueue(GameState game) {
        int committed = game.getQueue().commit(game.getDayNo(), game.getGamePhase());
        game.getAbilityRegistry().all().stream()
                .filter(AbilityInstance::isShared)
                .filter(instance -> game.getQueue().findByInstance(instance.getKey()).isEmpty())
                .forEach(instance -> instance.setUsedBy(null));
        log.info("[조작] 예약 확정: gameId={}, committed={}", game.getGameId(), committed);
    }

    private GameOverviewResponse overview(GameState game, Viewer viewer) {
        return new GameOverviewResponse(
                game.getGameId(),
                game.getStatus(),
                game.getGamePhase(),
                game.getDayNo(),
                game.getWinner(),
                playerViews(game, viewer),
                game.getChats().readableBy(viewer).stream().map(ChatSummaryResponse::from).toList());
    }

    private List<PlayerView> playerViews(GameState game, Viewer viewer) {
        return game.getPlayers().values().stream()
                .map(player -> PlayerView.of(player, visibilityPolicy.identityOf(game, viewer, player)))
                .toList();
    }

    private AbilityListResponse abilityList(GameState game, GamePlayer player) {
        Function<AbilityInstance, AbilityStatusView> view = instance -> abilityStatus(game, player, instance);
        return new AbilityListResponse(
                player.getActions().stream().map(view).toList(),
                player.getSharedActions().stream().map(view).toList(),
                player.getPassives().stream().map(view).toList());
    }

    private AbilityStatusView abilityStatus(GameState game, GamePlayer player, AbilityInstance instance) {
        List<String> queued = (instance.isShared()
                ? game.getQueue().findByInstance(instance.getKey())
                : game.getQueue().find(instance.getKey(), player.getName()))
                .map(QueuedAbility::getTargets)
                .orElse(null);
        boolean eligible = !game.isResolved()
                && instance.getDefinition().isEligible(AbilityContext.of(game, player, instance));
        return new AbilityStatusView(
                instance.getAbilityId(),
                instance.getDefinition().getDescription(),
                instance.getDefinition().getPhase(),
                instance.getDefinition().getTargetCount(),
                instance.getDefinition().isImmediate(),
                eligible,
                instance.getUses(),
                queued,
                instance.isShared() ? instance.getUsedBy() : null);
    }

    // ================= 락 / 권한 헬퍼 =================

    private <T> T read(String gameId, Function<GameState, T> action) {
        return lockStrategy.executeWithReadLock(LOCK_PREFIX + gameId, () -> action.apply(gameStore.getById(gameId)));
    }

    private <T> T write(String gameId, Function<GameState, T> action) {
        return lockStrategy.executeWithLock(LOCK_PREFIX + gameId, () -> action.apply(gameStore.getById(gameId)));
    }

    private void requireModerator(Viewer viewer) {
        if (!viewer.isModerator()) {
            throw ErrorCode.FORBIDDEN.commonException("moderator only");
        }
    }

    private void requireSelfOrModerator(Viewer viewer, String playerName) {
        if (viewer.isModerator() || viewer.is(playerName)) {
            return;
        }
        if (!viewer.isPlayer()) {
            throw ErrorCode.NOT_AUTHENTICATED.commonException();
        }
        throw ErrorCode.FORBIDDEN.commonException();
    }

    private String newModToken() {
        byte[] bytes = new byte[16];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
