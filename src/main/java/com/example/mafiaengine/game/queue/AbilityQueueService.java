package com.example.mafiaengine.game.queue;

import com.example.mafiaengine.game.ability.Ability;
import com.example.mafiaengine.game.ability.AbilityContext;
import com.example.mafiaengine.game.ability.AbilityInstance;
import com.example.mafiaengine.game.domain.GamePlayer;
import com.example.mafiaengine.game.domain.GameState;
import com.example.mafiaengine.game.resolution.ResolutionEngine;
import com.example.mafiaengine.global.error.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 능력 큐 등록/취소.
 * 검증은 모두 상태 변경 전에 끝나며, 실패하면 큐는 그대로 남는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AbilityQueueService {

    private final ResolutionEngine resolutionEngine;

    // ================= 단건 처리 =================

    public void queue(GameState game, String userName, String abilityId, List<String> targetNames) {
        apply(validate(game, userName, abilityId, targetNames));
    }

    /**
     * 예약 취소. 예약이 없으면 아무 일도 하지 않는다.
     */
    public void dequeue(GameState game, String userName, String abilityId) {
        apply(validate(game, userName, abilityId, null));
    }

    // ================= 일괄 처리 =================

    /**
     * 능력 id -> 대상 목록. 대상이 null이면 취소.
     * 전부 검증한 뒤에 적용한다.
     */
    public void queueAll(GameState game, String userName, Map<String, List<String>> selections) {
        List<PlannedChange> planned = new ArrayList<>();
        selections.forEach((abilityId, targets) -> planned.add(validate(game, userName, abilityId, targets)));
        planned.forEach(this::apply);
    }

    // ================= 검증 =================

    private PlannedChange validate(GameState game, String userName, String abilityId, List<String> targetNames) {
        if (game.isResolved()) {
            throw ErrorCode.GAME_ALREADY_RESOLVED.commonException();
        }
        GamePlayer user = game.getPlayer(userName);
        AbilityInstance instance = game.getAbilityRegistry().lookup(user, abilityId);
        Ability ability = instance.getDefinition();
        // 죽은 플레이어는 취소로도 큐를 바꿀 수 없다
        if (!user.isAlive() && !ability.isUsableAfterDeath()) {
            throw ErrorCode.INELIGIBLE_NOW.commonException(userName + " is dead");
        }
        if (game.getQueue().isCommitted(instance, userName)) {
            throw ErrorCode.INELIGIBLE_NOW.commonException(abilityId + " is already committed");
        }
        if (targetNames == null) {
            return new PlannedChange(game, user, instance, null);
        }

        AbilityContext context = AbilityContext.of(game, user, instance);
        if (!ability.isEligible(context)) {
            throw ErrorCode.INELIGIBLE_NOW.commonException(abilityId);
        }
        if (targetNames.size() != ability.getTargetCount()) {
            throw ErrorCode.INVALID_TARGET_COUNT.commonException(
                    abilityId + " needs " + ability.getTargetCount() + " target(s)");
        }
        List<GamePlayer> targets = new ArrayList<>();
        for (String targetName : targetNames) {
            GamePlayer target = game.findPlayer(targetName)
                    .orElseThrow(() -> ErrorCode.INVALID_TARGET.commonException(targetName));
            if (!target.isAlive() || !ability.isValidTarget(context, target)) {
                throw ErrorCode.INVALID_TARGET.commonException(targetName);
            }
            targets.add(target);
        }
        // 대상에 따라 달라지는 수식어 조건 (Indecisive 등)
        if (!ability.isEligible(context.withTargets(targets))) {
            throw ErrorCode.INELIGIBLE_NOW.commonException(abilityId);
        }
        return new PlannedChange(game, user, instance, targets);
    }

    // ================= 적용 =================

    private void apply(PlannedChange change) {
        GameState game = change.game();
        AbilityInstance instance = change.instance();
        String userName = change.user().getName();

        if (change.targets() == null) {
            boolean removed = instance.isShared()
                    ? game.getQueue().removeByInstance(instance.getKey())
                    : game.getQueue().remove(instance.getKey(), userName);
            if (instance.isShared()) {
                instance.setUsedBy(null);
            }
            log.debug("[큐] 취소: gameId={}, user={}, ability={}, removed={}",
                    game.getGameId(), userName, instance.getAbilityId(), removed);
            return;
        }

        if (instance.getDefinition().isImmediate()) {
            resolutionEngine.resolveImmediately(game, instance, change.user(), change.targets());
            return;
        }

        if (instance.isShared()) {
            // 다른 진영원이 예약해 둔 것을 대체
            game.getQueue().removeByInstance(instance.getKey());
            instance.setUsedBy(userName);
        }
        game.getQueue().put(QueuedAbility.builder()
                .instance(instance)
                .user(userName)
                .targets(change.targets().stream().map(GamePlayer::getName).toList())
                .dayNo(game.getDayNo())
                .phase(game.getGamePhase())
                .sequence(game.nextSequence())
                .build());
        log.debug("[큐] 등록: gameId={}, user={}, ability={}, targets={}",
                game.getGameId(), userName, instance.getAbilityId(), change.targets().size());
    }

    private record PlannedChange(GameState game, GamePlayer user, AbilityInstance instance,
            List<GamePlayer> targets) {
    }
}
