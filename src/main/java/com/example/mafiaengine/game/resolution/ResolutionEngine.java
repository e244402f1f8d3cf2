package com.example.mafiaengine.game.resolution;

import com.example.mafiaengine.game.ability.Ability;
import com.example.mafiaengine.game.ability.AbilityContext;
import com.example.mafiaengine.game.ability.AbilityInstance;
import com.example.mafiaengine.game.ability.AbilityTags;
import com.example.mafiaengine.game.domain.GamePlayer;
import com.example.mafiaengine.game.domain.GameState;
import com.example.mafiaengine.game.queue.QueuedAbility;
import com.example.mafiaengine.global.error.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 페이즈 해결 엔진.
 * 큐와 발동하는 패시브를 모아 정렬한 뒤 순서대로 효과를 적용하고, 사용 횟수 소모와 승리 판정까지 처리한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResolutionEngine {

    private final ResolutionOrder resolutionOrder;
    private final WinConditionChecker winConditionChecker;

    // ================= 페이즈 해결 =================

    public List<ResolutionLogEntry> resolve(GameState game) {
        if (game.isResolved()) {
            throw ErrorCode.GAME_ALREADY_RESOLVED.commonException();
        }
        List<ResolutionLogEntry> entries = new ArrayList<>();
        List<PendingAction> actions = new ArrayList<>();
        Set<String> claimedShared = new HashSet<>();

        for (QueuedAbility queued : game.getQueue().snapshot()) {
            if (queued.getInstance().isShared() && !claimedShared.add(queued.getInstance().getKey())) {
                throw new IllegalStateException("shared ability queued twice: " + queued.getInstance().getKey());
            }
            if (!queued.isStampedFor(game.getDayNo(), game.getGamePhase())) {
                entries.add(new ResolutionLogEntry(game.getDayNo(), game.getGamePhase(),
                        queued.getInstance().getAbilityId(), queued.getUser(), queued.getTargets(),
                        ResolutionOutcome.EXPIRED, "queued for " + queued.getPhase() + " " + queued.getDayNo()));
                continue;
            }
            GamePlayer user = game.getPlayer(queued.getUser());
            List<GamePlayer> targets = queued.getTargets().stream().map(game::getPlayer).toList();
            actions.add(PendingAction.queued(queued.getInstance(), user,
                    effectiveTargets(queued.getInstance(), user, targets), queued.getSequence()));
        }
        actions.addAll(firingPassives(game));
        actions.sort(resolutionOrder);

        ResolutionContext context = new ResolutionContext(game, actions, isLazyAllowed(game));
        for (int i = 0; i < actions.size(); i++) {
            context.advanceTo(i);
            entries.add(resolveOne(context, actions.get(i)));
        }

        consumeUses(game, actions);
        game.clearQueue();
        game.getResolutionLog().addAll(entries);

        log.info("[해결] 완료: gameId={}, day={}, phase={}, resolved={}",
                game.getGameId(), game.getDayNo(), game.getGamePhase(), entries.size());
        winConditionChecker.check(game);
        return entries;
    }

    /**
     * 즉시 발동 능력. 큐에 저장하지 않고 바로 해결한다.
     */
    public ResolutionLogEntry resolveImmediately(GameState game, AbilityInstance instance, GamePlayer user,
            List<GamePlayer> targets) {
        if (game.isResolved()) {
            throw ErrorCode.GAME_ALREADY_RESOLVED.commonException();
        }
        PendingAction action = PendingAction.queued(instance, user, effectiveTargets(instance, user, targets),
                game.nextSequence());
        ResolutionContext context = new ResolutionContext(game, List.of(action), isLazyAllowed(game));
        context.advanceTo(0);

        ResolutionLogEntry entry = resolveOne(context, action);
        instance.recordUse(game.getDayNo(), action.targetNames());
        game.getResolutionLog().add(entry);

        log.info("[즉시해결] gameId={}, ability={}, user={}, outcome={}",
                game.getGameId(), instance.getAbilityId(), user.getName(), entry.outcome());
        winConditionChecker.check(game);
        return entry;
    }

    // ================= 내부 처리 =================

    private ResolutionLogEntry resolveOne(ResolutionContext context, PendingAction action) {
        EffectResult result = evaluate(context, action);
        action.setOutcome(result.outcome());

        if (result.outcome() == ResolutionOutcome.FIZZLED && action.isQueued()
                && action.getAbility().hasTag(AbilityTags.INVESTIGATE)) {
            context.notify(action.getUser(), "No result");
        }
        GameState game = context.getGame();
        log.debug("[해결] gameId={}, ability={}, user={}, targets={}, outcome={}",
                game.getGameId(), action.getAbility().getId(), action.getUser().getName(),
                action.targetNames(), result.outcome());
        return new ResolutionLogEntry(game.getDayNo(), game.getGamePhase(), action.getAbility().getId(),
                action.getUser().getName(), action.targetNames(), result.outcome(), result.detail());
    }

    private EffectResult evaluate(ResolutionContext context, PendingAction action) {
        Ability ability = action.getAbility();
        if (action.isBlocked()) {
            return EffectResult.fizzled("roleblocked by " + action.getBlockedBy());
        }
        if (!ability.isUsableAfterDeath() && !action.getUser().isAlive()) {
            return EffectResult.fizzled(action.getUser().getName() + " is dead");
        }
        Optional<GamePlayer> deadTarget = action.getTargets().stream().filter(t -> !t.isAlive()).findFirst();
        if (deadTarget.isPresent()) {
            return EffectResult.fizzled("target " + deadTarget.get().getName() + " is dead");
        }
        if (ability.hasTag(AbilityTags.LAZY) && !context.isLazyAllowed()) {
            return EffectResult.fizzled("too few non-town players alive");
        }
        return ability.resolve(context, action);
    }

    private List<PendingAction> firingPassives(GameState game) {
        List<PendingAction> passives = new ArrayList<>();
        for (GamePlayer player : game.getPlayers().values()) {
            for (AbilityInstance passive : player.getPassives()) {
                if (passive.isActive() && passive.getDefinition().isEligible(AbilityContext.of(game, player, passive))) {
                    passives.add(PendingAction.passive(passive, player,
                            effectiveTargets(passive, player, List.of()), game.nextSequence()));
                }
            }
        }
        return passives;
    }

    private List<GamePlayer> effectiveTargets(AbilityInstance instance, GamePlayer user, List<GamePlayer> targets) {
        return instance.getDefinition().hasTag(AbilityTags.SELF_TARGETED) ? List.of(user) : targets;
    }

    /**
     * 큐에서 온 항목은 막혔어도 사용 횟수를 소모, 패시브는 실제로 쓰였을 때만
     */
    private void consumeUses(GameState game, List<PendingAction> actions) {
        for (PendingAction action : actions) {
            if (action.isQueued() || action.isUsed()) {
                action.getInstance().recordUse(game.getDayNo(), action.targetNames());
            }
        }
    }

    /**
     * Lazy 능력은 해결 시작 시점에 Town이 아닌 생존자가 둘 이상일 때만 발동
     */
    private boolean isLazyAllowed(GameState game) {
        return game.alivePlayers().stream().filter(p -> !p.isTown()).count() > 1;
    }
}
