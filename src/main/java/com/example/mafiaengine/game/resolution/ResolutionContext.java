package com.example.mafiaengine.game.resolution;

import com.example.mafiaengine.game.ability.Ability;
import com.example.mafiaengine.game.ability.AbilityTags;
import com.example.mafiaengine.game.domain.GamePlayer;
import com.example.mafiaengine.game.domain.GameState;
import com.example.mafiaengine.game.knowledge.KnowledgeFact;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 해결 패스 하나의 작업 공간. 효과(AbilityEffect)는 이 객체를 통해서만 게임 상태를 바꾼다.
 */
public class ResolutionContext {

    @Getter
    private final GameState game;

    // 정렬된 해결 순서
    private final List<PendingAction> actions;

    @Getter
    private final boolean lazyAllowed;

    // 대상 이름 -> 걸린 보호 (걸린 순서)
    private final Map<String, List<Protection>> protections = new HashMap<>();

    private int cursor = -1;

    public ResolutionContext(GameState game, List<PendingAction> actions, boolean lazyAllowed) {
        this.game = game;
        this.actions = actions;
        this.lazyAllowed = lazyAllowed;
    }

    void advanceTo(int index) {
        this.cursor = index;
    }

    // ================= 사망 / 보호 =================

    /**
     * 살해 시도. 보호는 이 시점에 걸려 있는 것만 확인한다.
     */
    public EffectResult attemptKill(PendingAction attack, GamePlayer target, String cause) {
        if (!target.isAlive()) {
            return EffectResult.fizzled(target.getName() + " is already dead");
        }
        if (!attack.getAbility().hasTag(AbilityTags.UNSTOPPABLE)) {
            for (Protection protection : protections.getOrDefault(target.getName(), List.of())) {
                if (protection.isExhausted() || !protection.covers(attack)) {
                    continue;
                }
                protection.consume();
                GamePlayer protector = protection.getSource().getUser();
                if (protection.isDiesInstead()) {
                    kill(protector, "Died protecting " + target.getName());
                }
                return EffectResult.blocked(target.getName() + " was protected by "
                        + protection.getSource().getAbility().getId());
            }
        }
        kill(target, cause);
        return EffectResult.success(target.getName() + " was killed");
    }

    /**
     * 보호 없이 바로 사망 처리 (Weak 등)
     */
    public void kill(GamePlayer player, String cause) {
        if (player.isAlive()) {
            player.kill(cause);
        }
    }

    public void protect(PendingAction source, GamePlayer target, Integer limit, boolean diesInstead) {
        protections.computeIfAbsent(target.getName(), k -> new ArrayList<>())
                .add(Protection.builder()
                        .source(source)
                        .remaining(limit)
                        .diesInstead(diesInstead)
                        .build());
    }

    // ================= 롤블락 / 리다이렉트 =================

    /**
     * 대상이 사용하는 아직 해결되지 않은 능력을 막는다. 막은 개수 반환.
     */
    public int block(PendingAction source, GamePlayer target) {
        int count = 0;
        for (PendingAction pending : unresolved()) {
            if (pending.getUser() == target && canInterfere(source, pending)) {
                pending.block(source.getUser().getName());
                count++;
            }
        }
        return count;
    }

    /**
     * from이 사용하는 아직 해결되지 않은 능력의 대상을 to로 바꾼다.
     */
    public int redirect(PendingAction source, GamePlayer from, GamePlayer to) {
        int count = 0;
        for (PendingAction pending : unresolved()) {
            if (pending.getUser() == from
                    && canInterfere(source, pending)
                    && !pending.getTargets().isEmpty()
                    && !pending.getAbility().hasTag(AbilityTags.SELF_TARGETED)) {
                pending.redirectTo(to);
                count++;
            }
        }
        return count;
    }

    private boolean canInterfere(PendingAction source, PendingAction pending) {
        Ability ability = pending.getAbility();
        if (!pending.isQueued() || ability.hasTag(AbilityTags.UNSTOPPABLE)) {
            return false;
        }
        return !(source.getAbility().hasTag(AbilityTags.PERSONAL) && pending.getInstance().isShared());
    }

    private List<PendingAction> unresolved() {
        return actions.subList(cursor + 1, actions.size());
    }

    // ================= 정보 =================

    /**
     * 대상을 방문한 플레이어 (막히지 않은 능력 기준, 이름순)
     */
    public List<GamePlayer> visitorsOf(PendingAction observer, GamePlayer target) {
        return actions.stream()
                .filter(pending -> pending != observer)
                .filter(pending -> pending.isQueued() && !pending.isBlocked())
                .filter(pending -> !pending.getAbility().hasTag(AbilityTags.SELF_TARGETED))
                .filter(pending -> pending.getTargets().contains(target))
                .map(PendingAction::getUser)
                .distinct()
                .sorted(Comparator.comparing(GamePlayer::getName))
                .toList();
    }

    public void learn(GamePlayer observer, GamePlayer subject, KnowledgeFact fact) {
        game.getKnowledge().learn(observer.getName(), subject.getName(), fact);
    }

    /**
     * 플레이어 개인 수신함으로 결과 전달
     */
    public void notify(GamePlayer player, String message) {
        game.getChats().notify(player.getName(), message);
    }

    /**
     * 전체 채팅 공지
     */
    public void announce(String message) {
        game.getChats().announce(message);
    }
}
