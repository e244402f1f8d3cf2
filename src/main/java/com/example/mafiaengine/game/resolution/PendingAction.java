package com.example.mafiaengine.game.resolution;

import com.example.mafiaengine.game.ability.Ability;
import com.example.mafiaengine.game.ability.AbilityInstance;
import com.example.mafiaengine.game.domain.GamePlayer;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * 해결 패스 안에서 처리 중인 능력 사용.
 * 롤블락/리다이렉트는 아직 해결되지 않은 PendingAction을 직접 바꾼다.
 */
@Getter
public class PendingAction {

    private final AbilityInstance instance;
    private final GamePlayer user;
    private final List<GamePlayer> targets;
    private final long sequence;

    // false면 큐가 아닌 패시브에서 온 항목
    private final boolean queued;

    private String blockedBy;

    // 패시브가 실제로 사용 횟수를 소모했는지
    private boolean used;

    @Setter
    private ResolutionOutcome outcome;

    private PendingAction(AbilityInstance instance, GamePlayer user, List<GamePlayer> targets, long sequence,
            boolean queued) {
        this.instance = instance;
        this.user = user;
        this.targets = new ArrayList<>(targets);
        this.sequence = sequence;
        this.queued = queued;
    }

    public static PendingAction queued(AbilityInstance instance, GamePlayer user, List<GamePlayer> targets,
            long sequence) {
        return new PendingAction(instance, user, targets, sequence, true);
    }

    public static PendingAction passive(AbilityInstance instance, GamePlayer user, List<GamePlayer> targets,
            long sequence) {
        return new PendingAction(instance, user, targets, sequence, false);
    }

    public Ability getAbility() {
        return instance.getDefinition();
    }

    public boolean isBlocked() {
        return blockedBy != null;
    }

    public void block(String blocker) {
        if (blockedBy == null) {
            blockedBy = blocker;
        }
    }

    public void redirectTo(GamePlayer newTarget) {
        targets.replaceAll(target -> newTarget);
    }

    public void markUsed() {
        used = true;
    }

    public List<String> targetNames() {
        return targets.stream().map(GamePlayer::getName).toList();
    }
}
