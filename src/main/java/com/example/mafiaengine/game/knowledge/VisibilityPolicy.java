package com.example.mafiaengine.game.knowledge;

import com.example.mafiaengine.game.domain.GamePlayer;
import com.example.mafiaengine.game.domain.GameState;
import com.example.mafiaengine.game.domain.Viewer;
import org.springframework.stereotype.Component;

/**
 * 플레이어 정보를 요청자 권한에 맞게 걸러낸다.
 * 이름과 생존 여부는 항상 공개, 역할/진영은 아래 경우에만 공개:
 * 모더레이터, 본인, 사망한 대상, 해당 사실을 배운 관찰자 (배운 항목만)
 */
@Component
public class VisibilityPolicy {

    public VisibleIdentity identityOf(GameState game, Viewer viewer, GamePlayer subject) {
        if (viewer.isModerator() || viewer.is(subject.getName()) || !subject.isAlive()) {
            return full(subject);
        }
        if (!viewer.isPlayer()) {
            return VisibleIdentity.hidden();
        }
        return game.getKnowledge().knows(viewer.playerName(), subject.getName())
                .map(fact -> new VisibleIdentity(
                        fact.roleId(),
                        fact.alignmentId(),
                        fact.isComplete() ? subject.getRoleName() : null))
                .orElseGet(VisibleIdentity::hidden);
    }

    private VisibleIdentity full(GamePlayer subject) {
        return new VisibleIdentity(subject.getRole().getId(), subject.getAlignment().getId(), subject.getRoleName());
    }
}
