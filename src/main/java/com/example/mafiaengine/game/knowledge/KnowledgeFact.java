package com.example.mafiaengine.game.knowledge;

import com.example.mafiaengine.game.domain.GamePlayer;

/**
 * 관찰자가 대상에 대해 알게 된 사실. 모르는 항목은 null.
 */
public record KnowledgeFact(String alignmentId, String roleId) {

    public static KnowledgeFact alignment(String alignmentId) {
        return new KnowledgeFact(alignmentId, null);
    }

    public static KnowledgeFact role(String roleId) {
        return new KnowledgeFact(null, roleId);
    }

    public static KnowledgeFact identity(GamePlayer subject) {
        return new KnowledgeFact(subject.getAlignment().getId(), subject.getRole().getId());
    }

    /**
     * 이미 아는 항목은 유지하고 모르는 항목만 채운다
     */
    public KnowledgeFact merge(KnowledgeFact other) {
        return new KnowledgeFact(
                alignmentId != null ? alignmentId : other.alignmentId,
                roleId != null ? roleId : other.roleId);
    }

    public boolean isComplete() {
        return alignmentId != null && roleId != null;
    }
}
