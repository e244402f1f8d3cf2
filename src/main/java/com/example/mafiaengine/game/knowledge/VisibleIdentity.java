package com.example.mafiaengine.game.knowledge;

/**
 * 요청자에게 공개되는 신원. 공개되지 않은 항목은 null.
 */
public record VisibleIdentity(String role, String alignment, String roleName) {

    public static VisibleIdentity hidden() {
        return new VisibleIdentity(null, null, null);
    }
}
