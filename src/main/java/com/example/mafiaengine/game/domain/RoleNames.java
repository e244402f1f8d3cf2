package com.example.mafiaengine.game.domain;

public final class RoleNames {

    private RoleNames() {
    }

    /**
     * 진영 오버라이드 > 형용사형 역할 > "{alignment} {role}"
     */
    public static String of(Role role, Alignment alignment) {
        String override = alignment.getRoleNames().get(role.getId());
        if (override != null) {
            return override;
        }
        if (role.isAdjective()) {
            return role.getId() + " " + alignment.getDemonym();
        }
        return alignment.getId() + " " + role.getId();
    }
}
