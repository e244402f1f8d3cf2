package com.example.mafiaengine.game.ability;

public final class AbilityTags {

    public static final String KILL = "kill";
    public static final String PROTECT = "protect";
    public static final String INVESTIGATE = "investigate";
    public static final String ROLEBLOCK = "roleblock";
    public static final String REDIRECT = "redirect";

    // 수식어가 붙이는 태그
    public static final String LAZY = "lazy";
    public static final String PERSONAL = "personal";
    public static final String SELF_TARGETED = "self_targeted";
    public static final String UNSTOPPABLE = "unstoppable";

    private AbilityTags() {
    }
}
