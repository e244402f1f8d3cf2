package com.example.mafiaengine.game.ability;

/**
 * 같은 우선순위 안에서의 정렬 기준. 실제 순서는 mafia.engine.category-order 설정.
 */
public enum AbilityCategory {
    CONTROL,
    PROTECTIVE,
    INFORMATIONAL,
    OFFENSIVE,
    CLEANUP
}
