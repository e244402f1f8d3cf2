package com.example.mafiaengine.game.modifier;

import com.example.mafiaengine.game.ability.AbilityDefinition;

/**
 * 능력 하나를 감싸서 새 능력 정의를 돌려주는 변환.
 * 역할에 선언된 순서대로 적용된다.
 */
public interface Modifier {

    /**
     * 역할 이름 앞에 붙는 표시 이름 ("1-Shot", "Night 1,3")
     */
    String getId();

    AbilityDefinition apply(AbilityDefinition ability);
}
