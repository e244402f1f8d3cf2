package com.example.mafiaengine.game.ability;

import com.example.mafiaengine.game.domain.GamePlayer;
import com.example.mafiaengine.game.domain.GameState;

import java.util.List;

public record AbilityContext(
        GameState game,
        GamePlayer user,
        AbilityInstance instance,
        List<GamePlayer> targets) {

    public static AbilityContext of(GameState game, GamePlayer user, AbilityInstance instance) {
        return new AbilityContext(game, user, instance, List.of());
    }

    public AbilityContext withTargets(List<GamePlayer> targets) {
        return new AbilityContext(game, user, instance, List.copyOf(targets));
    }
}
