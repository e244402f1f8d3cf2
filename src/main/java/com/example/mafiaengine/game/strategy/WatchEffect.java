package com.example.mafiaengine.game.strategy;

import com.example.mafiaengine.game.ability.AbilityEffect;
import com.example.mafiaengine.game.domain.GamePlayer;
import com.example.mafiaengine.game.resolution.EffectResult;
import com.example.mafiaengine.game.resolution.PendingAction;
import com.example.mafiaengine.game.resolution.ResolutionContext;

import java.util.List;

public class WatchEffect implements AbilityEffect {

    @Override
    public EffectResult apply(ResolutionContext context, PendingAction action) {
        for (GamePlayer target : action.getTargets()) {
            List<String> visitors = context.visitorsOf(action, target).stream().map(GamePlayer::getName).toList();
            String message = visitors.isEmpty()
                    ? target.getName() + " was not visited by anyone."
                    : target.getName() + " was visited by " + String.join(", ", visitors) + ".";
            context.notify(action.getUser(), message);
        }
        return EffectResult.success("watched " + String.join(", ", action.targetNames()));
    }
}
