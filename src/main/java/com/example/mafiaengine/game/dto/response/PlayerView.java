package com.example.mafiaengine.game.dto.response;

import com.example.mafiaengine.game.domain.GamePlayer;
import com.example.mafiaengine.game.knowledge.VisibleIdentity;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlayerView(
        String name,
        boolean alive,
        String role,
        String alignment,
        String roleName) {

    public static PlayerView of(GamePlayer player, VisibleIdentity identity) {
        return new PlayerView(player.getName(), player.isAlive(),
                identity.role(), identity.alignment(), identity.roleName());
    }
}
