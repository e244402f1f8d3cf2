package com.example.mafiaengine.game.dto.response;

public record CreateGameResponse(
        String gameId,
        String modToken) {
}
