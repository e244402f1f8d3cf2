package com.example.mafiaengine.game.dto.request;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record PatchGameRequest(@NotEmpty List<GameAction> actions) {
}
