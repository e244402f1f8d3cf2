package com.example.mafiaengine.game.dto.request;

import com.example.mafiaengine.game.domain.GamePhase;
import jakarta.validation.constraints.NotNull;

public record UpdateGameRequest(
        @NotNull GamePhase phase,
        @NotNull Integer dayNo) {
}
