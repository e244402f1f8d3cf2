package com.example.mafiaengine.game.dto.request;

import com.example.mafiaengine.game.domain.GamePhase;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record CreateGameRequest(
        @NotEmpty List<@NotBlank String> players,
        @NotEmpty @Valid List<RoleSetup> roles,
        GamePhase phase,
        Integer dayNo,
        boolean shuffleRoles) {

    /**
     * 역할 + 진영 + 수식어 (수식어는 적힌 순서대로 적용)
     */
    public record RoleSetup(
            @NotBlank String role,
            @NotBlank String alignment,
            List<String> modifiers) {
    }
}
