package com.example.mafiaengine.game.resolution;

import com.example.mafiaengine.game.domain.GamePhase;

import java.util.List;

public record ResolutionLogEntry(
        int dayNo,
        GamePhase phase,
        String abilityId,
        String user,
        List<String> targets,
        ResolutionOutcome outcome,
        String detail) {
}
