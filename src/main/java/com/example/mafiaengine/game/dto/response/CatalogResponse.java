package com.example.mafiaengine.game.dto.response;

import java.util.List;

public record CatalogResponse(
        List<RoleSummary> roles,
        List<String> alignments,
        List<String> modifiers) {

    public record RoleSummary(String id, String description) {
    }
}
