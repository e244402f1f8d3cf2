package com.example.mafiaengine.game.dto.response;

import java.util.List;

public record AbilityListResponse(
        List<AbilityStatusView> actions,
        List<AbilityStatusView> sharedActions,
        List<AbilityStatusView> passives) {
}
