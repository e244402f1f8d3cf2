package com.example.mafiaengine.game.service;

import com.example.mafiaengine.game.dto.request.CreateGameRequest;
import com.example.mafiaengine.global.error.ErrorCode;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;

@Component
public class GameValidator {

    public void validateCreateGame(CreateGameRequest request) {
        List<String> players = request.players();
        if (players == null || players.isEmpty()) {
            throw ErrorCode.INVALID_GAME_SETUP.commonException("at least one player is required");
        }
        if (new HashSet<>(players).size() != players.size()) {
            throw ErrorCode.INVALID_GAME_SETUP.commonException("player names must be unique");
        }
        if (request.roles() == null || request.roles().size() != players.size()) {
            throw ErrorCode.INVALID_GAME_SETUP.commonException("one role is required per player");
        }
        if (request.dayNo() != null && request.dayNo() < 1) {
            throw ErrorCode.INVALID_GAME_SETUP.commonException("day number must be at least 1");
        }
    }
}
