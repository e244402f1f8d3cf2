package com.example.mafiaengine.game.dto.response;

import com.example.mafiaengine.chat.dto.ChatSummaryResponse;
import com.example.mafiaengine.game.domain.GamePhase;
import com.example.mafiaengine.game.domain.GameStatus;

import java.util.List;

public record GameOverviewResponse(
        String gameId,
        GameStatus status,
        GamePhase phase,
        int dayNo,
        String winner,
        List<PlayerView> players,
        List<ChatSummaryResponse> chats) {
}
