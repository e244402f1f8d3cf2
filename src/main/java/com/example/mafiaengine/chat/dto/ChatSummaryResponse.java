package com.example.mafiaengine.chat.dto;

import com.example.mafiaengine.chat.domain.Chat;
import com.example.mafiaengine.chat.domain.ChatType;

public record ChatSummaryResponse(
        String id,
        String title,
        ChatType type,
        int messageCount) {

    public static ChatSummaryResponse from(Chat chat) {
        return new ChatSummaryResponse(chat.getId(), chat.getTitle(), chat.getType(), chat.getMessages().size());
    }
}
