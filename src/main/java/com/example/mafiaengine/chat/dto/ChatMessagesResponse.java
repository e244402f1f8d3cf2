package com.example.mafiaengine.chat.dto;

import com.example.mafiaengine.chat.domain.ChatMessage;

import java.util.List;

public record ChatMessagesResponse(
        String chatId,
        int start,
        int total,
        List<ChatMessage> messages) {
}
