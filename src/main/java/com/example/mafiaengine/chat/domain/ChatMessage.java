package com.example.mafiaengine.chat.domain;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

@Getter
@Builder
public class ChatMessage {

    private final String author;
    private final String content;
    private final Instant timestamp;
}
