package com.example.mafiaengine.chat.dto;

import jakarta.validation.constraints.NotBlank;

public record PostMessageRequest(@NotBlank String content) {
}
