package com.example.mafiaengine.chat.controller;

import com.example.mafiaengine.chat.domain.ChatMessage;
import com.example.mafiaengine.chat.dto.ChatMessagesResponse;
import com.example.mafiaengine.chat.dto.ChatSummaryResponse;
import com.example.mafiaengine.chat.dto.PostMessageRequest;
import com.example.mafiaengine.chat.service.ChatService;
import com.example.mafiaengine.game.domain.Viewer;
import com.example.mafiaengine.game.service.GameService;
import com.example.mafiaengine.global.dto.CommonResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

import static com.example.mafiaengine.game.controller.GameController.MOD_TOKEN_HEADER;
import static com.example.mafiaengine.game.controller.GameController.PLAYER_NAME_HEADER;

@RestController
@RequestMapping("/api/games/{gameId}")
@RequiredArgsConstructor
public class ChatController {

    private final ChatService chatService;
    private final GameService gameService;

    @GetMapping("/chats")
    public ResponseEntity<CommonResponse<List<ChatSummaryResponse>>> listChats(
            @PathVariable String gameId,
            @RequestHeader(value = MOD_TOKEN_HEADER, required = false) String modToken,
            @RequestHeader(value = PLAYER_NAME_HEADER, required = false) String playerName) {
        Viewer viewer = gameService.resolveViewer(gameId, modToken, playerName);
        return ResponseEntity.ok(CommonResponse.success(chatService.listChats(gameId, viewer), null));
    }

    @GetMapping("/chats/{chatId}/messages")
    public ResponseEntity<CommonResponse<ChatMessagesResponse>> readMessages(
            @PathVariable String gameId,
            @PathVariable String chatId,
            @RequestParam(required = false) Integer start,
            @RequestParam(required = false) Integer limit,
            @RequestHeader(value = MOD_TOKEN_HEADER, required = false) String modToken,
            @RequestHeader(value = PLAYER_NAME_HEADER, required = false) String playerName) {
        Viewer viewer = gameService.resolveViewer(gameId, modToken, playerName);
        ChatMessagesResponse response = chatService.readMessages(gameId, viewer, chatId, start, limit);
        return ResponseEntity.ok(CommonResponse.success(response, null));
    }

    @PostMapping("/chats/{chatId}/messages")
    public ResponseEntity<CommonResponse<ChatMessage>> postMessage(
            @PathVariable String gameId,
            @PathVariable String chatId,
            @Valid @RequestBody PostMessageRequest request,
            @RequestHeader(value = MOD_TOKEN_HEADER, required = false) String modToken,
            @RequestHeader(value = PLAYER_NAME_HEADER, required = false) String playerName) {
        Viewer viewer = gameService.resolveViewer(gameId, modToken, playerName);
        ChatMessage message = chatService.postMessage(gameId, viewer, chatId, request.content());
        return ResponseEntity.status(HttpStatus.CREATED).body(CommonResponse.success(message, null));
    }

    @GetMapping("/players/{name}/messages")
    public ResponseEntity<CommonResponse<ChatMessagesResponse>> readPrivateMessages(
            @PathVariable String gameId,
            @PathVariable String name,
            @RequestParam(required = false) Integer start,
            @RequestParam(required = false) Integer limit,
            @RequestHeader(value = MOD_TOKEN_HEADER, required = false) String modToken,
            @RequestHeader(value = PLAYER_NAME_HEADER, required = false) String playerName) {
        Viewer viewer = gameService.resolveViewer(gameId, modToken, playerName);
        ChatMessagesResponse response = chatService.readPrivateMessages(gameId, viewer, name, start, limit);
        return ResponseEntity.ok(CommonResponse.success(response, null));
    }

    @PostMapping("/players/{name}/messages")
    public ResponseEntity<CommonResponse<ChatMessage>> postPrivateMessage(
            @PathVariable String gameId,
            @PathVariable String name,
            @Valid @RequestBody PostMessageRequest request,
            @RequestHeader(value = MOD_TOKEN_HEADER, required = false) String modToken,
            @RequestHeader(value = PLAYER_NAME_HEADER, required = false) String playerName) {
        Viewer viewer = gameService.resolveViewer(gameId, modToken, playerName);
        ChatMessage message = chatService.postPrivateMessage(gameId, viewer, name, request.content());
        return ResponseEntity.status(HttpStatus.CREATED).body(CommonResponse.success(message, null));
    }
}
