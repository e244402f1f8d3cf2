package com.example.mafiaengine.chat.service;

import com.example.mafiaengine.chat.domain.Chat;
import com.example.mafiaengine.chat.domain.ChatMessage;
import com.example.mafiaengine.chat.domain.ChatRegistry;
import com.example.mafiaengine.chat.dto.ChatMessagesResponse;
import com.example.mafiaengine.chat.dto.ChatSummaryResponse;
import com.example.mafiaengine.game.domain.GameState;
import com.example.mafiaengine.game.domain.Viewer;
import com.example.mafiaengine.game.repository.GameStore;
import com.example.mafiaengine.global.concurrency.LockStrategy;
import com.example.mafiaengine.global.config.EngineProperties;
import com.example.mafiaengine.global.error.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChatService {

    private static final String LOCK_PREFIX = "game:";
    private static final String MODERATOR_AUTHOR = "Moderator";

    private final GameStore gameStore;
    private final LockStrategy lockStrategy;
    private final EngineProperties engineProperties;

    // ================== 채팅방 ================== //

    public List<ChatSummaryResponse> listChats(String gameId, Viewer viewer) {
        return read(gameId, game -> game.getChats().readableBy(viewer).stream()
                .map(ChatSummaryResponse::from)
                .toList());
    }

    public ChatMessagesResponse readMessages(String gameId, Viewer viewer, String chatId, Integer start, Integer limit) {
        return read(gameId, game -> {
            Chat chat = game.getChats().find(chatId)
                    .orElseThrow(() -> ErrorCode.CHAT_NOT_FOUND.commonException(chatId));
            if (!chat.canRead(viewer)) {
                throw ErrorCode.FORBIDDEN.commonException(chatId);
            }
            return page(chat.getId(), chat.getMessages(), start, limit);
        });
    }

    public ChatMessage postMessage(String gameId, Viewer viewer, String chatId, String content) {
        return write(gameId, game -> {
            Chat chat = game.getChats().find(chatId)
                    .orElseThrow(() -> ErrorCode.CHAT_NOT_FOUND.commonException(chatId));
            return post(game, viewer, chat, content);
        });
    }

    // ================== 개인 메시지 ================== //

    /**
     * 본인 이름이면 개인 수신함, 다른 플레이어 이름이면 두 사람의 귓속말.
     * 모더레이터는 해당 플레이어의 수신함을 본다.
     */
    public ChatMessagesResponse readPrivateMessages(String gameId, Viewer viewer, String playerName,
            Integer start, Integer limit) {
        return read(gameId, game -> {
            game.getPlayer(playerName);
            String chatId = privateChatId(viewer, playerName);
            // 아직 대화가 없는 귓속말은 빈 목록
            Optional<Chat> chat = game.getChats().find(chatId);
            return page(chatId, chat.map(Chat::getMessages).orElse(List.of()), start, limit);
        });
    }

    public ChatMessage postPrivateMessage(String gameId, Viewer viewer, String playerName, String content) {
        return write(gameId, game -> {
            game.getPlayer(playerName);
            ChatRegistry chats = game.getChats();
            Chat chat = viewer.isModerator() || viewer.is(playerName)
                    ? chats.inbox(playerName)
                    : chats.pair(requirePlayer(viewer), playerName);
            return post(game, viewer, chat, content);
        });
    }

    // ================== 내부 처리 ================== //

    private ChatMessage post(GameState game, Viewer viewer, Chat chat, String content) {
        if (game.isResolved()) {
            throw ErrorCode.GAME_ALREADY_RESOLVED.commonException();
        }
        if (!chat.canWrite(viewer, game)) {
            throw ErrorCode.CHAT_WRITE_DENIED.commonException(chat.getId());
        }
        String author = viewer.isModerator() ? MODERATOR_AUTHOR : viewer.playerName();
        ChatMessage message = game.getChats().post(chat, author, content);
        log.debug("[채팅] gameId={}, chatId={}, author={}", game.getGameId(), chat.getId(), author);
        return message;
    }

    private String privateChatId(Viewer viewer, String playerName) {
        if (viewer.isModerator() || viewer.is(playerName)) {
            return ChatRegistry.inboxId(playerName);
        }
        return ChatRegistry.pairId(requirePlayer(viewer), playerName);
    }

    private String requirePlayer(Viewer viewer) {
        if (!viewer.isPlayer()) {
            throw ErrorCode.NOT_AUTHENTICATED.commonException();
        }
        return viewer.playerName();
    }

    /**
     * start는 0 이상으로 보정, limit이 없거나 음수면 기본 페이지 크기
     */
    private ChatMessagesResponse page(String chatId, List<ChatMessage> messages, Integer start, Integer limit) {
        int from = Math.max(0, start == null ? 0 : start);
        int size = limit == null || limit < 0 ? engineProperties.messagePageSize() : limit;
        int begin = Math.min(from, messages.size());
        int end = (int) Math.min((long) begin + size, messages.size());
        return new ChatMessagesResponse(chatId, from, messages.size(), List.copyOf(messages.subList(begin, end)));
    }

    private <T> T read(String gameId, Function<GameState, T> action) {
        return lockStrategy.executeWithReadLock(LOCK_PREFIX + gameId, () -> action.apply(gameStore.getById(gameId)));
    }

    private <T> T write(String gameId, Function<GameState, T> action) {
        return lockStrategy.executeWithLock(LOCK_PREFIX + gameId, () -> action.apply(gameStore.getById(gameId)));
    }
}
