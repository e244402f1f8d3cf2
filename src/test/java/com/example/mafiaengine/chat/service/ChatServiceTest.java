package com.example.mafiaengine.chat.service;

import com.example.mafiaengine.chat.domain.ChatMessage;
import com.example.mafiaengine.chat.domain.ChatRegistry;
import com.example.mafiaengine.chat.dto.ChatMessagesResponse;
import com.example.mafiaengine.chat.dto.ChatSummaryResponse;
import com.example.mafiaengine.game.TestGames;
import com.example.mafiaengine.game.domain.GamePhase;
import com.example.mafiaengine.game.domain.GameState;
import com.example.mafiaengine.game.domain.GameStatus;
import com.example.mafiaengine.game.domain.Viewer;
import com.example.mafiaengine.game.repository.GameStore;
import com.example.mafiaengine.global.concurrency.ReadWriteLockStrategy;
import com.example.mafiaengine.global.config.EngineProperties;
import com.example.mafiaengine.global.error.CommonException;
import com.example.mafiaengine.global.error.ErrorCode;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChatServiceTest {

    private static final String GAME_ID = "game_test";

    private final GameStore gameStore = new GameStore();
    private final ChatService chatService =
            new ChatService(gameStore, new ReadWriteLockStrategy(), EngineProperties.defaults());

    private GameState game;

    @BeforeEach
    void setUp() {
        game = TestGames.game(GamePhase.DAY, 1,
                "Alice:Town:Cop", "Bob:Town:Vanilla", "Carol:Town:Vanilla",
                "Eve:Mafia:Vanilla", "Sam:Mafia:Vanilla");
        gameStore.save(game);
    }

    @Test
    @DisplayName("전체 채팅은 낮에만 살아있는 플레이어가 쓸 수 있다")
    void globalChatFollowsPhaseAndLife() {
        // when
        ChatMessage message = chatService.postMessage(GAME_ID, Viewer.player("Alice"), ChatRegistry.GLOBAL_ID, "hi");

        // then
        assertThat(message.getAuthor()).isEqualTo("Alice");
        assertThat(message.getTimestamp()).isEqualTo(TestGames.CLOCK.instant());

        game.setGamePhase(GamePhase.NIGHT);
        assertErrorCode(() -> chatService.postMessage(GAME_ID, Viewer.player("Alice"), ChatRegistry.GLOBAL_ID, "hi"),
                ErrorCode.CHAT_WRITE_DENIED);

        game.setGamePhase(GamePhase.DAY);
        game.getPlayer("Bob").kill("Lynched");
        assertErrorCode(() -> chatService.postMessage(GAME_ID, Viewer.player("Bob"), ChatRegistry.GLOBAL_ID, "hi"),
                ErrorCode.CHAT_WRITE_DENIED);
        assertErrorCode(() -> chatService.postMessage(GAME_ID, Viewer.none(), ChatRegistry.GLOBAL_ID, "hi"),
                ErrorCode.CHAT_WRITE_DENIED);
    }

    @Test
    @DisplayName("모더레이터는 언제든 쓸 수 있고 작성자는 Moderator로 남는다")
    void moderatorAlwaysWrites() {
        // given
        game.setGamePhase(GamePhase.NIGHT);

        // when
        ChatMessage message = chatService.postMessage(GAME_ID, Viewer.moderator(), ChatRegistry.GLOBAL_ID, "night falls");

        // then
        assertThat(message.getAuthor()).isEqualTo("Moderator");
    }

    @Test
    @DisplayName("마피아 채팅은 진영원만 읽고 쓸 수 있다")
    void factionChatIsMembersOnly() {
        // given
        String factionId = ChatRegistry.factionId("Mafia");

        // when
        ChatMessagesResponse messages = chatService.readMessages(GAME_ID, Viewer.player("Eve"), factionId, null, null);
        game.setGamePhase(GamePhase.NIGHT);
        chatService.postMessage(GAME_ID, Viewer.player("Sam"), factionId, "kill Alice");

        // then
        assertThat(messages.messages()).extracting(ChatMessage::getContent)
                .containsExactly("Eve is a Mafia Goon.", "Sam is a Mafia Goon.");
        assertErrorCode(() -> chatService.readMessages(GAME_ID, Viewer.player("Alice"), factionId, null, null),
                ErrorCode.FORBIDDEN);
        assertErrorCode(() -> chatService.postMessage(GAME_ID, Viewer.player("Alice"), factionId, "hello?"),
                ErrorCode.CHAT_WRITE_DENIED);
    }

    @Test
    @DisplayName("목록에는 읽을 수 있는 채팅만 나온다")
    void listsReadableChats() {
        assertThat(chatService.listChats(GAME_ID, Viewer.player("Alice")))
                .extracting(ChatSummaryResponse::id)
                .containsExactlyInAnyOrder(ChatRegistry.GLOBAL_ID, ChatRegistry.inboxId("Alice"));
        assertThat(chatService.listChats(GAME_ID, Viewer.none()))
                .extracting(ChatSummaryResponse::id)
                .containsExactly(ChatRegistry.GLOBAL_ID);
    }

    @Test
    @DisplayName("페이지 시작은 0 이상으로 보정되고 limit이 없으면 기본 크기")
    void pagesMessages() {
        // given
        for (int i = 0; i < 30; i++) {
            chatService.postMessage(GAME_ID, Viewer.moderator(), ChatRegistry.GLOBAL_ID, "message " + i);
        }

        // when
        ChatMessagesResponse defaults = chatService.readMessages(GAME_ID, Viewer.none(), ChatRegistry.GLOBAL_ID, -5, null);
        ChatMessagesResponse tail = chatService.readMessages(GAME_ID, Viewer.none(), ChatRegistry.GLOBAL_ID, 28, 10);
        ChatMessagesResponse beyond = chatService.readMessages(GAME_ID, Viewer.none(), ChatRegistry.GLOBAL_ID, 100, 10);

        // then
        assertThat(defaults.start()).isZero();
        assertThat(defaults.total()).isEqualTo(30);
        assertThat(defaults.messages()).hasSize(25);
        assertThat(tail.messages()).extracting(ChatMessage::getContent).containsExactly("message 28", "message 29");
        assertThat(beyond.messages()).isEmpty();
    }

    @Test
    @DisplayName("귓속말은 두 사람이 같은 채널을 공유한다")
    void privateMessagesArePairwise() {
        // when
        chatService.postPrivateMessage(GAME_ID, Viewer.player("Alice"), "Bob", "I am the cop");

        // then
        ChatMessagesResponse bobView = chatService.readPrivateMessages(GAME_ID, Viewer.player("Bob"), "Alice", null, null);
        assertThat(bobView.chatId()).isEqualTo(ChatRegistry.pairId("Alice", "Bob"));
        assertThat(bobView.messages()).extracting(ChatMessage::getContent).containsExactly("I am the cop");

        ChatMessagesResponse carolView =
                chatService.readPrivateMessages(GAME_ID, Viewer.player("Carol"), "Alice", null, null);
        assertThat(carolView.messages()).isEmpty();
    }

    @Test
    @DisplayName("거부된 귓속말은 새 채널을 남기지 않는다")
    void rejectedPrivateMessageLeavesNoChannel() {
        // given
        game.getPlayer("Alice").kill("Lynched");
        String pairId = ChatRegistry.pairId("Alice", "Bob");

        // when & then
        assertErrorCode(() -> chatService.postPrivateMessage(GAME_ID, Viewer.player("Alice"), "Bob", "boo"),
                ErrorCode.CHAT_WRITE_DENIED);
        game.setStatus(GameStatus.RESOLVED);
        assertErrorCode(() -> chatService.postPrivateMessage(GAME_ID, Viewer.player("Bob"), "Alice", "gg"),
                ErrorCode.GAME_ALREADY_RESOLVED);
        assertThat(game.getChats().find(pairId)).isEmpty();
        assertThat(chatService.listChats(GAME_ID, Viewer.moderator()))
                .extracting(ChatSummaryResponse::id)
                .doesNotContain(pairId);
    }

    @Test
    @DisplayName("본인과 모더레이터는 개인 수신함을 보고, 플레이어는 수신함에 쓸 수 없다")
    void inboxIsReadOnlyForPlayers() {
        // when
        ChatMessagesResponse own = chatService.readPrivateMessages(GAME_ID, Viewer.player("Alice"), "Alice", null, null);
        ChatMessagesResponse moderator = chatService.readPrivateMessages(GAME_ID, Viewer.moderator(), "Alice", null, null);
        chatService.postPrivateMessage(GAME_ID, Viewer.moderator(), "Alice", "You have been warned.");

        // then
        assertThat(own.messages()).extracting(ChatMessage::getContent).containsExactly("You are a Town Cop.");
        assertThat(moderator.chatId()).isEqualTo(ChatRegistry.inboxId("Alice"));
        assertErrorCode(() -> chatService.postPrivateMessage(GAME_ID, Viewer.player("Alice"), "Alice", "note to self"),
                ErrorCode.CHAT_WRITE_DENIED);
        assertErrorCode(() -> chatService.postPrivateMessage(GAME_ID, Viewer.none(), "Alice", "hello"),
                ErrorCode.NOT_AUTHENTICATED);
    }

    @Test
    @DisplayName("없는 채팅은 CHAT_NOT_FOUND, 끝난 게임에는 쓸 수 없다")
    void rejectsUnknownChatAndResolvedGame() {
        assertErrorCode(() -> chatService.readMessages(GAME_ID, Viewer.moderator(), "faction:Cult", null, null),
                ErrorCode.CHAT_NOT_FOUND);

        game.setStatus(GameStatus.RESOLVED);
        assertErrorCode(() -> chatService.postMessage(GAME_ID, Viewer.moderator(), ChatRegistry.GLOBAL_ID, "gg"),
                ErrorCode.GAME_ALREADY_RESOLVED);
    }

    private static void assertErrorCode(ThrowingCallable call, ErrorCode errorCode) {
        assertThatThrownBy(call)
                .isInstanceOfSatisfying(CommonException.class, e -> assertThat(e.getErrorCode()).isEqualTo(errorCode));
    }
}
