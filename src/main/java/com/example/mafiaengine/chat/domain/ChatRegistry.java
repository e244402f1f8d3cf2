package com.example.mafiaengine.chat.domain;

import com.example.mafiaengine.game.domain.Viewer;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 게임별 채팅 채널 목록.
 * 채널 id: "global", "faction:{alignment}", "role:{role}", "player:{name}", "pm:{a}:{b}"
 */
public class ChatRegistry {

    public static final String GLOBAL_ID = "global";
    public static final String SYSTEM_AUTHOR = "System";

    private final Map<String, Chat> chats = new LinkedHashMap<>();
    private final Clock clock;

    public ChatRegistry(Clock clock) {
        this.clock = clock;
        chats.put(GLOBAL_ID, new Chat(GLOBAL_ID, "Global", ChatType.GLOBAL, Set.of()));
    }

    public static String factionId(String alignmentId) {
        return "faction:" + alignmentId;
    }

    public static String roleId(String roleId) {
        return "role:" + roleId;
    }

    public static String inboxId(String playerName) {
        return "player:" + playerName;
    }

    /**
     * 이름 순으로 정렬해서 같은 쌍은 항상 같은 id
     */
    public static String pairId(String a, String b) {
        return a.compareTo(b) <= 0 ? "pm:" + a + ":" + b : "pm:" + b + ":" + a;
    }

    public Chat global() {
        return chats.get(GLOBAL_ID);
    }

    public Chat group(String id, String title, Set<String> members) {
        return chats.computeIfAbsent(id, k -> new Chat(k, title, ChatType.GROUP, members));
    }

    public Chat inbox(String playerName) {
        return chats.computeIfAbsent(inboxId(playerName),
                k -> new Chat(k, playerName, ChatType.INBOX, Set.of(playerName)));
    }

    /**
     * 두 사람의 귓속말. 처음이면 등록되지 않은 채널을 돌려주고, 첫 메시지가 올라갈 때 등록된다.
     */
    public Chat pair(String a, String b) {
        String id = pairId(a, b);
        return find(id).orElseGet(() -> new Chat(id, id.substring("pm:".length()), ChatType.PRIVATE, Set.of(a, b)));
    }

    public Optional<Chat> find(String chatId) {
        return Optional.ofNullable(chats.get(chatId));
    }

    public Collection<Chat> all() {
        return chats.values();
    }

    public List<Chat> readableBy(Viewer viewer) {
        return chats.values().stream().filter(chat -> chat.canRead(viewer)).toList();
    }

    public ChatMessage post(Chat chat, String author, String content) {
        ChatMessage message = ChatMessage.builder()
                .author(author)
                .content(content)
                .timestamp(clock.instant())
                .build();
        chats.putIfAbsent(chat.getId(), chat);
        chat.append(message);
        return message;
    }

    public void announce(String content) {
        post(global(), SYSTEM_AUTHOR, content);
    }

    public void notify(String playerName, String content) {
        post(inbox(playerName), SYSTEM_AUTHOR, content);
    }
}
