package com.example.mafiaengine.chat.domain;

import com.example.mafiaengine.game.domain.GameState;
import com.example.mafiaengine.game.domain.Viewer;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 채팅 채널. 메시지는 추가만 가능하다.
 */
@Getter
public class Chat {

    private final String id;
    private final String title;
    private final ChatType type;
    private final Set<String> members;
    private final List<ChatMessage> messages = new ArrayList<>();

    public Chat(String id, String title, ChatType type, Set<String> members) {
        this.id = id;
        this.title = title;
        this.type = type;
        this.members = new LinkedHashSet<>(members);
    }

    public Set<String> getMembers() {
        return Collections.unmodifiableSet(members);
    }

    public List<ChatMessage> getMessages() {
        return Collections.unmodifiableList(messages);
    }

    public void append(ChatMessage message) {
        messages.add(message);
    }

    public boolean canRead(Viewer viewer) {
        if (viewer.isModerator() || type == ChatType.GLOBAL) {
            return true;
        }
        return viewer.isPlayer() && members.contains(viewer.playerName());
    }

    /**
     * 모더레이터는 항상 가능. 플레이어는 살아있어야 하고,
     * 전체 채팅은 채팅 페이즈에만, 수신함은 쓸 수 없다.
     */
    public boolean canWrite(Viewer viewer, GameState game) {
        if (viewer.isModerator()) {
            return true;
        }
        if (!viewer.isPlayer() || type == ChatType.INBOX) {
            return false;
        }
        boolean alive = game.findPlayer(viewer.playerName()).map(p -> p.isAlive()).orElse(false);
        if (!alive) {
            return false;
        }
        if (type == ChatType.GLOBAL) {
            return game.getChatPhases().contains(game.getGamePhase());
        }
        return members.contains(viewer.playerName());
    }
}
