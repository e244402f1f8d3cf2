package com.example.mafiaengine.game.service;

import com.example.mafiaengine.chat.domain.Chat;
import com.example.mafiaengine.chat.domain.ChatRegistry;
import com.example.mafiaengine.game.ability.AbilityDefinition;
import com.example.mafiaengine.game.ability.AbilityInstance;
import com.example.mafiaengine.game.ability.AbilityKind;
import com.example.mafiaengine.game.catalog.RoleCatalog;
import com.example.mafiaengine.game.domain.Alignment;
import com.example.mafiaengine.game.domain.GamePlayer;
import com.example.mafiaengine.game.domain.GameState;
import com.example.mafiaengine.game.domain.Role;
import com.example.mafiaengine.game.dto.request.CreateGameRequest.RoleSetup;
import com.example.mafiaengine.game.knowledge.KnowledgeFact;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.function.Function;

/**
 * 플레이어 생성 + 역할/진영 배정 + 능력 인스턴스 초기화.
 * 배정 후 정보를 공유하는 진영/역할끼리 서로의 신원을 알게 하고 채팅방을 연다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoleAssigner {

    private static final String INFORMED = "informed";
    private static final String CHAT = "chat";

    private final RoleCatalog roleCatalog;
    private final Random random;

    public void assignRoles(GameState game, List<String> names, List<RoleSetup> setups, boolean shuffle) {
        List<RoleSetup> roles = new ArrayList<>(setups);
        if (shuffle) {
            Collections.shuffle(roles, random);
        }

        Map<String, List<AbilityInstance>> sharedByAlignment = new HashMap<>();
        for (int i = 0; i < names.size(); i++) {
            RoleSetup setup = roles.get(i);
            Role role = roleCatalog.role(setup.role(), setup.modifiers());
            Alignment alignment = roleCatalog.alignment(setup.alignment());

            GamePlayer player = GamePlayer.builder()
                    .name(names.get(i))
                    .role(role)
                    .alignment(alignment)
                    .build();
            addAbilities(game, player, role.composeAbilities());
            addAbilities(game, player, alignment.getActions());
            addAbilities(game, player, alignment.getPassives());
            player.getSharedActions().addAll(sharedByAlignment.computeIfAbsent(alignment.getId(),
                    id -> sharedInstances(game, alignment)));
            game.addPlayer(player);
        }

        shareKnowledge(game);
        openChats(game);
        log.info("[역할배정] 완료: gameId={}, players={}, shuffled={}", game.getGameId(), names.size(), shuffle);
    }

    // ================= 능력 인스턴스 =================

    private void addAbilities(GameState game, GamePlayer player, List<AbilityDefinition> definitions) {
        for (AbilityDefinition definition : definitions) {
            AbilityInstance instance = new AbilityInstance(player.getName(), definition);
            game.getAbilityRegistry().register(instance);
            if (definition.getKind() == AbilityKind.PASSIVE) {
                player.getPassives().add(instance);
            } else {
                player.getActions().add(instance);
            }
        }
    }

    private List<AbilityInstance> sharedInstances(GameState game, Alignment alignment) {
        List<AbilityInstance> instances = new ArrayList<>();
        for (AbilityDefinition definition : alignment.getSharedActions()) {
            AbilityInstance instance = new AbilityInstance("alignment:" + alignment.getId(), definition);
            game.getAbilityRegistry().register(instance);
            instances.add(instance);
        }
        return instances;
    }

    // ================= 정보 공유 =================

    private void shareKnowledge(GameState game) {
        Collection<GamePlayer> players = game.getPlayers().values();
        for (GamePlayer observer : players) {
            for (GamePlayer subject : players) {
                if (observer == subject) {
                    continue;
                }
                boolean sameInformedAlignment = observer.isAlliedWith(subject)
                        && observer.getAlignment().hasTag(INFORMED);
                boolean sameInformedRole = observer.getRole().getId().equals(subject.getRole().getId())
                        && observer.getRole().hasTag(INFORMED);
                if (sameInformedAlignment || sameInformedRole) {
                    game.getKnowledge().learn(observer.getName(), subject.getName(), KnowledgeFact.identity(subject));
                }
            }
        }
    }

    // ================= 채팅방 =================

    private void openChats(GameState game) {
        ChatRegistry chats = game.getChats();
        for (GamePlayer player : game.getPlayers().values()) {
            chats.notify(player.getName(), "You are a " + player.getRoleName() + ".");
        }

        Map<String, List<GamePlayer>> factions = groupBy(game, player -> player.getAlignment().hasTag(CHAT)
                ? ChatRegistry.factionId(player.getAlignment().getId()) : null);
        factions.forEach((chatId, members) ->
                openGroup(chats, chatId, members.get(0).getAlignment().getId(), members));

        Map<String, List<GamePlayer>> roleGroups = groupBy(game, player -> player.getRole().hasTag(CHAT)
                ? ChatRegistry.roleId(player.getRole().getId()) : null);
        roleGroups.forEach((chatId, members) ->
                openGroup(chats, chatId, members.get(0).getRole().getId(), members));
    }

    private Map<String, List<GamePlayer>> groupBy(GameState game, Function<GamePlayer, String> chatIdOf) {
        Map<String, List<GamePlayer>> groups = new LinkedHashMap<>();
        for (GamePlayer player : game.getPlayers().values()) {
            String chatId = chatIdOf.apply(player);
            if (chatId != null) {
                groups.computeIfAbsent(chatId, k -> new ArrayList<>()).add(player);
            }
        }
        return groups;
    }

    private void openGroup(ChatRegistry chats, String chatId, String title, List<GamePlayer> members) {
        Set<String> names = new LinkedHashSet<>();
        members.forEach(member -> names.add(member.getName()));
        Chat chat = chats.group(chatId, title, names);
        for (GamePlayer member : members) {
            chats.post(chat, ChatRegistry.SYSTEM_AUTHOR, member.getName() + " is a " + member.getRoleName() + ".");
        }
    }
}
