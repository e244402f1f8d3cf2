package com.example.mafiaengine.game.catalog;

import com.example.mafiaengine.game.domain.Role;
import com.example.mafiaengine.game.modifier.Modifiers;

import java.util.List;
import java.util.Set;

public final class StandardRoles {

    private StandardRoles() {
    }

    public static List<Role> all() {
        return List.of(
                Role.builder()
                        .id("Vanilla")
                        .description("No special abilities.")
                        .adjective(true)
                        .build(),
                Role.builder()
                        .id("Cop")
                        .description("Investigates one player's alignment each night.")
                        .actions(List.of(StandardAbilities.investigate()))
                        .build(),
                Role.builder()
                        .id("Doctor")
                        .description("Protects one player from a kill each night.")
                        .actions(List.of(StandardAbilities.protect()))
                        .build(),
                Role.builder()
                        .id("Vigilante")
                        .description("Kills one player each night.")
                        .actions(List.of(StandardAbilities.kill("Kill", "Shot by a Vigilante")))
                        .build(),
                Role.builder()
                        .id("Roleblocker")
                        .description("Blocks one player's abilities each night.")
                        .actions(List.of(StandardAbilities.roleblock()))
                        .build(),
                Role.builder()
                        .id("Redirector")
                        .description("Redirects one player's abilities onto another each night.")
                        .actions(List.of(StandardAbilities.redirect()))
                        .build(),
                Role.builder()
                        .id("Watcher")
                        .description("Learns who visited one player each night.")
                        .actions(List.of(StandardAbilities.watch()))
                        .build(),
                Role.builder()
                        .id("Bodyguard")
                        .description("Protects one player each night and dies in their place.")
                        .actions(List.of(StandardAbilities.guard()))
                        .build(),
                Role.builder()
                        .id("Bulletproof")
                        .description("Cannot be killed at night.")
                        .adjective(true)
                        .passives(List.of(StandardAbilities.bulletproof()))
                        .build(),
                Role.builder()
                        .id("Innocent Child")
                        .description("May reveal their alignment to everyone once.")
                        .actions(List.of(StandardAbilities.reveal()))
                        .modifiers(List.of(Modifiers.xShot(1)))
                        .build(),
                Role.builder()
                        .id("Mason")
                        .description("Knows the other Masons and shares a chat with them.")
                        .tags(Set.of("informed", "chat"))
                        .build());
    }
}
