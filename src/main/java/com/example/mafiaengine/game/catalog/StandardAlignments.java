package com.example.mafiaengine.game.catalog;

import com.example.mafiaengine.game.domain.Alignment;
import com.example.mafiaengine.game.domain.WinConditions;

import java.util.List;
import java.util.Map;
import java.util.Set;

public final class StandardAlignments {

    private StandardAlignments() {
    }

    public static List<Alignment> all() {
        return List.of(
                Alignment.builder()
                        .id("Town")
                        .tags(Set.of("town"))
                        .demonym("Townie")
                        .winCondition(WinConditions.lastStanding())
                        .build(),
                Alignment.builder()
                        .id("Mafia")
                        .tags(Set.of("mafia", "informed", "chat"))
                        .demonym("Mafioso")
                        .sharedActions(List.of(StandardAbilities.factionalKill()))
                        .roleNames(Map.of("Vanilla", "Mafia Goon"))
                        .winCondition(WinConditions.lastStanding())
                        .build(),
                Alignment.builder()
                        .id("Serial Killer")
                        .actions(List.of(StandardAbilities.kill("Serial Kill", "Killed by a Serial Killer")))
                        .roleNames(Map.of("Vanilla", "Serial Killer"))
                        .winCondition(WinConditions.lastStandingOrNobodyAlive())
                        .build());
    }
}
