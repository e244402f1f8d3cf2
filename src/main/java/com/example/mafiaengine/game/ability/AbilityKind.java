package com.example.mafiaengine.game.ability;

public enum AbilityKind {
    ACTION,
    SHARED_ACTION,
    PASSIVE
}
