package com.example.mafiaengine.game.domain;

public enum GamePhase {
    DAY,
    NIGHT
}
