package com.example.mafiaengine.game.domain;

public enum GameStatus {
    IN_PROGRESS,
    RESOLVED
}
