package com.example.mafiaengine.game.domain;

/**
 * 요청자 권한 수준. API 계층이 헤더로부터 결정해서 넘겨준다.
 */
public record Viewer(Level level, String playerName) {

    public enum Level {
        NONE,
        PLAYER,
        MODERATOR
    }

    public static Viewer none() {
        return new Viewer(Level.NONE, null);
    }

    public static Viewer player(String playerName) {
        return new Viewer(Level.PLAYER, playerName);
    }

    public static Viewer moderator() {
        return new Viewer(Level.MODERATOR, null);
    }

    public boolean isModerator() {
        return level == Level.MODERATOR;
    }

    public boolean isPlayer() {
        return level == Level.PLAYER;
    }

    public boolean is(String name) {
        return isPlayer() && playerName.equals(name);
    }
}
