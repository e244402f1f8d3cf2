package com.example.mafiaengine.game.queue;

public record QueueKey(String instanceKey, String user) {
}
