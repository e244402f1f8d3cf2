package com.example.mafiaengine.game.dto.request;

/**
 * target이 null이면 "처형 없음"에 투표
 */
public record VoteRequest(String target) {
}
