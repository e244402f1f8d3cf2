package com.example.mafiaengine.game.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 모더레이터 게임 조작
 */
public enum GameAction {
    @JsonProperty("dequeue")
    DEQUEUE,
    @JsonProperty("resolve")
    RESOLVE,
    @JsonProperty("next_phase")
    NEXT_PHASE,
    @JsonProperty("clear_votes")
    CLEAR_VOTES,
    @JsonProperty("post_vote_count")
    POST_VOTE_COUNT
}
