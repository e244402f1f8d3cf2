package com.example.mafiaengine.game.dto.response;

import java.util.List;
import java.util.Map;

public record VoteTallyResponse(
        // 투표자 -> 대상 (null = 처형 없음)
        Map<String, String> votes,
        List<VoteCount> tally) {

    public record VoteCount(String target, int count, List<String> voters) {
    }
}
