package com.example.mafiaengine.game.dto.request;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 능력 id -> 대상 이름 목록. 대상이 null이면 예약 취소.
 */
public record QueueAbilitiesRequest(
        Map<String, List<String>> actions,
        Map<String, List<String>> sharedActions) {

    public Map<String, List<String>> merged() {
        Map<String, List<String>> merged = new LinkedHashMap<>();
        if (actions != null) {
            merged.putAll(actions);
        }
        if (sharedActions != null) {
            merged.putAll(sharedActions);
        }
        return merged;
    }
}
