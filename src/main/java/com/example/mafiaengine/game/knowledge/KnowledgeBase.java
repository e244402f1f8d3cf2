package com.example.mafiaengine.game.knowledge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 관찰자 -> 대상 -> 사실. 한 번 배운 사실은 지워지지 않는다.
 */
public class KnowledgeBase {

    private final Map<String, Map<String, KnowledgeFact>> facts = new LinkedHashMap<>();

    public void learn(String observer, String subject, KnowledgeFact fact) {
        facts.computeIfAbsent(observer, k -> new LinkedHashMap<>())
                .merge(subject, fact, KnowledgeFact::merge);
    }

    public Optional<KnowledgeFact> knows(String observer, String subject) {
        return Optional.ofNullable(facts.getOrDefault(observer, Map.of()).get(subject));
    }

    public Set<String> knownSubjects(String observer) {
        return Collections.unmodifiableSet(facts.getOrDefault(observer, Map.of()).keySet());
    }
}
