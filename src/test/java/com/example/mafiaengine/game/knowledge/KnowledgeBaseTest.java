package com.example.mafiaengine.game.knowledge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class KnowledgeBaseTest {

    private final KnowledgeBase knowledge = new KnowledgeBase();

    @Test
    @DisplayName("진영과 역할을 따로 배우면 합쳐진다")
    void mergesPartialFacts() {
        // when
        knowledge.learn("Alice", "Eve", KnowledgeFact.alignment("Mafia"));
        knowledge.learn("Alice", "Eve", KnowledgeFact.role("Vanilla"));

        // then
        assertThat(knowledge.knows("Alice", "Eve")).contains(new KnowledgeFact("Mafia", "Vanilla"));
        assertThat(knowledge.knows("Alice", "Eve").orElseThrow().isComplete()).isTrue();
    }

    @Test
    @DisplayName("이미 배운 사실은 덮어쓰이거나 지워지지 않는다")
    void factsAreMonotonic() {
        // given
        knowledge.learn("Alice", "Eve", KnowledgeFact.alignment("Mafia"));

        // when
        knowledge.learn("Alice", "Eve", KnowledgeFact.alignment("Town"));
        knowledge.learn("Alice", "Eve", new KnowledgeFact(null, null));

        // then
        assertThat(knowledge.knows("Alice", "Eve")).map(KnowledgeFact::alignmentId).contains("Mafia");
    }

    @Test
    @DisplayName("관찰자별로 분리되어 있다")
    void separatedByObserver() {
        // when
        knowledge.learn("Alice", "Eve", KnowledgeFact.alignment("Mafia"));

        // then
        assertThat(knowledge.knows("Bob", "Eve")).isEmpty();
        assertThat(knowledge.knownSubjects("Alice")).containsExactly("Eve");
        assertThat(knowledge.knownSubjects("Bob")).isEmpty();
    }
}
