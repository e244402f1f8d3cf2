package com.example.mafiaengine.game.queue;

import com.example.mafiaengine.game.ability.AbilityInstance;
import com.example.mafiaengine.game.domain.GamePhase;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * 게임별 능력 큐. 삽입 순서를 유지하고 (능력, 사용자)당 항목 하나만 둔다.
 * 모더레이터가 확정한 항목은 별도로 보관되며 플레이어가 바꿀 수 없다.
 */
public class AbilityQueue {

    private final Map<QueueKey, QueuedAbility> entries = new LinkedHashMap<>();
    private final Map<QueueKey, QueuedAbility> committed = new LinkedHashMap<>();

    /**
     * 같은 키가 있으면 교체. 교체된 항목은 맨 뒤로 간다.
     */
    public void put(QueuedAbility queued) {
        entries.remove(queued.key());
        entries.put(queued.key(), queued);
    }

    public Optional<QueuedAbility> find(String instanceKey, String user) {
        QueueKey key = new QueueKey(instanceKey, user);
        return Optional.ofNullable(entries.getOrDefault(key, committed.get(key)));
    }

    /**
     * 능력 인스턴스 기준으로 찾는다 (공유 능력은 사용자와 무관하게 하나)
     */
    public Optional<QueuedAbility> findByInstance(String instanceKey) {
        return all()
                .filter(queued -> queued.getInstance().getKey().equals(instanceKey))
                .findFirst();
    }

    /**
     * 확정된 항목이 있어 더 이상 바꿀 수 없는지. 공유 능력은 사용자와 무관하게 본다.
     */
    public boolean isCommitted(AbilityInstance instance, String user) {
        if (instance.isShared()) {
            return committed.keySet().stream().anyMatch(key -> key.instanceKey().equals(instance.getKey()));
        }
        return committed.containsKey(new QueueKey(instance.getKey(), user));
    }

    /**
     * 현재 일차/페이즈로 찍힌 항목을 확정하고 나머지는 버린다.
     * 확정된 항목은 다음 해결 때 그대로 처리된다.
     *
     * @return 확정된 항목 수
     */
    public int commit(int dayNo, GamePhase phase) {
        int count = 0;
        for (Iterator<QueuedAbility> it = entries.values().iterator(); it.hasNext(); ) {
            QueuedAbility queued = it.next();
            it.remove();
            if (queued.isStampedFor(dayNo, phase)) {
                committed.put(queued.key(), queued);
                count++;
            }
        }
        return count;
    }

    // 확정된 항목은 지우지 않는다
    public boolean remove(String instanceKey, String user) {
        return entries.remove(new QueueKey(instanceKey, user)) != null;
    }

    public boolean removeByInstance(String instanceKey) {
        return entries.keySet().removeIf(key -> key.instanceKey().equals(instanceKey));
    }

    /**
     * 확정된 항목 먼저, 그 다음 대기 항목
     */
    public List<QueuedAbility> snapshot() {
        List<QueuedAbility> snapshot = new ArrayList<>(committed.values());
        snapshot.addAll(entries.values());
        return List.copyOf(snapshot);
    }

    public boolean isEmpty() {
        return entries.isEmpty() && committed.isEmpty();
    }

    public int size() {
        return entries.size() + committed.size();
    }

    public void clear() {
        entries.clear();
        committed.clear();
    }

    private Stream<QueuedAbility> all() {
        return Stream.concat(entries.values().stream(), committed.values().stream());
    }
}
