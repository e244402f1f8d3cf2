package com.example.mafiaengine.game.resolution;

import com.example.mafiaengine.game.ability.AbilityCategory;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * 해결 순서: 우선순위 오름차순 -> 카테고리 순서 -> 삽입 순서
 */
public class ResolutionOrder implements Comparator<PendingAction> {

    private final Map<AbilityCategory, Integer> ranks = new EnumMap<>(AbilityCategory.class);
    private final List<AbilityCategory> categoryOrder;

    public ResolutionOrder(List<AbilityCategory> categoryOrder) {
        int total = AbilityCategory.values().length;
        if (categoryOrder == null || categoryOrder.size() != total || new HashSet<>(categoryOrder).size() != total) {
            throw new IllegalArgumentException(
                    "category order must list every category exactly once: " + categoryOrder);
        }
        this.categoryOrder = List.copyOf(categoryOrder);
        for (int i = 0; i < categoryOrder.size(); i++) {
            ranks.put(categoryOrder.get(i), i);
        }
    }

    public List<AbilityCategory> getCategoryOrder() {
        return categoryOrder;
    }

    @Override
    public int compare(PendingAction a, PendingAction b) {
        int byPriority = Integer.compare(a.getAbility().getPriority(), b.getAbility().getPriority());
        if (byPriority != 0) {
            return byPriority;
        }
        int byCategory = Integer.compare(rankOf(a), rankOf(b));
        if (byCategory != 0) {
            return byCategory;
        }
        return Long.compare(a.getSequence(), b.getSequence());
    }

    private int rankOf(PendingAction action) {
        AbilityCategory category = action.getAbility().getCategory();
        return category == null ? ranks.size() : ranks.get(category);
    }
}
