package com.example.mafiaengine.game.modifier;

import com.example.mafiaengine.game.ability.AbilityContext;
import com.example.mafiaengine.game.ability.AbilityDefinition;
import com.example.mafiaengine.game.ability.AbilityEffect;
import com.example.mafiaengine.game.ability.AbilityKind;
import com.example.mafiaengine.game.ability.AbilityTags;
import com.example.mafiaengine.game.domain.GamePhase;
import com.example.mafiaengine.game.domain.GamePlayer;
import com.example.mafiaengine.game.resolution.EffectResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 표준 수식어 모음
 */
public final class Modifiers {

    private static final Pattern X_SHOT = Pattern.compile("(\\d+)-Shot");
    private static final Pattern NIGHT_X = Pattern.compile("Night ([\\d,\\s]+)");

    private static final Map<String, Supplier<Modifier>> FIXED = new LinkedHashMap<>();

    static {
        FIXED.put("Odd Night", Modifiers::oddNight);
        FIXED.put("Even Night", Modifiers::evenNight);
        FIXED.put("Day", Modifiers::day);
        FIXED.put("Non-Consecutive Night", Modifiers::nonConsecutiveNight);
        FIXED.put("Indecisive", Modifiers::indecisive);
        FIXED.put("Weak", Modifiers::weak);
        FIXED.put("Loyal", Modifiers::loyal);
        FIXED.put("Disloyal", Modifiers::disloyal);
        FIXED.put("Personal", Modifiers::personal);
        FIXED.put("Self-Targeted", Modifiers::selfTargeted);
        FIXED.put("Lazy", Modifiers::lazy);
        FIXED.put("Activated", Modifiers::activated);
        FIXED.put("Unstoppable", Modifiers::unstoppable);
    }

    private Modifiers() {
    }

    /**
     * 표시 이름으로 수식어 생성 ("2-Shot", "Night 1,3", "Weak" ...)
     */
    public static Optional<Modifier> parse(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String trimmed = id.trim();
        Matcher shot = X_SHOT.matcher(trimmed);
        if (shot.matches()) {
            return Optional.of(xShot(Integer.parseInt(shot.group(1))));
        }
        Matcher night = NIGHT_X.matcher(trimmed);
        if (night.matches()) {
            Set<Integer> nights = Arrays.stream(night.group(1).split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .map(Integer::parseInt)
                    .collect(Collectors.toCollection(TreeSet::new));
            return nights.isEmpty() ? Optional.empty() : Optional.of(nightX(nights));
        }
        return Optional.ofNullable(FIXED.get(trimmed)).map(Supplier::get);
    }

    public static List<String> knownIds() {
        List<String> ids = new ArrayList<>(List.of("X-Shot", "Night X"));
        ids.addAll(FIXED.keySet());
        return ids;
    }

    // ================= 사용 조건 =================

    public static Modifier xShot(int maxUses) {
        return eligibility(maxUses + "-Shot", context -> context.instance().getUses() < maxUses);
    }

    public static Modifier nightX(Set<Integer> nights) {
        String id = "Night " + nights.stream().map(String::valueOf).collect(Collectors.joining(","));
        return eligibility(id, context -> nights.contains(context.game().getDayNo()));
    }

    public static Modifier oddNight() {
        return eligibility("Odd Night", context -> context.game().getDayNo() % 2 == 1);
    }

    public static Modifier evenNight() {
        return eligibility("Even Night", context -> context.game().getDayNo() % 2 == 0);
    }

    public static Modifier day() {
        return new SimpleModifier("Day", ability -> ability.toBuilder().phase(GamePhase.DAY).build());
    }

    /**
     * 마지막 사용 당일과 다음 날에는 사용 불가
     */
    public static Modifier nonConsecutiveNight() {
        return eligibility("Non-Consecutive Night", context -> {
            Integer last = context.instance().getLastUsedDay();
            return last == null || context.game().getDayNo() > last + 1;
        });
    }

    /**
     * 연속된 이틀 안에 같은 자리에 같은 대상을 다시 고를 수 없다. 대상 없이 검사할 때는 통과.
     */
    public static Modifier indecisive() {
        return eligibility("Indecisive", context -> {
            if (context.targets().isEmpty()) {
                return true;
            }
            Integer last = context.instance().getLastUsedDay();
            if (last == null || context.game().getDayNo() - last > 1) {
                return true;
            }
            List<String> previous = context.instance().getLastTargets();
            List<GamePlayer> targets = context.targets();
            for (int i = 0; i < Math.min(targets.size(), previous.size()); i++) {
                if (targets.get(i).getName().equals(previous.get(i))) {
                    return false;
                }
            }
            return true;
        });
    }

    // ================= 효과 변경 =================

    /**
     * 대상 중 Town이 아닌 플레이어가 있으면 사용자가 죽는다
     */
    public static Modifier weak() {
        return effect("Weak", inner -> (context, action) -> {
            EffectResult result = inner.apply(context, action);
            if (action.getTargets().stream().anyMatch(target -> !target.isTown())) {
                context.kill(action.getUser(), "Weak");
            }
            return result;
        });
    }

    /**
     * 같은 진영 대상에게만 효과가 있다
     */
    public static Modifier loyal() {
        return effect("Loyal", inner -> (context, action) -> {
            if (action.getTargets().stream().anyMatch(target -> !target.isAlliedWith(action.getUser()))) {
                return EffectResult.failed("loyal ability used on a non-ally");
            }
            return inner.apply(context, action);
        });
    }

    /**
     * 같은 진영 대상에게는 효과가 없다
     */
    public static Modifier disloyal() {
        return effect("Disloyal", inner -> (context, action) -> {
            if (action.getTargets().stream().anyMatch(target -> target.isAlliedWith(action.getUser()))) {
                return EffectResult.failed("disloyal ability used on an ally");
            }
            return inner.apply(context, action);
        });
    }

    // ================= 태그 / 형태 변경 =================

    public static Modifier personal() {
        return tag("Personal", AbilityTags.PERSONAL);
    }

    public static Modifier lazy() {
        return tag("Lazy", AbilityTags.LAZY);
    }

    public static Modifier unstoppable() {
        return tag("Unstoppable", AbilityTags.UNSTOPPABLE);
    }

    /**
     * 대상을 고르지 않고 사용자 자신에게 적용
     */
    public static Modifier selfTargeted() {
        return new SimpleModifier("Self-Targeted", ability -> ability.toBuilder()
                .targetCount(0)
                .build()
                .withTag(AbilityTags.SELF_TARGETED));
    }

    /**
     * 패시브를 직접 큐에 넣어야 하는 액션으로 바꾼다
     */
    public static Modifier activated() {
        return new SimpleModifier("Activated", ability -> ability.getKind() != AbilityKind.PASSIVE
                ? ability
                : ability.toBuilder().kind(AbilityKind.ACTION).build());
    }

    // ================= 내부 조립 =================

    private static Modifier eligibility(String id, Predicate<AbilityContext> condition) {
        return new SimpleModifier(id, ability -> ability.toBuilder()
                .eligibility(ability.getEligibility().and(condition::test))
                .build());
    }

    private static Modifier effect(String id, UnaryOperator<AbilityEffect> wrapper) {
        return new SimpleModifier(id, ability -> ability.toBuilder()
                .effect(wrapper.apply(ability.getEffect()))
                .build());
    }

    private static Modifier tag(String id, String tag) {
        return new SimpleModifier(id, ability -> ability.withTag(tag));
    }

    private record SimpleModifier(String id, UnaryOperator<AbilityDefinition> transform) implements Modifier {

        @Override
        public String getId() {
            return id;
        }

        @Override
        public AbilityDefinition apply(AbilityDefinition ability) {
            return transform.apply(ability);
        }
    }
}
