package com.example.mafiaengine.game.ability;

@FunctionalInterface
public interface Eligibility {

    boolean test(AbilityContext context);

    default Eligibility and(Eligibility other) {
        return context -> test(context) && other.test(context);
    }

    static Eligibility always() {
        return context -> true;
    }
}
