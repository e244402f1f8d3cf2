package com.example.mafiaengine.game.resolution;

public record EffectResult(ResolutionOutcome outcome, String detail) {

    public static EffectResult success(String detail) {
        return new EffectResult(ResolutionOutcome.SUCCESS, detail);
    }

    public static EffectResult blocked(String detail) {
        return new EffectResult(ResolutionOutcome.BLOCKED, detail);
    }

    public static EffectResult fizzled(String detail) {
        return new EffectResult(ResolutionOutcome.FIZZLED, detail);
    }

    public static EffectResult failed(String detail) {
        return new EffectResult(ResolutionOutcome.FAILED, detail);
    }
}
