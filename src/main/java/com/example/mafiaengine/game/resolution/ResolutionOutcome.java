package com.example.mafiaengine.game.resolution;

public enum ResolutionOutcome {
    SUCCESS,
    // 보호 효과에 막힘
    BLOCKED,
    // 해결되지 않고 건너뜀 (롤블락, 사용자/대상 사망, Lazy)
    FIZZLED,
    // 효과가 실행됐지만 아무 일도 일어나지 않음
    FAILED,
    // 다른 일차/페이즈에 예약된 항목
    EXPIRED
}
