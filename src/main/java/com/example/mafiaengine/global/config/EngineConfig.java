package com.example.mafiaengine.global.config;

import com.example.mafiaengine.game.resolution.ResolutionOrder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 역할 셔플, 모더레이터 토큰 생성용
     */
    @Bean
    public Random random() {
        return new SecureRandom();
    }

    @Bean
    public ResolutionOrder resolutionOrder(EngineProperties engineProperties) {
        return new ResolutionOrder(engineProperties.categoryOrder());
    }
}
