package com.example.mafiaengine;

import com.example.mafiaengine.game.resolution.ResolutionOrder;
import com.example.mafiaengine.global.concurrency.LockStrategy;
import com.example.mafiaengine.global.config.EngineProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class MafiaEngineApplicationTests {

    @Autowired
    private EngineProperties engineProperties;

    @Autowired
    private ResolutionOrder resolutionOrder;

    @Autowired
    private LockStrategy lockStrategy;

    @Test
    @DisplayName("application.yml 설정이 엔진에 그대로 반영된다")
    void contextLoads() {
        assertThat(resolutionOrder.getCategoryOrder()).isEqualTo(engineProperties.categoryOrder());
        assertThat(engineProperties.messagePageSize()).isEqualTo(25);
        assertThat(lockStrategy.getStrategyName()).isEqualTo("READ_WRITE");
    }
}
