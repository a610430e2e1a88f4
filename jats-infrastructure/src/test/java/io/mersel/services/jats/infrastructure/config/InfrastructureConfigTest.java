package io.mersel.services.jats.infrastructure.config;

import io.mersel.services.jats.application.enums.JatsVersion;
import io.mersel.services.jats.application.interfaces.IArticleRepairService;
import io.mersel.services.jats.application.interfaces.IRepairStep;
import io.mersel.services.jats.infrastructure.ArticleRepairService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Altyapı bileşenlerinin Spring bağlamında birlikte ayağa kalktığını doğrular.
 */
@SpringJUnitConfig(classes = {InfrastructureConfig.class, InfrastructureConfigTest.MetricsConfig.class})
@TestPropertySource(properties = "jats.repair.dtd-version=1.4")
@DisplayName("InfrastructureConfig")
class InfrastructureConfigTest {

    @Configuration
    static class MetricsConfig {

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Autowired
    private IArticleRepairService repairService;

    @Autowired
    private RepairProperties properties;

    @Test
    @DisplayName("Tüm onarım adımları sırayla bağlanır")
    void adimlar() {
        assertThat(repairService).isInstanceOf(ArticleRepairService.class);
        assertThat(((ArticleRepairService) repairService).getSteps())
                .extracting(IRepairStep::order)
                .containsExactly(10, 20, 30, 35, 40, 45, 50, 60, 70, 80);
    }

    @Test
    @DisplayName("Yapılandırma özellikleri bağlanır")
    void ozellikler() {
        assertThat(properties.getTargetVersion()).isEqualTo(JatsVersion.V1_4);
        assertThat(properties.getCitation().getReferenceIdPrefix()).isEqualTo("ref");
    }
}
