package io.mersel.services.jats.infrastructure.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Altyapı katmanı Spring yapılandırması.
 * <p>
 * Bu katmandaki tüm bileşenleri (yükleyici, onarım adımları, JAXP, Saxon, metrikler)
 * otomatik tarar ve onarım yapılandırma özelliklerini etkinleştirir.
 * Çağıran uygulama bir {@code MeterRegistry} bean'i sağlamalıdır.
 */
@Configuration
@ComponentScan(basePackages = "io.mersel.services.jats.infrastructure")
@EnableConfigurationProperties(RepairProperties.class)
public class InfrastructureConfig {
}
