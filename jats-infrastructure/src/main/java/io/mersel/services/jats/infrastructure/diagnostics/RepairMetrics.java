package io.mersel.services.jats.infrastructure.diagnostics;

import com.github.benmanes.caffeine.cache.Cache;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * JATS onarım servisi özel metrikleri.
 */
@Component
public class RepairMetrics {

    private final MeterRegistry registry;

    public RepairMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Bir onarım adımının uyguladığı düzeltme ve belirsizlik sayılarını kaydet.
     *
     * @param step        Adım adı
     * @param repairs     Uygulanan düzeltme sayısı
     * @param ambiguities Dokunulmadan bırakılan belirsiz durum sayısı
     */
    public void recordStep(String step, long repairs, long ambiguities) {
        if (repairs > 0) {
            Counter.builder("jats_repairs_total")
                    .tag("step", step)
                    .description("Uygulanan yapısal düzeltme sayısı")
                    .register(registry)
                    .increment(repairs);
        }
        if (ambiguities > 0) {
            Counter.builder("jats_ambiguities_total")
                    .tag("step", step)
                    .description("Çözümlenemeyen referans belirsizliği sayısı")
                    .register(registry)
                    .increment(ambiguities);
        }
    }

    /**
     * Tamamlanan hat çalıştırmasını kaydet.
     *
     * @param status     Rapor durumu (PASS, WARNING, FAIL)
     * @param durationMs Toplam süre (milisaniye)
     */
    public void recordPipeline(String status, long durationMs) {
        Counter.builder("jats_pipeline_total")
                .tag("status", status)
                .description("Onarım hattı çalıştırma sayısı")
                .register(registry)
                .increment();

        Timer.builder("jats_pipeline_duration")
                .description("Onarım hattı süresi")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Ölümcül ayrıştırma hatasını kaydet.
     */
    public void recordParseFailure() {
        Counter.builder("jats_parse_failures_total")
                .description("Ayrıştırılamayan belge sayısı")
                .register(registry)
                .increment();
    }

    /**
     * Şema doğrulama metriklerini kaydet.
     *
     * @param result     "valid", "invalid" veya "skipped"
     * @param durationMs İşlem süresi (milisaniye)
     */
    public void recordSchemaValidation(String result, long durationMs) {
        Counter.builder("jats_schema_validations_total")
                .tag("result", result)
                .description("Toplam şema doğrulama sayısı")
                .register(registry)
                .increment();

        Timer.builder("jats_schema_validation_duration")
                .description("Şema doğrulama süresi")
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    /**
     * Derlenmiş XSD cache boyutu için gauge kaydeder.
     *
     * @param cache Derlenmiş şema cache'i (Caffeine)
     */
    public void registerSchemaCacheSizeGauge(Cache<?, ?> cache) {
        Gauge.builder("jats_schema_cache_size", cache, c -> (double) c.estimatedSize())
                .description("Önbelleğe alınmış derlenmiş XSD sayısı")
                .register(registry);
    }
}
