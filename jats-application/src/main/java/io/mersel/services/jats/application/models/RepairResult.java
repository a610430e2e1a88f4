package io.mersel.services.jats.application.models;

/**
 * Tek bir belgenin onarım sonucu.
 * <p>
 * Aynı onarılmış ağaçtan üretilmiş iki serileştirme ve uyumluluk raporunu taşır.
 * DTD varyantı PMC Style Checker'a, şema varyantı XSD doğrulayıcılarına gider.
 */
public class RepairResult {

    private final byte[] schemaVariant;
    private final byte[] dtdVariant;
    private final ComplianceReport report;
    private final long durationMs;

    private RepairResult(Builder builder) {
        this.schemaVariant = builder.schemaVariant;
        this.dtdVariant = builder.dtdVariant;
        this.report = builder.report;
        this.durationMs = builder.durationMs;
    }

    /** DOCTYPE içermeyen, {@code xsi:noNamespaceSchemaLocation} taşıyan varyant (UTF-8). */
    public byte[] getSchemaVariant() {
        return schemaVariant;
    }

    /** DOCTYPE bildirimli, şema konumu içermeyen varyant (UTF-8). */
    public byte[] getDtdVariant() {
        return dtdVariant;
    }

    public ComplianceReport getReport() {
        return report;
    }

    /** İşlem süresi (milisaniye). */
    public long getDurationMs() {
        return durationMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private byte[] schemaVariant;
        private byte[] dtdVariant;
        private ComplianceReport report;
        private long durationMs;

        private Builder() {
        }

        public Builder schemaVariant(byte[] schemaVariant) {
            this.schemaVariant = schemaVariant;
            return this;
        }

        public Builder dtdVariant(byte[] dtdVariant) {
            this.dtdVariant = dtdVariant;
            return this;
        }

        public Builder report(ComplianceReport report) {
            this.report = report;
            return this;
        }

        public Builder durationMs(long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public RepairResult build() {
            return new RepairResult(this);
        }
    }
}
