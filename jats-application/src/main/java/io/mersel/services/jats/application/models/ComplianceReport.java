package io.mersel.services.jats.application.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.mersel.services.jats.application.enums.ComplianceStatus;

import java.util.List;

/**
 * Onarım sonrası uyumluluk raporu.
 * <p>
 * Motorun tekrar tüketmediği saf çıktı modelidir; Jackson ile doğrudan
 * JSON'a serileştirilir:
 * <ul>
 *   <li>{@code status}: PASS / WARNING / FAIL</li>
 *   <li>{@code checks}: yapısal kontrol sonuçları (ad, sonuç, açıklama)</li>
 *   <li>{@code errors}: serbest biçimli hata listesi (şema hataları dahil)</li>
 *   <li>{@code repairs}, {@code ambiguities}, {@code notices}: onarım günlüğünden</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ComplianceReport {

    private final ComplianceStatus status;
    private final String targetVersion;
    private final SchemaValidationResult schemaValidation;
    private final List<StructuralCheckResult> checks;
    private final List<String> errors;
    private final List<RepairEvent> repairs;
    private final List<RepairEvent> ambiguities;
    private final List<RepairEvent> notices;
    private final DocumentStructure documentStructure;

    private ComplianceReport(Builder builder) {
        this.status = builder.status;
        this.targetVersion = builder.targetVersion;
        this.schemaValidation = builder.schemaValidation;
        this.checks = List.copyOf(builder.checks);
        this.errors = List.copyOf(builder.errors);
        this.repairs = List.copyOf(builder.repairs);
        this.ambiguities = List.copyOf(builder.ambiguities);
        this.notices = List.copyOf(builder.notices);
        this.documentStructure = builder.documentStructure;
    }

    public ComplianceStatus getStatus() {
        return status;
    }

    /** Hedef JATS sürümü (örn: "1.3"). */
    public String getTargetVersion() {
        return targetVersion;
    }

    public SchemaValidationResult getSchemaValidation() {
        return schemaValidation;
    }

    public List<StructuralCheckResult> getChecks() {
        return checks;
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<RepairEvent> getRepairs() {
        return repairs;
    }

    public List<RepairEvent> getAmbiguities() {
        return ambiguities;
    }

    public List<RepairEvent> getNotices() {
        return notices;
    }

    public DocumentStructure getDocumentStructure() {
        return documentStructure;
    }

    /**
     * Adı verilen kontrolün sonucunu döndürür; kontrol yoksa {@code null}.
     */
    public StructuralCheckResult check(String name) {
        return checks.stream()
                .filter(c -> c.name().equals(name))
                .findFirst()
                .orElse(null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ComplianceStatus status;
        private String targetVersion;
        private SchemaValidationResult schemaValidation;
        private List<StructuralCheckResult> checks = List.of();
        private List<String> errors = List.of();
        private List<RepairEvent> repairs = List.of();
        private List<RepairEvent> ambiguities = List.of();
        private List<RepairEvent> notices = List.of();
        private DocumentStructure documentStructure;

        private Builder() {
        }

        public Builder status(ComplianceStatus status) {
            this.status = status;
            return this;
        }

        public Builder targetVersion(String targetVersion) {
            this.targetVersion = targetVersion;
            return this;
        }

        public Builder schemaValidation(SchemaValidationResult schemaValidation) {
            this.schemaValidation = schemaValidation;
            return this;
        }

        public Builder checks(List<StructuralCheckResult> checks) {
            this.checks = checks;
            return this;
        }

        public Builder errors(List<String> errors) {
            this.errors = errors;
            return this;
        }

        public Builder repairs(List<RepairEvent> repairs) {
            this.repairs = repairs;
            return this;
        }

        public Builder ambiguities(List<RepairEvent> ambiguities) {
            this.ambiguities = ambiguities;
            return this;
        }

        public Builder notices(List<RepairEvent> notices) {
            this.notices = notices;
            return this;
        }

        public Builder documentStructure(DocumentStructure documentStructure) {
            this.documentStructure = documentStructure;
            return this;
        }

        public ComplianceReport build() {
            return new ComplianceReport(this);
        }
    }
}
