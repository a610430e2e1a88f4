package io.mersel.services.jats.application.enums;

/**
 * Onarım günlüğüne düşen olay türleri.
 */
public enum RepairEventType {
    /** Girdi ile ilgili bilgi: toleranslı ayrıştırma, beklenmeyen kök element, reddedilen öneri. */
    INPUT_NOTICE,
    /** Uygulanmış en iyi çaba düzeltmesi (placeholder satır, sentezlenmiş metadata vb.). */
    STRUCTURAL_REPAIR,
    /** Güvenle sınıflandırılamayan veya tahmine dayalı eşlenen referans. */
    RESOLUTION_AMBIGUITY
}
