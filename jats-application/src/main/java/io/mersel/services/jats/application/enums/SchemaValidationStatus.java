package io.mersel.services.jats.application.enums;

public enum SchemaValidationStatus {
    VALID,
    INVALID,
    /** Şema yapılandırılmamış, okunamadı veya derlenemedi. */
    SKIPPED
}
