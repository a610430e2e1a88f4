package io.mersel.services.jats.application.enums;

/**
 * Uyumluluk raporunun genel durumu.
 */
public enum ComplianceStatus {
    /** Şema doğrulaması geçti, tüm yapısal kontroller başarılı, belirsizlik yok. */
    PASS,
    /** Şema doğrulaması atlandı, bir kontrol başarısız veya insan incelemesi gereken belirsizlik var. */
    WARNING,
    /** Onarılmış belge şema doğrulamasından geçemedi. */
    FAIL
}
