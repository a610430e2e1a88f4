package io.mersel.services.jats.application.models;

/**
 * Onarılmış belgenin özet yapısı (raporun {@code documentStructure} bölümü).
 */
public record DocumentStructure(
        String dtdVersion,
        String articleType,
        int tableCount,
        int figureCount,
        int referenceCount
) {
}
