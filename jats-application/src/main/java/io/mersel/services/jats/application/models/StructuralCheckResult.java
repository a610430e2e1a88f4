package io.mersel.services.jats.application.models;

/**
 * Tek bir yerel yapısal kontrolün sonucu.
 *
 * @param name        Kontrol adı (örn: "table-wrap-position")
 * @param passed      Kontrol geçti mi
 * @param description İnsan tarafından okunabilir açıklama
 */
public record StructuralCheckResult(
        String name,
        boolean passed,
        String description
) {
}
