package io.mersel.services.jats.application.models;

import io.mersel.services.jats.application.enums.RepairEventType;

/**
 * Onarım hattında kaydedilen tek bir olay.
 *
 * @param step     Olayı üreten adımın adı (örn: "table-structure")
 * @param type     Olay türü
 * @param message  İnsan tarafından okunabilir açıklama
 * @param location Etkilenen elementin basit yolu (örn: "/article/body/sec[2]/p[1]"), bilinmiyorsa {@code null}
 */
public record RepairEvent(
        String step,
        RepairEventType type,
        String message,
        String location
) {
}
