package io.mersel.services.jats.application.interfaces;

import java.util.Optional;

/**
 * Harici (LLM tabanlı) içerik onarım önerisi sağlayıcısı.
 * <p>
 * Önerilen metin güvenilmez girdi sayılır: kullanılırsa yükleyiciden yeniden
 * geçirilir ve aynı onarım hattına girer. Ayrı bir onarım yolu değildir.
 */
public interface IRepairSuggestionProvider {

    /**
     * @param document Ham belge metni
     * @return Önerilen belge metni; öneri yoksa boş
     */
    Optional<String> suggest(String document);
}
