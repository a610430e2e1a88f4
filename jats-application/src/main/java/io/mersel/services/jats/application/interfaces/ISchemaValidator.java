package io.mersel.services.jats.application.interfaces;

import io.mersel.services.jats.application.models.SchemaValidationResult;
import org.w3c.dom.Document;

import java.nio.file.Path;

/**
 * XML Schema (XSD) doğrulama servisi arayüzü.
 * <p>
 * Onarılmış ağacı yapılandırılmış JATS XSD'sine göre doğrular.
 * Ağacı değiştirmez. Şema yoksa veya derlenemiyorsa {@code SKIPPED} döner.
 */
public interface ISchemaValidator {

    /**
     * @param tree   Doğrulanacak belge
     * @param schema Ana XSD dosyası
     * @return Doğrulama sonucu ve kullanıcı dostu hata listesi
     */
    SchemaValidationResult validate(Document tree, Path schema);

    /**
     * Derlenmiş şema cache'ini temizler. XSD dosyaları değiştiğinde çağrılır.
     */
    void invalidateCache();
}
