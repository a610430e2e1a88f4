package io.mersel.services.jats.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.mersel.services.jats.application.models.ComplianceReport;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Uyumluluk raporunu Jackson ile JSON'a yazan yardımcı sınıf.
 * <p>
 * Rapor, renderer ve iş kuyruğu gibi dış bileşenlere bu biçimde aktarılır.
 * Elle JSON metni oluşturmak yerine bu sınıf kullanılmalıdır.
 */
public final class ReportJsonWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ReportJsonWriter() {
    }

    public static String toJson(ComplianceReport report) {
        try {
            return MAPPER.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Uyumluluk raporu JSON'a dönüştürülemedi", e);
        }
    }

    /**
     * @throws IOException yazma hatası
     */
    public static void write(OutputStream out, ComplianceReport report) throws IOException {
        MAPPER.writeValue(out, report);
    }
}
