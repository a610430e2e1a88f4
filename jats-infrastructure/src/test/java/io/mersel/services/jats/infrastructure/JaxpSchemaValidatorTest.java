package io.mersel.services.jats.infrastructure;

import io.mersel.services.jats.application.enums.SchemaValidationStatus;
import io.mersel.services.jats.application.models.SchemaValidationResult;
import io.mersel.services.jats.infrastructure.diagnostics.RepairMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static io.mersel.services.jats.infrastructure.TestDocuments.parse;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * JaxpSchemaValidator birim testleri.
 * <p>
 * Küçük bir XSD geçici dizine yazılır; doğrulama, hata dönüşümü, cache ve
 * HTTP import'larının lokal çözümü test edilir.
 */
@DisplayName("JaxpSchemaValidator")
class JaxpSchemaValidatorTest {

    private static final String ARTICLE_XSD = """
            <xs:schema xmlns:xs="http://www.w3.org/2001/XMLSchema">
              <xs:element name="article">
                <xs:complexType>
                  <xs:sequence>
                    <xs:element name="body">
                      <xs:complexType>
                        <xs:sequence>
                          <xs:element name="p" type="xs:string" maxOccurs="unbounded"/>
                        </xs:sequence>
                      </xs:complexType>
                    </xs:element>
                  </xs:sequence>
                  <xs:attribute name="dtd-version" type="xs:string"/>
                </xs:complexType>
              </xs:element>
            </xs:schema>
            """;

    @TempDir
    Path tempDir;

    private SimpleMeterRegistry registry;
    private JaxpSchemaValidator validator;
    private Path schema;

    @BeforeEach
    void setUp() throws IOException {
        registry = new SimpleMeterRegistry();
        validator = new JaxpSchemaValidator(new RepairMetrics(registry));
        validator.init();
        schema = write("article.xsd", ARTICLE_XSD);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Nested
    @DisplayName("Doğrulama")
    class ValidationTests {

        @Test
        @DisplayName("Geçerli belge VALID döner")
        void gecerli() {
            SchemaValidationResult result = validator.validate(
                    parse("<article dtd-version=\"1.3\"><body><p>Metin</p></body></article>"), schema);

            assertThat(result.status()).isEqualTo(SchemaValidationStatus.VALID);
            assertThat(result.errors()).isEmpty();
            assertThat(registry.counter("jats_schema_validations_total", "result", "valid").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Yanlış yerdeki element satır/sütun ile raporlanır")
        void yanlis_element() {
            SchemaValidationResult result = validator.validate(
                    parse("<article><body><p>x</p><table/></body></article>"), schema);

            assertThat(result.status()).isEqualTo(SchemaValidationStatus.INVALID);
            assertThat(result.errors()).isNotEmpty();
            assertThat(result.errors().get(0)).startsWith("Satır ").contains("\"table\" elementi bu konumda geçersiz");
            assertThat(registry.counter("jats_schema_validations_total", "result", "invalid").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("İzin verilmeyen nitelik Türkçe mesajla raporlanır")
        void izinsiz_nitelik() {
            SchemaValidationResult result = validator.validate(
                    parse("<article foo=\"1\"><body><p>x</p></body></article>"), schema);

            assertThat(result.status()).isEqualTo(SchemaValidationStatus.INVALID);
            assertThat(result.errors()).anyMatch(e -> e.contains("\"article\" elementinde \"foo\" niteliği kullanılamaz."));
        }
    }

    @Nested
    @DisplayName("Atlanan doğrulama")
    class SkippedTests {

        @Test
        @DisplayName("XSD dosyası yoksa SKIPPED döner")
        void dosya_yok() {
            SchemaValidationResult result = validator.validate(
                    parse("<article/>"), tempDir.resolve("yok.xsd"));

            assertThat(result.status()).isEqualTo(SchemaValidationStatus.SKIPPED);
            assertThat(result.errors().get(0)).contains("XSD dosyası bulunamadı");
            assertThat(registry.counter("jats_schema_validations_total", "result", "skipped").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("null yol SKIPPED döner")
        void null_yol() {
            assertThat(validator.validate(parse("<article/>"), null).status())
                    .isEqualTo(SchemaValidationStatus.SKIPPED);
        }

        @Test
        @DisplayName("Derlenemeyen XSD SKIPPED döner")
        void bozuk_xsd() throws IOException {
            Path broken = write("broken.xsd", "bu bir şema değil");

            SchemaValidationResult result = validator.validate(parse("<article/>"), broken);

            assertThat(result.status()).isEqualTo(SchemaValidationStatus.SKIPPED);
            assertThat(result.errors().get(0)).contains("XSD derlenemedi");
        }
    }

    @Nested
    @DisplayName("Cache")
    class CacheTests {

        @Test
        @DisplayName("Aynı XSD bir kez derlenir, temizlenince cache boşalır")
        void cache() {
            validator.validate(parse("<article><body><p>a</p></body></article>"), schema);
            validator.validate(parse("<article><body><p>b</p></body></article>"), schema);

            assertThat(registry.get("jats_schema_cache_size").gauge().value()).isEqualTo(1.0);

            validator.invalidateCache();

            assertThat(registry.get("jats_schema_cache_size").gauge().value()).isZero();
        }
    }

    @Test
    @DisplayName("HTTP import lokal kopyadan çözülür")
    void http_import() throws IOException {
        write("modules/xlink.xsd", """
                <xs:schema xmlns:xs="http://www.w3.org/2001/XMLSchema"
                           targetNamespace="http://www.w3.org/1999/xlink">
                  <xs:attribute name="href" type="xs:string"/>
                </xs:schema>
                """);
        Path main = write("linked.xsd", """
                <xs:schema xmlns:xs="http://www.w3.org/2001/XMLSchema"
                           xmlns:xlink="http://www.w3.org/1999/xlink">
                  <xs:import namespace="http://www.w3.org/1999/xlink"
                             schemaLocation="https://example.invalid/standard-modules/xlink.xsd"/>
                  <xs:element name="article">
                    <xs:complexType>
                      <xs:attribute ref="xlink:href"/>
                    </xs:complexType>
                  </xs:element>
                </xs:schema>
                """);

        SchemaValidationResult result = validator.validate(parse("""
                <article xmlns:xlink="http://www.w3.org/1999/xlink" xlink:href="u"/>"""), main);

        assertThat(result.status()).isEqualTo(SchemaValidationStatus.VALID);
    }
}
