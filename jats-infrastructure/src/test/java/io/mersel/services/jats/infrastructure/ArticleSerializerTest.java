package io.mersel.services.jats.infrastructure;

import io.mersel.services.jats.application.enums.JatsVersion;
import io.mersel.services.jats.infrastructure.config.RepairProperties;
import io.mersel.services.jats.infrastructure.dom.XmlNodes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;

import java.nio.charset.StandardCharsets;

import static io.mersel.services.jats.infrastructure.TestDocuments.parse;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ArticleSerializer")
class ArticleSerializerTest {

    private static final String ARTICLE = """
            <article xmlns:xlink="http://www.w3.org/1999/xlink" dtd-version="1.3"><body><p>Ş<ext-link xlink:href="u">x</ext-link></p></body></article>""";

    private RepairProperties properties;
    private ArticleSerializer serializer;

    @BeforeEach
    void setUp() {
        properties = new RepairProperties();
        serializer = new ArticleSerializer(properties);
    }

    private static String text(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Şema varyantı")
    class SchemaVariantTests {

        @Test
        @DisplayName("DOCTYPE içermez, şema konumunu taşır")
        void sema_konumu() {
            String xml = text(serializer.toSchemaVariant(parse(ARTICLE)));

            assertThat(xml).startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<article");
            assertThat(xml).doesNotContain("<!DOCTYPE");
            assertThat(xml).contains("xmlns:xsi=\"" + XmlNodes.XSI_NS + "\"");
            assertThat(xml).contains("xsi:noNamespaceSchemaLocation=\"" + JatsVersion.V1_3.getSchemaLocation() + "\"");
        }

        @Test
        @DisplayName("Yapılandırılan şema konumu kullanılır")
        void yapilandirilan_konum() {
            properties.setSchemaLocation("JATS-journalpublishing1-3.xsd");

            String xml = text(serializer.toSchemaVariant(parse(ARTICLE)));

            assertThat(xml).contains("xsi:noNamespaceSchemaLocation=\"JATS-journalpublishing1-3.xsd\"");
        }
    }

    @Nested
    @DisplayName("DTD varyantı")
    class DtdVariantTests {

        @Test
        @DisplayName("Hedef sürümün DOCTYPE'ını taşır, şema konumu içermez")
        void doctype() {
            String xml = text(serializer.toDtdVariant(parse(ARTICLE)));

            assertThat(xml).startsWith("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                    + JatsVersion.V1_3.getDoctypeDeclaration() + "\n<article");
            assertThat(xml).doesNotContain("noNamespaceSchemaLocation");
            assertThat(xml).doesNotContain("xmlns:xsi");
        }

        @Test
        @DisplayName("Girdideki xsi nitelikleri ve bildirimi kaldırılır")
        void xsi_temizligi() {
            Document doc = parse("""
                    <article xmlns:xsi="http://www.w3.org/2001/XMLSchema-instance" xsi:noNamespaceSchemaLocation="a.xsd"><body/></article>""");

            String xml = text(serializer.toDtdVariant(doc));

            assertThat(xml).doesNotContain("xsi");
        }

        @Test
        @DisplayName("Sürüm 1.4 hedeflenince DOCTYPE da 1.4 olur")
        void surum_1_4() {
            properties.setDtdVersion("1.4");

            String xml = text(serializer.toDtdVariant(parse(ARTICLE)));

            assertThat(xml).contains(JatsVersion.V1_4.getPublicId());
        }
    }

    @Test
    @DisplayName("Serileştirme ağacı değiştirmez ve aynı ağaç aynı baytları üretir")
    void deterministik() {
        Document doc = parse(ARTICLE);

        byte[] first = serializer.toDtdVariant(doc);
        serializer.toSchemaVariant(doc);
        byte[] second = serializer.toDtdVariant(doc);

        assertThat(second).isEqualTo(first);
        assertThat(doc.getDocumentElement().hasAttributeNS(XmlNodes.XMLNS_NS, "xsi")).isFalse();
        assertThat(text(first)).contains("Ş");
    }
}
