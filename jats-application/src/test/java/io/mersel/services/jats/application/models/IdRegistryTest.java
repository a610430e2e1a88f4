package io.mersel.services.jats.application.models;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.xml.sax.InputSource;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.StringReader;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IdRegistry")
class IdRegistryTest {

    private static Document parse(String xml) throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        return factory.newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
    }

    @Nested
    @DisplayName("scan")
    class ScanTests {

        @Test
        @DisplayName("Belge sırasıyla id'leri toplar")
        void belge_sirasi() throws Exception {
            IdRegistry ids = IdRegistry.scan(parse("""
                    <article><sec id="s1"><fig id="f1"/></sec><ref id="ref1"/></article>"""));

            assertThat(ids.ids()).containsExactly("s1", "f1", "ref1");
            assertThat(ids.size()).isEqualTo(3);
            assertThat(ids.contains("f1")).isTrue();
            assertThat(ids.get("ref1")).get().extracting(e -> e.getNodeName()).isEqualTo("ref");
        }

        @Test
        @DisplayName("Yinelenen id'de ilk element kazanır ve id yinelenenlere eklenir")
        void yinelenen_id() throws Exception {
            IdRegistry ids = IdRegistry.scan(parse("""
                    <article><sec id="x"/><fig id="x"/></article>"""));

            assertThat(ids.get("x")).get().extracting(e -> e.getNodeName()).isEqualTo("sec");
            assertThat(ids.duplicates()).containsExactly("x");
        }

        @Test
        @DisplayName("id'siz belgede kayıt defteri boştur")
        void bos() throws Exception {
            IdRegistry ids = IdRegistry.scan(parse("<article><p/></article>"));

            assertThat(ids.size()).isZero();
            assertThat(ids.get("p")).isEmpty();
        }
    }

    @Nested
    @DisplayName("findIgnoreCase")
    class FindIgnoreCaseTests {

        @Test
        @DisplayName("Tekil eşleşmede gerçek id'yi döndürür")
        void tekil_eslesme() throws Exception {
            IdRegistry ids = IdRegistry.scan(parse("<article><ref id=\"ref1\"/></article>"));

            assertThat(ids.findIgnoreCase("Ref1")).contains("ref1");
        }

        @Test
        @DisplayName("Birden fazla adayda boş döner")
        void coklu_aday() throws Exception {
            IdRegistry ids = IdRegistry.scan(parse("<article><ref id=\"ref1\"/><ref id=\"REF1\"/></article>"));

            assertThat(ids.findIgnoreCase("Ref1")).isEmpty();
        }

        @Test
        @DisplayName("null için boş döner")
        void null_girdi() throws Exception {
            IdRegistry ids = IdRegistry.scan(parse("<article/>"));

            assertThat(ids.findIgnoreCase(null)).isEmpty();
        }
    }

    @Test
    @DisplayName("RepairContext ağaç değişince kayıt defterini yeniden oluşturur")
    void context_gecersiz_kilma() throws Exception {
        Document doc = parse("<article><sec id=\"s1\"/></article>");
        RepairContext context = new RepairContext(doc, new RepairLog());
        assertThat(context.ids().contains("s1")).isTrue();

        doc.getDocumentElement().getFirstChild().getAttributes().getNamedItem("id").setNodeValue("s2");
        assertThat(context.ids().contains("s1")).isTrue();

        context.treeModified();
        assertThat(context.ids().contains("s2")).isTrue();
        assertThat(context.ids().contains("s1")).isFalse();
    }
}
