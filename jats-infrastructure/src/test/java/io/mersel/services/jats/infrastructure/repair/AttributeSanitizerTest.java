package io.mersel.services.jats.infrastructure.repair;

import io.mersel.services.jats.application.enums.RepairEventType;
import io.mersel.services.jats.application.models.RepairContext;
import io.mersel.services.jats.infrastructure.config.RepairProperties;
import io.mersel.services.jats.infrastructure.dom.XmlNodes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import java.util.List;

import static io.mersel.services.jats.infrastructure.TestDocuments.context;
import static io.mersel.services.jats.infrastructure.TestDocuments.first;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AttributeSanitizer")
class AttributeSanitizerTest {

    private RepairProperties properties;
    private AttributeSanitizer sanitizer;

    @BeforeEach
    void setUp() {
        properties = new RepairProperties();
        sanitizer = new AttributeSanitizer(properties);
    }

    @Test
    @DisplayName("data-* ve class nitelikleri silinir, id kalır")
    void yasakli_nitelikler_silinir() {
        RepairContext ctx = context("""
                <article><body><p id="p1" class="Body" data-pid="7">Metin</p><p data-pid="8">İkinci</p></body></article>""");

        sanitizer.apply(ctx);

        Element p = first(ctx.document(), "p");
        assertThat(p.getAttribute("id")).isEqualTo("p1");
        assertThat(p.hasAttribute("class")).isFalse();
        assertThat(p.hasAttribute("data-pid")).isFalse();
        assertThat(ctx.log().ofType(RepairEventType.STRUCTURAL_REPAIR))
                .extracting(e -> e.message())
                .containsExactly(
                        "'class' niteliği 1 elementten silindi",
                        "'data-pid' niteliği 2 elementten silindi");
    }

    @Test
    @DisplayName("Namespace bildirimleri ve xlink nitelikleri korunur")
    void namespace_korunur() {
        RepairContext ctx = context("""
                <article xmlns:xlink="http://www.w3.org/1999/xlink"><body><p><ext-link xlink:href="https://example.org">x</ext-link></p></body></article>""");

        sanitizer.apply(ctx);

        Element link = first(ctx.document(), "ext-link");
        assertThat(link.getAttributeNS(XmlNodes.XLINK_NS, "href")).isEqualTo("https://example.org");
        assertThat(ctx.root().hasAttributeNS(XmlNodes.XMLNS_NS, "xlink")).isTrue();
        assertThat(ctx.log().size()).isZero();
    }

    @Test
    @DisplayName("Yapılandırılan önek ve liste kullanılır")
    void yapilandirma() {
        properties.getSanitizer().setBannedPrefixes(List.of("aria-"));
        properties.getSanitizer().setDeniedAttributes(List.of("style"));

        assertThat(sanitizer.isBanned("aria-label")).isTrue();
        assertThat(sanitizer.isBanned("style")).isTrue();
        assertThat(sanitizer.isBanned("data-x")).isFalse();
        assertThat(sanitizer.isBanned("class")).isFalse();
    }

    @Test
    @DisplayName("Varsayılan kurallar gramer niteliklerine dokunmaz")
    void gramer_nitelikleri() {
        assertThat(sanitizer.isBanned("id")).isFalse();
        assertThat(sanitizer.isBanned("rid")).isFalse();
        assertThat(sanitizer.isBanned("colspan")).isFalse();
        assertThat(sanitizer.isBanned("position")).isFalse();
        assertThat(sanitizer.isBanned("class")).isTrue();
        assertThat(sanitizer.isBanned("data-anything")).isTrue();
    }
}
