package io.mersel.services.jats.infrastructure.repair;

import io.mersel.services.jats.application.enums.RepairEventType;
import io.mersel.services.jats.application.models.RepairContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import static io.mersel.services.jats.infrastructure.TestDocuments.context;
import static io.mersel.services.jats.infrastructure.TestDocuments.first;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("IdRefValidator")
class IdRefValidatorTest {

    private final IdRefValidator validator = new IdRefValidator();

    @Nested
    @DisplayName("Tek hedefli rid")
    class SingleTests {

        @Test
        @DisplayName("Geçerli rid'e dokunulmaz")
        void gecerli() {
            RepairContext ctx = context("""
                    <article><p><xref ref-type="bibr" rid="ref1">1</xref></p><ref id="ref1"/></article>""");

            validator.apply(ctx);

            assertThat(first(ctx.document(), "xref").getAttribute("rid")).isEqualTo("ref1");
            assertThat(ctx.log().size()).isZero();
        }

        @Test
        @DisplayName("Büyük/küçük harf farkı düzeltilir")
        void harf_farki() {
            RepairContext ctx = context("""
                    <article><p><xref ref-type="bibr" rid="Ref1">1</xref></p><ref id="ref1"/></article>""");

            validator.apply(ctx);

            assertThat(first(ctx.document(), "xref").getAttribute("rid")).isEqualTo("ref1");
            assertThat(ctx.log().ofType(RepairEventType.STRUCTURAL_REPAIR)).hasSize(1);
            assertThat(ctx.log().ofType(RepairEventType.RESOLUTION_AMBIGUITY)).isEmpty();
        }

        @Test
        @DisplayName("Konumsal ipucu uygulanır ve belirsizlik olarak raporlanır")
        void konumsal() {
            RepairContext ctx = context("""
                    <article><p><xref ref-type="fig" rid="F9">Şekil 2</xref></p><fig id="fig-a"/><fig id="fig-b"/></article>""");

            validator.apply(ctx);

            assertThat(first(ctx.document(), "xref").getAttribute("rid")).isEqualTo("fig-b");
            assertThat(ctx.log().ofType(RepairEventType.RESOLUTION_AMBIGUITY)).hasSize(1);
        }

        @Test
        @DisplayName("alt niteliğindeki sayı metinden önce gelir")
        void alt_ipucu() {
            RepairContext ctx = context("""
                    <article><p><xref ref-type="table" rid="T" alt="Tablo 1">Tablo 2</xref></p><table-wrap id="t1"/><table-wrap id="t2"/></article>""");

            validator.apply(ctx);

            assertThat(first(ctx.document(), "xref").getAttribute("rid")).isEqualTo("t1");
        }

        @Test
        @DisplayName("Hedefsiz xref metni korunarak açılır")
        void hedefsiz_xref() {
            RepairContext ctx = context("""
                    <article><p>Bkz. <xref ref-type="bibr" rid="missing">[9]</xref> sonra</p><ref id="ref1"/></article>""");

            validator.apply(ctx);

            Element p = first(ctx.document(), "p");
            assertThat(first(ctx.document(), "xref")).isNull();
            assertThat(p.getTextContent()).isEqualTo("Bkz. [9] sonra");
        }

        @Test
        @DisplayName("xref dışındaki elementte hedefsiz rid silinir")
        void hedefsiz_nitelik() {
            RepairContext ctx = context("<article><contrib rid=\"nope\"/></article>");

            validator.apply(ctx);

            Element contrib = first(ctx.document(), "contrib");
            assertThat(contrib).isNotNull();
            assertThat(contrib.hasAttribute("rid")).isFalse();
        }
    }

    @Nested
    @DisplayName("Çok hedefli değerler")
    class MultiTests {

        @Test
        @DisplayName("rids geçerli hedeflere süzülür")
        void rids_suzme() {
            RepairContext ctx = context("""
                    <article><named-content rids="ref1 zz ref2"/><ref id="ref1"/><ref id="ref2"/></article>""");

            validator.apply(ctx);

            assertThat(first(ctx.document(), "named-content").getAttribute("rids")).isEqualTo("ref1 ref2");
        }

        @Test
        @DisplayName("Boşluk içeren rid çok hedefli sayılır")
        void bosluklu_rid() {
            RepairContext ctx = context("""
                    <article><p><xref ref-type="bibr" rid="ref1 ref9">1</xref></p><ref id="ref1"/></article>""");

            validator.apply(ctx);

            assertThat(first(ctx.document(), "xref").getAttribute("rid")).isEqualTo("ref1");
        }

        @Test
        @DisplayName("Hiç geçerli hedef kalmazsa nitelik silinir")
        void hic_gecerli_yok() {
            RepairContext ctx = context("<article><named-content rids=\"a b\"/></article>");

            validator.apply(ctx);

            assertThat(first(ctx.document(), "named-content").hasAttribute("rids")).isFalse();
        }
    }

    @Test
    @DisplayName("Yinelenen id yeniden adlandırılmaz, bildirilir")
    void yinelenen_id() {
        RepairContext ctx = context("<article><sec id=\"s1\"/><sec id=\"s1\"/></article>");

        validator.apply(ctx);

        assertThat(ctx.log().ofType(RepairEventType.INPUT_NOTICE))
                .singleElement()
                .extracting(e -> e.message())
                .isEqualTo("Yinelenen id 's1'");
        assertThat(ctx.document().getElementsByTagName("sec").item(1).getAttributes().getNamedItem("id").getNodeValue())
                .isEqualTo("s1");
    }
}
