package io.mersel.services.jats.infrastructure.repair;

import io.mersel.services.jats.application.models.RepairContext;
import io.mersel.services.jats.infrastructure.dom.XmlNodes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import static io.mersel.services.jats.infrastructure.TestDocuments.context;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FormulaIdAssigner")
class FormulaIdAssignerTest {

    private final FormulaIdAssigner assigner = new FormulaIdAssigner();

    @Test
    @DisplayName("id'siz formüllere belge sırasıyla id verilir, kullanılan id'ler atlanır")
    void id_atama() {
        RepairContext ctx = context("""
                <article xmlns:mml="http://www.w3.org/1998/Math/MathML"><body><p><tex-math>a</tex-math><tex-math id="texmath-1">b</tex-math><tex-math>c</tex-math><mml:math><mml:mi>x</mml:mi></mml:math></p></body></article>""");

        assigner.apply(ctx);

        assertThat(XmlNodes.descendants(ctx.document(), "tex-math"))
                .extracting(e -> e.getAttribute("id"))
                .containsExactly("texmath-2", "texmath-1", "texmath-3");
        Element math = (Element) ctx.document().getElementsByTagNameNS(XmlNodes.MATHML_NS, "math").item(0);
        assertThat(math.getAttribute("id")).isEqualTo("mml-math-1");
        assertThat(ctx.log().events()).singleElement()
                .extracting(e -> e.message())
                .isEqualTo("3 formül elementine id verildi");
    }

    @Test
    @DisplayName("Tüm formüller id taşıyorsa değişiklik yapılmaz")
    void degisiklik_yok() {
        RepairContext ctx = context("<article><p><tex-math id=\"eq1\">a</tex-math></p></article>");

        assigner.apply(ctx);

        assertThat(ctx.log().size()).isZero();
    }

    @Test
    @DisplayName("Başka elementin kullandığı id atlanır")
    void cakisan_id() {
        RepairContext ctx = context("<article><sec id=\"texmath-1\"><tex-math>a</tex-math></sec></article>");

        assigner.apply(ctx);

        assertThat(XmlNodes.descendants(ctx.document(), "tex-math").get(0).getAttribute("id")).isEqualTo("texmath-2");
    }
}
