package io.mersel.services.jats.infrastructure.repair;

import io.mersel.services.jats.application.models.RepairContext;
import io.mersel.services.jats.infrastructure.config.RepairProperties;
import io.mersel.services.jats.infrastructure.dom.XmlNodes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static io.mersel.services.jats.infrastructure.TestDocuments.childNames;
import static io.mersel.services.jats.infrastructure.TestDocuments.context;
import static io.mersel.services.jats.infrastructure.TestDocuments.first;
import static io.mersel.services.jats.infrastructure.TestDocuments.parse;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ArticleTypeNormalizer")
class ArticleTypeNormalizerTest {

    private static final String META = """
            <front><article-meta><title-group><article-title>T</article-title></title-group></article-meta></front>""";

    private RepairProperties properties;
    private ArticleTypeNormalizer normalizer;

    @BeforeEach
    void setUp() {
        properties = new RepairProperties();
        normalizer = new ArticleTypeNormalizer(properties);
    }

    @Nested
    @DisplayName("Tür işareti")
    class MarkerTests {

        @Test
        @DisplayName("İşaret paragrafı silinir, tür ve başlık konusu metadata'ya taşınır")
        void isaret_tasinir() {
            RepairContext ctx = context("<article>" + META
                    + "<body><p><bold>CASE REPORT</bold></p><p>Metin</p></body></article>");

            normalizer.apply(ctx);

            assertThat(ctx.root().getAttribute("article-type")).isEqualTo("case-report");
            assertThat(XmlNodes.descendants(ctx.document(), "p")).hasSize(1);
            assertThat(XmlNodes.text(first(ctx.document(), "p"))).isEqualTo("Metin");
            assertThat(childNames(first(ctx.document(), "article-meta")))
                    .containsExactly("article-categories", "title-group");
            assertThat(first(ctx.document(), "subj-group").getAttribute("subj-group-type")).isEqualTo("heading");
            assertThat(XmlNodes.text(first(ctx.document(), "subject"))).isEqualTo("Case Report");
        }

        @Test
        @DisplayName("Sondaki noktalama ve büyük/küçük harf farkı yok sayılır")
        void noktalama() {
            RepairContext ctx = context("<article>" + META
                    + "<body><sec><p>Research  Article:</p></sec></body></article>");

            normalizer.apply(ctx);

            assertThat(ctx.root().getAttribute("article-type")).isEqualTo("research-article");
            assertThat(first(ctx.document(), "p")).isNull();
        }

        @Test
        @DisplayName("Mevcut article-type ve article-categories korunur")
        void mevcut_degerler() {
            RepairContext ctx = context("""
                    <article article-type="editorial"><front><article-meta><article-categories><subj-group><subject>X</subject></subj-group></article-categories></article-meta></front><body><p>REVIEW ARTICLE</p></body></article>""");

            normalizer.apply(ctx);

            assertThat(ctx.root().getAttribute("article-type")).isEqualTo("editorial");
            assertThat(XmlNodes.descendants(ctx.document(), "subject")).hasSize(1);
            assertThat(first(ctx.document(), "p")).isNull();
        }
    }

    @Test
    @DisplayName("İşaret yoksa yapılandırılan tür yazılır, paragraf kalır")
    void isaret_yok() {
        properties.getMetadata().setArticleType("brief-report");
        RepairContext ctx = context("<article>" + META + "<body><p>Giriş metni</p></body></article>");

        normalizer.apply(ctx);

        assertThat(ctx.root().getAttribute("article-type")).isEqualTo("brief-report");
        assertThat(first(ctx.document(), "p")).isNotNull();
        assertThat(first(ctx.document(), "article-categories")).isNull();
    }

    @Test
    @DisplayName("Biçim dışı çocuk içeren paragraf işaret sayılmaz")
    void bicim_disi_cocuk() {
        assertThat(ArticleTypeNormalizer.markerOf(parse("<p><italic>Case report</italic></p>").getDocumentElement()))
                .isEqualTo("CASE REPORT");
        assertThat(ArticleTypeNormalizer.markerOf(parse("<p>CASE REPORT <xref rid=\"r1\">1</xref></p>").getDocumentElement()))
                .isNull();
        assertThat(ArticleTypeNormalizer.markerOf(parse("<p>A case report of twins</p>").getDocumentElement()))
                .isNull();
    }

    @Test
    @DisplayName("titleCase eğik çizgiden sonra da büyük harf kullanır")
    void title_case() {
        assertThat(ArticleTypeNormalizer.titleCase("SYSTEMATIC REVIEW/META ANALYSIS"))
                .isEqualTo("Systematic Review/Meta Analysis");
        assertThat(ArticleTypeNormalizer.titleCase("EDITORIAL")).isEqualTo("Editorial");
    }
}
