package io.mersel.services.jats.infrastructure.repair;

import io.mersel.services.jats.application.interfaces.IRepairStep;
import io.mersel.services.jats.application.models.RepairContext;
import io.mersel.services.jats.infrastructure.config.RepairProperties;
import io.mersel.services.jats.infrastructure.dom.XmlNodes;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Dönüştürücünün gövdenin ilk paragrafı olarak bıraktığı makale türü işaretini
 * ("RESEARCH ARTICLE" gibi) metadata'ya taşır.
 * <p>
 * İşaret paragrafı silinir, {@code article-categories} yoksa başlık konusu olarak eklenir
 * ve kökte {@code article-type} yoksa işaretten (bulunamazsa yapılandırmadan) türetilir.
 * Metadata tamamlama adımından sonra çalışır, {@code article-meta} her zaman vardır.
 */
@Component
public class ArticleTypeNormalizer implements IRepairStep {

    static final String NAME = "article-type";

    private static final Map<String, String> MARKERS = new LinkedHashMap<>();

    static {
        MARKERS.put("SYSTEMATIC REVIEW/META ANALYSIS", "review-article");
        MARKERS.put("SYSTEMATIC REVIEW", "review-article");
        MARKERS.put("META ANALYSIS", "review-article");
        MARKERS.put("REVIEW ARTICLE", "review-article");
        MARKERS.put("RESEARCH ARTICLE", "research-article");
        MARKERS.put("ORIGINAL RESEARCH ARTICLE", "research-article");
        MARKERS.put("ORIGINAL ARTICLE", "research-article");
        MARKERS.put("CASE REPORT", "case-report");
        MARKERS.put("CASE STUDY", "case-report");
        MARKERS.put("SHORT COMMUNICATION", "brief-report");
        MARKERS.put("EDITORIAL", "editorial");
        MARKERS.put("COMMENTARY", "article-commentary");
        MARKERS.put("LETTER TO THE EDITOR", "letter");
    }

    private final RepairProperties properties;

    public ArticleTypeNormalizer(RepairProperties properties) {
        this.properties = properties;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int order() {
        return 35;
    }

    @Override
    public void apply(RepairContext context) {
        Element article = context.root();
        if (!"article".equals(article.getNodeName())) {
            return;
        }

        boolean changed = false;
        String marker = null;
        Element body = XmlNodes.firstChild(article, "body");
        if (body != null) {
            List<Element> paragraphs = XmlNodes.descendants(body, "p");
            if (!paragraphs.isEmpty()) {
                Element first = paragraphs.get(0);
                marker = markerOf(first);
                if (marker != null) {
                    String location = XmlNodes.path(first);
                    first.getParentNode().removeChild(first);
                    context.log().repair(NAME, "Makale türü işareti '" + marker + "' gövdeden silindi", location);
                    changed = true;
                }
            }
        }

        if (marker != null) {
            changed |= addHeadingSubject(article, marker, context);
        }

        if (!article.hasAttribute("article-type")) {
            String type = marker != null ? MARKERS.get(marker) : properties.getMetadata().getArticleType();
            article.setAttribute("article-type", type);
            context.log().repair(NAME, "article-type=\"" + type + "\" olarak ayarlandı", "/article");
            changed = true;
        }

        if (changed) {
            context.treeModified();
        }
    }

    /**
     * Paragraf yalnızca bir makale türü işaretinden oluşuyorsa işareti döndürür.
     */
    static String markerOf(Element paragraph) {
        if (!XmlNodes.childElements(paragraph).stream().allMatch(ArticleTypeNormalizer::isInlineFormatting)) {
            return null;
        }
        String text = XmlNodes.text(paragraph)
                .replaceAll("\\s+", " ")
                .replaceAll("[\\s.:;,]+$", "")
                .toUpperCase(Locale.ROOT);
        return MARKERS.containsKey(text) ? text : null;
    }

    private static boolean isInlineFormatting(Element element) {
        return switch (element.getNodeName()) {
            case "bold", "italic", "sc", "underline" -> true;
            default -> false;
        };
    }

    private boolean addHeadingSubject(Element article, String marker, RepairContext context) {
        Element front = XmlNodes.firstChild(article, "front");
        Element articleMeta = front == null ? null : XmlNodes.firstChild(front, "article-meta");
        if (articleMeta == null || XmlNodes.firstChild(articleMeta, "article-categories") != null) {
            return false;
        }
        Document doc = article.getOwnerDocument();
        Element subjGroup = XmlNodes.create(doc, "subj-group");
        subjGroup.setAttribute("subj-group-type", "heading");
        subjGroup.appendChild(XmlNodes.create(doc, "subject", titleCase(marker)));
        Element categories = XmlNodes.create(doc, "article-categories");
        categories.appendChild(subjGroup);
        FrontMatterLayout.insertInOrder(articleMeta, categories, FrontMatterLayout.ARTICLE_META);
        context.log().repair(NAME, "article-categories başlık konusu eklendi", XmlNodes.path(categories));
        return true;
    }

    /**
     * "CASE REPORT" → "Case Report"; "/" ile ayrılan parçalar da büyük harfle başlar.
     */
    static String titleCase(String marker) {
        StringBuilder sb = new StringBuilder(marker.length());
        boolean start = true;
        for (char c : marker.toLowerCase(Locale.ROOT).toCharArray()) {
            sb.append(start ? Character.toUpperCase(c) : c);
            start = c == ' ' || c == '/';
        }
        return sb.toString();
    }
}
