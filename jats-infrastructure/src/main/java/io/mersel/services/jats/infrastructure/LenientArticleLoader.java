package io.mersel.services.jats.infrastructure;

import io.mersel.services.jats.application.interfaces.ArticleParseException;
import io.mersel.services.jats.application.interfaces.IArticleLoader;
import io.mersel.services.jats.application.models.RepairLog;
import io.mersel.services.jats.infrastructure.dom.XmlNodes;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Entities;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.DocumentType;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Toleranslı JATS yükleyicisi.
 * <p>
 * Önce XXE korumalı, namespace-aware JAXP ayrıştırması denenir. Başarısız olursa
 * jsoup XML ayrıştırıcısı ile iyi-biçimlilik hataları (kapanmamış tag, HTML entity,
 * çıplak {@code &}) kurtarılır, bildirilmemiş iyi bilinen önekler köke eklenir ve
 * sonuç yeniden katı ayrıştırılır.
 * <p>
 * DOCTYPE bildirimleri kabul edilir ama dış DTD asla yüklenmez; DOCTYPE düğümü
 * ağaçtan çıkarılır, serileştirici hedef sürümünkini yeniden yazar.
 */
@Service
public class LenientArticleLoader implements IArticleLoader {

    private static final Logger log = LoggerFactory.getLogger(LenientArticleLoader.class);

    static final String STEP = "loader";

    private static final String EXPECTED_ROOT = "article";
    private static final String UNDECLARED_NS_BASE = "urn:x-undeclared-prefix:";

    @Override
    public Document load(byte[] input, RepairLog repairLog) throws ArticleParseException {
        if (input == null || new String(input, StandardCharsets.UTF_8).isBlank()) {
            throw new ArticleParseException("Girdi boş, ayrıştırılacak işaretleme yok");
        }

        Document document;
        try {
            document = parseStrict(input);
        } catch (SAXException | IOException e) {
            log.warn("Girdi iyi biçimli değil, toleranslı ayrıştırma deneniyor: {}", e.getMessage());
            document = recover(input, repairLog, e);
        }

        DocumentType doctype = document.getDoctype();
        if (doctype != null) {
            document.removeChild(doctype);
        }

        String rootName = document.getDocumentElement().getNodeName();
        if (!EXPECTED_ROOT.equals(rootName)) {
            repairLog.notice(STEP, "Kök element '" + rootName + "', beklenen '" + EXPECTED_ROOT + "'", "/" + rootName);
        }
        return document;
    }

    // ── Katı ayrıştırma ─────────────────────────────────────────────

    private Document parseStrict(byte[] bytes) throws SAXException, IOException {
        DocumentBuilder builder = newDocumentBuilder();
        return builder.parse(new InputSource(new ByteArrayInputStream(bytes)));
    }

    private DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setValidating(false);
            factory.setXIncludeAware(false);
            // XXE koruması: DOCTYPE'a izin verilir ama dış varlıklar ve DTD yüklenmez
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setEntityResolver((publicId, systemId) -> new InputSource(new StringReader("")));
            builder.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException e) {
                    log.debug("Ayrıştırma uyarısı: {}", e.getMessage());
                }

                @Override
                public void error(SAXParseException e) throws SAXException {
                    throw e;
                }

                @Override
                public void fatalError(SAXParseException e) throws SAXException {
                    throw e;
                }
            });
            return builder;
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML ayrıştırıcı yapılandırılamadı", e);
        }
    }

    // ── Kurtarma ────────────────────────────────────────────────────

    private Document recover(byte[] input, RepairLog repairLog, Exception strictFailure) throws ArticleParseException {
        String text = new String(input, StandardCharsets.UTF_8);
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }

        org.jsoup.nodes.Document soup = Jsoup.parse(text, "", Parser.xmlParser());
        org.jsoup.nodes.Element root = pickRoot(soup);
        if (root == null) {
            throw new ArticleParseException("Girdi XML benzeri işaretleme içermiyor: " + strictFailure.getMessage(), strictFailure);
        }

        int topLevelElements = soup.children().size();
        if (topLevelElements > 1) {
            repairLog.notice(STEP, "Birden fazla kök element bulundu, yalnızca '" + root.tagName() + "' korundu", null);
        }

        Set<String> declared = declareMissingPrefixes(root);
        for (String prefix : declared) {
            repairLog.notice(STEP, "Bildirilmemiş '" + prefix + "' öneki kökte bildirildi", "/" + root.tagName());
        }

        soup.outputSettings()
                .syntax(org.jsoup.nodes.Document.OutputSettings.Syntax.xml)
                .escapeMode(Entities.EscapeMode.xhtml)
                .charset(StandardCharsets.UTF_8)
                .prettyPrint(false);
        String repaired = root.outerHtml();

        try {
            Document document = parseStrict(repaired.getBytes(StandardCharsets.UTF_8));
            repairLog.notice(STEP, "Girdi iyi biçimli değildi, toleranslı ayrıştırıcı ile kurtarıldı: "
                    + strictFailure.getMessage(), null);
            return document;
        } catch (SAXException | IOException e) {
            throw new ArticleParseException("Girdi kurtarma sonrasında da ayrıştırılamadı: " + e.getMessage(), e);
        }
    }

    /**
     * {@code article} üst düzeyde varsa onu, yoksa ilk üst düzey elementi seçer.
     */
    private static org.jsoup.nodes.Element pickRoot(org.jsoup.nodes.Document soup) {
        org.jsoup.nodes.Element first = null;
        for (org.jsoup.nodes.Element child : soup.children()) {
            if (EXPECTED_ROOT.equals(child.tagName())) {
                return child;
            }
            if (first == null) {
                first = child;
            }
        }
        return first;
    }

    /**
     * Element veya nitelik adlarında kullanılıp kökte bildirilmemiş önekleri bildirir.
     * İyi bilinen önekler gerçek namespace'lerine, diğerleri ayırt edici bir URN'e bağlanır.
     *
     * @return Bildirilen önekler
     */
    private static Set<String> declareMissingPrefixes(org.jsoup.nodes.Element root) {
        Set<String> used = new LinkedHashSet<>();
        for (org.jsoup.nodes.Element element : root.getAllElements()) {
            collectPrefix(element.tagName(), used);
            for (Attribute attribute : element.attributes()) {
                collectPrefix(attribute.getKey(), used);
            }
        }

        Set<String> declared = new LinkedHashSet<>();
        for (String prefix : used) {
            String attr = "xmlns:" + prefix;
            if (root.hasAttr(attr)) {
                continue;
            }
            String uri = XmlNodes.WELL_KNOWN_PREFIXES.getOrDefault(prefix, UNDECLARED_NS_BASE + prefix);
            root.attr(attr, uri);
            declared.add(prefix);
        }
        return declared;
    }

    private static void collectPrefix(String qualifiedName, Set<String> into) {
        int colon = qualifiedName.indexOf(':');
        if (colon <= 0) {
            return;
        }
        String prefix = qualifiedName.substring(0, colon);
        if (!"xml".equals(prefix) && !"xmlns".equals(prefix)) {
            into.add(prefix);
        }
    }
}
