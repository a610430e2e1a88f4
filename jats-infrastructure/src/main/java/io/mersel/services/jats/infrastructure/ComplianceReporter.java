package io.mersel.services.jats.infrastructure;

import io.mersel.services.jats.application.enums.ComplianceStatus;
import io.mersel.services.jats.application.enums.RepairEventType;
import io.mersel.services.jats.application.enums.SchemaValidationStatus;
import io.mersel.services.jats.application.interfaces.IComplianceReporter;
import io.mersel.services.jats.application.interfaces.ISchemaValidator;
import io.mersel.services.jats.application.models.ComplianceReport;
import io.mersel.services.jats.application.models.DocumentStructure;
import io.mersel.services.jats.application.models.RepairEvent;
import io.mersel.services.jats.application.models.RepairLog;
import io.mersel.services.jats.application.models.SchemaValidationResult;
import io.mersel.services.jats.application.models.StructuralCheckResult;
import io.mersel.services.jats.infrastructure.config.RepairProperties;
import io.mersel.services.jats.infrastructure.dom.XmlNodes;
import io.mersel.services.jats.infrastructure.repair.AttributeSanitizer;
import net.sf.saxon.s9api.Processor;
import net.sf.saxon.s9api.SaxonApiException;
import net.sf.saxon.s9api.XPathCompiler;
import net.sf.saxon.s9api.XPathExecutable;
import net.sf.saxon.s9api.XPathSelector;
import net.sf.saxon.s9api.XdmItem;
import net.sf.saxon.s9api.XdmNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;

import javax.xml.transform.dom.DOMSource;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Şema doğrulaması ve sabit yapısal kontrol bataryası ile uyumluluk raporu üretir.
 * <p>
 * Kontroller Saxon XPath ile ağacın salt okunur bir kopyası üzerinde çalışır.
 * Nitelik temizliği kontrolü temizleyicinin kurallarını paylaştığı için Java'da yapılır.
 * <p>
 * Durum kuralı:
 * <ul>
 *   <li>Şema doğrulaması {@code INVALID} ise {@code FAIL}</li>
 *   <li>Doğrulama atlandıysa, bir kontrol başarısızsa veya belirsizlik kaydedildiyse {@code WARNING}</li>
 *   <li>Aksi halde {@code PASS}</li>
 * </ul>
 */
@Service
public class ComplianceReporter implements IComplianceReporter {

    private static final Logger log = LoggerFactory.getLogger(ComplianceReporter.class);

    static final String ATTRIBUTE_CLEANLINESS = "attribute-cleanliness";

    private final ISchemaValidator schemaValidator;
    private final AttributeSanitizer sanitizer;
    private final RepairProperties properties;
    private final Processor processor;
    private final List<XPathCheck> checks;
    private final XPathExecutable tableCount;
    private final XPathExecutable figureCount;
    private final XPathExecutable referenceCount;

    public ComplianceReporter(ISchemaValidator schemaValidator,
                              AttributeSanitizer sanitizer,
                              RepairProperties properties) {
        this.schemaValidator = schemaValidator;
        this.sanitizer = sanitizer;
        this.properties = properties;
        this.processor = new Processor(false);

        XPathCompiler compiler = processor.newXPathCompiler();
        compiler.declareNamespace("mml", XmlNodes.MATHML_NS);
        compiler.declareNamespace("xlink", XmlNodes.XLINK_NS);
        this.checks = compileChecks(compiler);
        this.tableCount = compile(compiler, "count(//table-wrap)");
        this.figureCount = compile(compiler, "count(//fig)");
        this.referenceCount = compile(compiler, "count(//ref)");
    }

    @Override
    public ComplianceReport report(Document tree, RepairLog repairLog) {
        SchemaValidationResult schema = validateSchema(tree);

        List<StructuralCheckResult> results = new ArrayList<>();
        DocumentStructure structure = null;
        try {
            XdmNode copy = processor.newDocumentBuilder().build(new DOMSource(tree));
            for (XPathCheck check : checks) {
                results.add(new StructuralCheckResult(check.name(), evaluate(check.expression(), copy), check.description()));
            }
            structure = describe(tree, copy);
        } catch (SaxonApiException e) {
            throw new IllegalStateException("Yapısal kontroller çalıştırılamadı", e);
        }
        results.add(new StructuralCheckResult(ATTRIBUTE_CLEANLINESS, isClean(tree),
                "Hiçbir elementte yasaklı önekli veya yasak listesindeki nitelik yok"));

        List<String> errors = new ArrayList<>();
        if (schema.status() != SchemaValidationStatus.VALID) {
            errors.addAll(schema.errors());
        }
        for (StructuralCheckResult result : results) {
            if (!result.passed()) {
                errors.add("Kontrol başarısız: " + result.name() + " (" + result.description() + ")");
            }
        }

        List<RepairEvent> ambiguities = repairLog.ofType(RepairEventType.RESOLUTION_AMBIGUITY);
        ComplianceStatus status = decideStatus(schema, results, ambiguities);
        log.info("Uyumluluk raporu: {} ({} kontrol, {} başarısız, {} belirsizlik, şema: {})",
                status, results.size(), results.stream().filter(r -> !r.passed()).count(),
                ambiguities.size(), schema.status());

        return ComplianceReport.builder()
                .status(status)
                .targetVersion(properties.getTargetVersion().getDtdVersion())
                .schemaValidation(schema)
                .checks(results)
                .errors(errors)
                .repairs(repairLog.ofType(RepairEventType.STRUCTURAL_REPAIR))
                .ambiguities(ambiguities)
                .notices(repairLog.ofType(RepairEventType.INPUT_NOTICE))
                .documentStructure(structure)
                .build();
    }

    static ComplianceStatus decideStatus(SchemaValidationResult schema,
                                         List<StructuralCheckResult> results,
                                         List<RepairEvent> ambiguities) {
        if (schema.status() == SchemaValidationStatus.INVALID) {
            return ComplianceStatus.FAIL;
        }
        boolean anyFailed = results.stream().anyMatch(r -> !r.passed());
        if (schema.status() == SchemaValidationStatus.SKIPPED || anyFailed || !ambiguities.isEmpty()) {
            return ComplianceStatus.WARNING;
        }
        return ComplianceStatus.PASS;
    }

    // ── Şema ────────────────────────────────────────────────────────

    private SchemaValidationResult validateSchema(Document tree) {
        String schemaPath = properties.getSchemaPath();
        if (schemaPath == null || schemaPath.isBlank()) {
            return SchemaValidationResult.skipped("XSD yolu yapılandırılmamış, şema doğrulaması atlandı");
        }
        return schemaValidator.validate(tree, Path.of(schemaPath));
    }

    // ── Yapısal kontroller ──────────────────────────────────────────

    private static List<XPathCheck> compileChecks(XPathCompiler compiler) {
        Map<String, String[]> definitions = new LinkedHashMap<>();
        definitions.put("article-meta-present", new String[]{
                "exists(/article/front/article-meta)",
                "front/article-meta mevcut"});
        definitions.put("article-title-present", new String[]{
                "exists(/article/front/article-meta/title-group/article-title)",
                "Makale başlığı (title-group/article-title) mevcut"});
        definitions.put("journal-meta-complete", new String[]{
                "exists(/article/front/journal-meta/journal-id)"
                        + " and exists(/article/front/journal-meta/journal-title-group/journal-title)"
                        + " and exists(/article/front/journal-meta/issn)"
                        + " and exists(/article/front/journal-meta/publisher/publisher-name)",
                "journal-meta dergi kimliği, adı, ISSN ve yayıncı içeriyor"});
        definitions.put("pub-date-present", new String[]{
                "exists(/article/front/article-meta/(pub-date | pub-date-not-available))",
                "Yayın tarihi mevcut"});
        definitions.put("location-present", new String[]{
                "exists(/article/front/article-meta/(fpage | elocation-id))",
                "Sayfa (fpage) veya elocation-id mevcut"});
        definitions.put("table-wrap-position", new String[]{
                "every $t in //table-wrap satisfies $t/@position = ('anchor', 'background', 'float', 'margin')",
                "Her table-wrap geçerli bir position değeri (anchor, background, float, margin) taşıyor"});
        definitions.put("table-structure", new String[]{
                "every $t in //table satisfies ("
                        + "(empty($t/tr) or empty($t/(thead | tfoot | tbody)))"
                        + " and (empty($t/(thead | tfoot)) or exists($t/tbody))"
                        + " and (exists($t/tr) or exists($t/tbody)))",
                "Tablolar ya doğrudan satır ya da thead?, tfoot?, tbody+ içeriyor"});
        definitions.put("figure-captions", new String[]{
                "every $f in //fig satisfies exists($f/caption)",
                "Her şekil bir başlık (caption) taşıyor"});
        definitions.put("figure-alt-text", new String[]{
                "every $f in //fig satisfies exists($f/(alt-text | long-desc) | $f//graphic/alt-text)",
                "Her şekil alternatif metin taşıyor"});
        definitions.put("section-ids", new String[]{
                "every $s in //sec satisfies exists($s/@id)",
                "Her bölüm (sec) id taşıyor"});
        definitions.put("figure-ids", new String[]{
                "every $f in //fig satisfies exists($f/@id)",
                "Her şekil id taşıyor"});
        definitions.put("reference-ids", new String[]{
                "every $r in //ref satisfies exists($r/@id)",
                "Her kaynak girdisi id taşıyor"});
        definitions.put("reference-closure", new String[]{
                "every $token in (for $a in (//@rid | //@rids) return tokenize(normalize-space($a), ' '))"
                        + " satisfies exists(//*[@id = $token])",
                "Her rid/rids değeri mevcut bir id'yi gösteriyor"});
        definitions.put("unique-ids", new String[]{
                "count(//@id) = count(distinct-values(//@id))",
                "id değerleri tekil"});

        List<XPathCheck> compiled = new ArrayList<>();
        definitions.forEach((name, def) -> compiled.add(new XPathCheck(name, compile(compiler, def[0]), def[1])));
        return List.copyOf(compiled);
    }

    private static XPathExecutable compile(XPathCompiler compiler, String expression) {
        try {
            return compiler.compile(expression);
        } catch (SaxonApiException e) {
            throw new IllegalStateException("XPath ifadesi derlenemedi: " + expression, e);
        }
    }

    private static boolean evaluate(XPathExecutable expression, XdmNode context) throws SaxonApiException {
        XPathSelector selector = expression.load();
        selector.setContextItem(context);
        return selector.effectiveBooleanValue();
    }

    private static int count(XPathExecutable expression, XdmNode context) throws SaxonApiException {
        XPathSelector selector = expression.load();
        selector.setContextItem(context);
        XdmItem item = selector.evaluateSingle();
        return item == null ? 0 : Integer.parseInt(item.getStringValue());
    }

    private DocumentStructure describe(Document tree, XdmNode copy) throws SaxonApiException {
        Element root = tree.getDocumentElement();
        return new DocumentStructure(
                root.getAttribute("dtd-version"),
                root.getAttribute("article-type"),
                count(tableCount, copy),
                count(figureCount, copy),
                count(referenceCount, copy));
    }

    private boolean isClean(Document tree) {
        for (Element element : XmlNodes.descendants(tree, "*")) {
            NamedNodeMap attributes = element.getAttributes();
            for (int i = 0; i < attributes.getLength(); i++) {
                Attr attr = (Attr) attributes.item(i);
                if (!XmlNodes.XMLNS_NS.equals(attr.getNamespaceURI()) && sanitizer.isBanned(attr.getName())) {
                    return false;
                }
            }
        }
        return true;
    }

    private record XPathCheck(String name, XPathExecutable expression, String description) {
    }
}
