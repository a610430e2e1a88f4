package io.mersel.services.jats.infrastructure.repair;

import io.mersel.services.jats.application.enums.CitationKind;
import io.mersel.services.jats.application.interfaces.ICitationClassifier;
import io.mersel.services.jats.application.interfaces.IRepairStep;
import io.mersel.services.jats.application.models.CitationClassification;
import io.mersel.services.jats.application.models.CitationToken;
import io.mersel.services.jats.application.models.RepairContext;
import io.mersel.services.jats.infrastructure.config.RepairProperties;
import io.mersel.services.jats.infrastructure.dom.XmlNodes;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Dönüştürücünün matematik olarak işaretlediği atıf üst simgelerini gerçek kaynak
 * bağlantılarına çevirir.
 * <p>
 * Her {@code tex-math} içeriği {@link ICitationClassifier}'a sorulur:
 * <ul>
 *   <li>Atıf: element (tek çocuğu ise {@code inline-formula} sarmalayıcısıyla birlikte)
 *       baştaki noktalama ve {@code <sup>} içinde numara başına bir {@code xref} ile değiştirilir;
 *       eksik {@code ref} girdileri {@code back/ref-list} içinde numara sırasına göre oluşturulur.</li>
 *   <li>Formül: dokunulmaz.</li>
 *   <li>Belirsiz: dokunulmaz, belirsizlik olarak raporlanır.</li>
 * </ul>
 */
@Component
public class CitationResolver implements IRepairStep {

    static final String NAME = "citation-resolver";

    private final ICitationClassifier classifier;
    private final RepairProperties properties;

    public CitationResolver(ICitationClassifier classifier, RepairProperties properties) {
        this.classifier = classifier;
        this.properties = properties;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int order() {
        return 45;
    }

    @Override
    public void apply(RepairContext context) {
        for (Element texMath : XmlNodes.descendants(context.document(), "tex-math")) {
            if (texMath.getParentNode() == null) {
                continue;
            }
            Element candidate = candidateFor(texMath);
            String location = XmlNodes.path(candidate);
            CitationClassification result = classifier.classify(texMath.getTextContent());

            if (result.kind() == CitationKind.AMBIGUOUS) {
                context.log().ambiguity(NAME, result.reason(), location);
                continue;
            }
            if (result.kind() != CitationKind.CITATION) {
                continue;
            }

            CitationToken token = result.token();
            Optional<String> conflict = conflictingId(context, token);
            if (conflict.isPresent()) {
                context.log().ambiguity(NAME, "Üretilecek '" + conflict.get()
                        + "' id'si ref olmayan bir elemente ait, atıf dönüştürülmedi", location);
                continue;
            }

            List<String> targets = new ArrayList<>();
            List<Integer> missing = new ArrayList<>();
            for (int number : token.numbers()) {
                Optional<String> existing = existingReference(context, number);
                targets.add(existing.orElse(referenceId(number)));
                if (existing.isEmpty()) {
                    missing.add(number);
                }
            }

            replaceWithCitation(candidate, token, targets);
            int created = ensureReferences(context, missing);
            context.log().repair(NAME, "Atıf işareti " + token.numbers() + " xref'e dönüştürüldü"
                    + (created > 0 ? ", " + created + " kaynak girdisi oluşturuldu" : ""), location);
            context.treeModified();
        }
    }

    /**
     * tex-math, inline-formula sarmalayıcısının tek element çocuğuysa sarmalayıcının kendisi değiştirilir.
     */
    private static Element candidateFor(Element texMath) {
        Node parent = texMath.getParentNode();
        if (XmlNodes.isElement(parent, "inline-formula")
                && XmlNodes.childElements((Element) parent).size() == 1) {
            return (Element) parent;
        }
        return texMath;
    }

    private Optional<String> conflictingId(RepairContext context, CitationToken token) {
        for (int number : token.numbers()) {
            String id = referenceId(number);
            Optional<Element> owner = context.ids().get(id);
            if (owner.isPresent() && !"ref".equals(owner.get().getNodeName())) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }

    /**
     * Numaranın gösterdiği mevcut {@code ref} id'si. Tam eşleşme yoksa büyük/küçük harf
     * duyarsız tekil eşleşme kabul edilir ("Ref1"), böylece dönüştürücünün girdileri kopyalanmaz.
     */
    private Optional<String> existingReference(RepairContext context, int number) {
        String id = referenceId(number);
        Optional<Element> exact = context.ids().get(id);
        if (exact.isPresent()) {
            return "ref".equals(exact.get().getNodeName()) ? Optional.of(id) : Optional.empty();
        }
        return context.ids().findIgnoreCase(id)
                .filter(match -> context.ids().get(match)
                        .map(owner -> "ref".equals(owner.getNodeName()))
                        .orElse(false));
    }

    private void replaceWithCitation(Element candidate, CitationToken token, List<String> targets) {
        Document doc = candidate.getOwnerDocument();
        Node parent = candidate.getParentNode();

        if (!token.leadingPunctuation().isEmpty()) {
            Node previous = candidate.getPreviousSibling();
            if (previous != null && previous.getNodeType() == Node.TEXT_NODE) {
                previous.setNodeValue(previous.getNodeValue() + token.leadingPunctuation());
            } else {
                parent.insertBefore(doc.createTextNode(token.leadingPunctuation()), candidate);
            }
        }

        Element sup = XmlNodes.create(doc, "sup");
        List<Integer> numbers = token.numbers();
        for (int i = 0; i < numbers.size(); i++) {
            if (i > 0) {
                sup.appendChild(doc.createTextNode(","));
            }
            Element xref = XmlNodes.create(doc, "xref", String.valueOf(numbers.get(i)));
            xref.setAttribute("ref-type", "bibr");
            xref.setAttribute("rid", targets.get(i));
            sup.appendChild(xref);
        }
        parent.replaceChild(sup, candidate);
    }

    /**
     * Eksik kaynak girdilerini oluşturur. Var olanlara dokunmaz.
     *
     * @return Oluşturulan girdi sayısı
     */
    private int ensureReferences(RepairContext context, List<Integer> numbers) {
        int created = 0;
        Element refList = null;
        for (int number : numbers) {
            String id = referenceId(number);
            if (context.ids().contains(id)) {
                continue;
            }
            if (refList == null) {
                refList = ensureRefList(context);
            }
            insertReference(refList, number);
            context.treeModified();
            created++;
        }
        return created;
    }

    private Element ensureRefList(RepairContext context) {
        Document doc = context.document();
        Element article = context.root();
        Element back = XmlNodes.firstChild(article, "back");
        if (back == null) {
            back = XmlNodes.create(doc, "back");
            Element body = XmlNodes.firstChild(article, "body");
            if (body != null) {
                XmlNodes.insertAfter(back, body);
            } else {
                article.appendChild(back);
            }
        }
        Element refList = XmlNodes.firstChild(back, "ref-list");
        if (refList == null) {
            refList = XmlNodes.create(doc, "ref-list");
            back.appendChild(refList);
        }
        return refList;
    }

    /**
     * Girdiyi numarası kendisinden büyük ilk üretilmiş girdinin önüne ekler.
     */
    private void insertReference(Element refList, int number) {
        Document doc = refList.getOwnerDocument();
        Element ref = XmlNodes.create(doc, "ref");
        ref.setAttribute("id", referenceId(number));
        ref.appendChild(XmlNodes.create(doc, "mixed-citation",
                String.format(properties.getCitation().getPlaceholderText(), number)));

        for (Element sibling : XmlNodes.childElements(refList, "ref")) {
            Integer siblingNumber = generatedNumber(sibling.getAttribute("id"));
            if (siblingNumber != null && siblingNumber > number) {
                refList.insertBefore(ref, sibling);
                return;
            }
        }
        refList.appendChild(ref);
    }

    private Integer generatedNumber(String id) {
        String prefix = properties.getCitation().getReferenceIdPrefix();
        if (!id.startsWith(prefix) || id.length() == prefix.length() || id.length() - prefix.length() > 9) {
            return null;
        }
        String digits = id.substring(prefix.length());
        return digits.chars().allMatch(Character::isDigit) ? Integer.parseInt(digits) : null;
    }

    private String referenceId(int number) {
        return properties.getCitation().getReferenceIdPrefix() + number;
    }
}
