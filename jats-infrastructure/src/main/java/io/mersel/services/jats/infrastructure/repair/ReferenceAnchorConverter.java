package io.mersel.services.jats.infrastructure.repair;

import io.mersel.services.jats.application.interfaces.IRepairStep;
import io.mersel.services.jats.application.models.RepairContext;
import io.mersel.services.jats.infrastructure.dom.XmlNodes;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * Dönüştürücünün kaynakçayı {@code back} altında çapa paragrafları olarak bırakmasını düzeltir.
 * <p>
 * {@code <p><named-content content-type="anchor" id="Ref1"/>Metin</p>} biçimindeki her paragraf
 * {@code ref-list} içinde {@code <ref id="Ref1"><mixed-citation>Metin</mixed-citation></ref>} olur.
 * Metin ve satır içi işaretleme korunur; xref'ler aynı id'yi göstermeye devam eder.
 */
@Component
public class ReferenceAnchorConverter implements IRepairStep {

    static final String NAME = "reference-anchor";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int order() {
        return 40;
    }

    @Override
    public void apply(RepairContext context) {
        Element back = XmlNodes.firstChild(context.root(), "back");
        if (back == null) {
            return;
        }

        int converted = 0;
        Element refList = XmlNodes.firstChild(back, "ref-list");
        for (Element paragraph : XmlNodes.childElements(back, "p")) {
            Element anchor = leadingAnchor(paragraph);
            if (anchor == null) {
                continue;
            }
            if (refList == null) {
                refList = XmlNodes.create(context.document(), "ref-list");
                back.appendChild(refList);
            }
            refList.appendChild(toReference(paragraph, anchor));
            back.removeChild(paragraph);
            converted++;
        }

        if (converted > 0) {
            context.log().repair(NAME, converted + " çapa paragrafı ref elementine dönüştürüldü", XmlNodes.path(refList));
            context.treeModified();
        }
    }

    /**
     * Paragrafın (boşluklar hariç) ilk düğümü id'li bir çapa ise onu döndürür.
     */
    private static Element leadingAnchor(Element paragraph) {
        for (Node n = paragraph.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (XmlNodes.isBlankText(n)) {
                continue;
            }
            if (XmlNodes.isElement(n, "named-content")) {
                Element candidate = (Element) n;
                if ("anchor".equals(candidate.getAttribute("content-type")) && !candidate.getAttribute("id").isEmpty()) {
                    return candidate;
                }
            }
            return null;
        }
        return null;
    }

    private static Element toReference(Element paragraph, Element anchor) {
        Document doc = paragraph.getOwnerDocument();
        Element ref = XmlNodes.create(doc, "ref");
        ref.setAttribute("id", anchor.getAttribute("id"));
        Element citation = XmlNodes.create(doc, "mixed-citation");
        ref.appendChild(citation);

        paragraph.removeChild(anchor);
        while (paragraph.getFirstChild() != null) {
            citation.appendChild(paragraph.getFirstChild());
        }
        Node first = citation.getFirstChild();
        if (first != null && first.getNodeType() == Node.TEXT_NODE) {
            first.setNodeValue(first.getNodeValue().stripLeading());
        }
        return ref;
    }
}
