package io.mersel.services.jats.infrastructure.repair;

import io.mersel.services.jats.application.interfaces.IRepairStep;
import io.mersel.services.jats.application.models.RepairContext;
import io.mersel.services.jats.infrastructure.config.RepairProperties;
import io.mersel.services.jats.infrastructure.dom.XmlNodes;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Anlamlı çocuğu kalmamış arka madde kapsayıcılarını siler.
 * <p>
 * Yorum, işleme talimatı, boşluk ile {@code label}/{@code title} anlamlı sayılmaz.
 * Elementler ters belge sırasıyla, yani en içteki önce işlenir; böylece yalnızca boş
 * bir {@code ref-list} taşıyan {@code back} de aynı geçişte silinir.
 */
@Component
public class EmptyElementPruner implements IRepairStep {

    static final String NAME = "empty-pruner";

    private static final Set<String> DECORATIVE = Set.of("label", "title");

    private final RepairProperties properties;

    public EmptyElementPruner(RepairProperties properties) {
        this.properties = properties;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int order() {
        return 70;
    }

    @Override
    public void apply(RepairContext context) {
        Set<String> containers = Set.copyOf(properties.getPruner().getContainers());
        List<Element> all = new ArrayList<>(XmlNodes.descendants(context.document(), "*"));
        Collections.reverse(all);

        boolean changed = false;
        for (Element element : all) {
            if (!containers.contains(element.getNodeName())
                    || element == context.root()
                    || hasMeaningfulContent(element)) {
                continue;
            }
            String location = XmlNodes.path(element);
            element.getParentNode().removeChild(element);
            context.log().repair(NAME, "Boş " + element.getNodeName() + " silindi", location);
            changed = true;
        }
        if (changed) {
            context.treeModified();
        }
    }

    static boolean hasMeaningfulContent(Element element) {
        for (Node n = element.getFirstChild(); n != null; n = n.getNextSibling()) {
            switch (n.getNodeType()) {
                case Node.ELEMENT_NODE:
                    if (!DECORATIVE.contains(n.getNodeName())) {
                        return true;
                    }
                    break;
                case Node.TEXT_NODE:
                case Node.CDATA_SECTION_NODE:
                    if (!n.getNodeValue().isBlank()) {
                        return true;
                    }
                    break;
                default:
                    break;
            }
        }
        return false;
    }
}
