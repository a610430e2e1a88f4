package io.mersel.services.jats.infrastructure.repair;

import io.mersel.services.jats.application.interfaces.IRepairStep;
import io.mersel.services.jats.application.models.RepairContext;
import io.mersel.services.jats.infrastructure.dom.XmlNodes;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * id'si olmayan {@code tex-math} ve {@code mml:math} elementlerine belge sırasıyla
 * {@code texmath-1}, {@code mml-math-1} ... id'leri verir. Kullanımdaki id'ler atlanır.
 */
@Component
public class FormulaIdAssigner implements IRepairStep {

    static final String NAME = "formula-ids";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int order() {
        return 50;
    }

    @Override
    public void apply(RepairContext context) {
        Set<String> used = new HashSet<>(context.ids().ids());

        int assigned = assign(XmlNodes.descendants(context.document(), "tex-math"), "texmath-", used);

        NodeList math = context.document().getElementsByTagNameNS(XmlNodes.MATHML_NS, "math");
        List<Element> mathElements = new ArrayList<>(math.getLength());
        for (int i = 0; i < math.getLength(); i++) {
            mathElements.add((Element) math.item(i));
        }
        assigned += assign(mathElements, "mml-math-", used);

        if (assigned > 0) {
            context.log().repair(NAME, assigned + " formül elementine id verildi", null);
            context.treeModified();
        }
    }

    private static int assign(List<Element> elements, String prefix, Set<String> used) {
        int assigned = 0;
        int counter = 0;
        for (Element element : elements) {
            if (element.hasAttribute("id")) {
                continue;
            }
            String id;
            do {
                counter++;
                id = prefix + counter;
            } while (used.contains(id));
            element.setAttribute("id", id);
            used.add(id);
            assigned++;
        }
        return assigned;
    }
}
