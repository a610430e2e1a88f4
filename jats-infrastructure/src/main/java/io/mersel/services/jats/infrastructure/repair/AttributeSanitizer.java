package io.mersel.services.jats.infrastructure.repair;

import io.mersel.services.jats.application.interfaces.IRepairStep;
import io.mersel.services.jats.application.models.RepairContext;
import io.mersel.services.jats.infrastructure.config.RepairProperties;
import io.mersel.services.jats.infrastructure.dom.XmlNodes;
import org.springframework.stereotype.Component;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Yazım aracı ve sunum niteliklerini ({@code data-*}, {@code class}) temizler.
 * <p>
 * Namespace bildirimleri ve gramerde yeri olan nitelikler ({@code id}, {@code position},
 * {@code colspan}, {@code rowspan}, {@code rid} ...) olduğu gibi kalır.
 */
@Component
public class AttributeSanitizer implements IRepairStep {

    static final String NAME = "attribute-sanitizer";

    private final RepairProperties properties;

    public AttributeSanitizer(RepairProperties properties) {
        this.properties = properties;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int order() {
        return 10;
    }

    @Override
    public void apply(RepairContext context) {
        Map<String, Integer> removedByName = new TreeMap<>();

        for (Element element : XmlNodes.descendants(context.document(), "*")) {
            NamedNodeMap attributes = element.getAttributes();
            List<Attr> banned = new ArrayList<>();
            for (int i = 0; i < attributes.getLength(); i++) {
                Attr attr = (Attr) attributes.item(i);
                if (!XmlNodes.XMLNS_NS.equals(attr.getNamespaceURI()) && isBanned(attr.getName())) {
                    banned.add(attr);
                }
            }
            for (Attr attr : banned) {
                element.removeAttributeNode(attr);
                removedByName.merge(attr.getName(), 1, Integer::sum);
            }
        }

        if (removedByName.isEmpty()) {
            return;
        }
        context.treeModified();
        removedByName.forEach((name, count) ->
                context.log().repair(NAME, "'" + name + "' niteliği " + count + " elementten silindi", null));
    }

    /**
     * Nitelik adı yasaklı bir önekle başlıyor veya yasak listesinde mi.
     */
    public boolean isBanned(String attributeName) {
        if (properties.getSanitizer().getDeniedAttributes().contains(attributeName)) {
            return true;
        }
        for (String prefix : properties.getSanitizer().getBannedPrefixes()) {
            if (!prefix.isEmpty() && attributeName.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
