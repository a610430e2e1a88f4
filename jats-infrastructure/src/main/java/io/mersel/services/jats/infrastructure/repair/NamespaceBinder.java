package io.mersel.services.jats.infrastructure.repair;

import io.mersel.services.jats.application.interfaces.IRepairStep;
import io.mersel.services.jats.application.models.RepairContext;
import io.mersel.services.jats.infrastructure.config.RepairProperties;
import io.mersel.services.jats.infrastructure.dom.XmlNodes;
import org.springframework.stereotype.Component;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Kullanılan {@code xlink} ve {@code mml} namespace'lerini kökte tek kez bildirir,
 * alt elementlerdeki gereksiz (kapsamdakiyle aynı) bildirimleri kaldırır ve
 * kökteki {@code dtd-version} değerini hedef sürüme ayarlar.
 */
@Component
public class NamespaceBinder implements IRepairStep {

    static final String NAME = "namespace-binder";

    private static final List<Map.Entry<String, String>> ROOT_BOUND = List.of(
            Map.entry("xlink", XmlNodes.XLINK_NS),
            Map.entry("mml", XmlNodes.MATHML_NS)
    );

    private final RepairProperties properties;

    public NamespaceBinder(RepairProperties properties) {
        this.properties = properties;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int order() {
        return 80;
    }

    @Override
    public void apply(RepairContext context) {
        Element root = context.root();
        boolean changed = false;

        for (Map.Entry<String, String> binding : ROOT_BOUND) {
            String attr = "xmlns:" + binding.getKey();
            if (!root.hasAttributeNS(XmlNodes.XMLNS_NS, binding.getKey()) && isUsed(root, binding.getValue())) {
                root.setAttributeNS(XmlNodes.XMLNS_NS, attr, binding.getValue());
                context.log().repair(NAME, attr + " kökte bildirildi", "/" + root.getNodeName());
                changed = true;
            }
        }

        int removed = 0;
        for (Element element : XmlNodes.descendants(root, "*")) {
            removed += removeRedundantDeclarations(element);
        }
        if (removed > 0) {
            context.log().repair(NAME, removed + " gereksiz namespace bildirimi kaldırıldı", null);
            changed = true;
        }

        String version = properties.getTargetVersion().getDtdVersion();
        if (!version.equals(root.getAttribute("dtd-version"))) {
            root.setAttribute("dtd-version", version);
            context.log().repair(NAME, "dtd-version=\"" + version + "\" olarak ayarlandı", "/" + root.getNodeName());
            changed = true;
        }

        if (changed) {
            context.treeModified();
        }
    }

    private static boolean isUsed(Element root, String namespace) {
        if (root.getElementsByTagNameNS(namespace, "*").getLength() > 0) {
            return true;
        }
        for (Element element : XmlNodes.descendants(root.getOwnerDocument(), "*")) {
            NamedNodeMap attributes = element.getAttributes();
            for (int i = 0; i < attributes.getLength(); i++) {
                if (namespace.equals(attributes.item(i).getNamespaceURI())) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Ebeveynin kapsamında aynı URI'ye bağlı önekin tekrar bildirimini kaldırır.
     *
     * @return Kaldırılan bildirim sayısı
     */
    private static int removeRedundantDeclarations(Element element) {
        Node parent = element.getParentNode();
        if (parent == null || parent.getNodeType() != Node.ELEMENT_NODE) {
            return 0;
        }
        NamedNodeMap attributes = element.getAttributes();
        List<Attr> redundant = new ArrayList<>();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attr = (Attr) attributes.item(i);
            if (!XmlNodes.XMLNS_NS.equals(attr.getNamespaceURI())) {
                continue;
            }
            String prefix = "xmlns".equals(attr.getName()) ? null : attr.getLocalName();
            if (attr.getValue().equals(parent.lookupNamespaceURI(prefix))) {
                redundant.add(attr);
            }
        }
        redundant.forEach(element::removeAttributeNode);
        return redundant.size();
    }
}
