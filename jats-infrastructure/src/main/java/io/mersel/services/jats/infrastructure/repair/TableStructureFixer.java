package io.mersel.services.jats.infrastructure.repair;

import io.mersel.services.jats.application.interfaces.IRepairStep;
import io.mersel.services.jats.application.models.RepairContext;
import io.mersel.services.jats.application.models.RepairLog;
import io.mersel.services.jats.infrastructure.config.RepairProperties;
import io.mersel.services.jats.infrastructure.dom.XmlNodes;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Tablo içerik modelini uygular:
 * {@code (col* | colgroup*), (thead?, tfoot?, tbody+ | tr+)}.
 * <p>
 * Kurallar:
 * <ul>
 *   <li>Hücresiz satırlar, geçerli satırı olan gruplardan silinir; geçerli satırı olmayan thead/tfoot silinir.</li>
 *   <li>Grup içeren tabloda doğrudan {@code tr} kalmaz, ardışık satırlar yeni bir tbody'ye alınır.</li>
 *   <li>thead/tfoot ilk tbody'den önce gelir.</li>
 *   <li>Başlık veya altlık varsa boş tbody silinir; hiç tbody kalmazsa tfoot, yoksa thead'in
 *       hemen ardına tek placeholder satırlı bir tbody eklenir.</li>
 *   <li>Başlık/altlık yoksa boş tbody, tablonun tek içerik grubu değilse silinir;
 *       tek grupsa placeholder satır alır.</li>
 * </ul>
 * Hücreleri boş da olsa hücreli satırlar veridir ve korunur.
 * Placeholder satır ({@code <tr><td/></tr>}) yalnızca gramer gereğidir, içerik değildir;
 * görüntüleyiciler {@link #isPlaceholderRow(Element)} ile tanıyıp gizleyebilir.
 */
@Component
public class TableStructureFixer implements IRepairStep {

    static final String NAME = "table-structure";

    private final RepairProperties properties;

    public TableStructureFixer(RepairProperties properties) {
        this.properties = properties;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int order() {
        return 20;
    }

    @Override
    public void apply(RepairContext context) {
        boolean changed = applyDefaultPositions(context);
        for (Element table : XmlNodes.descendants(context.document(), "table")) {
            changed |= fixTable(table, context.log());
        }
        if (changed) {
            context.treeModified();
        }
    }

    /**
     * Tek hücreli, hücresi tamamen boş satır mı.
     */
    public static boolean isPlaceholderRow(Element row) {
        List<Element> children = XmlNodes.childElements(row);
        if (children.size() != 1 || !isCell(children.get(0))) {
            return false;
        }
        return isBlankCell(children.get(0));
    }

    // ── table-wrap ──────────────────────────────────────────────────

    private boolean applyDefaultPositions(RepairContext context) {
        String position = properties.getTables().getDefaultPosition();
        if (position == null || position.isBlank()) {
            return false;
        }
        boolean changed = false;
        for (Element wrap : XmlNodes.descendants(context.document(), "table-wrap")) {
            if (!wrap.hasAttribute("position")) {
                wrap.setAttribute("position", position);
                context.log().repair(NAME, "table-wrap position=\"" + position + "\" olarak ayarlandı", XmlNodes.path(wrap));
                changed = true;
            }
        }
        return changed;
    }

    // ── table ───────────────────────────────────────────────────────

    private boolean fixTable(Element table, RepairLog log) {
        String location = XmlNodes.path(table);
        boolean changed = removeInvalidRows(table, location, log);
        changed |= wrapDirectRows(table, location, log);
        changed |= orderHeaderAndFooter(table, location, log);

        Element head = XmlNodes.firstChild(table, "thead");
        Element foot = XmlNodes.firstChild(table, "tfoot");
        if (head != null || foot != null) {
            changed |= fixBodiesWithHeaderOrFooter(table, head, foot, location, log);
        } else {
            changed |= fixBodiesWithoutHeaderOrFooter(table, location, log);
        }

        return changed;
    }

    private boolean removeInvalidRows(Element table, String location, RepairLog log) {
        boolean changed = false;
        List<Element> containers = new ArrayList<>();
        containers.add(table);
        containers.addAll(groups(table));

        for (Element container : containers) {
            List<Element> rows = XmlNodes.childElements(container, "tr");
            boolean anyValid = rows.stream().anyMatch(TableStructureFixer::hasCell);
            if (!anyValid) {
                continue;
            }
            for (Element row : rows) {
                if (!hasCell(row)) {
                    container.removeChild(row);
                    log.repair(NAME, "Hücresiz satır silindi (" + container.getNodeName() + ")", location);
                    changed = true;
                }
            }
        }

        for (String name : List.of("thead", "tfoot")) {
            for (Element group : XmlNodes.childElements(table, name)) {
                if (!hasValidRow(group)) {
                    table.removeChild(group);
                    log.repair(NAME, "Geçerli satırı olmayan " + name + " silindi", location);
                    changed = true;
                }
            }
        }

        // Grupsuz tabloda hiç geçerli doğrudan satır yoksa satırlar atılır, aşağıda placeholder grup eklenir
        if (groups(table).isEmpty()) {
            List<Element> direct = XmlNodes.childElements(table, "tr");
            if (!direct.isEmpty() && direct.stream().noneMatch(TableStructureFixer::hasCell)) {
                direct.forEach(table::removeChild);
                log.repair(NAME, "Hücresiz doğrudan satırlar silindi", location);
                changed = true;
            }
        }
        return changed;
    }

    /**
     * Grup içeren tabloda doğrudan satırları bulundukları yerde yeni tbody'lere alır.
     */
    private boolean wrapDirectRows(Element table, String location, RepairLog log) {
        if (groups(table).isEmpty() || XmlNodes.childElements(table, "tr").isEmpty()) {
            return false;
        }
        Document doc = table.getOwnerDocument();
        Element currentBody = null;
        Node node = table.getFirstChild();
        while (node != null) {
            Node next = node.getNextSibling();
            if (XmlNodes.isElement(node, "tr")) {
                if (currentBody == null) {
                    currentBody = XmlNodes.create(doc, "tbody");
                    table.insertBefore(currentBody, node);
                }
                currentBody.appendChild(node);
            } else if (node.getNodeType() == Node.ELEMENT_NODE) {
                currentBody = null;
            }
            node = next;
        }
        log.repair(NAME, "Gruplarla karışık doğrudan satırlar tbody içine alındı", location);
        return true;
    }

    /**
     * thead ve tfoot'u (bu sırayla) ilk grup konumuna taşır.
     */
    private boolean orderHeaderAndFooter(Element table, String location, RepairLog log) {
        boolean changed = false;
        Node insertionPoint = firstGroup(table);
        for (String name : List.of("thead", "tfoot")) {
            Element group = XmlNodes.firstChild(table, name);
            if (group == null) {
                continue;
            }
            if (group == insertionPoint) {
                insertionPoint = nextGroup(group);
            } else {
                table.insertBefore(group, insertionPoint);
                log.repair(NAME, name + " gramer sırasına taşındı", location);
                changed = true;
            }
        }
        return changed;
    }

    private boolean fixBodiesWithHeaderOrFooter(Element table, Element head, Element foot,
                                                String location, RepairLog log) {
        boolean changed = false;
        for (Element body : XmlNodes.childElements(table, "tbody")) {
            if (!hasValidRow(body)) {
                table.removeChild(body);
                log.repair(NAME, "Boş tbody silindi", location);
                changed = true;
            }
        }
        if (XmlNodes.firstChild(table, "tbody") == null) {
            Element body = placeholderBody(table.getOwnerDocument());
            XmlNodes.insertAfter(body, foot != null ? foot : head);
            log.repair(NAME, "Başlık/altlık için placeholder satırlı tbody eklendi", location);
            changed = true;
        }
        return changed;
    }

    private boolean fixBodiesWithoutHeaderOrFooter(Element table, String location, RepairLog log) {
        List<Element> bodies = XmlNodes.childElements(table, "tbody");
        boolean hasDirectRows = !XmlNodes.childElements(table, "tr").isEmpty();

        if (bodies.isEmpty()) {
            if (hasDirectRows) {
                return false;
            }
            table.appendChild(placeholderBody(table.getOwnerDocument()));
            log.repair(NAME, "Satırsız tabloya placeholder satırlı tbody eklendi", location);
            return true;
        }

        boolean changed = false;
        List<Element> empty = bodies.stream().filter(b -> !hasValidRow(b)).toList();
        if (empty.size() == bodies.size() && !hasDirectRows) {
            // Tek içerik grubu olarak ilki kalır
            Element keep = empty.get(0);
            for (Element body : empty.subList(1, empty.size())) {
                table.removeChild(body);
                changed = true;
            }
            for (Element row : XmlNodes.childElements(keep, "tr")) {
                keep.removeChild(row);
            }
            keep.appendChild(placeholderRow(table.getOwnerDocument()));
            log.repair(NAME, "Tek içerik grubu olan boş tbody'ye placeholder satır eklendi", location);
            return true;
        }

        for (Element body : empty) {
            table.removeChild(body);
            log.repair(NAME, "Boş tbody silindi", location);
            changed = true;
        }
        return changed;
    }

    // ── Yardımcılar ─────────────────────────────────────────────────

    private static boolean isGroup(Node node) {
        return XmlNodes.isElement(node, "thead")
                || XmlNodes.isElement(node, "tfoot")
                || XmlNodes.isElement(node, "tbody");
    }

    private static List<Element> groups(Element table) {
        return XmlNodes.childElements(table).stream()
                .filter(TableStructureFixer::isGroup)
                .toList();
    }

    private static Node firstGroup(Element table) {
        for (Node n = table.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (isGroup(n)) {
                return n;
            }
        }
        return null;
    }

    private static Node nextGroup(Node group) {
        for (Node n = group.getNextSibling(); n != null; n = n.getNextSibling()) {
            if (isGroup(n)) {
                return n;
            }
        }
        return null;
    }

    private static boolean isCell(Node node) {
        return XmlNodes.isElement(node, "td") || XmlNodes.isElement(node, "th");
    }

    private static boolean hasCell(Element row) {
        return XmlNodes.childElements(row).stream().anyMatch(TableStructureFixer::isCell);
    }

    private static boolean hasValidRow(Element group) {
        return XmlNodes.childElements(group, "tr").stream().anyMatch(TableStructureFixer::hasCell);
    }

    private static boolean isBlankCell(Element cell) {
        return XmlNodes.childElements(cell).isEmpty() && XmlNodes.text(cell).isEmpty();
    }

    private static Element placeholderRow(Document doc) {
        Element row = XmlNodes.create(doc, "tr");
        row.appendChild(XmlNodes.create(doc, "td"));
        return row;
    }

    private static Element placeholderBody(Document doc) {
        Element body = XmlNodes.create(doc, "tbody");
        body.appendChild(placeholderRow(doc));
        return body;
    }
}
