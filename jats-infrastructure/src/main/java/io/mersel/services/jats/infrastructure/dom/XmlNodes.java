package io.mersel.services.jats.infrastructure.dom;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Onarım adımlarının ortak kullandığı DOM yardımcıları.
 * <p>
 * JATS elementleri namespace'sizdir; yeni elementler her zaman
 * {@code createElementNS(null, ...)} ile oluşturulur ki namespace-aware
 * ağaçta {@code localName} dolu kalsın.
 */
public final class XmlNodes {

    public static final String XLINK_NS = "http://www.w3.org/1999/xlink";
    public static final String MATHML_NS = "http://www.w3.org/1998/Math/MathML";
    public static final String XSI_NS = "http://www.w3.org/2001/XMLSchema-instance";
    public static final String ALI_NS = "http://www.niso.org/schemas/ali/1.0/";
    public static final String XMLNS_NS = "http://www.w3.org/2000/xmlns/";

    /** Girdide bildirilmeden kullanılabilen iyi bilinen önekler. */
    public static final Map<String, String> WELL_KNOWN_PREFIXES = Map.of(
            "xlink", XLINK_NS,
            "mml", MATHML_NS,
            "xsi", XSI_NS,
            "ali", ALI_NS
    );

    private XmlNodes() {
    }

    public static boolean isElement(Node node, String name) {
        return node != null
                && node.getNodeType() == Node.ELEMENT_NODE
                && name.equals(node.getNodeName());
    }

    public static List<Element> childElements(Element parent) {
        List<Element> result = new ArrayList<>();
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) n);
            }
        }
        return result;
    }

    public static List<Element> childElements(Element parent, String name) {
        List<Element> result = new ArrayList<>();
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (isElement(n, name)) {
                result.add((Element) n);
            }
        }
        return result;
    }

    /** Verilen adlı ilk alt element; yoksa {@code null}. */
    public static Element firstChild(Element parent, String name) {
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (isElement(n, name)) {
                return (Element) n;
            }
        }
        return null;
    }

    /**
     * Belge sırasıyla alt ağaçtaki tüm eşleşen elementler.
     * DOM'un canlı {@link NodeList}'i yerine anlık kopya döner, ağaç değişirken güvenle dolaşılabilir.
     */
    public static List<Element> descendants(Node root, String name) {
        NodeList list = root.getNodeType() == Node.DOCUMENT_NODE
                ? ((Document) root).getElementsByTagName(name)
                : ((Element) root).getElementsByTagName(name);
        List<Element> result = new ArrayList<>(list.getLength());
        for (int i = 0; i < list.getLength(); i++) {
            result.add((Element) list.item(i));
        }
        return result;
    }

    public static Element create(Document doc, String name) {
        return doc.createElementNS(null, name);
    }

    public static Element create(Document doc, String name, String text) {
        Element element = create(doc, name);
        if (text != null && !text.isEmpty()) {
            element.appendChild(doc.createTextNode(text));
        }
        return element;
    }

    public static void insertAfter(Node newChild, Node reference) {
        reference.getParentNode().insertBefore(newChild, reference.getNextSibling());
    }

    /** Elementi kaldırır, çocuklarını aynı konumda bırakır. */
    public static void unwrap(Element element) {
        Node parent = element.getParentNode();
        while (element.getFirstChild() != null) {
            parent.insertBefore(element.getFirstChild(), element);
        }
        parent.removeChild(element);
    }

    /** Boşluk dışında karakter içermeyen metin düğümü mü. */
    public static boolean isBlankText(Node node) {
        short type = node.getNodeType();
        return (type == Node.TEXT_NODE || type == Node.CDATA_SECTION_NODE)
                && node.getNodeValue().isBlank();
    }

    public static String text(Node node) {
        String content = node.getTextContent();
        return content == null ? "" : content.trim();
    }

    /**
     * Raporda gösterilecek basit konum: {@code /article/body/sec[2]/p}.
     * Sıra numarası yalnızca aynı adlı kardeş varsa eklenir.
     */
    public static String path(Node node) {
        StringBuilder sb = new StringBuilder();
        Node current = node;
        while (current != null && current.getNodeType() == Node.ELEMENT_NODE) {
            String name = current.getNodeName();
            int index = 1;
            int total = 0;
            Node parent = current.getParentNode();
            if (parent != null) {
                for (Node s = parent.getFirstChild(); s != null; s = s.getNextSibling()) {
                    if (isElement(s, name)) {
                        total++;
                        if (s == current) {
                            index = total;
                        }
                    }
                }
            }
            sb.insert(0, total > 1 ? "/" + name + "[" + index + "]" : "/" + name);
            current = parent;
        }
        return sb.toString();
    }
}
