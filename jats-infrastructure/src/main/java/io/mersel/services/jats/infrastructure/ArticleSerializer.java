package io.mersel.services.jats.infrastructure;

import io.mersel.services.jats.application.enums.JatsVersion;
import io.mersel.services.jats.application.interfaces.IArticleSerializer;
import io.mersel.services.jats.infrastructure.config.RepairProperties;
import io.mersel.services.jats.infrastructure.dom.XmlNodes;
import org.springframework.stereotype.Service;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;

import javax.xml.XMLConstants;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Onarılmış ağacı iki kardeş varyanta serileştirir.
 * <ul>
 *   <li><b>Şema varyantı:</b> XML bildirimi, DOCTYPE yok, kökte {@code xmlns:xsi} ve
 *       {@code xsi:noNamespaceSchemaLocation}.</li>
 *   <li><b>DTD varyantı:</b> XML bildirimi ve hedef sürümün DOCTYPE'ı, şema konumu yok.
 *       PMC Style Checker bu varyantı bekler.</li>
 * </ul>
 * Her iki varyant da ağacın derin kopyası üzerinde üretilir. Girinti eklenmez; aynı ağaç
 * her zaman aynı baytları üretir.
 */
@Service
public class ArticleSerializer implements IArticleSerializer {

    private static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n";
    private static final String SCHEMA_LOCATION_ATTR = "noNamespaceSchemaLocation";

    private final RepairProperties properties;

    public ArticleSerializer(RepairProperties properties) {
        this.properties = properties;
    }

    @Override
    public byte[] toSchemaVariant(Document tree) {
        Document copy = (Document) tree.cloneNode(true);
        Element root = copy.getDocumentElement();
        root.setAttributeNS(XmlNodes.XMLNS_NS, "xmlns:xsi", XmlNodes.XSI_NS);
        root.setAttributeNS(XmlNodes.XSI_NS, "xsi:" + SCHEMA_LOCATION_ATTR, properties.getEffectiveSchemaLocation());
        return write(copy, null);
    }

    @Override
    public byte[] toDtdVariant(Document tree) {
        Document copy = (Document) tree.cloneNode(true);
        Element root = copy.getDocumentElement();
        root.removeAttributeNS(XmlNodes.XSI_NS, SCHEMA_LOCATION_ATTR);
        root.removeAttributeNS(XmlNodes.XSI_NS, "schemaLocation");
        if (!usesNamespace(copy, XmlNodes.XSI_NS)) {
            root.removeAttributeNS(XmlNodes.XMLNS_NS, "xsi");
        }
        JatsVersion version = properties.getTargetVersion();
        return write(copy, version.getDoctypeDeclaration());
    }

    private static byte[] write(Document doc, String doctype) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(XML_DECLARATION.getBytes(StandardCharsets.UTF_8));
        if (doctype != null) {
            out.writeBytes((doctype + "\n").getBytes(StandardCharsets.UTF_8));
        }
        try {
            Transformer transformer = newTransformer();
            transformer.transform(new DOMSource(doc), new StreamResult(out));
        } catch (TransformerException e) {
            throw new IllegalStateException("Makale serileştirilemedi", e);
        }
        return out.toByteArray();
    }

    private static Transformer newTransformer() throws TransformerException {
        TransformerFactory tf = TransformerFactory.newInstance();
        tf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        tf.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
        tf.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
        Transformer transformer = tf.newTransformer();
        // Bildirim ve DOCTYPE elle yazılır
        transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
        transformer.setOutputProperty(OutputKeys.INDENT, "no");
        transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
        transformer.setOutputProperty(OutputKeys.METHOD, "xml");
        return transformer;
    }

    private static boolean usesNamespace(Document doc, String namespace) {
        for (Element element : XmlNodes.descendants(doc, "*")) {
            NamedNodeMap attributes = element.getAttributes();
            for (int i = 0; i < attributes.getLength(); i++) {
                Attr attr = (Attr) attributes.item(i);
                if (namespace.equals(attr.getNamespaceURI())) {
                    return true;
                }
            }
        }
        return false;
    }
}
