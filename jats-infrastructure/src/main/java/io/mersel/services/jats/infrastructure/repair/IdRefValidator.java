package io.mersel.services.jats.infrastructure.repair;

import io.mersel.services.jats.application.interfaces.IRepairStep;
import io.mersel.services.jats.application.models.IdRegistry;
import io.mersel.services.jats.application.models.RepairContext;
import io.mersel.services.jats.infrastructure.dom.XmlNodes;
import org.springframework.stereotype.Component;
import org.w3c.dom.Element;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code rid} ve {@code rids} referanslarını mevcut id'lere göre doğrular ve onarır.
 * <p>
 * Tek hedefli {@code rid} için sırasıyla denenir:
 * <ol>
 *   <li>Büyük/küçük harf duyarsız tekil eşleşme</li>
 *   <li>Konumsal ipucu: {@code alt} veya metindeki ilk sayı, {@code ref-type}'ın gösterdiği
 *       türün N'inci elementine eşlenir. Yanlış eşleyebileceği için ayrıca belirsizlik olarak raporlanır.</li>
 * </ol>
 * Onarılamayan nitelik silinir; {@code rid}'i zorunlu olan {@code xref} ise metni korunarak açılır.
 * Çok hedefli değerler geçerli id'lere süzülür. Yinelenen id'ler yeniden adlandırılmaz, yalnızca bildirilir.
 */
@Component
public class IdRefValidator implements IRepairStep {

    static final String NAME = "idref-validator";

    private static final Pattern FIRST_NUMBER = Pattern.compile("\\d{1,6}");

    private static final Map<String, String> TARGET_BY_REF_TYPE = Map.of(
            "bibr", "ref",
            "fig", "fig",
            "table", "table-wrap",
            "sec", "sec",
            "disp-formula", "disp-formula",
            "fn", "fn",
            "app", "app",
            "supplementary-material", "supplementary-material"
    );

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int order() {
        return 60;
    }

    @Override
    public void apply(RepairContext context) {
        IdRegistry ids = context.ids();
        reportDuplicates(ids, context);

        boolean changed = false;
        for (Element element : XmlNodes.descendants(context.document(), "*")) {
            if (element.getParentNode() == null) {
                continue;
            }
            if (element.hasAttribute("rids")) {
                changed |= filterMulti(element, "rids", ids, context);
            }
            if (element.hasAttribute("rid")) {
                String[] tokens = tokens(element.getAttribute("rid"));
                changed |= tokens.length > 1
                        ? filterMulti(element, "rid", ids, context)
                        : resolveSingle(element, tokens.length == 1 ? tokens[0] : "", ids, context);
            }
        }
        if (changed) {
            context.treeModified();
        }
    }

    private boolean resolveSingle(Element element, String rid, IdRegistry ids, RepairContext context) {
        String location = XmlNodes.path(element);
        if (!rid.isEmpty() && ids.contains(rid)) {
            if (!rid.equals(element.getAttribute("rid"))) {
                element.setAttribute("rid", rid);
                return true;
            }
            return false;
        }

        Optional<String> caseMatch = ids.findIgnoreCase(rid);
        if (caseMatch.isPresent()) {
            element.setAttribute("rid", caseMatch.get());
            context.log().repair(NAME, "rid '" + rid + "' → '" + caseMatch.get() + "' (büyük/küçük harf)", location);
            return true;
        }

        Optional<String> positional = positionalTarget(element);
        if (positional.isPresent()) {
            element.setAttribute("rid", positional.get());
            String message = "rid '" + rid + "' konumsal ipucuyla '" + positional.get() + "' olarak eşlendi";
            context.log().repair(NAME, message, location);
            context.log().ambiguity(NAME, message + ", eşleme doğrulanmalı", location);
            return true;
        }

        if ("xref".equals(element.getNodeName())) {
            XmlNodes.unwrap(element);
            context.log().repair(NAME, "Hedefi olmayan xref (rid='" + rid + "') açıldı, metni korundu", location);
        } else {
            element.removeAttribute("rid");
            context.log().repair(NAME, "Hedefi olmayan rid='" + rid + "' silindi", location);
        }
        return true;
    }

    private boolean filterMulti(Element element, String attribute, IdRegistry ids, RepairContext context) {
        String original = element.getAttribute(attribute);
        List<String> valid = Arrays.stream(tokens(original))
                .filter(ids::contains)
                .distinct()
                .toList();
        String rewritten = String.join(" ", valid);
        if (rewritten.equals(original)) {
            return false;
        }
        String location = XmlNodes.path(element);
        if (!valid.isEmpty()) {
            element.setAttribute(attribute, rewritten);
            context.log().repair(NAME, attribute + " geçerli hedeflere süzüldü: '" + original + "' → '" + rewritten + "'", location);
        } else if ("xref".equals(element.getNodeName()) && "rid".equals(attribute)) {
            XmlNodes.unwrap(element);
            context.log().repair(NAME, "Hedefi olmayan xref (rid='" + original + "') açıldı, metni korundu", location);
        } else {
            element.removeAttribute(attribute);
            context.log().repair(NAME, "Hedefi olmayan " + attribute + "='" + original + "' silindi", location);
        }
        return true;
    }

    /**
     * {@code alt} niteliğindeki (yoksa metindeki) ilk sayıyı, ref-type'ın gösterdiği
     * türün belge sırasındaki N'inci elementine eşler.
     */
    private static Optional<String> positionalTarget(Element element) {
        String targetName = TARGET_BY_REF_TYPE.get(element.getAttribute("ref-type"));
        if (targetName == null) {
            return Optional.empty();
        }
        Optional<Integer> hint = firstNumber(element.getAttribute("alt"))
                .or(() -> firstNumber(element.getTextContent()));
        if (hint.isEmpty()) {
            return Optional.empty();
        }
        List<Element> targets = XmlNodes.descendants(element.getOwnerDocument(), targetName);
        int index = hint.get();
        if (index < 1 || index > targets.size()) {
            return Optional.empty();
        }
        String id = targets.get(index - 1).getAttribute("id");
        return id.isEmpty() ? Optional.empty() : Optional.of(id);
    }

    private static Optional<Integer> firstNumber(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher m = FIRST_NUMBER.matcher(text);
        return m.find() ? Optional.of(Integer.parseInt(m.group())) : Optional.empty();
    }

    private static String[] tokens(String value) {
        String trimmed = value.trim();
        return trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
    }

    private static void reportDuplicates(IdRegistry ids, RepairContext context) {
        for (String duplicate : ids.duplicates()) {
            context.log().notice(NAME, "Yinelenen id '" + duplicate + "'",
                    ids.get(duplicate).map(XmlNodes::path).orElse(null));
        }
    }
}
