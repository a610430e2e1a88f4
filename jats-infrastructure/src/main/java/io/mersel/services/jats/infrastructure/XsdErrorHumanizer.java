package io.mersel.services.jats.infrastructure;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Xerces XSD doğrulama hatalarını JATS editörü için okunabilir Türkçe mesajlara çevirir.
 * <p>
 * JATS elementleri namespace'sizdir ama MathML ve XLink parçaları Clark notasyonuyla
 * ({@code {"http://www.w3.org/1998/Math/MathML":math}}) gelir; bunlar sadeleştirilir.
 * Tanınmayan mesajlar namespace'leri temizlenmiş haliyle döner.
 */
final class XsdErrorHumanizer {

    private XsdErrorHumanizer() {
    }

    private static final Pattern NS_QUOTED_PREFIX = Pattern.compile("\"[^\"]+\":");

    /** Element yanlış yerde: starting with element 'X'. One of 'A, B' is expected. */
    private static final Pattern CVC_2_4_A = Pattern.compile(
            "cvc-complex-type\\.2\\.4\\.a:\\s*Invalid content was found starting with element '([^']+)'\\."
                    + "\\s*One of '([^']+)' is expected\\.");

    /** Zorunlu çocuk eksik: The content of element 'X' is not complete. */
    private static final Pattern CVC_2_4_B = Pattern.compile(
            "cvc-complex-type\\.2\\.4\\.b:\\s*The content of element '([^']+)' is not complete\\."
                    + "\\s*One of '([^']+)' is expected\\.");

    /** Beklenmeyen element: No child element is expected at this point. */
    private static final Pattern CVC_2_4_D = Pattern.compile(
            "cvc-complex-type\\.2\\.4\\.d:\\s*Invalid content was found starting with element '([^']+)'\\."
                    + "\\s*No child element is expected at this point\\.");

    private static final Pattern CVC_2_3 = Pattern.compile(
            "cvc-complex-type\\.2\\.3:\\s*Element '([^']+)' cannot have character");

    private static final Pattern CVC_ATTR_NOT_ALLOWED = Pattern.compile(
            "cvc-complex-type\\.3\\.2\\.2:\\s*Attribute '([^']+)' is not allowed to appear in element '([^']+)'\\.");

    private static final Pattern CVC_ATTR_REQUIRED = Pattern.compile(
            "cvc-complex-type\\.4:\\s*Attribute '([^']+)' must appear on element '([^']+)'\\.");

    private static final Pattern CVC_ENUM = Pattern.compile(
            "cvc-enumeration-valid:\\s*Value '([^']*)' is not facet-valid with respect to enumeration '\\[([^\\]]+)\\]'");

    private static final Pattern CVC_IDREF = Pattern.compile(
            "cvc-id\\.1:\\s*There is no ID/IDREF binding for IDREF '([^']+)'");

    private static final Pattern CVC_DUPLICATE_ID = Pattern.compile(
            "cvc-id\\.2:\\s*There are multiple occurrences of ID value '([^']+)'");

    /**
     * Clark notasyonundaki namespace URI'larını siler: {@code {"ns":A, "ns":B}} → {@code A, B}.
     */
    static String stripNamespaces(String msg) {
        if (msg == null) {
            return null;
        }
        String cleaned = NS_QUOTED_PREFIX.matcher(msg).replaceAll("");
        cleaned = cleaned.replace("{", "").replace("}", "");
        return cleaned.replaceAll("  +", " ");
    }

    /**
     * @param line   satır numarası (0 veya negatifse gösterilmez)
     * @param column sütun numarası
     * @param rawMsg Xerces ham hata mesajı
     */
    static String humanize(int line, int column, String rawMsg) {
        if (rawMsg == null || rawMsg.isBlank()) {
            return rawMsg;
        }
        String cleaned = stripNamespaces(rawMsg);
        String friendly = tryHumanize(cleaned);
        String body = friendly != null ? friendly : cleaned;

        if (line <= 0) {
            return body;
        }
        StringBuilder sb = new StringBuilder("Satır ").append(line);
        if (column > 0) {
            sb.append(", Sütun ").append(column);
        }
        return sb.append(": ").append(body).toString();
    }

    private static String tryHumanize(String msg) {
        Matcher m = CVC_2_4_A.matcher(msg);
        if (m.find()) {
            String found = stripQuotes(m.group(1));
            return "\"" + found + "\" elementi bu konumda geçersiz. Bu noktada beklenen: "
                    + formatList(parseElementList(m.group(2))) + ".";
        }

        m = CVC_2_4_B.matcher(msg);
        if (m.find()) {
            return "\"" + stripQuotes(m.group(1)) + "\" elementinin içeriği eksik. Zorunlu element(ler): "
                    + formatList(parseElementList(m.group(2))) + ".";
        }

        m = CVC_2_4_D.matcher(msg);
        if (m.find()) {
            return "\"" + stripQuotes(m.group(1)) + "\" elementi burada beklenmiyor, üst element başka çocuk almaz.";
        }

        m = CVC_2_3.matcher(msg);
        if (m.find()) {
            return "\"" + stripQuotes(m.group(1)) + "\" elementi doğrudan metin içeremez.";
        }

        m = CVC_ATTR_NOT_ALLOWED.matcher(msg);
        if (m.find()) {
            return "\"" + stripQuotes(m.group(2)) + "\" elementinde \"" + m.group(1) + "\" niteliği kullanılamaz.";
        }

        m = CVC_ATTR_REQUIRED.matcher(msg);
        if (m.find()) {
            return "\"" + stripQuotes(m.group(2)) + "\" elementinde zorunlu \"" + m.group(1) + "\" niteliği eksik.";
        }

        m = CVC_ENUM.matcher(msg);
        if (m.find()) {
            return "\"" + m.group(1) + "\" değeri geçersiz. İzin verilen değerler: " + m.group(2) + ".";
        }

        m = CVC_IDREF.matcher(msg);
        if (m.find()) {
            return "\"" + m.group(1) + "\" referansının hedefi yok (rid/rids için eşleşen id bulunamadı).";
        }

        m = CVC_DUPLICATE_ID.matcher(msg);
        if (m.find()) {
            return "\"" + m.group(1) + "\" id değeri birden fazla elementte kullanılmış.";
        }
        return null;
    }

    private static String stripQuotes(String s) {
        return s == null ? "" : s.replace("\"", "").replace("'", "").trim();
    }

    /**
     * "'A', 'B', 'mml:math'" → [A, B, mml:math]
     */
    private static List<String> parseElementList(String raw) {
        List<String> result = new ArrayList<>();
        if (raw == null) {
            return result;
        }
        for (String part : raw.split(",")) {
            String cleaned = stripQuotes(part);
            if (!cleaned.isBlank()) {
                result.add(cleaned);
            }
        }
        return result;
    }

    /**
     * 4 ve üzeri öğede ilk 3'ü gösterir, kalanı sayı olarak ekler.
     */
    private static String formatList(List<String> items) {
        if (items.size() <= 3) {
            return String.join(", ", items);
        }
        return String.join(", ", items.subList(0, 3)) + " ve " + (items.size() - 3) + " tane daha";
    }
}
