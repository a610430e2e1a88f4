package io.mersel.services.jats.infrastructure.repair;

import io.mersel.services.jats.application.interfaces.ICitationClassifier;
import io.mersel.services.jats.application.models.CitationClassification;
import io.mersel.services.jats.application.models.CitationToken;
import io.mersel.services.jats.infrastructure.config.RepairProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Üst simge atıf işaretlerini ({@code ^{5}}, {@code .^{1-3}}, {@code ^{5,6}}) gerçek
 * formüllerden ayıran varsayılan sınıflandırıcı.
 * <p>
 * Harf, ters bölü komutu veya işleç içeren içerik formüldür. Atıf biçiminde olup
 * eşiklerden birini aşan içerik ile parantezsiz sayısal üst simge ({@code ^2}, birim
 * üssü olabilir) belirsiz kabul edilir.
 */
@Component
public class SuperscriptCitationClassifier implements ICitationClassifier {

    private static final Pattern BRACED = Pattern.compile("^([.,;:]*)\\s*\\^\\{([^{}]*)}$");
    private static final Pattern BARE = Pattern.compile("^([.,;:]*)\\s*\\^\\d+$");
    private static final Pattern RANGE = Pattern.compile("^(\\d+)\\s*[-–]\\s*(\\d+)$");
    private static final Pattern SINGLE = Pattern.compile("^\\d+$");
    private static final Pattern OPERATOR = Pattern.compile("[=+*/<>]");
    private static final int MAX_DIGITS = 9;

    private final RepairProperties properties;

    public SuperscriptCitationClassifier(RepairProperties properties) {
        this.properties = properties;
    }

    @Override
    public CitationClassification classify(String payload) {
        String text = payload == null ? "" : payload.trim();
        RepairProperties.Citation limits = properties.getCitation();

        if (text.isEmpty()) {
            return CitationClassification.formula("Boş içerik");
        }
        if (text.length() > limits.getMaxPayloadLength()) {
            return CitationClassification.formula("İçerik atıf için fazla uzun");
        }
        if (text.indexOf('\\') >= 0) {
            return CitationClassification.formula("LaTeX komutu içeriyor");
        }
        if (text.chars().anyMatch(Character::isLetter)) {
            return CitationClassification.formula("Harf içeriyor");
        }
        if (OPERATOR.matcher(text).find()) {
            return CitationClassification.formula("İşleç içeriyor");
        }
        if (text.indexOf('^') < 0) {
            return CitationClassification.formula("Üst simge işareti yok");
        }

        Matcher braced = BRACED.matcher(text);
        if (!braced.matches()) {
            if (BARE.matcher(text).matches()) {
                return CitationClassification.ambiguous("Parantezsiz sayısal üst simge, birim üssü olabilir: " + text);
            }
            return CitationClassification.formula("Atıf biçiminde değil");
        }

        Set<Integer> numbers = new LinkedHashSet<>();
        for (String item : braced.group(2).split(",", -1)) {
            String trimmed = item.trim();
            if (trimmed.isEmpty()) {
                return CitationClassification.ambiguous("Boş liste öğesi: " + text);
            }
            Matcher range = RANGE.matcher(trimmed);
            if (range.matches()) {
                String error = expandRange(range.group(1), range.group(2), numbers, limits);
                if (error != null) {
                    return CitationClassification.ambiguous(error + ": " + text);
                }
            } else if (SINGLE.matcher(trimmed).matches()) {
                Integer number = parse(trimmed, limits);
                if (number == null) {
                    return CitationClassification.ambiguous("Kaynak numarası aralık dışında: " + text);
                }
                numbers.add(number);
            } else {
                return CitationClassification.ambiguous("Tanınmayan liste öğesi '" + trimmed + "': " + text);
            }
        }
        return CitationClassification.citation(new CitationToken(braced.group(1), new ArrayList<>(numbers)));
    }

    private static String expandRange(String from, String to, Set<Integer> into, RepairProperties.Citation limits) {
        Integer start = parse(from, limits);
        Integer end = parse(to, limits);
        if (start == null || end == null) {
            return "Kaynak numarası aralık dışında";
        }
        if (end < start) {
            return "Azalan aralık";
        }
        if (end - start + 1 > limits.getMaxRangeSpan()) {
            return "Aralık çok geniş";
        }
        for (int n = start; n <= end; n++) {
            into.add(n);
        }
        return null;
    }

    /**
     * @return 1..max-citation-number aralığındaki sayı; değilse {@code null}
     */
    private static Integer parse(String digits, RepairProperties.Citation limits) {
        if (digits.length() > MAX_DIGITS) {
            return null;
        }
        int value = Integer.parseInt(digits);
        return value >= 1 && value <= limits.getMaxCitationNumber() ? value : null;
    }
}
