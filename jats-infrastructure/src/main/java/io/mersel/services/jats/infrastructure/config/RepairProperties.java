package io.mersel.services.jats.infrastructure.config;

import io.mersel.services.jats.application.enums.JatsVersion;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.IllegalFormatException;
import java.util.List;

/**
 * JATS onarım hattı yapılandırma özellikleri.
 * <p>
 * {@code jats.repair} prefix'i altındaki değerleri okur.
 * <ul>
 *   <li>{@code dtd-version}: Hedef JATS sürümü (1.0 ile 1.4 arası, varsayılan 1.3)</li>
 *   <li>{@code schema-path}: Doğrulamada kullanılacak ana XSD dosyası (boşsa doğrulama atlanır)</li>
 *   <li>{@code schema-location}: Şema varyantına yazılacak konum (boşsa sürümden türetilir)</li>
 *   <li>{@code sanitizer.*}: Silinecek nitelik önekleri ve yasak nitelik listesi</li>
 *   <li>{@code citation.*}: Atıf/formül sezgiselinin eşikleri</li>
 *   <li>{@code metadata.*}: Eksik zorunlu metadata için yer tutucu değerler</li>
 *   <li>{@code pruner.containers}: Boşsa silinecek kapsayıcı elementler</li>
 *   <li>{@code suggestions.enabled}: Harici onarım önerisi kullanımı (varsayılan kapalı)</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "jats.repair")
public class RepairProperties {

    private static final Logger log = LoggerFactory.getLogger(RepairProperties.class);

    private static final JatsVersion DEFAULT_VERSION = JatsVersion.V1_3;
    private static final String DEFAULT_PLACEHOLDER_TEXT = "Reference %d";

    private String dtdVersion = DEFAULT_VERSION.getDtdVersion();
    private String schemaPath = "";
    private String schemaLocation = "";

    private final Sanitizer sanitizer = new Sanitizer();
    private final Tables tables = new Tables();
    private final Metadata metadata = new Metadata();
    private final Citation citation = new Citation();
    private final Pruner pruner = new Pruner();
    private final Suggestions suggestions = new Suggestions();

    @PostConstruct
    void validate() {
        if (JatsVersion.fromDtdVersion(dtdVersion).isEmpty()) {
            log.warn("dtd-version tanınmıyor (verilen: {}), varsayılan {} kullanılıyor",
                    dtdVersion, DEFAULT_VERSION.getDtdVersion());
            dtdVersion = DEFAULT_VERSION.getDtdVersion();
        }
        if (citation.maxPayloadLength <= 0) {
            log.warn("citation.max-payload-length pozitif olmalı (verilen: {}), varsayılan 40 kullanılıyor",
                    citation.maxPayloadLength);
            citation.maxPayloadLength = 40;
        }
        if (citation.maxRangeSpan <= 0) {
            log.warn("citation.max-range-span pozitif olmalı (verilen: {}), varsayılan 50 kullanılıyor",
                    citation.maxRangeSpan);
            citation.maxRangeSpan = 50;
        }
        if (citation.maxCitationNumber <= 0) {
            log.warn("citation.max-citation-number pozitif olmalı (verilen: {}), varsayılan 9999 kullanılıyor",
                    citation.maxCitationNumber);
            citation.maxCitationNumber = 9999;
        }
        if (citation.referenceIdPrefix == null || citation.referenceIdPrefix.isBlank()) {
            log.warn("citation.reference-id-prefix boş olamaz, varsayılan 'ref' kullanılıyor");
            citation.referenceIdPrefix = "ref";
        }
        if (!isNumberFormat(citation.placeholderText)) {
            log.warn("citation.placeholder-text tek bir tamsayı argümanlı biçim olmalı (verilen: {}), "
                    + "varsayılan '{}' kullanılıyor", citation.placeholderText, DEFAULT_PLACEHOLDER_TEXT);
            citation.placeholderText = DEFAULT_PLACEHOLDER_TEXT;
        }
    }

    /**
     * Biçim tek tamsayıyla hatasız çalışıyor ve numarayı metne yansıtıyor mu.
     */
    static boolean isNumberFormat(String format) {
        if (format == null || format.isBlank()) {
            return false;
        }
        try {
            return !String.format(format, 1).equals(String.format(format, 2));
        } catch (IllegalFormatException e) {
            return false;
        }
    }

    /**
     * Hedef sürüm; geçersiz bir değer verilmişse varsayılan sürüm.
     */
    public JatsVersion getTargetVersion() {
        return JatsVersion.fromDtdVersion(dtdVersion).orElse(DEFAULT_VERSION);
    }

    /**
     * Şema varyantına yazılacak konum; yapılandırılmamışsa sürümün resmi XSD adresi.
     */
    public String getEffectiveSchemaLocation() {
        return schemaLocation == null || schemaLocation.isBlank()
                ? getTargetVersion().getSchemaLocation()
                : schemaLocation;
    }

    public String getDtdVersion() {
        return dtdVersion;
    }

    public void setDtdVersion(String dtdVersion) {
        this.dtdVersion = dtdVersion;
    }

    public String getSchemaPath() {
        return schemaPath;
    }

    public void setSchemaPath(String schemaPath) {
        this.schemaPath = schemaPath;
    }

    public String getSchemaLocation() {
        return schemaLocation;
    }

    public void setSchemaLocation(String schemaLocation) {
        this.schemaLocation = schemaLocation;
    }

    public Sanitizer getSanitizer() {
        return sanitizer;
    }

    public Tables getTables() {
        return tables;
    }

    public Metadata getMetadata() {
        return metadata;
    }

    public Citation getCitation() {
        return citation;
    }

    public Pruner getPruner() {
        return pruner;
    }

    public Suggestions getSuggestions() {
        return suggestions;
    }

    // ── Gruplar ─────────────────────────────────────────────────────

    public static class Sanitizer {

        /** Bu öneklerle başlayan nitelikler silinir (yazım aracı metadata'sı). */
        private List<String> bannedPrefixes = new ArrayList<>(List.of("data-"));

        /** Gramerde yeri olmayan sunum nitelikleri. */
        private List<String> deniedAttributes = new ArrayList<>(List.of("class"));

        public List<String> getBannedPrefixes() {
            return bannedPrefixes;
        }

        public void setBannedPrefixes(List<String> bannedPrefixes) {
            this.bannedPrefixes = bannedPrefixes;
        }

        public List<String> getDeniedAttributes() {
            return deniedAttributes;
        }

        public void setDeniedAttributes(List<String> deniedAttributes) {
            this.deniedAttributes = deniedAttributes;
        }
    }

    public static class Tables {

        /** {@code position} niteliği olmayan table-wrap'lere yazılacak değer. */
        private String defaultPosition = "float";

        public String getDefaultPosition() {
            return defaultPosition;
        }

        public void setDefaultPosition(String defaultPosition) {
            this.defaultPosition = defaultPosition;
        }
    }

    public static class Metadata {

        private String articleType = "research-article";
        private String journalId = "journal";
        private String journalIdType = "publisher-id";
        private String journalTitle = "Journal";
        private String issn = "0000-0000";
        private String publisherName = "Publisher";
        private String elocationId = "e001";

        public String getArticleType() {
            return articleType;
        }

        public void setArticleType(String articleType) {
            this.articleType = articleType;
        }

        public String getJournalId() {
            return journalId;
        }

        public void setJournalId(String journalId) {
            this.journalId = journalId;
        }

        public String getJournalIdType() {
            return journalIdType;
        }

        public void setJournalIdType(String journalIdType) {
            this.journalIdType = journalIdType;
        }

        public String getJournalTitle() {
            return journalTitle;
        }

        public void setJournalTitle(String journalTitle) {
            this.journalTitle = journalTitle;
        }

        public String getIssn() {
            return issn;
        }

        public void setIssn(String issn) {
            this.issn = issn;
        }

        public String getPublisherName() {
            return publisherName;
        }

        public void setPublisherName(String publisherName) {
            this.publisherName = publisherName;
        }

        public String getElocationId() {
            return elocationId;
        }

        public void setElocationId(String elocationId) {
            this.elocationId = elocationId;
        }
    }

    public static class Citation {

        /** Bu uzunluktan uzun içerik formül sayılır. */
        private int maxPayloadLength = 40;

        /** Tek bir aralığın açılabileceği en fazla numara (örn: 1-50). */
        private int maxRangeSpan = 50;

        /** Kabul edilen en büyük kaynak numarası. */
        private int maxCitationNumber = 9999;

        /** Üretilen referans id'lerinin öneki: "ref" → ref5. */
        private String referenceIdPrefix = "ref";

        /** Sentezlenen kaynak girdisinin metni; {@code %d} kaynak numarasıdır. */
        private String placeholderText = DEFAULT_PLACEHOLDER_TEXT;

        public int getMaxPayloadLength() {
            return maxPayloadLength;
        }

        public void setMaxPayloadLength(int maxPayloadLength) {
            this.maxPayloadLength = maxPayloadLength;
        }

        public int getMaxRangeSpan() {
            return maxRangeSpan;
        }

        public void setMaxRangeSpan(int maxRangeSpan) {
            this.maxRangeSpan = maxRangeSpan;
        }

        public int getMaxCitationNumber() {
            return maxCitationNumber;
        }

        public void setMaxCitationNumber(int maxCitationNumber) {
            this.maxCitationNumber = maxCitationNumber;
        }

        public String getReferenceIdPrefix() {
            return referenceIdPrefix;
        }

        public void setReferenceIdPrefix(String referenceIdPrefix) {
            this.referenceIdPrefix = referenceIdPrefix;
        }

        public String getPlaceholderText() {
            return placeholderText;
        }

        public void setPlaceholderText(String placeholderText) {
            this.placeholderText = placeholderText;
        }
    }

    public static class Pruner {

        private List<String> containers = new ArrayList<>(List.of("back", "ref-list", "fn-group", "app-group"));

        public List<String> getContainers() {
            return containers;
        }

        public void setContainers(List<String> containers) {
            this.containers = containers;
        }
    }

    public static class Suggestions {

        private boolean enabled = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
