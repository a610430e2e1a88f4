package io.mersel.services.jats.application.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Desteklenen JATS Journal Publishing sürümleri.
 * <p>
 * Her sürüm, DTD varyantına yazılacak DOCTYPE kimliklerini ve şema
 * varyantındaki varsayılan {@code xsi:noNamespaceSchemaLocation} değerini taşır.
 * PMC Style Checker DOCTYPE bildirimi olan DTD varyantını bekler.
 */
public enum JatsVersion {

    V1_0("1.0", "20120330", "JATS-journalpublishing1"),
    V1_1("1.1", "20151215", "JATS-journalpublishing1-1"),
    V1_2("1.2", "20190208", "JATS-journalpublishing1-2"),
    V1_3("1.3", "20210610", "JATS-journalpublishing1-3"),
    V1_4("1.4", "20240930", "JATS-journalpublishing1-4");

    private static final String BASE_URL = "https://jats.nlm.nih.gov/publishing/";

    private final String dtdVersion;
    private final String releaseDate;
    private final String fileBaseName;

    JatsVersion(String dtdVersion, String releaseDate, String fileBaseName) {
        this.dtdVersion = dtdVersion;
        this.releaseDate = releaseDate;
        this.fileBaseName = fileBaseName;
    }

    /** Kök elementteki {@code dtd-version} değeri (örn: "1.3"). */
    public String getDtdVersion() {
        return dtdVersion;
    }

    public String getPublicId() {
        return "-//NLM//DTD JATS (Z39.96) Journal Publishing DTD v" + dtdVersion + " " + releaseDate + "//EN";
    }

    public String getSystemId() {
        return BASE_URL + dtdVersion + "/" + fileBaseName + ".dtd";
    }

    /** Şema varyantı için varsayılan XSD konumu. */
    public String getSchemaLocation() {
        return BASE_URL + dtdVersion + "/xsd/" + fileBaseName + ".xsd";
    }

    /**
     * Tam DOCTYPE bildirimi, örn:
     * {@code <!DOCTYPE article PUBLIC "-//NLM//DTD JATS (Z39.96) ...//EN" "https://...dtd">}
     */
    public String getDoctypeDeclaration() {
        return "<!DOCTYPE article PUBLIC \"" + getPublicId() + "\" \"" + getSystemId() + "\">";
    }

    /**
     * "1.3" gibi bir sürüm metninden enum değerini bulur.
     *
     * @param dtdVersion sürüm metni
     * @return eşleşen sürüm; tanınmıyorsa boş
     */
    public static Optional<JatsVersion> fromDtdVersion(String dtdVersion) {
        if (dtdVersion == null) {
            return Optional.empty();
        }
        String trimmed = dtdVersion.trim();
        return Arrays.stream(values())
                .filter(v -> v.dtdVersion.equals(trimmed))
                .findFirst();
    }
}
