package io.mersel.services.jats.application.models;

import io.mersel.services.jats.application.enums.CitationKind;

/**
 * {@code ICitationClassifier} kararının sonucu.
 *
 * @param kind   Sınıflandırma
 * @param token  Yalnızca {@link CitationKind#CITATION} için dolu
 * @param reason Karar gerekçesi (belirsizlik raporunda gösterilir)
 */
public record CitationClassification(
        CitationKind kind,
        CitationToken token,
        String reason
) {

    public static CitationClassification citation(CitationToken token) {
        return new CitationClassification(CitationKind.CITATION, token, null);
    }

    public static CitationClassification formula(String reason) {
        return new CitationClassification(CitationKind.FORMULA, null, reason);
    }

    public static CitationClassification ambiguous(String reason) {
        return new CitationClassification(CitationKind.AMBIGUOUS, null, reason);
    }
}
