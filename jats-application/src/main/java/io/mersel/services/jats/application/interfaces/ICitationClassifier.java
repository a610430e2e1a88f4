package io.mersel.services.jats.application.interfaces;

import io.mersel.services.jats.application.models.CitationClassification;

/**
 * Matematik yer tutucusu içeriğinin atıf işareti mi, gerçek formül mü
 * olduğuna karar veren strateji.
 * <p>
 * Karar sezgiseldir; eşikleri değiştirmek veya farklı bir strateji kullanmak
 * için başka bir bean tanımlamak yeterlidir, çevreleyen hat değişmez.
 * Emin olunamayan durumlar {@code AMBIGUOUS} döner ve dokunulmadan raporlanır.
 */
public interface ICitationClassifier {

    /**
     * @param payload {@code tex-math} elementinin metin içeriği (örn: {@code ".^{1-3}"})
     */
    CitationClassification classify(String payload);
}
