package io.mersel.services.jats.application.enums;

/**
 * Matematik yer tutucusu içeriğinin sınıflandırma sonucu.
 */
public enum CitationKind {
    CITATION,
    FORMULA,
    AMBIGUOUS
}
