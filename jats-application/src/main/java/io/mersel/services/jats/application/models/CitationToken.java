package io.mersel.services.jats.application.models;

import java.util.List;

/**
 * Çözümlenmiş bir atıf işareti.
 *
 * @param leadingPunctuation İşaretten önce gelen noktalama ("." gibi), yoksa boş metin
 * @param numbers            Aralıklar ve listeler açılmış, sıralı kaynak numaraları
 */
public record CitationToken(
        String leadingPunctuation,
        List<Integer> numbers
) {

    public CitationToken {
        leadingPunctuation = leadingPunctuation == null ? "" : leadingPunctuation;
        numbers = List.copyOf(numbers);
    }
}
