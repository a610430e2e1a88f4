package io.mersel.services.jats.application.interfaces;

import io.mersel.services.jats.application.models.RepairLog;
import org.w3c.dom.Document;

/**
 * Ham belge metnini bellek içi ağaca dönüştüren yükleyici.
 * <p>
 * Küçük iyi-biçimlilik hataları işlemi durdurmaz; kurtarma yapıldığında
 * günlüğe bir {@code INPUT_NOTICE} yazılır. Kök element {@code article}
 * değilse uyarı verilir ama hata fırlatılmaz.
 */
public interface IArticleLoader {

    /**
     * @param input UTF-8 belge içeriği
     * @param log   Girdi bildirimlerinin yazılacağı günlük
     * @return Namespace-aware DOM ağacı (DOCTYPE düğümü içermez)
     * @throws ArticleParseException içerik işaretleme olarak hiç ayrıştırılamazsa
     */
    Document load(byte[] input, RepairLog log) throws ArticleParseException;
}
