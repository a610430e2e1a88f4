package io.mersel.services.jats.application.interfaces;

import org.w3c.dom.Document;

/**
 * Onarılmış ağaçtan iki hedef serileştirmeyi üretir.
 * <p>
 * Her iki varyant da ağacın kopyası üzerinde üretilir; ağaç değişmez
 * ve iki varyant yalnızca belge tipi bildirimi ile şema konumu niteliğinde ayrışır.
 */
public interface IArticleSerializer {

    /** DOCTYPE içermeyen, kökte şema konumu taşıyan UTF-8 çıktı. */
    byte[] toSchemaVariant(Document tree);

    /** Yapılandırılmış JATS sürümünün DOCTYPE'ını taşıyan, şema konumu içermeyen UTF-8 çıktı. */
    byte[] toDtdVariant(Document tree);
}
