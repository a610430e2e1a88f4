package io.mersel.services.jats.application.interfaces;

import io.mersel.services.jats.application.models.RepairContext;

/**
 * Onarım hattındaki tek bir ağaç dönüşümü.
 * <p>
 * Adımlar {@link #order()} değerine göre artan sırayla, belge başına bir kez çalışır.
 * Her adım idempotent olmalıdır: kendi çıktısına ikinci kez uygulandığında
 * ağacı değiştirmemelidir. Ağacı değiştiren adım {@code context.treeModified()}
 * çağırarak id kayıt defterini geçersiz kılar. Adımlar hata fırlatmaz,
 * düzeltemediklerini günlüğe yazar.
 */
public interface IRepairStep {

    /** Günlük ve metriklerde kullanılan kısa ad (örn: "attribute-sanitizer"). */
    String getName();

    /** Hat içindeki sıra; küçük değer önce çalışır. */
    int order();

    void apply(RepairContext context);
}
