package io.mersel.services.jats.application.interfaces;

import io.mersel.services.jats.application.models.RepairResult;

/**
 * JATS makale onarım servisi arayüzü.
 * <p>
 * Dönüştürücüden gelen gevşek biçimli bir makaleyi yükler, sıralı onarım
 * adımlarından geçirir, iki varyantı serileştirir ve uyumluluk raporu üretir.
 * Belge başına senkron çalışır; belgeler arasında paylaşılan durum yoktur.
 */
public interface IArticleRepairService {

    /**
     * @param input UTF-8 belge içeriği
     * @return Şema varyantı, DTD varyantı ve rapor
     * @throws ArticleParseException girdi işaretleme olarak ayrıştırılamazsa (tek ölümcül durum)
     */
    RepairResult repair(byte[] input) throws ArticleParseException;
}
