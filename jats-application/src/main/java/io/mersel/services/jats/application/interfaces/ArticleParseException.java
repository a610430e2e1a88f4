package io.mersel.services.jats.application.interfaces;

/**
 * Girdi metni toleranslı ayrıştırma ile bile işaretleme olarak okunamadığında fırlatılır.
 * <p>
 * Onarım hattındaki tek ölümcül hatadır: bu istisna fırlatıldığında belge için
 * hiçbir kısmi çıktı üretilmez.
 */
public class ArticleParseException extends Exception {

    public ArticleParseException(String message) {
        super(message);
    }

    public ArticleParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
