package io.mersel.services.jats.application.models;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Bir belgenin onarım hattı boyunca taşıdığı durum.
 * <p>
 * Ağacı, onarım günlüğünü ve tembel oluşturulan {@link IdRegistry}'yi tutar.
 * Ağacı değiştiren her adım değişiklikten sonra {@link #treeModified()} çağırmalıdır;
 * bir sonraki {@link #ids()} çağrısı kayıt defterini yeniden oluşturur.
 */
public final class RepairContext {

    private final Document document;
    private final RepairLog log;
    private IdRegistry idRegistry;

    public RepairContext(Document document, RepairLog log) {
        this.document = document;
        this.log = log;
    }

    public Document document() {
        return document;
    }

    public Element root() {
        return document.getDocumentElement();
    }

    public RepairLog log() {
        return log;
    }

    public IdRegistry ids() {
        if (idRegistry == null) {
            idRegistry = IdRegistry.scan(document);
        }
        return idRegistry;
    }

    public void treeModified() {
        idRegistry = null;
    }
}
