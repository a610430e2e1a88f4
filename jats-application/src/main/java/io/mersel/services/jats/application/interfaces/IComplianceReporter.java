package io.mersel.services.jats.application.interfaces;

import io.mersel.services.jats.application.models.ComplianceReport;
import io.mersel.services.jats.application.models.RepairLog;
import org.w3c.dom.Document;

/**
 * Şema doğrulaması ve yerel yapısal kontrollerle uyumluluk raporu üretir.
 * Salt okunurdur, ağaca asla yazmaz.
 */
public interface IComplianceReporter {

    ComplianceReport report(Document tree, RepairLog log);
}
