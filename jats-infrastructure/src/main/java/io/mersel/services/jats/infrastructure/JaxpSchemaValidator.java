package io.mersel.services.jats.infrastructure;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.mersel.services.jats.application.interfaces.ISchemaValidator;
import io.mersel.services.jats.application.models.SchemaValidationResult;
import io.mersel.services.jats.infrastructure.diagnostics.RepairMetrics;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXNotRecognizedException;
import org.xml.sax.SAXNotSupportedException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import javax.xml.transform.stream.StreamSource;
import javax.xml.validation.Schema;
import javax.xml.validation.SchemaFactory;
import javax.xml.validation.Validator;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * JAXP tabanlı JATS XSD doğrulayıcısı.
 * <p>
 * Derlenmiş şemalar Caffeine cache'inde dosya yolu ve değişiklik zamanı ile
 * anahtarlanır; XSD dosyası değişirse yeniden derlenir. Şemanın HTTP import'ları
 * {@link LocalSchemaResourceResolver} ile paket içinden çözülür.
 * <p>
 * Ağaç satır/sütun bilgisi taşımadığı için önce serileştirilir, hatalar
 * serileştirilmiş metnin konumlarıyla raporlanır.
 */
@Service
public class JaxpSchemaValidator implements ISchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(JaxpSchemaValidator.class);

    private final RepairMetrics metrics;

    private Cache<String, Schema> schemaCache;

    @Value("${jats.cache.schema-max-size:8}")
    private int schemaCacheMaxSize = 8;

    public JaxpSchemaValidator(RepairMetrics metrics) {
        this.metrics = metrics;
    }

    @PostConstruct
    void init() {
        schemaCache = Caffeine.newBuilder()
                .maximumSize(schemaCacheMaxSize)
                .build();
        metrics.registerSchemaCacheSizeGauge(schemaCache);
    }

    @Override
    public void invalidateCache() {
        schemaCache.invalidateAll();
        log.info("Derlenmiş XSD cache'i temizlendi");
    }

    @Override
    public SchemaValidationResult validate(Document tree, Path schemaPath) {
        long startTime = System.currentTimeMillis();

        if (schemaPath == null || !Files.isRegularFile(schemaPath)) {
            String reason = "XSD dosyası bulunamadı, şema doğrulaması atlandı: " + schemaPath;
            log.warn(reason);
            metrics.recordSchemaValidation("skipped", System.currentTimeMillis() - startTime);
            return SchemaValidationResult.skipped(reason);
        }

        Schema schema;
        try {
            schema = getOrCompile(schemaPath);
        } catch (SAXException | IOException e) {
            String reason = "XSD derlenemedi, şema doğrulaması atlandı: " + e.getMessage();
            log.warn(reason);
            metrics.recordSchemaValidation("skipped", System.currentTimeMillis() - startTime);
            return SchemaValidationResult.skipped(reason);
        }

        List<String> errors = new ArrayList<>();
        try {
            Validator validator = schema.newValidator();
            // XXE koruma
            try {
                validator.setProperty(XMLConstants.ACCESS_EXTERNAL_DTD, "");
                validator.setProperty(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            } catch (SAXNotRecognizedException | SAXNotSupportedException e) {
                log.warn("XXE koruma özellikleri validator implementasyonu tarafından desteklenmiyor");
            }
            validator.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException e) {
                    log.debug("XSD uyarısı: {}", e.getMessage());
                }

                @Override
                public void error(SAXParseException e) {
                    errors.add(formatError(e));
                }

                @Override
                public void fatalError(SAXParseException e) {
                    errors.add(formatError(e));
                }
            });
            validator.validate(new StreamSource(new ByteArrayInputStream(serializeDocument(tree))));
        } catch (SAXException | IOException e) {
            errors.add("Şema doğrulama hatası: " + e.getMessage());
            log.warn("XSD doğrulama başarısız: {}", e.getMessage());
        }

        SchemaValidationResult result = errors.isEmpty()
                ? SchemaValidationResult.valid()
                : SchemaValidationResult.invalid(errors);
        metrics.recordSchemaValidation(errors.isEmpty() ? "valid" : "invalid", System.currentTimeMillis() - startTime);
        return result;
    }

    // ── Derleme ─────────────────────────────────────────────────────

    private Schema getOrCompile(Path schemaPath) throws SAXException, IOException {
        Path absolute = schemaPath.toAbsolutePath().normalize();
        String key = absolute + "@" + Files.getLastModifiedTime(absolute).toMillis();
        Schema cached = schemaCache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        Schema compiled = compileSchema(absolute);
        schemaCache.put(key, compiled);
        log.info("JATS XSD derlendi: {}", absolute);
        return compiled;
    }

    private Schema compileSchema(Path mainFile) throws SAXException {
        SchemaFactory factory = SchemaFactory.newInstance(XMLConstants.W3C_XML_SCHEMA_NS_URI);
        try {
            factory.setProperty(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setProperty(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "file");
        } catch (SAXNotRecognizedException | SAXNotSupportedException e) {
            log.warn("SchemaFactory XXE koruma özellikleri desteklenmiyor");
        }
        factory.setResourceResolver(new LocalSchemaResourceResolver(mainFile.getParent()));
        // StreamSource(File) systemId taşır, göreceli xs:include/xs:import çözümlenebilir
        return factory.newSchema(new StreamSource(mainFile.toFile()));
    }

    private static byte[] serializeDocument(Document doc) {
        try {
            TransformerFactory tf = TransformerFactory.newInstance();
            tf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            tf.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            tf.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
            Transformer transformer = tf.newTransformer();
            transformer.setOutputProperty(OutputKeys.INDENT, "no");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            transformer.transform(new DOMSource(doc), new StreamResult(out));
            return out.toByteArray();
        } catch (TransformerException e) {
            throw new IllegalStateException("Belge doğrulama için serileştirilemedi", e);
        }
    }

    private static String formatError(SAXParseException e) {
        return XsdErrorHumanizer.humanize(e.getLineNumber(), e.getColumnNumber(), e.getMessage());
    }
}
