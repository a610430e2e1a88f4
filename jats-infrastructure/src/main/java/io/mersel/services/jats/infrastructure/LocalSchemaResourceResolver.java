package io.mersel.services.jats.infrastructure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.ls.LSInput;
import org.w3c.dom.ls.LSResourceResolver;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * JATS XSD paketindeki HTTP import'larını lokal dosyalara yönlendirir.
 * <p>
 * JATS yayın şeması standart modülleri mutlak adreslerle içeri alabilir:
 * <ul>
 *   <li>XLink: {@code http://www.w3.org/XML/2008/06/xlink.xsd} → {@code standard-modules/xlink.xsd}</li>
 *   <li>XML: {@code http://www.w3.org/2001/xml.xsd} → {@code standard-modules/xml.xsd}</li>
 *   <li>MathML 3: {@code http://www.w3.org/Math/XMLSchema/mathml3/mathml3.xsd}
 *       → {@code standard-modules/mathml3/mathml3.xsd}</li>
 * </ul>
 * URL'deki dosya adı şema dizininde (3 seviyeye kadar) aranır, bulunursa ağ erişimi olmadan
 * kullanılır. Göreceli import'lar SchemaFactory'nin kendisine bırakılır. Bulunamazsa
 * {@code null} döner ve {@code ACCESS_EXTERNAL_SCHEMA=file} kısıtı ağ isteğini engeller.
 */
class LocalSchemaResourceResolver implements LSResourceResolver {

    private static final Logger log = LoggerFactory.getLogger(LocalSchemaResourceResolver.class);

    private final Path schemaBaseDir;

    LocalSchemaResourceResolver(Path schemaBaseDir) {
        this.schemaBaseDir = schemaBaseDir;
    }

    @Override
    public LSInput resolveResource(String type, String namespaceURI,
                                   String publicId, String systemId, String baseURI) {
        if (systemId == null || !(systemId.startsWith("http://") || systemId.startsWith("https://"))) {
            return null;
        }
        String fileName = systemId.substring(systemId.lastIndexOf('/') + 1);
        if (fileName.isBlank()) {
            return null;
        }

        Path localFile = findFile(schemaBaseDir, fileName);
        if (localFile == null) {
            log.debug("HTTP şema referansı lokal olarak bulunamadı: {}", systemId);
            return null;
        }
        log.debug("HTTP şema referansı lokal dosyaya yönlendirildi: {} → {}", systemId, localFile);
        return new PathLSInput(localFile, publicId, baseURI);
    }

    static Path findFile(Path dir, String fileName) {
        Path direct = dir.resolve(fileName);
        if (Files.isRegularFile(direct)) {
            return direct;
        }
        try (Stream<Path> stream = Files.walk(dir, 3)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().equals(fileName))
                    .findFirst()
                    .orElse(null);
        } catch (IOException e) {
            log.warn("Lokal şema araması başarısız: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Lokal dosyayı SchemaFactory'ye sunar. systemId dosyanın kendi URI'sidir,
     * böylece dosyanın göreceli include'ları kendi dizininden çözülür.
     */
    private static final class PathLSInput implements LSInput {
        private final Path path;
        private final String publicId;
        private final String baseURI;

        private PathLSInput(Path path, String publicId, String baseURI) {
            this.path = path;
            this.publicId = publicId;
            this.baseURI = baseURI;
        }

        @Override
        public InputStream getByteStream() {
            try {
                return Files.newInputStream(path);
            } catch (IOException e) {
                throw new IllegalStateException("Lokal XSD dosyası okunamadı: " + path, e);
            }
        }

        @Override
        public String getSystemId() {
            return path.toUri().toString();
        }

        @Override
        public String getPublicId() {
            return publicId;
        }

        @Override
        public String getBaseURI() {
            return baseURI;
        }

        @Override
        public String getEncoding() {
            return "UTF-8";
        }

        @Override
        public Reader getCharacterStream() {
            return null;
        }

        @Override
        public String getStringData() {
            return null;
        }

        @Override
        public boolean getCertifiedText() {
            return false;
        }

        @Override
        public void setCharacterStream(Reader characterStream) {
        }

        @Override
        public void setByteStream(InputStream byteStream) {
        }

        @Override
        public void setStringData(String stringData) {
        }

        @Override
        public void setSystemId(String systemId) {
        }

        @Override
        public void setPublicId(String publicId) {
        }

        @Override
        public void setBaseURI(String baseURI) {
        }

        @Override
        public void setEncoding(String encoding) {
        }

        @Override
        public void setCertifiedText(boolean certifiedText) {
        }
    }
}
