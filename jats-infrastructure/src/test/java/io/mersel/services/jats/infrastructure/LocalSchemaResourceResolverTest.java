package io.mersel.services.jats.infrastructure;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.ls.LSInput;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LocalSchemaResourceResolver")
class LocalSchemaResourceResolverTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Dosya doğrudan veya alt dizinde bulunur")
    void dosya_bulma() throws IOException {
        Files.writeString(tempDir.resolve("a.xsd"), "<x/>");
        Files.createDirectories(tempDir.resolve("mathml3/common"));
        Files.writeString(tempDir.resolve("mathml3/common/b.xsd"), "<x/>");

        assertThat(LocalSchemaResourceResolver.findFile(tempDir, "a.xsd")).isEqualTo(tempDir.resolve("a.xsd"));
        assertThat(LocalSchemaResourceResolver.findFile(tempDir, "b.xsd"))
                .isEqualTo(tempDir.resolve("mathml3/common/b.xsd"));
        assertThat(LocalSchemaResourceResolver.findFile(tempDir, "c.xsd")).isNull();
    }

    @Test
    @DisplayName("HTTP systemId lokal dosyaya yönlendirilir, diğerleri çözülmez")
    void http_yonlendirme() throws IOException {
        Files.writeString(tempDir.resolve("xlink.xsd"), "<x/>");
        LocalSchemaResourceResolver resolver = new LocalSchemaResourceResolver(tempDir);

        LSInput input = resolver.resolveResource(null, null, null, "http://www.w3.org/1999/xlink.xsd", null);

        assertThat(input).isNotNull();
        assertThat(input.getSystemId()).isEqualTo(tempDir.resolve("xlink.xsd").toUri().toString());
        assertThat(resolver.resolveResource(null, null, null, "xlink.xsd", null)).isNull();
        assertThat(resolver.resolveResource(null, null, null, "https://example.org/yok.xsd", null)).isNull();
        assertThat(resolver.resolveResource(null, null, null, null, null)).isNull();
    }

    @Test
    @DisplayName("JATS standart modüllerinin HTTP adresleri paket düzenindeki dosyalara çözülür")
    void jats_standart_modulleri() throws IOException {
        Path modules = Files.createDirectories(tempDir.resolve("standard-modules/mathml3"));
        Files.writeString(tempDir.resolve("standard-modules/xlink.xsd"), "<x/>");
        Files.writeString(tempDir.resolve("standard-modules/xml.xsd"), "<x/>");
        Files.writeString(modules.resolve("mathml3.xsd"), "<x/>");
        LocalSchemaResourceResolver resolver = new LocalSchemaResourceResolver(tempDir);

        assertThat(resolver.resolveResource(null, null, null,
                "http://www.w3.org/XML/2008/06/xlink.xsd", null).getSystemId())
                .isEqualTo(tempDir.resolve("standard-modules/xlink.xsd").toUri().toString());
        assertThat(resolver.resolveResource(null, null, null,
                "http://www.w3.org/2001/xml.xsd", null).getSystemId())
                .isEqualTo(tempDir.resolve("standard-modules/xml.xsd").toUri().toString());
        assertThat(resolver.resolveResource(null, null, null,
                "http://www.w3.org/Math/XMLSchema/mathml3/mathml3.xsd", null).getSystemId())
                .isEqualTo(modules.resolve("mathml3.xsd").toUri().toString());
    }
}
