package io.mersel.services.jats.infrastructure.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * {@code jats-repair-defaults.yml} dosyasının {@link RepairProperties} varsayılanlarıyla
 * birebir aynı kaldığını doğrular.
 */
@DisplayName("jats-repair-defaults.yml")
class RepairDefaultsYamlTest {

    private Binder binder;

    @BeforeEach
    void setUp() throws IOException {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                .load("jats-repair-defaults", new ClassPathResource("jats-repair-defaults.yml"));
        binder = new Binder(ConfigurationPropertySources.from(sources));
    }

    @Test
    @DisplayName("Dosyadaki değerler koddaki varsayılanlarla aynı")
    void varsayilanlar() {
        RepairProperties fromYaml = binder.bind("jats.repair", RepairProperties.class).get();
        RepairProperties defaults = new RepairProperties();

        assertThat(fromYaml.getDtdVersion()).isEqualTo(defaults.getDtdVersion());
        assertThat(fromYaml.getSchemaPath()).isEqualTo(defaults.getSchemaPath());
        assertThat(fromYaml.getSchemaLocation()).isEqualTo(defaults.getSchemaLocation());
        assertThat(fromYaml.getSanitizer()).usingRecursiveComparison().isEqualTo(defaults.getSanitizer());
        assertThat(fromYaml.getTables()).usingRecursiveComparison().isEqualTo(defaults.getTables());
        assertThat(fromYaml.getMetadata()).usingRecursiveComparison().isEqualTo(defaults.getMetadata());
        assertThat(fromYaml.getCitation()).usingRecursiveComparison().isEqualTo(defaults.getCitation());
        assertThat(fromYaml.getPruner()).usingRecursiveComparison().isEqualTo(defaults.getPruner());
        assertThat(fromYaml.getSuggestions()).usingRecursiveComparison().isEqualTo(defaults.getSuggestions());
    }

    @Test
    @DisplayName("Şema cache boyutu validator varsayılanıyla aynı")
    void cache_boyutu() {
        assertThat(binder.bind("jats.cache.schema-max-size", Integer.class).get()).isEqualTo(8);
    }
}
