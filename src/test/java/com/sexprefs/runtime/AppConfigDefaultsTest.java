package com.sexprefs.runtime;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppConfigDefaultsTest {

    @Test
    void shouldDefaultToSequentialAbortingSearch() {
        AppConfig config = new AppConfig();

        assertEquals(10, config.getSearch().getProgressInterval());
        assertEquals(1, config.getSearch().getParallelism());
        assertFalse(config.getSearch().isSkipMalformedFiles());
        assertEquals(List.of(".el", ".el.gz"), config.getSearch().getExtensions());
        assertTrue(config.getSearch().getExcludedDirectories().contains(".git"));
    }

    @Test
    void shouldMatchTheBundledApplicationConfig() throws Exception {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

        AppConfig bundled = mapper.readValue(Path.of("src/main/resources/application.yml").toFile(), AppConfig.class);

        bundled.getSearch().validate();
        assertEquals(new AppConfig().getSearch().getExtensions(), bundled.getSearch().getExtensions());
        assertEquals(new AppConfig().getSearch().getExcludedDirectories(), bundled.getSearch().getExcludedDirectories());
    }

    @Test
    void shouldFallBackToDefaultsForMissingSections() throws Exception {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

        AppConfig config = mapper.readValue("search:\n  parallelism: 4\nunrelated: true\n", AppConfig.class);
        AppConfig empty = mapper.readValue("search: null\n", AppConfig.class);

        assertEquals(4, config.getSearch().getParallelism());
        assertEquals(10, config.getSearch().getProgressInterval());
        assertEquals(1, empty.getSearch().getParallelism());
    }

    @Test
    void shouldRejectNonPositiveSettings() {
        AppConfig.SearchConfig interval = new AppConfig.SearchConfig();
        interval.setProgressInterval(0);
        AppConfig.SearchConfig extensions = new AppConfig.SearchConfig();
        extensions.setExtensions(List.of());

        assertThrows(IllegalArgumentException.class, interval::validate);
        assertThrows(IllegalArgumentException.class, extensions::validate);
    }
}
