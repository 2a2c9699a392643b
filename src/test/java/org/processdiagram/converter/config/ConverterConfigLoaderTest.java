package org.processdiagram.converter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.ValidationMessage;
import org.processdiagram.converter.layout.Direction;
import org.processdiagram.converter.layout.LayoutMode;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConverterConfigLoaderTest {
    private static final Path TOP_TO_BOTTOM_JSON = Path.of("src/test/resources/config/top_to_bottom.json");
    private static final Path INVALID_VALUES_JSON = Path.of("src/test/resources/config/invalid_values.json");
    private static final Path UNKNOWN_PROPERTY_JSON = Path.of("src/test/resources/config/unknown_property.json");
    private static final Path BROKEN_JSON = Path.of("src/test/resources/config/broken.json");

    @Test
    void shouldLoadBundledDefaults() {
        ConverterConfig config = ConverterConfigLoader.loadFromClasspath("converter.json");
        ConverterConfig defaults = ConverterConfig.defaults();

        assertEquals(defaults.layoutMode, config.layoutMode);
        assertEquals(defaults.direction, config.direction);
        assertEquals(defaults.theme, config.theme);
        assertEquals(defaults.layout.rankGap, config.layout.rankGap);
        assertEquals(defaults.layout.maxRankingWork, config.layout.maxRankingWork);
        assertEquals(defaults.routing.maxAttempts, config.routing.maxAttempts);
    }

    @Test
    void shouldLoadFileAndKeepDefaultsForMissingFields() {
        ConverterConfig config = ConverterConfigLoader.load(TOP_TO_BOTTOM_JSON);

        assertEquals(LayoutMode.COMPUTE, config.layoutMode);
        assertEquals(Direction.TB, config.direction);
        assertEquals("print", config.theme);
        assertEquals(80, config.layout.rankGap);
        assertEquals(30, config.layout.nodeGap);
        assertEquals(20, config.layout.containerMargin);
        assertEquals(20, config.routing.maxAttempts);
        assertEquals(20, config.routing.selfLoopOffset);
    }

    @Test
    void shouldTreatEmptyObjectAsDefaults() {
        ConverterConfig config = ConverterConfigLoader.fromJson("{}");

        assertEquals(LayoutMode.COMPUTE, config.layoutMode);
        assertEquals(Direction.LR, config.direction);
        assertFalse(config.schemaValidation);
    }

    @Test
    void shouldBindPreserveMode() {
        ConverterConfig config = ConverterConfigLoader.fromJson("{\"layoutMode\": \"preserve\", \"schemaValidation\": true}");

        assertEquals(LayoutMode.PRESERVE, config.layoutMode);
        assertTrue(config.schemaValidation);
    }

    @Test
    void shouldRejectValuesOutsideSchema() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConverterConfigLoader.load(INVALID_VALUES_JSON));

        assertEquals(2, e.getProblems().size());
    }

    @Test
    void shouldRejectUnknownProperties() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConverterConfigLoader.load(UNKNOWN_PROPERTY_JSON));

        assertFalse(e.getProblems().isEmpty());
    }

    @Test
    void shouldRejectBrokenJson() {
        assertThrows(ConfigurationException.class, () -> ConverterConfigLoader.load(BROKEN_JSON));
    }

    @Test
    void shouldRejectMissingFileAndResource() {
        assertThrows(ConfigurationException.class,
                () -> ConverterConfigLoader.load(Path.of("src/test/resources/config/missing.json")));
        assertThrows(ConfigurationException.class,
                () -> ConverterConfigLoader.loadFromClasspath("config/missing.json"));
    }

    @Test
    void shouldReportSchemaViolations() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        Set<ValidationMessage> valid = ConverterConfigLoader.validate(mapper.readTree("{\"direction\": \"BT\"}"));
        Set<ValidationMessage> invalid = ConverterConfigLoader.validate(
                mapper.readTree("{\"routing\": {\"maxAttempts\": 0}}"));

        assertTrue(valid.isEmpty());
        assertEquals(1, invalid.size());
    }

    @Test
    void shouldApplyEnvironmentOverrides() {
        ConverterConfig config = ConverterConfigLoader.fromEnvironment(Map.of(
                ConverterConfigLoader.ENV_LAYOUT, "Preserve",
                ConverterConfigLoader.ENV_DIRECTION, "bt",
                ConverterConfigLoader.ENV_THEME, " dark "));

        assertEquals(LayoutMode.PRESERVE, config.layoutMode);
        assertEquals(Direction.BT, config.direction);
        assertEquals("dark", config.theme);
    }

    @Test
    void shouldIgnoreBlankEnvironmentValues() {
        ConverterConfig config = ConverterConfigLoader.applyEnvironment(
                ConverterConfigLoader.load(TOP_TO_BOTTOM_JSON), Map.of(ConverterConfigLoader.ENV_DIRECTION, " "));

        assertEquals(Direction.TB, config.direction);
        assertEquals("print", config.theme);
    }

    @Test
    void shouldRejectInvalidEnvironmentValue() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConverterConfigLoader.fromEnvironment(Map.of(ConverterConfigLoader.ENV_DIRECTION, "diagonal")));

        assertTrue(e.getMessage().contains("diagonal"));
    }
}
