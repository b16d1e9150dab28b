package com.cascade.config;

import com.cascade.dsl.ParserMode;
import com.cascade.exception.ConfigurationException;
import com.cascade.exception.RuleSyntaxException;
import com.cascade.model.ActionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLoader.
 */
class ConfigLoaderTest {

    private static CascadeConfig parse(String yaml) {
        return ConfigLoader.parseYaml(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("Should load configuration with inline rules from the classpath")
    void shouldLoadFromClasspath() {
        CascadeConfig config = ConfigLoader.load("classpath:cascade-test.yaml");

        assertEquals("test-cascade", config.name());
        assertEquals("2.1", config.version());
        assertEquals(ParserMode.LENIENT, config.parserMode());
        assertEquals(Set.of("User Story"), config.parentTypes());
        assertEquals(1, config.rules().size());
        assertEquals("Close parent", config.rules().get(0).name());
    }

    @Test
    @DisplayName("Should load the bundled rule book")
    void shouldLoadDefaultConfiguration() {
        CascadeConfig config = ConfigLoader.load("classpath:cascade.yaml");

        assertEquals(ParserMode.STRICT, config.parserMode());
        assertEquals(Set.of("User Story", "Bug"), config.parentTypes());
        assertEquals(3, config.rules().size());
    }

    @Test
    @DisplayName("Should read rules from a separate file without a cascade root")
    void shouldReadRulesFile() {
        CascadeConfig config = parse("""
                name: file-rules
                rules-file: classpath:rules-test.dsl
                """);

        assertEquals("file-rules", config.name());
        assertEquals("1.0", config.version());
        assertEquals(ParserMode.STRICT, config.parserMode());
        assertTrue(config.parentTypes().isEmpty());
        assertEquals("Tag done", config.rules().get(0).name());
        assertEquals(ActionType.ADD, config.rules().get(0).then().get(0).type());
    }

    @Test
    @DisplayName("Should require exactly one rule source")
    void shouldRequireOneRuleSource() {
        assertThrows(ConfigurationException.class, () -> parse("name: none\n"));
        assertThrows(ConfigurationException.class, () -> parse("""
                rules: |
                  rule "A":
                      when me.State is "x"
                      then set me.State = "y"
                rules-file: classpath:rules-test.dsl
                """));
    }

    @Test
    @DisplayName("Should fail on invalid rules at load time")
    void shouldWrapRuleSyntaxErrors() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> parse("""
                rules: |
                  rule "Broken":
                      when me.State is "x"
                """));

        assertInstanceOf(RuleSyntaxException.class, e.getCause());
    }

    @Test
    @DisplayName("Should reject unknown parser modes and malformed parent types")
    void shouldRejectBadSettings() {
        assertThrows(ConfigurationException.class, () -> parse("""
                parser:
                  mode: relaxed
                rules-file: classpath:rules-test.dsl
                """));
        assertThrows(ConfigurationException.class, () -> parse("""
                parent-types: User Story
                rules-file: classpath:rules-test.dsl
                """));
    }

    @Test
    @DisplayName("Should reject a parser setting that is not a map")
    void shouldRejectScalarParserSetting() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> parse("""
                parser: lenient
                rules-file: classpath:rules-test.dsl
                """));

        assertEquals("'parser' must be a map", e.getMessage());
    }

    @Test
    @DisplayName("Should fail for missing or empty files")
    void shouldFailForMissingFiles() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:does-not-exist.yaml"));
        assertThrows(ConfigurationException.class, () -> parse("rules-file: classpath:does-not-exist.dsl\n"));
        assertThrows(ConfigurationException.class, () -> parse(""));
    }
}
