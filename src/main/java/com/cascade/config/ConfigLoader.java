package com.cascade.config;

import com.cascade.dsl.ParserMode;
import com.cascade.dsl.RuleParser;
import com.cascade.exception.ConfigurationException;
import com.cascade.exception.RuleSyntaxException;
import com.cascade.model.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Loads Cascade configuration from YAML files.
 * <p>
 * Rules are given inline under {@code rules} or in a separate file named by
 * {@code rules-file}, and are parsed while loading so that a bad rule book
 * fails at startup.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String CLASSPATH_PREFIX = "classpath:";

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static CascadeConfig load(String path) {
        log.info("Loading Cascade configuration from: {}", path);

        try (InputStream inputStream = getResource(path).getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Read a rule book from a path.
     * Supports classpath: prefix for classpath resources.
     */
    public static String readRules(String path) {
        try (InputStream inputStream = getResource(path).getInputStream()) {
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read rules from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith(CLASSPATH_PREFIX)) {
            return new ClassPathResource(path.substring(CLASSPATH_PREFIX.length()));
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static CascadeConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The cascade section could be at root or under 'cascade' key
        Map<String, Object> cascadeConfig = root.containsKey("cascade")
                ? (Map<String, Object>) root.get("cascade")
                : root;

        String name = getString(cascadeConfig, "name", "default");
        String version = getString(cascadeConfig, "version", "1.0");
        ParserMode parserMode = parseParserMode(cascadeConfig.get("parser"));
        Set<String> parentTypes = parseParentTypes(cascadeConfig.get("parent-types"));

        String rulesText = getString(cascadeConfig, "rules", null);
        String rulesFile = getString(cascadeConfig, "rules-file", null);
        if (rulesText != null && rulesFile != null) {
            throw new ConfigurationException("Configure either 'rules' or 'rules-file', not both");
        }
        if (rulesFile != null) {
            rulesText = readRules(rulesFile);
        }
        if (rulesText == null) {
            throw new ConfigurationException("No rules configured. Set 'rules' or 'rules-file'.");
        }

        List<Rule> rules;
        try {
            rules = new RuleParser(parserMode).parse(rulesText);
        } catch (RuleSyntaxException e) {
            throw new ConfigurationException("Invalid rule book"
                    + (rulesFile != null ? " " + rulesFile : "") + ": " + e.getMessage(), e);
        }
        if (rules.isEmpty()) {
            log.warn("Rule book is empty, no work item will ever be updated");
        }

        CascadeConfig config = new CascadeConfig(name, version, parserMode, parentTypes, rules);

        log.info("Loaded Cascade configuration: {} v{} with {} rules, parser: {}, parent types: {}",
                name, version, rules.size(), parserMode,
                parentTypes.isEmpty() ? "any" : parentTypes);

        return config;
    }

    @SuppressWarnings("unchecked")
    private static ParserMode parseParserMode(Object value) {
        if (value == null) {
            return ParserMode.STRICT;
        }
        if (!(value instanceof Map<?, ?>)) {
            throw new ConfigurationException("'parser' must be a map");
        }
        Map<String, Object> parserMap = (Map<String, Object>) value;
        String mode = getString(parserMap, "mode", ParserMode.STRICT.name());
        try {
            return ParserMode.valueOf(mode.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown parser mode '" + mode + "'. Use STRICT or LENIENT.", e);
        }
    }

    private static Set<String> parseParentTypes(Object value) {
        if (value == null) {
            return Set.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("'parent-types' must be a list");
        }
        Set<String> types = new LinkedHashSet<>();
        for (Object type : list) {
            types.add(String.valueOf(type));
        }
        return types;
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }
}
