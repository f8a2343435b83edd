package com.connection.harness.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Loads {@link HarnessConfig} from YAML.
 *
 * <p>Expected layout:</p>
 * <pre>
 * services:
 *   remote_command:
 *     enable: true
 *     connections:
 *       - name: build-host
 *         enable: true
 *         host: ${BUILD_HOST:localhost}
 *         port: 22
 * </pre>
 *
 * <p>The {@code services} wrapper is optional; without it every top-level key is a service type.
 * {@code enable} defaults to true at both levels. Every connection key other than {@code name}
 * and {@code enable} becomes a connection property. {@code ${VAR}} and {@code ${VAR:default}}
 * placeholders in string values are resolved from the environment.</p>
 */
public class HarnessConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(HarnessConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final Pattern ENV_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::([^}]*))?\\}");

    static final String SERVICES = "services";
    static final String CONNECTIONS = "connections";
    static final String NAME = "name";
    static final String ENABLE = "enable";
    static final String DEFAULT_CONNECTION_NAME = "default";

    private final UnaryOperator<String> environment;

    public HarnessConfigLoader() {
        this(System::getenv);
    }

    /**
     * @param environment resolves placeholder names; returns null for unset variables
     */
    public HarnessConfigLoader(UnaryOperator<String> environment) {
        this.environment = environment;
    }

    public HarnessConfig loadString(String yaml) {
        return load(new StringReader(yaml), "<string>");
    }

    public HarnessConfig loadFile(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return load(reader, file.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + file, e);
        }
    }

    /**
     * Loads every {@code *.yaml} and {@code *.yml} file of a directory in file-name order and merges them.
     * A missing directory yields an empty configuration.
     */
    public HarnessConfig loadDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            log.warn("Config directory not found: {}", directory);
            return HarnessConfig.empty();
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(directory)) {
            files = stream
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.endsWith(".yaml") || name.endsWith(".yml");
                    })
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new ConfigurationException("Cannot list configuration directory " + directory, e);
        }

        HarnessConfig config = HarnessConfig.empty();
        for (Path file : files) {
            config = config.merge(loadFile(file));
        }
        log.info("Loaded {} configuration file(s) from {}: services={}",
                files.size(), directory, config.serviceTypes());
        return config;
    }

    public HarnessConfig loadResource(String resource) {
        InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new ConfigurationException("Configuration resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return load(reader, resource);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration resource " + resource, e);
        }
    }

    /**
     * Loads from a path that is either a directory, a file, or failing both a classpath resource.
     */
    public HarnessConfig load(String location) {
        Path path = Path.of(location);
        if (Files.isDirectory(path)) {
            return loadDirectory(path);
        }
        if (Files.isRegularFile(path)) {
            return loadFile(path);
        }
        return loadResource(location);
    }

    public HarnessConfig load(Reader reader, String sourceName) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(reader);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed YAML in " + sourceName + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + sourceName, e);
        }

        if (root == null || root.isMissingNode() || root.isNull()) {
            log.warn("Configuration {} is empty", sourceName);
            return HarnessConfig.empty();
        }

        JsonNode servicesNode = root.has(SERVICES) ? root.get(SERVICES) : root;
        if (!servicesNode.isObject()) {
            throw new ConfigurationException("Expected a mapping of services in " + sourceName);
        }

        Map<String, ServiceSettings> services = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = servicesNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            services.put(field.getKey(), parseService(field.getKey(), field.getValue(), sourceName));
        }

        log.debug("Loaded configuration {}: services={}", sourceName, services.keySet());
        return new HarnessConfig(services);
    }

    private ServiceSettings parseService(String serviceType, JsonNode node, String sourceName) {
        if (node == null || node.isNull()) {
            return new ServiceSettings(serviceType, true, List.of());
        }
        if (!node.isObject()) {
            throw new ConfigurationException(
                    "Service '" + serviceType + "' in " + sourceName + " must be a mapping");
        }

        boolean enabled = readBoolean(node.get(ENABLE), true);
        List<ConnectionSettings> connections = new ArrayList<>();
        JsonNode connectionsNode = node.get(CONNECTIONS);
        if (connectionsNode != null && !connectionsNode.isNull()) {
            if (!connectionsNode.isArray()) {
                throw new ConfigurationException(
                        "'connections' of service '" + serviceType + "' in " + sourceName + " must be a list");
            }
            for (JsonNode connectionNode : connectionsNode) {
                connections.add(parseConnection(serviceType, connectionNode, sourceName));
            }
        }

        if (!enabled) {
            log.info("Service {} is disabled in configuration", serviceType);
        }
        return new ServiceSettings(serviceType, enabled, connections);
    }

    private ConnectionSettings parseConnection(String serviceType, JsonNode node, String sourceName) {
        if (!node.isObject()) {
            throw new ConfigurationException(
                    "Connection entries of service '" + serviceType + "' in " + sourceName + " must be mappings");
        }

        String name = node.hasNonNull(NAME) ? substitute(node.get(NAME).asText()) : DEFAULT_CONNECTION_NAME;
        boolean enabled = readBoolean(node.get(ENABLE), true);

        Map<String, Object> properties = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (NAME.equals(field.getKey()) || ENABLE.equals(field.getKey())) {
                continue;
            }
            properties.put(field.getKey(), toValue(field.getValue()));
        }
        return new ConnectionSettings(name, enabled, properties);
    }

    private boolean readBoolean(JsonNode node, boolean defaultValue) {
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return Boolean.parseBoolean(substitute(node.asText()).trim());
    }

    private Object toValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return substitute(node.textValue());
        }
        if (node.isObject()) {
            Map<String, Object> map = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                map.put(field.getKey(), toValue(field.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            List<Object> list = new ArrayList<>();
            for (JsonNode element : node) {
                list.add(toValue(element));
            }
            return list;
        }
        return YAML_MAPPER.convertValue(node, Object.class);
    }

    String substitute(String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }
        Matcher m = ENV_PATTERN.matcher(value);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String variable = m.group(1).trim();
            String fallback = m.group(2);
            String resolved = environment.apply(variable);
            if (resolved == null) {
                if (fallback == null) {
                    throw new ConfigurationException("Environment variable '" + variable + "' is not set");
                }
                resolved = fallback;
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(resolved));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
