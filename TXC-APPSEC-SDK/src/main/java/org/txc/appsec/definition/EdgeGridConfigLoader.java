package org.txc.appsec.definition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Reads {@link EdgeGridCredentials} from an {@code .edgerc} file or from AKAMAI_* environment variables.
 *
 * <pre>
 * [default]
 * host = akab-xxxx.luna.akamaiapis.net
 * client_token = akab-...
 * client_secret = ...
 * access_token = akab-...
 * max_body = 131072
 * </pre>
 */
public class EdgeGridConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(EdgeGridConfigLoader.class);

    public static final String DEFAULT_SECTION = "default";

    private final Function<String, String> environment;

    public EdgeGridConfigLoader() {
        this(System::getenv);
    }

    public EdgeGridConfigLoader(Function<String, String> environment) {
        this.environment = environment;
    }

    public EdgeGridCredentials fromFile(Path edgercPath, String section) throws ConfigException {
        String wanted = (section == null || section.isBlank()) ? DEFAULT_SECTION : section;
        logger.info("Loading EdgeGrid credentials from '{}' section [{}]", edgercPath, wanted);

        Map<String, Map<String, String>> sections;
        try (BufferedReader reader = Files.newBufferedReader(edgercPath, StandardCharsets.UTF_8)) {
            sections = parseIni(reader);
        } catch (IOException e) {
            throw new ConfigException(ConfigException.Reason.LOADING_FILE,
                    "unable to load config from environment or .edgerc file: " + edgercPath, e);
        }

        Map<String, String> values = sections.get(wanted);
        if (values == null) {
            throw new ConfigException(ConfigException.Reason.SECTION_DOES_NOT_EXIST,
                    "provided config section does not exist: " + wanted);
        }

        List<String> missing = new ArrayList<>();
        String host = require(values, "host", missing);
        String clientToken = require(values, "client_token", missing);
        String clientSecret = require(values, "client_secret", missing);
        String accessToken = require(values, "access_token", missing);
        if (!missing.isEmpty()) {
            throw new ConfigException(ConfigException.Reason.REQUIRED_OPTION_EDGERC,
                    "required option is missing from edgerc: " + String.join(", ", missing));
        }
        int maxBody = parseMaxBody(values.get("max_body"));
        return build(host, clientToken, clientSecret, accessToken, maxBody);
    }

    /**
     * Section {@code default} reads AKAMAI_HOST etc., any other section AKAMAI_&lt;SECTION&gt;_HOST etc.
     */
    public EdgeGridCredentials fromEnv(String section) throws ConfigException {
        String prefix = "AKAMAI_";
        if (section != null && !section.isBlank() && !DEFAULT_SECTION.equalsIgnoreCase(section)) {
            prefix += section.toUpperCase(Locale.ROOT).replace('-', '_') + "_";
        }

        List<String> missing = new ArrayList<>();
        String host = requireEnv(prefix + "HOST", missing);
        String clientToken = requireEnv(prefix + "CLIENT_TOKEN", missing);
        String clientSecret = requireEnv(prefix + "CLIENT_SECRET", missing);
        String accessToken = requireEnv(prefix + "ACCESS_TOKEN", missing);
        if (!missing.isEmpty()) {
            throw new ConfigException(ConfigException.Reason.REQUIRED_OPTION_ENV,
                    "required environment variable is missing: " + String.join(", ", missing));
        }
        int maxBody = parseMaxBody(environment.apply(prefix + "MAX_BODY"));
        logger.info("Loaded EdgeGrid credentials from environment ({}*)", prefix);
        return build(host, clientToken, clientSecret, accessToken, maxBody);
    }

    private EdgeGridCredentials build(String host, String clientToken, String clientSecret,
                                      String accessToken, int maxBody) throws ConfigException {
        if (host.endsWith("/")) {
            throw new ConfigException(ConfigException.Reason.HOST_CONTAINS_SLASH_AT_THE_END,
                    "host must not contain '/' at the end: " + host);
        }
        return new EdgeGridCredentials(host, clientToken, clientSecret, accessToken, maxBody);
    }

    private String requireEnv(String name, List<String> missing) {
        String value = environment.apply(name);
        if (value == null || value.isBlank()) {
            missing.add(name);
            return null;
        }
        return value.trim();
    }

    private static String require(Map<String, String> values, String key, List<String> missing) {
        String value = values.get(key);
        if (value == null || value.isBlank()) {
            missing.add(key);
            return null;
        }
        return value;
    }

    private static int parseMaxBody(String raw) throws ConfigException {
        if (raw == null || raw.isBlank()) {
            return EdgeGridCredentials.DEFAULT_MAX_BODY;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException(ConfigException.Reason.INVALID_VALUE, "max_body is not a number: " + raw, e);
        }
    }

    static Map<String, Map<String, String>> parseIni(BufferedReader reader) throws IOException {
        Map<String, Map<String, String>> sections = new HashMap<>();
        Map<String, String> current = null;
        String line;
        while ((line = reader.readLine()) != null) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith(";")) {
                continue;
            }
            if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
                current = sections.computeIfAbsent(trimmed.substring(1, trimmed.length() - 1).trim(), k -> new HashMap<>());
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq < 0 || current == null) {
                continue;
            }
            String key = trimmed.substring(0, eq).trim();
            String value = unquote(trimmed.substring(eq + 1).trim());
            current.put(key, value);
        }
        return sections;
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && (value.startsWith("\"") && value.endsWith("\"")
                || value.startsWith("'") && value.endsWith("'"))) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
