package org.txc.appsec.definition;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.txc.appsec.client.AppSecSession;
import org.txc.appsec.client.EdgeGridExecutor;
import org.txc.appsec.json.JsonMappers;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Builds {@link AppSecSDK} instances from the bundled {@code config.properties} and EdgeGrid credentials.
 * Every call returns a new, independent SDK.
 */
public final class AppSecSdkManager {
    private static final Logger logger = LoggerFactory.getLogger(AppSecSdkManager.class);

    static final String INTERNAL_PROPERTIES = "config.properties";

    private final SdkConfig sdkConfig;
    private final EdgeGridConfigLoader configLoader;

    public AppSecSdkManager() throws ConfigException {
        this(loadInternalProperties(), new EdgeGridConfigLoader());
    }

    public AppSecSdkManager(SdkConfig sdkConfig, EdgeGridConfigLoader configLoader) {
        this.sdkConfig = sdkConfig;
        this.configLoader = configLoader;
    }

    /**
     * Uses the edgerc path and section from {@code config.properties}.
     */
    public AppSecSDK fromDefaultEdgerc() throws ConfigException {
        return fromDefaultEdgerc(null);
    }

    /**
     * Uses the edgerc path from {@code config.properties} with the given section, or the configured
     * section when {@code section} is blank.
     */
    public AppSecSDK fromDefaultEdgerc(String section) throws ConfigException {
        String wanted = (section == null || section.isBlank()) ? sdkConfig.getEdgercSection() : section;
        return fromEdgerc(expandHome(sdkConfig.getEdgercPath()), wanted);
    }

    public AppSecSDK fromEdgerc(Path edgercPath, String section) throws ConfigException {
        return create(configLoader.fromFile(edgercPath, section));
    }

    public AppSecSDK fromEnv(String section) throws ConfigException {
        return create(configLoader.fromEnv(section));
    }

    public AppSecSDK create(EdgeGridCredentials credentials) {
        logger.info("Creating AppSecSDK for host {}", credentials.getHost());
        ObjectMapper jsonMapper = JsonMappers.newObjectMapper();
        EdgeGridExecutor executor = new EdgeGridExecutor(credentials, jsonMapper,
                sdkConfig.getConnectTimeout(), sdkConfig.getRequestTimeout());
        return new AppSecSDK(AppSecSession.create(executor, jsonMapper));
    }

    public SdkConfig getSdkConfig() {
        return sdkConfig;
    }

    static SdkConfig loadInternalProperties() throws ConfigException {
        try (InputStream input = AppSecSdkManager.class.getClassLoader().getResourceAsStream(INTERNAL_PROPERTIES)) {
            if (input == null) {
                logger.warn("'{}' not found in classpath, using built-in defaults.", INTERNAL_PROPERTIES);
                return new SdkConfig();
            }
            Properties prop = new Properties();
            prop.load(input);
            logger.info("Loaded internal SDK properties from {}.", INTERNAL_PROPERTIES);
            return SdkConfig.fromProperties(prop);
        } catch (IOException e) {
            throw new ConfigException(ConfigException.Reason.LOADING_FILE,
                    "unable to read " + INTERNAL_PROPERTIES, e);
        }
    }

    static Path expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home") + path.substring(1));
        }
        return Paths.get(path);
    }
}
