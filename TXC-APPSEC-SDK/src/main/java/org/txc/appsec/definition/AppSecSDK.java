package org.txc.appsec.definition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.txc.appsec.client.AppSecSession;
import org.txc.appsec.handlers.AttackGroupHandler;
import org.txc.appsec.handlers.ConfigurationCloneHandler;
import org.txc.appsec.handlers.CustomDenyHandler;
import org.txc.appsec.handlers.HostnameCoverageHandler;
import org.txc.appsec.handlers.IResourceHandler;
import org.txc.appsec.handlers.MatchTargetHandler;
import org.txc.appsec.handlers.ReputationAnalysisHandler;
import org.txc.appsec.handlers.ReputationProfileHandler;
import org.txc.appsec.handlers.VersionNotesHandler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Entry point to the Application Security API. Every resource handler shares one {@link AppSecSession};
 * instances are independent of each other and safe for concurrent use.
 */
public class AppSecSDK {
    private static final Logger logger = LoggerFactory.getLogger(AppSecSDK.class);

    private final AppSecSession session;
    private final AttackGroupHandler attackGroups;
    private final CustomDenyHandler customDeny;
    private final MatchTargetHandler matchTargets;
    private final ReputationProfileHandler reputationProfiles;
    private final ReputationAnalysisHandler reputationAnalysis;
    private final VersionNotesHandler versionNotes;
    private final ConfigurationCloneHandler configurationClones;
    private final HostnameCoverageHandler hostnameCoverage;
    private final Map<String, IResourceHandler> resourceHandlers = new LinkedHashMap<>();

    public AppSecSDK(AppSecSession session) {
        this.session = session;
        this.attackGroups = register(new AttackGroupHandler(session));
        this.customDeny = register(new CustomDenyHandler(session));
        this.matchTargets = register(new MatchTargetHandler(session));
        this.reputationProfiles = register(new ReputationProfileHandler(session));
        this.reputationAnalysis = register(new ReputationAnalysisHandler(session));
        this.versionNotes = register(new VersionNotesHandler(session));
        this.configurationClones = register(new ConfigurationCloneHandler(session));
        this.hostnameCoverage = register(new HostnameCoverageHandler(session));
        logger.info("AppSecSDK ready with resources: {}", resourceHandlers.keySet());
    }

    private <H extends IResourceHandler> H register(H handler) {
        resourceHandlers.put(handler.getResourceName(), handler);
        return handler;
    }

    public AttackGroupHandler attackGroups() { return attackGroups; }
    public CustomDenyHandler customDeny() { return customDeny; }
    public MatchTargetHandler matchTargets() { return matchTargets; }
    public ReputationProfileHandler reputationProfiles() { return reputationProfiles; }
    public ReputationAnalysisHandler reputationAnalysis() { return reputationAnalysis; }
    public VersionNotesHandler versionNotes() { return versionNotes; }
    public ConfigurationCloneHandler configurationClones() { return configurationClones; }
    public HostnameCoverageHandler hostnameCoverage() { return hostnameCoverage; }

    public AppSecSession getSession() {
        return session;
    }

    /**
     * Looks a handler up by its resource name, e.g. {@code "match-targets"}.
     */
    public IResourceHandler getHandler(String resourceName) {
        if (resourceName == null || resourceName.trim().isEmpty()) {
            throw new IllegalArgumentException("Resource name cannot be null or empty.");
        }
        IResourceHandler handler = resourceHandlers.get(resourceName.toLowerCase());
        if (handler == null) {
            throw new IllegalArgumentException("No handler registered for resource: " + resourceName);
        }
        return handler;
    }

    public Set<String> getResourceNames() {
        return Collections.unmodifiableSet(resourceHandlers.keySet());
    }
}
