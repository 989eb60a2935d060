package org.txc.appsec.handlers;

import org.txc.appsec.client.AppSecPaths;
import org.txc.appsec.client.AppSecSession;
import org.txc.appsec.client.RequestBody;
import org.txc.appsec.client.RequestContext;
import org.txc.appsec.definition.configurationclone.ConfigurationVersion;
import org.txc.appsec.definition.configurationclone.CreateConfigurationCloneRequest;
import org.txc.appsec.definition.configurationclone.CreateConfigurationCloneResponse;
import org.txc.appsec.definition.configurationclone.GetConfigurationCloneRequest;
import org.txc.appsec.errors.AppSecException;

import java.util.List;

/**
 * Reads configuration versions and creates new configurations cloned from an existing version.
 */
public class ConfigurationCloneHandler extends AbstractResourceHandler {

    static final ResourceOperation<GetConfigurationCloneRequest, ConfigurationVersion> GET_CONFIGURATION_CLONE =
            ResourceOperation.builder("GetConfigurationClone", GetConfigurationCloneRequest.class,
                            ConfigurationVersion.class, ConfigurationVersion::new)
                    .get(r -> AppSecPaths.version(r.getConfigId(), r.getVersion()).build())
                    .build();

    static final ResourceOperation<CreateConfigurationCloneRequest, CreateConfigurationCloneResponse> CREATE_CONFIGURATION_CLONE =
            ResourceOperation.builder("CreateConfigurationClone", CreateConfigurationCloneRequest.class,
                            CreateConfigurationCloneResponse.class, CreateConfigurationCloneResponse::new)
                    .post(r -> AppSecPaths.configs().build(), RequestBody::json)
                    .build();

    public ConfigurationCloneHandler(AppSecSession session) {
        super(session);
    }

    public ConfigurationVersion getConfigurationClone(RequestContext context, GetConfigurationCloneRequest request)
            throws AppSecException {
        return execute(context, GET_CONFIGURATION_CLONE, request);
    }

    public CreateConfigurationCloneResponse createConfigurationClone(RequestContext context,
                                                                     CreateConfigurationCloneRequest request)
            throws AppSecException {
        return execute(context, CREATE_CONFIGURATION_CLONE, request);
    }

    @Override
    public String getResourceName() {
        return "configuration-clone";
    }

    @Override
    public List<String> getOperationNames() {
        return List.of(GET_CONFIGURATION_CLONE.getName(), CREATE_CONFIGURATION_CLONE.getName());
    }
}
