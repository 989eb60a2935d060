package org.txc.appsec.handlers;

import org.txc.appsec.client.AppSecPaths;
import org.txc.appsec.client.AppSecSession;
import org.txc.appsec.client.RequestContext;
import org.txc.appsec.definition.hostnamecoverage.GetApiHostnameCoverageOverlappingRequest;
import org.txc.appsec.definition.hostnamecoverage.GetApiHostnameCoverageOverlappingResponse;
import org.txc.appsec.errors.AppSecException;

import java.util.List;

public class HostnameCoverageHandler extends AbstractResourceHandler {

    static final ResourceOperation<GetApiHostnameCoverageOverlappingRequest, GetApiHostnameCoverageOverlappingResponse>
            GET_OVERLAPPING = ResourceOperation.builder("GetApiHostnameCoverageOverlapping",
                            GetApiHostnameCoverageOverlappingRequest.class,
                            GetApiHostnameCoverageOverlappingResponse.class, GetApiHostnameCoverageOverlappingResponse::new)
                    .get(r -> AppSecPaths.version(r.getConfigId(), r.getVersion())
                            .segment("hostname-coverage").segment("overlapping")
                            .queryIfPresent("hostname", r.getHostname())
                            .build())
                    .build();

    public HostnameCoverageHandler(AppSecSession session) {
        super(session);
    }

    /**
     * Other configurations whose hostname coverage overlaps this version.
     */
    public GetApiHostnameCoverageOverlappingResponse getApiHostnameCoverageOverlapping(
            RequestContext context, GetApiHostnameCoverageOverlappingRequest request) throws AppSecException {
        return execute(context, GET_OVERLAPPING, request);
    }

    @Override
    public String getResourceName() {
        return "hostname-coverage";
    }

    @Override
    public List<String> getOperationNames() {
        return List.of(GET_OVERLAPPING.getName());
    }
}
