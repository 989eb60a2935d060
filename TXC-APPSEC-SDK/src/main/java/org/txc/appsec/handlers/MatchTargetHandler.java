package org.txc.appsec.handlers;

import org.txc.appsec.client.AppSecPaths;
import org.txc.appsec.client.AppSecSession;
import org.txc.appsec.client.RequestBody;
import org.txc.appsec.client.RequestContext;
import org.txc.appsec.client.UrlBuilder;
import org.txc.appsec.definition.matchtarget.CreateMatchTargetRequest;
import org.txc.appsec.definition.matchtarget.GetMatchTargetRequest;
import org.txc.appsec.definition.matchtarget.GetMatchTargetsRequest;
import org.txc.appsec.definition.matchtarget.GetMatchTargetsResponse;
import org.txc.appsec.definition.matchtarget.MatchTarget;
import org.txc.appsec.definition.matchtarget.RemoveMatchTargetRequest;
import org.txc.appsec.definition.matchtarget.UpdateMatchTargetRequest;
import org.txc.appsec.errors.AppSecException;

import java.util.List;

/**
 * API and website match targets of a configuration version.
 */
public class MatchTargetHandler extends AbstractResourceHandler {

    static final ResourceOperation<GetMatchTargetsRequest, GetMatchTargetsResponse> GET_MATCH_TARGETS =
            ResourceOperation.builder("GetMatchTargets", GetMatchTargetsRequest.class,
                            GetMatchTargetsResponse.class, GetMatchTargetsResponse::new)
                    .get(r -> matchTargets(r.getConfigId(), r.getConfigVersion()).build())
                    .postProcess(MatchTargetHandler::filterByTargetId)
                    .build();

    static final ResourceOperation<GetMatchTargetRequest, MatchTarget> GET_MATCH_TARGET =
            ResourceOperation.builder("GetMatchTarget", GetMatchTargetRequest.class, MatchTarget.class, MatchTarget::new)
                    .get(r -> matchTargets(r.getConfigId(), r.getConfigVersion()).segment(r.getTargetId())
                            .query("includeChildObjectName", true)
                            .build())
                    .build();

    static final ResourceOperation<CreateMatchTargetRequest, MatchTarget> CREATE_MATCH_TARGET =
            ResourceOperation.builder("CreateMatchTarget", CreateMatchTargetRequest.class, MatchTarget.class, MatchTarget::new)
                    .post(r -> matchTargets(r.getConfigId(), r.getConfigVersion()).build(),
                            r -> RequestBody.raw(r.getJsonPayloadRaw()))
                    .build();

    static final ResourceOperation<UpdateMatchTargetRequest, MatchTarget> UPDATE_MATCH_TARGET =
            ResourceOperation.builder("UpdateMatchTarget", UpdateMatchTargetRequest.class, MatchTarget.class, MatchTarget::new)
                    .put(r -> matchTargets(r.getConfigId(), r.getConfigVersion()).segment(r.getTargetId()).build(),
                            r -> RequestBody.raw(r.getJsonPayloadRaw()))
                    .build();

    static final ResourceOperation<RemoveMatchTargetRequest, MatchTarget> REMOVE_MATCH_TARGET =
            ResourceOperation.builder("RemoveMatchTarget", RemoveMatchTargetRequest.class, MatchTarget.class, MatchTarget::new)
                    .delete(r -> matchTargets(r.getConfigId(), r.getConfigVersion()).segment(r.getTargetId()).build())
                    .build();

    public MatchTargetHandler(AppSecSession session) {
        super(session);
    }

    private static UrlBuilder matchTargets(int configId, int configVersion) {
        return AppSecPaths.version(configId, configVersion).segment("match-targets");
    }

    private static GetMatchTargetsResponse filterByTargetId(GetMatchTargetsRequest request, GetMatchTargetsResponse response) {
        GetMatchTargetsResponse.MatchTargets targets = response.getMatchTargets();
        if (targets == null || ListFilter.isUnset(request.getTargetId())) {
            return response;
        }
        targets.setApiTargets(ListFilter.retain(targets.getApiTargets(), request.getTargetId(), MatchTarget::getTargetId));
        targets.setWebsiteTargets(ListFilter.retain(targets.getWebsiteTargets(), request.getTargetId(), MatchTarget::getTargetId));
        return response;
    }

    /**
     * Lists every match target; a non-zero {@link GetMatchTargetsRequest#getTargetId()} keeps only that target
     * in both the API and the website list.
     */
    public GetMatchTargetsResponse getMatchTargets(RequestContext context, GetMatchTargetsRequest request)
            throws AppSecException {
        return execute(context, GET_MATCH_TARGETS, request);
    }

    public MatchTarget getMatchTarget(RequestContext context, GetMatchTargetRequest request) throws AppSecException {
        return execute(context, GET_MATCH_TARGET, request);
    }

    public MatchTarget createMatchTarget(RequestContext context, CreateMatchTargetRequest request) throws AppSecException {
        return execute(context, CREATE_MATCH_TARGET, request);
    }

    public MatchTarget updateMatchTarget(RequestContext context, UpdateMatchTargetRequest request) throws AppSecException {
        return execute(context, UPDATE_MATCH_TARGET, request);
    }

    public MatchTarget removeMatchTarget(RequestContext context, RemoveMatchTargetRequest request) throws AppSecException {
        return execute(context, REMOVE_MATCH_TARGET, request);
    }

    @Override
    public String getResourceName() {
        return "match-targets";
    }

    @Override
    public List<String> getOperationNames() {
        return List.of(GET_MATCH_TARGETS.getName(), GET_MATCH_TARGET.getName(), CREATE_MATCH_TARGET.getName(),
                UPDATE_MATCH_TARGET.getName(), REMOVE_MATCH_TARGET.getName());
    }
}
