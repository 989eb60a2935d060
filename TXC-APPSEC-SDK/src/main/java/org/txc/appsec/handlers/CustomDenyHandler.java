package org.txc.appsec.handlers;

import org.txc.appsec.client.AppSecPaths;
import org.txc.appsec.client.AppSecSession;
import org.txc.appsec.client.RequestBody;
import org.txc.appsec.client.RequestContext;
import org.txc.appsec.client.UrlBuilder;
import org.txc.appsec.definition.customdeny.CreateCustomDenyRequest;
import org.txc.appsec.definition.customdeny.CustomDeny;
import org.txc.appsec.definition.customdeny.GetCustomDenyListRequest;
import org.txc.appsec.definition.customdeny.GetCustomDenyListResponse;
import org.txc.appsec.definition.customdeny.GetCustomDenyRequest;
import org.txc.appsec.definition.customdeny.RemoveCustomDenyRequest;
import org.txc.appsec.definition.customdeny.RemoveCustomDenyResponse;
import org.txc.appsec.definition.customdeny.UpdateCustomDenyRequest;
import org.txc.appsec.errors.AppSecException;

import java.util.List;

/**
 * Custom deny actions of a configuration version.
 */
public class CustomDenyHandler extends AbstractResourceHandler {

    static final ResourceOperation<GetCustomDenyListRequest, GetCustomDenyListResponse> GET_CUSTOM_DENY_LIST =
            ResourceOperation.builder("GetCustomDenyList", GetCustomDenyListRequest.class,
                            GetCustomDenyListResponse.class, GetCustomDenyListResponse::new)
                    .get(r -> customDeny(r.getConfigId(), r.getVersion()).build())
                    .postProcess((r, res) -> {
                        res.setCustomDenyList(ListFilter.retain(res.getCustomDenyList(), r.getId(), CustomDeny::getId));
                        return res;
                    })
                    .build();

    static final ResourceOperation<GetCustomDenyRequest, CustomDeny> GET_CUSTOM_DENY =
            ResourceOperation.builder("GetCustomDeny", GetCustomDenyRequest.class, CustomDeny.class, CustomDeny::new)
                    .get(r -> customDeny(r.getConfigId(), r.getVersion()).segment(r.getId()).build())
                    .build();

    static final ResourceOperation<CreateCustomDenyRequest, CustomDeny> CREATE_CUSTOM_DENY =
            ResourceOperation.builder("CreateCustomDeny", CreateCustomDenyRequest.class, CustomDeny.class, CustomDeny::new)
                    .post(r -> customDeny(r.getConfigId(), r.getVersion()).build(),
                            r -> RequestBody.raw(r.getJsonPayloadRaw()))
                    .build();

    static final ResourceOperation<UpdateCustomDenyRequest, CustomDeny> UPDATE_CUSTOM_DENY =
            ResourceOperation.builder("UpdateCustomDeny", UpdateCustomDenyRequest.class, CustomDeny.class, CustomDeny::new)
                    .put(r -> customDeny(r.getConfigId(), r.getVersion()).segment(r.getId()).build(),
                            r -> RequestBody.raw(r.getJsonPayloadRaw()))
                    .build();

    static final ResourceOperation<RemoveCustomDenyRequest, RemoveCustomDenyResponse> REMOVE_CUSTOM_DENY =
            ResourceOperation.builder("RemoveCustomDeny", RemoveCustomDenyRequest.class,
                            RemoveCustomDenyResponse.class, RemoveCustomDenyResponse::new)
                    .delete(r -> customDeny(r.getConfigId(), r.getVersion()).segment(r.getId()).build())
                    .build();

    public CustomDenyHandler(AppSecSession session) {
        super(session);
    }

    private static UrlBuilder customDeny(int configId, int version) {
        return AppSecPaths.version(configId, version).segment("custom-deny");
    }

    public GetCustomDenyListResponse getCustomDenyList(RequestContext context, GetCustomDenyListRequest request)
            throws AppSecException {
        return execute(context, GET_CUSTOM_DENY_LIST, request);
    }

    public CustomDeny getCustomDeny(RequestContext context, GetCustomDenyRequest request) throws AppSecException {
        return execute(context, GET_CUSTOM_DENY, request);
    }

    public CustomDeny createCustomDeny(RequestContext context, CreateCustomDenyRequest request) throws AppSecException {
        return execute(context, CREATE_CUSTOM_DENY, request);
    }

    public CustomDeny updateCustomDeny(RequestContext context, UpdateCustomDenyRequest request) throws AppSecException {
        return execute(context, UPDATE_CUSTOM_DENY, request);
    }

    public RemoveCustomDenyResponse removeCustomDeny(RequestContext context, RemoveCustomDenyRequest request)
            throws AppSecException {
        return execute(context, REMOVE_CUSTOM_DENY, request);
    }

    @Override
    public String getResourceName() {
        return "custom-deny";
    }

    @Override
    public List<String> getOperationNames() {
        return List.of(GET_CUSTOM_DENY_LIST.getName(), GET_CUSTOM_DENY.getName(), CREATE_CUSTOM_DENY.getName(),
                UPDATE_CUSTOM_DENY.getName(), REMOVE_CUSTOM_DENY.getName());
    }
}
