package org.txc.appsec.handlers;

import org.txc.appsec.client.AppSecPaths;
import org.txc.appsec.client.AppSecSession;
import org.txc.appsec.client.RequestBody;
import org.txc.appsec.client.RequestContext;
import org.txc.appsec.client.UrlBuilder;
import org.txc.appsec.definition.reputationprofile.CreateReputationProfileRequest;
import org.txc.appsec.definition.reputationprofile.GetReputationProfileRequest;
import org.txc.appsec.definition.reputationprofile.GetReputationProfilesRequest;
import org.txc.appsec.definition.reputationprofile.GetReputationProfilesResponse;
import org.txc.appsec.definition.reputationprofile.RemoveReputationProfileRequest;
import org.txc.appsec.definition.reputationprofile.ReputationProfile;
import org.txc.appsec.definition.reputationprofile.UpdateReputationProfileRequest;
import org.txc.appsec.errors.AppSecException;

import java.util.List;

/**
 * Client reputation profiles of a configuration version.
 */
public class ReputationProfileHandler extends AbstractResourceHandler {

    static final ResourceOperation<GetReputationProfilesRequest, GetReputationProfilesResponse> GET_REPUTATION_PROFILES =
            ResourceOperation.builder("GetReputationProfiles", GetReputationProfilesRequest.class,
                            GetReputationProfilesResponse.class, GetReputationProfilesResponse::new)
                    .get(r -> reputationProfiles(r.getConfigId(), r.getConfigVersion()).build())
                    .postProcess((r, res) -> {
                        res.setReputationProfiles(ListFilter.retain(res.getReputationProfiles(),
                                r.getReputationProfileId(), ReputationProfile::getId));
                        return res;
                    })
                    .build();

    static final ResourceOperation<GetReputationProfileRequest, ReputationProfile> GET_REPUTATION_PROFILE =
            ResourceOperation.builder("GetReputationProfile", GetReputationProfileRequest.class,
                            ReputationProfile.class, ReputationProfile::new)
                    .get(r -> reputationProfiles(r.getConfigId(), r.getConfigVersion())
                            .segment(r.getReputationProfileId()).build())
                    .build();

    static final ResourceOperation<CreateReputationProfileRequest, ReputationProfile> CREATE_REPUTATION_PROFILE =
            ResourceOperation.builder("CreateReputationProfile", CreateReputationProfileRequest.class,
                            ReputationProfile.class, ReputationProfile::new)
                    .post(r -> reputationProfiles(r.getConfigId(), r.getConfigVersion()).build(),
                            r -> RequestBody.raw(r.getJsonPayloadRaw()))
                    .build();

    static final ResourceOperation<UpdateReputationProfileRequest, ReputationProfile> UPDATE_REPUTATION_PROFILE =
            ResourceOperation.builder("UpdateReputationProfile", UpdateReputationProfileRequest.class,
                            ReputationProfile.class, ReputationProfile::new)
                    .put(r -> reputationProfiles(r.getConfigId(), r.getConfigVersion())
                                    .segment(r.getReputationProfileId()).build(),
                            r -> RequestBody.raw(r.getJsonPayloadRaw()))
                    .build();

    static final ResourceOperation<RemoveReputationProfileRequest, ReputationProfile> REMOVE_REPUTATION_PROFILE =
            ResourceOperation.builder("RemoveReputationProfile", RemoveReputationProfileRequest.class,
                            ReputationProfile.class, ReputationProfile::new)
                    .delete(r -> reputationProfiles(r.getConfigId(), r.getConfigVersion())
                            .segment(r.getReputationProfileId()).build())
                    .build();

    public ReputationProfileHandler(AppSecSession session) {
        super(session);
    }

    private static UrlBuilder reputationProfiles(int configId, int configVersion) {
        return AppSecPaths.version(configId, configVersion).segment("reputation-profiles");
    }

    public GetReputationProfilesResponse getReputationProfiles(RequestContext context, GetReputationProfilesRequest request)
            throws AppSecException {
        return execute(context, GET_REPUTATION_PROFILES, request);
    }

    public ReputationProfile getReputationProfile(RequestContext context, GetReputationProfileRequest request)
            throws AppSecException {
        return execute(context, GET_REPUTATION_PROFILE, request);
    }

    public ReputationProfile createReputationProfile(RequestContext context, CreateReputationProfileRequest request)
            throws AppSecException {
        return execute(context, CREATE_REPUTATION_PROFILE, request);
    }

    public ReputationProfile updateReputationProfile(RequestContext context, UpdateReputationProfileRequest request)
            throws AppSecException {
        return execute(context, UPDATE_REPUTATION_PROFILE, request);
    }

    /**
     * Deletes a profile. The API answers 200 with the removed profile or 204 with no content.
     */
    public ReputationProfile removeReputationProfile(RequestContext context, RemoveReputationProfileRequest request)
            throws AppSecException {
        return execute(context, REMOVE_REPUTATION_PROFILE, request);
    }

    @Override
    public String getResourceName() {
        return "reputation-profiles";
    }

    @Override
    public List<String> getOperationNames() {
        return List.of(GET_REPUTATION_PROFILES.getName(), GET_REPUTATION_PROFILE.getName(),
                CREATE_REPUTATION_PROFILE.getName(), UPDATE_REPUTATION_PROFILE.getName(),
                REMOVE_REPUTATION_PROFILE.getName());
    }
}
