package org.txc.appsec.handlers;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.txc.appsec.client.RequestContext;
import org.txc.appsec.definition.AppSecSDK;
import org.txc.appsec.definition.reputationprofile.AtomicCondition;
import org.txc.appsec.definition.reputationprofile.CreateReputationProfileRequest;
import org.txc.appsec.definition.reputationprofile.GetReputationProfileRequest;
import org.txc.appsec.definition.reputationprofile.GetReputationProfilesRequest;
import org.txc.appsec.definition.reputationprofile.GetReputationProfilesResponse;
import org.txc.appsec.definition.reputationprofile.RemoveReputationProfileRequest;
import org.txc.appsec.definition.reputationprofile.ReputationProfile;
import org.txc.appsec.definition.reputationprofile.UpdateReputationProfileRequest;
import org.txc.appsec.errors.ApiException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ReputationProfileHandler Tests")
class ReputationProfileHandlerTest {

    private static final String PROFILES_PATH = "/appsec/v1/configs/43253/versions/15/reputation-profiles";
    private static final String PROFILE_JSON = "{\"id\":12345,\"name\":\"Web Attackers (High Threat)\","
            + "\"context\":\"WEBATCK\",\"threshold\":9,\"sharedIpHandling\":\"NON_SHARED\","
            + "\"condition\":{\"positiveMatch\":true,\"atomicConditions\":["
            + "{\"className\":\"RequestHeaderCondition\",\"index\":1,\"positiveMatch\":true,"
            + "\"name\":\"x-forwarded-for\",\"value\":[\"1.2.3.4\"]},"
            + "{\"className\":\"RequestHeaderCondition\",\"index\":2,\"positiveMatch\":true,"
            + "\"name\":[\"user-agent\",\"referer\"]}]}}";

    private MockAppSecApi api;
    private AppSecSDK sdk;

    @BeforeEach
    void setUp() throws Exception {
        api = new MockAppSecApi();
        sdk = api.newSdk();
    }

    @AfterEach
    void tearDown() {
        api.close();
    }

    @Test
    @DisplayName("Should normalize atomic condition names given as string or array")
    void shouldNormalizeConditionNames() throws Exception {
        api.stub("GET", PROFILES_PATH + "/12345", 200, PROFILE_JSON);

        ReputationProfile profile = sdk.reputationProfiles().getReputationProfile(RequestContext.background(),
                new GetReputationProfileRequest(43253, 15, 12345));

        assertThat(profile.getContext()).isEqualTo("WEBATCK");
        assertThat(profile.getThreshold()).isEqualTo(9);
        assertThat(profile.getCondition().getAtomicConditions()).extracting(AtomicCondition::getName)
                .containsExactly(List.of("x-forwarded-for"), List.of("user-agent", "referer"));
    }

    @Test
    @DisplayName("Should filter profiles by id")
    void shouldFilterById() throws Exception {
        api.stub("GET", PROFILES_PATH, 200, "{\"reputationProfiles\":[" + PROFILE_JSON
                + ",{\"id\":67890,\"name\":\"Scanning Tools\",\"context\":\"SCANTL\"}]}");
        GetReputationProfilesRequest request = new GetReputationProfilesRequest(43253, 15);
        request.setReputationProfileId(67890);

        GetReputationProfilesResponse response = sdk.reputationProfiles()
                .getReputationProfiles(RequestContext.background(), request);

        assertThat(response.getReputationProfiles()).extracting(ReputationProfile::getName)
                .containsExactly("Scanning Tools");
    }

    @Test
    @DisplayName("Should decode update and remove responses as reputation profiles")
    void shouldDecodeWriteResponsesAsProfiles() throws Exception {
        api.stub("POST", PROFILES_PATH, 201, PROFILE_JSON)
                .stub("PUT", PROFILES_PATH + "/12345", 200, PROFILE_JSON)
                .stub("DELETE", PROFILES_PATH + "/12345", 204, null);

        ReputationProfile created = sdk.reputationProfiles().createReputationProfile(RequestContext.background(),
                new CreateReputationProfileRequest(43253, 15, PROFILE_JSON));
        ReputationProfile updated = sdk.reputationProfiles().updateReputationProfile(RequestContext.background(),
                new UpdateReputationProfileRequest(43253, 15, 12345, PROFILE_JSON));
        ReputationProfile removed = sdk.reputationProfiles().removeReputationProfile(RequestContext.background(),
                new RemoveReputationProfileRequest(43253, 15, 12345));

        assertThat(created.getId()).isEqualTo(12345);
        assertThat(updated.getName()).isEqualTo("Web Attackers (High Threat)");
        assertThat(removed.getId()).isZero();
    }

    @Test
    @DisplayName("Should reject a 202 on create as outside the success set")
    void shouldRejectUnexpectedStatus() {
        api.stub("POST", PROFILES_PATH, 202, PROFILE_JSON);

        assertThatThrownBy(() -> sdk.reputationProfiles().createReputationProfile(RequestContext.background(),
                new CreateReputationProfileRequest(43253, 15, PROFILE_JSON)))
                .isInstanceOfSatisfying(ApiException.class, e -> assertThat(e.getStatusCode()).isEqualTo(202));
    }
}
