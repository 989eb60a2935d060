package org.txc.appsec.handlers;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.txc.appsec.client.RequestContext;
import org.txc.appsec.definition.AppSecSDK;
import org.txc.appsec.definition.matchtarget.CreateMatchTargetRequest;
import org.txc.appsec.definition.matchtarget.GetMatchTargetRequest;
import org.txc.appsec.definition.matchtarget.GetMatchTargetsRequest;
import org.txc.appsec.definition.matchtarget.GetMatchTargetsResponse;
import org.txc.appsec.definition.matchtarget.MatchTarget;
import org.txc.appsec.definition.matchtarget.RemoveMatchTargetRequest;
import org.txc.appsec.definition.matchtarget.UpdateMatchTargetRequest;
import org.txc.appsec.errors.ValidationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MatchTargetHandler Tests")
class MatchTargetHandlerTest {

    private static final String TARGETS_PATH = "/appsec/v1/configs/43253/versions/15/match-targets";
    private static final String LIST_JSON = "{\"matchTargets\":{"
            + "\"apiTargets\":[{\"type\":\"api\",\"targetId\":2052813,\"sequence\":1,"
            + "\"apis\":[{\"id\":624913,\"name\":\"Billing\"}],\"securityPolicy\":{\"policyId\":\"AAAA_81230\"}}],"
            + "\"websiteTargets\":[{\"type\":\"website\",\"targetId\":2971336,\"hostnames\":[\"www.example.com\"],"
            + "\"isNegativePathMatch\":false,\"filePaths\":[\"/*\"]},"
            + "{\"type\":\"website\",\"targetId\":3008967,\"hostnames\":[\"api.example.com\"]}]}}";

    private MockAppSecApi api;
    private AppSecSDK sdk;

    @BeforeEach
    void setUp() throws Exception {
        api = new MockAppSecApi();
        sdk = api.newSdk();
        api.stub("GET", TARGETS_PATH, 200, LIST_JSON);
    }

    @AfterEach
    void tearDown() {
        api.close();
    }

    @Test
    @DisplayName("Should decode API and website targets into one model")
    void shouldDecodeBothVariants() throws Exception {
        GetMatchTargetsResponse response = sdk.matchTargets().getMatchTargets(RequestContext.background(),
                new GetMatchTargetsRequest(43253, 15));

        assertThat(response.getMatchTargets().getApiTargets()).singleElement().satisfies(target -> {
            assertThat(target.getApis()).extracting(MatchTarget.ApiReference::getName).containsExactly("Billing");
            assertThat(target.getSecurityPolicy().getPolicyId()).isEqualTo("AAAA_81230");
        });
        assertThat(response.getMatchTargets().getWebsiteTargets()).extracting(MatchTarget::getTargetId)
                .containsExactly(2971336, 3008967);
        assertThat(response.getMatchTargets().getWebsiteTargets().get(0).getIsNegativePathMatch()).isFalse();
    }

    @Test
    @DisplayName("Should keep only the requested target across both lists")
    void shouldFilterByTargetId() throws Exception {
        GetMatchTargetsRequest request = new GetMatchTargetsRequest(43253, 15);
        request.setTargetId(3008967);

        GetMatchTargetsResponse response = sdk.matchTargets().getMatchTargets(RequestContext.background(), request);

        assertThat(response.getMatchTargets().getApiTargets()).isEmpty();
        assertThat(response.getMatchTargets().getWebsiteTargets()).singleElement()
                .satisfies(target -> assertThat(target.getHostnames()).containsExactly("api.example.com"));
    }

    @Test
    @DisplayName("Should request child object names for a single target")
    void shouldGetSingleTarget() throws Exception {
        api.stub("GET", TARGETS_PATH + "/2971336?includeChildObjectName=true", 200,
                "{\"type\":\"website\",\"targetId\":2971336,\"hostnames\":[\"www.example.com\"]}");

        MatchTarget target = sdk.matchTargets().getMatchTarget(RequestContext.background(),
                new GetMatchTargetRequest(43253, 15, 2971336));

        assertThat(target.getType()).isEqualTo("website");
        assertThat(target.getHostnames()).containsExactly("www.example.com");
    }

    @Test
    @DisplayName("Should create, update and remove with the expected methods")
    void shouldWriteTargets() throws Exception {
        String payload = "{\"type\":\"website\",\"hostnames\":[\"www.example.com\"]}";
        api.stub("POST", TARGETS_PATH, 201, "{\"type\":\"website\",\"targetId\":4000001}")
                .stub("PUT", TARGETS_PATH + "/4000001", 200, "{\"type\":\"website\",\"targetId\":4000001}")
                .stub("DELETE", TARGETS_PATH + "/4000001", 200, "{\"type\":\"website\",\"targetId\":4000001}");

        MatchTarget created = sdk.matchTargets().createMatchTarget(RequestContext.background(),
                new CreateMatchTargetRequest(43253, 15, payload));
        sdk.matchTargets().updateMatchTarget(RequestContext.background(),
                new UpdateMatchTargetRequest(43253, 15, created.getTargetId(), payload));
        MatchTarget removed = sdk.matchTargets().removeMatchTarget(RequestContext.background(),
                new RemoveMatchTargetRequest(43253, 15, created.getTargetId()));

        assertThat(created.getTargetId()).isEqualTo(4000001);
        assertThat(removed.getTargetId()).isEqualTo(4000001);
        assertThat(api.requests()).extracting(r -> r.method).containsExactly("POST", "PUT", "DELETE");
        assertThat(api.requests().get(1).bodyAsString()).isEqualTo(payload);
    }

    @Test
    @DisplayName("Should require targetId for update")
    void shouldRequireTargetId() {
        assertThatThrownBy(() -> sdk.matchTargets().updateMatchTarget(RequestContext.background(),
                new UpdateMatchTargetRequest(43253, 15, 0, "{}")))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.getFields()).containsExactly("targetId"));
    }
}
