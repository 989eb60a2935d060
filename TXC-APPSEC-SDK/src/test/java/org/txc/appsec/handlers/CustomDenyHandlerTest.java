package org.txc.appsec.handlers;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.txc.appsec.client.RequestContext;
import org.txc.appsec.definition.AppSecSDK;
import org.txc.appsec.definition.customdeny.CreateCustomDenyRequest;
import org.txc.appsec.definition.customdeny.CustomDeny;
import org.txc.appsec.definition.customdeny.GetCustomDenyListRequest;
import org.txc.appsec.definition.customdeny.GetCustomDenyListResponse;
import org.txc.appsec.definition.customdeny.GetCustomDenyRequest;
import org.txc.appsec.definition.customdeny.RemoveCustomDenyRequest;
import org.txc.appsec.definition.customdeny.RemoveCustomDenyResponse;
import org.txc.appsec.definition.customdeny.UpdateCustomDenyRequest;
import org.txc.appsec.errors.ApiException;
import org.txc.appsec.errors.ValidationException;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CustomDenyHandler Tests")
class CustomDenyHandlerTest {

    private static final String CUSTOM_DENY_PATH = "/appsec/v1/configs/43253/versions/15/custom-deny";

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
    @DisplayName("Should send the raw update payload byte-for-byte and surface a 500 as ApiException")
    void shouldSendRawPayloadAndRaiseOnServerError() {
        String payload = "{ \"name\" : \"deny_custom_64386\",\n  \"parameters\":[{\"name\":\"response_status_code\",\"value\":\"403\"}] }";
        api.stub("PUT", CUSTOM_DENY_PATH + "/deny_custom_64386", 500,
                "{\"type\":\"internal_error\",\"title\":\"Internal Server Error\",\"detail\":\"Error updating data\",\"status\":500}");

        assertThatThrownBy(() -> sdk.customDeny().updateCustomDeny(RequestContext.background(),
                new UpdateCustomDenyRequest(43253, 15, "deny_custom_64386", payload)))
                .isInstanceOfSatisfying(ApiException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(500);
                    assertThat(e.getError().getTitle()).isEqualTo("Internal Server Error");
                    assertThat(e.getMessage()).isEqualTo("UpdateCustomDeny: API error: "
                            + "Title: Internal Server Error; Type: internal_error; Detail: Error updating data");
                });

        assertThat(api.requests()).hasSize(1);
        assertThat(api.lastRequest().method).isEqualTo("PUT");
        assertThat(api.lastRequest().body).isEqualTo(payload.getBytes(StandardCharsets.UTF_8));
        assertThat(api.lastRequest().contentType).isEqualTo("application/json");
    }

    @Test
    @DisplayName("Should decode a numeric custom deny id as its decimal string")
    void shouldDecodeNumericId() throws Exception {
        api.stub("GET", CUSTOM_DENY_PATH + "/622918", 200,
                "{\"id\":622918,\"name\":\"deny page\",\"parameters\":[{\"name\":\"prevent_browser_cache\",\"value\":\"true\"}]}");

        CustomDeny response = sdk.customDeny().getCustomDeny(RequestContext.background(),
                new GetCustomDenyRequest(43253, 15, "622918"));

        assertThat(response.getId()).isEqualTo("622918");
        assertThat(response.getParameters()).singleElement()
                .satisfies(p -> assertThat(p.getValue()).isEqualTo("true"));
    }

    @Test
    @DisplayName("Should filter the list by id and keep it whole without a filter")
    void shouldFilterListById() throws Exception {
        api.stub("GET", CUSTOM_DENY_PATH, 200, "{\"customDenyList\":["
                + "{\"id\":\"deny_custom_1\",\"name\":\"one\"},"
                + "{\"id\":622918,\"name\":\"two\"}]}");

        GetCustomDenyListResponse all = sdk.customDeny().getCustomDenyList(RequestContext.background(),
                new GetCustomDenyListRequest(43253, 15));
        GetCustomDenyListRequest filtered = new GetCustomDenyListRequest(43253, 15);
        filtered.setId("622918");
        GetCustomDenyListResponse one = sdk.customDeny().getCustomDenyList(RequestContext.background(), filtered);

        assertThat(all.getCustomDenyList()).extracting(CustomDeny::getName).containsExactly("one", "two");
        assertThat(one.getCustomDenyList()).extracting(CustomDeny::getName).containsExactly("two");
    }

    @Test
    @DisplayName("Should POST the raw create payload and accept 201")
    void shouldCreate() throws Exception {
        api.stub("POST", CUSTOM_DENY_PATH, 201, "{\"id\":\"deny_custom_2\",\"name\":\"new\"}");

        CustomDeny created = sdk.customDeny().createCustomDeny(RequestContext.background(),
                new CreateCustomDenyRequest(43253, 15, "{\"name\":\"new\"}"));

        assertThat(created.getId()).isEqualTo("deny_custom_2");
        assertThat(api.lastRequest().bodyAsString()).isEqualTo("{\"name\":\"new\"}");
    }

    @Test
    @DisplayName("Should accept 204 on remove and return an empty response")
    void shouldRemoveWithNoContent() throws Exception {
        api.stub("DELETE", CUSTOM_DENY_PATH + "/deny_custom_2", 204, null);

        RemoveCustomDenyResponse response = sdk.customDeny().removeCustomDeny(RequestContext.background(),
                new RemoveCustomDenyRequest(43253, 15, "deny_custom_2"));

        assertThat(response).isNotNull();
        assertThat(api.lastRequest().method).isEqualTo("DELETE");
    }

    @Test
    @DisplayName("Should name every missing field")
    void shouldNameMissingFields() {
        assertThatThrownBy(() -> sdk.customDeny().removeCustomDeny(RequestContext.background(),
                new RemoveCustomDenyRequest(0, 15, null)))
                .isInstanceOfSatisfying(ValidationException.class, e -> {
                    assertThat(e.getFields()).containsExactly("configId", "id");
                    assertThat(e.getMessage()).startsWith("RemoveCustomDeny: struct validation: configId: ");
                });
        assertThat(api.requests()).isEmpty();
    }
}
