package org.txc.appsec.handlers;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.txc.appsec.client.RequestContext;
import org.txc.appsec.definition.AppSecSDK;
import org.txc.appsec.definition.hostnamecoverage.GetApiHostnameCoverageOverlappingRequest;
import org.txc.appsec.definition.hostnamecoverage.GetApiHostnameCoverageOverlappingResponse;

import static org.assertj.core.api.Assertions.assertThat;

class HostnameCoverageHandlerTest {

    private static final String OVERLAP_PATH = "/appsec/v1/configs/43253/versions/15/hostname-coverage/overlapping";
    private static final String OVERLAP_JSON = "{\"overLappingList\":[{\"configId\":7180,\"configName\":\"Other\","
            + "\"configVersion\":3,\"contractId\":\"C-0N7RAC7\",\"contractName\":\"Example\",\"versionTags\":[\"PRODUCTION\"]}]}";

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
    void sendsHostnameAsQueryParameter() throws Exception {
        api.stub("GET", OVERLAP_PATH + "?hostname=www.example.com", 200, OVERLAP_JSON);

        GetApiHostnameCoverageOverlappingResponse response = sdk.hostnameCoverage().getApiHostnameCoverageOverlapping(
                RequestContext.background(), new GetApiHostnameCoverageOverlappingRequest(43253, 15, "www.example.com"));

        assertThat(response.getOverlappingList()).singleElement().satisfies(overlap -> {
            assertThat(overlap.getConfigId()).isEqualTo(7180);
            assertThat(overlap.getVersionTags()).containsExactly("PRODUCTION");
        });
    }

    @Test
    void omitsBlankHostname() throws Exception {
        api.stub("GET", OVERLAP_PATH, 200, "{\"overLappingList\":[]}");

        GetApiHostnameCoverageOverlappingResponse response = sdk.hostnameCoverage().getApiHostnameCoverageOverlapping(
                RequestContext.background(), new GetApiHostnameCoverageOverlappingRequest(43253, 15, ""));

        assertThat(response.getOverlappingList()).isEmpty();
        assertThat(api.lastRequest().pathAndQuery).isEqualTo(OVERLAP_PATH);
    }
}
