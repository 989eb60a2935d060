package org.txc.appsec.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("UrlBuilder Tests")
class UrlBuilderTest {

    @Test
    @DisplayName("Should build policy paths from the common prefixes")
    void shouldBuildPolicyPath() {
        String path = AppSecPaths.policy(43253, 7, "AAAA_81230").segment("attack-groups").build();

        assertThat(path).isEqualTo("/appsec/v1/configs/43253/versions/7/security-policies/AAAA_81230/attack-groups");
    }

    @Test
    @DisplayName("Should escape path segments")
    void shouldEscapeSegments() {
        String path = UrlBuilder.root("/appsec/v1").segment("a b/c").segment("é").build();

        assertThat(path).isEqualTo("/appsec/v1/a%20b%2Fc/%C3%A9");
    }

    @Test
    @DisplayName("Should keep query parameters in insertion order")
    void shouldKeepQueryOrder() {
        String path = AppSecPaths.configs()
                .query("includeConditionException", true)
                .query("q", "x&y=z")
                .build();

        assertThat(path).isEqualTo("/appsec/v1/configs?includeConditionException=true&q=x%26y%3Dz");
    }

    @Test
    @DisplayName("Should skip optional parameters without a value")
    void shouldSkipBlankOptionalParameters() {
        assertThat(AppSecPaths.configs().queryIfPresent("hostname", null).build()).isEqualTo("/appsec/v1/configs");
        assertThat(AppSecPaths.configs().queryIfPresent("hostname", " ").build()).isEqualTo("/appsec/v1/configs");
        assertThat(AppSecPaths.configs().queryIfPresent("hostname", "www.example.com").build())
                .isEqualTo("/appsec/v1/configs?hostname=www.example.com");
    }
}
