package org.txc.appsec.client;

/**
 * Common prefixes of Application Security API paths.
 */
public final class AppSecPaths {
    public static final String API_ROOT = "/appsec/v1";

    private AppSecPaths() {}

    /** {@code /appsec/v1/configs} */
    public static UrlBuilder configs() {
        return UrlBuilder.root(API_ROOT).segment("configs");
    }

    /** {@code /appsec/v1/configs/{configId}/versions/{version}} */
    public static UrlBuilder version(int configId, int version) {
        return configs().segment(configId).segment("versions").segment(version);
    }

    /** {@code /appsec/v1/configs/{configId}/versions/{version}/security-policies/{policyId}} */
    public static UrlBuilder policy(int configId, int version, String policyId) {
        return version(configId, version).segment("security-policies").segment(policyId);
    }
}
