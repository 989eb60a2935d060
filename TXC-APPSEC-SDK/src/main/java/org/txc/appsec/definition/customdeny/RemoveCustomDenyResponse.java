package org.txc.appsec.definition.customdeny;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The delete endpoint returns no content; an instance only signals success.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RemoveCustomDenyResponse {
}
