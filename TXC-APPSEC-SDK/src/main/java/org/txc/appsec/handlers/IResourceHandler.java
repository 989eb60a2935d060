package org.txc.appsec.handlers;

import java.util.List;

/**
 * One resource group of the Application Security API (attack groups, match targets, ...).
 */
public interface IResourceHandler {

    /** Short name used to look the handler up, e.g. {@code "attack-groups"}. */
    String getResourceName();

    /** Names of the operations the handler exposes, e.g. {@code "GetAttackGroup"}. */
    List<String> getOperationNames();
}
