package org.txc.appsec.handlers;

import org.txc.appsec.client.AppSecPaths;
import org.txc.appsec.client.AppSecSession;
import org.txc.appsec.client.RequestBody;
import org.txc.appsec.client.RequestContext;
import org.txc.appsec.definition.reputationanalysis.GetReputationAnalysisRequest;
import org.txc.appsec.definition.reputationanalysis.RemoveReputationAnalysisRequest;
import org.txc.appsec.definition.reputationanalysis.ReputationAnalysisSettings;
import org.txc.appsec.definition.reputationanalysis.UpdateReputationAnalysisRequest;
import org.txc.appsec.errors.AppSecException;

import java.util.List;

/**
 * Reputation analysis forwarding settings of a security policy.
 */
public class ReputationAnalysisHandler extends AbstractResourceHandler {

    static final ResourceOperation<GetReputationAnalysisRequest, ReputationAnalysisSettings> GET_REPUTATION_ANALYSIS =
            ResourceOperation.builder("GetReputationAnalysis", GetReputationAnalysisRequest.class,
                            ReputationAnalysisSettings.class, ReputationAnalysisSettings::new)
                    .get(r -> reputationAnalysis(r.getConfigId(), r.getVersion(), r.getPolicyId()))
                    .build();

    static final ResourceOperation<UpdateReputationAnalysisRequest, ReputationAnalysisSettings> UPDATE_REPUTATION_ANALYSIS =
            ResourceOperation.builder("UpdateReputationAnalysis", UpdateReputationAnalysisRequest.class,
                            ReputationAnalysisSettings.class, ReputationAnalysisSettings::new)
                    .put(r -> reputationAnalysis(r.getConfigId(), r.getVersion(), r.getPolicyId()), RequestBody::json)
                    .build();

    // No DELETE on this endpoint: removal writes the flags back with a PUT.
    static final ResourceOperation<RemoveReputationAnalysisRequest, ReputationAnalysisSettings> REMOVE_REPUTATION_ANALYSIS =
            ResourceOperation.builder("RemoveReputationAnalysis", RemoveReputationAnalysisRequest.class,
                            ReputationAnalysisSettings.class, ReputationAnalysisSettings::new)
                    .put(r -> reputationAnalysis(r.getConfigId(), r.getVersion(), r.getPolicyId()), RequestBody::json)
                    .build();

    public ReputationAnalysisHandler(AppSecSession session) {
        super(session);
    }

    private static String reputationAnalysis(int configId, int version, String policyId) {
        return AppSecPaths.policy(configId, version, policyId).segment("reputation-analysis").build();
    }

    public ReputationAnalysisSettings getReputationAnalysis(RequestContext context, GetReputationAnalysisRequest request)
            throws AppSecException {
        return execute(context, GET_REPUTATION_ANALYSIS, request);
    }

    public ReputationAnalysisSettings updateReputationAnalysis(RequestContext context, UpdateReputationAnalysisRequest request)
            throws AppSecException {
        return execute(context, UPDATE_REPUTATION_ANALYSIS, request);
    }

    public ReputationAnalysisSettings removeReputationAnalysis(RequestContext context, RemoveReputationAnalysisRequest request)
            throws AppSecException {
        return execute(context, REMOVE_REPUTATION_ANALYSIS, request);
    }

    @Override
    public String getResourceName() {
        return "reputation-analysis";
    }

    @Override
    public List<String> getOperationNames() {
        return List.of(GET_REPUTATION_ANALYSIS.getName(), UPDATE_REPUTATION_ANALYSIS.getName(),
                REMOVE_REPUTATION_ANALYSIS.getName());
    }
}
