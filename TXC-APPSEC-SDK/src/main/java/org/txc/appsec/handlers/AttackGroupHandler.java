package org.txc.appsec.handlers;

import org.txc.appsec.client.AppSecPaths;
import org.txc.appsec.client.AppSecSession;
import org.txc.appsec.client.RequestBody;
import org.txc.appsec.client.RequestContext;
import org.txc.appsec.definition.attackgroup.AttackGroupAction;
import org.txc.appsec.definition.attackgroup.GetAttackGroupRequest;
import org.txc.appsec.definition.attackgroup.GetAttackGroupResponse;
import org.txc.appsec.definition.attackgroup.GetAttackGroupsRequest;
import org.txc.appsec.definition.attackgroup.GetAttackGroupsResponse;
import org.txc.appsec.definition.attackgroup.UpdateAttackGroupRequest;
import org.txc.appsec.definition.attackgroup.UpdateAttackGroupResponse;
import org.txc.appsec.errors.AppSecException;

import java.util.List;

/**
 * Attack group actions and their condition/exception blocks within a security policy.
 */
public class AttackGroupHandler extends AbstractResourceHandler {

    static final ResourceOperation<GetAttackGroupsRequest, GetAttackGroupsResponse> GET_ATTACK_GROUPS =
            ResourceOperation.builder("GetAttackGroups", GetAttackGroupsRequest.class,
                            GetAttackGroupsResponse.class, GetAttackGroupsResponse::new)
                    .get(r -> AppSecPaths.policy(r.getConfigId(), r.getVersion(), r.getPolicyId())
                            .segment("attack-groups")
                            .query("includeConditionException", true)
                            .build())
                    .postProcess((r, res) -> {
                        res.setAttackGroups(ListFilter.retain(res.getAttackGroups(), r.getGroup(), AttackGroupAction::getGroup));
                        return res;
                    })
                    .build();

    static final ResourceOperation<GetAttackGroupRequest, GetAttackGroupResponse> GET_ATTACK_GROUP =
            ResourceOperation.builder("GetAttackGroup", GetAttackGroupRequest.class,
                            GetAttackGroupResponse.class, GetAttackGroupResponse::new)
                    .get(r -> AppSecPaths.policy(r.getConfigId(), r.getVersion(), r.getPolicyId())
                            .segment("attack-groups").segment(r.getGroup())
                            .query("includeConditionException", true)
                            .build())
                    .build();

    static final ResourceOperation<UpdateAttackGroupRequest, UpdateAttackGroupResponse> UPDATE_ATTACK_GROUP =
            ResourceOperation.builder("UpdateAttackGroup", UpdateAttackGroupRequest.class,
                            UpdateAttackGroupResponse.class, UpdateAttackGroupResponse::new)
                    .put(r -> AppSecPaths.policy(r.getConfigId(), r.getVersion(), r.getPolicyId())
                                    .segment("attack-groups").segment(r.getGroup())
                                    .segment("action-condition-exception")
                                    .build(),
                            RequestBody::json)
                    .build();

    public AttackGroupHandler(AppSecSession session) {
        super(session);
    }

    /**
     * Lists the attack groups of a policy, narrowed to {@link GetAttackGroupsRequest#getGroup()} when set.
     */
    public GetAttackGroupsResponse getAttackGroups(RequestContext context, GetAttackGroupsRequest request)
            throws AppSecException {
        return execute(context, GET_ATTACK_GROUPS, request);
    }

    public GetAttackGroupResponse getAttackGroup(RequestContext context, GetAttackGroupRequest request)
            throws AppSecException {
        return execute(context, GET_ATTACK_GROUP, request);
    }

    public UpdateAttackGroupResponse updateAttackGroup(RequestContext context, UpdateAttackGroupRequest request)
            throws AppSecException {
        return execute(context, UPDATE_ATTACK_GROUP, request);
    }

    @Override
    public String getResourceName() {
        return "attack-groups";
    }

    @Override
    public List<String> getOperationNames() {
        return List.of(GET_ATTACK_GROUPS.getName(), GET_ATTACK_GROUP.getName(), UPDATE_ATTACK_GROUP.getName());
    }
}
