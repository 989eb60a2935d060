package org.txc.appsec.handlers;

import org.txc.appsec.client.AppSecPaths;
import org.txc.appsec.client.AppSecSession;
import org.txc.appsec.client.RequestBody;
import org.txc.appsec.client.RequestContext;
import org.txc.appsec.definition.versionnotes.GetVersionNotesRequest;
import org.txc.appsec.definition.versionnotes.UpdateVersionNotesRequest;
import org.txc.appsec.definition.versionnotes.VersionNotes;
import org.txc.appsec.errors.AppSecException;

import java.util.List;

public class VersionNotesHandler extends AbstractResourceHandler {

    static final ResourceOperation<GetVersionNotesRequest, VersionNotes> GET_VERSION_NOTES =
            ResourceOperation.builder("GetVersionNotes", GetVersionNotesRequest.class, VersionNotes.class, VersionNotes::new)
                    .get(r -> versionNotes(r.getConfigId(), r.getVersion()))
                    .build();

    static final ResourceOperation<UpdateVersionNotesRequest, VersionNotes> UPDATE_VERSION_NOTES =
            ResourceOperation.builder("UpdateVersionNotes", UpdateVersionNotesRequest.class, VersionNotes.class, VersionNotes::new)
                    .put(r -> versionNotes(r.getConfigId(), r.getVersion()), RequestBody::json)
                    .build();

    public VersionNotesHandler(AppSecSession session) {
        super(session);
    }

    private static String versionNotes(int configId, int version) {
        return AppSecPaths.version(configId, version).segment("version-notes").build();
    }

    public VersionNotes getVersionNotes(RequestContext context, GetVersionNotesRequest request) throws AppSecException {
        return execute(context, GET_VERSION_NOTES, request);
    }

    public VersionNotes updateVersionNotes(RequestContext context, UpdateVersionNotesRequest request) throws AppSecException {
        return execute(context, UPDATE_VERSION_NOTES, request);
    }

    @Override
    public String getResourceName() {
        return "version-notes";
    }

    @Override
    public List<String> getOperationNames() {
        return List.of(GET_VERSION_NOTES.getName(), UPDATE_VERSION_NOTES.getName());
    }
}
