package org.txc.appsec.handlers;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.txc.appsec.client.ContextCancelledException;
import org.txc.appsec.client.RequestContext;
import org.txc.appsec.definition.AppSecSDK;
import org.txc.appsec.definition.versionnotes.GetVersionNotesRequest;
import org.txc.appsec.definition.versionnotes.UpdateVersionNotesRequest;
import org.txc.appsec.definition.versionnotes.VersionNotes;
import org.txc.appsec.errors.TransportException;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VersionNotesHandlerTest {

    private static final String NOTES_PATH = "/appsec/v1/configs/43253/versions/15/version-notes";

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
    void getVersionNotes() throws Exception {
        api.stub("GET", NOTES_PATH, 200, "{\"notes\":\"Initial WAF rollout\"}");

        VersionNotes notes = sdk.versionNotes().getVersionNotes(RequestContext.background(),
                new GetVersionNotesRequest(43253, 15));

        assertThat(notes.getNotes()).isEqualTo("Initial WAF rollout");
    }

    @Test
    void updateVersionNotesSendsOnlyNotes() throws Exception {
        api.stub("PUT", NOTES_PATH, 200, "{\"notes\":\"Tightened XSS\"}");

        VersionNotes notes = sdk.versionNotes().updateVersionNotes(RequestContext.background(),
                new UpdateVersionNotesRequest(43253, 15, "Tightened XSS"));

        assertThat(notes.getNotes()).isEqualTo("Tightened XSS");
        assertThat(api.lastRequest().bodyAsString()).isEqualTo("{\"notes\":\"Tightened XSS\"}");
    }

    @Test
    void cancelledContextSendsNothing() {
        api.stub("GET", NOTES_PATH, 200, "{\"notes\":\"unused\"}");
        RequestContext context = RequestContext.background();
        context.cancel();

        assertThatThrownBy(() -> sdk.versionNotes().getVersionNotes(context, new GetVersionNotesRequest(43253, 15)))
                .isInstanceOf(TransportException.class);
        assertThat(api.requests()).isEmpty();
    }

    @Test
    void cancelDuringCallAbortsExchange() {
        api.stubDelayed("GET", NOTES_PATH, Duration.ofSeconds(10), 200, "{\"notes\":\"too late\"}");
        RequestContext context = RequestContext.background();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(context::cancel, 300, TimeUnit.MILLISECONDS);
            long start = System.nanoTime();

            assertThatThrownBy(() -> sdk.versionNotes().getVersionNotes(context, new GetVersionNotesRequest(43253, 15)))
                    .isInstanceOf(TransportException.class)
                    .hasCauseInstanceOf(ContextCancelledException.class)
                    .hasMessage("GetVersionNotes request failed: context canceled");
            assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void deadlineDuringCallAbortsExchange() {
        api.stubDelayed("GET", NOTES_PATH, Duration.ofSeconds(10), 200, "{\"notes\":\"too late\"}");
        RequestContext context = RequestContext.withTimeout(Duration.ofMillis(400));
        long start = System.nanoTime();

        assertThatThrownBy(() -> sdk.versionNotes().getVersionNotes(context, new GetVersionNotesRequest(43253, 15)))
                .isInstanceOf(TransportException.class)
                .hasCauseInstanceOf(ContextCancelledException.class)
                .hasMessage("GetVersionNotes request failed: context deadline exceeded");
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
    }
}
