package org.txc.appsec;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.txc.appsec.client.RequestContext;
import org.txc.appsec.definition.AppSecSDK;
import org.txc.appsec.definition.AppSecSdkManager;
import org.txc.appsec.definition.attackgroup.GetAttackGroupsRequest;
import org.txc.appsec.definition.configurationclone.GetConfigurationCloneRequest;
import org.txc.appsec.definition.customdeny.GetCustomDenyListRequest;
import org.txc.appsec.definition.hostnamecoverage.GetApiHostnameCoverageOverlappingRequest;
import org.txc.appsec.definition.matchtarget.GetMatchTargetsRequest;
import org.txc.appsec.definition.reputationanalysis.GetReputationAnalysisRequest;
import org.txc.appsec.definition.reputationprofile.GetReputationProfilesRequest;
import org.txc.appsec.definition.versionnotes.GetVersionNotesRequest;
import org.txc.appsec.errors.ApiException;
import org.txc.appsec.errors.AppSecException;
import org.txc.appsec.json.JsonMappers;

import java.nio.file.Paths;
import java.util.Scanner;

public class InteractiveTester {

    static final String USAGE = String.join(System.lineSeparator(),
            "  notes <configId> <version>",
            "  attack-groups <configId> <version> <policyId> [group]",
            "  custom-deny <configId> <version> [id]",
            "  match-targets <configId> <version> [targetId]",
            "  reputation-profiles <configId> <version> [profileId]",
            "  reputation-analysis <configId> <version> <policyId>",
            "  overlap <configId> <version> [hostname]",
            "  clone <configId> <version>",
            "  help | exit");

    public static void main(String[] args) {
        System.out.println("--- AppSec SDK Interactive Tester ---");
        AppSecSDK sdk = null;

        try (Scanner consoleReader = new Scanner(System.in)) {
            // --- Step 1: Initialize the SDK ---
            while (sdk == null) {
                System.out.print("Enter the path to your .edgerc file (blank for the configured default): ");
                String edgercPath = consoleReader.nextLine().trim();
                if (edgercPath.equalsIgnoreCase("exit")) return;
                System.out.print("Section [default]: ");
                String section = consoleReader.nextLine().trim();

                try {
                    AppSecSdkManager manager = new AppSecSdkManager();
                    sdk = edgercPath.isEmpty()
                            ? manager.fromDefaultEdgerc(section)
                            : manager.fromEdgerc(Paths.get(edgercPath), section);
                    System.out.println("SDK initialized. Resources: " + sdk.getResourceNames());
                } catch (Exception e) {
                    System.out.println("ERROR: Failed to initialize SDK. Please check the path and section and try again.");
                    System.out.println("   Details: " + e.getMessage());
                }
            }

            // --- Step 2: Command loop ---
            System.out.println("\nCommands:");
            System.out.println(USAGE);
            ObjectMapper mapper = JsonMappers.newObjectMapper();

            while (true) {
                System.out.print("\nappsec> ");
                if (!consoleReader.hasNextLine()) break;
                String line = consoleReader.nextLine().trim();
                if ("exit".equalsIgnoreCase(line)) break;
                if (line.isEmpty()) continue;

                try {
                    Object result = run(sdk, line.split("\\s+"));
                    if (result == null) {
                        System.out.println(USAGE);
                    } else {
                        System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
                    }
                } catch (ApiException e) {
                    System.out.println("  -> API error (HTTP " + e.getStatusCode() + "): " + e.getError());
                } catch (AppSecException e) {
                    System.out.println("  -> ERROR: " + e.getMessage());
                } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
                    System.out.println("  -> ERROR: Invalid arguments. " + e.getMessage());
                } catch (Exception e) {
                    System.out.println("  -> ERROR: Could not print response. Details: " + e.getMessage());
                }
            }
        } finally {
            System.out.println("Exiting...");
        }
    }

    /**
     * Runs one console command.
     *
     * @return the decoded response, or {@code null} for {@code help} and unknown commands
     */
    static Object run(AppSecSDK sdk, String[] words) throws AppSecException {
        RequestContext context = RequestContext.background();
        String command = words[0].toLowerCase();
        if ("help".equals(command)) {
            return null;
        }
        int configId = Integer.parseInt(words[1]);
        int version = Integer.parseInt(words[2]);

        switch (command) {
            case "notes":
                return sdk.versionNotes().getVersionNotes(context, new GetVersionNotesRequest(configId, version));
            case "attack-groups": {
                GetAttackGroupsRequest request = new GetAttackGroupsRequest(configId, version, words[3]);
                request.setGroup(optional(words, 4));
                return sdk.attackGroups().getAttackGroups(context, request);
            }
            case "custom-deny": {
                GetCustomDenyListRequest request = new GetCustomDenyListRequest(configId, version);
                request.setId(optional(words, 3));
                return sdk.customDeny().getCustomDenyList(context, request);
            }
            case "match-targets": {
                GetMatchTargetsRequest request = new GetMatchTargetsRequest(configId, version);
                request.setTargetId(words.length > 3 ? Integer.parseInt(words[3]) : 0);
                return sdk.matchTargets().getMatchTargets(context, request);
            }
            case "reputation-profiles": {
                GetReputationProfilesRequest request = new GetReputationProfilesRequest(configId, version);
                request.setReputationProfileId(words.length > 3 ? Integer.parseInt(words[3]) : 0);
                return sdk.reputationProfiles().getReputationProfiles(context, request);
            }
            case "reputation-analysis":
                return sdk.reputationAnalysis().getReputationAnalysis(context,
                        new GetReputationAnalysisRequest(configId, version, words[3]));
            case "overlap":
                return sdk.hostnameCoverage().getApiHostnameCoverageOverlapping(context,
                        new GetApiHostnameCoverageOverlappingRequest(configId, version, optional(words, 3)));
            case "clone":
                return sdk.configurationClones().getConfigurationClone(context,
                        new GetConfigurationCloneRequest(configId, version));
            default:
                return null;
        }
    }

    private static String optional(String[] words, int index) {
        return words.length > index ? words[index] : null;
    }
}
