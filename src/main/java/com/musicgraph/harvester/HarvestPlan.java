package com.musicgraph.harvester;

import com.musicgraph.harvester.model.DiscoveryOptions;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Everything the command line decided for one run.
 *
 * @param seedIds seed artist ids, in the order given
 * @param outputDir directory receiving the per-artist folders (or the flat shuffled list)
 * @param options discovery and track-selection options
 * @param sessionName checkpoint session, null to run without checkpoints
 * @param resume continue the named session instead of starting it over
 * @param resetProgress delete the named session before starting
 * @param shuffle move every track to the top level with numeric prefixes
 * @param archive pack the output directory into a sibling ZIP file
 * @param treeExport file receiving the discovery tree JSON, null to skip
 */
public record HarvestPlan(
    List<String> seedIds,
    Path outputDir,
    DiscoveryOptions options,
    String sessionName,
    boolean resume,
    boolean resetProgress,
    boolean shuffle,
    boolean archive,
    Path treeExport
) {
    public HarvestPlan {
        seedIds = List.copyOf(seedIds);
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(options, "options");
        if (seedIds.isEmpty()) throw new IllegalArgumentException("At least one seed artist is required");
        if ((resume || resetProgress) && (sessionName == null || sessionName.isBlank())) {
            throw new IllegalArgumentException("--resume and --reset-progress require --session");
        }
        if (resume && resetProgress) {
            throw new IllegalArgumentException("--resume and --reset-progress are mutually exclusive");
        }
    }

    public boolean hasSession() {
        return sessionName != null && !sessionName.isBlank();
    }

    /**
     * Flat mode: one level of similar artists without year probing.
     */
    public boolean flatDiscovery() {
        return options.maxDepth() == 0 && options.similarLimit() > 0;
    }
}
