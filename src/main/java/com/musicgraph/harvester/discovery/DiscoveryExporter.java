package com.musicgraph.harvester.discovery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.musicgraph.harvester.JsonMappers;
import com.musicgraph.harvester.model.Artist;
import com.musicgraph.harvester.model.DiscoveryResult;
import com.musicgraph.harvester.model.DiscoveryStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes a discovery result as a JSON document with {@code metadata}, {@code stats},
 * {@code unique_artists}, {@code filtered_out_artists} and {@code discovery_tree} sections.
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public class DiscoveryExporter {
    private static final Logger logger = LoggerFactory.getLogger(DiscoveryExporter.class);

    private final ObjectMapper mapper = JsonMappers.shared();

    public ObjectNode toJson(DiscoveryResult result) {
        ObjectNode root = mapper.createObjectNode();

        ObjectNode metadata = root.putObject("metadata");
        metadata.put("timestamp", result.createdAt().toString());
        ArrayNode seeds = metadata.putArray("seed_artists");
        for (Artist seed : result.seedArtists()) {
            seeds.addObject().put("id", seed.id()).put("name", seed.name());
        }
        metadata.set("parameters", mapper.valueToTree(result.discoveryParams()));

        DiscoveryStats stats = DiscoveryStats.of(result.discoveredArtists());
        ObjectNode statsNode = root.putObject("stats");
        statsNode.put("total_artists", stats.totalArtists());
        statsNode.put("filtered_out_count", result.filteredOutArtists().size());
        statsNode.put("max_depth_reached", result.maxDepthReached());
        statsNode.put("average_track_count", stats.averageTrackCount());
        statsNode.put("total_tracks", stats.totalTracks());
        statsNode.put("discovery_time_seconds", result.discoveryTimeSeconds());
        statsNode.set("countries", mapper.valueToTree(stats.countries()));
        ObjectNode depths = statsNode.putObject("depth_distribution");
        stats.depthDistribution().forEach((depth, count) -> depths.put(String.valueOf(depth), count));

        writeArtists(root.putArray("unique_artists"), result.discoveredArtists());
        writeArtists(root.putArray("filtered_out_artists"), result.filteredOutArtists());

        ObjectNode tree = root.putObject("discovery_tree");
        for (Map.Entry<String, List<String>> entry : result.discoveryTree().entrySet()) {
            ArrayNode children = tree.putArray(entry.getKey());
            entry.getValue().forEach(children::add);
        }
        return root;
    }

    /**
     * Writes the document to {@code target}, creating parent directories.
     * @throws IOException if the file cannot be written
     */
    public void write(DiscoveryResult result, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        mapper.writeValue(target.toFile(), toJson(result));
        logger.info("Wrote discovery tree ({} artists) to {}", result.totalDiscovered(), target);
    }

    private static void writeArtists(ArrayNode array, List<Artist> artists) {
        for (Artist artist : artists) {
            ObjectNode node = array.addObject();
            node.put("id", artist.id());
            node.put("name", artist.name());
            node.put("depth", artist.depth());
            node.put("discovered_from", artist.discoveredFrom());
            node.put("country", artist.country());
            node.put("track_count", artist.trackCount());
            if (artist.similarityScore() != null) node.put("similarity_score", artist.similarityScore());
            ArrayNode genres = node.putArray("genres");
            artist.genres().forEach(genres::add);
        }
    }
}
