package com.musicgraph.harvester;

import com.musicgraph.harvester.cache.InMemoryCacheService;
import com.musicgraph.harvester.discovery.CancellationSignal;
import com.musicgraph.harvester.discovery.DiscoveryService;
import com.musicgraph.harvester.discovery.ProgressListener;
import com.musicgraph.harvester.discovery.YearContentProbe;
import com.musicgraph.harvester.download.DownloadService;
import com.musicgraph.harvester.download.MediaTransport;
import com.musicgraph.harvester.error.NotFoundException;
import com.musicgraph.harvester.error.OperationCancelledException;
import com.musicgraph.harvester.model.Artist;
import com.musicgraph.harvester.model.DiscoveryOptions;
import com.musicgraph.harvester.model.DiscoveryResult;
import com.musicgraph.harvester.model.ProgressCheckpoint;
import com.musicgraph.harvester.model.ProgressType;
import com.musicgraph.harvester.model.ProgressUpdate;
import com.musicgraph.harvester.model.RunStatistics;
import com.musicgraph.harvester.model.Track;
import com.musicgraph.harvester.progress.ProgressService;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class HarvestRunnerTest {

    @TempDir
    Path tempDir;

    private FakeCatalogService catalog;
    private YearContentProbe probe;
    private InMemoryCacheService cache;
    private ProgressService progress;
    private HarvestRunner runner;
    private Path outputDir;

    @BeforeEach
    void setUp() {
        catalog = new FakeCatalogService().addArtists("S", "A", "B", "T", "C");
        catalog.similar("S", "A", "B");
        catalog.similar("T", "B", "C");
        for (String id : List.of("S", "A", "B", "T", "C")) {
            String prefix = id.toLowerCase();
            List<Track> tracks = new ArrayList<>();
            for (int i = 1; i <= 3; i++) {
                tracks.add(FakeCatalogService.track(prefix + i, id, 2000 + i));
                catalog.downloadUrl(prefix + i, "http://media/" + prefix + i);
            }
            catalog.tracks(id, tracks);
        }

        probe = new YearContentProbe(catalog, 3, Duration.ofSeconds(2), Duration.ofMillis(1));
        cache = new InMemoryCacheService();
        progress = new ProgressService(cache, tempDir.resolve("progress"));
        HarvesterConfig config = HarvesterConfig.builder()
            .songsCacheDir(tempDir.resolve("songs"))
            .maxConcurrentDownloads(2)
            .build();
        MediaTransport transport = url -> {
            byte[] bytes = ("audio:" + url).getBytes(StandardCharsets.UTF_8);
            return new MediaTransport.MediaResponse(bytes.length, new ByteArrayInputStream(bytes));
        };
        runner = new HarvestRunner(catalog,
            new DiscoveryService(catalog, probe, 10, 2, 0),
            new DownloadService(catalog, cache, transport, config),
            progress,
            new CsvService(),
            new PostProcessor(new Random(1)));
        outputDir = tempDir.resolve("out");
    }

    @AfterEach
    void tearDown() {
        probe.close();
    }

    private static DiscoveryOptions options(int similar, int depth) {
        return DiscoveryOptions.builder().similarLimit(similar).maxDepth(depth).songsPerArtist(2).build();
    }

    private HarvestPlan plan(List<String> seeds, DiscoveryOptions options, String session, boolean resume) {
        return new HarvestPlan(seeds, outputDir, options, session, resume, false, false, false, null);
    }

    private static long countLines(Path file) throws IOException {
        try (Stream<String> lines = Files.lines(file)) {
            return lines.count();
        }
    }

    @Test
    void testRunDownloadsEveryDiscoveredArtist() throws IOException {
        RunStatistics stats = runner.run(plan(List.of("S"), options(2, 1), null, false), ProgressListener.NONE, new CancellationSignal());

        assertEquals(3, stats.artistsProcessed());
        assertEquals(0, stats.artistsSkipped());
        assertEquals(6, stats.tracksDownloaded());
        assertEquals(0, stats.tracksFailed());
        assertTrue(stats.totalBytes() > 0);

        Path first = outputDir.resolve("Artist_S/Artist_S_-_Song_s1_s1.mp3");
        assertEquals("audio:http://media/s1", Files.readString(first));
        assertTrue(Files.isSameFile(first, tempDir.resolve("songs/AIDS-TIDs1-Y2001.mp3")));
        assertFalse(Files.exists(outputDir.resolve("Artist_A/Artist_A_-_Song_a3_a3.mp3")), "only two songs per artist");
        assertEquals(4, countLines(outputDir.resolve(HarvestRunner.ARTISTS_CSV)));
        assertEquals(7, countLines(outputDir.resolve(HarvestRunner.REPORT_CSV)));
    }

    @Test
    void testSessionCheckpointsEveryArtistAndCompletes() {
        runner.run(plan(List.of("S"), options(2, 1), "nightly", false), ProgressListener.NONE, new CancellationSignal());

        ProgressCheckpoint checkpoint = new ProgressService(null, tempDir.resolve("progress"))
            .loadCheckpoint("nightly").orElseThrow();
        assertEquals(List.of("S", "A", "B"), new ArrayList<>(checkpoint.getProcessedArtistIds()));
        assertEquals(3, checkpoint.getTotalArtists());
        assertEquals(2, checkpoint.getLastArtistIndex());
        assertEquals(6, checkpoint.getTracksDownloaded());
        assertTrue(checkpoint.isComplete());
        assertEquals(ProgressService.commandSignature(List.of("S"), 2, 1, 2), checkpoint.getCommandHash());
    }

    @Test
    void testResumeSkipsProcessedArtists() {
        progress.createCheckpoint("nightly", 3, ProgressService.commandSignature(List.of("S"), 2, 1, 2));
        progress.saveProgress("nightly", "S", 0, 2, 0);

        RunStatistics stats = runner.run(plan(List.of("S"), options(2, 1), "nightly", true), ProgressListener.NONE, new CancellationSignal());

        assertEquals(2, stats.artistsProcessed());
        assertEquals(1, stats.artistsSkipped());
        assertEquals(4, stats.tracksDownloaded());
        assertFalse(Files.exists(outputDir.resolve("Artist_S")));
        assertTrue(Files.isDirectory(outputDir.resolve("Artist_B")));
        assertEquals(6, progress.currentCheckpoint().orElseThrow().getTracksDownloaded());
    }

    @Test
    void testResumeWithDifferentParametersIsRejected() {
        progress.createCheckpoint("nightly", 3, "somethingelse");
        List<ProgressUpdate> updates = new CopyOnWriteArrayList<>();

        assertThrows(IllegalStateException.class,
            () -> runner.run(plan(List.of("S"), options(2, 1), "nightly", true), updates::add, new CancellationSignal()));
        assertEquals(ProgressType.ERROR, updates.get(updates.size() - 1).type());
        assertFalse(Files.exists(outputDir.resolve("Artist_S")));
    }

    @Test
    void testResumeWithoutCheckpointStartsFresh() {
        RunStatistics stats = runner.run(plan(List.of("S"), options(2, 1), "fresh", true), ProgressListener.NONE, new CancellationSignal());

        assertEquals(3, stats.artistsProcessed());
        assertTrue(progress.currentCheckpoint().orElseThrow().isComplete());
    }

    @Test
    void testExistingSessionIsNotOverwrittenWithoutResumeOrReset() {
        String signature = ProgressService.commandSignature(List.of("S"), 2, 1, 2);
        progress.createCheckpoint("nightly", 3, signature);
        progress.saveProgress("nightly", "S", 0);
        progress.saveProgress("nightly", "A", 1);

        assertThrows(IllegalStateException.class,
            () -> runner.run(plan(List.of("S"), options(2, 1), "nightly", false), ProgressListener.NONE, new CancellationSignal()));

        ProgressCheckpoint stored = new ProgressService(cache, tempDir.resolve("progress")).loadCheckpoint("nightly").orElseThrow();
        assertEquals(2, stored.getProcessedArtistIds().size());
        assertEquals(signature, stored.getCommandHash());
        assertFalse(Files.exists(outputDir.resolve("Artist_B")));
    }

    @Test
    void testResetProgressStartsOver() {
        progress.createCheckpoint("nightly", 3, "old");
        progress.saveProgress("nightly", "S", 0);
        HarvestPlan plan = new HarvestPlan(List.of("S"), outputDir, options(2, 1), "nightly", false, true, false, false, null);

        RunStatistics stats = runner.run(plan, ProgressListener.NONE, new CancellationSignal());

        assertEquals(3, stats.artistsProcessed());
        assertEquals(ProgressService.commandSignature(List.of("S"), 2, 1, 2),
            progress.currentCheckpoint().orElseThrow().getCommandHash());
    }

    @Test
    void testFailuresAreReportedAndRunContinues() throws IOException {
        catalog.failTrackListing("B");
        catalog.downloadUrl("a2", null);

        RunStatistics stats = runner.run(plan(List.of("S"), options(2, 1), null, false), ProgressListener.NONE, new CancellationSignal());

        assertEquals(3, stats.artistsProcessed());
        assertEquals(3, stats.tracksDownloaded());
        assertEquals(1, stats.tracksFailed());
        String report = Files.readString(outputDir.resolve(HarvestRunner.REPORT_CSV));
        assertTrue(report.contains("FAILED"));
        assertTrue(report.contains("No download URL for track a2"));
    }

    @Test
    void testCancellationKeepsUnfinishedArtistPending() {
        CancellationSignal cancellation = new CancellationSignal();
        ProgressListener cancelOnDownload = update -> {
            if (update.type() == ProgressType.DOWNLOAD) cancellation.cancel();
        };

        assertThrows(OperationCancelledException.class,
            () -> runner.run(plan(List.of("S"), options(2, 1), "nightly", false), cancelOnDownload, cancellation));

        ProgressCheckpoint checkpoint = progress.loadCheckpoint("nightly").orElseThrow();
        assertTrue(checkpoint.getProcessedArtistIds().isEmpty());
        assertFalse(checkpoint.isComplete());
        assertFalse(Files.exists(outputDir.resolve("Artist_A")));
    }

    @Test
    void testUnknownSeedFails() {
        assertThrows(NotFoundException.class,
            () -> runner.run(plan(List.of("missing"), options(2, 1), null, false), ProgressListener.NONE, new CancellationSignal()));
    }

    @Test
    void testFlatModeMergesSeeds() throws IOException {
        RunStatistics stats = runner.run(plan(List.of("S", "T"), options(2, 0), null, false), ProgressListener.NONE, new CancellationSignal());

        assertEquals(5, stats.artistsProcessed());
        assertEquals(6, countLines(outputDir.resolve(HarvestRunner.ARTISTS_CSV)));
        assertTrue(Files.isDirectory(outputDir.resolve("Artist_C")));
    }

    @Test
    void testSeedsOnlyWhenNoSimilarRequested() {
        RunStatistics stats = runner.run(plan(List.of("S"), options(0, 0), null, false), ProgressListener.NONE, new CancellationSignal());

        assertEquals(1, stats.artistsProcessed());
        assertEquals(2, stats.tracksDownloaded());
    }

    @Test
    void testShuffleZipAndTreeExport() throws IOException {
        Path tree = tempDir.resolve("tree.json");
        HarvestPlan plan = new HarvestPlan(List.of("S"), outputDir, options(2, 1), null, false, false, true, true, tree);
        List<ProgressUpdate> updates = new CopyOnWriteArrayList<>();

        runner.run(plan, updates::add, new CancellationSignal());

        List<String> names;
        try (Stream<Path> files = Files.list(outputDir)) {
            names = files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
        }
        List<String> tracks = names.stream().filter(n -> n.endsWith(".mp3")).collect(Collectors.toList());
        assertEquals(6, tracks.size());
        assertTrue(tracks.stream().allMatch(n -> n.matches("\\d{3}_.*")), names.toString());
        assertTrue(names.contains(HarvestRunner.ARTISTS_CSV));
        assertTrue(Files.isRegularFile(tempDir.resolve("out.zip")));
        assertTrue(Files.isRegularFile(tree));
        assertEquals(ProgressType.COMPLETE, updates.get(updates.size() - 1).type());
    }

    @Test
    void testMergeKeepsFirstAppearance() {
        Artist s = FakeCatalogService.artist("S", "GB", 10);
        Artist t = FakeCatalogService.artist("T", "US", 10);
        Artist shared = FakeCatalogService.artist("X", "GB", 10);
        DiscoveryResult first = new DiscoveryResult(List.of(s), List.of(s, shared.withDiscovery(1, "S")), List.of(),
            Map.of("S", List.of("X")), Set.of("GB"), 1, 1.0, Map.of(), Instant.now());
        DiscoveryResult second = new DiscoveryResult(List.of(t), List.of(t, shared.withDiscovery(1, "T")), List.of(),
            Map.of("T", List.of("X")), Set.of("US", "GB"), 1, 2.0, Map.of(), Instant.now());

        DiscoveryResult merged = HarvestRunner.merge(List.of(first, second));

        assertEquals(List.of("S", "X", "T"), merged.discoveredArtists().stream().map(Artist::id).collect(Collectors.toList()));
        assertEquals("S", merged.discoveredArtists().get(1).discoveredFrom());
        assertEquals(Set.of("S", "T"), merged.discoveryTree().keySet());
        assertEquals(2, merged.seedArtists().size());
        assertEquals(3.0, merged.discoveryTimeSeconds(), 1e-9);
    }

    @Test
    void testFileNames() {
        Artist artist = new Artist("id/1", "AC/DC: Live", null, null, 0, null);
        Track track = FakeCatalogService.track("t?1", "id/1", null);

        assertEquals("AC_DC__Live", HarvestRunner.folderName(artist));
        assertEquals("AC_DC__Live_-_Song_t_1_t_1.mp3", HarvestRunner.trackFileName(track, artist));
        assertEquals("id_1", HarvestRunner.folderName(new Artist("id/1", "  ", null, null, 0, null)));

        Artist longName = new Artist("x", "a".repeat(300), null, null, 0, null);
        String name = HarvestRunner.trackFileName(track, longName);
        assertEquals(200 + "_t_1.mp3".length(), name.length());
    }
}
