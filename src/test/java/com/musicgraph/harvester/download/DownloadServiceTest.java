package com.musicgraph.harvester.download;

import com.musicgraph.harvester.FakeCatalogService;
import com.musicgraph.harvester.HarvesterConfig;
import com.musicgraph.harvester.MutableClock;
import com.musicgraph.harvester.cache.InMemoryCacheService;
import com.musicgraph.harvester.discovery.CancellationSignal;
import com.musicgraph.harvester.error.DownloadException;
import com.musicgraph.harvester.error.FileStorageException;
import com.musicgraph.harvester.error.NetworkException;
import com.musicgraph.harvester.model.Artist;
import com.musicgraph.harvester.model.DownloadOutcome;
import com.musicgraph.harvester.model.DownloadRequest;
import com.musicgraph.harvester.model.ProgressType;
import com.musicgraph.harvester.model.ProgressUpdate;
import com.musicgraph.harvester.model.Track;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class DownloadServiceTest {

    @TempDir
    Path tempDir;

    private FakeCatalogService catalog;
    private MutableClock clock;
    private InMemoryCacheService cache;
    private FakeTransport transport;
    private Artist artist;

    @BeforeEach
    void setUp() {
        catalog = new FakeCatalogService().addArtists("a1");
        clock = new MutableClock();
        cache = new InMemoryCacheService(clock, Duration.ofMinutes(5));
        transport = new FakeTransport();
        artist = FakeCatalogService.artist("a1", "US", 10);
    }

    private DownloadService service() {
        return service(HarvesterConfig.builder().songsCacheDir(tempDir.resolve("cache")).build());
    }

    private DownloadService service(HarvesterConfig config) {
        return new DownloadService(catalog, cache, transport, config);
    }

    private Track servedTrack(String id, String payload) {
        catalog.downloadUrl(id, "http://media/" + id);
        transport.serve("http://media/" + id, payload);
        return FakeCatalogService.track(id, "a1", 2005);
    }

    @Test
    void testFetchLinksCanonicalFileToEveryTarget() throws IOException {
        DownloadService service = service();
        Track track = servedTrack("t1", "audio-bytes");
        Path first = tempDir.resolve("out/first/song.mp3");
        Path second = tempDir.resolve("out/second/song.mp3");

        assertTrue(service.fetch(track, first, artist));
        assertTrue(service.fetch(track, second, artist));

        Path canonical = tempDir.resolve("cache/AIDa1-TIDt1-Y2005.mp3");
        assertTrue(Files.isRegularFile(canonical));
        assertTrue(Files.isSameFile(canonical, first));
        assertTrue(Files.isSameFile(canonical, second));
        assertEquals("audio-bytes", Files.readString(second));
        assertEquals(1, transport.opens.get(), "payload should be fetched once");
        assertEquals(1, catalog.urlResolutions.get(), "second fetch must not resolve the URL again");
        assertEquals(canonical.toString(), cache.get("track:t1").orElseThrow());

        Files.delete(first);
        assertEquals("audio-bytes", Files.readString(second), "other links keep the content");
        assertEquals("audio-bytes", Files.readString(canonical));
    }

    @Test
    void testSameTrackSharesCanonicalFileAcrossExtensions() throws IOException {
        DownloadService service = service();
        Track track = servedTrack("t9", "audio-bytes");
        Path mp3 = tempDir.resolve("out/a/song.mp3");
        Path m4a = tempDir.resolve("out/b/song.m4a");

        assertTrue(service.fetch(track, mp3, artist));
        assertTrue(service.fetch(track, m4a, artist));

        assertTrue(Files.isSameFile(mp3, m4a));
        assertEquals(1, transport.opens.get());
        assertTrue(Files.isRegularFile(tempDir.resolve("cache/AIDa1-TIDt9-Y2005.mp3")));
        assertFalse(Files.exists(tempDir.resolve("cache/AIDa1-TIDt9-Y2005.m4a")));
    }

    @Test
    void testTrackLockIsReleasedAfterFetch() throws IOException {
        DownloadService service = service();
        Track track = servedTrack("t8", "audio-bytes");

        assertTrue(service.fetch(track, tempDir.resolve("out/t8.mp3"), artist));
        assertTrue(service.fetch(track, tempDir.resolve("out/t8-again.mp3"), artist));

        assertEquals(0, service.heldTrackLocks(), "idle tracks keep no lock");
    }

    @Test
    void testConcurrentFetchesOfOneTrackDownloadOnce() throws Exception {
        DownloadService service = service();
        Track track = servedTrack("t7", "audio-bytes");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                Path target = tempDir.resolve("out/" + i + "/song.mp3");
                results.add(pool.submit(() -> service.fetch(track, target, artist)));
            }
            for (Future<Boolean> result : results) {
                assertTrue(result.get(10, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, transport.opens.get());
        assertEquals(0, service.heldTrackLocks());
    }

    @Test
    void testCanonicalFileOnDiskIsReusedWithoutCacheEntry() throws IOException {
        Path canonical = tempDir.resolve("cache/AIDa1-TIDt2-Y2005.mp3");
        Files.createDirectories(canonical.getParent());
        Files.writeString(canonical, "already-here");

        DownloadService service = service();
        Path target = tempDir.resolve("out/t2.mp3");
        assertTrue(service.fetch(FakeCatalogService.track("t2", "a1", 2005), target, artist));

        assertEquals(0, catalog.urlResolutions.get());
        assertEquals(0, transport.opens.get());
        assertEquals("already-here", Files.readString(target));
        assertTrue(cache.exists("track:t2"));
    }

    @Test
    void testStaleCacheEntryIsDroppedAndTrackDownloadedAgain() throws IOException {
        cache.set("track:t3", tempDir.resolve("gone.mp3").toString(), 3600);
        DownloadService service = service();
        Track track = servedTrack("t3", "fresh");
        Path target = tempDir.resolve("out/t3.mp3");

        assertTrue(service.fetch(track, target, artist));

        assertEquals("fresh", Files.readString(target));
        assertEquals(tempDir.resolve("cache/AIDa1-TIDt3-Y2005.mp3").toString(), cache.get("track:t3").orElseThrow());
    }

    @Test
    void testFailureIsNegativelyCachedForFiveMinutes() {
        DownloadService service = service();
        catalog.downloadUrl("t4", "http://media/t4");
        transport.fail("http://media/t4");
        Track track = FakeCatalogService.track("t4", "a1", 2005);
        Path target = tempDir.resolve("out/t4.mp3");

        assertThrows(NetworkException.class, () -> service.fetch(track, target, artist));
        assertTrue(cache.exists("failed_track:t4"));
        assertEquals(1, transport.opens.get());

        assertFalse(service.fetch(track, target, artist));
        assertEquals(1, transport.opens.get(), "recent failure must skip the network");
        assertEquals(1, catalog.urlResolutions.get());

        clock.advance(Duration.ofSeconds(301));
        transport.serve("http://media/t4", "recovered");
        assertTrue(service.fetch(track, target, artist));
        assertEquals(2, transport.opens.get());
    }

    @Test
    void testMissingDownloadUrlIsDownloadFailure() {
        DownloadService service = service();
        Track track = FakeCatalogService.track("t5", "a1", null);

        DownloadException e = assertThrows(DownloadException.class,
            () -> service.fetch(track, tempDir.resolve("out/t5.mp3"), artist));
        assertTrue(e.getMessage().contains("t5"));
        assertTrue(cache.exists("failed_track:t5"));
    }

    @Test
    void testDeclaredOversizePayloadIsRejected() throws IOException {
        DownloadService service = service(HarvesterConfig.builder()
            .songsCacheDir(tempDir.resolve("cache"))
            .maxFileSizeMb(1)
            .build());
        catalog.downloadUrl("t6", "http://media/t6");
        transport.serve("http://media/t6", new MediaTransport.MediaResponse(2L * 1024 * 1024,
            new ByteArrayInputStream(new byte[16])));

        assertThrows(DownloadException.class,
            () -> service.fetch(FakeCatalogService.track("t6", "a1", null), tempDir.resolve("out/t6.mp3"), artist));
        assertTrue(cache.exists("failed_track:t6"));
        assertNoFilesIn(tempDir.resolve("cache"));
    }

    @Test
    void testStreamedOversizePayloadLeavesNoPartialFile() throws IOException {
        DownloadService service = service(HarvesterConfig.builder()
            .songsCacheDir(tempDir.resolve("cache"))
            .maxFileSizeMb(1)
            .build());
        catalog.downloadUrl("t7", "http://media/t7");
        transport.serve("http://media/t7", new MediaTransport.MediaResponse(-1,
            new ByteArrayInputStream(new byte[2 * 1024 * 1024])));

        assertThrows(DownloadException.class,
            () -> service.fetch(FakeCatalogService.track("t7", "a1", null), tempDir.resolve("out/t7.mp3"), artist));
        assertNoFilesIn(tempDir.resolve("cache"));
        assertFalse(Files.exists(tempDir.resolve("out/t7.mp3")));
    }

    @Test
    void testEmptyPayloadIsRejected() {
        DownloadService service = service();
        Track track = servedTrack("t8", "");

        assertThrows(DownloadException.class, () -> service.fetch(track, tempDir.resolve("out/t8.mp3"), artist));
        assertFalse(Files.exists(tempDir.resolve("cache/AIDa1-TIDt8-Y2005.mp3")));
    }

    @Test
    void testFilesystemFailureIsNotNegativelyCached() throws IOException {
        Path blocked = tempDir.resolve("blocked");
        Files.writeString(blocked, "not a directory");
        DownloadService service = service(HarvesterConfig.builder().songsCacheDir(blocked.resolve("cache")).build());
        Track track = servedTrack("t9", "bytes");

        assertThrows(FileStorageException.class, () -> service.fetch(track, tempDir.resolve("out/t9.mp3"), artist));
        assertFalse(cache.exists("failed_track:t9"));
    }

    @Test
    void testTrackWithoutArtistsUsesHintForCanonicalName() throws IOException {
        DownloadService service = service();
        catalog.downloadUrl("t10", "http://media/t10");
        transport.serve("http://media/t10", "x");
        Track anonymous = new Track("t10", "Song", List.of(), List.of(), null, null, null, 0, false, List.of(), null);

        assertTrue(service.fetch(anonymous, tempDir.resolve("out/t10.flac"), artist));

        assertTrue(Files.isRegularFile(tempDir.resolve("cache/AIDa1-TIDt10.mp3")));
    }

    @Test
    void testFetchAllReportsOutcomesAndProgress() {
        DownloadService service = service();
        List<DownloadRequest> requests = new ArrayList<>();
        for (int i = 1; i <= 4; i++) {
            Track track = servedTrack("ok" + i, "payload-" + i);
            requests.add(new DownloadRequest(track, tempDir.resolve("out/ok" + i + ".mp3"), artist));
        }
        catalog.downloadUrl("bad", "http://media/bad");
        transport.fail("http://media/bad");
        requests.add(new DownloadRequest(FakeCatalogService.track("bad", "a1", null), tempDir.resolve("out/bad.mp3"), artist));

        List<ProgressUpdate> updates = Collections.synchronizedList(new ArrayList<>());
        List<DownloadOutcome> outcomes = service.fetchAll(requests, updates::add, new CancellationSignal());

        assertEquals(5, outcomes.size());
        assertEquals(4, outcomes.stream().filter(DownloadOutcome::success).count());
        DownloadOutcome failed = outcomes.stream().filter(o -> !o.success()).findFirst().orElseThrow();
        assertEquals("bad", failed.track().id());
        assertNotNull(failed.error());
        for (DownloadOutcome outcome : outcomes) {
            if (outcome.success()) {
                assertEquals(outcome.request().outputPath(), outcome.track().filePath());
                assertTrue(outcome.track().fileSize() > 0);
            }
        }
        assertEquals(5, updates.size());
        assertTrue(updates.stream().allMatch(u -> u.type() == ProgressType.DOWNLOAD));
        assertEquals(5, updates.get(4).itemsCompleted());
    }

    @Test
    void testFetchAllSkipsEverythingOnceCancelled() {
        DownloadService service = service();
        Track track = servedTrack("c1", "bytes");
        CancellationSignal cancellation = new CancellationSignal();
        cancellation.cancel();

        List<DownloadOutcome> outcomes = service.fetchAll(
            List.of(new DownloadRequest(track, tempDir.resolve("out/c1.mp3"), artist)), u -> { }, cancellation);

        assertEquals(1, outcomes.size());
        assertFalse(outcomes.get(0).success());
        assertEquals("Cancelled", outcomes.get(0).error());
        assertEquals(0, transport.opens.get());
    }

    @Test
    void testFetchAllWithNoRequests() {
        assertTrue(service().fetchAll(List.of(), u -> { }, new CancellationSignal()).isEmpty());
    }

    private static void assertNoFilesIn(Path dir) throws IOException {
        if (!Files.exists(dir)) return;
        try (var files = Files.list(dir)) {
            assertEquals(0, files.count());
        }
    }

    /**
     * Serves canned payloads by URL and counts how often the network was touched.
     */
    static class FakeTransport implements MediaTransport {
        private final Map<String, MediaResponse> responses = new ConcurrentHashMap<>();
        private final Map<String, String> payloads = new ConcurrentHashMap<>();
        final AtomicInteger opens = new AtomicInteger();

        void serve(String url, String payload) {
            responses.remove(url);
            payloads.put(url, payload);
        }

        void serve(String url, MediaResponse response) {
            payloads.remove(url);
            responses.put(url, response);
        }

        void fail(String url) {
            payloads.remove(url);
            responses.remove(url);
        }

        @Override
        public MediaResponse open(String url) throws IOException {
            opens.incrementAndGet();
            MediaResponse canned = responses.get(url);
            if (canned != null) return canned;
            String payload = payloads.get(url);
            if (payload == null) throw new IOException("connection reset");
            byte[] bytes = payload.getBytes(StandardCharsets.UTF_8);
            return new MediaResponse(bytes.length, new ByteArrayInputStream(bytes));
        }
    }
}
