package com.musicgraph.harvester.download;

import com.musicgraph.harvester.FakeCatalogService;
import com.musicgraph.harvester.model.Quality;
import com.musicgraph.harvester.model.Track;
import org.junit.jupiter.api.*;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CanonicalFileNamerTest {

    @Test
    void testNameIsDerivedFromIdsAndYear() {
        CanonicalFileNamer namer = new CanonicalFileNamer(Paths.get("songs"));
        Track track = FakeCatalogService.track("t1", "a9", 1999);

        Path path = namer.canonicalPath(track, FakeCatalogService.artist("other", null, 1));

        assertEquals(Paths.get("songs", "AIDa9-TIDt1-Y1999.mp3"), path);
    }

    @Test
    void testNameIgnoresRequestedQuality() {
        Track track = FakeCatalogService.track("t1", "a9", 1999);

        assertEquals(CanonicalFileNamer.canonicalName(track, null),
            CanonicalFileNamer.canonicalName(track.withQuality(Quality.LOW), null));
    }

    @Test
    void testFallbacksForMissingArtist() {
        Track anonymous = new Track("t2", "Song", List.of(), List.of(), null, null, null, 0, false, List.of(), null);

        assertEquals("AIDunknown-TIDt2.mp3", CanonicalFileNamer.canonicalName(anonymous, null));
        assertEquals("AIDhint-TIDt2.mp3", CanonicalFileNamer.canonicalName(anonymous, FakeCatalogService.artist("hint", null, 1)));
    }

    @Test
    void testUnsafeIdsAreSanitized() {
        Track track = FakeCatalogService.track("t/3", "a:1", null);

        String name = CanonicalFileNamer.canonicalName(track, null);

        assertFalse(name.contains("/"));
        assertFalse(name.contains(":"));
    }
}
