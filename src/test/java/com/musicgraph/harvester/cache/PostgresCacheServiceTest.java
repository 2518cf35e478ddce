package com.musicgraph.harvester.cache;

import com.musicgraph.harvester.MutableClock;
import com.musicgraph.harvester.error.CacheException;
import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class PostgresCacheServiceTest {
    private static EmbeddedPostgres postgres;

    @BeforeAll
    static void startDatabase(@TempDir Path dataDir) {
        try {
            postgres = PostgresCacheService.startEmbedded(dataDir.resolve("pgdata").toString(), 0);
        } catch (CacheException e) {
            postgres = null;
        }
        Assumptions.assumeTrue(postgres != null, "embedded PostgreSQL cannot run in this environment");
    }

    @AfterAll
    static void stopDatabase() throws IOException {
        if (postgres != null) postgres.close();
    }

    private PostgresCacheService service(MutableClock clock) {
        PostgresCacheService service = new PostgresCacheService(
            "jdbc:postgresql://localhost:" + postgres.getPort() + "/postgres", "postgres", "postgres", clock);
        service.createTables();
        service.clear();
        return service;
    }

    @Test
    void testCreateTablesIsIdempotent() {
        PostgresCacheService service = service(new MutableClock());
        assertDoesNotThrow(service::createTables);
    }

    @Test
    void testUpsertAndExpiry() {
        MutableClock clock = new MutableClock();
        PostgresCacheService service = service(clock);
        service.set("k", "v1", 60);
        service.set("k", "v2", 60);
        assertEquals(Optional.of("v2"), service.get("k"));
        clock.advance(Duration.ofSeconds(61));
        assertEquals(Optional.empty(), service.get("k"));
        assertFalse(service.delete("k"), "expired row was deleted on read");
    }

    @Test
    void testPurgeExpired() {
        MutableClock clock = new MutableClock();
        PostgresCacheService service = service(clock);
        service.set("short", "1", 5);
        service.set("long", "2", 500);
        clock.advance(Duration.ofSeconds(10));
        assertEquals(1, service.purgeExpired());
        assertTrue(service.exists("long"));
    }

    @Test
    void testUnreachableDatabaseRaisesCacheException() {
        PostgresCacheService unreachable = new PostgresCacheService("jdbc:postgresql://localhost:1/none", "x", "y");
        assertThrows(CacheException.class, () -> unreachable.get("k"));
    }
}
