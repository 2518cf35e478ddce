package com.musicgraph.harvester.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.musicgraph.harvester.HarvesterConfig;
import com.musicgraph.harvester.JsonMappers;
import com.musicgraph.harvester.cache.CacheServiceInterface;
import com.musicgraph.harvester.error.CacheException;
import com.musicgraph.harvester.error.NetworkException;
import com.musicgraph.harvester.error.OperationCancelledException;
import com.musicgraph.harvester.error.ServiceException;
import com.musicgraph.harvester.model.Artist;
import com.musicgraph.harvester.model.Quality;
import com.musicgraph.harvester.model.Track;
import com.musicgraph.harvester.model.YearRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Catalog client speaking JSON over HTTP.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@code GET /artists/{id}}: artist lookup, 404 maps to empty.</li>
 *   <li>{@code GET /artists/{id}/similar?limit=n}: similar list; score of the i-th of n results is {@code 1 - i/n}.
 *       Raw responses are cached for 24 hours.</li>
 *   <li>{@code GET /artists/{id}/tracks?page=p&page_size=s}: paginated listing in popularity order,
 *       stopping as soon as {@code maxTracks} tracks are collected.</li>
 *   <li>{@code GET /artists/{id}/albums}: release years for the year probe; results cached for 1 hour.</li>
 *   <li>{@code GET /tracks/{id}/download-info}: media URLs per codec and bitrate.</li>
 * </ul>
 * <p>
 * Error Handling: I/O failures become {@link NetworkException}, non-2xx statuses other than 404
 * become {@link ServiceException}. Cache failures are logged and ignored.
 *
 * @author Music Graph Harvester Team
 * @since 1.0
 */
public class HttpCatalogService implements CatalogServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(HttpCatalogService.class);

    static final long SIMILAR_CACHE_TTL = Duration.ofHours(24).toSeconds();
    static final long YEAR_CHECK_CACHE_TTL = Duration.ofHours(1).toSeconds();
    private static final int PAGE_SIZE = 100;
    private static final int MEDIUM_BITRATE_CEILING = 192;

    private final String baseUrl;
    private final String token;
    private final Duration timeout;
    private final CacheServiceInterface cache;
    private final HttpClient client;
    private final ObjectMapper mapper = JsonMappers.shared();

    public HttpCatalogService(HarvesterConfig config, CacheServiceInterface cache) {
        this(config.catalogBaseUrl(), config.catalogToken(), Duration.ofSeconds(config.catalogTimeoutSeconds()), cache);
    }

    /**
     * @param baseUrl API root, e.g. {@code http://localhost:8080/api}
     * @param token bearer token, blank for none
     * @param timeout per-request timeout
     * @param cache cache for similar lists and probe results, may be null
     */
    public HttpCatalogService(String baseUrl, String token, Duration timeout, CacheServiceInterface cache) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.token = token;
        this.timeout = timeout;
        this.cache = cache;
        this.client = HttpClient.newBuilder().connectTimeout(timeout).followRedirects(HttpClient.Redirect.NORMAL).build();
    }

    @Override
    public Optional<Artist> getArtist(String artistId) {
        return fetch("/artists/" + encode(artistId))
            .map(body -> parse(body, CatalogPayloads.ArtistPayload.class).toArtist(null));
    }

    @Override
    public List<Artist> getSimilarArtists(String artistId, int limit) {
        String cacheKey = "similar_artists:" + artistId + ":" + limit;
        String body = cacheGet(cacheKey).orElse(null);
        if (body == null) {
            Optional<String> fetched = fetch("/artists/" + encode(artistId) + "/similar?limit=" + limit);
            if (fetched.isEmpty()) {
                logger.debug("No similar list for artist {}", artistId);
                return List.of();
            }
            body = fetched.get();
            cacheSet(cacheKey, body, SIMILAR_CACHE_TTL);
        } else {
            logger.debug("Cache hit for {}", cacheKey);
        }
        List<CatalogPayloads.ArtistPayload> raw = parse(body, CatalogPayloads.SimilarPayload.class).artistsOrEmpty();
        int n = raw.size();
        List<Artist> artists = new ArrayList<>();
        for (int i = 0; i < n && artists.size() < limit; i++) {
            CatalogPayloads.ArtistPayload payload = raw.get(i);
            if (payload == null || payload.id() == null) continue;
            artists.add(payload.toArtist(1.0 - (double) i / n));
        }
        return artists;
    }

    @Override
    public List<Track> getArtistTracks(String artistId, Integer maxTracks) {
        List<Track> tracks = new ArrayList<>();
        int pageSize = maxTracks == null ? PAGE_SIZE : Math.max(1, Math.min(PAGE_SIZE, maxTracks));
        int page = 0;
        while (true) {
            Optional<String> body = fetch("/artists/" + encode(artistId) + "/tracks?page=" + page + "&page_size=" + pageSize);
            if (body.isEmpty()) break;
            CatalogPayloads.TrackPagePayload payload = parse(body.get(), CatalogPayloads.TrackPagePayload.class);
            List<CatalogPayloads.TrackPayload> items = payload.tracksOrEmpty();
            for (CatalogPayloads.TrackPayload item : items) {
                if (item == null || item.id() == null) continue;
                tracks.add(item.toTrack(Quality.HIGH));
                if (maxTracks != null && tracks.size() >= maxTracks) {
                    logger.debug("Collected {} tracks for artist {}, stopping pagination", tracks.size(), artistId);
                    return tracks;
                }
            }
            boolean lastPage = items.size() < pageSize
                || (payload.total() != null && (page + 1) * pageSize >= payload.total());
            if (lastPage) break;
            page++;
        }
        return tracks;
    }

    @Override
    public boolean hasContentInYears(String artistId, YearRange years) {
        String cacheKey = "year_check:" + artistId + ":" + years;
        Optional<String> cached = cacheGet(cacheKey);
        if (cached.isPresent()) {
            return Boolean.parseBoolean(cached.get());
        }
        Optional<String> body = fetch("/artists/" + encode(artistId) + "/albums");
        boolean found = body.isPresent() && parse(body.get(), CatalogPayloads.AlbumsPayload.class).albumsOrEmpty().stream()
            .anyMatch(album -> album != null && years.contains(album.year()));
        cacheSet(cacheKey, Boolean.toString(found), YEAR_CHECK_CACHE_TTL);
        return found;
    }

    @Override
    public Optional<String> getTrackDownloadUrl(Track track) {
        Optional<String> body = fetch("/tracks/" + encode(track.id()) + "/download-info");
        if (body.isEmpty()) return Optional.empty();
        List<CatalogPayloads.DownloadOptionPayload> options = new ArrayList<>();
        for (CatalogPayloads.DownloadOptionPayload option : parse(body.get(), CatalogPayloads.DownloadInfoPayload.class).optionsOrEmpty()) {
            if (option != null && option.url() != null && !option.url().isBlank()) options.add(option);
        }
        return selectForQuality(options, track.quality()).map(CatalogPayloads.DownloadOptionPayload::url);
    }

    /**
     * Picks a download option for a tier: the highest bitrate for HIGH, the highest bitrate not above
     * 192 kbps for MEDIUM, the lowest bitrate for LOW.
     */
    static Optional<CatalogPayloads.DownloadOptionPayload> selectForQuality(
            List<CatalogPayloads.DownloadOptionPayload> options, Quality quality) {
        if (options.isEmpty()) return Optional.empty();
        List<CatalogPayloads.DownloadOptionPayload> sorted = new ArrayList<>(options);
        sorted.sort(Comparator.comparingInt(CatalogPayloads.DownloadOptionPayload::bitrateKbps).reversed());
        switch (quality) {
            case LOW:
                return Optional.of(sorted.get(sorted.size() - 1));
            case MEDIUM:
                return sorted.stream()
                    .filter(o -> o.bitrateKbps() <= MEDIUM_BITRATE_CEILING)
                    .findFirst()
                    .or(() -> Optional.of(sorted.get(sorted.size() - 1)));
            default:
                return Optional.of(sorted.get(0));
        }
    }

    private Optional<String> fetch(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path))
            .timeout(timeout)
            .header("Accept", "application/json")
            .header("User-Agent", "SimilarArtistHarvester/1.0");
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        HttpResponse<String> response;
        try {
            response = client.send(builder.GET().build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new NetworkException("Catalog request failed: " + path + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted during catalog request " + path);
        }
        int status = response.statusCode();
        if (status == 404) {
            return Optional.empty();
        }
        if (status < 200 || status >= 300) {
            throw new ServiceException("Catalog returned HTTP " + status + " for " + path, "catalog");
        }
        return Optional.of(response.body());
    }

    private <T> T parse(String body, Class<T> type) {
        try {
            return mapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ServiceException("Malformed catalog response: " + e.getOriginalMessage(), "catalog", e);
        }
    }

    private Optional<String> cacheGet(String key) {
        if (cache == null) return Optional.empty();
        try {
            return cache.get(key);
        } catch (CacheException e) {
            logger.warn("Cache read failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void cacheSet(String key, String value, long ttlSeconds) {
        if (cache == null) return;
        try {
            cache.set(key, value, ttlSeconds);
        } catch (CacheException e) {
            logger.warn("Cache write failed for {}: {}", key, e.getMessage());
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
