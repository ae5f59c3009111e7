package com.hostscout.core.service.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hostscout.core.api.ISink;
import com.hostscout.core.dedupe.DedupStore;
import com.hostscout.core.model.CanonicalEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JSON 산출물:
 * <pre>
 * { "exportedAt": "2025-03-01T21:34:00Z", "total": 2,
 *   "entities": [ {"key":"a","uri":"https://a.example.com"}, ... ] }
 * </pre>
 * 엔티티는 key 오름차순. load() 는 같은 형식을 다시 읽어 이전 결과 병합에 쓴다.
 */
public final class JsonEntitySink implements ISink {

    private static final Logger LOG = LoggerFactory.getLogger(JsonEntitySink.class);

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path path;
    private final Clock clock;

    public JsonEntitySink(Path path) {
        this(path, Clock.systemUTC());
    }

    public JsonEntitySink(Path path, Clock clock) {
        this.path = Objects.requireNonNull(path, "path");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override public String name() { return "json"; }

    public Path path() { return path; }

    @Override
    public void write(Set<CanonicalEntity> entities) throws IOException {
        List<CanonicalEntity> sorted = entities.stream()
                .sorted(Comparator.comparing(CanonicalEntity::key))
                .collect(Collectors.toList());

        ObjectNode root = MAPPER.createObjectNode();
        root.putPOJO("exportedAt", Instant.now(clock));
        root.put("total", sorted.size());
        ArrayNode arr = root.putArray("entities");
        for (CanonicalEntity e : sorted) {
            arr.addObject().put("key", e.key()).put("uri", e.uri().toString());
        }

        SinkFiles.writeAtomically(path, tmp -> MAPPER.writeValue(tmp.toFile(), root));
        LOG.info("JSON exported: {} ({} entities)", path.toAbsolutePath(), sorted.size());
    }

    /**
     * 이전 산출물 읽기. 파일이 없으면 빈 스토어.
     * 형식이 깨진 항목(키/uri 누락, 잘못된 uri)은 건너뛴다.
     */
    public static DedupStore load(Path path) throws IOException {
        DedupStore store = new DedupStore();
        if (path == null || !Files.exists(path)) return store;

        JsonNode root = MAPPER.readTree(path.toFile());
        JsonNode arr = (root == null) ? null : root.get("entities");
        if (arr == null || !arr.isArray()) {
            LOG.warn("No 'entities' array in {}, ignoring previous results", path);
            return store;
        }
        int skipped = 0;
        for (JsonNode n : arr) {
            String key = n.path("key").asText("");
            String uri = n.path("uri").asText("");
            if (key.isBlank() || uri.isBlank()) { skipped++; continue; }
            try {
                store.insert(new CanonicalEntity(key, new URI(uri)));
            } catch (URISyntaxException e) {
                skipped++;
            }
        }
        if (skipped > 0) LOG.warn("Skipped {} malformed entry(ies) in {}", skipped, path);
        LOG.debug("Loaded {} previous entities from {}", store.size(), path);
        return store;
    }
}
