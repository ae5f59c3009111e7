package com.hostscout.core.service.export;

import com.hostscout.core.api.ISink;
import com.hostscout.core.model.CanonicalEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/** CSV 산출물: 헤더 "key,uri", key 오름차순 */
public final class CsvEntitySink implements ISink {

    private static final Logger LOG = LoggerFactory.getLogger(CsvEntitySink.class);
    static final String HEADER = "key,uri";

    private final Path path;

    public CsvEntitySink(Path path) {
        this.path = Objects.requireNonNull(path, "path");
    }

    @Override public String name() { return "csv"; }

    public Path path() { return path; }

    @Override
    public void write(Set<CanonicalEntity> entities) throws IOException {
        List<CanonicalEntity> sorted = entities.stream()
                .sorted(Comparator.comparing(CanonicalEntity::key))
                .collect(Collectors.toList());

        SinkFiles.writeAtomically(path, tmp -> {
            try (BufferedWriter w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                w.write(HEADER);
                w.newLine();
                for (CanonicalEntity e : sorted) {
                    w.write(cell(e.key()));
                    w.write(',');
                    w.write(cell(e.uri().toString()));
                    w.newLine();
                }
            }
        });
        LOG.info("CSV exported: {} ({} entities)", path.toAbsolutePath(), sorted.size());
    }

    /** RFC 4180 따옴표 처리 */
    static String cell(String s) {
        if (s == null) return "";
        if (s.indexOf(',') < 0 && s.indexOf('"') < 0 && s.indexOf('\n') < 0 && s.indexOf('\r') < 0) return s;
        return '"' + s.replace("\"", "\"\"") + '"';
    }
}
