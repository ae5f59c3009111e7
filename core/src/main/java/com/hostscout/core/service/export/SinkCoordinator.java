package com.hostscout.core.service.export;

import com.hostscout.core.api.ISink;
import com.hostscout.core.model.CanonicalEntity;
import com.hostscout.core.model.CrawlConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 설정된 싱크를 순서대로 모두 실행한다.
 * 한 싱크의 실패는 로그만 남기고 다음 싱크로 넘어가며, 전부 끝난 뒤 마지막 실패를 다시 던진다.
 */
public final class SinkCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(SinkCoordinator.class);

    private final List<ISink> sinks;

    public SinkCoordinator(List<ISink> sinks) {
        this.sinks = List.copyOf(Objects.requireNonNull(sinks, "sinks"));
    }

    /** output.formats 순서대로 json/csv 싱크 구성 */
    public static SinkCoordinator fromConfig(CrawlConfig.Output out) {
        List<ISink> list = new ArrayList<>();
        for (String f : out.getFormats()) {
            switch (f) {
                case "json" -> list.add(new JsonEntitySink(out.jsonPath()));
                case "csv" -> list.add(new CsvEntitySink(out.csvPath()));
                default -> LOG.warn("Unknown output format '{}', skipped", f);
            }
        }
        return new SinkCoordinator(list);
    }

    public List<ISink> sinks() { return sinks; }

    public void writeAll(Set<CanonicalEntity> entities) throws IOException {
        LOG.info("[Export plan] sinks={}, entities={}",
                sinks.stream().map(ISink::name).toList(), entities.size());
        IOException last = null;
        for (ISink s : sinks) {
            try {
                s.write(entities);
            } catch (IOException e) {
                LOG.warn("Sink '{}' failed: {}", s.name(), e.toString());
                last = e;
            } catch (RuntimeException e) {
                LOG.warn("Sink '{}' failed: {}", s.name(), e.toString());
                last = new IOException("sink '" + s.name() + "' failed", e);
            }
        }
        if (last != null) throw last;
    }
}
