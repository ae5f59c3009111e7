package com.hostscout.core.util;

import com.hostscout.core.model.CrawlConfig;
import com.hostscout.core.model.CrawlConfig.SourceCfg;
import com.hostscout.core.model.CrawlConfig.SourceType;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * hostscout.yml 을 읽어 CrawlConfig 로 변환.
 *
 * 예상 YAML 키:
 * fingerprint: "myshopify.com"
 * reservedWords: [www, admin, cdn]
 * concurrency: 5
 * timeoutMs: 10000
 * followRedirects: true
 * userAgent: "HostScout/0.1 (+crawler)"
 * userAgents: ["Mozilla/5.0 ...", "..."]
 * rps: 10
 * maxBodyBytes: 5242880
 * verify: false
 * scope:
 *   maxDepth: 10
 *   maxPagesPerQuery: 10
 *   emptyPageLimit: 5
 *   maxFrontierSize: 10000
 *   excludeHosts: [google.com, bing.com]
 *   excludePatterns: ["re:/login"]
 * retry:
 *   attemptBudget: 3
 *   backoffBaseMs: 500
 * politeness:
 *   respectRobots: true
 *   minHostIntervalMs: 1000
 *   hostFailureLimit: 10
 * output:
 *   dir: "out"
 *   baseName: "hostscout"
 *   formats: [json, csv]
 *   mergeExisting: false
 * sources:
 *   - type: search
 *     name: bing
 *     template: "https://www.bing.com/search?q={query}&first={offset}"
 *     firstOffset: 1
 *     pageSize: 10
 *     queries: ["site:myshopify.com"]
 *
 * 시스템 프로퍼티 오버라이드: -Dhs.crawl.concurrency, -Dhs.crawl.maxFrontierSize
 * 모르는 키는 무시한다.
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "hostscout.yml";

    private YamlConfigLoader() {}

    public static CrawlConfig loadDefault() throws IOException {
        return load(Path.of(DEFAULT_FILE));
    }

    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException(DEFAULT_FILE + " not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static CrawlConfig load(InputStream in) {
        LoaderOptions opts = new LoaderOptions();
        Yaml yaml = new Yaml(new SafeConstructor(opts));
        Object root = yaml.load(in);

        CrawlConfig cfg = CrawlConfig.defaults();

        if (root instanceof Map<?, ?> map) {
            // 1) 평면 키
            setString(map, "fingerprint", cfg::setFingerprint);
            setStringList(map, "reservedWords", cfg::setReservedWords);
            setInt(map, "concurrency", cfg::setConcurrency);
            setLongAsDurationMs(map, "timeoutMs", cfg::setTimeout);
            setBoolean(map, "followRedirects", cfg::setFollowRedirects);
            setString(map, "userAgent", cfg::setUserAgent);
            setStringList(map, "userAgents", cfg::setUserAgents);
            setInt(map, "rps", cfg::setRps);
            setInt(map, "maxBodyBytes", cfg::setMaxBodyBytes);
            setBoolean(map, "verify", cfg::setVerify);

            // 2) scope.*
            Map<String, Object> scope = getMap(map, "scope");
            if (scope != null) {
                var s = cfg.scope();
                setInt(scope, "maxDepth", s::setMaxDepth);
                setInt(scope, "maxPagesPerQuery", s::setMaxPagesPerQuery);
                setInt(scope, "emptyPageLimit", s::setEmptyPageLimit);
                setInt(scope, "maxFrontierSize", s::setMaxFrontierSize);
                setStringList(scope, "excludeHosts", s::setExcludeHosts);
                setStringList(scope, "excludePatterns", s::setExcludePatterns);
            }

            // 3) retry.*
            Map<String, Object> retry = getMap(map, "retry");
            if (retry != null) {
                var r = cfg.retry();
                setInt(retry, "attemptBudget", r::setAttemptBudget);
                setLong(retry, "backoffBaseMs", r::setBackoffBaseMs);
            }

            // 4) politeness.*
            Map<String, Object> pol = getMap(map, "politeness");
            if (pol != null) {
                var p = cfg.politeness();
                setBoolean(pol, "respectRobots", p::setRespectRobots);
                setLong(pol, "minHostIntervalMs", p::setMinHostIntervalMs);
                setInt(pol, "hostFailureLimit", p::setHostFailureLimit);
            }

            // 5) output.*
            Map<String, Object> output = getMap(map, "output");
            if (output != null) {
                var o = cfg.output();
                setString(output, "dir", v -> o.setDir(Path.of(v)));
                setString(output, "baseName", o::setBaseName);
                setStringList(output, "formats", o::setFormats);
                setBoolean(output, "mergeExisting", o::setMergeExisting);
            }

            // 6) sources[]
            Object srcs = map.get("sources");
            if (srcs instanceof List<?> list) {
                for (Object o : list) {
                    if (o instanceof Map<?, ?> sm) cfg.addSource(toSource(sm));
                }
            }
        }

        applySystemOverrides(cfg);
        cfg.validate();
        return cfg;
    }

    private static SourceCfg toSource(Map<?, ?> m) {
        SourceCfg s = new SourceCfg();
        setEnum(m, "type", SourceType.class, s::setType);
        setString(m, "name", s::setName);
        setStringList(m, "urls", s::setUrls);
        setString(m, "template", s::setTemplate);
        setStringList(m, "queries", s::setQueries);
        setInt(m, "pageSize", s::setPageSize);
        setInt(m, "firstOffset", s::setFirstOffset);
        setString(m, "nextSelector", s::setNextSelector);
        setString(m, "followSelector", s::setFollowSelector);
        return s;
    }

    private static void applySystemOverrides(CrawlConfig cfg) {
        Integer cc = sysInt("hs.crawl.concurrency");
        if (cc != null) cfg.setConcurrency(cc);
        Integer cap = sysInt("hs.crawl.maxFrontierSize");
        if (cap != null) cfg.scope().setMaxFrontierSize(cap);
    }

    private static Integer sysInt(String key) {
        String v = System.getProperty(key);
        if (v == null || v.isBlank()) return null;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("system property " + key + " is not an integer: " + v, e);
        }
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setLongAsDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        if (ms > 0) setter.accept(Duration.ofMillis(ms));
    }

    private static <E extends Enum<E>> void setEnum(Map<?, ?> map, String key, Class<E> type, Consumer<E> setter) {
        Object v = map.get(key);
        if (v == null) return;
        // next-link / next_link / NEXT_LINK 모두 허용
        String s = String.valueOf(v).trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            setter.accept(Enum.valueOf(type, s));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown " + key + ": " + v, e);
        }
    }
}
