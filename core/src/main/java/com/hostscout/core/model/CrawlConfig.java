package com.hostscout.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 크롤 설정 (hostscout.yml 매핑 대상), 순수 설정 보관용.
 * 하위 섹션(scope / retry / politeness / output / sources)은 YAML 섹션과 1:1로 대응한다.
 */
public final class CrawlConfig {

    public static final String DEFAULT_FINGERPRINT = "myshopify.com";
    public static final List<String> DEFAULT_RESERVED = List.of(
            "www", "admin", "cdn", "login", "api", "shop", "store",
            "checkout", "help", "support", "partners", "apps");

    /** 순회 범위/종료 정책: YAML `scope:` */
    public static final class Scope {
        private int maxDepth = 10;
        private int maxPagesPerQuery = 10;
        /** 새 엔티티 0건 페이지가 연속으로 이만큼 나오면 해당 쿼리 중단 */
        private int emptyPageLimit = 5;
        private int maxFrontierSize = 10_000;
        private List<String> excludeHosts = List.of(
                "google.com", "bing.com", "duckduckgo.com", "youtube.com", "facebook.com", "twitter.com");
        /** UrlExclusion 패턴(prefix / glob / re:) */
        private List<String> excludePatterns = List.of();

        public int getMaxDepth() { return maxDepth; }
        public Scope setMaxDepth(int v) { this.maxDepth = v; return this; }
        public int getMaxPagesPerQuery() { return maxPagesPerQuery; }
        public Scope setMaxPagesPerQuery(int v) { this.maxPagesPerQuery = v; return this; }
        public int getEmptyPageLimit() { return emptyPageLimit; }
        public Scope setEmptyPageLimit(int v) { this.emptyPageLimit = v; return this; }
        public int getMaxFrontierSize() { return maxFrontierSize; }
        public Scope setMaxFrontierSize(int v) { this.maxFrontierSize = v; return this; }
        public List<String> getExcludeHosts() { return excludeHosts; }
        public Scope setExcludeHosts(List<String> v) { this.excludeHosts = (v == null ? List.of() : List.copyOf(v)); return this; }
        public List<String> getExcludePatterns() { return excludePatterns; }
        public Scope setExcludePatterns(List<String> v) { this.excludePatterns = (v == null ? List.of() : List.copyOf(v)); return this; }

        /** 쿼리 하나가 꺼낼 수 있는 최대 아이템 수(D × P) */
        public long perQueryBudget() {
            return (long) maxDepth * (long) maxPagesPerQuery;
        }
    }

    /** 재시도: YAML `retry:` */
    public static final class Retry {
        private int attemptBudget = 3;
        private long backoffBaseMs = 500;

        public int getAttemptBudget() { return attemptBudget; }
        public Retry setAttemptBudget(int v) { this.attemptBudget = v; return this; }
        public long getBackoffBaseMs() { return backoffBaseMs; }
        public Retry setBackoffBaseMs(long v) { this.backoffBaseMs = v; return this; }
    }

    /** 호스트 예절: YAML `politeness:` */
    public static final class Politeness {
        private boolean respectRobots = true;
        private long minHostIntervalMs = 1000;
        /** 연속 실패가 이 값에 도달한 호스트는 실행 끝까지 거부. 0이면 끔 */
        private int hostFailureLimit = 10;

        public boolean isRespectRobots() { return respectRobots; }
        public Politeness setRespectRobots(boolean v) { this.respectRobots = v; return this; }
        public long getMinHostIntervalMs() { return minHostIntervalMs; }
        public Politeness setMinHostIntervalMs(long v) { this.minHostIntervalMs = v; return this; }
        public Duration minHostInterval() { return Duration.ofMillis(Math.max(0, minHostIntervalMs)); }
        public int getHostFailureLimit() { return hostFailureLimit; }
        public Politeness setHostFailureLimit(int v) { this.hostFailureLimit = v; return this; }
    }

    /** 출력: YAML `output:` */
    public static final class Output {
        private Path dir = Path.of("out");
        private String baseName = "hostscout";
        private Set<String> formats = new LinkedHashSet<>(List.of("json", "csv"));
        /** 이전 JSON 결과와 합쳐서 저장 */
        private boolean mergeExisting = false;

        public Path getDir() { return dir; }
        public Output setDir(Path v) { this.dir = v; return this; }
        public String getBaseName() { return baseName; }
        public Output setBaseName(String v) { this.baseName = v; return this; }
        public Set<String> getFormats() { return formats; }
        public Output setFormats(List<String> v) {
            Set<String> out = new LinkedHashSet<>();
            if (v != null) for (String s : v) if (s != null && !s.isBlank()) out.add(s.trim().toLowerCase(Locale.ROOT));
            this.formats = out;
            return this;
        }
        public boolean isMergeExisting() { return mergeExisting; }
        public Output setMergeExisting(boolean v) { this.mergeExisting = v; return this; }

        public Path jsonPath() { return dir.resolve(baseName + ".json"); }
        public Path csvPath() { return dir.resolve(baseName + ".csv"); }
    }

    public enum SourceType { STATIC, SEARCH, NEXT_LINK }

    /** 소스 하나: YAML `sources:` 리스트 원소 */
    public static final class SourceCfg {
        private SourceType type = SourceType.STATIC;
        private String name;
        private List<String> urls = List.of();
        /** SEARCH: {query} {page} {offset} 치환 */
        private String template;
        private List<String> queries = List.of();
        private int pageSize = 10;
        /** 첫 페이지 offset (bing first=1 등) */
        private int firstOffset = 0;
        /** NEXT_LINK: 다음 페이지 링크 CSS 셀렉터 */
        private String nextSelector = "a[rel=next]";
        /** NEXT_LINK/SEARCH: 상세 페이지로 따라갈 링크 셀렉터(빈 값이면 따라가지 않음) */
        private String followSelector = "";

        public SourceType getType() { return type; }
        public SourceCfg setType(SourceType v) { this.type = (v == null ? SourceType.STATIC : v); return this; }
        public String getName() { return name; }
        public SourceCfg setName(String v) { this.name = v; return this; }
        public List<String> getUrls() { return urls; }
        public SourceCfg setUrls(List<String> v) { this.urls = (v == null ? List.of() : List.copyOf(v)); return this; }
        public String getTemplate() { return template; }
        public SourceCfg setTemplate(String v) { this.template = v; return this; }
        public List<String> getQueries() { return queries; }
        public SourceCfg setQueries(List<String> v) { this.queries = (v == null ? List.of() : List.copyOf(v)); return this; }
        public int getPageSize() { return pageSize; }
        public SourceCfg setPageSize(int v) { this.pageSize = v; return this; }
        public int getFirstOffset() { return firstOffset; }
        public SourceCfg setFirstOffset(int v) { this.firstOffset = v; return this; }
        public String getNextSelector() { return nextSelector; }
        public SourceCfg setNextSelector(String v) { this.nextSelector = v; return this; }
        public String getFollowSelector() { return followSelector; }
        public SourceCfg setFollowSelector(String v) { this.followSelector = (v == null ? "" : v); return this; }

        void validate(int index) {
            String where = "sources[" + index + "]";
            if (name == null || name.isBlank()) throw new IllegalArgumentException(where + ".name is required");
            switch (type) {
                case STATIC, NEXT_LINK -> {
                    if (urls.isEmpty()) throw new IllegalArgumentException(where + ".urls must not be empty");
                }
                case SEARCH -> {
                    if (template == null || !template.contains("{query}"))
                        throw new IllegalArgumentException(where + ".template must contain {query}");
                    if (queries.isEmpty()) throw new IllegalArgumentException(where + ".queries must not be empty");
                    if (pageSize < 1) throw new IllegalArgumentException(where + ".pageSize must be >= 1");
                }
            }
            if (type == SourceType.NEXT_LINK && (nextSelector == null || nextSelector.isBlank()))
                throw new IllegalArgumentException(where + ".nextSelector is required");
        }
    }

    // ---------- 기본 필드 ----------
    private String fingerprint = DEFAULT_FINGERPRINT;
    private List<String> reservedWords = DEFAULT_RESERVED;
    private int concurrency = 5;
    private Duration timeout = Duration.ofSeconds(10);
    private boolean followRedirects = true;
    private String userAgent = "HostScout/0.1 (+crawler)";
    private List<String> userAgents = List.of();
    private int rps = 10;
    private int maxBodyBytes = 5 * 1024 * 1024;
    private boolean verify = false;

    private final Scope scope = new Scope();
    private final Retry retry = new Retry();
    private final Politeness politeness = new Politeness();
    private final Output output = new Output();
    private final List<SourceCfg> sources = new ArrayList<>();

    // ---------- getters ----------
    public String getFingerprint() { return fingerprint; }
    public List<String> getReservedWords() { return reservedWords; }
    public int getConcurrency() { return concurrency; }
    public Duration getTimeout() { return timeout; }
    public boolean isFollowRedirects() { return followRedirects; }
    public String getUserAgent() { return userAgent; }
    public List<String> getUserAgents() { return userAgents; }
    public int getRps() { return rps; }
    public int getMaxBodyBytes() { return maxBodyBytes; }
    public boolean isVerify() { return verify; }
    public Scope scope() { return scope; }
    public Retry retry() { return retry; }
    public Politeness politeness() { return politeness; }
    public Output output() { return output; }
    public List<SourceCfg> getSources() { return sources; }

    // ---------- fluent setters ----------
    public CrawlConfig setFingerprint(String v) {
        this.fingerprint = (v == null ? null : v.trim().toLowerCase(Locale.ROOT));
        return this;
    }
    public CrawlConfig setReservedWords(List<String> v) {
        List<String> out = new ArrayList<>();
        if (v != null) for (String s : v) if (s != null && !s.isBlank()) out.add(s.trim().toLowerCase(Locale.ROOT));
        this.reservedWords = List.copyOf(out);
        return this;
    }
    public CrawlConfig setConcurrency(int v) { this.concurrency = Math.max(1, v); return this; }
    public CrawlConfig setTimeout(Duration v) { this.timeout = v; return this; }
    public CrawlConfig setTimeoutMs(long ms) { this.timeout = Duration.ofMillis(Math.max(1, ms)); return this; }
    public CrawlConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public CrawlConfig setUserAgent(String v) { this.userAgent = v; return this; }
    public CrawlConfig setUserAgents(List<String> v) { this.userAgents = (v == null ? List.of() : List.copyOf(v)); return this; }
    public CrawlConfig setRps(int v) { this.rps = v; return this; }
    public CrawlConfig setMaxBodyBytes(int v) { this.maxBodyBytes = v; return this; }
    public CrawlConfig setVerify(boolean v) { this.verify = v; return this; }
    public CrawlConfig addSource(SourceCfg s) { this.sources.add(Objects.requireNonNull(s, "source")); return this; }

    // ---------- validate ----------
    public void validate() {
        if (fingerprint == null || fingerprint.isBlank() || !fingerprint.contains("."))
            throw new IllegalArgumentException("fingerprint must be a host suffix like 'example.com'");
        Objects.requireNonNull(reservedWords, "reservedWords");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (userAgent == null || userAgent.isBlank()) throw new IllegalArgumentException("userAgent is required");
        if (rps <= 0) throw new IllegalArgumentException("rps must be > 0");
        if (maxBodyBytes < 1024) throw new IllegalArgumentException("maxBodyBytes must be >= 1024");

        if (scope.maxDepth < 1) throw new IllegalArgumentException("scope.maxDepth must be >= 1");
        if (scope.maxPagesPerQuery < 1) throw new IllegalArgumentException("scope.maxPagesPerQuery must be >= 1");
        if (scope.emptyPageLimit < 1) throw new IllegalArgumentException("scope.emptyPageLimit must be >= 1");
        if (scope.maxFrontierSize < 1) throw new IllegalArgumentException("scope.maxFrontierSize must be >= 1");

        if (retry.attemptBudget < 1) throw new IllegalArgumentException("retry.attemptBudget must be >= 1");
        if (retry.backoffBaseMs < 0) throw new IllegalArgumentException("retry.backoffBaseMs must be >= 0");

        if (politeness.minHostIntervalMs < 0)
            throw new IllegalArgumentException("politeness.minHostIntervalMs must be >= 0");
        if (politeness.hostFailureLimit < 0)
            throw new IllegalArgumentException("politeness.hostFailureLimit must be >= 0");

        Objects.requireNonNull(output.dir, "output.dir");
        for (String f : output.formats) {
            if (!f.equals("json") && !f.equals("csv"))
                throw new IllegalArgumentException("output.formats: unsupported format " + f);
        }

        Set<String> names = new LinkedHashSet<>();
        for (int i = 0; i < sources.size(); i++) {
            SourceCfg s = sources.get(i);
            s.validate(i);
            if (!names.add(s.getName()))
                throw new IllegalArgumentException("duplicate source name: " + s.getName());
        }
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }
}
