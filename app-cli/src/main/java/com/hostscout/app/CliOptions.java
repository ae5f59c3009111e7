package com.hostscout.app;

import com.hostscout.core.model.CrawlConfig;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 명령행 옵션. YAML 설정 위에 덮어쓴다.
 * 위치 인자(옵션이 아닌 값)는 시드 URL 로 취급해 "cli" 정적 소스를 만든다.
 */
public final class CliOptions {

    static final String USAGE = """
            Usage: hostscout [options] [seed-url...]

            Options:
              -c, --config PATH         YAML configuration (default: ./hostscout.yml if present)
              -o, --out DIR             Output directory (default from config, else "out")
              -f, --fingerprint STR     Host suffix to discover, e.g. myshopify.com
              -w, --concurrency INT     Number of crawl workers
                  --max-depth INT       Maximum traversal depth per query
                  --max-pages INT       Maximum result pages per query
                  --verify              Verify every discovered entity before export
                  --merge               Merge with previously exported JSON results
                  --no-robots           Do not consult robots.txt
              -A, --user-agent STR      User-Agent header
              -h, --help                Show this help
            """;

    private Path config;
    private Path outDir;
    private String fingerprint;
    private Integer concurrency;
    private Integer maxDepth;
    private Integer maxPages;
    private boolean verify;
    private boolean merge;
    private boolean noRobots;
    private String userAgent;
    private boolean help;
    private final List<String> seeds = new ArrayList<>();

    private CliOptions() {}

    /** @throws IllegalArgumentException 알 수 없는 옵션, 값 누락, 숫자 형식 오류 */
    public static CliOptions parse(String... args) {
        CliOptions o = new CliOptions();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            try {
                switch (a) {
                    case "-h", "--help" -> o.help = true;
                    case "-c", "--config" -> o.config = Path.of(args[++i]);
                    case "-o", "--out" -> o.outDir = Path.of(args[++i]);
                    case "-f", "--fingerprint" -> o.fingerprint = args[++i];
                    case "-w", "--concurrency" -> o.concurrency = Integer.parseInt(args[++i]);
                    case "--max-depth" -> o.maxDepth = Integer.parseInt(args[++i]);
                    case "--max-pages" -> o.maxPages = Integer.parseInt(args[++i]);
                    case "--verify" -> o.verify = true;
                    case "--merge" -> o.merge = true;
                    case "--no-robots" -> o.noRobots = true;
                    case "-A", "--user-agent" -> o.userAgent = args[++i];
                    default -> {
                        if (a.startsWith("-")) throw new IllegalArgumentException("unknown option " + a);
                        o.seeds.add(a);
                    }
                }
            } catch (ArrayIndexOutOfBoundsException e) {
                throw new IllegalArgumentException("missing value for option " + a);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid number for option " + a + ": " + args[i]);
            }
        }
        return o;
    }

    /** 설정에 옵션 적용(설정 객체를 직접 변경) */
    public CrawlConfig applyTo(CrawlConfig cfg) {
        if (outDir != null) cfg.output().setDir(outDir);
        if (fingerprint != null) cfg.setFingerprint(fingerprint);
        if (concurrency != null) cfg.setConcurrency(concurrency);
        if (maxDepth != null) cfg.scope().setMaxDepth(maxDepth);
        if (maxPages != null) cfg.scope().setMaxPagesPerQuery(maxPages);
        if (verify) cfg.setVerify(true);
        if (merge) cfg.output().setMergeExisting(true);
        if (noRobots) cfg.politeness().setRespectRobots(false);
        if (userAgent != null) cfg.setUserAgent(userAgent);
        if (!seeds.isEmpty()) {
            cfg.addSource(new CrawlConfig.SourceCfg()
                    .setType(CrawlConfig.SourceType.STATIC)
                    .setName("cli")
                    .setUrls(seeds));
        }
        return cfg;
    }

    public Path config() { return config; }
    public boolean help() { return help; }
    public List<String> seeds() { return List.copyOf(seeds); }
}
