package com.hostscout.app;

import com.hostscout.app.logging.LogSetup;
import com.hostscout.app.verify.MarkerScoreVerifier;
import com.hostscout.app.verify.MarkerSet;
import com.hostscout.core.api.IVerifier;
import com.hostscout.core.http.HttpFetcher;
import com.hostscout.core.model.CrawlConfig;
import com.hostscout.core.model.CrawlStats;
import com.hostscout.core.model.RunState;
import com.hostscout.core.service.DiscoveryService;
import com.hostscout.core.util.ProgressListener;
import com.hostscout.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * CLI 진입점.
 * 종료 코드: 0 성공, 1 실행 실패(I/O 등), 2 잘못된 인자/설정, 130 중단
 */
public final class App {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_INTERRUPTED = 130;

    private App() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CliOptions opts;
        CrawlConfig cfg;
        try {
            opts = CliOptions.parse(args);
            if (opts.help()) {
                out.print(CliOptions.USAGE);
                return EXIT_OK;
            }
            cfg = opts.applyTo(loadConfig(opts.config()));
            cfg.validate();
            if (cfg.getSources().isEmpty()) {
                throw new IllegalArgumentException("no sources configured (add 'sources:' to the YAML or pass seed URLs)");
            }
        } catch (IllegalArgumentException e) {
            err.println("hostscout: " + e.getMessage());
            err.print(CliOptions.USAGE);
            return EXIT_USAGE;
        } catch (IOException e) {
            err.println("hostscout: cannot read configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        // 로그 초기화 (출력 디렉터리 아래 logs/)
        LogSetup.init(cfg.output().getDir().resolve("logs"));
        Logger log = LoggerFactory.getLogger(App.class);
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                log.error("==== Uncaught: {} ====", t.getName(), e));

        IVerifier verifier = null;
        if (cfg.isVerify()) {
            verifier = new MarkerScoreVerifier(new HttpFetcher(cfg),
                    MarkerSet.forFingerprint(cfg.getFingerprint()), cfg.retry().getAttemptBudget());
        }
        DiscoveryService service = DiscoveryService.fromConfig(cfg, verifier);

        ShutdownDrain drain = new ShutdownDrain(service::cancel, ShutdownDrain.DEFAULT_MAX_WAIT);
        Thread hook = new Thread(drain, "shutdown-hook");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            DiscoveryService.Result r = service.run(new ProgressLogger(log));
            CrawlStats.Snapshot s = r.report().getStats();
            out.printf("Discovered %d entities (state=%s, processed=%d, blocked=%d, failed=%d, disallowed=%d, elapsed=%ds)%n",
                    r.exported().size(), r.report().getState(), s.processed, s.blocked, s.failed, s.disallowed,
                    r.report().elapsed().toSeconds());
            if (r.verifiedOut() > 0) out.printf("Rejected by verification: %d%n", r.verifiedOut());
            if (r.mergedFromPrevious() > 0) out.printf("Kept from previous results: %d%n", r.mergedFromPrevious());
            out.printf("Output: %s%n", cfg.output().getDir().toAbsolutePath());
            return exitCodeFor(r.report().getState());
        } catch (IOException e) {
            log.error("Export failed: {}", e.toString(), e);
            err.println("hostscout: export failed: " + e.getMessage());
            return EXIT_FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("hostscout: interrupted");
            return EXIT_INTERRUPTED;
        } finally {
            drain.finished();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException ignore) {
                // 이미 종료 중
            }
        }
    }

    /** 취소로 끝난 실행도 결과는 저장되지만 종료 코드는 130 */
    static int exitCodeFor(RunState state) {
        return (state == RunState.ABORTED) ? EXIT_INTERRUPTED : EXIT_OK;
    }

    /** -c 가 있으면 그 파일, 없으면 ./hostscout.yml(있을 때만), 둘 다 없으면 기본값 */
    static CrawlConfig loadConfig(Path explicit) throws IOException {
        if (explicit != null) return YamlConfigLoader.load(explicit);
        Path def = Path.of(YamlConfigLoader.DEFAULT_FILE);
        if (Files.exists(def)) return YamlConfigLoader.load(def);
        return CrawlConfig.defaults();
    }

    /** 10% 단위로만 INFO 를 남기는 진행률 리스너 */
    static final class ProgressLogger implements ProgressListener {
        private final Logger log;
        private String lastPhase = "";
        private int lastDecile = -1;

        ProgressLogger(Logger log) { this.log = log; }

        @Override
        public synchronized void onProgress(double progress, String phase, long done, long total) {
            int decile = (int) Math.floor(Math.max(0.0, Math.min(1.0, progress)) * 10);
            if (!phase.equals(lastPhase)) {
                lastPhase = phase;
                lastDecile = -1;
            }
            if (decile > lastDecile) {
                lastDecile = decile;
                log.info("[{}] {}% ({}/{})", phase, decile * 10, done, total);
            }
        }
    }
}
