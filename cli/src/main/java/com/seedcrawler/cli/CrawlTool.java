package com.seedcrawler.cli;

import com.seedcrawler.core.api.ISeedResolver;
import com.seedcrawler.core.crawler.CrawlOrchestrator;
import com.seedcrawler.core.model.CrawlConfig;
import com.seedcrawler.core.model.CrawlReport;
import com.seedcrawler.core.search.GoogleSearchSeedResolver;
import com.seedcrawler.core.search.SeedResolutionException;
import com.seedcrawler.core.search.StaticSeedResolver;
import com.seedcrawler.core.service.export.JsonReportExporter;
import com.seedcrawler.core.util.LoggingConfigurator;
import com.seedcrawler.core.util.YamlConfigLoader;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;

/**
 * 명령행 진입점.
 * 종료 코드: 0 = 크롤 완료 또는 시드 조회 실패(메시지 출력), 2 = 잘못된 옵션/설정.
 */
public class CrawlTool {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlTool.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 2;

    /** 종료 훅이 현재 배치 join을 기다려 주는 최대 시간 */
    private static final long SHUTDOWN_GRACE_SEC = 10;

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != EXIT_OK) System.exit(code);
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        CrawlToolOptions options = new CrawlToolOptions();
        CmdLineParser parser = new CmdLineParser(options);
        try {
            parser.parseArgument(args);
        } catch (CmdLineException e) {
            err.println(e.getMessage());
            parser.printUsage(err);
            return EXIT_USAGE;
        }
        if (options.isHelp()) {
            parser.printUsage(out);
            return EXIT_OK;
        }

        LoggingConfigurator.init(
                options.getLogDir() != null ? Paths.get(options.getLogDir()) : null,
                options.isVerbose() ? Level.FINE : Level.INFO);

        CrawlConfig config;
        try {
            config = (options.getConfigFile() != null)
                    ? YamlConfigLoader.load(Paths.get(options.getConfigFile()))
                    : YamlConfigLoader.loadDefault();
            applyOverrides(config, options);
            config.validate();
        } catch (IOException | IllegalArgumentException | NullPointerException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        ISeedResolver resolver;
        if (config.hasExplicitSeeds()) {
            resolver = new StaticSeedResolver(config.getSeeds());
        } else if (config.getSearch().hasCredentials()) {
            resolver = new GoogleSearchSeedResolver(config);
        } else {
            err.println("Search API credentials missing: set " + YamlConfigLoader.ENV_API_KEY + " and "
                    + YamlConfigLoader.ENV_ENGINE_ID + " (or search.apiKey/search.engineId), or pass --seed URLs");
            return EXIT_USAGE;
        }

        AtomicBoolean cancel = new AtomicBoolean(false);
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            // Ctrl+C: 새 배치 dispatch 중단, 현재 배치 join까지 잠깐 기다린다
            cancel.set(true);
            try {
                finished.await(SHUTDOWN_GRACE_SEC, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }, "crawl-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            CrawlReport report;
            try {
                report = new CrawlOrchestrator(config, resolver).run(
                        (round, dispatched, budget, discovered) ->
                                LOG.debug("round {}: {}/{} dispatched, {} discovered", round, dispatched, budget, discovered),
                        cancel);
            } catch (SeedResolutionException e) {
                err.println("Seed resolution failed: " + e.getMessage());
                out.println("Exiting...");
                return EXIT_OK;
            }

            out.println(report.summaryLine());
            if (options.getReportFile() != null) {
                Path file = Paths.get(options.getReportFile());
                try {
                    new JsonReportExporter().export(report, file);
                } catch (IOException e) {
                    err.println("Could not write report " + file + ": " + e.getMessage());
                }
            }
            out.println("Exiting...");
            return EXIT_OK;
        } finally {
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                LOG.debug("Shutdown in progress, hook stays registered");
            }
        }
    }

    /** 명령행에 주어진 값만 설정 위에 덮어쓴다 */
    static void applyOverrides(CrawlConfig config, CrawlToolOptions o) {
        if (o.getKeyword() != null) config.setKeyword(o.getKeyword());
        if (o.getMaxPages() != null) config.setMaxPages(o.getMaxPages());
        if (o.getBatchSize() != null) {
            if (o.getBatchSize() < 1) throw new IllegalArgumentException("batch size must be >= 1");
            config.setBatchSize(o.getBatchSize());
        }
        if (o.getSeedCount() != null) config.setSeedCount(o.getSeedCount());
        if (!o.getSeeds().isEmpty()) config.setSeeds(o.getSeeds());
        if (o.getTimeoutMs() != null) {
            if (o.getTimeoutMs() < 1) throw new IllegalArgumentException("timeout must be >= 1 ms");
            config.setTimeout(Duration.ofMillis(o.getTimeoutMs()));
        }
        if (o.getMaxTimeSec() != null) {
            if (o.getMaxTimeSec() < 0) throw new IllegalArgumentException("max time must be >= 0");
            config.setMaxRunTime(Duration.ofSeconds(o.getMaxTimeSec()));
        }
        if (o.isNoRobots()) config.getRobots().setRespect(false);
    }
}
