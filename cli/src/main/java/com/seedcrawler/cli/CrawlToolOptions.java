package com.seedcrawler.cli;

import org.kohsuke.args4j.Option;

import java.util.ArrayList;
import java.util.List;

/**
 * 명령행 옵션. 값이 주어진 항목만 설정 파일 위에 덮어쓴다(null = 미지정).
 */
public class CrawlToolOptions {

    private String _keyword;
    private Integer _maxPages;
    private Integer _batchSize;
    private Integer _seedCount;
    private final List<String> _seeds = new ArrayList<>();
    private Long _timeoutMs;
    private String _configFile;
    private String _reportFile;
    private Long _maxTimeSec;
    private String _logDir;
    private boolean _noRobots = false;
    private boolean _verbose = false;
    private boolean _help = false;

    @Option(name = "-k", aliases = "--keyword", metaVar = "QUERY", usage = "search keyword used to find seed URLs (default: python)")
    public void setKeyword(String keyword) {
        _keyword = keyword;
    }

    @Option(name = "-d", aliases = "--depth", metaVar = "N", usage = "maximum number of pages to fetch (default: 100)")
    public void setMaxPages(int maxPages) {
        _maxPages = maxPages;
    }

    @Option(name = "-b", aliases = "--batch-size", metaVar = "N", usage = "pages fetched concurrently per batch (default: CPU count)")
    public void setBatchSize(int batchSize) {
        _batchSize = batchSize;
    }

    @Option(name = "-n", aliases = "--results", metaVar = "N", usage = "number of search results used as seeds, 1..10 (default: 10)")
    public void setSeedCount(int seedCount) {
        _seedCount = seedCount;
    }

    @Option(name = "-s", aliases = "--seed", metaVar = "URL", usage = "seed URL, repeatable; skips the search API")
    public void addSeed(String seed) {
        _seeds.add(seed);
    }

    @Option(name = "-t", aliases = "--timeout-ms", metaVar = "MS", usage = "per-request timeout in milliseconds (default: 5000)")
    public void setTimeoutMs(long timeoutMs) {
        _timeoutMs = timeoutMs;
    }

    @Option(name = "-c", aliases = "--config", metaVar = "FILE", usage = "YAML configuration file (default: ./crawler.yml if present)")
    public void setConfigFile(String configFile) {
        _configFile = configFile;
    }

    @Option(name = "-r", aliases = "--report", metaVar = "FILE", usage = "write a JSON crawl report to this file")
    public void setReportFile(String reportFile) {
        _reportFile = reportFile;
    }

    @Option(name = "--max-time-sec", metaVar = "SEC", usage = "stop dispatching new batches after this many seconds (0 = no limit)")
    public void setMaxTimeSec(long maxTimeSec) {
        _maxTimeSec = maxTimeSec;
    }

    @Option(name = "--log-dir", metaVar = "DIR", usage = "also write rolling log files to this directory")
    public void setLogDir(String logDir) {
        _logDir = logDir;
    }

    @Option(name = "--no-robots", usage = "do not fetch or honor robots.txt")
    public void setNoRobots(boolean noRobots) {
        _noRobots = noRobots;
    }

    @Option(name = "-v", aliases = "--verbose", usage = "debug logging")
    public void setVerbose(boolean verbose) {
        _verbose = verbose;
    }

    @Option(name = "-h", aliases = "--help", help = true, usage = "print this help")
    public void setHelp(boolean help) {
        _help = help;
    }

    public String getKeyword() {
        return _keyword;
    }

    public Integer getMaxPages() {
        return _maxPages;
    }

    public Integer getBatchSize() {
        return _batchSize;
    }

    public Integer getSeedCount() {
        return _seedCount;
    }

    public List<String> getSeeds() {
        return _seeds;
    }

    public Long getTimeoutMs() {
        return _timeoutMs;
    }

    public String getConfigFile() {
        return _configFile;
    }

    public String getReportFile() {
        return _reportFile;
    }

    public Long getMaxTimeSec() {
        return _maxTimeSec;
    }

    public String getLogDir() {
        return _logDir;
    }

    public boolean isNoRobots() {
        return _noRobots;
    }

    public boolean isVerbose() {
        return _verbose;
    }

    public boolean isHelp() {
        return _help;
    }
}
