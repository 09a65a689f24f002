package com.seedcrawler.core.service.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.seedcrawler.core.model.CrawlReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

/**
 * 크롤 결과 JSON 파일.
 * CrawlReport 필드 그대로 + meta(reportVersion/generatedAt/distinctUrls/elapsedMs).
 */
public final class JsonReportExporter {

    private static final Logger LOG = LoggerFactory.getLogger(JsonReportExporter.class);

    public static final String REPORT_VERSION = "1";

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);

    public Path export(CrawlReport report, Path file) throws IOException {
        if (report == null) throw new IllegalArgumentException("report is null");
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        om.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), toTree(report));
        LOG.info("Report written: {}", file.toAbsolutePath());
        return file;
    }

    ObjectNode toTree(CrawlReport report) {
        ObjectNode root = om.createObjectNode();
        ObjectNode meta = root.putObject("meta");
        meta.put("reportVersion", REPORT_VERSION);
        meta.put("generatedAt", Instant.now().toString());
        meta.put("distinctUrls", report.distinctUrlCount());
        meta.put("elapsedMs", report.elapsed().toMillis());
        root.setAll((ObjectNode) om.valueToTree(report));
        return root;
    }
}
