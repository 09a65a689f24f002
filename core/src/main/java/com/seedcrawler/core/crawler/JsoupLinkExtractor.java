package com.seedcrawler.core.crawler;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Set;

/** 기본 jsoup 기반 링크 추출기: a[href] → raw href 수집(정규화는 UrlNormalizer 몫) */
public class JsoupLinkExtractor implements LinkExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(JsoupLinkExtractor.class);

    @Override
    public Set<String> extract(String html, String baseUrl) {
        Set<String> out = new LinkedHashSet<>();
        if (html == null || html.isBlank()) return out;

        try {
            Document doc = Jsoup.parse(html, baseUrl == null ? "" : baseUrl);
            for (Element a : doc.select("a[href]")) {
                String href = a.attr("href").trim();
                if (!href.isEmpty()) out.add(href);
            }
        } catch (RuntimeException e) {
            LOG.debug("link extraction failed for {}: {}", baseUrl, e.toString());
            return new LinkedHashSet<>();
        }
        return out;
    }
}
