package com.seedcrawler.core.util;

import java.time.Instant;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 크롤 이벤트용 JSON 라인 로거.
 * <pre>{"ts":..,"lvl":"INFO","comp":"CrawlOrchestrator","thread":..,"event":"batch-dispatch","round":3,...}</pre>
 * {@link #with(Object...)}로 묶은 컨텍스트(예: run id)는 모든 라인에 붙는다.
 */
public final class StructuredLog {
    private final Logger jul;
    private final String comp;
    private final Object[] context;

    private StructuredLog(Logger jul, String comp, Object[] context) {
        this.jul = jul;
        this.comp = comp;
        this.context = context;
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(Logger.getLogger(cls.getName()), cls.getSimpleName(), new Object[0]);
    }

    /** 컨텍스트 key/value 추가본 */
    public StructuredLog with(Object... kvs) {
        if (kvs == null || kvs.length == 0) return this;
        Object[] merged = Arrays.copyOf(context, context.length + kvs.length);
        System.arraycopy(kvs, 0, merged, context.length, kvs.length);
        return new StructuredLog(jul, comp, merged);
    }

    public void debug(String event, Object... kvs) { log(Level.FINE,    event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO,    event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING, event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = line(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    String line(Level lvl, String event, Throwable t, Object... kvs) {
        StringBuilder sb = new StringBuilder(160).append('{');
        kv(sb, "ts", Instant.now().toString());
        kv(sb, "lvl", lvl.getName());
        kv(sb, "comp", comp);
        kv(sb, "thread", Thread.currentThread().getName());
        kv(sb, "event", event);
        pairs(sb, context);
        pairs(sb, kvs);
        if (t != null) {
            kv(sb, "error", t.getClass().getSimpleName());
            kv(sb, "message", t.getMessage());
        }
        sb.setLength(sb.length() - 1); // 마지막 콤마
        return sb.append('}').toString();
    }

    private static void pairs(StringBuilder sb, Object[] kvs) {
        if (kvs == null) return;
        for (int i = 0; i + 1 < kvs.length; i += 2) {
            kv(sb, String.valueOf(kvs[i]), kvs[i + 1]);
        }
        if (kvs.length % 2 == 1) kv(sb, "_kv_mismatch", true);
    }

    private static void kv(StringBuilder sb, String k, Object v) {
        sb.append('"').append(esc(k)).append("\":");
        if (v == null) {
            sb.append("null");
        } else if (v instanceof Number || v instanceof Boolean) {
            sb.append(v);
        } else {
            sb.append('"').append(esc(String.valueOf(v))).append('"');
        }
        sb.append(',');
    }

    private static String esc(String s) {
        StringBuilder r = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> r.append("\\\"");
                case '\\' -> r.append("\\\\");
                case '\n' -> r.append("\\n");
                case '\r' -> r.append("\\r");
                case '\t' -> r.append("\\t");
                default -> {
                    if (c < 0x20) r.append(String.format("\\u%04x", (int) c));
                    else r.append(c);
                }
            }
        }
        return r.toString();
    }
}
