package com.seedcrawler.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * URL 정규화 + 확장자 분류.
 *
 * 정규화 규칙:
 * - 상대 링크는 base 페이지 기준으로 resolve (루트 상대 링크는 base origin 기준)
 * - 링크에 자체 호스트가 있으면 그 호스트 사용
 * - http/https 외 스킴은 버림
 * - scheme/host 소문자, 기본 포트(http:80, https:443) 제거
 * - 빈 경로는 "/", 중복 슬래시 축소
 * - query는 키에 포함, fragment는 제거
 */
public final class UrlNormalizer {

    /** 이미지/오디오/비디오/압축/레거시 스크립트 */
    public static final List<String> DEFAULT_IGNORED_EXTENSIONS = List.of(
            ".img", ".jpg", ".jpeg", ".png", ".gif", ".bmp", ".ico", ".svg", ".webp",
            ".mp3", ".wav", ".ogg", ".flac",
            ".mp4", ".avi", ".wmv", ".flv", ".mov", ".mkv", ".webm",
            ".zip", ".rar", ".7z", ".gz", ".tar", ".bz2",
            ".cgi"
    );

    private final Set<String> ignored;

    public UrlNormalizer() {
        this(DEFAULT_IGNORED_EXTENSIONS);
    }

    public UrlNormalizer(Collection<String> ignoredExtensions) {
        Set<String> s = new LinkedHashSet<>();
        if (ignoredExtensions != null) {
            for (String e : ignoredExtensions) {
                if (e == null || e.isBlank()) continue;
                String v = e.trim().toLowerCase(Locale.ROOT);
                s.add(v.startsWith(".") ? v : "." + v);
            }
        }
        this.ignored = Set.copyOf(s);
    }

    /** raw 링크를 base 기준 절대 URL 키로. 비었거나 파싱 불가면 empty. */
    public static Optional<String> normalize(String rawLink, String baseUrl) {
        if (rawLink == null || rawLink.isBlank()) return Optional.empty();

        URI link = parse(rawLink);
        if (link == null) return Optional.empty();

        URI resolved;
        if (link.isAbsolute()) {
            resolved = link;
        } else {
            URI base = (baseUrl == null ? null : parse(baseUrl));
            if (base == null || !base.isAbsolute() || base.isOpaque()) return Optional.empty();
            // "http://a.com" + "x" → "http://a.comx" 방지
            if (base.getRawPath() == null || base.getRawPath().isEmpty()) base = base.resolve("/");
            try {
                resolved = base.resolve(link);
            } catch (IllegalArgumentException e) {
                return Optional.empty();
            }
        }
        return Optional.ofNullable(canonical(resolved));
    }

    /** 이미 절대 URL인 문자열 정규화(seed 등) */
    public static Optional<String> normalize(String absoluteUrl) {
        return normalize(absoluteUrl, null);
    }

    /** scheme://host[:port], robots 캐시 키 */
    public static String originOf(String url) {
        URI u = parse(url);
        String host = (u == null ? null : hostOf(u));
        if (host == null || u.getScheme() == null) return null;
        String scheme = u.getScheme().toLowerCase(Locale.ROOT);
        int port = effectivePort(scheme, portOf(u));
        return scheme + "://" + host.toLowerCase(Locale.ROOT) + (port < 0 ? "" : ":" + port);
    }

    /** 경로 확장자가 무시 목록에 있으면 true (query 무시, 대소문자 무시) */
    public boolean isIgnoredExtension(String url) {
        String ext = extensionOf(url);
        return ext != null && ignored.contains(ext);
    }

    public Set<String> ignoredExtensions() { return ignored; }

    /** 마지막 경로 세그먼트의 ".ext" (소문자). 없으면 null */
    static String extensionOf(String url) {
        URI u = parse(url);
        String path = (u == null ? null : u.getPath());
        if (path == null || path.isEmpty()) return null;
        String last = path.substring(path.lastIndexOf('/') + 1);
        int dot = last.lastIndexOf('.');
        if (dot < 0) return null;
        return last.substring(dot).toLowerCase(Locale.ROOT);
    }

    // ------------ helpers ------------

    private static String canonical(URI u) {
        String scheme = u.getScheme() == null ? null : u.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) return null;

        String host = hostOf(u);
        if (host == null || host.isBlank()) return null;
        host = host.toLowerCase(Locale.ROOT);

        int port = effectivePort(scheme, portOf(u));

        URI n = u.normalize(); // "." / ".." 세그먼트 정리
        String path = n.getRawPath();
        if (path == null || path.isEmpty()) path = "/";
        path = path.replaceAll("/{2,}", "/");

        String query = n.getRawQuery();

        StringBuilder sb = new StringBuilder(64);
        sb.append(scheme).append("://").append(host);
        if (port >= 0) sb.append(':').append(port);
        sb.append(path);
        if (query != null) sb.append('?').append(query);
        return sb.toString(); // fragment 제거
    }

    private static int effectivePort(String scheme, int port) {
        if (("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443)) return -1;
        return port;
    }

    /** host 외부에서 URI가 거부하는 문자. 브라우저처럼 퍼센트 인코딩해서 받아들인다 */
    private static final String UNSAFE = " \"<>\\^`{|}[]";

    private static URI parse(String s) {
        if (s == null) return null;
        String t = encodeUnsafe(s.trim());
        if (t.isEmpty()) return null;
        try {
            return new URI(t);
        } catch (URISyntaxException e) {
            return null; // 잘못된 URL은 무시
        }
    }

    /** authority(IPv6 리터럴의 [ ] 포함)는 그대로, 그 뒤 path/query/fragment의 UNSAFE 문자만 인코딩 */
    static String encodeUnsafe(String s) {
        int from = authorityEnd(s);
        StringBuilder sb = new StringBuilder(s.length() + 16).append(s, 0, from);
        for (int i = from; i < s.length(); i++) {
            char c = s.charAt(i);
            if (UNSAFE.indexOf(c) >= 0) sb.append('%').append(String.format("%02X", (int) c));
            else sb.append(c);
        }
        return sb.toString();
    }

    private static int authorityEnd(String s) {
        int start;
        if (s.startsWith("//")) {
            start = 2;
        } else {
            int i = s.indexOf("://");
            if (i <= 0 || !s.substring(0, i).matches("[A-Za-z][A-Za-z0-9+.-]*")) return 0;
            start = i + 3;
        }
        for (int i = start; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '/' || c == '?' || c == '#') return i;
        }
        return s.length();
    }

    /**
     * 서버 기반 host. "my_host.example.com"처럼 URI가 registry 기반으로만 파싱한 경우
     * authority에서 host를 직접 꺼낸다(영숫자 . - _ 만 허용).
     */
    private static String hostOf(URI u) {
        if (u.getHost() != null) return u.getHost();
        String auth = registryHostPort(u);
        if (auth == null) return null;
        int colon = auth.lastIndexOf(':');
        if (colon >= 0 && !auth.substring(colon + 1).matches("\\d*")) return null;
        String host = colon >= 0 ? auth.substring(0, colon) : auth;
        return host.matches("[A-Za-z0-9._-]+") ? host : null;
    }

    private static int portOf(URI u) {
        if (u.getHost() != null) return u.getPort();
        String auth = registryHostPort(u);
        int colon = (auth == null ? -1 : auth.lastIndexOf(':'));
        if (colon < 0 || colon == auth.length() - 1) return -1;
        try {
            return Integer.parseInt(auth.substring(colon + 1));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /** registry authority에서 userinfo를 뺀 host[:port] */
    private static String registryHostPort(URI u) {
        String auth = u.getRawAuthority();
        if (auth == null || auth.isEmpty()) return null;
        int at = auth.lastIndexOf('@');
        return at >= 0 ? auth.substring(at + 1) : auth;
    }
}
