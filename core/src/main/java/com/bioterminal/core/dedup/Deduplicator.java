package com.bioterminal.core.dedup;

import com.bioterminal.core.parse.TextExtractor;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 중복 판정.
 * <ul>
 *   <li>정확 중복: 추출 텍스트의 SHA-256</li>
 *   <li>쌍 비교 근사 중복: 64비트 SimHash 해밍 거리</li>
 *   <li>코퍼스 단위 근사 중복: 공유 {@link MinHashDeduplicator} 인덱스</li>
 * </ul>
 * 정적 메서드는 순수 함수. 인스턴스는 프로세스 수명 동안 인덱스를 소유한다.
 */
public final class Deduplicator {

    public static final int DEFAULT_NEAR_DUPLICATE_THRESHOLD = 3;

    /** 항상 제거하는 추적 파라미터. utm_* 는 접두어로 따로 처리. */
    static final Set<String> TRACKING_PARAMS = Set.of(
            "utm_source", "utm_medium", "utm_campaign", "utm_term", "utm_content",
            "fbclid", "gclid", "msclkid", "_ga", "mc_cid", "mc_eid");

    private final MinHashDeduplicator index;
    private final int nearDuplicateThreshold;

    public Deduplicator() {
        this(new MinHashDeduplicator(), DEFAULT_NEAR_DUPLICATE_THRESHOLD);
    }

    public Deduplicator(MinHashDeduplicator index, int nearDuplicateThreshold) {
        this.index = Objects.requireNonNull(index, "index");
        if (nearDuplicateThreshold < 0) throw new IllegalArgumentException("threshold must be >= 0");
        this.nearDuplicateThreshold = nearDuplicateThreshold;
    }

    public MinHashDeduplicator index() { return index; }

    public int nearDuplicateThreshold() { return nearDuplicateThreshold; }

    /**
     * 인덱스 조회 후 등록. 이미 같은 id가 있으면 등록은 건너뛴다.
     * @return 자신을 제외한 근사 중복 후보 id
     */
    public List<String> register(String id, String text) {
        synchronized (index) {
            List<String> candidates = new ArrayList<>(index.query(text));
            candidates.remove(id);
            if (!index.contains(id)) index.add(id, text);
            return candidates;
        }
    }

    public boolean isNearDuplicate(String fp1, String fp2) {
        return isNearDuplicate(fp1, fp2, nearDuplicateThreshold);
    }

    // ---------------- 순수 함수 ----------------

    /**
     * 정규 URL: scheme/host 소문자, 기본 포트 제거, 추적 파라미터 제거,
     * 나머지 파라미터 키 기준 정렬(같은 키는 원래 순서), 경로 끝 '/' 제거, fragment 제거.
     * 파싱 불가 입력은 trim 만 해서 돌려준다.
     */
    public static String canonicalUrl(String url) {
        if (url == null) return null;
        String in = url.trim();
        URI u;
        try {
            u = new URI(in);
        } catch (URISyntaxException e) {
            return in;
        }
        if (u.getScheme() == null || u.getRawAuthority() == null) return in;

        String scheme = u.getScheme().toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(in.length());
        sb.append(scheme).append("://");
        if (u.getRawUserInfo() != null) sb.append(u.getRawUserInfo()).append('@');
        if (u.getHost() != null) {
            sb.append(u.getHost().toLowerCase(Locale.ROOT));
            int port = u.getPort();
            boolean defaultPort = (port == 80 && scheme.equals("http")) || (port == 443 && scheme.equals("https"));
            if (port >= 0 && !defaultPort) sb.append(':').append(port);
        } else {
            sb.append(u.getRawAuthority().toLowerCase(Locale.ROOT));
        }

        String path = (u.getRawPath() == null) ? "" : u.getRawPath();
        int end = path.length();
        while (end > 0 && path.charAt(end - 1) == '/') end--;
        sb.append(path, 0, end);

        String query = canonicalQuery(u.getRawQuery());
        if (!query.isEmpty()) sb.append('?').append(query);
        return sb.toString();
    }

    static String canonicalQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) return "";
        List<String[]> kept = new ArrayList<>();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            String key = (eq < 0) ? pair : pair.substring(0, eq);
            if (isTracking(key)) continue;
            kept.add(new String[]{key, pair});
        }
        kept.sort(Comparator.comparing(kv -> kv[0])); // stable
        StringBuilder q = new StringBuilder();
        for (String[] kv : kept) {
            if (q.length() > 0) q.append('&');
            q.append(kv[1]);
        }
        return q.toString();
    }

    static boolean isTracking(String key) {
        String k = key.toLowerCase(Locale.ROOT);
        return k.startsWith("utm_") || TRACKING_PARAMS.contains(k);
    }

    /** SHA-256(UTF-8) 16진수 */
    public static String contentHash(String text) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            byte[] d = sha.digest((text == null ? "" : text).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(d);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String contentFingerprint(String text) {
        return contentFingerprint(text, SimHash.DEFAULT_BITS);
    }

    public static String contentFingerprint(String text, int bits) {
        return SimHash.toHex(SimHash.compute(text, bits));
    }

    public static int simhashDistance(String fp1, String fp2) {
        return SimHash.distance(SimHash.fromHex(fp1), SimHash.fromHex(fp2));
    }

    public static boolean isNearDuplicate(String fp1, String fp2, int threshold) {
        return simhashDistance(fp1, fp2) <= threshold;
    }

    /** 보일러플레이트 제거 후 평문. 해시/지문은 이 결과 위에서 계산한다. */
    public static String extractText(String html) {
        return TextExtractor.extract(html);
    }
}
