package com.bioterminal.core.dedup;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * SimHash 지문.
 * 특징 = 소문자 + 비단어 문자 제거 텍스트의 문자 4-gram, 가중치 = 출현 횟수,
 * 특징 해시 = MD5 하위 64비트.
 */
public final class SimHash {
    private SimHash() {}

    public static final int DEFAULT_BITS = 64;
    static final int WINDOW = 4;

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}_]+");

    public static long compute(String text, int bits) {
        if (bits < 1 || bits > 64) throw new IllegalArgumentException("bits must be within [1,64]: " + bits);
        Map<String, Integer> features = features(text);
        long[] v = new long[bits];
        MessageDigest md5 = md5();
        for (var e : features.entrySet()) {
            long h = low64(md5.digest(e.getKey().getBytes(StandardCharsets.UTF_8)));
            int w = e.getValue();
            for (int i = 0; i < bits; i++) {
                v[i] += ((h >>> i) & 1L) == 1L ? w : -w;
            }
        }
        long fp = 0L;
        for (int i = 0; i < bits; i++) {
            if (v[i] > 0) fp |= (1L << i);
        }
        return fp;
    }

    /** 짧은 텍스트는 전체를 하나의 특징으로 본다 */
    static Map<String, Integer> features(String text) {
        String s = NON_WORD.matcher(text == null ? "" : text.toLowerCase(Locale.ROOT)).replaceAll("");
        Map<String, Integer> out = new LinkedHashMap<>();
        int n = Math.max(s.length() - WINDOW + 1, 1);
        for (int i = 0; i < n; i++) {
            String f = s.substring(i, Math.min(s.length(), i + WINDOW));
            out.merge(f, 1, Integer::sum);
        }
        return out;
    }

    public static int distance(long a, long b) {
        return Long.bitCount(a ^ b);
    }

    public static String toHex(long fp) {
        return Long.toHexString(fp);
    }

    public static long fromHex(String hex) {
        if (hex == null || hex.isBlank()) throw new IllegalArgumentException("empty fingerprint");
        return Long.parseUnsignedLong(hex.trim(), 16);
    }

    private static long low64(byte[] d) {
        long h = 0L;
        for (int i = d.length - 8; i < d.length; i++) h = (h << 8) | (d[i] & 0xFFL);
        return h;
    }

    private static MessageDigest md5() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
