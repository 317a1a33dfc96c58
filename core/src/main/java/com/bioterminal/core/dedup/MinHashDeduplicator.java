package com.bioterminal.core.dedup;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * MinHash + LSH 밴딩 인덱스.
 * 같은 보도자료가 여러 뉴스와이어에 실린 경우를 묶는 용도.
 *
 * <p>순열: (a*x + b) mod (2^61-1) 하위 32비트, 토큰 해시 = SHA-1 앞 4바이트(little-endian).
 * 밴드 수 b / 행 수 r 는 임계값 기준 위양성+위음성 면적 합이 최소가 되도록 고른다.
 * 모든 공개 메서드는 synchronized.
 */
public final class MinHashDeduplicator {

    public static final double DEFAULT_THRESHOLD = 0.8;
    public static final int DEFAULT_NUM_PERM = 128;
    public static final int DEFAULT_SHINGLE_SIZE = 1;
    public static final long DEFAULT_SEED = 1L;

    static final long MERSENNE_61 = (1L << 61) - 1;
    static final long MAX_HASH = 0xFFFF_FFFFL;

    private final double threshold;
    private final int numPerm;
    private final int shingleSize;
    private final long[] permA;
    private final long[] permB;
    private final LshParams params;

    private final Map<String, long[]> signatures = new LinkedHashMap<>();
    private final List<Map<BandKey, Set<String>>> bandTables = new ArrayList<>();

    public MinHashDeduplicator() {
        this(DEFAULT_THRESHOLD, DEFAULT_NUM_PERM, DEFAULT_SHINGLE_SIZE, DEFAULT_SEED);
    }

    public MinHashDeduplicator(double threshold, int numPerm) {
        this(threshold, numPerm, DEFAULT_SHINGLE_SIZE, DEFAULT_SEED);
    }

    public MinHashDeduplicator(double threshold, int numPerm, int shingleSize, long seed) {
        if (threshold <= 0.0 || threshold >= 1.0) throw new IllegalArgumentException("threshold must be within (0,1)");
        if (numPerm < 2) throw new IllegalArgumentException("numPerm must be >= 2");
        if (shingleSize < 1) throw new IllegalArgumentException("shingleSize must be >= 1");
        this.threshold = threshold;
        this.numPerm = numPerm;
        this.shingleSize = shingleSize;

        Random rnd = new Random(seed);
        this.permA = new long[numPerm];
        this.permB = new long[numPerm];
        for (int i = 0; i < numPerm; i++) {
            permA[i] = 1 + Math.floorMod(rnd.nextLong(), MERSENNE_61 - 1);
            permB[i] = Math.floorMod(rnd.nextLong(), MERSENNE_61);
        }

        this.params = LshParams.optimal(threshold, numPerm, 0.5, 0.5);
        for (int i = 0; i < params.bands(); i++) bandTables.add(new HashMap<>());
    }

    public double threshold() { return threshold; }
    public int numPerm() { return numPerm; }
    public LshParams params() { return params; }

    /** @throws IllegalArgumentException 이미 있는 id */
    public synchronized void add(String id, String text) {
        if (id == null) throw new IllegalArgumentException("id is null");
        if (signatures.containsKey(id)) throw new IllegalArgumentException("duplicate id: " + id);
        long[] sig = signature(text);
        signatures.put(id, sig);
        for (int b = 0; b < params.bands(); b++) {
            bandTables.get(b).computeIfAbsent(bandKey(sig, b), k -> new LinkedHashSet<>()).add(id);
        }
    }

    public synchronized boolean contains(String id) {
        return signatures.containsKey(id);
    }

    public synchronized int size() {
        return signatures.size();
    }

    /** 밴드 하나라도 겹치는 후보 id (삽입 순서) */
    public synchronized List<String> query(String text) {
        return candidates(signature(text));
    }

    public synchronized boolean isDuplicate(String text) {
        return !query(text).isEmpty();
    }

    /** 저장된 문서의 후보. 자기 자신은 빼고, 없는 id면 빈 리스트. */
    public synchronized List<String> queryById(String id) {
        long[] sig = signatures.get(id);
        if (sig == null) return List.of();
        List<String> out = candidates(sig);
        out.remove(id);
        return out;
    }

    /** 두 문서 서명의 Jaccard 추정치 */
    public synchronized double estimateJaccard(String id1, String id2) {
        long[] a = signatures.get(id1), b = signatures.get(id2);
        if (a == null || b == null) throw new IllegalArgumentException("unknown id");
        int same = 0;
        for (int i = 0; i < numPerm; i++) if (a[i] == b[i]) same++;
        return (double) same / numPerm;
    }

    /**
     * LSH 후보 관계의 연결 요소 중 크기 2 이상인 것.
     * 각 클러스터는 삽입 순서, 클러스터 목록은 첫 원소의 삽입 순서.
     */
    public synchronized List<List<String>> getClusters() {
        List<String> ids = new ArrayList<>(signatures.keySet());
        Map<String, Integer> pos = new HashMap<>();
        for (int i = 0; i < ids.size(); i++) pos.put(ids.get(i), i);

        int[] parent = new int[ids.size()];
        for (int i = 0; i < parent.length; i++) parent[i] = i;

        for (Map<BandKey, Set<String>> table : bandTables) {
            for (Set<String> bucket : table.values()) {
                if (bucket.size() < 2) continue;
                int first = -1;
                for (String id : bucket) {
                    int p = pos.get(id);
                    if (first < 0) first = p; else union(parent, first, p);
                }
            }
        }

        Map<Integer, List<String>> groups = new LinkedHashMap<>();
        for (int i = 0; i < ids.size(); i++) {
            groups.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(ids.get(i));
        }
        List<List<String>> out = new ArrayList<>();
        for (List<String> g : groups.values()) if (g.size() > 1) out.add(List.copyOf(g));
        return out;
    }

    // ---------------- internal ----------------

    private List<String> candidates(long[] sig) {
        Set<String> out = new LinkedHashSet<>();
        for (int b = 0; b < params.bands(); b++) {
            Set<String> hit = bandTables.get(b).get(bandKey(sig, b));
            if (hit != null) out.addAll(hit);
        }
        if (out.size() < 2) return new ArrayList<>(out);
        // 삽입 순서로 정렬
        List<String> ordered = new ArrayList<>(out.size());
        for (String id : signatures.keySet()) if (out.contains(id)) ordered.add(id);
        return ordered;
    }

    private BandKey bandKey(long[] sig, int band) {
        int from = band * params.rows();
        return new BandKey(band, Arrays.copyOfRange(sig, from, from + params.rows()));
    }

    long[] signature(String text) {
        long[] sig = new long[numPerm];
        Arrays.fill(sig, MAX_HASH);
        MessageDigest sha1 = sha1();
        for (String shingle : shingles(text)) {
            long hv = tokenHash(sha1, shingle);
            for (int i = 0; i < numPerm; i++) {
                long phv = mulMod(permA[i], hv);
                phv = (phv + permB[i]) % MERSENNE_61;
                phv &= MAX_HASH;
                if (phv < sig[i]) sig[i] = phv;
            }
        }
        return sig;
    }

    Set<String> shingles(String text) {
        String[] words = (text == null) ? new String[0] : text.toLowerCase(Locale.ROOT).trim().split("\\s+");
        Set<String> out = new LinkedHashSet<>();
        if (words.length == 1 && words[0].isEmpty()) return out;
        if (words.length <= shingleSize) {
            out.add(String.join(" ", words));
            return out;
        }
        for (int i = 0; i + shingleSize <= words.length; i++) {
            out.add(String.join(" ", Arrays.asList(words).subList(i, i + shingleSize)));
        }
        return out;
    }

    private static long tokenHash(MessageDigest sha1, String token) {
        byte[] d = sha1.digest(token.getBytes(StandardCharsets.UTF_8));
        return (d[0] & 0xFFL) | (d[1] & 0xFFL) << 8 | (d[2] & 0xFFL) << 16 | (d[3] & 0xFFL) << 24;
    }

    /** a*b mod (2^61-1). a < 2^61, b < 2^32 이므로 128비트 곱을 접어서 계산. */
    static long mulMod(long a, long b) {
        long hi = Math.multiplyHigh(a, b);
        long lo = a * b;
        // 2^64 ≡ 2^3 (mod 2^61-1)
        long s = (lo & MERSENNE_61) + (lo >>> 61) + (hi << 3);
        s = (s & MERSENNE_61) + (s >>> 61);
        return (s >= MERSENNE_61) ? s - MERSENNE_61 : s;
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int a, int b) {
        int ra = find(parent, a), rb = find(parent, b);
        if (ra != rb) parent[Math.max(ra, rb)] = Math.min(ra, rb);
    }

    private static MessageDigest sha1() {
        try {
            return MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    private record BandKey(int band, long[] values) {
        @Override public boolean equals(Object o) {
            return o instanceof BandKey k && k.band == band && Arrays.equals(k.values, values);
        }

        @Override public int hashCode() {
            return 31 * band + Arrays.hashCode(values);
        }
    }
}
