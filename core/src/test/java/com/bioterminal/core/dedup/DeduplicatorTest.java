package com.bioterminal.core.dedup;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeduplicatorTest {

    @Test
    @DisplayName("정규 URL: 추적 파라미터 제거, 파라미터 정렬, 끝 슬래시/fragment 제거")
    void canonical_url_strips_tracking_and_sorts() {
        assertThat(Deduplicator.canonicalUrl(
                "HTTPS://WWW.FierceBiotech.com/Biotech/Deal/?utm_source=rss&b=2&a=1&fbclid=xyz#top"))
                .isEqualTo("https://www.fiercebiotech.com/Biotech/Deal?a=1&b=2");
    }

    @Test
    void canonical_url_is_idempotent_and_drops_default_port() {
        String once = Deduplicator.canonicalUrl("http://news.test:80/a/b/?z=1&utm_medium=email");
        assertThat(once).isEqualTo("http://news.test/a/b?z=1");
        assertThat(Deduplicator.canonicalUrl(once)).isEqualTo(once);
        assertThat(Deduplicator.canonicalUrl("https://news.test:8443/x")).isEqualTo("https://news.test:8443/x");
    }

    @Test
    void canonical_url_keeps_repeated_keys_in_original_order() {
        assertThat(Deduplicator.canonicalUrl("https://a.test/s?tag=b&id=7&tag=a"))
                .isEqualTo("https://a.test/s?id=7&tag=b&tag=a");
    }

    @Test
    void unparseable_url_is_only_trimmed() {
        assertThat(Deduplicator.canonicalUrl("  not a url  ")).isEqualTo("not a url");
        assertThat(Deduplicator.canonicalUrl(null)).isNull();
    }

    @Test
    void content_hash_is_sha256_hex() {
        assertThat(Deduplicator.contentHash("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(Deduplicator.contentHash("")).hasSize(64);
    }

    @Test
    @DisplayName("SimHash: 같은 텍스트 거리 0, 약간 바꾼 글은 무관한 글보다 가깝다")
    void fingerprint_distance_orders_similarity() {
        String a = "Acme Therapeutics announced positive topline results from its Phase 3 trial of ACM-101 "
                + "in patients with moderate to severe plaque psoriasis, meeting all primary endpoints.";
        String near = a.replace("positive", "encouraging");
        String other = "The European Medicines Agency validated the marketing authorisation application "
                + "for a gene therapy targeting spinal muscular atrophy in infants.";

        String fa = Deduplicator.contentFingerprint(a);
        assertThat(Deduplicator.simhashDistance(fa, Deduplicator.contentFingerprint(a))).isZero();
        int dNear = Deduplicator.simhashDistance(fa, Deduplicator.contentFingerprint(near));
        int dOther = Deduplicator.simhashDistance(fa, Deduplicator.contentFingerprint(other));
        assertThat(dNear).isLessThan(dOther);
        assertThat(Deduplicator.isNearDuplicate(fa, fa, 0)).isTrue();
    }

    @Test
    @DisplayName("4-gram 특징이 절반 넘게 다르면 해밍 거리 > 3, 근접 중복 아님")
    void mostly_different_features_are_not_near_duplicates() {
        String a = "Acme Therapeutics announced positive topline results from its Phase 3 trial of ACM-101 "
                + "in patients with moderate to severe plaque psoriasis, meeting all primary endpoints.";
        String b = "Acme Therapeutics announced that the FDA accepted its biologics license application for ACM-220 "
                + "in adults with relapsed multiple myeloma, with a decision date expected next spring.";

        Set<String> fa = SimHash.features(a).keySet();
        Set<String> fb = SimHash.features(b).keySet();
        Set<String> union = new HashSet<>(fa);
        union.addAll(fb);
        Set<String> shared = new HashSet<>(fa);
        shared.retainAll(fb);
        assertThat(1.0 - (double) shared.size() / union.size()).isGreaterThan(0.5);

        String pa = Deduplicator.contentFingerprint(a);
        String pb = Deduplicator.contentFingerprint(b);
        assertThat(Deduplicator.simhashDistance(pa, pb)).isGreaterThan(Deduplicator.DEFAULT_NEAR_DUPLICATE_THRESHOLD);
        assertThat(Deduplicator.isNearDuplicate(pa, pb, Deduplicator.DEFAULT_NEAR_DUPLICATE_THRESHOLD)).isFalse();
    }

    @Test
    void fingerprint_is_unsigned_hex_round_trip() {
        long fp = SimHash.compute("biotech pipeline update", 64);
        assertThat(SimHash.fromHex(SimHash.toHex(fp))).isEqualTo(fp);
        assertThatThrownBy(() -> SimHash.compute("x", 65)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("register: 자신을 제외한 후보, 같은 id 재등록은 무시")
    void register_returns_candidates_excluding_self() {
        Deduplicator d = new Deduplicator();
        String body = MinHashDeduplicatorTest.body(200, 7L);

        assertThat(d.register("h1", body)).isEmpty();
        assertThat(d.register("h1", body)).isEmpty();
        assertThat(d.register("h2", body + " addendum")).containsExactly("h1");
        assertThat(d.index().size()).isEqualTo(2);
    }

    @Test
    void extract_text_removes_boilerplate() {
        String html = "<html><body><nav>Home | About</nav><article><p>Trial met its endpoint.</p></article>"
                + "<footer>© 2025</footer><script>var x=1;</script></body></html>";
        String text = Deduplicator.extractText(html);
        assertThat(text).contains("Trial met its endpoint.");
        assertThat(text).doesNotContain("var x").doesNotContain("Home | About");
    }
}
