package com.bioterminal.core.link;

import com.bioterminal.core.api.IEntityResolver;
import com.bioterminal.core.config.YamlSupport;
import com.bioterminal.core.model.EntityMatches;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 별칭 사전 기반 엔티티 해석기. 대소문자 무시, 단어 경계 일치.
 * <pre>
 * companies:
 *   MRNA: [Moderna, "Moderna Inc"]
 * diseases:
 *   covid-19: [COVID-19, SARS-CoV-2]
 * catalysts:
 *   fda-approval: ["FDA approval", "approved by the FDA"]
 * </pre>
 * NER 대용의 단순 휴리스틱이다.
 */
public final class DictionaryEntityResolver implements IEntityResolver {

    private static final Logger LOG = LoggerFactory.getLogger(DictionaryEntityResolver.class);

    private record Alias(String id, Pattern pattern) {}

    private final List<Alias> companies;
    private final List<Alias> diseases;
    private final List<Alias> catalysts;

    public DictionaryEntityResolver(Map<String, List<String>> companies,
                                    Map<String, List<String>> diseases,
                                    Map<String, List<String>> catalysts) {
        this.companies = compile(companies);
        this.diseases = compile(diseases);
        this.catalysts = compile(catalysts);
    }

    public static DictionaryEntityResolver load(Path yamlPath) throws IOException {
        try (Reader r = Files.newBufferedReader(yamlPath, StandardCharsets.UTF_8)) {
            Object root = YamlSupport.safeYaml().load(r);
            if (!(root instanceof Map<?, ?> m)) {
                LOG.warn("entity dictionary {} is empty", yamlPath);
                return new DictionaryEntityResolver(Map.of(), Map.of(), Map.of());
            }
            DictionaryEntityResolver out = new DictionaryEntityResolver(
                    section(m, "companies"), section(m, "diseases"), section(m, "catalysts"));
            LOG.info("Loaded entity dictionary {}: {} aliases", yamlPath, out.aliasCount());
            return out;
        }
    }

    @Override
    public EntityMatches resolve(String text) {
        if (text == null || text.isBlank()) return EntityMatches.EMPTY;
        return new EntityMatches(match(companies, text), match(diseases, text), match(catalysts, text));
    }

    public int aliasCount() {
        return companies.size() + diseases.size() + catalysts.size();
    }

    private static Set<String> match(List<Alias> aliases, String text) {
        Set<String> out = new LinkedHashSet<>();
        for (Alias a : aliases) {
            if (!out.contains(a.id()) && a.pattern().matcher(text).find()) out.add(a.id());
        }
        return out;
    }

    private static List<Alias> compile(Map<String, List<String>> dict) {
        List<Alias> out = new ArrayList<>();
        if (dict == null) return out;
        dict.forEach((id, names) -> {
            List<String> all = new ArrayList<>(names == null ? List.of() : names);
            all.add(id); // 식별자 자체도 별칭
            for (String n : all) {
                if (n == null || n.isBlank()) continue;
                // \b 는 비단어 문자로 끝나는 별칭(예: "Inc.")에서 실패하므로 lookaround 사용
                String p = "(?<![\\p{L}\\p{N}_])" + Pattern.quote(n.trim()) + "(?![\\p{L}\\p{N}_])";
                out.add(new Alias(id, Pattern.compile(p, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)));
            }
        });
        return out;
    }

    private static Map<String, List<String>> section(Map<?, ?> root, String key) {
        Map<String, Object> sec = YamlSupport.getMap(root, key);
        Map<String, List<String>> out = new LinkedHashMap<>();
        if (sec == null) return out;
        for (String id : sec.keySet()) out.put(id, YamlSupport.getStringList(sec, id));
        return out;
    }
}
