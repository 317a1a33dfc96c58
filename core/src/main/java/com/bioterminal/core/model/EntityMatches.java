package com.bioterminal.core.model;

import java.util.Set;

/** 엔티티 해석 결과. 순서 의미 없음, 매칭 없으면 빈 집합. */
public record EntityMatches(Set<String> companies, Set<String> diseases, Set<String> catalysts) {

    public static final EntityMatches EMPTY = new EntityMatches(Set.of(), Set.of(), Set.of());

    public EntityMatches {
        companies = (companies == null) ? Set.of() : Set.copyOf(companies);
        diseases = (diseases == null) ? Set.of() : Set.copyOf(diseases);
        catalysts = (catalysts == null) ? Set.of() : Set.copyOf(catalysts);
    }

    public boolean isEmpty() {
        return companies.isEmpty() && diseases.isEmpty() && catalysts.isEmpty();
    }
}
