package com.bioterminal.core.api;

import com.bioterminal.core.model.EntityMatches;

/** 엔티티 해석 최소 계약: 자유 텍스트에서 회사/질환/카탈리스트 식별자를 찾는다. 매칭 없음은 오류가 아니다. */
@FunctionalInterface
public interface IEntityResolver {

    IEntityResolver NONE = text -> EntityMatches.EMPTY;

    EntityMatches resolve(String text);
}
