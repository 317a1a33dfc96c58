package com.bioterminal.core.model;

/** 아이템 하나의 파이프라인 처리 결과 */
public record ItemOutcome(String url, Status status, Stage stage, String reason, ScraperResult result) {

    public enum Status { SUCCESS, SKIPPED, FAILED }

    public enum Stage { ROBOTS, RATE_LIMIT, FETCH, PARSE, NORMALIZE, LINK, FIXTURE, UPSERT }

    public static ItemOutcome success(ScraperResult r) {
        return new ItemOutcome(r.getUrl(), Status.SUCCESS, Stage.UPSERT, null, r);
    }

    public static ItemOutcome skipped(String url, Stage stage, String reason) {
        return new ItemOutcome(url, Status.SKIPPED, stage, reason, null);
    }

    public static ItemOutcome failed(String url, Stage stage, String reason) {
        return new ItemOutcome(url, Status.FAILED, stage, reason, null);
    }
}
