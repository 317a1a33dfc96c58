package com.bioterminal.core.scraper;

/**
 * 연속 실패 카운터. threshold번 연속 실패하면 열린다(이후 아이템 처리 중단).
 * threshold 0 이면 항상 닫혀 있다. 한 run 안에서만 쓰고 스레드 안전하지 않다.
 */
final class CircuitBreaker {
    private final int threshold;
    private int consecutive;
    private boolean open;

    CircuitBreaker(int threshold) {
        if (threshold < 0) throw new IllegalArgumentException("threshold must be >= 0");
        this.threshold = threshold;
    }

    void recordSuccess() {
        consecutive = 0;
    }

    /** @return 이번 실패로 열렸으면 true */
    boolean recordFailure() {
        consecutive++;
        if (!open && threshold > 0 && consecutive >= threshold) {
            open = true;
            return true;
        }
        return false;
    }

    boolean isOpen() { return open; }

    int consecutiveFailures() { return consecutive; }
}
