package com.bioterminal.core.util;

/**
 * run 진행 콜백. 파이프라인 스레드에서 호출되므로 오래 붙잡지 말 것.
 */
@FunctionalInterface
public interface ProgressListener {

    enum Phase { DISCOVER, FETCH, PROCESS, DONE }

    /**
     * @param fraction 0.0~1.0
     * @param done     처리한 URL 수
     * @param total    발견된 URL 수, discover 단계에서는 -1
     */
    void onProgress(Phase phase, double fraction, long done, long total);

    ProgressListener NONE = (phase, f, d, t) -> {};
}
