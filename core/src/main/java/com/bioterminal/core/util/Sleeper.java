package com.bioterminal.core.util;

import java.time.Duration;

/** 대기 추상화. 테스트에서는 가짜 구현으로 교체해 실제 sleep 없이 검증한다. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    Sleeper NONE = d -> { };
}
