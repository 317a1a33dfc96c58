package com.bioterminal.core.sink;

/** 저장 실패. 파이프라인은 삼키지 않고 호출자에게 그대로 올린다. */
public class UpsertException extends RuntimeException {
    public UpsertException(String message) { super(message); }
    public UpsertException(String message, Throwable cause) { super(message, cause); }
}
