package com.bioterminal.core.robots;

import java.net.URI;

public interface RobotsFetcher {

    /**
     * @param status   HTTP status, 0 이면 네트워크 오류
     * @param location 3xx일 때 다음 URI, 그 외에는 요청 URI
     */
    record Response(int status, String body, URI location, String error) {
        public static Response ok(int status, String body, URI uri) {
            return new Response(status, body == null ? "" : body, uri, null);
        }
        public static Response redirect(int status, URI next) {
            return new Response(status, "", next, null);
        }
        public static Response fail(String msg, URI uri) {
            return new Response(0, "", uri, msg);
        }
        public boolean isNetworkError() { return status == 0; }
    }

    /** robots.txt 한 번 요청. 리다이렉트 판단은 호출자 몫. */
    Response fetch(URI robotsTxtUri);
}
