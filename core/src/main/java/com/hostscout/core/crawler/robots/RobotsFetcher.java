package com.hostscout.core.crawler.robots;

import java.net.URI;

/** robots.txt 원문을 가져오는 계약. 리다이렉트는 따라가지 않고 location 으로 돌려준다. */
public interface RobotsFetcher {

    /**
     * @param status   HTTP status (0 이면 네트워크 오류)
     * @param body     본문(2xx 일 때만 의미 있음)
     * @param location 3xx 의 Location 을 요청 URI 기준으로 resolve 한 값(없으면 null)
     * @param error    오류 메시지(없으면 null)
     */
    record Response(int status, String body, URI location, String error) {
        public static Response ok(int status, String body) {
            return new Response(status, body == null ? "" : body, null, null);
        }
        public static Response redirect(int status, URI location) {
            return new Response(status, "", location, null);
        }
        public static Response fail(String msg) {
            return new Response(0, "", null, msg);
        }
        public boolean isRedirect() {
            return (status == 301 || status == 302 || status == 303 || status == 307 || status == 308) && location != null;
        }
    }

    Response fetch(URI robotsTxtUri) throws InterruptedException;
}
