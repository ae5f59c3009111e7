package com.hostscout.core.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * JSON 라인 기반 구조화 로거.
 * 이벤트 1건 = JSON 객체 1개(Jackson 으로 직렬화)를 SLF4J 로 흘린다.
 * 바인딩(slf4j-jdk14)과 핸들러 설정은 앱 쪽 LogSetup 담당.
 */
public final class StructuredLog {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Logger log;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.log = LoggerFactory.getLogger(cls);
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) {
        if (log.isDebugEnabled()) log.debug(toJson("DEBUG", event, null, kvs));
    }
    public void info(String event, Object... kvs) {
        if (log.isInfoEnabled()) log.info(toJson("INFO", event, null, kvs));
    }
    public void warn(String event, Object... kvs) {
        if (log.isWarnEnabled()) log.warn(toJson("WARN", event, null, kvs));
    }
    public void error(String event, Throwable t, Object... kvs) {
        if (log.isErrorEnabled()) log.error(toJson("ERROR", event, t, kvs), t);
    }

    /** 테스트 및 단독 사용을 위한 순수 빌더 */
    String toJson(String lvl, String event, Throwable t, Object... kvs) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("ts", Instant.now().toString());
        n.put("lvl", lvl);
        n.put("comp", comp);
        n.put("thread", Thread.currentThread().getName());
        n.put("event", event);
        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                put(n, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) n.put("_kv_mismatch", true);
        }
        if (t != null) {
            n.put("error", t.getClass().getSimpleName());
            n.put("message", t.getMessage());
        }
        return n.toString();
    }

    private static void put(ObjectNode n, String k, Object v) {
        if (v == null) n.putNull(k);
        else if (v instanceof Integer i) n.put(k, i);
        else if (v instanceof Long l) n.put(k, l);
        else if (v instanceof Double d) n.put(k, d);
        else if (v instanceof Boolean b) n.put(k, b);
        else if (v instanceof Number num) n.put(k, num.toString());
        else n.put(k, String.valueOf(v));
    }
}
