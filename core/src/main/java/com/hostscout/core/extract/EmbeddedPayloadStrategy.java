package com.hostscout.core.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hostscout.core.model.CandidateMatch;
import com.hostscout.core.model.FetchedDocument;
import com.hostscout.core.model.OriginField;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * (d) 중첩 key/value 페이로드의 문자열 리프.
 * - JSON 본문 자체
 * - &lt;script type="application/json"&gt; / "application/ld+json" 블록
 * 깊이가 깊어도 스택이 넘치지 않도록 명시적 Deque 로 순회한다.
 */
public final class EmbeddedPayloadStrategy implements ExtractionStrategy {

    private static final Logger LOG = LoggerFactory.getLogger(EmbeddedPayloadStrategy.class);

    private final ObjectMapper mapper;

    public EmbeddedPayloadStrategy() { this(new ObjectMapper()); }
    public EmbeddedPayloadStrategy(ObjectMapper mapper) { this.mapper = mapper; }

    @Override public String name() { return "embedded"; }

    @Override
    public Set<CandidateMatch> extract(FetchedDocument doc, FingerprintRules rules) {
        Set<CandidateMatch> out = new LinkedHashSet<>();
        if (!rules.containsFingerprint(doc.body())) return out;

        if (doc.looksLikeJson()) {
            walk(parse(doc.body(), doc), doc, rules, out);
            return out;
        }
        for (Element script : doc.dom().select("script[type]")) {
            if (!isJsonType(script.attr("type"))) continue;
            String data = script.data();
            if (!rules.containsFingerprint(data)) continue;
            walk(parse(data, doc), doc, rules, out);
        }
        return out;
    }

    /** 블록 하나가 깨져도 나머지는 계속 */
    private JsonNode parse(String text, FetchedDocument doc) {
        try {
            return mapper.readTree(text);
        } catch (JsonProcessingException e) {
            LOG.debug("Skip malformed JSON payload in {}: {}", doc.uri(), e.getOriginalMessage());
            return null;
        }
    }

    static boolean isJsonType(String type) {
        String t = type.trim().toLowerCase(Locale.ROOT);
        return t.equals("application/json") || t.equals("application/ld+json");
    }

    private static void walk(JsonNode root, FetchedDocument doc, FingerprintRules rules, Set<CandidateMatch> out) {
        if (root == null) return;
        Deque<JsonNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            JsonNode n = stack.pop();
            if (n.isTextual()) {
                String v = n.textValue();
                if (rules.containsFingerprint(v)) out.add(new CandidateMatch(v.trim(), OriginField.EMBEDDED, doc.uri()));
            } else if (n.isContainerNode()) {
                for (Iterator<JsonNode> it = n.elements(); it.hasNext(); ) stack.push(it.next());
            }
        }
    }
}
