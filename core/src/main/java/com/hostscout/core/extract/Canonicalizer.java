package com.hostscout.core.extract;

import com.hostscout.core.model.CandidateMatch;
import com.hostscout.core.model.CanonicalEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 후보 문자열 → CanonicalEntity.
 * 순수 함수이며 멱등: canonicalize(canonicalize(x).uri) == canonicalize(x)
 *
 * 절차: trim/소문자 → 스킴, 선행 슬래시, www. 제거 → 호스트 경계에 있는 ".{fingerprint}" 를 찾고
 * 바로 앞 라벨을 토큰으로 잘라낸다 → 문법/길이/예약어 검사 → https://{token}.{fingerprint} 재조립.
 * 검사에 걸린 출현은 건너뛰고 다음 출현을 본다(admin.x/?shop=foo.x → foo)
 */
public final class Canonicalizer {

    private static final Logger LOG = LoggerFactory.getLogger(Canonicalizer.class);
    /** "x://" 형태이거나 http(s): 만. "host:443" 의 포트를 스킴으로 보지 않는다 */
    private static final Pattern SCHEME = Pattern.compile("^(?:[a-z][a-z0-9+.-]*://|https?:)");
    private static final Pattern LABEL = Pattern.compile("[a-z0-9][a-z0-9-]{0,61}[a-z0-9]");

    private final FingerprintRules rules;
    private final String suffix;

    public Canonicalizer(FingerprintRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.suffix = "." + rules.fingerprint();
    }

    public Optional<CanonicalEntity> canonicalize(CandidateMatch candidate) {
        return canonicalize(candidate == null ? null : candidate.rawText());
    }

    public Optional<CanonicalEntity> canonicalize(String raw) {
        if (raw == null) return Optional.empty();
        String s = strip(raw.trim().toLowerCase(Locale.ROOT));

        int from = 0;
        while (true) {
            int at = s.indexOf(suffix, from);
            if (at < 0) break;
            from = at + 1;
            if (!isHostBoundary(s, at + suffix.length())) continue;

            String token = labelBefore(s, at);
            if (token.isEmpty()) continue;
            if (!LABEL.matcher(token).matches()) {
                LOG.trace("Rejected token '{}' (grammar) from '{}'", token, raw);
                continue;
            }
            if (rules.isReserved(token)) {
                LOG.trace("Rejected token '{}' (reserved) from '{}'", token, raw);
                continue;
            }
            return Optional.of(new CanonicalEntity(token, URI.create("https://" + token + suffix)));
        }
        return Optional.empty();
    }

    private static String strip(String s) {
        s = SCHEME.matcher(s).replaceFirst("");
        int i = 0;
        while (i < s.length() && (s.charAt(i) == '/' || s.charAt(i) == '\\')) i++;
        s = s.substring(i);
        while (s.startsWith("www.") && s.length() > 4) s = s.substring(4);
        return s;
    }

    /** 접미사 뒤가 끝이거나 라벨 문자가 아니어야 한다(myshopify.community 제외) */
    private static boolean isHostBoundary(String s, int end) {
        if (end >= s.length()) return true;
        char c = s.charAt(end);
        return !(Character.isLetterOrDigit(c) || c == '-' || c == '_');
    }

    /** 접미사 바로 앞 라벨(구분자 전까지). 문법 검사는 호출자가 한다 */
    private static String labelBefore(String s, int at) {
        int i = at;
        while (i > 0) {
            char c = s.charAt(i - 1);
            if (Character.isLetterOrDigit(c) || c == '-' || c == '_') i--;
            else break;
        }
        return s.substring(i, at);
    }
}
