package com.hostscout.core.extract;

import com.hostscout.core.model.CrawlConfig;

import java.util.Collection;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 지문(호스트 접미사) 규칙 묶음.
 * strict  : {label}.{fingerprint}  (label = 영숫자로 시작/끝, 가운데 '-' 허용, 2~63자)
 * permissive: {[A-Za-z0-9_-]+}.{fingerprint}  (폴백 전용)
 */
public final class FingerprintRules {

    private final String fingerprint;
    private final Set<String> reserved;
    private final Pattern strict;
    private final Pattern permissive;

    public FingerprintRules(String fingerprint, Collection<String> reservedWords) {
        Objects.requireNonNull(fingerprint, "fingerprint");
        this.fingerprint = fingerprint.trim().toLowerCase(Locale.ROOT);
        if (this.fingerprint.isEmpty()) throw new IllegalArgumentException("fingerprint is empty");
        this.reserved = (reservedWords == null) ? Set.of() : Set.copyOf(reservedWords);
        String fp = Pattern.quote(this.fingerprint);
        this.strict = Pattern.compile(
                "(?<![A-Za-z0-9-])([A-Za-z0-9][A-Za-z0-9-]{0,61}[A-Za-z0-9])\\." + fp + "(?![A-Za-z0-9-])",
                Pattern.CASE_INSENSITIVE);
        this.permissive = Pattern.compile("([A-Za-z0-9_-]+)\\." + fp, Pattern.CASE_INSENSITIVE);
    }

    public static FingerprintRules fromConfig(CrawlConfig cfg) {
        return new FingerprintRules(cfg.getFingerprint(), cfg.getReservedWords());
    }

    public String fingerprint() { return fingerprint; }
    public Set<String> reserved() { return reserved; }
    public Pattern strictPattern() { return strict; }
    public Pattern permissivePattern() { return permissive; }

    public boolean isReserved(String label) {
        return label != null && reserved.contains(label.toLowerCase(Locale.ROOT));
    }

    /** 대소문자 무시 포함 여부 */
    public boolean containsFingerprint(String text) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(fingerprint);
    }
}
