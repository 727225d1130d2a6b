package com.poolhistory.scd2;

import com.poolhistory.model.PoolSnapshot;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Fingerprint of the attributes that define a pool version.
 * <p>
 * Values are normalized (null -> "", numbers in plain notation without trailing zeros,
 * null list elements dropped), joined with control-character separators and MD5-hashed.
 * Two snapshots with the same fingerprint are the same version.
 */
@Component
public class AttributeHasher {

    static final char FIELD_SEPARATOR = '\u001F';
    static final char LIST_SEPARATOR = '\u001E';

    public String fingerprint(PoolSnapshot pool) {
        return fingerprint(hashedValues(pool));
    }

    public String fingerprint(List<?> values) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) sb.append(FIELD_SEPARATOR);
            sb.append(normalize(values.get(i)));
        }
        return DigestUtils.md5DigestAsHex(sb.toString().getBytes(StandardCharsets.UTF_8));
    }

    /** Hashed attribute set, in hashing order. */
    static List<Object> hashedValues(PoolSnapshot p) {
        return Arrays.asList(
                p.getProtocolSlug(),
                p.getChain(),
                p.getSymbol(),
                p.getUnderlyingTokens(),
                p.getRewardTokens(),
                p.getTvlUsd(),
                p.getApy(),
                p.getApyBase(),
                p.getApyReward(),
                p.getPoolOld());
    }

    static String normalize(Object v) {
        if (v == null) return "";
        if (v instanceof Collection<?> c) {
            return c.stream()
                    .filter(Objects::nonNull)
                    .map(AttributeHasher::normalize)
                    .collect(Collectors.joining(String.valueOf(LIST_SEPARATOR)));
        }
        if (v instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) return d.toString();
            return plain(BigDecimal.valueOf(d));
        }
        if (v instanceof Float f) {
            if (f.isNaN() || f.isInfinite()) return f.toString();
            return plain(new BigDecimal(f.toString()));
        }
        if (v instanceof BigDecimal bd) return plain(bd);
        return v.toString();
    }

    private static String plain(BigDecimal bd) {
        if (bd.signum() == 0) return "0";
        return bd.stripTrailingZeros().toPlainString();
    }
}
