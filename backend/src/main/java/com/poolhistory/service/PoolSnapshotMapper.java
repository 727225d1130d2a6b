package com.poolhistory.service;

import com.poolhistory.llama.dto.LlamaChartPoint;
import com.poolhistory.llama.dto.LlamaPool;
import com.poolhistory.model.PoolSnapshot;
import com.poolhistory.model.TvlFact;
import com.poolhistory.scd2.SchemaMismatchException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps raw DeFiLlama rows to typed snapshots and facts.
 * Key columns are mandatory; numeric columns are coerced best-effort (unparsable -> null, logged).
 */
@Component
@Slf4j
public class PoolSnapshotMapper {

    /**
     * @param targetProjects protocol slugs to keep (case-insensitive); empty keeps everything
     */
    public List<PoolSnapshot> toSnapshots(List<LlamaPool> pools, Collection<String> targetProjects) {
        Set<String> keep = targetProjects == null ? Set.of() : targetProjects.stream()
                .filter(Objects::nonNull)
                .map(PoolSnapshotMapper::normalize)
                .collect(Collectors.toSet());

        List<PoolSnapshot> out = new ArrayList<>();
        for (LlamaPool p : pools) {
            if (!keep.isEmpty() && !keep.contains(normalize(p.getProject()))) continue;
            if (isEmpty(p.getPool())) {
                throw new SchemaMismatchException("pool row without 'pool' id (project=" + p.getProject()
                        + ", symbol=" + p.getSymbol() + ")");
            }
            out.add(PoolSnapshot.builder()
                    .poolId(p.getPool())
                    .protocolSlug(p.getProject())
                    .chain(p.getChain())
                    .symbol(p.getSymbol())
                    .underlyingTokens(cleanTokens(p.getUnderlyingTokens()))
                    .rewardTokens(cleanTokens(p.getRewardTokens()))
                    .timestamp(p.getTimestamp())
                    .tvlUsd(parseDoubleSafe("tvlUsd", p.getTvlUsd(), p.getPool()))
                    .apy(parseDoubleSafe("apy", p.getApy(), p.getPool()))
                    .apyBase(parseDoubleSafe("apyBase", p.getApyBase(), p.getPool()))
                    .apyReward(parseDoubleSafe("apyReward", p.getApyReward(), p.getPool()))
                    .poolOld(p.getPoolOld())
                    .build());
        }
        log.info("[mapper] {} of {} pools kept for projects {}", out.size(), pools.size(), keep.isEmpty() ? "*" : keep);
        return out;
    }

    /** Chart points to daily facts; points without a readable timestamp are dropped. */
    public List<TvlFact> toFacts(String poolId, List<LlamaChartPoint> points) {
        if (isEmpty(poolId)) throw new SchemaMismatchException("chart without pool id");
        List<TvlFact> out = new ArrayList<>(points.size());
        int skipped = 0;
        for (LlamaChartPoint pt : points) {
            LocalDate date = parseDate(pt.getTimestamp());
            if (date == null) {
                skipped++;
                continue;
            }
            out.add(TvlFact.builder()
                    .poolId(poolId)
                    .date(date)
                    .tvlUsd(parseDoubleSafe("tvlUsd", pt.getTvlUsd(), poolId))
                    .apy(parseDoubleSafe("apy", pt.getApy(), poolId))
                    .apyBase(parseDoubleSafe("apyBase", pt.getApyBase(), poolId))
                    .apyReward(parseDoubleSafe("apyReward", pt.getApyReward(), poolId))
                    .build());
        }
        if (skipped > 0) {
            log.warn("[mapper] pool {}: {} chart points without a valid timestamp dropped", poolId, skipped);
        }
        return out;
    }

    /** ISO offset date-time, local date-time or plain date to a UTC day. */
    static LocalDate parseDate(String ts) {
        if (isEmpty(ts)) return null;
        String s = ts.trim();
        try {
            if (s.length() == 10) return LocalDate.parse(s);
            TemporalAccessor t = DateTimeFormatter.ISO_DATE_TIME.parseBest(s, OffsetDateTime::from, LocalDateTime::from);
            if (t instanceof OffsetDateTime odt) {
                return odt.withOffsetSameInstant(ZoneOffset.UTC).toLocalDate();
            }
            return ((LocalDateTime) t).toLocalDate();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static List<String> cleanTokens(List<String> tokens) {
        if (tokens == null) return List.of();
        return tokens.stream().filter(Objects::nonNull).toList();
    }

    private static Double parseDoubleSafe(String field, String raw, String poolId) {
        if (isEmpty(raw)) return null;
        try {
            return Double.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("[mapper] pool {}: cannot coerce {}='{}' to a number, using null", poolId, field, raw);
            return null;
        }
    }

    private static String normalize(String s) {
        return s == null ? null : s.toLowerCase(Locale.ROOT).trim();
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isBlank();
    }
}
