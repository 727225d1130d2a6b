package com.poolhistory.scd2;

import com.poolhistory.model.PoolSnapshot;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.poolhistory.support.PoolFixtures.pool;
import static org.assertj.core.api.Assertions.assertThat;

class AttributeHasherTest {

    private final AttributeHasher hasher = new AttributeHasher();

    @Test
    void sameAttributesGiveSameFixedWidthHexHash() {
        String first = hasher.fingerprint(pool("p1", "WETH-USDC", 1000.0));
        String second = hasher.fingerprint(pool("p1", "WETH-USDC", 1000.0));

        assertThat(first).isEqualTo(second).hasSize(32).matches("[0-9a-f]{32}");
    }

    @Test
    void everyHashedAttributeChangesTheHash() {
        PoolSnapshot base = pool("p1", "WETH-USDC", 1000.0);
        String h = hasher.fingerprint(base);

        assertThat(hasher.fingerprint(base.toBuilder().protocolSlug("uniswap-v3").build())).isNotEqualTo(h);
        assertThat(hasher.fingerprint(base.toBuilder().chain("Base").build())).isNotEqualTo(h);
        assertThat(hasher.fingerprint(base.toBuilder().symbol("WETH-DAI").build())).isNotEqualTo(h);
        assertThat(hasher.fingerprint(base.toBuilder().underlyingTokens(List.of("0xaaa")).build())).isNotEqualTo(h);
        assertThat(hasher.fingerprint(base.toBuilder().rewardTokens(List.of()).build())).isNotEqualTo(h);
        assertThat(hasher.fingerprint(base.toBuilder().tvlUsd(1000.5).build())).isNotEqualTo(h);
        assertThat(hasher.fingerprint(base.toBuilder().apy(4.3).build())).isNotEqualTo(h);
        assertThat(hasher.fingerprint(base.toBuilder().apyBase(null).build())).isNotEqualTo(h);
        assertThat(hasher.fingerprint(base.toBuilder().apyReward(0.0).build())).isNotEqualTo(h);
        assertThat(hasher.fingerprint(base.toBuilder().poolOld("other").build())).isNotEqualTo(h);
    }

    @Test
    void poolIdAndTimestampAreNotHashed() {
        PoolSnapshot base = pool("p1", "WETH-USDC", 1000.0);

        assertThat(hasher.fingerprint(base.toBuilder().poolId("p2").timestamp("2025-05-05T00:00:00Z").build()))
                .isEqualTo(hasher.fingerprint(base));
    }

    @Test
    void nullAndEmptyDoNotChurn() {
        PoolSnapshot withNulls = pool("p1", "X", 1.0).toBuilder().poolOld(null).rewardTokens(null).build();
        PoolSnapshot withEmpty = pool("p1", "X", 1.0).toBuilder().poolOld("").rewardTokens(List.of()).build();

        assertThat(hasher.fingerprint(withNulls)).isEqualTo(hasher.fingerprint(withEmpty));
    }

    @Test
    void nullTokensInsideListsAreIgnored() {
        List<String> tokens = new ArrayList<>(Arrays.asList("0xaaa", null, "0xbbb"));
        PoolSnapshot withNullToken = pool("p1", "X", 1.0).toBuilder().underlyingTokens(tokens).build();

        assertThat(hasher.fingerprint(withNullToken)).isEqualTo(hasher.fingerprint(pool("p1", "X", 1.0)));
    }

    @Test
    void numbersAreNormalizedBeforeHashing() {
        assertThat(AttributeHasher.normalize(1.0)).isEqualTo("1");
        assertThat(AttributeHasher.normalize(new BigDecimal("1.500"))).isEqualTo("1.5");
        assertThat(AttributeHasher.normalize(1e-7)).isEqualTo("0.0000001");
        assertThat(AttributeHasher.normalize(-0.0)).isEqualTo("0");
        assertThat(hasher.fingerprint(Arrays.asList("a", 2.0))).isEqualTo(hasher.fingerprint(Arrays.asList("a", 2L)));
    }

    @Test
    void listBoundariesAreUnambiguous() {
        String split = hasher.fingerprint(Arrays.asList(List.of("a", "b"), "c"));
        String shifted = hasher.fingerprint(Arrays.asList(List.of("a"), "b" + "c"));

        assertThat(split).isNotEqualTo(shifted);
    }
}
