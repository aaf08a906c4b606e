package org.nowstart.dca.service.dca.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class TradingPairTest {

    @Test
    void matches_acceptsCanonicalAndAlternateName() {
        TradingPair pair = new TradingPair("XXBTZEUR", "XBTEUR", "XXBT", "ZEUR", 8, 1, new BigDecimal("0.0001"));

        assertThat(pair.identifiers()).containsExactlyInAnyOrder("XXBTZEUR", "XBTEUR");
        assertThat(pair.matches("XXBTZEUR")).isTrue();
        assertThat(pair.matches("XBTEUR")).isTrue();
        assertThat(pair.matches("XETHZEUR")).isFalse();
        assertThat(pair.matches(null)).isFalse();
    }

    @Test
    void identifiers_collapsesMissingAlternateName() {
        TradingPair pair = new TradingPair("DOTEUR", "DOTEUR", "DOT", "ZEUR", 8, 4, new BigDecimal("0.1"));

        assertThat(pair.identifiers()).containsExactly("DOTEUR");
        assertThat(new TradingPair("DOTEUR", null, "DOT", "ZEUR", 8, 4, BigDecimal.ONE).identifiers())
                .containsExactly("DOTEUR");
    }

    @Test
    void constructor_rejectsInvalidPrecisionAndMinimum() {
        assertThatThrownBy(() -> new TradingPair("XXBTZEUR", "XBTEUR", "XXBT", "ZEUR", -1, 1, BigDecimal.ONE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TradingPair("XXBTZEUR", "XBTEUR", "XXBT", "ZEUR", 8, 1, BigDecimal.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TradingPair(" ", "XBTEUR", "XXBT", "ZEUR", 8, 1, BigDecimal.ONE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void settings_applyDefaultsAndRejectInvalidValues() {
        TradingPair pair = new TradingPair("XXBTZEUR", "XBTEUR", "XXBT", "ZEUR", 8, 1, new BigDecimal("0.0001"));

        DcaSettings settings = new DcaSettings(pair, 1, new BigDecimal("20"));

        assertThat(settings.takerFeeRate()).isEqualByComparingTo("0.0026");
        assertThat(settings.clockTolerance()).isEqualTo(Duration.ofSeconds(1));
        assertThatThrownBy(() -> new DcaSettings(pair, 0, new BigDecimal("20")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DcaSettings(pair, 1, BigDecimal.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
