package org.irlens.compare;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CompareOptionsTest {

    @Test
    void fromConfig_readsBothSettings() {
        CompareOptions options = CompareOptions.fromConfig(ConfigFactory.parseString(
                "assume-alpha-equivalent-bindings = true\nfloat-tolerance = 0.5"));

        assertThat(options.assumeAlphaEquivalentBindings()).isTrue();
        assertThat(options.floatTolerance()).isEqualTo(0.5);
    }

    @Test
    void negativeOrNanTolerance_isRejected() {
        assertThatThrownBy(() -> CompareOptions.DEFAULT.withFloatTolerance(-1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CompareOptions.DEFAULT.withFloatTolerance(Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void withers_keepTheOtherSetting() {
        CompareOptions options = CompareOptions.ALPHA_EQUIVALENT.withFloatTolerance(0.25);

        assertThat(options).isEqualTo(new CompareOptions(true, 0.25));
        assertThat(options.withAlphaEquivalentBindings(false)).isEqualTo(new CompareOptions(false, 0.25));
    }
}
