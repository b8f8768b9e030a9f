package solarplasma.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TurbulenceConfigTest {

    @Test
    @DisplayName("Por defecto se promedia en 15 minutos con al menos 5 medidas")
    void getDefault_shouldUseFifteenMinutes() {
        TurbulenceConfig config = TurbulenceConfig.getDefault();

        assertThat(config.window()).isEqualTo(Duration.ofMinutes(15));
        assertThat(config.minPeriods()).isEqualTo(5);
        assertThat(config.withMinPeriods(1).minPeriods()).isEqualTo(1);
    }

    @Test
    @DisplayName("Ventanas no positivas o minPeriods < 1 se rechazan")
    void constructor_withInvalidValues_shouldThrow() {
        assertThatThrownBy(() -> new TurbulenceConfig(Duration.ZERO, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TurbulenceConfig(Duration.ofMinutes(1), 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
