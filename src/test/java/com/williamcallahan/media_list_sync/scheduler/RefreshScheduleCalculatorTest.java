package com.williamcallahan.media_list_sync.scheduler;

import com.williamcallahan.media_list_sync.exception.ConfigurationException;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RefreshScheduleCalculatorTest {

    @ParameterizedTest
    @CsvSource({
            "1, 03:30, 30 * * * *",
            "6, 03:30, 30 */6 * * *",
            "23, 03:30, 30 */23 * * *",
            "24, 03:30, 30 3 * * *",
            "72, 03:30, 30 3 */3 * *",
            "168, 03:30, 30 3 */7 * *",
            "720, 12:05, 5 12 1 * *",
            "8760, 00:00, 0 0 1 * *"
    })
    void toCron_mapsIntervalBands(int hours, String time, String expected) {
        String cron = RefreshScheduleCalculator.toCron(hours, time);

        assertThat(cron).isEqualTo(expected);
        assertThat(CronExpressions.toSpringExpression(cron)).isEqualTo("0 " + expected);
    }

    @Test
    void toCron_roundsDayIntervals() {
        assertThat(RefreshScheduleCalculator.toCron(36, "06:00")).isEqualTo("0 6 */2 * *");
        assertThat(RefreshScheduleCalculator.toCron(30, "06:00")).isEqualTo("0 6 */1 * *");
    }

    @Test
    void toCron_missingTimeDefaultsToMidnight() {
        assertThat(RefreshScheduleCalculator.toCron(24, null)).isEqualTo("0 0 * * *");
        assertThat(RefreshScheduleCalculator.toCron(24, "")).isEqualTo("0 0 * * *");
    }

    @Test
    void toCron_acceptsSingleDigitHour() {
        assertThat(RefreshScheduleCalculator.toCron(24, "9:30")).isEqualTo("30 9 * * *");
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -5, 8761})
    void toCron_rejectsOutOfRangeInterval(int hours) {
        assertThatThrownBy(() -> RefreshScheduleCalculator.toCron(hours, "00:00"))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void toCron_rejectsMalformedTime() {
        assertThatThrownBy(() -> RefreshScheduleCalculator.toCron(24, "25:99"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("HH:MM");
    }
}
