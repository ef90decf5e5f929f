package com.williamcallahan.media_list_sync.scheduler;

import com.williamcallahan.media_list_sync.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronExpressionsTest {

    @Test
    void toSpringExpression_prefixesSecondsField() {
        assertThat(CronExpressions.toSpringExpression("0 */6 * * *")).isEqualTo("0 0 */6 * * *");
        assertThat(CronExpressions.toSpringExpression("  15   3 * * 1 ")).isEqualTo("0 15 3 * * 1");
    }

    @Test
    void toSpringExpression_rejectsWrongFieldCount() {
        assertThatThrownBy(() -> CronExpressions.toSpringExpression("0 0 */6 * * *"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("5 fields");
        assertThatThrownBy(() -> CronExpressions.toSpringExpression("* * *"))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void toSpringExpression_rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> CronExpressions.toSpringExpression("61 * * * *"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("61 * * * *");
    }

    @Test
    void toSpringExpression_rejectsBlank() {
        assertThatThrownBy(() -> CronExpressions.toSpringExpression(" "))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> CronExpressions.toSpringExpression(null))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void nextExecution_findsFollowingSlot() {
        Instant after = Instant.parse("2024-05-01T12:07:00Z");

        assertThat(CronExpressions.nextExecution("*/15 * * * *", after, ZoneOffset.UTC))
                .contains(Instant.parse("2024-05-01T12:15:00Z"));
        assertThat(CronExpressions.nextExecution("0 3 * * *", after, ZoneOffset.UTC))
                .contains(Instant.parse("2024-05-02T03:00:00Z"));
    }
}
