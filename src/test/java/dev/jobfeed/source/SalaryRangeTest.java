package dev.jobfeed.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SalaryRangeTest {

    @Test
    @DisplayName("Should parse a dollar range with separators")
    void shouldParseRange() {
        SalaryRange range = SalaryRange.parse("$80,000 - $120,000 a year");

        assertThat(range.min()).isEqualTo(80000L);
        assertThat(range.max()).isEqualTo(120000L);
        assertThat(range.currency()).isEqualTo("USD");
    }

    @Test
    @DisplayName("Should expand the K suffix")
    void shouldExpandThousands() {
        SalaryRange range = SalaryRange.parse("€90K–110K");

        assertThat(range.min()).isEqualTo(90000L);
        assertThat(range.max()).isEqualTo(110000L);
        assertThat(range.currency()).isEqualTo("EUR");
    }

    @Test
    @DisplayName("Should parse a single Kenyan shilling amount")
    void shouldParseSingleAmount() {
        SalaryRange range = SalaryRange.parse("KSh 150,000 per month");

        assertThat(range.min()).isEqualTo(150000L);
        assertThat(range.max()).isNull();
        assertThat(range.currency()).isEqualTo("KES");
    }

    @Test
    @DisplayName("Should return an empty range for text without amounts")
    void shouldHandleNoAmounts() {
        assertThat(SalaryRange.parse("Competitive").isEmpty()).isTrue();
        assertThat(SalaryRange.parse(null)).isEqualTo(SalaryRange.NONE);
        assertThat(SalaryRange.parse("  ")).isEqualTo(SalaryRange.NONE);
    }
}
