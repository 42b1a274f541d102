package com.enterprise.qb.sql;

import com.enterprise.qb.sql.core.SortDirection;
import com.enterprise.qb.sql.param.SqlLiteralFormatter;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.*;

class SqlLiteralFormatterTest {

    @Test
    void string() {
        assertThat(SqlLiteralFormatter.format("hello")).isEqualTo("'hello'");
    }

    @Test
    void stringWithQuotes() {
        assertThat(SqlLiteralFormatter.format("it's")).isEqualTo("'it''s'");
    }

    @Test
    void longValue() {
        assertThat(SqlLiteralFormatter.format(42L)).isEqualTo("42");
    }

    @Test
    void bigDecimalScientific() {
        // 1E+3 should render as 1000, not scientific notation
        assertThat(SqlLiteralFormatter.format(new BigDecimal("1E+3"))).isEqualTo("1000");
    }

    @Test
    void booleans() {
        assertThat(SqlLiteralFormatter.format(true)).isEqualTo("TRUE");
        assertThat(SqlLiteralFormatter.format(false)).isEqualTo("FALSE");
    }

    @Test
    void temporalTypes() {
        assertThat(SqlLiteralFormatter.format(LocalDate.of(2024, 3, 15)))
                .isEqualTo("DATE '2024-03-15'");
        assertThat(SqlLiteralFormatter.format(LocalDateTime.of(2024, 3, 15, 10, 30, 5)))
                .isEqualTo("TIMESTAMP '2024-03-15 10:30:05'");
        assertThat(SqlLiteralFormatter.format(LocalTime.of(8, 0)))
                .isEqualTo("TIME '08:00'");
    }

    @Test
    void enumByName() {
        assertThat(SqlLiteralFormatter.format(SortDirection.DESC)).isEqualTo("'DESC'");
    }

    @Test
    void nullThrows() {
        assertThatThrownBy(() -> SqlLiteralFormatter.format(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void unsupportedTypeThrows() {
        assertThatThrownBy(() -> SqlLiteralFormatter.format(new Object()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported literal type");
    }

    @Test
    void debugFormatNeverThrows() {
        assertThat(SqlLiteralFormatter.formatForDebug(null)).isEqualTo("NULL");
        assertThat(SqlLiteralFormatter.formatForDebug(new StringBuilder("o'k"))).isEqualTo("'o''k'");
    }
}
