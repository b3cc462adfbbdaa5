package com.southern.keysync.handler;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class SqliteLocalDateTimeTypeHandlerTest {

    @Test
    void writesFixedWidthText() {
        LocalDateTime time = LocalDateTime.of(2024, 3, 5, 7, 8, 9, 120_000_000);
        assertThat(SqliteLocalDateTimeTypeHandler.format(time)).isEqualTo("2024-03-05 07:08:09.120");
    }

    @Test
    void readsWithAndWithoutFraction() {
        assertThat(SqliteLocalDateTimeTypeHandler.parse("2024-03-05 07:08:09"))
                .isEqualTo(LocalDateTime.of(2024, 3, 5, 7, 8, 9));
        assertThat(SqliteLocalDateTimeTypeHandler.parse("2024-03-05 07:08:09.120"))
                .isEqualTo(LocalDateTime.of(2024, 3, 5, 7, 8, 9, 120_000_000));
        assertThat(SqliteLocalDateTimeTypeHandler.parse("2024-03-05T07:08:09.5"))
                .isEqualTo(LocalDateTime.of(2024, 3, 5, 7, 8, 9, 500_000_000));
    }

    @Test
    void blankIsNull() {
        assertThat(SqliteLocalDateTimeTypeHandler.parse(null)).isNull();
        assertThat(SqliteLocalDateTimeTypeHandler.parse(" ")).isNull();
    }
}
