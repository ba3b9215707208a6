package com.example.shortsbot_backend.timeline;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CaptionTimeFormatTest {

    @Test
    void formatsEachDialect() {
        assertThat(CaptionTimeFormat.srt(3723.456)).isEqualTo("01:02:03,456");
        assertThat(CaptionTimeFormat.vtt(3723.456)).isEqualTo("01:02:03.456");
        assertThat(CaptionTimeFormat.ass(3723.456)).isEqualTo("1:02:03.46");
    }

    @Test
    void negativeOffsetsClampToZero() {
        assertThat(CaptionTimeFormat.srt(-1)).isEqualTo("00:00:00,000");
        assertThat(CaptionTimeFormat.ass(-1)).isEqualTo("0:00:00.00");
    }
}
