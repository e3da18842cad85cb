package org.irlens.render;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class DisplayWidthTest {

    @Test
    void asciiIsOneColumnPerChar() {
        assertEquals(0, DisplayWidth.of(""));
        assertEquals(11, DisplayWidth.of("T.int32(16)"));
    }

    @Test
    void cjkTakesTwoColumns() {
        assertEquals(4, DisplayWidth.of("日本"));
        assertEquals(6, DisplayWidth.of("\"日本\""));
        assertEquals(2, DisplayWidth.of('한'));
    }

    @Test
    void combiningMarksTakeNoColumn() {
        assertEquals(1, DisplayWidth.of("e\u0301"));
        assertEquals(0, DisplayWidth.of(0x200B));
    }

    @Test
    void supplementaryCodePointsAreCountedOnce() {
        assertEquals(2, DisplayWidth.of("😀"));
        assertEquals(3, DisplayWidth.of("a𠀀"));
    }
}
