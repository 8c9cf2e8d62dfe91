package work.lcod.rlm.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class DurationParserTest {
    @Test
    void bareNumberIsSeconds() {
        assertEquals(Duration.ofSeconds(20), DurationParser.parse("20").orElseThrow());
    }

    @Test
    void parsesUnits() {
        assertEquals(Duration.ofMillis(1500), DurationParser.parse("1500ms").orElseThrow());
        assertEquals(Duration.ofSeconds(5), DurationParser.parse("5s").orElseThrow());
        assertEquals(Duration.ofMinutes(2), DurationParser.parse("2M").orElseThrow());
        assertEquals(Duration.ofHours(1), DurationParser.parse(" 1h ").orElseThrow());
    }

    @Test
    void blankIsEmpty() {
        assertTrue(DurationParser.parse("  ").isEmpty());
        assertTrue(DurationParser.parse(null).isEmpty());
    }

    @Test
    void rejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("soon"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("-5s"));
    }

    @Test
    void numbersAndFallbacks() {
        assertEquals(Duration.ofSeconds(7), DurationParser.parseOrDefault(7, Duration.ZERO));
        assertEquals(Duration.ofSeconds(3), DurationParser.parseOrDefault(null, Duration.ofSeconds(3)));
        assertEquals(Duration.ofMillis(250), DurationParser.parseOrDefault("250ms", Duration.ZERO));
    }
}
