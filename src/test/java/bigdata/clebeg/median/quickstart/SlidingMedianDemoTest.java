package bigdata.clebeg.median.quickstart;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Scanner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SlidingMedianDemo")
class SlidingMedianDemoTest {

    @Test
    @DisplayName("stdin mode reads n, k and the values")
    void interactiveInput() {
        String medians = SlidingMedianDemo.runInteractive(new Scanner("8 3\n1 3 -1 -3 5 3 6 7\n"));

        assertEquals("1 -1 -1 3 5 6", medians);
    }

    @Test
    @DisplayName("stdin mode prints half medians")
    void interactiveEvenWindow() {
        assertEquals("2.5 3.5", SlidingMedianDemo.runInteractive(new Scanner("5 4 1 2 3 4 5")));
    }

    @Test
    @DisplayName("Truncated input or bad k is rejected")
    void interactiveBadInput() {
        assertThrows(IllegalArgumentException.class,
                () -> SlidingMedianDemo.runInteractive(new Scanner("4 2 1 2")));
        assertThrows(IllegalArgumentException.class,
                () -> SlidingMedianDemo.runInteractive(new Scanner("4 0 1 2 3 4")));
    }
}
