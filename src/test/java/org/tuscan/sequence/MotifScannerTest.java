package org.tuscan.sequence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Random;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import it.unimi.dsi.fastutil.ints.IntIterator;

@Tag("unit")
class MotifScannerTest {

    private final MotifScanner scanner = new MotifScanner();

    @Test
    void findsSingleWindowWithAnchorAtIndex25() {
        String sequence = "A".repeat(25) + "GGA";

        assertThat((List<Integer>) scanner.findOffsets(sequence)).containsExactly(0);
    }

    @Test
    void reportsOverlappingWindows() {
        assertThat((List<Integer>) scanner.findOffsets("A".repeat(25) + "GGGA")).containsExactly(0, 1);
        assertThat((List<Integer>) scanner.findOffsets("G".repeat(30))).containsExactly(0, 1, 2);
    }

    @Test
    void anchorInsideNeighbouringWindowStillMatches() {
        // the GG at 26-27 anchors offset 1 and lies inside the window at offset 0
        String sequence = "C".repeat(25) + "GGGT";

        assertThat((List<Integer>) scanner.findOffsets(sequence)).containsExactly(0, 1);
    }

    @Test
    void anchorOfFirstWindowDoesNotHideAnchorOfLaterWindow() {
        String sequence = "A".repeat(25) + "GG" + "A".repeat(3) + "GG" + "A".repeat(3);

        assertThat((List<Integer>) scanner.findOffsets(sequence)).containsExactly(0, 5);
    }

    @Test
    void returnsNothingForShortSequence() {
        assertThat((List<Integer>) scanner.findOffsets("A".repeat(25) + "GG")).isEmpty();
        assertThat((List<Integer>) scanner.findOffsets("")).isEmpty();
    }

    @Test
    void skipsWindowsCoveringInvalidCharacters() {
        assertThat((List<Integer>) scanner.findOffsets("AAAN" + "A".repeat(21) + "GGA")).isEmpty();
        assertThat((List<Integer>) scanner.findOffsets("A".repeat(25) + "GGN")).isEmpty();
        // the N only blocks the window that covers it
        assertThat((List<Integer>) scanner.findOffsets("N" + "A".repeat(25) + "GGA")).containsExactly(1);
    }

    @Test
    void matchesBruteForceOnRandomSequences() {
        Random random = new Random(42);
        String alphabet = "ACGTGGN";
        for (int n = 0; n < 20; n++) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < 2000; i++) {
                sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
            }
            String sequence = sb.toString();

            assertThat((List<Integer>) scanner.findOffsets(sequence)).containsExactlyElementsOf(bruteForce(sequence));
        }
    }

    @Test
    void cursorYieldsOffsetsOneAtATime() {
        IntIterator cursor = scanner.offsets("G".repeat(40));

        assertThat(cursor.hasNext()).isTrue();
        assertThat(cursor.nextInt()).isZero();
        assertThat(cursor.nextInt()).isEqualTo(1);
        List<Integer> rest = new ArrayList<>();
        while (cursor.hasNext()) {
            rest.add(cursor.nextInt());
        }
        assertThat(rest).hasSize(11).isSorted().startsWith(2).endsWith(12);
        assertThat(cursor.hasNext()).isFalse();
        assertThatThrownBy(cursor::nextInt).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void cursorOverShortSequenceIsEmpty() {
        assertThat(scanner.offsets("GG").hasNext()).isFalse();
    }

    private static List<Integer> bruteForce(String sequence) {
        List<Integer> offsets = new ArrayList<>();
        for (int i = 0; i + Candidate.WINDOW_LENGTH <= sequence.length(); i++) {
            String window = sequence.substring(i, i + Candidate.WINDOW_LENGTH);
            if (window.chars().allMatch(c -> Nucleotides.isBase((char) c)) && window.startsWith("GG", 25)) {
                offsets.add(i);
            }
        }
        return offsets;
    }
}
