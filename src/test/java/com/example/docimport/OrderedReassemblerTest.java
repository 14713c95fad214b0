package com.example.docimport;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OrderedReassemblerTest {

    private final List<Object> released = new ArrayList<>();

    private static Document doc(long i) {
        return Document.builder().append("i", i).build();
    }

    private OrderedReassembler reassembler(int window) {
        return new OrderedReassembler(window, d -> released.add(d.get("i")));
    }

    @Test
    void holdsOutOfTurnResultsUntilTheGapCloses() throws Exception {
        OrderedReassembler r = reassembler(4);
        assertTrue(r.permits().tryAcquire(4));

        r.complete(2, doc(2));
        r.complete(1, doc(1));
        assertTrue(released.isEmpty());
        assertEquals(0, r.permits().availablePermits());

        r.complete(0, doc(0));
        assertEquals(List.of(0L, 1L, 2L), released);
        assertEquals(3, r.nextExpected());
        assertEquals(3, r.permits().availablePermits());

        r.complete(3, doc(3));
        assertEquals(List.of(0L, 1L, 2L, 3L), released);
    }

    @Test
    void wrapsAroundTheRing() throws Exception {
        OrderedReassembler r = reassembler(2);
        for (long i = 0; i < 10; i += 2) {
            r.complete(i + 1, doc(i + 1));
            r.complete(i, doc(i));
        }
        assertEquals(List.of(0L, 1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L, 9L), released);
    }

    @Test
    void rejectsIndexOutsideWindow() throws Exception {
        OrderedReassembler r = reassembler(2);
        assertThrows(IllegalStateException.class, () -> r.complete(2, doc(2)));
        r.complete(0, doc(0));
        assertThrows(IllegalStateException.class, () -> r.complete(0, doc(0)));
    }

    @Test
    void stopsWhenDownstreamRefuses() throws Exception {
        OrderedReassembler r = new OrderedReassembler(4, d -> false);
        r.complete(0, doc(0));
        assertEquals(0, r.nextExpected());
    }
}
