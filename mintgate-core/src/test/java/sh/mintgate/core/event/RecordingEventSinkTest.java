// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.event;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import sh.mintgate.core.types.Address;
import sh.mintgate.core.types.TokenId;

class RecordingEventSinkTest {

    private static final Address A = new Address("0x" + "a".repeat(40));

    @Test
    void keepsArrivalOrderAndFiltersByKind() {
        RecordingEventSink sink = new RecordingEventSink();
        sink.emit(new AdminAdded(A));
        sink.emit(new TokenMinted(A, TokenId.ZERO, BigInteger.ONE));
        sink.emit(new AdminRemoved(A));

        assertEquals(3, sink.size());
        assertEquals(List.of("AdminAdded", "TokenMinted", "AdminRemoved"),
                sink.events().stream().map(LedgerEvent::name).toList());
        assertEquals(List.of(new TokenMinted(A, TokenId.ZERO, BigInteger.ONE)), sink.eventsOf(TokenMinted.class));

        sink.clear();
        assertEquals(0, sink.size());
    }

    @Test
    void eventsReturnsACopy() {
        RecordingEventSink sink = new RecordingEventSink();
        sink.emit(new AdminAdded(A));
        assertThrows(UnsupportedOperationException.class, () -> sink.events().clear());
    }

    @Test
    void andThenDeliversToBothInOrder() {
        List<String> seen = new ArrayList<>();
        EventSink first = e -> seen.add("first:" + e.name());
        EventSink second = e -> seen.add("second:" + e.name());

        first.andThen(second).emit(new AdminAdded(A));

        assertEquals(List.of("first:AdminAdded", "second:AdminAdded"), seen);
    }

    @Test
    void eventsRejectNullFields() {
        assertThrows(NullPointerException.class, () -> new TokenMinted(A, null, BigInteger.ONE));
        assertThrows(NullPointerException.class, () -> new UriSet(TokenId.ZERO, null));
    }
}
