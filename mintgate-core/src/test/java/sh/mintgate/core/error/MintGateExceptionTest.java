// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.error;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import sh.mintgate.core.types.Address;
import sh.mintgate.core.types.TokenId;

class MintGateExceptionTest {

    private static final Address HOLDER = new Address("0x" + "1".repeat(40));
    private static final Address ASSET = new Address("0x" + "2".repeat(40));

    @Test
    void issuanceExceptionKeepsContextAndCause() {
        IllegalStateException cause = new IllegalStateException("receiver rejected");
        IssuanceException ex = new IssuanceException(HOLDER, TokenId.of(3), cause);

        assertSame(cause, ex.getCause());
        assertEquals(HOLDER, ex.recipient());
        assertEquals(TokenId.of(3), ex.tokenId());
        assertTrue(ex.getMessage().contains("receiver rejected"));
        assertInstanceOf(MintGateException.class, ex);
    }

    @Test
    void oracleExceptionKeepsContext() {
        OracleException ex = new OracleException(ASSET, HOLDER, new RuntimeException("timeout"));
        assertEquals(ASSET, ex.asset());
        assertEquals(HOLDER, ex.holder());
        assertTrue(ex.getMessage().contains(HOLDER.value()));
    }

    @Test
    void rejectedExceptionWithoutDetailUsesDescriptionOnly() {
        RejectedException ex = new RejectedException(MintError.INVALID_QUANTITY, "");
        assertEquals("INVALID_QUANTITY: quantity must be at least 1", ex.getMessage());
    }
}
