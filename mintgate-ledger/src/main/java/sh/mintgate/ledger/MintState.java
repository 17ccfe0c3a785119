// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.ledger;

/**
 * Per-address issuance state. {@link #MINTED} is terminal.
 */
public enum MintState {
    NEVER_MINTED,
    MINTED
}
