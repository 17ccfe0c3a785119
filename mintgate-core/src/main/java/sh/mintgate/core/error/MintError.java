// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.error;

/**
 * Expected business-rule rejections.
 *
 * <p>Each constant names one precondition a mutating operation checks before it
 * touches state. Rejections travel as {@link Outcome.Rejected} values; they only become
 * exceptions when a caller asks for that through {@link Outcome#orThrow()}.
 */
public enum MintError {
    /** Caller lacks the privilege the operation requires. */
    UNAUTHORIZED("caller is not authorized"),
    /** The null identity was supplied where a real actor is required. */
    INVALID_ADDRESS("null identity is not allowed"),
    ALREADY_ADMIN("address is already an admin"),
    NOT_ADMIN("address is not an admin"),
    /** The owner can never be an admin-set member. */
    OWNER_ALREADY_ADMIN("owner cannot be added as admin"),
    /** The address has used its one issuance. */
    ALREADY_MINTED("address has already minted"),
    INSUFFICIENT_BALANCE("balance is below the required threshold"),
    INVALID_QUANTITY("quantity must be at least 1"),
    UNKNOWN_TOKEN("token does not exist"),
    /** Paired lists differ in length. */
    LENGTH_MISMATCH("paired inputs differ in length");

    private final String description;

    MintError(final String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
