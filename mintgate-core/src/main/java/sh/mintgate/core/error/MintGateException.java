// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.error;

/**
 * Base runtime exception for all MintGate failures.
 *
 * <p>
 * Expected rejections are returned as {@link Outcome} values. Exceptions are reserved for
 * collaborator failures and for callers that opt into throwing via
 * {@link Outcome#orThrow()}.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * MintGateException
 * ├── {@link RejectedException} - a business rule refused the operation
 * ├── {@link IssuanceException} - the issuance primitive failed to create units
 * └── {@link OracleException} - the balance oracle failed to answer
 * </pre>
 *
 * @since 0.1.0
 */
public sealed class MintGateException extends RuntimeException
        permits RejectedException,
        IssuanceException,
        OracleException {

    public MintGateException(final String message) {
        super(message);
    }

    public MintGateException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
