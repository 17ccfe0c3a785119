// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.error;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import org.jspecify.annotations.Nullable;

/**
 * Result of a ledger operation that can be refused by a business rule.
 * <p>
 * This is a sealed interface with two implementations:
 * <ul>
 *   <li>{@link Success} - the operation was applied</li>
 *   <li>{@link Rejected} - a precondition failed and nothing was changed</li>
 * </ul>
 * <p>
 * Callers branch on the exact {@link MintError} instead of parsing messages:
 * <pre>{@code
 * Outcome<TokenMinted> outcome = gate.selfMint(caller);
 * if (outcome instanceof Outcome.Rejected<TokenMinted> r
 *         && r.reason() == MintError.INSUFFICIENT_BALANCE) {
 *     // prompt the user to top up
 * }
 * }</pre>
 *
 * @param <T> the value produced on success
 */
public sealed interface Outcome<T> permits Outcome.Success, Outcome.Rejected {

    static <T> Outcome<T> success(final @Nullable T value) {
        return new Success<>(value);
    }

    static <T> Outcome<T> rejected(final MintError error, final String detail) {
        return new Rejected<>(error, detail);
    }

    boolean isSuccess();

    /**
     * The rejection reason, empty on success.
     */
    Optional<MintError> error();

    /**
     * Returns the success value or throws {@link RejectedException} carrying the error.
     */
    @Nullable T orThrow();

    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);

    /**
     * The applied case.
     *
     * @param value the produced value, null for state-only operations
     */
    record Success<T>(@Nullable T value) implements Outcome<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Optional<MintError> error() {
            return Optional.empty();
        }

        @Override
        public @Nullable T orThrow() {
            return value;
        }

        @Override
        public <U> Outcome<U> map(final Function<? super T, ? extends U> mapper) {
            return new Success<>(mapper.apply(value));
        }
    }

    /**
     * The refused case. State is untouched.
     *
     * @param reason the violated precondition
     * @param detail human-readable context, such as the offending address
     */
    record Rejected<T>(MintError reason, String detail) implements Outcome<T> {

        public Rejected {
            Objects.requireNonNull(reason, "reason");
            Objects.requireNonNull(detail, "detail");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Optional<MintError> error() {
            return Optional.of(reason);
        }

        @Override
        public @Nullable T orThrow() {
            throw new RejectedException(reason, detail);
        }

        @Override
        public <U> Outcome<U> map(final Function<? super T, ? extends U> mapper) {
            return new Rejected<>(reason, detail);
        }
    }
}
