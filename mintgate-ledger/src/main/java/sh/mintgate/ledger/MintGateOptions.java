// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.ledger;

import java.math.BigInteger;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.mintgate.core.types.Address;
import sh.mintgate.core.types.TokenId;

/**
 * Initial configuration of a {@link MintGate}.
 *
 * <p>Everything here except the collection name and symbol can be changed later by the
 * owner; the options only seed the starting values.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * var options = MintGateOptions.builder()
 *     .name("Members Pass")
 *     .symbol("PASS")
 *     .asset(Address.of("0x..."))
 *     .requiredBalance(BigInteger.valueOf(1_000))
 *     .mintQuantity(BigInteger.ONE)
 *     .build();
 * }</pre>
 */
public final class MintGateOptions {

    /** Default collection name. */
    public static final String DEFAULT_NAME = "MintGate Collection";

    /** Default collection symbol. */
    public static final String DEFAULT_SYMBOL = "MGC";

    /** Default required balance: 1010 whole units of a 4-decimal asset. */
    public static final BigInteger DEFAULT_REQUIRED_BALANCE = BigInteger.valueOf(1010L).multiply(BigInteger.TEN.pow(4));

    /** Default token id handed out by self-service and batch mints. */
    public static final TokenId DEFAULT_MINTABLE_TOKEN_ID = TokenId.ZERO;

    /** Default units per self-service or batch mint. */
    public static final BigInteger DEFAULT_MINT_QUANTITY = BigInteger.ONE;

    private static final MintGateOptions DEFAULTS = builder().build();

    private final String name;
    private final String symbol;
    private final @Nullable Address asset;
    private final BigInteger requiredBalance;
    private final TokenId mintableTokenId;
    private final BigInteger mintQuantity;

    private MintGateOptions(Builder builder) {
        this.name = builder.name;
        this.symbol = builder.symbol;
        this.asset = builder.asset;
        this.requiredBalance = builder.requiredBalance;
        this.mintableTokenId = builder.mintableTokenId;
        this.mintQuantity = builder.mintQuantity;
    }

    /**
     * Returns options with all default values and no asset.
     *
     * @return default options
     */
    public static MintGateOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder seeded with this instance's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .name(name)
                .symbol(symbol)
                .asset(asset)
                .requiredBalance(requiredBalance)
                .mintableTokenId(mintableTokenId)
                .mintQuantity(mintQuantity);
    }

    public String name() {
        return name;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * The asset whose balance gates self-service mints, or null if not configured.
     * {@link MintGate.Builder#build()} requires one.
     */
    public @Nullable Address asset() {
        return asset;
    }

    public BigInteger requiredBalance() {
        return requiredBalance;
    }

    public TokenId mintableTokenId() {
        return mintableTokenId;
    }

    public BigInteger mintQuantity() {
        return mintQuantity;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MintGateOptions other)) {
            return false;
        }
        return name.equals(other.name)
                && symbol.equals(other.symbol)
                && Objects.equals(asset, other.asset)
                && requiredBalance.equals(other.requiredBalance)
                && mintableTokenId.equals(other.mintableTokenId)
                && mintQuantity.equals(other.mintQuantity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, symbol, asset, requiredBalance, mintableTokenId, mintQuantity);
    }

    @Override
    public String toString() {
        return "MintGateOptions{"
                + "name=" + name
                + ", symbol=" + symbol
                + ", asset=" + asset
                + ", requiredBalance=" + requiredBalance
                + ", mintableTokenId=" + mintableTokenId.toDecimalString()
                + ", mintQuantity=" + mintQuantity
                + '}';
    }

    /**
     * Builder for creating MintGateOptions instances.
     */
    public static final class Builder {
        private String name = DEFAULT_NAME;
        private String symbol = DEFAULT_SYMBOL;
        private @Nullable Address asset;
        private BigInteger requiredBalance = DEFAULT_REQUIRED_BALANCE;
        private TokenId mintableTokenId = DEFAULT_MINTABLE_TOKEN_ID;
        private BigInteger mintQuantity = DEFAULT_MINT_QUANTITY;

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException if {@code name} is blank
         */
        public Builder name(final String name) {
            Objects.requireNonNull(name, "name");
            if (name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            this.name = name;
            return this;
        }

        /**
         * @throws IllegalArgumentException if {@code symbol} is blank
         */
        public Builder symbol(final String symbol) {
            Objects.requireNonNull(symbol, "symbol");
            if (symbol.isBlank()) {
                throw new IllegalArgumentException("symbol must not be blank");
            }
            this.symbol = symbol;
            return this;
        }

        /**
         * @throws IllegalArgumentException if {@code asset} is the null identity
         */
        public Builder asset(final @Nullable Address asset) {
            if (asset != null && asset.isZero()) {
                throw new IllegalArgumentException("asset cannot be the null identity");
            }
            this.asset = asset;
            return this;
        }

        /**
         * @throws IllegalArgumentException if {@code requiredBalance} is negative
         */
        public Builder requiredBalance(final BigInteger requiredBalance) {
            Objects.requireNonNull(requiredBalance, "requiredBalance");
            if (requiredBalance.signum() < 0) {
                throw new IllegalArgumentException("requiredBalance must be non-negative, got: " + requiredBalance);
            }
            this.requiredBalance = requiredBalance;
            return this;
        }

        public Builder mintableTokenId(final TokenId mintableTokenId) {
            this.mintableTokenId = Objects.requireNonNull(mintableTokenId, "mintableTokenId");
            return this;
        }

        /**
         * @throws IllegalArgumentException if {@code mintQuantity} is below 1
         */
        public Builder mintQuantity(final BigInteger mintQuantity) {
            Objects.requireNonNull(mintQuantity, "mintQuantity");
            if (mintQuantity.signum() <= 0) {
                throw new IllegalArgumentException("mintQuantity must be at least 1, got: " + mintQuantity);
            }
            this.mintQuantity = mintQuantity;
            return this;
        }

        public MintGateOptions build() {
            return new MintGateOptions(this);
        }
    }
}
