// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintgate.core.error;

import sh.mintgate.core.types.Address;

/**
 * Thrown when the balance oracle cannot answer a balance query.
 *
 * @since 0.1.0
 */
public final class OracleException extends MintGateException {

    private final Address asset;
    private final Address holder;

    public OracleException(final Address asset, final Address holder, final Throwable cause) {
        super("Balance query for " + holder + " on asset " + asset + " failed: " + cause.getMessage(), cause);
        this.asset = asset;
        this.holder = holder;
    }

    public Address asset() {
        return asset;
    }

    public Address holder() {
        return holder;
    }
}
