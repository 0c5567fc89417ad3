package com.tokenledger.common;

/**
 * Currencies known to the ledger.
 * The token is the only asset held on chain; fiat currencies only appear as exchange payouts.
 */
public enum Currency {
    USDT(6, false),
    USD(2, true),
    UAH(2, true);

    private final int scale;
    private final boolean fiat;

    Currency(int scale, boolean fiat) {
        this.scale = scale;
        this.fiat = fiat;
    }

    /**
     * Number of digits kept after the decimal point.
     */
    public int getScale() {
        return scale;
    }

    public boolean isFiat() {
        return fiat;
    }
}
