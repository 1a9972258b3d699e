package org.tuscan.sequence;

/**
 * The strand a candidate was found on.
 */
public enum Strand {
    FORWARD("+"),
    REVERSE("-");

    private final String symbol;

    Strand(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return the report symbol, {@code +} or {@code -}.
     */
    public String symbol() {
        return symbol;
    }
}
