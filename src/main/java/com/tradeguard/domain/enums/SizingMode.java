package com.tradeguard.domain.enums;

/**
 * How the EV gate searches for a smaller size when the requested one fails the threshold.
 *
 * <p>BINARY_SEARCH assumes EV is concave in size (linear edge, super-linear slippage).
 * GRID scans a bounded set of evenly spaced sizes and makes no shape assumption.
 */
public enum SizingMode {
    BINARY_SEARCH,
    GRID
}
