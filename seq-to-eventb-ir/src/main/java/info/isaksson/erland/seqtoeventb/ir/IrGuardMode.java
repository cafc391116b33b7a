package info.isaksson.erland.seqtoeventb.ir;

/**
 * How a guard variable gets its initial value.
 */
public enum IrGuardMode {
    /** {@code [x = 1]}: initialized with the literal. */
    DETERMINISTIC,
    /** {@code [x : 0..10]}: initialized by membership in the literal range. */
    NON_DETERMINISTIC,
    /** {@code [x < 5]}: only compared against, initialized with {@code 0}. */
    DEFAULT
}
