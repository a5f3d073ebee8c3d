package org.chunksieve.isa;

/**
 * Engine opcodes used by the divisor search programs.
 * <p>
 * The numeric codes are fixed by the external engine and occupy the low 16 bits
 * of every instruction word.
 */
public enum Opcode {

    /** Allocates chunk {@code target} with {@code op1} digits of depth. */
    INIT(0x01),
    /** Collapses chunk {@code target} and prints its local value. */
    MEASURE(0x07),
    /** Diffusion/amplification step on chunk {@code target}. */
    GROVER(0x08),
    /** Invokes oracle {@code op1} on chunk {@code target}. */
    ORACLE(0x0B),
    /** Writes bits 0-31 of register {@code target} from {@code op1} (low half) and {@code op2} (high half). */
    STORE_LO(0x17),
    /** Writes bits 32-63 of register {@code target} from {@code op1} (low half) and {@code op2} (high half). */
    STORE_HI(0x18),
    /** Loads the engine's weight table before any chunk is touched. */
    IMPORT_WEIGHTS(0x1A),
    /** Terminates the program. */
    HALT(0xFF);

    /** Oracle id of the divisor-test predicate. */
    public static final int ORACLE_DIVISOR = 0x0C;

    private final int code;

    Opcode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
