package org.chunksieve.isa;

/**
 * Thrown when an instruction field does not fit its declared bit width.
 * <p>
 * Truncating the value instead would silently redirect the instruction to a
 * different chunk or register, so the encoder rejects it.
 */
public class EncodingOverflowException extends IllegalArgumentException {

    private final String field;
    private final long value;

    /**
     * Creates the exception for a single offending field.
     *
     * @param field the field name (opcode, target, op1 or op2)
     * @param value the rejected value
     * @param bits  the width of the field in bits
     */
    public EncodingOverflowException(String field, long value, int bits) {
        super(String.format("Field '%s' must fit in %d unsigned bits, got: %d", field, bits, value));
        this.field = field;
        this.value = value;
    }

    public String getField() {
        return field;
    }

    public long getValue() {
        return value;
    }
}
