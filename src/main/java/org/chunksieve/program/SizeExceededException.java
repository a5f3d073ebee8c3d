package org.chunksieve.program;

/**
 * Thrown when a requested program exceeds one of the engine's addressable limits
 * (chunk count, modulus width, offset width or instruction count).
 * <p>
 * The engine itself would only crash on such input, so the limits are checked
 * before any program is emitted.
 */
public class SizeExceededException extends IllegalArgumentException {

    /**
     * Creates a SizeExceededException with the specified message.
     *
     * @param message Description of the exceeded limit
     */
    public SizeExceededException(String message) {
        super(message);
    }
}
