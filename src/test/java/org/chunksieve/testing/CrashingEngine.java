package org.chunksieve.testing;

/**
 * Engine stand-in that exits with code 3 without printing anything.
 */
public final class CrashingEngine {

    public static final int EXIT_CODE = 3;

    private CrashingEngine() {
    }

    public static void main(String[] args) {
        System.exit(EXIT_CODE);
    }
}
