package org.chunksieve.testing;

/**
 * Engine stand-in that prints one line and then hangs, for timeout and cancellation tests.
 */
public final class StallingEngine {

    private StallingEngine() {
    }

    public static void main(String[] args) throws InterruptedException {
        System.out.println("[INIT] stalling");
        System.out.flush();
        Thread.sleep(60_000);
    }
}
