package org.chunksieve.testing;

import java.nio.file.Path;
import java.util.List;

/**
 * Builds engine commands that run one of the stand-in engines in a child JVM sharing
 * the test classpath.
 */
public final class EngineCommands {

    private EngineCommands() {
    }

    public static List<String> simulated() {
        return javaCommand(SimulatedEngine.class);
    }

    public static List<String> stalling() {
        return javaCommand(StallingEngine.class);
    }

    public static List<String> crashing() {
        return javaCommand(CrashingEngine.class);
    }

    public static List<String> javaCommand(Class<?> mainClass) {
        String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        String classPath = System.getProperty("surefire.test.class.path", System.getProperty("java.class.path"));
        return List.of(java, "-cp", classPath, mainClass.getName());
    }
}
