package io.phonorules.cli;

import java.nio.file.Path;

/** Entry point for the {@code phono} command; delegates to {@link PhonoApp}. */
public final class PhonoMain {

    private PhonoMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code words.phono --generate 10})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int exitCode = new PhonoApp(System::getenv, Path.of("")).run(args, System.out, System.err);
        System.exit(exitCode);
    }
}
