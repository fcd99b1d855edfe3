package com.stg2va.cli;

import org.slf4j.Logger;
import picocli.CommandLine.Model.CommandSpec;

import java.io.IOException;
import java.io.PrintWriter;

/**
 * Reporting of failed commands.
 */
final class CommandErrors {

    static final int EXIT_COMPILE_ERROR = 1;

    private CommandErrors() {
        // Utility class
    }

    /**
     * Logs a failure and prints a one-line diagnostic to the command's error stream.
     *
     * @param spec command spec providing the error stream
     * @param log logger of the failing command
     * @param what description of the failed action
     * @param e cause
     * @return exit code for compile errors
     */
    static int report(CommandSpec spec, Logger log, String what, Exception e) {
        log.debug(what, e);
        PrintWriter err = spec.commandLine().getErr();
        String message = e instanceof IOException ? "cannot read " + e.getMessage() : e.getMessage();
        err.println("error: " + message);
        err.flush();
        return EXIT_COMPILE_ERROR;
    }
}
