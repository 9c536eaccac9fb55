// file: cli/src/main/java/io/merklite/cli/CliException.java
package io.merklite.cli;

/** Usage or input problem; reported as "error: ..." with exit code 1. */
final class CliException extends RuntimeException {

    CliException(String msg) {
        super(msg);
    }

    CliException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
