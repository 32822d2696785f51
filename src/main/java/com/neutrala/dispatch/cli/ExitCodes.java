package com.neutrala.dispatch.cli;

/**
 * Process exit codes shared by the subcommands.
 */
final class ExitCodes {

    static final int OK = 0;
    static final int FAILURE = 1;
    static final int COMPILE_ERROR = 2;
    static final int TOOLCHAIN_MISSING = 3;

    private ExitCodes() {}
}
