package io.mirrorboard;

import io.mirrorboard.cli.BoardCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = BoardCommand.newCommandLine().execute(args);
        System.exit(code);
    }
}
