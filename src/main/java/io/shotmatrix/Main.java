package io.shotmatrix;

import io.shotmatrix.cli.ShotMatrixCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new ShotMatrixCommand()).execute(args);
        System.exit(code);
    }
}
