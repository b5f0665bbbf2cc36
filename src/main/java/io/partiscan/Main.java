package io.partiscan;

import io.partiscan.cli.PartiscanCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new PartiscanCommand()).execute(args);
        System.exit(code);
    }
}
