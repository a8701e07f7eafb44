package io.opgraph;

import io.opgraph.cli.OpGraphCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new OpGraphCommand()).execute(args);
        System.exit(code);
    }
}
