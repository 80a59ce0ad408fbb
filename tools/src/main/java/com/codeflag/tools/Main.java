package com.codeflag.tools;

import com.codeflag.tools.cli.CodeflagCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new CodeflagCommand()).execute(args);
        System.exit(code);
    }
}
