package io.skipkp;

import io.skipkp.cli.KeyProviderCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new KeyProviderCommand()).execute(args);
        System.exit(code);
    }
}
