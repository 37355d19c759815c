package io.subrelay;

import io.subrelay.cli.SubRelayCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SubRelayCommand()).execute(args);
        System.exit(code);
    }
}
