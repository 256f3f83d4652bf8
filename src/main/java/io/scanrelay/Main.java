package io.scanrelay;

import io.scanrelay.cli.ScanRelayCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new ScanRelayCommand()).execute(args);
        System.exit(code);
    }
}
