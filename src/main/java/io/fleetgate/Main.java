package io.fleetgate;

import io.fleetgate.cli.FleetGateCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = FleetGateCommand.commandLine().execute(args);
        System.exit(code);
    }
}
