package com.alterante.nearby;

import com.alterante.nearby.command.ReplayCommand;
import picocli.CommandLine;

@CommandLine.Command(
        name = "nearby-share",
        description = "Nearby sharing client: transfer session coordinator",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        subcommands = {
                ReplayCommand.class,
        }
)
public class Main implements Runnable {

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
