package org.arcx.cli;

import picocli.CommandLine;

/**
 * Main CLI entry point for arcx.
 * Compiles exclusive-arc mapping declarations into migration scripts.
 */
@CommandLine.Command(
        name = "arcx",
        mixinStandardHelpOptions = true,
        version = "arcx 0.1.0",
        description = "배타적 다형성 FK(exclusive arc) 제약조건 생성 툴",
        subcommands = {
                CompileCommand.class,
                InspectCommand.class
        }
)
public class ArcxCli {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new ArcxCli()).execute(args);
        System.exit(exitCode);
    }
}
