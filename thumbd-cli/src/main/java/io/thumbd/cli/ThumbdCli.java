package io.thumbd.cli;

import java.io.PrintStream;
import java.util.Arrays;

public final class ThumbdCli {
    private static final String VERSION = "0.1.0-SNAPSHOT";

    public static void main(String[] args) {
        int exitCode = run(args, System.out, System.err);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            printUsage(out);
            return 0;
        }

        String command = args[0];
        String[] commandArgs = Arrays.copyOfRange(args, 1, args.length);

        return switch (command) {
            case "fetch" -> FetchCommand.run(commandArgs, out, err);
            case "sweep" -> CacheCommand.run(CacheCommand.Action.SWEEP, commandArgs, out, err);
            case "clear" -> CacheCommand.run(CacheCommand.Action.CLEAR, commandArgs, out, err);
            case "stats" -> CacheCommand.run(CacheCommand.Action.STATS, commandArgs, out, err);
            case "help", "--help", "-h" -> {
                printUsage(out);
                yield 0;
            }
            case "version", "--version", "-v" -> {
                out.println("thumbd " + VERSION);
                yield 0;
            }
            default -> {
                err.println("Unknown command: " + command);
                err.println();
                printUsage(err);
                yield 1;
            }
        };
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: thumbd <command> [options]");
        out.println();
        out.println("Commands:");
        out.println("  fetch    Load images through the cache and report the results");
        out.println("  sweep    Trim the disk cache below its size limit");
        out.println("  clear    Delete every cached image (pre-rendered thumbnails are kept)");
        out.println("  stats    Show cache usage");
        out.println("  help     Show this help message");
        out.println("  version  Show version information");
        out.println();
        out.println("Run 'thumbd <command> --help' for more information on a command.");
    }
}
