package io.thumbd.cli;

import io.thumbd.cache.CacheStats;
import io.thumbd.cache.TieredCache;
import io.thumbd.common.ExecutorTaskScheduler;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Locale;

final class CacheCommand {

    enum Action {
        SWEEP("sweep", "Delete the oldest disk entries until the disk cache is below its limit."),
        CLEAR("clear", "Delete every cached image from memory and disk."),
        STATS("stats", "Show memory and disk cache usage.");

        final String command;
        final String description;

        Action(String command, String description) {
            this.command = command;
            this.description = description;
        }
    }

    static int run(Action action, String[] args, PrintStream out, PrintStream err) {
        return run(action, args, out, err, ThumbdConfig.defaultRoot());
    }

    static int run(Action action, String[] args, PrintStream out, PrintStream err, Path root) {
        Path configFile = null;
        boolean thumbnails = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("--config") || arg.equals("-c")) {
                if (i + 1 >= args.length) {
                    err.println("Error: --config requires a value");
                    return 1;
                }
                configFile = Path.of(args[++i]);
            } else if (arg.equals("--thumbnails") && action == Action.CLEAR) {
                thumbnails = true;
            } else if (arg.equals("--help") || arg.equals("-h")) {
                printUsage(action, out);
                return 0;
            } else {
                err.println("Error: unknown option: " + arg);
                err.println();
                printUsage(action, err);
                return 1;
            }
        }

        ThumbdConfig config;
        try {
            config = Options.loadConfig(configFile, root);
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: cannot read configuration: " + e.getMessage());
            return 1;
        }

        try (ExecutorTaskScheduler timer = ExecutorTaskScheduler.create("thumbd-timer");
             TieredCache cache = TieredCache.open(config.cache(), timer)) {
            CacheStats before = cache.stats();
            switch (action) {
                case SWEEP -> {
                    cache.sweepDisk();
                    CacheStats after = cache.stats();
                    out.println("Removed " + (before.diskCount() - after.diskCount()) + " entries, freed "
                        + Sizes.format(before.diskBytes() - after.diskBytes()));
                    printStats(after, out);
                }
                case CLEAR -> {
                    cache.clearAll();
                    out.println("Removed " + before.diskCount() + " cached images");
                    if (thumbnails) {
                        out.println("Removed " + cache.clearThumbnails() + " thumbnails");
                    }
                }
                case STATS -> printStats(before, out);
            }
            return 0;
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static void printStats(CacheStats stats, PrintStream out) {
        out.printf(Locale.ROOT, "Memory: %d entries, %s of %s%n",
            stats.memoryCount(), Sizes.format(stats.memoryBytes()), Sizes.format(stats.maxMemoryBytes()));
        out.printf(Locale.ROOT, "Disk:   %d entries, %s of %s%n",
            stats.diskCount(), Sizes.format(stats.diskBytes()), Sizes.format(stats.maxDiskBytes()));
    }

    private static void printUsage(Action action, PrintStream out) {
        out.println("Usage: thumbd " + action.command + " [options]");
        out.println();
        out.println(action.description);
        out.println();
        out.println("Options:");
        out.println("  -c, --config <file>  Properties file with cache settings");
        if (action == Action.CLEAR) {
            out.println("      --thumbnails     Also delete pre-rendered thumbnails");
        }
        out.println("  -h, --help           Show this help message");
    }
}
