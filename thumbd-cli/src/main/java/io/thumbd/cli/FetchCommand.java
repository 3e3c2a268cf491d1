package io.thumbd.cli;

import io.thumbd.cache.CacheStats;
import io.thumbd.cache.TieredCache;
import io.thumbd.common.ExecutorTaskScheduler;
import io.thumbd.common.ThumbnailSize;
import io.thumbd.loader.HttpImageFetcher;
import io.thumbd.loader.ImageFetcher;
import io.thumbd.loader.LoadDispatcher;
import io.thumbd.loader.LoadListener;
import io.thumbd.loader.schedule.SchedulerStats;
import io.thumbd.loader.schedule.ThumbnailScheduler;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

final class FetchCommand {
    private static final ThumbnailSize DEFAULT_SIZE = ThumbnailSize.of(200, 200);
    private static final int DEFAULT_TIMEOUT_SECONDS = 60;

    static int run(String[] args, PrintStream out, PrintStream err) {
        return run(args, out, err, HttpImageFetcher.create(), ThumbdConfig.defaultRoot());
    }

    static int run(String[] args, PrintStream out, PrintStream err, ImageFetcher fetcher, Path root) {
        FetchOptions options;
        try {
            options = parseArgs(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println();
            printUsage(err);
            return 1;
        }

        if (options.help) {
            printUsage(out);
            return 0;
        }

        if (options.urls.isEmpty()) {
            err.println("Error: at least one URL is required");
            err.println();
            printUsage(err);
            return 1;
        }

        ThumbdConfig config;
        try {
            config = Options.loadConfig(options.configFile, root);
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: cannot read configuration: " + e.getMessage());
            return 1;
        }

        Map<String, String> results = new ConcurrentHashMap<>();
        CountDownLatch remaining = new CountDownLatch(options.urls.size());
        LoadListener listener = new LoadListener() {
            @Override
            public void onLoaded(String url, ThumbnailSize size, BufferedImage image) {
                if (results.putIfAbsent(url, "OK " + image.getWidth() + "x" + image.getHeight()) == null) {
                    remaining.countDown();
                }
            }

            @Override
            public void onFailed(String url, String message) {
                if (results.putIfAbsent(url, "FAILED " + message) == null) {
                    remaining.countDown();
                }
            }
        };

        try (ExecutorTaskScheduler timer = ExecutorTaskScheduler.create("thumbd-timer");
             TieredCache cache = TieredCache.open(config.cache(), timer);
             LoadDispatcher dispatcher = new LoadDispatcher(cache, fetcher, timer, config.dispatcher());
             ThumbnailScheduler thumbnails = ThumbnailScheduler.create(cache, dispatcher, timer, config.scheduler())) {

            thumbnails.addListener(listener);
            for (String url : options.urls) {
                thumbnails.loadThumbnail(url, options.size, true);
            }

            if (!remaining.await(options.timeoutSeconds, TimeUnit.SECONDS)) {
                err.println("Warning: timed out after " + options.timeoutSeconds + " seconds");
            }

            int failures = 0;
            for (String url : options.urls) {
                String result = results.getOrDefault(url, "TIMEOUT");
                if (!result.startsWith("OK")) {
                    failures++;
                }
                out.println(result + "  " + url);
            }

            SchedulerStats stats = thumbnails.getCacheStats();
            CacheStats cacheStats = cache.stats();
            out.println();
            out.printf(Locale.ROOT, "Requests: %d  cache hits: %d  hit rate: %.2f%n",
                stats.totalRequests(), stats.cacheHits(), stats.hitRate());
            out.printf(Locale.ROOT, "Fetched:  %d  failed: %d  avg load: %.1f ms%n",
                stats.dispatcher().loadedCount(), stats.dispatcher().failedCount(), stats.dispatcher().avgLoadMs());
            out.printf(Locale.ROOT, "Memory:   %d entries, %s%n", cacheStats.memoryCount(), Sizes.format(cacheStats.memoryBytes()));
            out.printf(Locale.ROOT, "Disk:     %d entries, %s%n", cacheStats.diskCount(), Sizes.format(cacheStats.diskBytes()));
            return failures == 0 ? 0 : 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Error: operation interrupted");
            return 1;
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private static FetchOptions parseArgs(String[] args) {
        FetchOptions options = new FetchOptions();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];

            switch (arg) {
                case "--help", "-h" -> options.help = true;
                case "--size", "-s" -> options.size = ThumbnailSize.parse(Options.requireValue(args, ++i, "--size"));
                case "--config", "-c" -> options.configFile = Path.of(Options.requireValue(args, ++i, "--config"));
                case "--timeout" -> {
                    options.timeoutSeconds = Options.requireIntValue(args, ++i, "--timeout");
                    if (options.timeoutSeconds <= 0) {
                        throw new IllegalArgumentException("--timeout must be positive");
                    }
                }
                default -> {
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    options.urls.add(arg);
                }
            }
        }

        return options;
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: thumbd fetch <url>... [options]");
        out.println();
        out.println("Load images through the memory and disk caches, fetching misses over HTTP.");
        out.println();
        out.println("Options:");
        out.println("  -s, --size <WxH>        Thumbnail bounds (default: " + DEFAULT_SIZE + ")");
        out.println("  -c, --config <file>     Properties file with cache settings");
        out.println("      --timeout <seconds> Give up waiting after this long (default: " + DEFAULT_TIMEOUT_SECONDS + ")");
        out.println("  -h, --help              Show this help message");
    }

    private static final class FetchOptions {
        boolean help;
        ThumbnailSize size = DEFAULT_SIZE;
        Path configFile;
        int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
        Set<String> urls = new LinkedHashSet<>();
    }
}
