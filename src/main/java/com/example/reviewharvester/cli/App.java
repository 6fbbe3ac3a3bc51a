package com.example.reviewharvester.cli;

import com.example.reviewharvester.browser.ChromeSessionFactory;
import com.example.reviewharvester.io.JsonResultStore;
import com.example.reviewharvester.io.TargetFileReader;
import com.example.reviewharvester.model.CollectionLog;
import com.example.reviewharvester.model.FailedTarget;
import com.example.reviewharvester.model.TargetRecord;
import com.example.reviewharvester.scraper.CollectionRun;
import com.example.reviewharvester.scraper.Coordinator;
import com.example.reviewharvester.scraper.HarvestConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final int EXIT_USAGE = 64;
    private static final String USAGE = "Usage: java -jar review-harvester.jar <targets.json> <outputDir> "
            + "[maxReviews|all] [workers] [headless=true|false] [startFrom] [limit] [config.json]\n"
            + "Each target is read in the config's sortPasses order (default: newest, then relevant).";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length < 2) {
            System.out.println(USAGE);
            return EXIT_USAGE;
        }

        Path targetsFile = Paths.get(args[0]);
        Path outputDir = Paths.get(args[1]);
        HarvestConfig config;
        try {
            config = configure(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid argument: " + e.getMessage());
            System.out.println(USAGE);
            return EXIT_USAGE;
        } catch (IOException e) {
            System.err.println("Could not read config: " + e.getMessage());
            return EXIT_USAGE;
        }

        List<TargetRecord> targets;
        try {
            targets = new TargetFileReader().read(targetsFile);
        } catch (IOException e) {
            System.err.println("Could not read targets: " + e.getMessage());
            return EXIT_USAGE;
        }

        Coordinator coordinator;
        try {
            coordinator = Coordinator.create(config, new ChromeSessionFactory(config), new JsonResultStore(outputDir));
        } catch (IOException e) {
            log.error("Could not load the site profile", e);
            return EXIT_USAGE;
        }

        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            coordinator.stop();
            try {
                // let in-flight targets finish and be written
                finished.await(5, TimeUnit.MINUTES);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "harvest-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            CollectionRun result = coordinator.run(targets);
            printSummary(result.getLog(), outputDir);
            return result.getLog().getOutcome().exitCode();
        } finally {
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down, stop hook stays registered");
            }
        }
    }

    /** Defaults, then the optional JSON config file, then the positional knobs. */
    static HarvestConfig configure(String[] args) throws IOException {
        HarvestConfig config = args.length >= 8 ? HarvestConfig.load(Paths.get(args[7])) : new HarvestConfig();
        if (args.length >= 3) {
            config.setMaxReviews(args[2].equalsIgnoreCase("all") ? null : parsePositive("maxReviews", args[2]));
        }
        if (args.length >= 4) {
            config.setWorkers(parsePositive("workers", args[3]));
        }
        if (args.length >= 5) {
            config.setHeadless(!args[4].equalsIgnoreCase("headless=false") && !args[4].equalsIgnoreCase("false"));
        }
        if (args.length >= 6) {
            config.setStartFrom(Integer.parseInt(args[5]));
        }
        if (args.length >= 7) {
            config.setLimit(args[6].equalsIgnoreCase("all") ? null : parsePositive("limit", args[6]));
        }
        return config.validate();
    }

    private static int parsePositive(String name, String raw) {
        int value;
        try {
            value = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number, got '" + raw + "'");
        }
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be >= 1, got " + value);
        }
        return value;
    }

    private static void printSummary(CollectionLog runLog, Path outputDir) {
        System.out.println();
        System.out.println("=== Harvest summary ===");
        System.out.printf("Outcome:        %s%n", runLog.getOutcome());
        System.out.printf("Targets:        %d attempted, %d succeeded, %d failed, %d skipped, %d not dispatched%n",
                runLog.getTargetsAttempted(), runLog.getTargetsSucceeded(), runLog.getTargetsFailed(),
                runLog.getTargetsSkipped(), runLog.getTargetsNotDispatched());
        System.out.printf("Reviews:        %d (%.2f/s)%n", runLog.getReviewsCollected(), runLog.reviewsPerSecond());
        System.out.printf("Elapsed:        %.1fs%n", runLog.getElapsedMillis() / 1000.0);
        for (FailedTarget f : runLog.getFailures()) {
            System.out.printf("  FAILED %s [%s] %s%n", f.getTargetId(), f.getKind(), f.getDetail());
        }
        if (!runLog.getCollisions().isEmpty()) {
            System.out.println("  Duplicate target ids: " + runLog.getCollisions());
        }
        System.out.println("Output:         " + outputDir.toAbsolutePath()
                + (Files.isDirectory(outputDir) ? "" : " (nothing written)"));
    }
}
