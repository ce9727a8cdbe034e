package org.dxworks.typfmt;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {

    private static final String TYP_EXTENSION = ".typ";
    private static final String CHECK_FLAG = "--check";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /** Runs the command line and returns the process exit code. */
    public static int run(String[] args) {
        boolean check = false;
        List<Path> inputs = new ArrayList<>();
        for (String arg : args) {
            if (CHECK_FLAG.equals(arg)) {
                check = true;
            } else if (arg.startsWith("--")) {
                System.err.println("Unknown option: " + arg);
                printUsage();
                return 2;
            } else {
                inputs.add(Paths.get(arg));
            }
        }
        if (inputs.isEmpty()) {
            printUsage();
            return 2;
        }

        List<Path> files = new ArrayList<>();
        for (Path input : inputs) {
            if (!Files.exists(input)) {
                System.err.println("Error: Input path does not exist: " + input);
                return 2;
            }
            try {
                files.addAll(collectTypstFiles(input));
            } catch (IOException e) {
                System.err.println("Error: Cannot list " + input + ": " + e.getMessage());
                return 1;
            }
        }

        Typfmt typfmt = new Typfmt(TypfmtConfig.load());
        System.out.println((check ? "Checking " : "Formatting ") + files.size() + " Typst files"
                + " (max width " + typfmt.getConfig().getMaxWidth() + ")");

        Instant startTime = Instant.now();
        AtomicInteger changedCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        boolean checkOnly = check;

        files.parallelStream().forEach(file -> {
            try {
                if (formatFile(typfmt, file, checkOnly)) {
                    changedCount.incrementAndGet();
                    synchronized (System.out) {
                        System.out.println((checkOnly ? "Would reformat: " : "Reformatted: ") + file);
                    }
                }
            } catch (Exception | StackOverflowError e) {
                errorCount.incrementAndGet();
                String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                synchronized (System.err) {
                    System.err.println("  Error formatting " + file + ": " + reason);
                }
            }
        });

        Duration duration = Duration.between(startTime, Instant.now());
        System.out.println("=".repeat(60));
        System.out.println((checkOnly ? "Files needing formatting: " : "Files reformatted: ") + changedCount.get()
                + " of " + files.size() + " in " + duration.toMillis() + " ms");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("=".repeat(60));

        if (errorCount.get() > 0) return 1;
        return checkOnly && changedCount.get() > 0 ? 1 : 0;
    }

    /** Formats one file. Returns whether its formatted text differs from what is on disk. */
    static boolean formatFile(Typfmt typfmt, Path file, boolean checkOnly) throws IOException, SyntaxErrorException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        String formatted = typfmt.format(content);
        if (formatted.equals(content)) return false;
        if (!checkOnly) {
            Files.writeString(file, formatted, StandardCharsets.UTF_8);
        }
        return true;
    }

    private static List<Path> collectTypstFiles(Path input) throws IOException {
        List<Path> files = new ArrayList<>();
        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(App::isTypstFile)
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            files.add(input);
        }
        return files;
    }

    private static boolean isTypstFile(Path path) {
        return path.getFileName().toString().endsWith(TYP_EXTENSION);
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar typfmt.jar <path>... [--check]");
        System.err.println("  <path>:   Typst file or directory searched for .typ files");
        System.err.println("  --check:  Only report files that would be reformatted");
    }
}
