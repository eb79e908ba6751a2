import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import core.JumpTaxaResult;
import core.MovieData;
import core.TreeMovieBuilder;
import output.MovieDataWriter;
import preprocessing.TreeSequence;
import utils.Config;

/**
 * Command-line entry point.
 *
 * Reads a Newick or NEXUS tree sequence, builds the interpolated movie and
 * the jumping taxa of every consecutive pair, and writes them as JSON.
 */
public class Main {

    public static void main(String[] args) throws IOException {

        String inputFilePath = null;
        String outputFilePath = null;
        String orderFilePath = null;
        int start = 1;
        int step = 1;
        boolean verbose = false;

        // Parse command line arguments
        for (int i = 0; i < args.length; i++) {
            if (args[i].equals("-i") && i + 1 < args.length) {
                inputFilePath = args[i + 1];
                i++;
            } else if (args[i].equals("-o") && i + 1 < args.length) {
                outputFilePath = args[i + 1];
                i++;
            } else if (args[i].equals("--order") && i + 1 < args.length) {
                orderFilePath = args[i + 1];
                i++;
            } else if (args[i].equals("--start") && i + 1 < args.length) {
                start = parsePositive("start", args[i + 1]);
                i++;
            } else if (args[i].equals("--step") && i + 1 < args.length) {
                step = parsePositive("step", args[i + 1]);
                i++;
            } else if (args[i].equals("--max-rounds") && i + 1 < args.length) {
                Config.MAX_PRUNING_ROUNDS = parsePositive("max-rounds", args[i + 1]);
                i++;
            } else if (args[i].equals("-v")) {
                verbose = true;
            } else {
                System.err.println("Warning: Ignoring unknown argument '" + args[i] + "'");
            }
        }

        // Validate required arguments
        if (inputFilePath == null || outputFilePath == null) {
            System.out.println("Usage: java Main -i <input_file> -o <output_file> [options]");
            System.out.println("Options:");
            System.out.println("  --order <file>      Leaf order, one name per line");
            System.out.println("  --start <n>         First tree to use, 1-based (default: 1)");
            System.out.println("  --step <n>          Use every n-th tree (default: 1)");
            System.out.println("  --max-rounds <n>    Cap on pruning rounds per pair (default: " + Config.MAX_PRUNING_ROUNDS + ")");
            System.out.println("  -v                  Verbose output");
            System.exit(-1);
        }

        File inputFile = new File(inputFilePath);
        if (!inputFile.exists()) {
            System.err.println("Error: Input file '" + inputFilePath + "' does not exist.");
            System.exit(-1);
        }

        List<String> leafOrder = null;
        if (orderFilePath != null) {
            if (!new File(orderFilePath).exists()) {
                System.err.println("Error: Leaf order file '" + orderFilePath + "' does not exist.");
                System.exit(-1);
            }
            leafOrder = TreeSequence.readLeafOrder(Path.of(orderFilePath));
        }

        if (verbose) {
            Config.VERBOSE = true;
            Config.printConfig();
        }

        System.out.println("Input file: " + inputFilePath);
        System.out.println("Output file: " + outputFilePath);

        long startTime = System.nanoTime();

        String text = Files.readString(inputFile.toPath(), StandardCharsets.UTF_8);
        MovieData data = new TreeMovieBuilder().build(text, inputFile.getName(), leafOrder, start, step);
        if (data.isEmpty()) {
            System.err.println("Error: No trees could be read from '" + inputFilePath + "'");
            System.exit(-1);
        }

        new MovieDataWriter().write(data, new File(outputFilePath));

        long endTime = System.nanoTime();
        double duration = (endTime - startTime) / 1_000_000_000.0;

        System.out.println("Trees read: " + data.inputTreeCount);
        System.out.println("Trees written: " + data.trees.size());
        for (JumpTaxaResult result : data.jumpTaxa) {
            System.out.println("  " + result);
        }
        System.out.println("Time taken: " + duration + " seconds");
        System.out.println("Output written to: " + outputFilePath);
    }

    private static int parsePositive(String name, String value) {
        try {
            int parsed = Integer.parseInt(value);
            if (parsed >= 1) {
                return parsed;
            }
        } catch (NumberFormatException e) {
            System.err.println("Error: Invalid " + name + " value '" + value + "'");
            System.exit(-1);
        }
        System.err.println("Error: " + name + " must be at least 1, got " + value);
        System.exit(-1);
        return -1;
    }
}
