package org.openfda.maude.pipeline;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.openfda.maude.ir.Category;
import org.openfda.maude.partition.CategoryMatcher;
import org.openfda.maude.pipeline.stage.JoinStage;
import org.openfda.maude.pipeline.stage.LoadStage;
import org.openfda.maude.pipeline.stage.SwapStage;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

/**
 * Command-line surface of the pipeline.
 */
public final class PipelineOptions {
    static final List<String> TARGETS = List.of(JoinStage.NAME, LoadStage.NAME, SwapStage.NAME);

    private PipelineOptions() {}

    public record Invocation(String target, PipelineConfig config, boolean help) {}

    public static Options options() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("target").hasArg().argName("stage")
            .desc("Stage to bring up to date: " + String.join(", ", TARGETS) + " (default load)").build());
        options.addOption(Option.builder().longOpt("data-root").hasArg().argName("dir")
            .desc("Root holding extracted/, partitioned/, json/ and meta/ (default data/maude)").build());
        options.addOption(Option.builder().longOpt("shards").hasArg().argName("n")
            .desc("Number of shards (default 32)").build());
        options.addOption(Option.builder().longOpt("delimiter").hasArg().argName("char")
            .desc("Field delimiter of the extracted files (default |)").build());
        options.addOption(Option.builder().longOpt("workers").hasArg().argName("n")
            .desc("Join worker pool size (default 6)").build());
        options.addOption(Option.builder().longOpt("partition-workers").hasArg().argName("n")
            .desc("Categories partitioned concurrently (default 4)").build());
        options.addOption(Option.builder().longOpt("category-match").hasArgs().argName("category=substring")
            .desc("Filename substring attributing a file to a category; repeatable").build());
        options.addOption(Option.builder().longOpt("ignore").hasArgs().argName("substring")
            .desc("Filename substring of files to skip; repeatable, replaces problem, add, change").build());
        options.addOption(Option.builder().longOpt("host").hasArg().argName("url")
            .desc("Search cluster endpoint (default localhost:9200)").build());
        options.addOption(Option.builder().longOpt("username").hasArg().desc("Basic auth user").build());
        options.addOption(Option.builder().longOpt("password").hasArg().desc("Basic auth password").build());
        options.addOption(Option.builder().longOpt("insecure")
            .desc("Trust any TLS certificate of the cluster").build());
        options.addOption(Option.builder().longOpt("index-prefix").hasArg()
            .desc("Alias the built index is swapped under (default deviceevent)").build());
        options.addOption(Option.builder().longOpt("index-name").hasArg()
            .desc("Index to build (default <prefix>.yyyy-MM-dd-HH-mm, UTC)").build());
        options.addOption(Option.builder().longOpt("mapping-file").hasArg().argName("file")
            .desc("JSON settings and mappings for the new index").build());
        options.addOption(Option.builder().longOpt("max-docs-per-batch").hasArg()
            .desc("Documents per bulk request (default 1000)").build());
        options.addOption(Option.builder().longOpt("max-bytes-per-batch").hasArg()
            .desc("Bytes per bulk request (default 10485760)").build());
        options.addOption(Option.builder().longOpt("swap-index-name").hasArg()
            .desc("Index to point the prefix alias at, for the swap target").build());
        options.addOption(Option.builder("h").longOpt("help").desc("Print usage").build());
        return options;
    }

    public static Invocation parse(String[] args, Clock clock) throws ParseException {
        CommandLineParser parser = new DefaultParser();
        CommandLine cmd = parser.parse(options(), args);

        String target = cmd.getOptionValue("target", LoadStage.NAME);
        if (!TARGETS.contains(target)) {
            throw new ParseException("Unknown target " + target + ", expected one of " + TARGETS);
        }

        var builder = PipelineConfig.builder();
        if (cmd.hasOption("data-root")) {
            builder.dataRoot(Path.of(cmd.getOptionValue("data-root")));
        }
        if (cmd.hasOption("shards")) {
            builder.shardCount(positiveInt(cmd, "shards"));
        }
        if (cmd.hasOption("workers")) {
            builder.workers(positiveInt(cmd, "workers"));
        }
        if (cmd.hasOption("partition-workers")) {
            builder.partitionParallelism(positiveInt(cmd, "partition-workers"));
        }
        if (cmd.hasOption("delimiter")) {
            String delimiter = cmd.getOptionValue("delimiter");
            if (delimiter.length() != 1) {
                throw new ParseException("Delimiter must be a single character: " + delimiter);
            }
            builder.delimiter(delimiter.charAt(0));
        }
        builder.categoryMatcher(categoryMatcher(cmd));

        if (cmd.hasOption("host")) {
            builder.host(cmd.getOptionValue("host"));
        }
        builder.username(cmd.getOptionValue("username"));
        builder.password(cmd.getOptionValue("password"));
        builder.insecure(cmd.hasOption("insecure"));

        String prefix = cmd.getOptionValue("index-prefix", PipelineConfig.DEFAULT_INDEX_PREFIX);
        builder.indexPrefix(prefix);
        builder.indexName(cmd.getOptionValue("index-name", PipelineConfig.timestampedIndexName(prefix, clock)));
        if (cmd.hasOption("mapping-file")) {
            builder.mappingFile(Path.of(cmd.getOptionValue("mapping-file")));
        }
        if (cmd.hasOption("max-docs-per-batch")) {
            builder.maxDocsPerBatch(positiveInt(cmd, "max-docs-per-batch"));
        }
        if (cmd.hasOption("max-bytes-per-batch")) {
            builder.maxBytesPerBatch(positiveLong(cmd, "max-bytes-per-batch"));
        }
        builder.swapIndexName(cmd.getOptionValue("swap-index-name"));
        if (SwapStage.NAME.equals(target) && !cmd.hasOption("swap-index-name")) {
            throw new ParseException("The swap target needs --swap-index-name");
        }
        return new Invocation(target, builder.build(), cmd.hasOption("help"));
    }

    private static CategoryMatcher categoryMatcher(CommandLine cmd) throws ParseException {
        CategoryMatcher matcher = cmd.hasOption("ignore")
            ? CategoryMatcher.withIgnored(Arrays.asList(cmd.getOptionValues("ignore")))
            : CategoryMatcher.defaults();
        List<String> rules = cmd.hasOption("category-match")
            ? Arrays.asList(cmd.getOptionValues("category-match"))
            : new ArrayList<>();
        for (String rule : rules) {
            int eq = rule.indexOf('=');
            if (eq <= 0 || eq == rule.length() - 1) {
                throw new ParseException("Expected category=substring, got " + rule);
            }
            try {
                matcher = matcher.withRule(Category.fromToken(rule.substring(0, eq).trim()), rule.substring(eq + 1));
            } catch (IllegalArgumentException e) {
                throw new ParseException(e.getMessage());
            }
        }
        return matcher;
    }

    private static int positiveInt(CommandLine cmd, String option) throws ParseException {
        long value = positiveLong(cmd, option);
        if (value > Integer.MAX_VALUE) {
            throw new ParseException("--" + option + " is too large: " + value);
        }
        return (int) value;
    }

    private static long positiveLong(CommandLine cmd, String option) throws ParseException {
        String raw = cmd.getOptionValue(option);
        try {
            long value = Long.parseLong(raw);
            if (value <= 0) {
                throw new ParseException("--" + option + " must be positive: " + raw);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new ParseException("--" + option + " is not a number: " + raw);
        }
    }
}
