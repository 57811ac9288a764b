package com.logq;

import com.logq.config.LogQConfig;
import com.logq.json.JsonNode;
import com.logq.json.LogJsonParser;
import com.logq.output.OutputFormatter;
import com.logq.query.FindOptions;
import com.logq.query.OperandPresence;
import com.logq.query.ProjectionSpec;
import com.logq.query.SortSpec;
import org.eclipse.collections.api.list.MutableList;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "logq", mixinStandardHelpOptions = true, version = "1.0",
         description = "Query an append-only JSON document log")
public class LogQ implements Callable<Integer> {
    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Filter document, e.g. '{\"age\":{\"$gt\":21}}'")
    private String filter;

    @Parameters(index = "1", arity = "0..1", description = "Log file (default: logq.logFile setting)")
    private File logFile;

    @Option(names = {"-s", "--sort"}, description = "Sort document, e.g. '{\"age\":1,\"name\":-1}'")
    private String sort;

    @Option(names = {"-p", "--projection"}, description = "Projection document, e.g. '{\"name\":1}'")
    private String projection;

    @Option(names = {"-t", "--text-field"}, description = "Field searched by $text (repeatable)")
    private List<String> textFields;

    @Option(names = {"--strict-operands"}, description = "Apply operators even when the operand is 0, \"\", false or null")
    private boolean strictOperands = false;

    @Option(names = {"-c", "--compact-output"}, description = "Compact output without whitespace")
    private boolean compactOutput = false;

    @Option(names = {"-S", "--sort-keys"}, description = "Sort object keys in output")
    private boolean sortKeys = false;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LogQ()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            LogDatabase database = new LogDatabase(config());
            MutableList<JsonNode.JsonObject> results = database.find(filter, options());

            OutputFormatter formatter = new OutputFormatter(!compactOutput, sortKeys);
            results.forEach(result -> out.println(formatter.format(result)));
            out.flush();
            return 0;
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private LogQConfig config() {
        LogQConfig.Builder builder = LogQConfig.builder();
        if (logFile != null) {
            builder.logFile(logFile.toPath());
        }
        if (textFields != null) {
            builder.textSearchFields(textFields);
        }
        if (strictOperands) {
            builder.operandPresence(OperandPresence.PRESENT);
        }
        return builder.build();
    }

    private FindOptions options() throws Exception {
        LogJsonParser parser = new LogJsonParser();
        FindOptions options = FindOptions.NONE;
        if (sort != null) {
            options = options.withSort(SortSpec.parse(parser.parseObject(sort)));
        }
        if (projection != null) {
            options = options.withProjection(ProjectionSpec.parse(parser.parseObject(projection)));
        }
        return options;
    }
}
