package com.jzon;

import com.jzon.codec.JsonNodeCodec;
import com.jzon.cursor.CursorParser;
import com.jzon.cursor.CursorResult;
import com.jzon.cursor.JsonCursor;
import com.jzon.json.JsonNode;
import com.jzon.output.OutputFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.FileInputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.concurrent.Callable;

@Command(name = "jzon", mixinStandardHelpOptions = true, version = "1.0",
         description = "Navigate JSON documents with cursors")
public class Jzon implements Callable<Integer> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Jzon.class);

    @Parameters(index = "0", description = "The cursor to apply, e.g. '.user.tags[0]' or '.items | arrays | .[2]'")
    private String cursor;

    @Parameters(index = "1", arity = "0..1", description = "Input JSON file (default: stdin)")
    private File inputFile;

    @Option(names = {"-c", "--compact-output"}, description = "Compact output without whitespace")
    private boolean compactOutput = false;

    @Option(names = {"-r", "--raw-output"}, description = "Output raw strings, not JSON texts")
    private boolean rawOutput = false;

    @Option(names = {"-S", "--sort-keys"}, description = "Sort object keys in output")
    private boolean sortKeys = false;

    @Option(names = {"-d", "--delete"}, description = "Print the document with the value at the cursor removed")
    private boolean delete = false;

    private final InputStream stdin;
    private final PrintStream stdout;
    private final PrintStream stderr;

    public Jzon() {
        this(System.in, System.out, System.err);
    }

    public Jzon(InputStream stdin, PrintStream stdout, PrintStream stderr) {
        this.stdin = stdin;
        this.stdout = stdout;
        this.stderr = stderr;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Jzon()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        try {
            JsonCursor path = new CursorParser().parse(cursor);
            LOGGER.debug("Parsed cursor {}", path);

            JsonNode document;
            if (inputFile != null) {
                try (InputStream input = new FileInputStream(inputFile)) {
                    document = JsonNodeCodec.parse(input);
                }
            } else {
                document = JsonNodeCodec.parse(stdin);
            }

            CursorResult<JsonNode> result = delete ? document.delete(path) : document.get(path);
            JsonNode output = result.orElseThrow();

            OutputFormatter formatter = new OutputFormatter(!compactOutput, sortKeys);
            stdout.println(rawOutput ? formatter.formatRaw(output) : formatter.format(output));
            return 0;
        } catch (Exception e) {
            LOGGER.debug("Failed to apply cursor {}", cursor, e);
            stderr.println("Error: " + e.getMessage());
            return 1;
        }
    }
}
