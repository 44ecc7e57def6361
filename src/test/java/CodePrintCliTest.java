import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.codeprint.CodePrintCli;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class CodePrintCliTest {

    @TempDir
    Path tmp;

    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();

    private int run(String... args) {
        PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
        PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
        return CodePrintCli.run(args, out, err);
    }

    private String out() { return outBytes.toString(StandardCharsets.UTF_8); }
    private String err() { return errBytes.toString(StandardCharsets.UTF_8); }

    private Path write(String json) throws IOException {
        Path p = tmp.resolve("unit.json");
        Files.writeString(p, json, StandardCharsets.UTF_8);
        return p;
    }

    @Test
    void noArguments_printsUsage() {
        assertEquals(CodePrintCli.EXIT_USAGE, run());
        assertTrue(err().contains("Usage"));
    }

    @Test
    void printsReferencesAndFingerprint() throws IOException {
        Path unit = write("{ \"globals\": { \"g\": 42 }, \"functions\": {"
                + " \"f\": { \"instructions\": \"LOAD_GLOBAL g\\nLOAD_GLOBAL os\\nLOAD_ATTR path\\nRETURN_VALUE\" } } }");

        assertEquals(CodePrintCli.EXIT_OK, run(unit.toString(), "f"));

        String out = out();
        assertTrue(out.contains("function f"), out);
        assertTrue(out.contains("  ref value 42"), out);
        assertTrue(out.contains("  ref name os.path"), out);
        assertTrue(out.matches("(?s).*  fingerprint [0-9a-f]{32}.*"), out);
    }

    @Test
    void unresolvedAttributesAreWarnings() throws IOException {
        Path unit = write("{ \"globals\": { \"g\": 42 }, \"functions\": {"
                + " \"f\": { \"instructions\": \"3 LOAD_GLOBAL g\\nLOAD_ATTR nope\" } } }");

        assertEquals(CodePrintCli.EXIT_OK, run(unit.toString()));
        assertTrue(out().contains("  warning f (unit.json:3)"), out());
    }

    @Test
    void missingFileIsAnInputError() {
        assertEquals(CodePrintCli.EXIT_INPUT, run(tmp.resolve("absent.json").toString()));
        assertTrue(err().contains("Failed to read code unit"));
    }

    @Test
    void malformedUnitIsAnInputError() throws IOException {
        Path unit = write("[]");
        assertEquals(CodePrintCli.EXIT_INPUT, run(unit.toString()));
        assertTrue(err().contains("Malformed code unit"));
    }

    @Test
    void unknownFunctionIsAUsageError() throws IOException {
        Path unit = write("{ \"functions\": { \"f\": {} } }");
        assertEquals(CodePrintCli.EXIT_USAGE, run(unit.toString(), "g"));
    }

    @Test
    void contractViolationIsReportedDistinctly() throws IOException {
        Path unit = write("{ \"functions\": {"
                + " \"ok\": { \"instructions\": \"LOAD_CONST 1\" },"
                + " \"broken\": { \"freevars\": [\"a\"], \"instructions\": \"LOAD_DEREF a\" } } }");

        assertEquals(CodePrintCli.EXIT_CONTRACT, run(unit.toString()));
        assertTrue(out().contains("function ok"));
        assertTrue(err().contains("contract violation"), err());
    }
}
