package com.codeprint;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.codeprint.code.ContractViolationException;
import com.codeprint.code.Diagnostic;
import com.codeprint.code.DiagnosticCollector;
import com.codeprint.code.ReferenceList;
import com.codeprint.code.SymbolicValue;
import com.codeprint.debug.Debug;
import com.codeprint.loader.CodeUnit;
import com.codeprint.loader.CodeUnitFormatException;
import com.codeprint.loader.CodeUnitLoader;
import com.codeprint.runtime.CodeFunction;

/**
 * Prints the references and fingerprint of the functions in a JSON code unit.
 *
 * Usage: CodePrintCli &lt;unit.json&gt; [function]
 */
public final class CodePrintCli {

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_INPUT = 3;
    public static final int EXIT_CONTRACT = 4;

    public static void main(String[] args) {
        Debug.get().setSink(Debug.STDERR);
        System.exit(run(args, System.out, System.err));
    }

    public static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 1 || args.length > 2) {
            err.println("Usage: CodePrintCli <unit.json> [function]");
            return EXIT_USAGE;
        }

        CodePrint engine = new CodePrint();
        DiagnosticCollector diagnostics = new DiagnosticCollector();
        engine.setDiagnosticSink(diagnostics);

        final Path unitPath = Path.of(args[0]);
        final CodeUnit unit;
        try {
            unit = new CodeUnitLoader(engine.getModuleResolver()).load(unitPath);
        } catch (IOException e) {
            err.println("Failed to read code unit: " + unitPath + " (" + e.getMessage() + ")");
            return EXIT_INPUT;
        } catch (CodeUnitFormatException e) {
            err.println("Malformed code unit " + unitPath + ": " + e.getMessage());
            return EXIT_INPUT;
        }

        List<CodeFunction> selected = new ArrayList<>();
        if (args.length == 2) {
            try {
                selected.add(unit.function(args[1]));
            } catch (IllegalArgumentException e) {
                err.println(e.getMessage());
                return EXIT_USAGE;
            }
        } else {
            selected.addAll(unit.functions().values());
        }

        int status = EXIT_OK;
        for (CodeFunction fn : selected) {
            out.println("function " + fn.code.name);
            try {
                ReferenceList refs = engine.references(fn);
                for (SymbolicValue ref : refs) {
                    String kind = (ref.getType() == SymbolicValue.Type.PARTIAL_NAME) ? "name" : "value";
                    out.println("  ref " + kind + " " + ref.value);
                }
                out.println("  fingerprint " + engine.fingerprint(fn));
            } catch (ContractViolationException e) {
                err.println("  contract violation: " + e.getMessage());
                status = EXIT_CONTRACT;
            }
            for (Diagnostic d : diagnostics.diagnostics()) {
                out.println("  warning " + d);
            }
            diagnostics.clear();
        }
        return status;
    }

    private CodePrintCli() {}
}
