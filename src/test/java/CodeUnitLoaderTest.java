import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.codeprint.CodePrint;
import com.codeprint.code.CodeObject;
import com.codeprint.code.ContractViolationException;
import com.codeprint.code.DiagnosticCollector;
import com.codeprint.loader.CodeUnit;
import com.codeprint.loader.CodeUnitFormatException;
import com.codeprint.loader.CodeUnitLoader;
import com.codeprint.runtime.CodeFunction;
import com.codeprint.runtime.ModuleRegistry;
import com.codeprint.runtime.ScriptClass;
import com.codeprint.runtime.ScriptModule;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CodeUnitLoaderTest {

    private ModuleRegistry modules;
    private CodePrint engine;
    private DiagnosticCollector diagnostics;
    private CodeUnitLoader loader;

    @BeforeEach
    void setUp() {
        modules = new ModuleRegistry();
        engine = new CodePrint(modules);
        diagnostics = new DiagnosticCollector();
        engine.setDiagnosticSink(diagnostics);
        loader = new CodeUnitLoader(modules);
    }

    private static String resource(String name) throws IOException {
        try (InputStream in = CodeUnitLoaderTest.class.getResourceAsStream(name)) {
            assertNotNull(in, "missing test resource " + name);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void loadsTheExampleUnit() throws IOException {
        CodeFunction log = new CodeFunction(CodeObject.builder("log").build(), new LinkedHashMap<>());
        modules.register(new ScriptModule("logging").define("log", log));
        CodeUnit unit = loader.load(resource("/units/references.json"));

        assertEquals("flows.references", unit.module.name);
        assertEquals("references.flow", unit.filename);
        assertEquals(Arrays.asList("empty", "global_ref", "free_ref", "cell_ref", "import_ref",
                        "calls_x", "calls_missing", "MyClass.log_val", "method_ref", "class_ref", "bound_log"),
                Arrays.asList(unit.functions().keySet().toArray()));

        assertEquals(Collections.emptyList(), engine.references(unit.function("empty")).values());
        assertEquals(Arrays.asList(42), engine.references(unit.function("global_ref")).values());
        assertEquals(Arrays.asList("42"), engine.references(unit.function("free_ref")).values());
        assertEquals(Arrays.asList("cell_val"), engine.references(unit.function("cell_ref")).values());
        assertEquals(Arrays.asList(modules.resolve("logging")), engine.references(unit.function("import_ref")).values());
        assertEquals(Arrays.asList(unit.function("empty")), engine.references(unit.function("calls_x")).values());
        assertEquals(Arrays.asList("func_does_not_exist"), engine.references(unit.function("calls_missing")).values());

        Object myClass = unit.module.getAttribute("MyClass");
        assertTrue(myClass instanceof ScriptClass);
        assertEquals(Arrays.asList(myClass, "log_val"), engine.references(unit.function("method_ref")).values());

        List<Object> classRefs = engine.references(unit.function("class_ref")).values();
        assertEquals(Arrays.asList(unit.module.getAttribute("FlowBuilder"), "assign", myClass), classRefs);

        CodeFunction bound = unit.function("bound_log");
        assertTrue(bound.isBoundMethod());
        assertEquals(Arrays.asList(log, "42"), engine.references(bound).values());

        assertTrue(diagnostics.diagnostics().isEmpty(), diagnostics.diagnostics().toString());
    }

    @Test
    void classMembersAreTheUnitsFunctions() throws IOException {
        CodeUnit unit = loader.load(resource("/units/references.json"));
        ScriptClass myClass = (ScriptClass) unit.module.getAttribute("MyClass");
        assertSame(unit.function("MyClass.log_val"), myClass.getAttribute("log_val"));
        assertEquals("demo", myClass.getAttribute("kind"));
        assertFalse(unit.module.hasAttribute("MyClass.log_val"));
    }

    @Test
    void instructionsMayBeObjects() {
        String json = "{ \"globals\": { \"g\": [1, 2] }, \"functions\": { \"f\": { \"instructions\": ["
                + "{ \"op\": \"LOAD_GLOBAL\", \"arg\": \"g\", \"line\": 4 },"
                + "{ \"op\": \"RETURN_VALUE\" } ] } } }";
        CodeUnit unit = loader.load(json);

        CodeFunction f = unit.function("f");
        assertEquals(Integer.valueOf(4), f.code.instructions.get(0).line);
        assertEquals(Arrays.asList(Arrays.asList(1, 2)), engine.references(f).values());
    }

    @Test
    void closureMayReferToAnotherFunction() {
        String json = "{ \"functions\": {"
                + " \"inner\": { \"instructions\": \"LOAD_CONST 1\" },"
                + " \"outer\": { \"freevars\": [\"inner\"], \"closure\": [ { \"ref\": \"inner\" } ],"
                + "              \"instructions\": \"LOAD_DEREF inner\\nCALL_FUNCTION 0\" } } }";
        CodeUnit unit = loader.load(json);
        assertEquals(Arrays.asList(unit.function("inner")), engine.references(unit.function("outer")).values());
    }

    @Test
    void closureShorterThanFreeVars_failsWhenReferencesAreTaken() {
        String json = "{ \"functions\": { \"f\": { \"freevars\": [\"a\", \"b\"], \"closure\": [ { \"value\": 1 } ],"
                + " \"instructions\": \"LOAD_DEREF a\" } } }";
        CodeUnit unit = loader.load(json);
        assertThrows(ContractViolationException.class, () -> engine.references(unit.function("f")));
    }

    @Test
    void invalidJsonIsAFormatError() {
        CodeUnitFormatException e = assertThrows(CodeUnitFormatException.class, () -> loader.load("{ nope"));
        assertEquals("$", e.path);
    }

    @Test
    void badOpcodeNamesTheFunction() {
        String json = "{ \"functions\": { \"f\": { \"instructions\": \"LOAD_GLOBAL a\\nWHAT b\" } } }";
        CodeUnitFormatException e = assertThrows(CodeUnitFormatException.class, () -> loader.load(json));
        assertEquals("$.functions.f.instructions", e.path);
        assertTrue(e.getMessage().contains("[line 2]"), e.getMessage());
    }

    @Test
    void missingOpInObjectFormIsAFormatError() {
        String json = "{ \"functions\": { \"f\": { \"instructions\": [ { \"arg\": \"a\" } ] } } }";
        CodeUnitFormatException e = assertThrows(CodeUnitFormatException.class, () -> loader.load(json));
        assertEquals("$.functions.f.instructions[0]", e.path);
    }

    @Test
    void unknownClosureRefIsAFormatError() {
        String json = "{ \"functions\": { \"f\": { \"freevars\": [\"a\"], \"closure\": [ { \"ref\": \"ghost\" } ] } } }";
        CodeUnitFormatException e = assertThrows(CodeUnitFormatException.class, () -> loader.load(json));
        assertEquals("$.functions.f.closure[0].ref", e.path);
    }

    @Test
    void unresolvableImportIsAFormatError() {
        String json = "{ \"imports\": { \"x\": \"definitely.not.a.Module\" } }";
        CodeUnitFormatException e = assertThrows(CodeUnitFormatException.class, () -> loader.load(json));
        assertEquals("$.imports.x", e.path);
    }

    @Test
    void javaClassesCanBeImported() {
        String json = "{ \"imports\": { \"Collections\": \"java.util.Collections\" },"
                + " \"functions\": { \"f\": { \"instructions\": \"LOAD_GLOBAL Collections\\nLOAD_ATTR EMPTY_LIST\" } } }";
        CodeUnit unit = loader.load(json);
        assertEquals(Arrays.asList(Collections.EMPTY_LIST), engine.references(unit.function("f")).values());
    }

    @Test
    void unknownFunctionNameListsTheKnownOnes() {
        CodeUnit unit = loader.load("{ \"functions\": { \"f\": {} } }");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> unit.function("g"));
        assertTrue(e.getMessage().contains("[f]"), e.getMessage());
    }
}
