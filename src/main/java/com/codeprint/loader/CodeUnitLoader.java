package com.codeprint.loader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.codeprint.code.CodeObject;
import com.codeprint.code.ImportFailureException;
import com.codeprint.code.Instruction;
import com.codeprint.code.ModuleResolver;
import com.codeprint.code.Opcode;
import com.codeprint.debug.Debug;
import com.codeprint.runtime.Cell;
import com.codeprint.runtime.CodeFunction;
import com.codeprint.runtime.ScriptClass;
import com.codeprint.runtime.ScriptModule;
import com.codeprint.runtime.ScriptObject;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Builds callables from a JSON code unit.
 *
 * <pre>
 * {
 *   "module": "flows.example",
 *   "file": "example.flow",
 *   "globals":   { "global_val": 42 },
 *   "imports":   { "Collections": "java.util.Collections" },
 *   "classes":   { "Builder": { "methods": ["Builder.assign"], "attributes": { "kind": "demo" } } },
 *   "functions": {
 *     "x": {
 *       "firstLine": 10,
 *       "freevars": ["free_val"],
 *       "closure": [ { "value": "42" } ],
 *       "instructions": "11 LOAD_DEREF free_val\n RETURN_VALUE"
 *     }
 *   }
 * }
 * </pre>
 *
 * Functions whose name has no dot become module globals; dotted names ("Class.method") are
 * only reachable as class members. Closure cells hold either a literal ({@code value}) or a
 * unit-level name ({@code ref}), and a function may be bound to a fresh instance of one of the
 * unit's classes ({@code "bind": { "class": "Builder", "fields": {...} }}).
 */
public final class CodeUnitLoader {
    public static final String TAG = "codeprint.loader";

    private final ObjectMapper om = new ObjectMapper();
    private final ModuleResolver modules;

    public CodeUnitLoader(ModuleResolver modules) {
        this.modules = Objects.requireNonNull(modules, "modules");
    }

    public CodeUnit load(Path path) throws IOException {
        String json = Files.readString(path, StandardCharsets.UTF_8);
        CodeUnit unit = load(json, path.getFileName().toString());
        Debug.get().d(TAG, "loaded " + path + ": " + unit.functions().size() + " function(s)");
        return unit;
    }

    public CodeUnit load(String json) {
        return load(json, "<string>");
    }

    private CodeUnit load(String json, String defaultFile) {
        JsonNode root;
        try {
            root = om.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CodeUnitFormatException("$", "invalid JSON: " + e.getOriginalMessage(), e);
        }
        return load(root, defaultFile);
    }

    public CodeUnit load(JsonNode root) {
        return load(root, "<json>");
    }

    private CodeUnit load(JsonNode root, String defaultFile) {
        if (root == null || !root.isObject()) throw new CodeUnitFormatException("$", "expected an object");

        String moduleName = root.path("module").asText("__main__");
        String file = root.path("file").asText(defaultFile);
        ScriptModule module = new ScriptModule(moduleName);
        Map<String, Object> globals = module.namespace();

        // 1) literal globals
        for (Iterator<Map.Entry<String, JsonNode>> it = fields(root, "globals"); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            globals.put(e.getKey(), literal(e.getValue()));
        }

        // 2) imports
        for (Iterator<Map.Entry<String, JsonNode>> it = fields(root, "imports"); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            String target = e.getValue().asText();
            try {
                globals.put(e.getKey(), modules.resolve(target));
            } catch (ImportFailureException ex) {
                throw new CodeUnitFormatException("$.imports." + e.getKey(), "cannot import " + target, ex);
            }
        }

        // 3) functions; closures are filled in once every name exists
        LinkedHashMap<String, CodeFunction> functions = new LinkedHashMap<>();
        List<PendingCell> pendingCells = new ArrayList<>();
        Map<String, JsonNode> bindings = new LinkedHashMap<>();

        for (Iterator<Map.Entry<String, JsonNode>> it = fields(root, "functions"); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            String name = e.getKey();
            String path = "$.functions." + name;
            JsonNode spec = e.getValue();

            CodeObject code = code(name, file, spec, path);
            List<Cell> closure = new ArrayList<>();
            JsonNode cells = spec.path("closure");
            for (int i = 0; i < cells.size(); i++) {
                Cell cell = new Cell(null);
                closure.add(cell);
                pendingCells.add(new PendingCell(cell, cells.get(i), path + ".closure[" + i + "]"));
            }

            CodeFunction fn = new CodeFunction(code, globals, closure);
            functions.put(name, fn);
            if (name.indexOf('.') < 0) globals.put(name, fn);
            if (spec.has("bind")) bindings.put(name, spec.get("bind"));
        }

        // 4) classes
        for (Iterator<Map.Entry<String, JsonNode>> it = fields(root, "classes"); it.hasNext(); ) {
            Map.Entry<String, JsonNode> e = it.next();
            String path = "$.classes." + e.getKey();
            ScriptClass cls = new ScriptClass(e.getKey());
            for (Iterator<Map.Entry<String, JsonNode>> attrs = fields(e.getValue(), "attributes"); attrs.hasNext(); ) {
                Map.Entry<String, JsonNode> a = attrs.next();
                cls.member(a.getKey(), literal(a.getValue()));
            }
            for (JsonNode m : e.getValue().path("methods")) {
                String fnName = m.asText();
                CodeFunction method = functions.get(fnName);
                if (method == null) throw new CodeUnitFormatException(path + ".methods", "unknown function " + fnName);
                cls.member(memberName(fnName), method);
            }
            globals.put(cls.name, cls);
        }

        for (PendingCell pending : pendingCells) {
            pending.cell.setContents(cellValue(pending.spec, globals, functions, pending.path));
        }

        // 5) bound methods
        for (Map.Entry<String, JsonNode> b : bindings.entrySet()) {
            String path = "$.functions." + b.getKey() + ".bind";
            String className = b.getValue().path("class").asText(null);
            Object type = (className == null) ? null : globals.get(className);
            if (!(type instanceof ScriptClass)) {
                throw new CodeUnitFormatException(path, "unknown class " + className);
            }
            ScriptObject receiver = ((ScriptClass) type).newInstance();
            for (Iterator<Map.Entry<String, JsonNode>> it = fields(b.getValue(), "fields"); it.hasNext(); ) {
                Map.Entry<String, JsonNode> f = it.next();
                receiver.set(f.getKey(), literal(f.getValue()));
            }
            functions.put(b.getKey(), functions.get(b.getKey()).bind(receiver));
        }

        return new CodeUnit(module, file, functions);
    }

    private CodeObject code(String name, String file, JsonNode spec, String path) {
        if (!spec.isObject()) throw new CodeUnitFormatException(path, "expected an object");

        CodeObject.Builder b = CodeObject.builder(name)
                .filename(file)
                .firstLine(spec.path("firstLine").asInt(1))
                .cellVars(strings(spec.path("cellvars"), path + ".cellvars"))
                .freeVars(strings(spec.path("freevars"), path + ".freevars"));

        for (JsonNode c : spec.path("constants")) b.constant(literal(c));

        JsonNode ops = spec.path("instructions");
        if (ops.isTextual()) {
            try {
                b.instructions(InstructionListing.parse(ops.asText()));
            } catch (RuntimeException e) {
                throw new CodeUnitFormatException(path + ".instructions", e.getMessage(), e);
            }
        } else if (ops.isArray()) {
            for (int i = 0; i < ops.size(); i++) {
                b.instruction(instruction(ops.get(i), path + ".instructions[" + i + "]"));
            }
        } else if (!ops.isMissingNode()) {
            throw new CodeUnitFormatException(path + ".instructions", "expected a listing string or an array");
        }
        return b.build();
    }

    private Instruction instruction(JsonNode node, String path) {
        if (!node.hasNonNull("op")) throw new CodeUnitFormatException(path, "missing op");
        Opcode opcode;
        try {
            opcode = Opcode.fromName(node.get("op").asText());
        } catch (IllegalArgumentException e) {
            throw new CodeUnitFormatException(path + ".op", e.getMessage(), e);
        }
        String operand = node.hasNonNull("arg") ? node.get("arg").asText() : null;
        Integer line = node.hasNonNull("line") ? node.get("line").asInt() : null;
        return new Instruction(opcode, operand, line);
    }

    private Object cellValue(JsonNode spec, Map<String, Object> globals, Map<String, CodeFunction> functions, String path) {
        if (spec.has("value")) return literal(spec.get("value"));
        if (spec.hasNonNull("ref")) {
            String ref = spec.get("ref").asText();
            if (functions.containsKey(ref)) return functions.get(ref);
            if (globals.containsKey(ref)) return globals.get(ref);
            throw new CodeUnitFormatException(path + ".ref", "unknown name " + ref);
        }
        throw new CodeUnitFormatException(path, "expected 'value' or 'ref'");
    }

    private Object literal(JsonNode node) {
        return om.convertValue(node, Object.class);
    }

    private static List<String> strings(JsonNode node, String path) {
        List<String> out = new ArrayList<>();
        if (node.isMissingNode() || node.isNull()) return out;
        if (!node.isArray()) throw new CodeUnitFormatException(path, "expected an array of names");
        for (JsonNode n : node) out.add(n.asText());
        return out;
    }

    private static Iterator<Map.Entry<String, JsonNode>> fields(JsonNode parent, String name) {
        JsonNode node = parent.path(name);
        if (node.isMissingNode() || node.isNull()) return Collections.emptyIterator();
        if (!node.isObject()) throw new CodeUnitFormatException("$." + name, "expected an object");
        return node.fields();
    }

    private static String memberName(String fnName) {
        int dot = fnName.lastIndexOf('.');
        return (dot < 0) ? fnName : fnName.substring(dot + 1);
    }

    private static final class PendingCell {
        final Cell cell;
        final JsonNode spec;
        final String path;

        PendingCell(Cell cell, JsonNode spec, String path) {
            this.cell = cell;
            this.spec = spec;
            this.path = path;
        }
    }
}
