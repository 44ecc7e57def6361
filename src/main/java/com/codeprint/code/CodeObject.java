package com.codeprint.code;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Compiled form of a callable: its instruction stream and the names it shares with
 * enclosing and nested closures.
 *
 * cellVars are the variables this code's own nested closures capture; freeVars are the
 * variables this code captures from an enclosing scope. Both lists are order-significant.
 */
public final class CodeObject {
    public final String name;
    public final String filename;
    public final int firstLine;
    public final List<Instruction> instructions;
    public final List<String> cellVars;
    public final List<String> freeVars;
    public final List<Object> constants;

    private CodeObject(Builder b) {
        this.name = Objects.requireNonNull(b.name, "name");
        this.filename = (b.filename == null) ? "<unknown>" : b.filename;
        this.firstLine = b.firstLine;
        this.instructions = Collections.unmodifiableList(new ArrayList<>(b.instructions));
        this.cellVars = Collections.unmodifiableList(new ArrayList<>(b.cellVars));
        this.freeVars = Collections.unmodifiableList(new ArrayList<>(b.freeVars));
        this.constants = Collections.unmodifiableList(new ArrayList<>(b.constants));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    public String toString() {
        return "<code " + name + ", file \"" + filename + "\", line " + firstLine + ">";
    }

    public static final class Builder {
        private final String name;
        private String filename;
        private int firstLine = 1;
        private final List<Instruction> instructions = new ArrayList<>();
        private final List<String> cellVars = new ArrayList<>();
        private final List<String> freeVars = new ArrayList<>();
        private final List<Object> constants = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder filename(String filename) { this.filename = filename; return this; }
        public Builder firstLine(int firstLine) { this.firstLine = firstLine; return this; }

        public Builder op(Opcode opcode) { instructions.add(Instruction.of(opcode)); return this; }
        public Builder op(Opcode opcode, String operand) { instructions.add(Instruction.of(opcode, operand)); return this; }
        public Builder op(int line, Opcode opcode, String operand) { instructions.add(Instruction.at(line, opcode, operand)); return this; }

        public Builder instruction(Instruction instruction) {
            instructions.add(Objects.requireNonNull(instruction, "instruction"));
            return this;
        }

        public Builder instructions(List<Instruction> list) {
            for (Instruction i : list) instruction(i);
            return this;
        }

        public Builder cellVars(String... names) { Collections.addAll(cellVars, names); return this; }
        public Builder cellVars(List<String> names) { cellVars.addAll(names); return this; }
        public Builder freeVars(String... names) { Collections.addAll(freeVars, names); return this; }
        public Builder freeVars(List<String> names) { freeVars.addAll(names); return this; }
        public Builder constant(Object value) { constants.add(value); return this; }

        public CodeObject build() {
            return new CodeObject(this);
        }
    }
}
