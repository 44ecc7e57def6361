package com.codeprint.code;

import java.util.Objects;

/** One step of a compiled callable. Immutable. */
public final class Instruction {
    public final Opcode opcode;
    public final String operand;
    /** Source line this instruction starts, or null when it continues the previous line. */
    public final Integer line;

    public Instruction(Opcode opcode, String operand, Integer line) {
        this.opcode = Objects.requireNonNull(opcode, "opcode");
        this.operand = operand;
        this.line = line;
    }

    public static Instruction of(Opcode opcode) { return new Instruction(opcode, null, null); }
    public static Instruction of(Opcode opcode, String operand) { return new Instruction(opcode, operand, null); }
    public static Instruction at(int line, Opcode opcode, String operand) { return new Instruction(opcode, operand, line); }

    public Opcode.Kind kind() {
        return opcode.kind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Instruction)) return false;
        Instruction other = (Instruction) o;
        return opcode == other.opcode
                && Objects.equals(operand, other.operand)
                && Objects.equals(line, other.line);
    }

    @Override
    public int hashCode() {
        return Objects.hash(opcode, operand, line);
    }

    @Override
    public String toString() {
        String s = (operand == null) ? opcode.name() : opcode.name() + " " + operand;
        return (line == null) ? s : line + " " + s;
    }
}
