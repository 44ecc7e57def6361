package com.codeprint.loader;

import java.util.ArrayList;
import java.util.List;

import com.codeprint.code.Instruction;
import com.codeprint.code.Opcode;

/**
 * Parses the text form of an instruction stream, one instruction per line:
 *
 * <pre>
 *   12  LOAD_GLOBAL   helper      # optional source line first
 *       LOAD_ATTR     run
 *       LOAD_CONST    "two words"
 *       CALL_FUNCTION 0
 * </pre>
 *
 * A leading integer is the source line marker. Operands containing spaces are double quoted.
 * '#' starts a comment outside quotes.
 */
public final class InstructionListing {
    private final String source;
    private final List<Instruction> instructions = new ArrayList<>();
    private int line = 0;

    private InstructionListing(String source) {
        this.source = source;
    }

    public static List<Instruction> parse(String source) {
        if (source == null) throw new IllegalArgumentException("listing is null");
        return new InstructionListing(source).parseAll();
    }

    private List<Instruction> parseAll() {
        for (String raw : source.split("\r?\n", -1)) {
            line++;
            List<String> words = words(raw);
            if (!words.isEmpty()) instructions.add(instruction(words));
        }
        return instructions;
    }

    private Instruction instruction(List<String> words) {
        int i = 0;
        Integer sourceLine = null;
        if (isNumber(words.get(0))) {
            sourceLine = Integer.valueOf(words.get(0));
            i++;
        }
        if (i >= words.size()) throw error("Missing opcode after line marker " + sourceLine);

        Opcode opcode;
        try {
            opcode = Opcode.fromName(words.get(i++));
        } catch (IllegalArgumentException e) {
            throw error(e.getMessage());
        }

        String operand = null;
        if (i < words.size()) operand = words.get(i++);
        if (i < words.size()) throw error("Unexpected text after operand: " + words.get(i));

        return new Instruction(opcode, operand, sourceLine);
    }

    private List<String> words(String text) {
        List<String> out = new ArrayList<>();
        int current = 0;
        while (current < text.length()) {
            char c = text.charAt(current);
            if (c == '#') break;
            if (Character.isWhitespace(c)) {
                current++;
                continue;
            }
            if (c == '"') {
                int end = text.indexOf('"', current + 1);
                if (end < 0) throw error("Unterminated string");
                out.add(text.substring(current + 1, end));
                current = end + 1;
                continue;
            }
            int start = current;
            while (current < text.length()
                    && !Character.isWhitespace(text.charAt(current))
                    && text.charAt(current) != '#') {
                current++;
            }
            out.add(text.substring(start, current));
        }
        return out;
    }

    private static boolean isNumber(String word) {
        if (word.isEmpty()) return false;
        for (int i = 0; i < word.length(); i++) {
            char c = word.charAt(i);
            if (c < '0' || c > '9') return false;
        }
        return true;
    }

    private RuntimeException error(String msg) {
        return new RuntimeException("[line " + line + "] " + msg);
    }
}
