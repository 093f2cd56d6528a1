package com.hcltech.causal.dag.codec;

import java.util.ArrayList;
import java.util.List;

final class DagittyTokenizer {

    enum Kind {ID, SYMBOL, ARROW}

    record Token(Kind kind, String text, int line) {
        boolean is(String s) {
            return kind != Kind.ID && text.equals(s);
        }

        boolean isId() {
            return kind == Kind.ID;
        }

        boolean isArrow() {
            return kind == Kind.ARROW;
        }
    }

    private DagittyTokenizer() {}

    static List<Token> tokenize(String text) {
        List<Token> out = new ArrayList<>();
        int line = 1;
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '\n') {
                line++;
                i++;
            } else if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '"') {
                StringBuilder sb = new StringBuilder();
                int start = line;
                i++;
                while (true) {
                    if (i >= n) throw new DagittySyntaxException("line " + start + ": unterminated quoted name");
                    char q = text.charAt(i);
                    if (q == '\\' && i + 1 < n) {
                        sb.append(text.charAt(i + 1));
                        i += 2;
                    } else if (q == '"') {
                        i++;
                        break;
                    } else {
                        if (q == '\n') line++;
                        sb.append(q);
                        i++;
                    }
                }
                out.add(new Token(Kind.ID, sb.toString(), start));
            } else if (text.startsWith("<->", i)) {
                out.add(new Token(Kind.ARROW, "<->", line));
                i += 3;
            } else if (text.startsWith("->", i) || text.startsWith("<-", i) || text.startsWith("--", i)) {
                out.add(new Token(Kind.ARROW, text.substring(i, i + 2), line));
                i += 2;
            } else if ("{}[];,=".indexOf(c) >= 0) {
                out.add(new Token(Kind.SYMBOL, String.valueOf(c), line));
                i++;
            } else if (isIdChar(c)) {
                int start = i;
                while (i < n && isIdChar(text.charAt(i))) i++;
                out.add(new Token(Kind.ID, text.substring(start, i), line));
            } else {
                throw new DagittySyntaxException("line " + line + ": unexpected character '" + c + "'");
            }
        }
        return out;
    }

    private static boolean isIdChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }
}
