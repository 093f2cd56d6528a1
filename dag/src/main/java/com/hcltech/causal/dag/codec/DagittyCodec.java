package com.hcltech.causal.dag.codec;

import com.hcltech.causal.common.codec.Codec;
import com.hcltech.causal.common.errorsor.ErrorsOr;
import com.hcltech.causal.dag.CausalNode;
import com.hcltech.causal.dag.Edge;
import com.hcltech.causal.dag.GraphDescription;
import com.hcltech.causal.dag.NodeRole;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The dagitty text format:
 * <pre>
 * dag {
 *   X [exposure]
 *   Y [outcome]
 *   X -> M -> Y
 *   Y &lt;- U -> X
 * }
 * </pre>
 * Decoding also accepts the R wrapper {@code dagitty('...')}, {@code ;} separators and quoted ids, and ignores
 * attributes other than {@code exposure} and {@code outcome}. Undirected ({@code --}) and bidirected
 * ({@code <->}) edges are rejected. Nodes keep the order in which they first appear, and the first role
 * attribute given to a node is the one it keeps.
 */
public final class DagittyCodec implements Codec<GraphDescription, String> {

    private static final Pattern R_WRAPPER = Pattern.compile("^\\s*dagitty\\s*\\(\\s*(['\"])(.*)\\1\\s*\\)\\s*;?\\s*$", Pattern.DOTALL);
    private static final Pattern BARE_ID = Pattern.compile("[A-Za-z0-9_.]+");

    @Override
    public ErrorsOr<String> encode(GraphDescription graph) {
        if (graph == null) return ErrorsOr.error("Cannot encode a missing graph");
        StringBuilder sb = new StringBuilder("dag {\n");
        for (CausalNode n : graph.nodes()) {
            sb.append(quote(n.id()));
            if (n.role() != NodeRole.COVARIATE) sb.append(" [").append(n.role().wireName()).append(']');
            sb.append('\n');
        }
        for (Edge e : graph.edges()) {
            sb.append(quote(e.from())).append(" -> ").append(quote(e.to())).append('\n');
        }
        return ErrorsOr.lift(sb.append("}\n").toString());
    }

    @Override
    public ErrorsOr<GraphDescription> decode(String text) {
        if (text == null || text.isBlank()) return ErrorsOr.error("Empty dagitty text");
        Matcher wrapped = R_WRAPPER.matcher(text);
        String body = wrapped.matches() ? wrapped.group(2) : text;
        try {
            return ErrorsOr.lift(new Parser(DagittyTokenizer.tokenize(body)).parse());
        } catch (DagittySyntaxException e) {
            return ErrorsOr.error("Invalid dagitty text: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            return ErrorsOr.error("Invalid dagitty graph: " + e.getMessage());
        }
    }

    static String quote(String id) {
        if (BARE_ID.matcher(id).matches()) return id;
        return '"' + id.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    private static final class Parser {
        private final List<DagittyTokenizer.Token> tokens;
        private int pos;
        private final Map<String, NodeRole> nodes = new LinkedHashMap<>();
        private final List<Edge> edges = new ArrayList<>();

        Parser(List<DagittyTokenizer.Token> tokens) {
            this.tokens = tokens;
        }

        GraphDescription parse() {
            DagittyTokenizer.Token first = peek();
            if (first != null && first.isId() && first.text().equals("dag")) {
                pos++;
            } else if (first != null && first.isId() && isOtherGraphType(first.text())) {
                throw new DagittySyntaxException("line " + first.line() + ": only 'dag' graphs are supported, not '" + first.text() + "'");
            }
            expect("{");
            while (true) {
                DagittyTokenizer.Token t = peek();
                if (t == null) throw new DagittySyntaxException("missing closing '}'");
                if (t.is("}")) {
                    pos++;
                    break;
                }
                if (t.is(";")) {
                    pos++;
                    continue;
                }
                statement();
            }
            DagittyTokenizer.Token trailing = peek();
            if (trailing != null) {
                throw new DagittySyntaxException("line " + trailing.line() + ": unexpected '" + trailing.text() + "' after closing '}'");
            }
            List<CausalNode> out = new ArrayList<>(nodes.size());
            nodes.forEach((id, role) -> out.add(new CausalNode(id, role)));
            return new GraphDescription(out, edges);
        }

        private void statement() {
            if (isGraphAttribute()) {
                pos += 3;
                return;
            }
            String left = node();
            while (true) {
                DagittyTokenizer.Token t = peek();
                if (t == null || !t.isArrow()) return;
                pos++;
                if (t.is("--") || t.is("<->")) {
                    throw new DagittySyntaxException("line " + t.line() + ": unsupported edge '" + t.text() + "'; only directed edges are allowed");
                }
                String right = node();
                edges.add(t.is("->") ? new Edge(left, right) : new Edge(right, left));
                left = right;
            }
        }

        private String node() {
            DagittyTokenizer.Token t = next();
            if (!t.isId()) throw new DagittySyntaxException("line " + t.line() + ": expected a node but found '" + t.text() + "'");
            nodes.putIfAbsent(t.text(), NodeRole.COVARIATE);
            DagittyTokenizer.Token open = peek();
            if (open != null && open.is("[")) {
                pos++;
                attributes(t.text());
            }
            return t.text();
        }

        private void attributes(String id) {
            while (true) {
                DagittyTokenizer.Token t = next();
                if (t.is("]")) return;
                if (t.is(",")) continue;
                if (!t.isId()) throw new DagittySyntaxException("line " + t.line() + ": bad attribute '" + t.text() + "'");
                DagittyTokenizer.Token eq = peek();
                if (eq != null && eq.is("=")) {
                    pos++;
                    next();
                    continue;
                }
                if (t.text().equals("exposure")) assignRole(id, NodeRole.EXPOSURE);
                else if (t.text().equals("outcome")) assignRole(id, NodeRole.OUTCOME);
            }
        }

        /** The first role attribute a node receives is kept; later ones are ignored. */
        private void assignRole(String id, NodeRole role) {
            if (nodes.get(id) == NodeRole.COVARIATE) nodes.put(id, role);
        }

        /** {@code bb="0,0,1,1"} and similar settings at graph level. */
        private boolean isGraphAttribute() {
            return pos + 2 < tokens.size() && tokens.get(pos).isId() && tokens.get(pos + 1).is("=");
        }

        private DagittyTokenizer.Token peek() {
            return pos < tokens.size() ? tokens.get(pos) : null;
        }

        private DagittyTokenizer.Token next() {
            DagittyTokenizer.Token t = peek();
            if (t == null) throw new DagittySyntaxException("unexpected end of input");
            pos++;
            return t;
        }

        private void expect(String symbol) {
            DagittyTokenizer.Token t = next();
            if (!t.is(symbol)) throw new DagittySyntaxException("line " + t.line() + ": expected '" + symbol + "' but found '" + t.text() + "'");
        }

        private static boolean isOtherGraphType(String word) {
            return word.equals("pdag") || word.equals("mag") || word.equals("pag") || word.equals("graph");
        }
    }
}
