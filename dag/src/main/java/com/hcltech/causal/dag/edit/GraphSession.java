package com.hcltech.causal.dag.edit;

import com.hcltech.causal.common.errorsor.ErrorsOr;
import com.hcltech.causal.dag.CausalGraph;
import com.hcltech.causal.dag.Edge;
import com.hcltech.causal.dag.GraphDescription;
import com.hcltech.causal.dag.GraphEdit;
import com.hcltech.causal.dag.validation.StructuralValidator;
import com.hcltech.causal.dag.validation.ValidatedGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The current graph of one editing session.
 * <p>
 * Writers are serialised on the session; every edit builds and validates a new snapshot and then installs it
 * with a single reference swap, so readers calling {@link #current()} never see a half-applied edit. The
 * previous snapshots of the last {@value #UNDO_DEPTH} edits are kept for {@link #undo()}.
 */
public final class GraphSession {
    private static final Logger log = LoggerFactory.getLogger(GraphSession.class);

    public static final int UNDO_DEPTH = 10;

    private record Installed(ValidatedGraph graph, long version) {}

    private record UndoEntry(ValidatedGraph before, String action, String target) {}

    private final AtomicReference<Installed> current;
    private final Deque<UndoEntry> undo = new ArrayDeque<>();

    public GraphSession(ValidatedGraph initial) {
        this.current = new AtomicReference<>(new Installed(initial, 0));
    }

    public static ErrorsOr<GraphSession> open(GraphDescription raw) {
        return StructuralValidator.validate(raw).map(GraphSession::new);
    }

    public ValidatedGraph current() {
        return current.get().graph();
    }

    public CausalGraph graph() {
        return current().graph();
    }

    /** Incremented by every installed edit, including undo. */
    public long version() {
        return current.get().version();
    }

    public synchronized int undoDepth() {
        return undo.size();
    }

    public synchronized ErrorsOr<EditResult> removeNode(String id) {
        return graph().removeNode(id).map(this::install);
    }

    public synchronized ErrorsOr<EditResult> removeEdge(Edge edge) {
        return graph().removeEdge(edge).map(this::install);
    }

    /** Replaces the whole graph, for example after an import. The description is repaired like any other. */
    public synchronized ErrorsOr<EditResult> replace(GraphDescription raw) {
        return StructuralValidator.validate(raw).map(validated -> {
            ValidatedGraph before = current();
            push(new UndoEntry(before, "replace", "graph"));
            long version = swap(validated);
            String message = "Loaded graph with " + validated.graph().size() + " nodes and "
                    + validated.graph().edgeCount() + " edges";
            log.info("{} (version {})", message, version);
            return new EditResult("replace", "graph", message, before.graph().edgeCount(), version, validated.report());
        });
    }

    public synchronized ErrorsOr<EditResult> pruneLeaves(boolean preserveExposureOutcome) {
        PruneResult pruned = LeafPruner.prune(graph(), preserveExposureOutcome);
        if (pruned.removed().isEmpty()) return ErrorsOr.error("No leaf nodes to remove");
        ValidatedGraph before = current();
        ValidatedGraph after = revalidate(pruned.graph());
        push(new UndoEntry(before, "prune_leaves", String.join(", ", pruned.removed())));
        long version = swap(after);
        log.info("{} (version {})", pruned.message(), version);
        return ErrorsOr.lift(new EditResult("prune_leaves", String.join(", ", pruned.removed()), pruned.message(),
                pruned.edgesBefore() - pruned.edgesAfter(), version, after.report()));
    }

    public synchronized ErrorsOr<EditResult> undo() {
        UndoEntry entry = undo.pollFirst();
        if (entry == null) return ErrorsOr.error("No operations to undo");
        long version = swap(entry.before());
        String message = "Undid " + entry.action() + " of " + entry.target();
        log.info("{} (version {})", message, version);
        return ErrorsOr.lift(new EditResult("undo", entry.target(), message, 0, version, entry.before().report()));
    }

    private EditResult install(GraphEdit edit) {
        ValidatedGraph before = current();
        ValidatedGraph after = revalidate(edit.after());
        push(new UndoEntry(before, edit.action(), edit.target()));
        long version = swap(after);
        log.info("{} (version {})", edit.message(), version);
        return new EditResult(edit.action(), edit.target(), edit.message(), edit.edgesRemoved(), version, after.report());
    }

    private ValidatedGraph revalidate(CausalGraph graph) {
        return new ValidatedGraph(graph, StructuralValidator.inspect(graph));
    }

    private void push(UndoEntry entry) {
        undo.addFirst(entry);
        while (undo.size() > UNDO_DEPTH) undo.removeLast();
    }

    private long swap(ValidatedGraph next) {
        Installed previous = current.get();
        Installed installed = new Installed(next, previous.version() + 1);
        current.set(installed);
        return installed.version();
    }
}
