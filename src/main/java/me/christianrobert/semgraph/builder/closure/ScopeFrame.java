package me.christianrobert.semgraph.builder.closure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One level of lexical nesting.
 *
 * <p>Frames form a parent chain from the innermost region outward. A frame holds the
 * symbols bound directly in its region; symbols are added while the region is being built,
 * so a closure only sees the bindings that precede it in source order.</p>
 *
 * <p>Frames live for one build call only.</p>
 */
public class ScopeFrame {

    private final ScopeKind kind;
    private final String name;
    private final ScopeFrame parent;
    private final String ownerNodeId;
    private final Set<String> symbols = new LinkedHashSet<>();

    public ScopeFrame(ScopeKind kind, String name, ScopeFrame parent, String ownerNodeId) {
        if (kind == null) {
            throw new IllegalArgumentException("Scope kind cannot be null");
        }
        this.kind = kind;
        this.name = name;
        this.parent = parent;
        this.ownerNodeId = ownerNodeId;
    }

    /**
     * Outermost frame of a build.
     */
    public static ScopeFrame root(ScopeKind kind, String name, String ownerNodeId) {
        return new ScopeFrame(kind, name, null, ownerNodeId);
    }

    /**
     * New frame nested in this one.
     */
    public ScopeFrame child(ScopeKind childKind, String childName, String childOwnerNodeId) {
        return new ScopeFrame(childKind, childName, this, childOwnerNodeId);
    }

    /**
     * Detached copy of this frame with the same kind, owner, parent chain and symbols.
     * Bindings made in the copy reach this frame only through {@link #commit(ScopeFrame)}.
     */
    public ScopeFrame staging() {
        ScopeFrame copy = new ScopeFrame(kind, name, parent, ownerNodeId);
        copy.symbols.addAll(symbols);
        return copy;
    }

    /**
     * Adopts the symbols bound in a frame obtained from {@link #staging()}.
     */
    public void commit(ScopeFrame staged) {
        bindAll(staged.getSymbols());
    }

    public void bind(String symbol) {
        symbols.add(symbol);
    }

    public void bindAll(Iterable<String> names) {
        for (String symbol : names) {
            symbols.add(symbol);
        }
    }

    public boolean binds(String symbol) {
        return symbols.contains(symbol);
    }

    /**
     * Whether this frame or any enclosing frame binds the symbol.
     */
    public boolean isVisible(String symbol) {
        for (ScopeFrame frame = this; frame != null; frame = frame.parent) {
            if (frame.binds(symbol)) {
                return true;
            }
        }
        return false;
    }

    /**
     * This frame followed by all enclosing frames, innermost first.
     */
    public List<ScopeFrame> chain() {
        List<ScopeFrame> frames = new ArrayList<>();
        for (ScopeFrame frame = this; frame != null; frame = frame.parent) {
            frames.add(frame);
        }
        return frames;
    }

    public ScopeKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public String getOwnerNodeId() {
        return ownerNodeId;
    }

    public Set<String> getSymbols() {
        return Collections.unmodifiableSet(symbols);
    }

    @Override
    public String toString() {
        return "ScopeFrame{" + kind + (name != null ? " " + name : "") + ", symbols=" + symbols + "}";
    }
}
