package com.raditha.typebench.model;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One level of a type annotation: a constructor and its ordered arguments.
 * <p>
 * Nodes are immutable. Unions are flattened and de-duplicated on construction,
 * and {@code Optional[X]} never appears because the parser rewrites it to
 * {@code Union[X, None]}. Equality is structural, with union members compared
 * as an unordered set and all other argument lists compared positionally.
 */
public final class TypeNode {

    private static final String PARAMETERS_NAME = "[]";
    private static final String ELLIPSIS_NAME = "...";

    private final ConstructorKind kind;
    private final String name;
    private final List<TypeNode> children;
    private final int depth;

    private TypeNode(ConstructorKind kind, String name, List<TypeNode> children) {
        this.kind = kind;
        this.name = name;
        this.children = List.copyOf(children);
        int maxChild = 0;
        for (TypeNode child : this.children) {
            maxChild = Math.max(maxChild, child.depth);
        }
        this.depth = 1 + maxChild;
    }

    /**
     * Create a leaf for a canonical type name such as {@code int} or {@code MyClass}.
     */
    public static TypeNode leaf(String canonicalName) {
        return generic(canonicalName, List.of());
    }

    /**
     * Create a node for a canonical name with positional arguments.
     * A name of {@code Union} is routed through {@link #union(List)} so the
     * union invariants hold no matter how the node was built.
     */
    public static TypeNode generic(String canonicalName, List<TypeNode> args) {
        ConstructorKind kind = ConstructorKind.fromName(canonicalName);
        if (kind == ConstructorKind.UNION) {
            return union(args);
        }
        return new TypeNode(kind, canonicalName, args);
    }

    /**
     * Build a union. Nested unions are flattened, structurally equal members
     * collapse to one, and a single remaining member is returned as-is.
     *
     * @throws IllegalArgumentException if there are no members
     */
    public static TypeNode union(List<TypeNode> members) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("Union requires at least one member");
        }
        List<TypeNode> flat = new ArrayList<>();
        for (TypeNode member : members) {
            List<TypeNode> candidates = member.isUnion() ? member.children : List.of(member);
            for (TypeNode candidate : candidates) {
                if (!flat.contains(candidate)) {
                    flat.add(candidate);
                }
            }
        }
        if (flat.size() == 1) {
            return flat.get(0);
        }
        return new TypeNode(ConstructorKind.UNION, "Union", flat);
    }

    /**
     * Bracketed argument list, as used for the parameters of {@code Callable}.
     */
    public static TypeNode parameters(List<TypeNode> items) {
        return new TypeNode(ConstructorKind.PARAMETERS, PARAMETERS_NAME, items);
    }

    public static TypeNode ellipsis() {
        return new TypeNode(ConstructorKind.ELLIPSIS, ELLIPSIS_NAME, List.of());
    }

    /**
     * Literal value such as {@code 'GET'} or {@code 42}.
     */
    public static TypeNode value(String literal) {
        return new TypeNode(ConstructorKind.VALUE, literal, List.of());
    }

    /**
     * Fallback leaf holding annotation text the parser could not understand.
     */
    public static TypeNode unparsed(String raw) {
        return new TypeNode(ConstructorKind.UNPARSED, raw, List.of());
    }

    public ConstructorKind kind() {
        return kind;
    }

    /**
     * Canonical constructor name, or the raw text for values and unparsed leaves.
     */
    public String name() {
        return name;
    }

    public List<TypeNode> children() {
        return children;
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public boolean isUnion() {
        return kind == ConstructorKind.UNION;
    }

    /**
     * Nesting level: 1 for a leaf, otherwise 1 + the deepest child.
     */
    public int depth() {
        return depth;
    }

    /**
     * Canonical surface form, e.g. {@code dict[str, list[int]]} or {@code Union[int, None]}.
     */
    public String render() {
        return switch (kind) {
            case PARAMETERS -> "[" + joinChildren() + "]";
            case ELLIPSIS, VALUE, UNPARSED -> name;
            default -> children.isEmpty() ? name : name + "[" + joinChildren() + "]";
        };
    }

    private String joinChildren() {
        return children.stream().map(TypeNode::render).collect(Collectors.joining(", "));
    }

    /**
     * Structural equality after normalization.
     * Union members are an unordered set; every other argument list is ordered.
     */
    public boolean structurallyEquals(@Nullable TypeNode other) {
        if (other == null) {
            return false;
        }
        if (this == other) {
            return true;
        }
        if (kind != other.kind || !name.equals(other.name) || children.size() != other.children.size()) {
            return false;
        }
        if (isUnion()) {
            // members are de-duplicated, so equal size plus containment is set equality
            for (TypeNode member : children) {
                if (!other.children.contains(member)) {
                    return false;
                }
            }
            return true;
        }
        for (int i = 0; i < children.size(); i++) {
            if (!children.get(i).structurallyEquals(other.children.get(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeNode that)) return false;
        return structurallyEquals(that);
    }

    @Override
    public int hashCode() {
        int childHash;
        if (isUnion()) {
            childHash = 0;
            for (TypeNode member : children) {
                childHash += member.hashCode();
            }
        } else {
            childHash = children.hashCode();
        }
        return Objects.hash(kind, name, childHash);
    }

    @Override
    public String toString() {
        return render();
    }
}
