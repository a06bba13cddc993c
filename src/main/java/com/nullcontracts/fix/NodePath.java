package com.nullcontracts.fix;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.metamodel.PropertyMetaModel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Child-index path from the root of a tree to one of its nodes.
 * Used to find the counterpart of a node in a cloned tree. Comments are
 * skipped because cloning does not keep them at a stable position.
 */
public final class NodePath {

    private final List<Integer> indices;
    private final Class<? extends Node> targetClass;

    private NodePath(List<Integer> indices, Class<? extends Node> targetClass) {
        this.indices = indices;
        this.targetClass = targetClass;
    }

    /**
     * Computes the path of {@code node} from the root of its tree.
     *
     * @param node Any node
     * @return The path
     */
    public static NodePath of(Node node) {
        List<Integer> indices = new ArrayList<>();
        Node current = node;
        while (current.getParentNode().isPresent()) {
            Node parent = current.getParentNode().get();
            indices.add(indexOf(children(parent), current));
            current = parent;
        }
        Collections.reverse(indices);
        return new NodePath(Collections.unmodifiableList(indices), node.getClass());
    }

    /**
     * Follows the path from {@code root}.
     *
     * @param root Root of a tree with the same shape
     * @return The node at the path, if the shape and node class match
     */
    public Optional<Node> locate(Node root) {
        Node current = root;
        for (int index : indices) {
            List<Node> children = children(current);
            if (index < 0 || index >= children.size()) {
                return Optional.empty();
            }
            current = children.get(index);
        }
        return current.getClass() == targetClass ? Optional.of(current) : Optional.empty();
    }

    public List<Integer> getIndices() {
        return indices;
    }

    /**
     * Children in metamodel property order. {@link Node#getChildNodes()} is not
     * usable here: it lists children in the order they were attached, so a
     * statement inserted after parsing appears last.
     */
    private static List<Node> children(Node node) {
        List<Node> children = new ArrayList<>();
        for (PropertyMetaModel property : node.getMetaModel().getAllPropertyMetaModels()) {
            Object value = property.getValue(node);
            if (value instanceof Comment) {
                continue;
            }
            if (value instanceof Node) {
                children.add((Node) value);
            } else if (value instanceof NodeList) {
                for (Object element : (NodeList<?>) value) {
                    children.add((Node) element);
                }
            }
        }
        return children;
    }

    private static int indexOf(List<Node> nodes, Node node) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == node) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NodePath)) {
            return false;
        }
        NodePath other = (NodePath) o;
        return indices.equals(other.indices) && targetClass == other.targetClass;
    }

    @Override
    public int hashCode() {
        return indices.hashCode() * 31 + targetClass.hashCode();
    }

    @Override
    public String toString() {
        return targetClass.getSimpleName() + indices;
    }
}
