package de.bsommerfeld.nestedset.core.domain;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Blueprint for creating a node together with its nested children in one go.
 *
 * @param name     payload of the node
 * @param children blueprints of the children, in sibling order
 */
public record NodeSpec(String name, List<NodeSpec> children) {

    public NodeSpec {
        children = children != null ? List.copyOf(children) : Collections.emptyList();
    }

    public static NodeSpec leaf(String name) {
        return new NodeSpec(name, Collections.emptyList());
    }

    public static NodeSpec of(String name, NodeSpec... children) {
        return new NodeSpec(name, Arrays.asList(children));
    }
}
