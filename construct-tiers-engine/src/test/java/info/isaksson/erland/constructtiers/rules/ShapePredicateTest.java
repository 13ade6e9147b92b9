package info.isaksson.erland.constructtiers.rules;

import info.isaksson.erland.constructtiers.ir.Node;
import info.isaksson.erland.constructtiers.ir.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ShapePredicateTest {

    private static final ShapeMeasure ARGS = ShapeMeasure.attribute("arguments");

    @Test
    void attributesReadAsIntegersAndBooleans() {
        Node deco = new Node(0, NodeKind.DECORATOR, List.of(), Map.of("arguments", "2", "async", "true"), null);
        NodeShape shape = new NodeShape(deco, 4);

        assertEquals(2, shape.measure(ARGS));
        assertEquals(1, shape.measure(ShapeMeasure.attribute("async")));
        assertEquals(0, shape.measure(ShapeMeasure.attribute("missing")));
        assertEquals(4, shape.measure(ShapeMeasure.DEPTH));
        assertEquals(0, shape.measure(ShapeMeasure.CHILDREN));
    }

    @Test
    void nonNumericAttributeThrows() {
        Node deco = new Node(7, NodeKind.DECORATOR, List.of(), Map.of("arguments", "lots"), null);
        ShapeMeasureException ex = assertThrows(ShapeMeasureException.class,
                () -> new NodeShape(deco, 0).measure(ARGS));
        assertEquals(7, ex.nodeId);
        assertEquals("lots", ex.value);
    }

    @Test
    void presenceAcceptsAnyArgumentText() {
        ShapeMeasure hasArgs = ShapeMeasure.parse("has.arguments");
        assertEquals("has.arguments", hasArgs.key());
        assertNotEquals(ARGS, hasArgs);

        assertEquals(1, new NodeShape(decorator("arg1, arg2"), 0).measure(hasArgs));
        assertEquals(1, new NodeShape(decorator("3"), 0).measure(hasArgs));
        assertEquals(0, new NodeShape(decorator(" "), 0).measure(hasArgs));
        assertEquals(0, new NodeShape(decorator("0"), 0).measure(hasArgs));
        assertEquals(0, new NodeShape(new Node(0, NodeKind.DECORATOR, List.of(), Map.of(), null), 0).measure(hasArgs));

        assertThrows(ShapeMeasureException.class, () -> new NodeShape(decorator("arg1, arg2"), 0).measure(ARGS));
    }

    @Test
    void constraintsOnSameMeasureIntersect() {
        ShapePredicate p = ShapePredicate.of(ShapeConstraint.atLeast(ARGS, 1), ShapeConstraint.atMost(ARGS, 3));
        assertTrue(p.overlaps(ShapePredicate.of(ShapeConstraint.exactly(ARGS, 3))));
        assertFalse(p.overlaps(ShapePredicate.of(ShapeConstraint.atLeast(ARGS, 4))));
        assertFalse(p.overlaps(ShapePredicate.of(ShapeConstraint.exactly(ARGS, 0))));
    }

    @Test
    void unrelatedMeasuresAlwaysOverlap() {
        ShapePredicate byArgs = ShapePredicate.of(ShapeConstraint.atLeast(ARGS, 1));
        ShapePredicate byDepth = ShapePredicate.of(ShapeConstraint.atMost(ShapeMeasure.DEPTH, 0));
        assertTrue(byArgs.overlaps(byDepth));
        assertTrue(byDepth.overlaps(byArgs));
        assertTrue(ShapePredicate.ANY.overlaps(byArgs));
    }

    @Test
    void describesItself() {
        assertEquals("any", ShapePredicate.ANY.toString());
        assertEquals("children >= 3", ShapePredicate.of(ShapeConstraint.atLeast(ShapeMeasure.CHILDREN, 3)).toString());
        assertEquals("attr.bases <= 1 and depth == 0",
                ShapePredicate.of(ShapeConstraint.atMost(ShapeMeasure.parse("attr.bases"), 1),
                        ShapeConstraint.exactly(ShapeMeasure.DEPTH, 0)).toString());
    }

    private static Node decorator(String arguments) {
        return new Node(0, NodeKind.DECORATOR, List.of(), Map.of("arguments", arguments), null);
    }
}
