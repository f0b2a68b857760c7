package com.jsdesugar.tree;

import com.jsdesugar.ast.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.jsdesugar.testing.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

public class TreeQueriesTest {

    @Test
    void testUnwrapStripsNestedWrappers() {
        Identifier x = id("x");

        assertSame(x, TreeQueries.unwrap(paren(as(paren(x), "T"))));
        assertSame(x, TreeQueries.unwrap(x));
    }

    @Test
    void testAncestorFoundThroughWrappers() {
        MemberExpression target = member("a", "value");
        AssignmentExpression write = assign(paren(as(target, "Box")), num(1));
        ParentIndex parents = ParentIndex.of(program(stmt(write)));

        Optional<Node> found = TreeQueries.findAncestorMatching(parents, target, AssignmentExpression.class::isInstance);

        assertSame(write, found.orElseThrow());
    }

    @Test
    void testAncestorSearchStopsAtOtherParents() {
        MemberExpression inner = member("a", "inner");
        AssignmentExpression write = assign(member(inner, "value"), num(1));
        ParentIndex parents = ParentIndex.of(program(stmt(write)));

        assertTrue(TreeQueries.findAncestorMatching(parents, inner, AssignmentExpression.class::isInstance).isEmpty());
    }

    @Test
    void testWrapperMustHoldTheNode() {
        // The parentheses hold the sum, not a.value
        MemberExpression target = member("a", "value");
        BinaryExpression sum = binary("+", target, num(1));
        ParentIndex parents = ParentIndex.of(program(stmt(paren(sum))));

        assertTrue(TreeQueries.findAncestorMatching(parents, target, ParenthesizedExpression.class::isInstance).isEmpty());
    }

    @Test
    void testFindEnclosingWalksToTheTop() {
        MemberExpression target = member("a", "value");
        ExpressionStatement statement = stmt(call(id("f"), binary("+", target, num(1))));
        ParentIndex parents = ParentIndex.of(program(statement));

        assertSame(statement, TreeQueries.findEnclosing(parents, target, Statement.class::isInstance).orElseThrow());
        assertTrue(TreeQueries.findEnclosing(parents, target, ClassBody.class::isInstance).isEmpty());
    }

    @Test
    void testDescendantSearchIsPreOrder() {
        Identifier first = id("first");
        Identifier second = id("second");
        Program program = program(stmt(binary("+", call(first), second)));

        List<Node> identifiers = TreeQueries.findAllDescendantsMatching(program, Identifier.class::isInstance);

        assertEquals(List.of(first, second), identifiers);
        assertSame(first, TreeQueries.findFirstDescendantMatching(program, Identifier.class::isInstance).orElseThrow());
    }

    @Test
    void testStartNodeIsNotItsOwnDescendant() {
        Identifier x = id("x");

        assertTrue(TreeQueries.findFirstDescendantMatching(x, Identifier.class::isInstance).isEmpty());
        assertTrue(TreeQueries.subtreeContains(x, Identifier.class::isInstance));
    }

    @Test
    void testDescendantCheckUsesIdentity() {
        Identifier inside = id("x");
        Identifier lookalike = id("x");
        Expression tree = binary("+", inside, num(1));

        assertTrue(TreeQueries.isDescendantOf(tree, inside));
        assertFalse(TreeQueries.isDescendantOf(tree, lookalike));
    }
}
