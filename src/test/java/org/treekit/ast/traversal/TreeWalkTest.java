package org.treekit.ast.traversal;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.treekit.ast.core.Node;
import org.treekit.ast.core.repr.ValueNode;
import org.treekit.ast.lang.Add;
import org.treekit.ast.lang.IntLit;
import org.treekit.ast.lang.ListLit;
import org.treekit.ast.lang.Mul;
import org.treekit.ast.lang.optimized.OptIntLit;
import org.treekit.ast.lang.value.IntValue;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.treekit.ast.testing.Trees.at;
import static org.treekit.ast.testing.Trees.intLit;
import static org.treekit.ast.testing.Trees.sampleMul;

@Tag("unit")
class TreeWalkTest {

    private final Mul mul = sampleMul();
    private final Add add = (Add) mul.left();

    @Test
    void preorderVisitsParentsFirst() {
        List<Node> visited = new ArrayList<>();
        TreeWalk.preorder(mul, visited::add);

        assertThat(visited).containsExactly(mul, add, add.left(), add.right(), mul.right());
        assertThat(TreeWalk.preorderList(mul)).isEqualTo(visited);
    }

    @Test
    void postorderVisitsChildrenFirst() {
        List<Node> visited = new ArrayList<>();
        TreeWalk.postorder(mul, visited::add);

        assertThat(visited).containsExactly(add.left(), add.right(), add, mul.right(), mul);
    }

    @Test
    void levelOrderVisitsByDepth() {
        List<Node> visited = new ArrayList<>();
        TreeWalk.levelOrder(mul, visited::add);

        assertThat(visited).containsExactly(mul, add, mul.right(), add.left(), add.right());
    }

    @Test
    void withDepthReportsDistanceFromRoot() {
        List<String> visited = new ArrayList<>();
        TreeWalk.withDepth(mul, (node, depth) -> visited.add(node.getClass().getSimpleName() + "@" + depth));

        assertThat(visited).containsExactly("Mul@0", "Add@1", "IntLit@2", "IntLit@2", "IntLit@1");
    }

    @Test
    void findAllIsPreorderAndRestartable() {
        Iterable<IntLit> literals = TreeWalk.findAll(mul, IntLit.class);

        List<Integer> firstPass = new ArrayList<>();
        literals.forEach(lit -> firstPass.add(lit.value()));
        List<Integer> secondPass = new ArrayList<>();
        literals.forEach(lit -> secondPass.add(lit.value()));

        assertThat(firstPass).containsExactly(1, 2, 3);
        assertThat(secondPass).isEqualTo(firstPass);
    }

    @Test
    void findAllIsLazy() {
        Iterator<IntLit> literals = TreeWalk.findAll(mul, IntLit.class).iterator();

        assertThat(literals.next().value()).isEqualTo(1);
        assertThat(literals.hasNext()).isTrue();
    }

    @Test
    void findFirstReturnsFirstInPreorder() {
        assertThat(TreeWalk.findFirst(mul, IntLit.class)).contains(intLit(1, 1));
        assertThat(TreeWalk.findFirst(mul, OptIntLit.class)).isEmpty();
    }

    @Test
    void traversalWorksAcrossStrategies() {
        IntValue value = new IntValue(at(5, 6), 6);
        ListLit list = new ListLit(at(0, 7), List.of(new OptIntLit(at(1, 2), 5), ValueNode.of(value)));

        assertThat(TreeWalk.stream(list).count()).isEqualTo(3);
        assertThat(TreeWalk.findAll(list, IntValue.class)).containsExactly(value);
    }
}
