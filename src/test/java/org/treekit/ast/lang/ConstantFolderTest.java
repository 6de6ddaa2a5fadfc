package org.treekit.ast.lang;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.treekit.ast.core.Node;
import org.treekit.ast.core.NodeContractException;
import org.treekit.ast.core.repr.ValueNode;
import org.treekit.ast.lang.optimized.OptBinaryOp;
import org.treekit.ast.lang.optimized.OptIntLit;
import org.treekit.ast.lang.pooled.PooledBoolLit;
import org.treekit.ast.lang.pooled.PooledIntLit;
import org.treekit.ast.lang.value.IntValue;
import org.treekit.ast.pool.NodePool;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.treekit.ast.testing.Trees.at;
import static org.treekit.ast.testing.Trees.intLit;
import static org.treekit.ast.testing.Trees.sampleMul;

@Tag("unit")
class ConstantFolderTest {

    private ConstantFolder folder;

    @BeforeEach
    void setUp() {
        folder = new ConstantFolder();
    }

    @Test
    void foldsNestedArithmetic() {
        Node folded = folder.transform(sampleMul());

        assertThat(folded).isEqualTo(new IntLit(at(0, 11), 9));
    }

    @Test
    void leavesOverflowUnfolded() {
        Add overflow = new Add(at(0, 5), new IntLit(at(0, 1), Integer.MAX_VALUE), intLit(1, 4));

        assertThat(folder.transform(overflow)).isSameAs(overflow);
    }

    @Test
    void leavesDivisionByZeroUnfolded() {
        BinaryOp division = new BinaryOp(at(0, 5), intLit(4, 0), "/", intLit(0, 4));

        assertThat(folder.transform(division)).isSameAs(division);
    }

    @Test
    void foldsComparisonsAcrossRepresentations() {
        NodePool pool = new NodePool();
        OptBinaryOp less = new OptBinaryOp(at(0, 5), new OptIntLit(at(0, 1), 4), "<", PooledIntLit.of(pool, at(4, 5), 5));

        assertThat(folder.transform(less)).isEqualTo(new BoolLit(at(0, 5), true));
    }

    @Test
    void foldsBooleanOperators() {
        BinaryOp and = new BinaryOp(at(0, 13), new BoolLit(at(0, 4), true), "&&",
                PooledBoolLit.of(new NodePool(), at(8, 13), false));
        UnaryOp not = new UnaryOp(at(0, 14), "!", and);

        assertThat(folder.transform(not)).isEqualTo(new BoolLit(at(0, 14), true));
    }

    @Test
    void negationOfMinValueIsNotFolded() {
        UnaryOp negate = new UnaryOp(at(0, 12), "-", new IntLit(at(1, 12), Integer.MIN_VALUE));

        assertThat(folder.transform(negate)).isSameAs(negate);
    }

    @Test
    void unfoldableTreeIsReturnedAsIs() {
        Block block = new Block(at(0, 20), List.of(
                new VarDecl(at(0, 10), "x", new Add(at(4, 9), new Identifier(at(4, 5), "y"), intLit(1, 8))),
                new ExprStmt(at(11, 20), new Call(at(11, 19), new Identifier(at(11, 14), "log"), List.of()))));

        assertThat(folder.transform(block)).isSameAs(block);
    }

    @Test
    void rebuildsOnlyTheChangedPath() {
        Identifier untouched = new Identifier(at(0, 1), "a");
        ValueNode<IntValue> value = ValueNode.of(new IntValue(at(3, 4), 8));
        ListLit list = new ListLit(at(0, 12), List.of(untouched, value, new Add(at(6, 11), intLit(1, 6), intLit(2, 10))));

        ListLit folded = (ListLit) folder.transform(list);

        assertThat(folded).isNotSameAs(list);
        assertThat(folded.elements().get(0)).isSameAs(untouched);
        assertThat(folded.elements().get(1)).isSameAs(value);
        assertThat(folded.elements().get(2)).isEqualTo(new IntLit(at(6, 11), 3));
    }

    @Test
    void foldsInsideStatements() {
        IfStmt branch = new IfStmt(at(0, 20),
                new BinaryOp(at(3, 8), intLit(1, 3), "==", intLit(1, 7)),
                new Block(at(10, 20), List.of(new ExprStmt(at(11, 19), sampleMul()))),
                null);

        IfStmt folded = (IfStmt) folder.transform(branch);

        assertThat(folded.condition()).isEqualTo(new BoolLit(at(3, 8), true));
        assertThat(((ExprStmt) folded.thenBranch().statements().get(0)).expression()).isEqualTo(new IntLit(at(0, 11), 9));
        assertThat(folded.elseBranch()).isNull();
    }

    @Test
    void transformAsRejectsAnIncompatibleReplacement() {
        assertThatThrownBy(() -> folder.transformAs(sampleMul(), Identifier.class))
                .isInstanceOf(NodeContractException.class)
                .hasMessage("Transformer ConstantFolder replaced Mul with IntLit, expected a Identifier");
    }
}
