package org.treekit.ast.core.schema;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.treekit.ast.api.Span;
import org.treekit.ast.core.LeafNode;
import org.treekit.ast.core.Node;
import org.treekit.ast.core.NodeContractException;
import org.treekit.ast.core.NodeVisitor;
import org.treekit.ast.core.repr.ValueNode;
import org.treekit.ast.lang.BinaryOp;
import org.treekit.ast.lang.Call;
import org.treekit.ast.lang.ExprLanguage;
import org.treekit.ast.lang.ExprVisitor;
import org.treekit.ast.lang.IntLit;
import org.treekit.ast.lang.ListLit;
import org.treekit.ast.lang.pooled.PooledIntLit;
import org.treekit.ast.lang.value.IntValue;
import org.treekit.junit.extensions.logging.ExpectLog;
import org.treekit.junit.extensions.logging.LogLevel;
import org.treekit.junit.extensions.logging.LogWatchExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.treekit.ast.testing.Trees.at;
import static org.treekit.ast.testing.Trees.sampleMul;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class NodeKindRegistryTest {

    private NodeKindRegistry registry;

    @BeforeEach
    void setUp() {
        registry = ExprLanguage.newRegistry();
    }

    @Test
    void registersEveryGrammarKind() {
        assertThat(registry.kinds()).hasSize(ExprLanguage.KINDS.size());
        assertThat(registry.kindNamed("Block")).isPresent();
        assertThat(registry.kindNamed("Nope")).isEmpty();
    }

    @Test
    void derivesFieldTableFromRecordComponents() {
        NodeKind binary = registry.kindNamed("BinaryOp").orElseThrow();

        assertThat(binary.type()).isEqualTo(BinaryOp.class);
        assertThat(binary.fields()).extracting(FieldSpec::name).containsExactly("left", "operator", "right");
        assertThat(binary.fields()).extracting(FieldSpec::category)
                .containsExactly(FieldCategory.NODE, FieldCategory.SCALAR, FieldCategory.NODE);
        assertThat(binary.scalarFields()).extracting(FieldSpec::name).containsExactly("operator");
        assertThat(binary.isLeafKind()).isFalse();
    }

    @Test
    void recognisesListFields() {
        assertThat(registry.kindNamed("Call").orElseThrow().field("arguments"))
                .hasValueSatisfying(f -> assertThat(f.category()).isEqualTo(FieldCategory.NODE_LIST));
        assertThat(registry.kindNamed("ListLit").orElseThrow().childFields())
                .extracting(FieldSpec::name).containsExactly("elements");
    }

    @Test
    void pooledAndValueKindsAreLeafKinds() {
        assertThat(registry.kindNamed("IntLit").orElseThrow().isLeafKind()).isTrue();
        assertThat(registry.kindNamed("PooledIntLit").orElseThrow().fields())
                .extracting(FieldSpec::name).containsExactly("value");
        assertThat(registry.kindNamed("IntValue").orElseThrow().isLeafKind()).isTrue();
    }

    @Test
    void kindOfLooksThroughValueWrappers() {
        Node wrapped = ValueNode.of(new IntValue(at(0, 1), 4));

        assertThat(registry.kindOf(sampleMul())).hasValueSatisfying(k -> assertThat(k.name()).isEqualTo("Mul"));
        assertThat(registry.kindOf(wrapped)).hasValueSatisfying(k -> assertThat(k.type()).isEqualTo(IntValue.class));
    }

    @Test
    void registeringTwiceReturnsTheSameKind() {
        assertThat(registry.register(IntLit.class)).isSameAs(registry.kindNamed("IntLit").orElseThrow());
        assertThat(registry.isRegistered(PooledIntLit.class)).isTrue();
        assertThat(registry.isRegistered(ListLit.class)).isTrue();
    }

    @Test
    @ExpectLog(level = LogLevel.DEBUG, loggerPattern = ".*NodeKindRegistry", messagePattern = "Registered node kind Plain.*")
    void registrationIsLogged() {
        new NodeKindRegistry().register(Plain.class);
    }

    @Test
    void rejectsAbstractTypes() {
        assertThatThrownBy(() -> registry.register(Node.class))
                .isInstanceOf(NodeContractException.class)
                .hasMessageContaining("must be a concrete class");
    }

    @Test
    void rejectsTypesOutsideTheNodeHierarchy() {
        assertThatThrownBy(() -> registry.register(String.class))
                .isInstanceOf(NodeContractException.class)
                .hasMessageContaining("must implement Node or ValueLeaf");
    }

    @Test
    void rejectsKindsWithoutStructuralEquality() {
        assertThatThrownBy(() -> new NodeKindRegistry().register(IdentityLeaf.class))
                .isInstanceOf(NodeContractException.class)
                .hasMessageContaining("structural equals()");
    }

    @Test
    void rejectsReservedFieldNames() {
        assertThatThrownBy(() -> new NodeKindRegistry().register(Orphaned.class))
                .isInstanceOf(NodeContractException.class)
                .hasMessageContaining("'parent'")
                .hasMessageContaining("reserved");
    }

    @Test
    void rejectsDuplicateKindNames() {
        NodeKindRegistry fresh = new NodeKindRegistry();
        fresh.register(First.Dup.class);

        assertThatThrownBy(() -> fresh.register(Second.Dup.class))
                .isInstanceOf(NodeContractException.class)
                .hasMessageContaining("'Dup' is already registered");
    }

    @Test
    void rejectsKindsTheVisitorCannotVisit() {
        NodeKindRegistry bound = new NodeKindRegistry(ExprVisitor.class);

        assertThatThrownBy(() -> bound.register(Plain.class))
                .isInstanceOf(NodeContractException.class)
                .hasMessage("Visitor ExprVisitor has no method visitPlain(Plain)");
    }

    record Plain(Span span, int value) implements LeafNode {
        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            throw new UnsupportedOperationException();
        }

        @Override
        public Node deepCopy() {
            return this;
        }
    }

    record Orphaned(Span span, String parent) implements LeafNode {
        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            throw new UnsupportedOperationException();
        }

        @Override
        public Node deepCopy() {
            return this;
        }
    }

    static final class IdentityLeaf implements LeafNode {
        @Override
        public Span span() {
            return Span.SYNTHETIC;
        }

        @Override
        public <T> T accept(NodeVisitor<T> visitor) {
            throw new UnsupportedOperationException();
        }

        @Override
        public Node deepCopy() {
            return new IdentityLeaf();
        }
    }

    static final class First {
        record Dup(Span span) implements LeafNode {
            @Override
            public <T> T accept(NodeVisitor<T> visitor) {
                throw new UnsupportedOperationException();
            }

            @Override
            public Node deepCopy() {
                return this;
            }
        }
    }

    static final class Second {
        record Dup(Span span) implements LeafNode {
            @Override
            public <T> T accept(NodeVisitor<T> visitor) {
                throw new UnsupportedOperationException();
            }

            @Override
            public Node deepCopy() {
                return this;
            }
        }
    }

    @Test
    void visitorTypeMustBeANodeVisitor() {
        assertThatThrownBy(() -> new NodeKindRegistry(String.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("java.lang.String is not a NodeVisitor");
    }
}
