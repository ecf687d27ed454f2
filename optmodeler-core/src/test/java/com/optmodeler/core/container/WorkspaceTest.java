package com.optmodeler.core.container;

import com.optmodeler.core.entity.IndexSet;
import com.optmodeler.core.entity.OptSet;
import com.optmodeler.core.entity.Variable;
import com.optmodeler.core.exception.DuplicateNameException;
import com.optmodeler.core.exception.EntityInUseException;
import com.optmodeler.core.exception.SealedContainerException;
import com.optmodeler.core.exception.UnboundReferenceException;
import com.optmodeler.core.model.ValueType;
import com.optmodeler.core.statement.Relation;
import com.optmodeler.core.statement.SolveStatement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Workspace}.
 */
class WorkspaceTest {

    private Workspace workspace;

    @BeforeEach
    void setUp() {
        workspace = new Workspace("session");
    }

    @Test
    void openModel_duplicateName_throwsException() {
        workspace.openModel("m");

        assertThatThrownBy(() -> workspace.openModel("m")).isInstanceOf(DuplicateNameException.class);
    }

    @Test
    void getMembers_interleavesStatementsAndModels() {
        workspace.addStatement(SolveStatement.defaults());
        Model model = workspace.openModel("m");
        workspace.addSolve();

        assertThat(workspace.getMembers()).hasSize(3);
        assertThat(workspace.getMembers().get(1).model()).isSameAs(model);
        assertThat(workspace.getMembers().get(2).isModel()).isFalse();
    }

    @Test
    void subModel_mayReferenceWorkspaceEntities() {
        OptSet products = workspace.addSet("P", ValueType.STR);
        Model model = workspace.openModel("m");

        assertThat(model.addVariableGroup("make", IndexSet.over(products)).getOwner()).isSameAs(model);
        assertThat(model.getParent()).isSameAs(workspace);
        assertThat(model.getWorkspace()).isSameAs(workspace);
    }

    @Test
    void subModels_cannotReferenceEachOther() {
        Variable x = workspace.openModel("a").addVariable("x");
        Model other = workspace.openModel("b");

        assertThatThrownBy(() -> other.addConstraint("c", Relation.le(x, 1)))
            .isInstanceOf(UnboundReferenceException.class);
    }

    @Test
    void subModels_haveSeparateNamespaces() {
        workspace.openModel("a").addVariable("x");

        assertThat(workspace.openModel("b").addVariable("x").getName()).isEqualTo("x");
    }

    @Test
    void addVariable_subModelNameMatchingPrefixedWorkspaceName_throwsException() {
        workspace.addVariable("m_x");
        Model model = workspace.openModel("m");

        assertThatThrownBy(() -> model.addVariable("x")).isInstanceOf(DuplicateNameException.class);
        assertThat(model.getRegistry().isRegistered("x")).isFalse();
    }

    @Test
    void addParameter_workspaceNameMatchingPrefixedSubModelName_throwsException() {
        workspace.openModel("m").addVariable("x");

        assertThatThrownBy(() -> workspace.addParameter("m_x")).isInstanceOf(DuplicateNameException.class);
        assertThat(workspace.getRegistry().isRegistered("m_x")).isFalse();
    }

    @Test
    void addVariable_prefixedNamesOfTwoSubModelsCollide_throwsException() {
        Model outer = workspace.openModel("a");
        Model inner = workspace.openModel("a_b");
        outer.addVariable("b_x");

        assertThatThrownBy(() -> inner.addVariable("x")).isInstanceOf(DuplicateNameException.class);
    }

    @Test
    void drop_workspaceEntityUsedBySubModel_throwsException() {
        OptSet products = workspace.addSet("P");
        workspace.openModel("m").addVariableGroup("make", IndexSet.over(products));

        assertThatThrownBy(() -> workspace.drop(products)).isInstanceOf(EntityInUseException.class);
    }

    @Test
    void seal_sealsSubModels() {
        Model model = workspace.openModel("m");

        workspace.seal();

        assertThat(model.isSealed()).isTrue();
        assertThatThrownBy(() -> model.addVariable("x")).isInstanceOf(SealedContainerException.class);
        assertThatThrownBy(() -> workspace.openModel("n")).isInstanceOf(SealedContainerException.class);
    }
}
