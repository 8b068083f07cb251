package com.salescompass.backend.modules.accesscontrol.application;

import static com.salescompass.backend.support.AccessFixtures.role;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import com.salescompass.backend.modules.accesscontrol.domain.Role;

class RoleHierarchyTest {

    private final RoleHierarchy hierarchy = new RoleHierarchy(32);

    @Test
    void walksFromLeafToRoot() {
        Role admin = role("Admin", null);
        Role manager = role("Manager", admin);
        Role rep = role("Rep", manager);

        assertThat(hierarchy.leafToRoot(rep)).containsExactly(rep, manager, admin);
        assertThat(hierarchy.rootToLeaf(rep)).containsExactly(admin, manager, rep);
        assertThat(hierarchy.leafToRoot(null)).isEmpty();
    }

    @Test
    void detectsCycles() {
        Role a = role("A", null);
        Role b = role("B", a);
        a.setParent(b);

        assertThatThrownBy(() -> hierarchy.leafToRoot(b))
                .isInstanceOf(RoleHierarchyException.class)
                .hasMessageContaining("cycle");
    }

    @Test
    void detectsSelfParent() {
        Role a = role("A", null);
        a.setParent(a);

        assertThatThrownBy(() -> hierarchy.leafToRoot(a)).isInstanceOf(RoleHierarchyException.class);
    }

    @Test
    void unsavedRolesAreTrackedByInstance() {
        Role root = new Role();
        root.setName("Root");
        Role child = new Role();
        child.setName("Child");
        child.setParent(root);

        assertThat(hierarchy.leafToRoot(child)).containsExactly(child, root);
    }

    @Test
    void enforcesMaxDepth() {
        RoleHierarchy shallow = new RoleHierarchy(2);
        Role root = role("Root", null);
        Role middle = role("Middle", root);
        Role leaf = role("Leaf", middle);

        assertThat(shallow.leafToRoot(middle)).hasSize(2);
        assertThatThrownBy(() -> shallow.leafToRoot(leaf))
                .isInstanceOf(RoleHierarchyException.class)
                .hasMessageContaining("deeper than 2");
    }

    @Test
    void recognisesParentAssignmentsThatCloseALoop() {
        Role admin = role("Admin", null);
        Role manager = role("Manager", admin);
        Role rep = role("Rep", manager);
        Role other = role("Other", null);

        assertThat(hierarchy.wouldCreateCycle(admin, rep)).isTrue();
        assertThat(hierarchy.wouldCreateCycle(admin, admin)).isTrue();
        assertThat(hierarchy.wouldCreateCycle(rep, other)).isFalse();
        assertThat(hierarchy.wouldCreateCycle(rep, null)).isFalse();
    }

    @Test
    void rejectsNonPositiveDepth() {
        assertThatThrownBy(() -> new RoleHierarchy(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
