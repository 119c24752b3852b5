package tasktree.service;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tasktree.api.exception.DanglingParentException;
import tasktree.api.exception.HasChildrenException;
import tasktree.api.exception.NodeValidationException;
import tasktree.api.exception.ResourceNotFoundException;
import tasktree.domain.Attachment;
import tasktree.domain.DateWindow;
import tasktree.domain.Node;
import tasktree.domain.NodeKind;
import tasktree.domain.NodeStatus;
import tasktree.persistence.store.NodeField;
import tasktree.persistence.store.NodePatch;
import tasktree.persistence.store.NodeQuery;
import tasktree.support.FlakyNodeStore;
import tasktree.support.TreeFixture;
import tasktree.support.TreeInvariants;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static tasktree.support.TreeFixture.TEACHER;

/**
 * Unit tests for {@link TreeMutator} over the in-memory store.
 *
 * <p>Covers:
 * <ul>
 *   <li>create: hierarchy fields, append order, validation, autosave drafts</li>
 *   <li>update: draft promotion, cascades and their partial failures, breadcrumb refresh</li>
 *   <li>move, reorder, delete (all descendant policies) and duplicate</li>
 * </ul>
 *
 * <p>Every structural test finishes with a whole-collection consistency check.
 */
class TreeMutatorTest {

    private static final Set<String> ROOM_A = Set.of("room-a");

    private TreeFixture fixture;
    private TreeMutator mutator;

    @BeforeEach
    void setUp() {
        fixture = TreeFixture.create();
        mutator = fixture.mutator();
    }

    private String create(final String title, final String parentId) {
        return mutator.create(TEACHER, NodeDraft.of(title, parentId, ROOM_A), false);
    }

    private Node node(final String id) {
        return fixture.store().get(id).orElseThrow();
    }

    private int nodeCount() {
        return fixture.store().query(NodeQuery.all()).size();
    }

    // ==================== Create ====================

    @Test
    void testCreateRootAndChildrenAppendInOrder() {
        final String a = create("Project A", null);
        final String b = create("Assignment B", a);
        final String c = create("Assignment C", a);

        assertThat(node(a).getOrder()).isEqualTo(1);
        assertThat(node(a).getRootId()).isEqualTo(a);
        assertThat(node(a).getPath()).isEmpty();
        assertThat(node(b).getOrder()).isEqualTo(1);
        assertThat(node(c).getOrder()).isEqualTo(2);
        assertThat(node(c).getPath()).containsExactly(a);
        assertThat(node(c).getPathTitles()).containsExactly("Project A");
        assertThat(node(c).getRootId()).isEqualTo(a);
        assertThat(node(a).getChildIds()).containsExactly(b, c);
        TreeInvariants.assertConsistent(fixture.store());
    }

    @Test
    void testDeletingLeafChildUnlinksItFromParent() {
        final String a = create("Project A", null);
        final String b = create("Assignment B", a);
        final String c = create("Assignment C", a);

        mutator.delete(TEACHER, b, DescendantPolicy.ORPHAN);

        assertThat(node(a).getChildIds()).containsExactly(c);
        assertThat(fixture.store().get(b)).isEmpty();
        TreeInvariants.assertConsistent(fixture.store());
    }

    @Test
    void testGrandchildInheritsFullAncestorChain() {
        final String a = create("Project A", null);
        final String b = create("Assignment B", a);
        final String c = create("Task C", b);

        assertThat(node(c).getPath()).containsExactly(a, b);
        assertThat(node(c).getPathTitles()).containsExactly("Project A", "Assignment B");
        assertThat(node(c).breadcrumb()).isEqualTo("Project A → Assignment B");
        assertThat(node(c).getRootId()).isEqualTo(a);
    }

    @Test
    void testExplicitSaveRequiresTitle() {
        assertThatThrownBy(() -> mutator.create(TEACHER, NodeDraft.of("  ", null, ROOM_A), false))
                .isInstanceOf(NodeValidationException.class)
                .hasMessage(TreeMutator.TITLE_REQUIRED);
        assertThat(nodeCount()).isZero();
    }

    @Test
    void testExplicitSaveRequiresRoomWhenNoneIsActive() {
        final MutationContext noRoom = MutationContext.of("teacher-1");

        assertThatThrownBy(() -> mutator.create(noRoom, NodeDraft.of("Project", null, Set.of()), false))
                .isInstanceOf(NodeValidationException.class)
                .hasMessage(TreeMutator.VISIBILITY_REQUIRED);
    }

    @Test
    void testActiveRoomIsUsedWhenVisibilityIsEmpty() {
        final String id = mutator.create(TEACHER, NodeDraft.of("Project", null, Set.of()), false);

        assertThat(node(id).getVisibility()).containsExactly("room-a");
        assertThat(node(id).getOwnerId()).isEqualTo("teacher-1");
    }

    @Test
    void testAutosaveStoresIncompleteDraft() {
        final String id = mutator.create(MutationContext.of("teacher-1"), NodeDraft.of("", null, Set.of()), true);

        assertThat(node(id).getStatus()).isEqualTo(NodeStatus.DRAFT);
        assertThat(node(id).getTitle()).isEmpty();
    }

    @Test
    void testExplicitSaveNeverCreatesDraft() {
        final NodeDraft draft = new NodeDraft(
                NodeKind.PROJECT, "Project", null, null, null, NodeStatus.DRAFT, ROOM_A, null, null);

        final String id = mutator.create(TEACHER, draft, false);

        assertThat(node(id).getStatus()).isEqualTo(NodeStatus.TODO);
        assertThat(node(id).getKind()).isEqualTo(NodeKind.PROJECT);
    }

    @Test
    void testCreateUnderMissingParentIsRejected() {
        assertThatThrownBy(() -> create("Orphan", "missing"))
                .isInstanceOf(DanglingParentException.class)
                .hasMessage("Parent not found: missing");
        assertThat(nodeCount()).isZero();
    }

    // ==================== Update ====================

    @Test
    void testExplicitSavePromotesDraft() {
        final String id = mutator.create(TEACHER, NodeDraft.of("Half done", null, ROOM_A), true);

        final UpdateResult result = mutator.update(TEACHER, id, NodeUpdate.create().title("Done"), false, false);

        assertThat(result.node().getStatus()).isEqualTo(NodeStatus.TODO);
        assertThat(node(id).getStatus()).isEqualTo(NodeStatus.TODO);
        assertThat(node(id).getTitle()).isEqualTo("Done");
    }

    @Test
    void testAutosaveKeepsStoredStatus() {
        final String id = create("Project", null);

        mutator.update(TEACHER, id, NodeUpdate.create().status(NodeStatus.DRAFT).description("notes"), false, true);

        assertThat(node(id).getStatus()).isEqualTo(NodeStatus.TODO);
        assertThat(node(id).getDescription()).isEqualTo("notes");
    }

    @Test
    void testAutosaveCascadeDoesNotPushDiscardedStatus() {
        final String parent = create("Project P", null);
        final String child = create("Task C", parent);
        mutator.update(TEACHER, child, NodeUpdate.create().status(NodeStatus.DONE), false, false);
        final DateWindow window = DateWindow.onDay(LocalDate.of(2025, 9, 12));

        final UpdateResult result = mutator.update(TEACHER, parent,
                NodeUpdate.create().status(NodeStatus.IN_PROGRESS).window(window), true, true);

        assertThat(result.cascade().fields()).containsExactly(CascadeField.WINDOW);
        assertThat(node(parent).getStatus()).isEqualTo(NodeStatus.TODO);
        assertThat(node(child).getStatus()).isEqualTo(NodeStatus.DONE);
        assertThat(node(child).getWindow()).isEqualTo(window);
    }

    @Test
    void testExplicitSaveCannotBlankTitle() {
        final String id = create("Project", null);

        assertThatThrownBy(() -> mutator.update(TEACHER, id, NodeUpdate.create().title(""), false, false))
                .isInstanceOf(NodeValidationException.class)
                .hasMessage(TreeMutator.TITLE_REQUIRED);
        assertThat(node(id).getTitle()).isEqualTo("Project");
    }

    @Test
    void testUpdateOfMissingNodeIsNotFound() {
        assertThatThrownBy(() -> mutator.update(TEACHER, "nope", NodeUpdate.create().title("x"), false, false))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Node not found: nope");
    }

    @Test
    void testWindowChangeWithoutCascadeLeavesChildrenAlone() {
        final String a = create("Project A", null);
        final String b = create("Assignment B", a);
        final DateWindow window = DateWindow.onDay(LocalDate.of(2025, 9, 10));

        final UpdateResult result = mutator.update(TEACHER, a, NodeUpdate.create().window(window), false, false);

        assertThat(result.cascade()).isNull();
        assertThat(node(a).getWindow()).isEqualTo(window);
        assertThat(node(b).getWindow()).isNull();
    }

    @Test
    void testCascadeCopiesChangedFieldsToWholeSubtree() {
        final String a = create("Project A", null);
        final String b = create("Assignment B", a);
        final String c = create("Task C", b);

        final UpdateResult result = mutator.update(TEACHER, a,
                NodeUpdate.create().status(NodeStatus.DONE).title("Renamed"), true, false);

        assertThat(result.hasWarning()).isFalse();
        assertThat(result.cascade().fields()).containsExactly(CascadeField.STATUS);
        assertThat(result.cascade().descendantIds()).containsExactlyInAnyOrder(b, c);
        assertThat(node(b).getStatus()).isEqualTo(NodeStatus.DONE);
        assertThat(node(c).getStatus()).isEqualTo(NodeStatus.DONE);
        // titles are never cascaded
        assertThat(node(b).getTitle()).isEqualTo("Assignment B");
    }

    @Test
    void testPartialCascadeKeepsAncestorAndReportsPendingDescendants() {
        final FlakyNodeStore flaky = new FlakyNodeStore(TreeFixture.memoryStore(2));
        final TreeFixture local = TreeFixture.over(flaky);
        final String a = local.mutator().create(TEACHER, NodeDraft.of("Project A", null, ROOM_A), false);
        for (int i = 1; i <= 3; i++) {
            local.mutator().create(TEACHER, NodeDraft.of("Item " + i, a, ROOM_A), false);
        }
        flaky.failAfter(1, Integer.MAX_VALUE);

        final UpdateResult result = local.mutator().update(TEACHER, a,
                NodeUpdate.create().status(NodeStatus.STUCK), true, false);

        assertThat(flaky.get(a).orElseThrow().getStatus()).isEqualTo(NodeStatus.STUCK);
        assertThat(result.hasWarning()).isTrue();
        assertThat(result.cascadeWarning().message()).isEqualTo("Saved, but only some nested items were updated.");
        assertThat(result.cascadeWarning().succeededIds()).hasSize(2);
        assertThat(result.cascadeWarning().pendingIds()).hasSize(1);
        final long stuck = flaky.query(NodeQuery.siblingsOf(a)).stream()
                .filter(child -> child.getStatus() == NodeStatus.STUCK)
                .count();
        assertThat(stuck).isEqualTo(2);
    }

    @Test
    void testFailedCascadeReportsEveryDescendantAsPending() {
        final FlakyNodeStore flaky = new FlakyNodeStore(TreeFixture.memoryStore(500));
        final TreeFixture local = TreeFixture.over(flaky);
        final String a = local.mutator().create(TEACHER, NodeDraft.of("Project A", null, ROOM_A), false);
        final String b = local.mutator().create(TEACHER, NodeDraft.of("Assignment B", a, ROOM_A), false);
        flaky.failAfter(0, Integer.MAX_VALUE);

        final UpdateResult result = local.mutator().update(TEACHER, a,
                NodeUpdate.create().visibility(Set.of("room-b")), true, false);

        assertThat(flaky.get(a).orElseThrow().getVisibility()).containsExactly("room-b");
        assertThat(result.cascadeWarning().message()).isEqualTo("Saved, but nested items were not updated.");
        assertThat(result.cascadeWarning().pendingIds()).containsExactly(b);
        assertThat(flaky.get(b).orElseThrow().getVisibility()).containsExactly("room-a");
    }

    @Test
    void testRenameRefreshesDescendantBreadcrumbs() {
        final String a = create("Project A", null);
        final String b = create("Assignment B", a);
        final String c = create("Task C", b);

        mutator.update(TEACHER, b, NodeUpdate.create().title("Assignment B2"), false, false);

        assertThat(node(c).getPathTitles()).containsExactly("Project A", "Assignment B2");
        assertThat(node(b).getPathTitles()).containsExactly("Project A");
    }

    @Test
    void testParentChangeInUpdateMovesNode() {
        final String a = create("Project A", null);
        final String d = create("Project D", null);
        final String b = create("Assignment B", a);

        mutator.update(TEACHER, b, NodeUpdate.create().parentId(d).title("Moved B"), false, false);

        assertThat(node(b).getParentId()).isEqualTo(d);
        assertThat(node(b).getTitle()).isEqualTo("Moved B");
        TreeInvariants.assertConsistent(fixture.store());
    }

    @Test
    void testRejectedUpdateDoesNotMoveNode() {
        final String a = create("Project A", null);
        final String b = create("Project B", null);
        final String c = create("Task C", a);

        assertThatThrownBy(() -> mutator.update(TEACHER, c, NodeUpdate.create().parentId(b).title(""), false, false))
                .isInstanceOf(NodeValidationException.class)
                .hasMessage(TreeMutator.TITLE_REQUIRED);

        assertThat(node(c).getParentId()).isEqualTo(a);
        assertThat(node(c).getTitle()).isEqualTo("Task C");
        assertThat(node(a).getChildIds()).containsExactly(c);
        assertThat(node(b).getChildIds()).isEmpty();
        TreeInvariants.assertConsistent(fixture.store());
    }

    // ==================== Move ====================

    @Test
    void testMoveRebasesWholeSubtree() {
        final String a = create("Project A", null);
        final String d = create("Project D", null);
        final String existing = create("Existing", d);
        final String b = create("Assignment B", a);
        final String c = create("Task C", b);
        final String e = create("Subtask E", c);

        final MoveResult result = mutator.move(TEACHER, b, d);

        assertThat(result.moved()).isTrue();
        assertThat(result.previousParentId()).isEqualTo(a);
        assertThat(result.rebasedDescendants()).containsExactlyInAnyOrder(c, e);
        assertThat(node(a).getChildIds()).doesNotContain(b);
        assertThat(node(d).getChildIds()).containsExactly(existing, b);
        assertThat(node(b).getOrder()).isEqualTo(2);
        assertThat(node(e).getPath()).containsExactly(d, b, c);
        assertThat(node(e).getPathTitles()).containsExactly("Project D", "Assignment B", "Task C");
        assertThat(node(e).getRootId()).isEqualTo(d);
        assertThat(node(c).getChildIds()).containsExactly(e);
        TreeInvariants.assertConsistent(fixture.store());
        TreeInvariants.assertUniqueSiblingOrders(fixture.store());
    }

    @Test
    void testMoveToRootMakesSubtreeStandalone() {
        final String a = create("Project A", null);
        final String b = create("Assignment B", a);
        final String c = create("Task C", b);

        mutator.move(TEACHER, b, null);

        assertThat(node(b).isRoot()).isTrue();
        assertThat(node(b).getRootId()).isEqualTo(b);
        assertThat(node(b).getOrder()).isEqualTo(2);
        assertThat(node(c).getPath()).containsExactly(b);
        assertThat(node(c).getRootId()).isEqualTo(b);
        TreeInvariants.assertConsistent(fixture.store());
    }

    @Test
    void testMoveUnderOwnDescendantIsRejected() {
        final String a = create("Project A", null);
        final String b = create("Assignment B", a);
        final String c = create("Task C", b);

        assertThatThrownBy(() -> mutator.move(TEACHER, a, c))
                .isInstanceOf(DanglingParentException.class)
                .hasMessage("Cannot move an item under itself or one of its own items.");
        assertThatThrownBy(() -> mutator.move(TEACHER, b, b))
                .isInstanceOf(DanglingParentException.class);
        assertThat(node(a).isRoot()).isTrue();
        TreeInvariants.assertConsistent(fixture.store());
    }

    @Test
    void testMoveToMissingParentIsRejected() {
        final String a = create("Project A", null);

        assertThatThrownBy(() -> mutator.move(TEACHER, a, "ghost"))
                .isInstanceOf(DanglingParentException.class)
                .hasMessage("Parent not found: ghost");
    }

    @Test
    void testMoveToSameParentIsNoOp() {
        final String a = create("Project A", null);
        final String b = create("Assignment B", a);

        final MoveResult result = mutator.move(TEACHER, b, a);

        assertThat(result.moved()).isFalse();
        assertThat(node(b).getOrder()).isEqualTo(1);
    }

    // ==================== Reorder ====================

    @Test
    void testReorderSwapsWithNeighbour() {
        final String a = create("Project A", null);
        final String first = create("First", a);
        final String second = create("Second", a);
        final String third = create("Third", a);

        assertThat(mutator.reorder(TEACHER, third, ReorderDirection.UP)).isTrue();

        assertThat(node(third).getOrder()).isEqualTo(2);
        assertThat(node(second).getOrder()).isEqualTo(3);
        assertThat(node(first).getOrder()).isEqualTo(1);
    }

    @Test
    void testReorderAtEitherEndDoesNothing() {
        final String a = create("Project A", null);
        final String first = create("First", a);
        final String last = create("Last", a);

        assertThat(mutator.reorder(TEACHER, first, ReorderDirection.UP)).isFalse();
        assertThat(mutator.reorder(TEACHER, last, ReorderDirection.DOWN)).isFalse();
        assertThat(node(first).getOrder()).isEqualTo(1);
        assertThat(node(last).getOrder()).isEqualTo(2);
    }

    @Test
    void testReorderRepairsDriftedGroupFirst() {
        final String a = create("Project A", null);
        final String first = create("First", a);
        final String second = create("Second", a);
        final String third = create("Third", a);
        for (final String id : List.of(first, second, third)) {
            fixture.store().update(id, NodePatch.create().set(NodeField.ORDER, 5));
        }

        assertThat(mutator.reorder(TEACHER, second, ReorderDirection.DOWN)).isTrue();

        TreeInvariants.assertUniqueSiblingOrders(fixture.store());
        assertThat(node(first).getOrder()).isEqualTo(10);
        assertThat(node(third).getOrder()).isEqualTo(20);
        assertThat(node(second).getOrder()).isEqualTo(30);
    }

    // ==================== Delete ====================

    @Test
    void testDeleteWithChildrenRequiresDecision() {
        final String a = create("Project A", null);
        final String b = create("Assignment B", a);
        create("Task C", b);

        assertThatThrownBy(() -> mutator.delete(TEACHER, b, DescendantPolicy.REJECT))
                .isInstanceOfSatisfying(HasChildrenException.class, ex -> {
                    assertThat(ex.getNodeId()).isEqualTo(b);
                    assertThat(ex.getChildCount()).isEqualTo(1);
                    assertThat(ex.getMessage())
                            .isEqualTo("This item has 1 child. Delete them too, or keep them as standalone items?");
                });
        assertThatThrownBy(() -> mutator.delete(TEACHER, b, null)).isInstanceOf(HasChildrenException.class);
        assertThat(nodeCount()).isEqualTo(3);
    }

    @Test
    void testDeleteWithDescendantsRemovesSubtreeDeepestFirst() {
        final String a = create("Project A", null);
        final String b = create("Assignment B", a);
        final String c = create("Task C", b);
        final String d = create("Subtask D", c);

        final DeleteResult result = mutator.delete(TEACHER, b, DescendantPolicy.DELETE);

        assertThat(result.deletedIds()).containsExactly(d, c, b);
        assertThat(result.orphanedIds()).isEmpty();
        assertThat(fixture.store().query(NodeQuery.all())).extracting(Node::getId).containsExactly(a);
        assertThat(node(a).getChildIds()).isEmpty();
    }

    @Test
    void testDeleteKeepingDescendantsPromotesChildrenToRoots() {
        final String a = create("Project A", null);
        final String b = create("Assignment B", a);
        final String c1 = create("Task C1", b);
        final String c2 = create("Task C2", b);
        final String g = create("Subtask G", c1);

        final DeleteResult result = mutator.delete(TEACHER, b, DescendantPolicy.ORPHAN);

        assertThat(result.deletedIds()).containsExactly(b);
        assertThat(result.orphanedIds()).containsExactly(c1, c2);
        assertThat(node(a).getChildIds()).isEmpty();
        assertThat(node(c1).isRoot()).isTrue();
        assertThat(node(c1).getRootId()).isEqualTo(c1);
        assertThat(node(c1).getPathTitles()).isEmpty();
        assertThat(node(c1).getOrder()).isEqualTo(2);
        assertThat(node(c2).getOrder()).isEqualTo(3);
        assertThat(node(g).getPath()).containsExactly(c1);
        assertThat(node(g).getPathTitles()).containsExactly("Task C1");
        assertThat(node(g).getRootId()).isEqualTo(c1);
        TreeInvariants.assertConsistent(fixture.store());
        TreeInvariants.assertUniqueSiblingOrders(fixture.store());
    }

    @Test
    void testDeleteMissingNodeIsNotFound() {
        assertThatThrownBy(() -> mutator.delete(TEACHER, "nope", DescendantPolicy.DELETE))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    // ==================== Duplicate ====================

    @Test
    void testDuplicateStartsWithEmptyQuestionHistory() {
        final String a = create("Project A", null);
        final String b = create("Assignment B", a);
        fixture.questions().ask(b, "student-1", "Ana", "room-a", "What is due?");
        fixture.questions().ask(b, "student-2", "Ben", "room-a", "Can I use a calculator?");

        final DuplicationResult result = mutator.duplicate(TEACHER, b, DuplicateOptions.nodeOnly());

        final Node copy = node(result.newRootId());
        assertThat(copy.getId()).isNotEqualTo(b);
        assertThat(copy.getQuestionHistory()).isEmpty();
        assertThat(node(b).getQuestionHistory()).hasSize(2);
        assertThat(copy.getTitle()).isEqualTo("Assignment B");
        assertThat(copy.getOrder()).isEqualTo(2);
        assertThat(node(a).getChildIds()).containsExactly(b, copy.getId());
        TreeInvariants.assertConsistent(fixture.store());
    }

    @Test
    void testDuplicateSubtreeMapsEveryNode() {
        final String a = create("Project A", null);
        final String b = create("Assignment B", a);
        final String c1 = create("Task C1", b);
        final String c2 = create("Task C2", b);
        final String d = create("Subtask D", c1);

        final DuplicationResult result = mutator.duplicate(TEACHER, b, DuplicateOptions.withDescendants());

        assertThat(result.idMap()).containsOnlyKeys(b, c1, c2, d);
        assertThat(result.idMap().get(b)).isEqualTo(result.newRootId());
        final Node copyB = node(result.newRootId());
        final Node copyD = node(result.idMap().get(d));
        assertThat(copyB.getChildIds()).containsExactly(result.idMap().get(c1), result.idMap().get(c2));
        assertThat(copyD.getPath()).containsExactly(a, result.newRootId(), result.idMap().get(c1));
        assertThat(copyD.getPathTitles()).containsExactly("Project A", "Assignment B", "Task C1");
        assertThat(node(result.idMap().get(c2)).getOrder()).isEqualTo(node(c2).getOrder());
        // source subtree untouched
        assertThat(node(b).getChildIds()).containsExactly(c1, c2);
        assertThat(nodeCount()).isEqualTo(9);
        TreeInvariants.assertConsistent(fixture.store());
    }

    @Test
    void testDuplicateAttachmentsAreIndependent() {
        final Attachment worksheet = new Attachment("att-1", "worksheet.pdf",
                "https://files.example.org/worksheet.pdf", "application/pdf", 2048);
        final String a = mutator.create(TEACHER, new NodeDraft(NodeKind.PROJECT, "Project A", null, null, null,
                null, ROOM_A, List.of(worksheet), null), false);

        final String copy = mutator.duplicate(TEACHER, a, DuplicateOptions.nodeOnly()).newRootId();
        mutator.update(TEACHER, copy, NodeUpdate.create().attachments(List.of()), false, false);

        assertThat(node(copy).getAttachments()).isEmpty();
        assertThat(node(a).getAttachments()).containsExactly(worksheet);
    }

    @Test
    void testDuplicateToOtherParentWithNewRoomAndTitle() {
        final String a = create("Project A", null);
        final String b = create("Assignment B", a);
        final String c = create("Task C", b);
        final String z = create("Project Z", null);

        final DuplicationResult result = mutator.duplicate(TEACHER, b,
                new DuplicateOptions(true, z, Set.of("room-b"), "Assignment B (copy)"));

        final Node copyB = node(result.newRootId());
        final Node copyC = node(result.idMap().get(c));
        assertThat(copyB.getParentId()).isEqualTo(z);
        assertThat(copyB.getTitle()).isEqualTo("Assignment B (copy)");
        assertThat(copyB.getVisibility()).containsExactly("room-b");
        assertThat(copyC.getVisibility()).containsExactly("room-b");
        assertThat(copyC.getRootId()).isEqualTo(z);
        assertThat(copyC.getPathTitles()).containsExactly("Project Z", "Assignment B (copy)");
        assertThat(node(z).getChildIds()).containsExactly(result.newRootId());
        assertThat(node(a).getChildIds()).containsExactly(b);
        TreeInvariants.assertConsistent(fixture.store());
    }

    @Test
    void testDuplicateUnderMissingParentIsRejected() {
        final String a = create("Project A", null);
        final int before = nodeCount();

        assertThatThrownBy(() -> mutator.duplicate(TEACHER, a, new DuplicateOptions(false, "ghost", null, null)))
                .isInstanceOf(DanglingParentException.class);
        assertThat(nodeCount()).isEqualTo(before);
    }

    // ==================== Reads ====================

    @Test
    void testLoadWithDescendantsIsShallowestFirst() {
        final String a = create("Project A", null);
        final String b = create("Assignment B", a);
        final String c = create("Task C", b);
        final String b2 = create("Assignment B2", a);

        final SubtreeSnapshot snapshot = mutator.loadWithDescendants(a);

        assertThat(snapshot.node().getId()).isEqualTo(a);
        assertThat(snapshot.descendants()).extracting(Node::getId).containsExactly(b, b2, c);
        assertThat(snapshot.allNodes()).hasSize(4);
    }
}
