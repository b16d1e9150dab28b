package com.cascade.action;

import com.cascade.condition.DefaultConditionEvaluator;
import com.cascade.model.*;
import com.cascade.variable.EvaluationContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.cascade.WorkItemFixtures.builder;
import static com.cascade.WorkItemFixtures.url;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultActionExecutor.
 */
class DefaultActionExecutorTest {

    private static final String TAGS_PATH = "/fields/System.Tags";

    private ActionExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new DefaultActionExecutor(new DefaultConditionEvaluator().getOperandResolver());
    }

    private static Action action(ActionType type, Scope scope, String field, String value) {
        return new Action(type, AlterOptions.defaults(), new ObjectOperand(scope, field), new ConstOperand(value));
    }

    private static EvaluationContext contextFor(WorkItem me) {
        return EvaluationContext.of(me, null, List.of());
    }

    @Test
    @DisplayName("Should not add a tag that is already present")
    void shouldSkipExistingTag() {
        WorkItem me = builder(1).tags("Done").build();

        assertTrue(executor.execute(action(ActionType.ADD, Scope.ME, "Tags", "Done"), contextFor(me)).isEmpty());
    }

    @Test
    @DisplayName("Should append a new tag to the list")
    void shouldAppendTag() {
        WorkItem me = builder(1).tags("InProgress").build();

        List<UpdateOperation> ops = executor.execute(action(ActionType.ADD, Scope.ME, "Tags", "Done"), contextFor(me));

        assertEquals(List.of(new UpdateOperation(url(1), null, null, "replace", TAGS_PATH, "InProgress; Done")), ops);
    }

    @Test
    @DisplayName("Should write a single tag when the item has none")
    void shouldAddFirstTag() {
        WorkItem me = builder(1).build();

        List<UpdateOperation> ops = executor.execute(action(ActionType.ADD, Scope.ME, "Tags", "Done"), contextFor(me));

        assertEquals("Done", ops.get(0).value());
    }

    @Test
    @DisplayName("Should always emit the filtered list on remove")
    void shouldRemoveTag() {
        WorkItem tagged = builder(1).tags("A; Done; B").build();
        WorkItem untagged = builder(2).tags("A").build();

        List<UpdateOperation> removed = executor.execute(
                action(ActionType.REMOVE, Scope.ME, "Tags", "Done"), contextFor(tagged));
        List<UpdateOperation> unchanged = executor.execute(
                action(ActionType.REMOVE, Scope.ME, "Tags", "Done"), contextFor(untagged));

        assertEquals("A; B", removed.get(0).value());
        assertEquals(1, unchanged.size());
        assertEquals("A", unchanged.get(0).value());
    }

    @Test
    @DisplayName("Should treat add on a plain field as set and ignore remove")
    void shouldHandleNonTagFields() {
        WorkItem me = builder(1).state("New").build();

        List<UpdateOperation> added = executor.execute(action(ActionType.ADD, Scope.ME, "State", "Active"), contextFor(me));
        List<UpdateOperation> removed = executor.execute(action(ActionType.REMOVE, Scope.ME, "State", "New"), contextFor(me));

        assertEquals("Active", added.get(0).value());
        assertEquals("/fields/System.State", added.get(0).path());
        assertTrue(removed.isEmpty());
    }

    @Test
    @DisplayName("Should copy identities as their unique name")
    void shouldCopyIdentity() {
        WorkItem parent = builder(100).build();
        WorkItem me = builder(1).assignedTo("Dev", "dev@example.com").build();
        Action copy = new Action(ActionType.SET, AlterOptions.defaults(),
                new ObjectOperand(Scope.PARENT, "AssignedTo"), new ObjectOperand(Scope.ME, "AssignedTo"));

        List<UpdateOperation> ops = executor.execute(copy, EvaluationContext.of(me, parent, List.of(me)));

        assertEquals(1, ops.size());
        assertEquals(url(100), ops.get(0).url());
        assertEquals("/fields/System.AssignedTo", ops.get(0).path());
        assertEquals("dev@example.com", ops.get(0).value());
    }

    @Test
    @DisplayName("Should produce nothing when the value does not resolve")
    void shouldSkipUnresolvedValue() {
        WorkItem parent = builder(100).build();
        WorkItem me = builder(1).build();
        Action copy = new Action(ActionType.SET, AlterOptions.defaults(),
                new ObjectOperand(Scope.PARENT, "AssignedTo"), new ObjectOperand(Scope.ME, "AssignedTo"));

        assertTrue(executor.execute(copy, EvaluationContext.of(me, parent, List.of(me))).isEmpty());
    }

    @Test
    @DisplayName("Should produce nothing when there is no target")
    void shouldSkipMissingTarget() {
        WorkItem me = builder(1).build();

        assertTrue(executor.execute(action(ActionType.SET, Scope.PARENT, "State", "Active"), contextFor(me)).isEmpty());
    }

    @Test
    @DisplayName("Should emit one operation per children target, carrying options")
    void shouldFanOutToChildren() {
        WorkItem parent = builder(100).build();
        WorkItem first = builder(1).title("Test A").tags("X").build();
        WorkItem second = builder(2).title("Test B").tags("Y").build();
        WorkItem other = builder(3).title("Dev").build();
        Action action = new Action(ActionType.ADD, new AlterOptions(false, true),
                new ObjectOperand(Scope.CHILDREN, "Tags", List.of(new Condition(
                        new ObjectOperand(Scope.IMPLICIT, "Title"), Operator.STARTS_WITH, new ConstOperand("Test")))),
                new ConstOperand("Reopened"));

        List<UpdateOperation> ops = executor.execute(action,
                EvaluationContext.of(other, parent, List.of(first, second, other)));

        assertEquals(List.of(
                new UpdateOperation(url(1), false, true, "replace", TAGS_PATH, "X; Reopened"),
                new UpdateOperation(url(2), false, true, "replace", TAGS_PATH, "Y; Reopened")), ops);
    }

    @Test
    @DisplayName("Should parse and join tag lists")
    void shouldParseTagList() {
        assertEquals(List.of(), TagList.parse(null));
        assertEquals(List.of(), TagList.parse(""));
        assertEquals(List.of("a", "b"), TagList.parse("a; b"));
        assertEquals("a; b", TagList.join(List.of("a", "b")));
    }
}
