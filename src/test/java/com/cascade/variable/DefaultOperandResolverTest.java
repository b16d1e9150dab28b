package com.cascade.variable;

import com.cascade.condition.DefaultConditionEvaluator;
import com.cascade.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.cascade.WorkItemFixtures.builder;
import static com.cascade.WorkItemFixtures.item;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultOperandResolver.
 */
class DefaultOperandResolverTest {

    private OperandResolver resolver;

    private WorkItem parent;
    private WorkItem devTask;
    private WorkItem testTask;
    private WorkItem otherTestTask;
    private EvaluationContext context;

    @BeforeEach
    void setUp() {
        resolver = new DefaultConditionEvaluator().getOperandResolver();

        parent = builder(100).title("Story").state("New").type("User Story").build();
        devTask = builder(123).title("Dev Task").state("Active").assignedTo("Dev", "dev@example.com").build();
        testTask = builder(124).title("Test Task").state("New").assignedTo("Tester", "tester@example.com").build();
        otherTestTask = builder(125).title("Second Test Task").state("Closed").build();
        context = EvaluationContext.of(devTask, parent, List.of(devTask, testTask, otherTestTask));
    }

    @Test
    @DisplayName("Should resolve literals to themselves")
    void shouldResolveConstant() {
        assertEquals(Optional.of("Active"), resolver.resolve(new ConstOperand("Active"), context));
    }

    @Test
    @DisplayName("Should resolve me, parent and implicit fields")
    void shouldResolveScopedFields() {
        assertEquals(Optional.of("Dev Task"), resolver.resolve(new ObjectOperand(Scope.ME, "Title"), context));
        assertEquals(Optional.of("Story"), resolver.resolve(new ObjectOperand(Scope.PARENT, "Title"), context));
        assertEquals(Optional.of("Dev Task"), resolver.resolve(new ObjectOperand(Scope.IMPLICIT, "Title"), context));
    }

    @Test
    @DisplayName("Should bind unprefixed fields in a child filter to the candidate")
    void shouldShadowImplicitInsideChildFilter() {
        ObjectOperand operand = new ObjectOperand(Scope.CHILD, "AssignedTo", List.of(
                new Condition(new ObjectOperand(Scope.IMPLICIT, "Title"), Operator.CONTAINS, new ConstOperand("Test"))));

        assertEquals(Optional.of(testTask), resolver.resolveItem(operand, context));
        assertEquals(Optional.of("tester@example.com"), resolver.resolveAsString(operand, context));
    }

    @Test
    @DisplayName("Should keep me bound to the triggering item inside a child filter")
    void shouldKeepMeInsideChildFilter() {
        ObjectOperand operand = new ObjectOperand(Scope.CHILD, "Title", List.of(
                new Condition(new ObjectOperand(Scope.ME, "Title"), Operator.CONTAINS, new ConstOperand("Test"))));

        // me.Title is "Dev Task" for every candidate
        assertTrue(resolver.resolve(operand, context).isEmpty());
    }

    @Test
    @DisplayName("Should target first match for child and all matches for children")
    void shouldResolveChildAndChildrenTargets() {
        List<Condition> filter = List.of(
                new Condition(new ObjectOperand(Scope.IMPLICIT, "Title"), Operator.CONTAINS, new ConstOperand("Test")));

        assertEquals(List.of(testTask),
                resolver.resolveTargets(new ObjectOperand(Scope.CHILD, "State", filter), context));
        assertEquals(List.of(testTask, otherTestTask),
                resolver.resolveTargets(new ObjectOperand(Scope.CHILDREN, "State", filter), context));
        assertEquals(List.of(devTask, testTask, otherTestTask),
                resolver.resolveTargets(new ObjectOperand(Scope.CHILDREN, "State"), context));
    }

    @Test
    @DisplayName("Should take only the first child when child has no filter")
    void shouldResolveUnfilteredChildToFirstCandidate() {
        ObjectOperand firstChild = new ObjectOperand(Scope.CHILD, "Title");

        assertEquals(List.of(devTask), resolver.resolveTargets(firstChild, context));
        assertEquals(Optional.of("Dev Task"), resolver.resolve(firstChild, context));
        assertTrue(resolver.resolveTargets(firstChild, EvaluationContext.of(devTask, parent, List.of())).isEmpty());
    }

    @Test
    @DisplayName("Should resolve to empty when there is no parent")
    void shouldHandleMissingParent() {
        EvaluationContext orphan = EvaluationContext.of(devTask, null, List.of());
        ObjectOperand parentState = new ObjectOperand(Scope.PARENT, "State");

        assertTrue(resolver.resolve(parentState, orphan).isEmpty());
        assertTrue(resolver.resolveTargets(parentState, orphan).isEmpty());
    }

    @Test
    @DisplayName("Should resolve to empty for missing fields and unmatched children")
    void shouldHandleMissingValues() {
        assertTrue(resolver.resolve(new ObjectOperand(Scope.ME, "Custom.Missing"), context).isEmpty());

        ObjectOperand noMatch = new ObjectOperand(Scope.CHILD, "Title", List.of(
                new Condition(new ObjectOperand(Scope.IMPLICIT, "State"), Operator.IS, new ConstOperand("Removed"))));
        assertTrue(resolver.resolve(noMatch, context).isEmpty());
        assertTrue(resolver.resolveTargets(noMatch, context).isEmpty());
    }

    @Test
    @DisplayName("Should read Id from the item identity and ignore alias case")
    void shouldResolveIdAndAliases() {
        assertEquals(Optional.of(123L), resolver.resolve(new ObjectOperand(Scope.ME, "Id"), context));
        assertEquals(Optional.of("100"), resolver.resolveAsString(new ObjectOperand(Scope.PARENT, "id"), context));
        assertEquals(Optional.of("Active"), resolver.resolve(new ObjectOperand(Scope.ME, "state"), context));
        assertEquals(Optional.of("Active"), resolver.resolve(new ObjectOperand(Scope.ME, "System.State"), context));
    }

    @Test
    @DisplayName("Should render identities by unique name")
    void shouldRenderIdentities() {
        assertEquals("dev@example.com", Values.asString(new IdentityRef("Dev", "dev@example.com")));
        assertEquals("raw@example.com", Values.asString(Map.of("displayName", "Raw", "uniqueName", "raw@example.com")));
        assertEquals("42", Values.asString(42));
        assertNull(Values.asString(null));
    }

    @Test
    @DisplayName("Should render decimals without trailing zeros")
    void shouldRenderDecimals() {
        assertEquals("2", Values.asString(2.0));
        assertEquals("2.5", Values.asString(2.50));
        assertEquals("0", Values.asString(0.0));
        assertEquals("3", Values.asString(new java.math.BigDecimal("3.000")));
        assertEquals("NaN", Values.asString(Double.NaN));
    }

    @Test
    @DisplayName("Should map aliases to patch paths")
    void shouldMapPatchPaths() {
        assertEquals("/fields/System.State", FieldAliases.patchPath("State"));
        assertEquals("/fields/System.AssignedTo", FieldAliases.patchPath("assignedTo"));
        assertEquals("/fields/Custom.Priority", FieldAliases.patchPath("Custom.Priority"));
        assertTrue(FieldAliases.isTags("TAGS"));
        assertFalse(FieldAliases.isTags("Title"));
    }

    @Test
    @DisplayName("Should read fields without an alias verbatim")
    void shouldReadUnaliasedField() {
        WorkItem custom = builder(1).field("Custom.Priority", 2).build();
        EvaluationContext ctx = EvaluationContext.of(custom, item(2, "P", "New"), List.of());

        assertEquals(Optional.of("2"), resolver.resolveAsString(new ObjectOperand(Scope.ME, "Custom.Priority"), ctx));
    }
}
