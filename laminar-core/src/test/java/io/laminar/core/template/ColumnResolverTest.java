package io.laminar.core.template;

import static org.assertj.core.api.Assertions.assertThat;

import io.laminar.core.TestSheets;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ColumnResolverTest {

    private ColumnResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ColumnResolver(AliasTable.defaults());
    }

    @Test
    void shouldResolveCanonicalHeaders() {
        ColumnResolution resolution = resolver.resolve(TestSheets.CANONICAL_HEADERS);

        assertThat(resolution.missingRequired()).isEmpty();
        assertThat(resolution.columnOf(LogicalField.STEP_ID)).hasValue(0);
        assertThat(resolution.columnOf(LogicalField.ROLE)).hasValue(1);
        assertThat(resolution.columnOf(LogicalField.STEP_TITLE)).hasValue(2);
        assertThat(resolution.columnOf(LogicalField.NEXT_STEP)).hasValue(3);
        assertThat(resolution.columnOf(LogicalField.YES_NEXT)).hasValue(4);
        assertThat(resolution.columnOf(LogicalField.NO_NEXT)).hasValue(5);
        assertThat(resolution.columnOf(LogicalField.NOTES)).hasValue(6);
        assertThat(resolution.notes()).isEmpty();
    }

    @Test
    void shouldMatchAliasesAfterNormalization() {
        ColumnResolution resolution =
                resolver.resolve(List.of("  Step#", "ACTOR", "Activity", "Goes   To"));

        assertThat(resolution.missingRequired()).isEmpty();
        assertThat(resolution.columnOf(LogicalField.ROLE)).hasValue(1);
        assertThat(resolution.columnOf(LogicalField.NEXT_STEP)).hasValue(3);
    }

    @Test
    void shouldReportMissingRequiredFields() {
        ColumnResolution resolution = resolver.resolve(List.of("Step #", "Step Title"));

        assertThat(resolution.missingRequired()).containsExactly(LogicalField.ROLE);
        assertThat(resolution.unresolved()).contains(LogicalField.ROLE, LogicalField.NOTES);
    }

    @Test
    void shouldKeepFirstColumnAndNoteDuplicate() {
        ColumnResolution resolution =
                resolver.resolve(List.of("Step #", "Role", "Title", "Actor"));

        assertThat(resolution.columnOf(LogicalField.ROLE)).hasValue(1);
        assertThat(resolution.notes()).hasSize(1);
        assertThat(resolution.notes().get(0)).contains("Actor").contains("role");
    }

    @Test
    void shouldAssignSharedAliasToFirstUnresolvedField() {
        // "No" is an alias of both the step number and the no-branch
        ColumnResolution resolution =
                resolver.resolve(List.of("Step #", "Role", "Title", "Yes", "No"));

        assertThat(resolution.columnOf(LogicalField.STEP_ID)).hasValue(0);
        assertThat(resolution.columnOf(LogicalField.NO_NEXT)).hasValue(4);
        assertThat(resolution.notes()).isEmpty();
    }

    @Test
    void shouldReadTypeColumnAsConditionBeforeManualSystem() {
        // "Type" is an alias of both the condition flag and manual/system
        ColumnResolution single = resolver.resolve(List.of("Step #", "Role", "Title", "Type"));
        ColumnResolution twice =
                resolver.resolve(List.of("Step #", "Role", "Title", "Type", "Type"));
        ColumnResolution explicit =
                resolver.resolve(List.of("Step #", "Role", "Title", "Execution Type"));

        assertThat(single.columnOf(LogicalField.IS_CONDITION)).hasValue(3);
        assertThat(single.columnOf(LogicalField.MANUAL_SYSTEM)).isEmpty();
        assertThat(twice.columnOf(LogicalField.IS_CONDITION)).hasValue(3);
        assertThat(twice.columnOf(LogicalField.MANUAL_SYSTEM)).hasValue(4);
        assertThat(explicit.columnOf(LogicalField.MANUAL_SYSTEM)).hasValue(3);
        assertThat(explicit.columnOf(LogicalField.IS_CONDITION)).isEmpty();
    }

    @Test
    void shouldSkipBlankAndPlaceholderHeadersAndReportUnmatched() {
        ColumnResolution resolution =
                resolver.resolve(List.of("Step #", "", "Unnamed: 2", "Role", "Title", "Budget"));

        assertThat(resolution.columnOf(LogicalField.ROLE)).hasValue(3);
        assertThat(resolution.unmatchedHeaders()).containsExactly("Budget");
    }

    @Test
    void shouldAcceptExtraConfiguredAliases() {
        ColumnResolver custom =
                new ColumnResolver(
                        AliasTable.defaults().withAliases(LogicalField.ROLE, "Department"));

        ColumnResolution resolution = custom.resolve(List.of("Step #", "Department", "Title"));

        assertThat(resolution.missingRequired()).isEmpty();
    }

    @Test
    void shouldCanonicalizeRowsAndDropBlankOnes() {
        SheetTable sheet =
                TestSheets.sheet(
                        "s",
                        List.of("Step #", "Role", "Title"),
                        TestSheets.row("1", "Clerk", "Check"),
                        TestSheets.row("", " ", ""),
                        TestSheets.row("3", "Clerk", "Approve"));

        List<CanonicalRow> rows = resolver.resolve(sheet.headers()).canonicalize(sheet);

        assertThat(rows).hasSize(2);
        assertThat(rows.get(1).rowNumber()).isEqualTo(3);
        assertThat(rows.get(1).get(LogicalField.STEP_TITLE)).isEqualTo("Approve");
        assertThat(rows.get(1).has(LogicalField.NEXT_STEP)).isFalse();
    }
}
