/*
 * Copyright (c) 2025 Riskset Matching Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.riskset.matching.compiler;

import com.riskset.matching.api.IConditionCompiler;
import com.riskset.matching.api.config.MatchingConfig;
import com.riskset.matching.api.exceptions.ConditionSyntaxException;
import com.riskset.matching.api.exceptions.ConfigurationException;
import com.riskset.matching.api.model.CohortTable;
import com.riskset.matching.api.model.MatchMethod;
import com.riskset.matching.api.model.SubjectRecord;
import com.riskset.matching.runtime.model.ConditionExpression;
import com.riskset.matching.runtime.model.EligibilityModel;
import com.riskset.matching.runtime.model.EligibilityPredicate;
import com.riskset.matching.runtime.model.FieldReference;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EligibilityCompilerValidationTest {

    private final Tracer tracer = OpenTelemetry.noop().getTracer("test");

    private EligibilityCompiler compiler;
    private CohortTable cases;
    private CohortTable controls;

    @Mock
    private IConditionCompiler conditionCompiler;

    @BeforeEach
    void setUp() {
        compiler = new EligibilityCompiler(tracer);
        cases = CohortTable.fromRows("cases", "id", List.of(
                Map.of("id", "c1", "sex", "F", "site", 3, "age", 50, "idx_date", LocalDate.of(2010, 6, 1))));
        controls = CohortTable.fromRows("controls", "id", List.of(
                Map.of("id", "k1", "sex", "F", "site", 3, "age", 52, "evt_date", LocalDate.of(2011, 1, 1)),
                Map.of("id", "k2", "sex", "M", "site", 3, "age", 52, "evt_date", LocalDate.of(2011, 1, 1)),
                Map.of("id", "k3", "sex", "F", "site", 3, "age", 70, "evt_date", LocalDate.of(2009, 1, 1))));
    }

    private static MatchingConfig.Builder config() {
        return MatchingConfig.builder().matchVars(List.of("sex", "site"));
    }

    @Test
    @DisplayName("Should reject a match variable missing from the control pool")
    void shouldRejectMissingMatchVar() {
        MatchingConfig config = config().matchVars(List.of("sex", "region")).build();

        assertThatThrownBy(() -> compiler.compile(config, cases, controls))
                .isInstanceOfSatisfying(ConfigurationException.class, e -> {
                    assertThat(e.getColumn()).isEqualTo("region");
                    assertThat(e.getTable()).isEqualTo("cases");
                })
                .hasMessageContaining("Column 'region'");
    }

    @Test
    @DisplayName("Should reject an extra variable missing from either table")
    void shouldRejectMissingExtraVar() {
        MatchingConfig config = config().extraVars(List.of("idx_date")).build();

        assertThatThrownBy(() -> compiler.compile(config, cases, controls))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("idx_date")
                .hasMessageContaining("controls");
    }

    @Test
    @DisplayName("Should reject a missing index date column for incidence density")
    void shouldRejectMissingIndexDate() {
        MatchingConfig config = config().indexDateField("diag_date").build();

        assertThatThrownBy(() -> compiler.compile(config, cases, controls))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("diag_date");
    }

    @Test
    @DisplayName("Should check the control date column against the pool")
    void shouldRejectMissingControlDate() {
        MatchingConfig config = config().indexDateField("idx_date").build();

        assertThatThrownBy(() -> compiler.compile(config, cases, controls))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("idx_date")
                .hasMessageContaining("controls");
    }

    @Test
    @DisplayName("Should ignore the index date column for exact matching")
    void shouldIgnoreIndexDateForExact() {
        MatchingConfig config = config().method(MatchMethod.EXACT).indexDateField("diag_date").build();

        EligibilityModel model = compiler.compile(config, cases, controls);

        assertThat(model.getAtRiskRule()).isEmpty();
    }

    @Test
    @DisplayName("Should reject a condition that references an unknown case column")
    void shouldRejectUnknownConditionColumn() {
        MatchingConfig config = config().extraConditions("age < case.weight").build();

        assertThatThrownBy(() -> compiler.compile(config, cases, controls))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("weight")
                .hasMessageContaining("cases");
    }

    @Test
    @DisplayName("Should propagate syntax errors from the condition")
    void shouldPropagateSyntaxErrors() {
        MatchingConfig config = config().extraConditions("age >>> 3").build();

        assertThatThrownBy(() -> compiler.compile(config, cases, controls))
                .isInstanceOf(ConditionSyntaxException.class);
    }

    @Test
    @DisplayName("Should skip column checks for an empty control pool")
    void shouldAcceptEmptyPool() {
        CohortTable empty = CohortTable.fromRows("controls", "id", List.of());
        MatchingConfig config = config().indexDateField("idx_date").extraConditions("age > 1").build();

        EligibilityModel model = compiler.compile(config, cases, empty);

        assertThat(model.getAtRiskRule()).isPresent();
        assertThat(model.getExtraCondition()).isPresent();
    }

    @Test
    @DisplayName("Should check the declared columns of a control pool without rows")
    void shouldCheckDeclaredColumnsOfEmptyPool() {
        CohortTable empty = new CohortTable("controls", "id", List.of("id", "sex"), List.of());

        assertThatThrownBy(() -> compiler.compile(config().build(), cases, empty))
                .isInstanceOfSatisfying(ConfigurationException.class, e -> {
                    assertThat(e.getTable()).isEqualTo("controls");
                    assertThat(e.getColumn()).isEqualTo("site");
                });
    }

    @Test
    @DisplayName("Compiled model should combine match key, condition and at-risk test")
    void shouldBuildWorkingPredicate() {
        MatchingConfig config = config()
                .indexDateField("idx_date")
                .controlDateField("evt_date")
                .extraConditions("abs(age - case.age) <= 5")
                .build();

        EligibilityModel model = compiler.compile(config, cases, controls);
        EligibilityPredicate predicate = model.forCase(cases.rows().get(0));

        List<String> eligible = controls.rows().stream().filter(predicate).map(SubjectRecord::id).toList();
        assertThat(eligible).containsExactly("k1");
        assertThat(predicate.indexDate()).isEqualTo(LocalDate.of(2010, 6, 1));
    }

    @Test
    @DisplayName("Should delegate condition compilation and validate the reported references")
    void shouldUseInjectedConditionCompiler(@Mock ConditionExpression condition) {
        when(conditionCompiler.compile("custom")).thenReturn(condition);
        when(condition.references()).thenReturn(Set.of(FieldReference.ofControl("missing_col")));
        EligibilityCompiler withMock = new EligibilityCompiler(conditionCompiler, tracer);

        MatchingConfig config = config().extraConditions("custom").build();

        assertThatThrownBy(() -> withMock.compile(config, cases, controls))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("missing_col");
        verify(conditionCompiler).setTracer(tracer);
    }

    @Test
    @DisplayName("Should not compile a condition when none is configured")
    void shouldSkipConditionWhenAbsent() {
        EligibilityCompiler withMock = new EligibilityCompiler(conditionCompiler, tracer);

        EligibilityModel model = withMock.compile(config().build(), cases, controls);

        assertThat(model.getExtraCondition()).isEmpty();
        verify(conditionCompiler, never()).compile(any());
    }
}
