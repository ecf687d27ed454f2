package com.optmodeler.core.session;

import com.optmodeler.core.container.Model;
import com.optmodeler.core.entity.Variable;
import com.optmodeler.core.generator.GeneratorConfig;
import com.optmodeler.core.generator.impl.OptmodelGenerator;
import com.optmodeler.core.model.ObjectiveSense;
import com.optmodeler.core.model.VariableType;
import com.optmodeler.core.statement.Relation;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ModelSubmitter} and the default timeout handling of {@link SolverSession}.
 */
class ModelSubmitterTest {

    @Test
    void submit_rendersSubmitsAndIngests() {
        Model model = new Model("basic");
        Variable x = model.addVariable("x", VariableType.CONTINUOUS, 0.0, null);
        model.addConstraint("c1", Relation.le(x, 10));
        model.setObjective("obj", x, ObjectiveSense.MAXIMIZE);

        List<String> submitted = new ArrayList<>();
        SolverSession session = code -> {
            submitted.add(code);
            Map<String, Number> values = new LinkedHashMap<>();
            values.put("x", 10);
            values.put("c1", 1);
            return ResponseTable.ofValues(values, "OPTIMAL");
        };

        SubmissionResult result = new ModelSubmitter(session, new OptmodelGenerator(), GeneratorConfig.defaults())
            .submit(model);

        assertThat(submitted).containsExactly(result.program().content());
        assertThat(result.program().content()).contains("con c1 : x <= 10;");
        assertThat(result.response().status()).isEqualTo("OPTIMAL");
        assertThat(result.report().isComplete()).isTrue();
        assertThat(x.getValue()).isEqualTo(10.0);
        assertThat(model.isSealed()).isTrue();
    }

    @Test
    void submit_sessionFailure_propagatesUnchanged() {
        Model model = new Model("failing");
        model.addVariable("x");
        SolverSession session = code -> {
            throw new SolverSessionException("ERROR: solver unavailable");
        };

        ModelSubmitter submitter = new ModelSubmitter(session, new OptmodelGenerator(), null);

        assertThatThrownBy(() -> submitter.submit(model))
            .isInstanceOf(SolverSessionException.class)
            .hasMessageContaining("unavailable");
    }

    @Test
    void submit_nullResponse_throwsSessionException() {
        Model model = new Model("empty");
        model.addVariable("x");

        ModelSubmitter submitter = new ModelSubmitter(code -> null, new OptmodelGenerator(), null);

        assertThatThrownBy(() -> submitter.submit(model)).isInstanceOf(SolverSessionException.class);
    }

    @Test
    void submitAndWait_slowSolver_throwsTimeout() {
        CountDownLatch release = new CountDownLatch(1);
        SolverSession session = code -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ResponseTable.ofValues(Map.of(), "OPTIMAL");
        };

        try {
            assertThatThrownBy(() -> session.submitAndWait("solve;", Duration.ofMillis(50)))
                .isInstanceOf(SolverTimeoutException.class)
                .satisfies(e -> assertThat(((SolverTimeoutException) e).getTimeout()).isEqualTo(Duration.ofMillis(50)));
        } finally {
            release.countDown();
        }
    }

    @Test
    void submitAndWait_fastSolver_returnsResponse() {
        SolverSession session = code -> ResponseTable.ofValues(Map.of("x", 1), "OPTIMAL");

        assertThat(session.submitAndWait("solve;", Duration.ofSeconds(5)).status()).isEqualTo("OPTIMAL");
    }

    @Test
    void submit_withTimeout_usesSessionTimeout() {
        Model model = new Model("timed");
        Variable x = model.addVariable("x");
        SolverSession session = code -> ResponseTable.ofValues(Map.of("x", 2), "OPTIMAL");

        SubmissionResult result = new ModelSubmitter(session, new OptmodelGenerator(), null)
            .submit(model, Duration.ofSeconds(5));

        assertThat(result.report().applied()).hasSize(1);
        assertThat(x.getValue()).isEqualTo(2.0);
    }
}
