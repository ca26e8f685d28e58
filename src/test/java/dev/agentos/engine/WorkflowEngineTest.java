package dev.agentos.engine;

import dev.agentos.audit.AuditActions;
import dev.agentos.error.ConfigException;
import dev.agentos.model.AgentDescriptor;
import dev.agentos.model.AuditEntry;
import dev.agentos.model.ErrorKind;
import dev.agentos.model.PermissionManifest;
import dev.agentos.model.PriorityTier;
import dev.agentos.model.RetryPolicy;
import dev.agentos.model.Step;
import dev.agentos.model.StepReport;
import dev.agentos.model.StepState;
import dev.agentos.model.WorkflowDefinition;
import dev.agentos.model.WorkflowResult;
import dev.agentos.model.WorkflowState;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowEngineTest {

    @TempDir
    Path root;

    private EngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture(root);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private static Step step(String id, String agent, List<String> dependsOn) {
        return Step.of(id, agent, "run", dependsOn);
    }

    private static Step step(String id, String agent, List<String> dependsOn, String guard,
                             Map<String, Object> inputs, boolean required) {
        return new Step(id, agent, "run", inputs, dependsOn, guard, id, required, RetryPolicy.none(), List.of());
    }

    @Test
    void sequentialStepsRunInSuccessiveWaves() {
        fixture.agent("code-quality-agent", task -> Map.of("score", 91))
            .agent("documentation-agent", task -> "updated");

        WorkflowResult result = fixture.engine.execute(WorkflowDefinition.of("code-quality-check", List.of(
            new Step("A", "code-quality-agent", "analyze", Map.of(), List.of(), null, "quality", true,
                RetryPolicy.none(), List.of()),
            new Step("B", "documentation-agent", "update", Map.of(), List.of("A"), null, "docs", true,
                RetryPolicy.none(), List.of()))));

        assertThat(result.state()).isEqualTo(WorkflowState.COMPLETED);
        assertThat(result.allRequiredSucceeded()).isTrue();
        assertThat(result.step("A").orElseThrow().wave()).isEqualTo(0);
        assertThat(result.step("B").orElseThrow().wave()).isEqualTo(1);
        assertThat(result.context()).containsEntry("quality", Map.of("score", 91)).containsEntry("docs", "updated");
    }

    @Test
    void stepsWithoutDependenciesRunConcurrently() {
        var barrier = new CyclicBarrier(2);
        fixture.agent("left", task -> barrier.await(5, TimeUnit.SECONDS))
            .agent("right", task -> barrier.await(5, TimeUnit.SECONDS));

        WorkflowResult result = fixture.engine.execute(WorkflowDefinition.of("parallel", List.of(
            step("l", "left", List.of()),
            step("r", "right", List.of()))));

        assertThat(result.state()).isEqualTo(WorkflowState.COMPLETED);
        assertThat(result.steps()).extracting(StepReport::wave).containsOnly(0);
    }

    @Test
    void readyStepsBeyondConcurrencyLimitRunByPriorityThenDeclarationOrder() {
        List<String> order = Collections.synchronizedList(new ArrayList<>());
        fixture.agent("low", PriorityTier.LOW, EngineFixture.READ_ALL, task -> order.add("low"))
            .agent("normal", PriorityTier.NORMAL, EngineFixture.READ_ALL, task -> order.add("normal"))
            .agent("high", PriorityTier.HIGH, EngineFixture.READ_ALL, task -> order.add("high"));

        var workflow = new WorkflowDefinition("ordered", null, null, List.of(
            step("first", "low", List.of()),
            step("second", "normal", List.of()),
            step("third", "high", List.of())), 1);
        fixture.engine.execute(workflow);

        assertThat(order).containsExactly("high", "normal", "low");
    }

    @Test
    void cyclicWorkflowIsRejectedBeforeRunning() {
        fixture.agent("agent", task -> null);
        var workflow = WorkflowDefinition.of("cyclic", List.of(
            step("a", "agent", List.of("c")),
            step("b", "agent", List.of("a")),
            step("c", "agent", List.of("b"))));
        WorkflowRun run = fixture.engine.newRun(workflow);

        assertThatThrownBy(() -> fixture.engine.execute(run))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("cycle");
        assertThat(run.stateHistory()).doesNotContain(WorkflowState.RUNNING);
        assertThat(fixture.invocations("agent")).isZero();
    }

    @Test
    void overlappingWritesInOneWaveGrantOnlyTheHigherPriorityStep() throws Exception {
        var permissions = PermissionManifest.readWrite(List.of(), List.of("report.md"));
        fixture.agent("writer-a", PriorityTier.HIGH, permissions, task -> {
                task.workspace().write("report.md", "from A");
                return "A";
            })
            .agent("writer-b", PriorityTier.NORMAL, permissions, task -> {
                task.workspace().write("report.md", "from B");
                return "B";
            });

        WorkflowResult result = fixture.engine.execute(WorkflowDefinition.of("conflict", List.of(
            step("B", "writer-b", List.of()),
            step("A", "writer-a", List.of()))));

        assertThat(result.step("A").orElseThrow().state()).isEqualTo(StepState.SUCCEEDED);
        StepReport loser = result.step("B").orElseThrow();
        assertThat(loser.state()).isEqualTo(StepState.FAILED);
        assertThat(loser.errorKind()).isEqualTo(ErrorKind.RESOURCE_CONFLICT);
        assertThat(Files.readString(root.resolve("report.md"))).isEqualTo("from A");
        assertThat(fixture.invocations("writer-b")).isZero();
    }

    @Test
    void undeclaredRuntimeWriteToLeasedPathFailsWithResourceConflict() throws Exception {
        var anyWrite = PermissionManifest.readWrite(List.of(), List.of("out/**"));
        var started = new CountDownLatch(1);
        fixture.agent("first", PriorityTier.HIGH, anyWrite, task -> {
                task.workspace().write("out/shared.txt", "first");
                started.countDown();
                return "first";
            })
            .agent("second", PriorityTier.NORMAL, anyWrite, task -> {
                started.await(5, TimeUnit.SECONDS);
                task.workspace().write("out/shared.txt", "second");
                return "second";
            });

        WorkflowResult result = fixture.engine.execute(WorkflowDefinition.of("runtime-conflict", List.of(
            step("one", "first", List.of()),
            new Step("two", "second", "run", Map.of(), List.of(), null, "two", false, RetryPolicy.none(), List.of()))));

        assertThat(result.step("one").orElseThrow().state()).isEqualTo(StepState.SUCCEEDED);
        assertThat(result.step("two").orElseThrow().errorKind()).isEqualTo(ErrorKind.RESOURCE_CONFLICT);
        assertThat(Files.readString(root.resolve("out/shared.txt"))).isEqualTo("first");
    }

    @Test
    void guardOnMissingContextKeySkipsStep() {
        fixture.agent("security-agent", task -> Map.of("issues", 0))
            .agent("deploy-agent", task -> "deployed");

        WorkflowResult result = fixture.engine.execute(WorkflowDefinition.of("guarded", List.of(
            step("scan", "security-agent", List.of()),
            step("deploy", "deploy-agent", List.of("scan"), "security_score > 80", Map.of(), true))));

        assertThat(result.state()).isEqualTo(WorkflowState.COMPLETED);
        assertThat(result.step("deploy").orElseThrow().state()).isEqualTo(StepState.SKIPPED);
        assertThat(result.context()).doesNotContainKey("deploy");
        assertThat(fixture.invocations("deploy-agent")).isZero();
    }

    @Test
    void guardSeesNestedFieldOfAncestorOutput() {
        fixture.agent("security-agent", task -> Map.of("security_score", 95))
            .agent("deploy-agent", task -> "deployed");

        WorkflowResult result = fixture.engine.execute(WorkflowDefinition.of("guarded", List.of(
            step("scan", "security-agent", List.of()),
            step("deploy", "deploy-agent", List.of("scan"), "security_score > 80 && scan.security_score >= 95",
                Map.of(), true))));

        assertThat(result.step("deploy").orElseThrow().state()).isEqualTo(StepState.SUCCEEDED);
    }

    @Test
    void timedOutStepIsRetriedThenFails() {
        var slow = AgentDescriptor.of("slow-agent", List.of("test"), PriorityTier.NORMAL, EngineFixture.READ_ALL)
            .withTimeout(Duration.ofMillis(100));
        fixture.agent(slow, task -> {
            Thread.sleep(5_000);
            return "late";
        });

        var workflow = WorkflowDefinition.of("timeouts", List.of(
            new Step("sleepy", "slow-agent", "run", Map.of(), List.of(), null, "sleepy", true,
                RetryPolicy.of(2, Duration.ofMillis(10)), List.of())));
        WorkflowResult result = fixture.engine.execute(workflow);

        StepReport report = result.step("sleepy").orElseThrow();
        assertThat(result.state()).isEqualTo(WorkflowState.FAILED);
        assertThat(report.state()).isEqualTo(StepState.FAILED);
        assertThat(report.errorKind()).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(report.attempts()).isEqualTo(3);
        assertThat(fixture.invocations("slow-agent")).isEqualTo(3);
    }

    @Test
    void transientFailureRecoversWithinRetryBudget() {
        var calls = new AtomicInteger();
        fixture.agent("flaky", task -> {
            if (calls.incrementAndGet() < 2) {
                throw new IllegalStateException("transient");
            }
            return "ok";
        });

        WorkflowResult result = fixture.engine.execute(WorkflowDefinition.of("flaky", List.of(
            new Step("f", "flaky", "run", Map.of(), List.of(), null, "f", true,
                RetryPolicy.of(3, Duration.ZERO), List.of()))));

        assertThat(result.state()).isEqualTo(WorkflowState.COMPLETED);
        assertThat(result.step("f").orElseThrow().attempts()).isEqualTo(2);
    }

    @Test
    void permissionViolationIsNeverRetried() {
        var restricted = new PermissionManifest(List.of("**"), List.of(), List.of(), List.of(".env"));
        fixture.agent("snoop", PriorityTier.NORMAL, restricted, task -> task.workspace().read(".env"));

        WorkflowResult result = fixture.engine.execute(WorkflowDefinition.of("snoop", List.of(
            new Step("s", "snoop", "run", Map.of(), List.of(), null, "s", true,
                RetryPolicy.of(3, Duration.ZERO), List.of()))));

        StepReport report = result.step("s").orElseThrow();
        assertThat(report.errorKind()).isEqualTo(ErrorKind.PERMISSION_VIOLATION);
        assertThat(report.attempts()).isEqualTo(1);
        assertThat(result.state()).isEqualTo(WorkflowState.FAILED);
    }

    @Test
    void unregisteredAgentFailsOnlyItsStep() {
        fixture.agent("real", task -> "ok");

        WorkflowResult result = fixture.engine.execute(WorkflowDefinition.of("ghosts", List.of(
            step("real-step", "real", List.of()),
            step("ghost-step", "ghost", List.of(), null, Map.of(), false))));

        assertThat(result.state()).isEqualTo(WorkflowState.COMPLETED);
        assertThat(result.step("ghost-step").orElseThrow().state()).isEqualTo(StepState.SKIPPED_WITH_WARNING);
        assertThat(result.step("ghost-step").orElseThrow().errorKind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(result.step("real-step").orElseThrow().state()).isEqualTo(StepState.SUCCEEDED);
    }

    @Test
    void requiredFailureLetsWaveFinishAndSkipsTheRest() {
        fixture.agent("broken", task -> {
                throw new IllegalStateException("boom");
            })
            .agent("slow", task -> {
                Thread.sleep(200);
                return "done";
            })
            .agent("later", task -> "never");

        WorkflowResult result = fixture.engine.execute(WorkflowDefinition.of("failing", List.of(
            step("broken-step", "broken", List.of()),
            step("slow-step", "slow", List.of()),
            step("later-step", "later", List.of("slow-step")))));

        assertThat(result.state()).isEqualTo(WorkflowState.FAILED);
        assertThat(result.reason()).contains("broken-step");
        assertThat(result.step("broken-step").orElseThrow().errorKind()).isEqualTo(ErrorKind.AGENT_INTERNAL_ERROR);
        assertThat(result.step("slow-step").orElseThrow().state()).isEqualTo(StepState.SUCCEEDED);
        assertThat(result.step("later-step").orElseThrow().state()).isEqualTo(StepState.SKIPPED);
        assertThat(fixture.invocations("later")).isZero();
    }

    @Test
    void optionalFailureLeavesOutputAbsentAndSkipsStepsThatNeedIt() {
        fixture.agent("broken", task -> {
                throw new IllegalStateException("boom");
            })
            .agent("echo", task -> task.inputs());

        WorkflowResult result = fixture.engine.execute(WorkflowDefinition.of("optional", List.of(
            step("lint", "broken", List.of(), null, Map.of(), false),
            step("independent", "echo", List.of("lint")),
            step("consumer", "echo", List.of("lint"), null, Map.of("report", "{{lint}}"), true),
            step("downstream", "echo", List.of("consumer"), null, Map.of("data", "{{consumer}}"), true),
            step("tail", "echo", List.of("consumer")))));

        assertThat(result.state()).isEqualTo(WorkflowState.COMPLETED);
        assertThat(result.step("lint").orElseThrow().state()).isEqualTo(StepState.SKIPPED_WITH_WARNING);
        assertThat(result.context()).doesNotContainKey("lint");
        assertThat(result.step("independent").orElseThrow().state()).isEqualTo(StepState.SUCCEEDED);
        assertThat(result.step("consumer").orElseThrow().state()).isEqualTo(StepState.SKIPPED);
        assertThat(result.step("downstream").orElseThrow().state()).isEqualTo(StepState.SKIPPED);
        assertThat(result.step("tail").orElseThrow().state()).isEqualTo(StepState.SUCCEEDED);
    }

    @Test
    void inputsAreBoundFromAncestorOutputs() {
        fixture.agent("analyzer", task -> Map.of("files", 4))
            .agent("echo", task -> task.inputs());

        WorkflowResult result = fixture.engine.execute(WorkflowDefinition.of("binding", List.of(
            step("analyze", "analyzer", List.of()),
            step("report", "echo", List.of("analyze"), null,
                Map.of("summary", "Scanned {{analyze.files}} files", "raw", "{{analyze}}"), true))));

        assertThat(result.context().get("report")).asInstanceOf(InstanceOfAssertFactories.MAP)
            .containsEntry("summary", "Scanned 4 files")
            .containsEntry("raw", Map.of("files", 4));
    }

    @Test
    void agentsCannotChangePublishedOutputs() {
        Map<String, Object> produced = new HashMap<>(Map.<String, Object>of("score", 1, "tags", new ArrayList<>(List.of("a"))));
        fixture.agent("producer", task -> produced)
            .agent("mutator", task -> {
                ((Map<?, ?>) task.inputs().get("data")).clear();
                return "mutated";
            })
            .agent("reader", task -> task.inputs().get("data"));

        WorkflowResult result = fixture.engine.execute(WorkflowDefinition.of("isolation", List.of(
            step("data", "producer", List.of()),
            step("mutate", "mutator", List.of("data"), null, Map.of("data", "{{data}}"), true),
            step("read", "reader", List.of("mutate"), null, Map.of("data", "{{data}}"), true))));
        produced.put("score", 999);

        assertThat(result.state()).isEqualTo(WorkflowState.COMPLETED);
        assertThat(result.step("mutate").orElseThrow().state()).isEqualTo(StepState.SUCCEEDED);
        assertThat(result.context())
            .containsEntry("data", Map.of("score", 1, "tags", List.of("a")))
            .containsEntry("read", Map.of("score", 1, "tags", List.of("a")));
    }

    @Test
    void outputsOfNonAncestorsAreInvisibleToGuards() {
        fixture.agent("base", task -> Map.of("ready", true))
            .agent("flagger", task -> Map.of("halt", true))
            .agent("worker", task -> "worked");

        WorkflowResult result = fixture.engine.execute(WorkflowDefinition.of("visibility", List.of(
            step("base-step", "base", List.of()),
            step("flag-step", "flagger", List.of()),
            step("work-step", "worker", List.of("base-step"), "ready && !halt", Map.of(), true))));

        assertThat(result.step("work-step").orElseThrow().state()).isEqualTo(StepState.SUCCEEDED);
    }

    @Test
    void cancellationFinishesInFlightStepsAndSchedulesNothingNew() throws Exception {
        var started = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        fixture.agent("long", task -> {
                started.countDown();
                release.await(5, TimeUnit.SECONDS);
                return "finished";
            })
            .agent("next", task -> "never");

        WorkflowRun run = fixture.engine.newRun(WorkflowDefinition.of("cancellable", List.of(
            step("first", "long", List.of()),
            step("second", "next", List.of("first")))));
        CompletableFuture<WorkflowResult> pending = CompletableFuture.supplyAsync(() -> fixture.engine.execute(run));

        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        run.cancel();
        release.countDown();
        WorkflowResult result = pending.get(10, TimeUnit.SECONDS);

        assertThat(result.state()).isEqualTo(WorkflowState.CANCELLED);
        assertThat(result.step("first").orElseThrow().state()).isEqualTo(StepState.SUCCEEDED);
        assertThat(result.step("second").orElseThrow().state()).isEqualTo(StepState.SKIPPED);
        assertThat(fixture.invocations("next")).isZero();
        assertThat(fixture.sandbox.activeSessionCount()).isZero();
    }

    @Test
    void interruptingTheCallerCancelsTheRunAndLetsDispatchedStepsFinish() throws Exception {
        var started = new CountDownLatch(2);
        var finished = new AtomicInteger();
        fixture.agent("slow", task -> {
                started.countDown();
                started.await(5, TimeUnit.SECONDS);
                Thread.sleep(300);
                finished.incrementAndGet();
                return "done";
            })
            .agent("next", task -> "never");

        WorkflowRun run = fixture.engine.newRun(WorkflowDefinition.of("interruptible", List.of(
            step("a", "slow", List.of()),
            step("b", "slow", List.of()),
            step("c", "next", List.of("a")))));
        var outcome = new CompletableFuture<WorkflowResult>();
        var flagRestored = new AtomicBoolean();
        var finishedOnReturn = new AtomicInteger();
        Thread caller = new Thread(() -> {
            WorkflowResult result = fixture.engine.execute(run);
            finishedOnReturn.set(finished.get());
            flagRestored.set(Thread.currentThread().isInterrupted());
            outcome.complete(result);
        });
        caller.start();

        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        caller.interrupt();
        WorkflowResult result = outcome.get(10, TimeUnit.SECONDS);

        assertThat(result.state()).isEqualTo(WorkflowState.CANCELLED);
        assertThat(result.step("a").orElseThrow().state()).isEqualTo(StepState.SUCCEEDED);
        assertThat(result.step("b").orElseThrow().state()).isEqualTo(StepState.SUCCEEDED);
        assertThat(result.step("c").orElseThrow().state()).isEqualTo(StepState.SKIPPED);
        assertThat(finishedOnReturn.get()).isEqualTo(2);
        assertThat(flagRestored.get()).isTrue();
        assertThat(fixture.audit.entries(e -> e.action().equals(AuditActions.CONTEXT_PUBLISH)))
            .extracting(AuditEntry::detail)
            .containsExactlyInAnyOrder("a -> a", "b -> b");
        assertThat(fixture.invocations("next")).isZero();
    }

    @Test
    void rerunningIdenticalWorkflowYieldsIdenticalStepStates() {
        fixture.agent("scanner", task -> Map.of("score", 50))
            .agent("echo", task -> task.inputs());
        var workflow = WorkflowDefinition.of("repeatable", List.of(
            step("scan", "scanner", List.of()),
            step("high", "echo", List.of("scan"), "scan.score > 80", Map.of(), true),
            step("low", "echo", List.of("scan"), "scan.score <= 80", Map.of(), true),
            step("after", "echo", List.of("high", "low"))));

        List<StepState> first = fixture.engine.execute(workflow).steps().stream().map(StepReport::state).toList();
        List<StepState> second = fixture.engine.execute(workflow).steps().stream().map(StepReport::state).toList();

        assertThat(first).isEqualTo(second)
            .containsExactly(StepState.SUCCEEDED, StepState.SKIPPED, StepState.SUCCEEDED, StepState.SUCCEEDED);
    }

    @Test
    void runCannotBeExecutedTwice() {
        fixture.agent("echo", task -> "ok");
        WorkflowRun run = fixture.engine.newRun(WorkflowDefinition.of("once", List.of(step("s", "echo", List.of()))));
        fixture.engine.execute(run);

        assertThatThrownBy(() -> fixture.engine.execute(run)).isInstanceOf(IllegalStateException.class);
        assertThat(run.stateHistory()).containsExactly(
            WorkflowState.PENDING, WorkflowState.PLANNING, WorkflowState.RUNNING, WorkflowState.COMPLETED);
    }
}
