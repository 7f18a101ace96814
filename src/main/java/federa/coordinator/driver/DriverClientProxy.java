package federa.coordinator.driver;

import federa.common.FederaException;
import federa.common.codec.TaskCodec;
import federa.common.message.Content;
import federa.common.model.EvaluateIns;
import federa.common.model.EvaluateRes;
import federa.common.model.FitIns;
import federa.common.model.FitRes;
import federa.common.model.GetParametersIns;
import federa.common.model.GetParametersRes;
import federa.common.model.GetPropertiesIns;
import federa.common.model.GetPropertiesRes;
import federa.common.model.TaskIns;
import federa.common.model.TaskRes;
import federa.common.model.TaskType;
import federa.coordinator.queue.DriverQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * {@link ClientProxy} backed by push-and-poll on a {@link DriverQueue}.
 *
 * <p>
 * Each call pushes exactly one instruction, then pulls at a fixed interval until a
 * result answering that instruction shows up. Results for other instructions are
 * ignored. Holds no state across calls besides the node and run it is bound to, so
 * one proxy can serve any number of sequential calls.
 */
public final class DriverClientProxy implements ClientProxy {

    private static final Logger log = LoggerFactory.getLogger(DriverClientProxy.class);

    static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(200);

    private final long nodeId;
    private final boolean anonymous;
    private final long runId;
    private final String groupId;
    private final DriverQueue driver;
    private final Duration pollInterval;

    public DriverClientProxy(long nodeId, boolean anonymous, long runId, DriverQueue driver) {
        this(nodeId, anonymous, runId, "", driver, DEFAULT_POLL_INTERVAL);
    }

    public DriverClientProxy(long nodeId, boolean anonymous, long runId, String groupId, DriverQueue driver,
            Duration pollInterval) {
        this.nodeId = nodeId;
        this.anonymous = anonymous;
        this.runId = runId;
        this.groupId = Objects.requireNonNull(groupId, "groupId is required");
        this.driver = Objects.requireNonNull(driver, "driver is required");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval is required");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
    }

    @Override
    public long nodeId() {
        return nodeId;
    }

    public boolean anonymous() {
        return anonymous;
    }

    public long runId() {
        return runId;
    }

    @Override
    public GetPropertiesRes getProperties(GetPropertiesIns ins, Duration timeout) {
        Content content = call(TaskType.GET_PROPERTIES, TaskCodec.encode(ins), timeout);
        return TaskCodec.decodeGetPropertiesRes(content);
    }

    @Override
    public GetParametersRes getParameters(GetParametersIns ins, Duration timeout) {
        Content content = call(TaskType.GET_PARAMETERS, TaskCodec.encode(ins), timeout);
        return TaskCodec.decodeGetParametersRes(content);
    }

    @Override
    public FitRes fit(FitIns ins, Duration timeout) {
        Content content = call(TaskType.FIT, TaskCodec.encode(ins), timeout);
        return TaskCodec.decodeFitRes(content);
    }

    @Override
    public EvaluateRes evaluate(EvaluateIns ins, Duration timeout) {
        Content content = call(TaskType.EVALUATE, TaskCodec.encode(ins), timeout);
        return TaskCodec.decodeEvaluateRes(content);
    }

    private Content call(TaskType type, Content content, Duration timeout) {
        TaskIns taskIns = TaskIns.builder()
                .groupId(groupId)
                .runId(runId)
                .nodeId(nodeId)
                .taskType(type)
                .content(content)
                .createdAt(Instant.now())
                .build();

        String taskId = driver.pushTaskIns(taskIns);
        if (taskId == null || taskId.isEmpty()) {
            throw new FederaException("Queue accepted " + type.tag() + " for node " + nodeId + " without a task id");
        }
        log.debug("Pushed {} task {} to node {}", type.tag(), taskId, nodeId);

        return awaitResult(taskId, timeout).content();
    }

    private TaskRes awaitResult(String taskId, Duration timeout) {
        long start = System.nanoTime();
        long timeoutNanos = timeout == null ? Long.MAX_VALUE : saturatedNanos(timeout);
        Set<String> taskIds = Set.of(taskId);

        while (true) {
            for (TaskRes taskRes : driver.pullTaskRes(taskIds)) {
                if (taskRes.answers(taskId, runId)) {
                    return taskRes;
                }
                log.debug("Node {} ignoring result {} (expected answer to {} in run {})",
                        nodeId, taskRes.taskId(), taskId, runId);
            }

            long sleepNanos = pollInterval.toNanos();
            if (timeout != null) {
                long remaining = timeoutNanos - (System.nanoTime() - start);
                if (remaining <= 0) {
                    throw new RemoteCallTimeoutException(nodeId, taskId, timeout);
                }
                sleepNanos = Math.min(sleepNanos, remaining);
            }
            pause(sleepNanos, taskId);
        }
    }

    /** Durations beyond the nanosecond range count as unbounded. */
    private static long saturatedNanos(Duration timeout) {
        try {
            return timeout.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private void pause(long nanos, String taskId) {
        try {
            TimeUnit.NANOSECONDS.sleep(nanos);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FederaException("Interrupted while waiting for task " + taskId + " on node " + nodeId, e);
        }
    }

    @Override
    public String toString() {
        return "DriverClientProxy{nodeId=" + nodeId + ", runId=" + runId + ", anonymous=" + anonymous + "}";
    }
}
