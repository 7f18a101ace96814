package federa.coordinator.driver;

import federa.common.model.Node;
import federa.common.model.TaskIns;
import federa.common.model.TaskRes;
import federa.coordinator.queue.DriverQueue;
import federa.coordinator.queue.UnknownNodeException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory driver queue for proxy tests. Every push is answered with a fixed id;
 * each pull returns the next scripted batch, or nothing once the script is used up.
 */
class ScriptedDriverQueue implements DriverQueue {

    static final String TASK_ID = "19341fd7-62e1-4eb4-beb4-9876d3acda32";

    final List<TaskIns> pushed = new ArrayList<>();
    final AtomicInteger pulls = new AtomicInteger();
    private final Deque<List<TaskRes>> script = new ArrayDeque<>();
    private final Set<Long> knownNodes;
    private String assignedId = TASK_ID;

    ScriptedDriverQueue(Set<Long> knownNodes) {
        this.knownNodes = knownNodes;
    }

    ScriptedDriverQueue thenReturn(TaskRes... results) {
        script.add(List.of(results));
        return this;
    }

    ScriptedDriverQueue assigning(String id) {
        this.assignedId = id;
        return this;
    }

    @Override
    public long createRun() {
        return 0;
    }

    @Override
    public List<Node> getNodes(long runId) {
        return knownNodes.stream().map(id -> new Node(id, false)).toList();
    }

    @Override
    public synchronized String pushTaskIns(TaskIns taskIns) {
        if (!knownNodes.contains(taskIns.nodeId())) {
            throw new UnknownNodeException(taskIns.nodeId());
        }
        pushed.add(taskIns);
        return assignedId;
    }

    @Override
    public synchronized List<TaskRes> pullTaskRes(Set<String> taskInsIds) {
        pulls.incrementAndGet();
        List<TaskRes> next = script.poll();
        return next == null ? List.of() : next;
    }
}
