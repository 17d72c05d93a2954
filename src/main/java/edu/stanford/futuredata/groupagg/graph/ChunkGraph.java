package edu.stanford.futuredata.groupagg.graph;

import java.util.*;

/**
 * Chunks reachable from a set of result chunks, in an order where inputs precede their consumers.
 */
public class ChunkGraph {
    private final List<Chunk> nodes;
    private final List<Chunk> resultChunks;
    private final Tileable output;

    public ChunkGraph(List<Chunk> resultChunks, Tileable output) {
        this.resultChunks = Collections.unmodifiableList(new ArrayList<>(resultChunks));
        this.output = output;
        List<Chunk> order = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (Chunk c: resultChunks) {
            visit(c, visited, order);
        }
        this.nodes = Collections.unmodifiableList(order);
    }

    private static void visit(Chunk chunk, Set<String> visited, List<Chunk> order) {
        Deque<Chunk> stack = new ArrayDeque<>();
        Deque<Iterator<Chunk>> pending = new ArrayDeque<>();
        if (!visited.add(chunk.getKey())) {
            return;
        }
        stack.push(chunk);
        pending.push(chunk.getInputs().iterator());
        while (!stack.isEmpty()) {
            Iterator<Chunk> it = pending.peek();
            if (it.hasNext()) {
                Chunk next = it.next();
                if (visited.add(next.getKey())) {
                    stack.push(next);
                    pending.push(next.getInputs().iterator());
                }
            } else {
                pending.pop();
                order.add(stack.pop());
            }
        }
    }

    public List<Chunk> getNodes() {
        return nodes;
    }

    public List<Chunk> getResultChunks() {
        return resultChunks;
    }

    // Tileable realized by the result chunks; null for a probe graph.
    public Tileable getOutput() {
        return output;
    }

    public int size() {
        return nodes.size();
    }

    public List<Chunk> chunksOfStage(OperandStage stage) {
        List<Chunk> found = new ArrayList<>();
        for (Chunk c: nodes) {
            if (c.getStage() == stage) {
                found.add(c);
            }
        }
        return found;
    }

    public List<Chunk> chunksOfOperand(Class<?> opClass) {
        List<Chunk> found = new ArrayList<>();
        for (Chunk c: nodes) {
            if (opClass.isInstance(c.getOp())) {
                found.add(c);
            }
        }
        return found;
    }

    // Operand class and stage of every node in order; equal for isomorphic plans.
    public List<String> shapeSignature() {
        List<String> sig = new ArrayList<>();
        for (Chunk c: nodes) {
            sig.add(c.getOp().getClass().getSimpleName() + (c.getStage() == null ? "" : ":" + c.getStage())
                    + "<" + c.getInputs().size());
        }
        return sig;
    }
}
