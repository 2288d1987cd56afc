package com.delphine.script.interp;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.delphine.debug.Debug;

/**
 * Named frames of the script call chain, used for diagnostics, exception
 * snapshots and the recursion limit. Every push is paired with a pop in a
 * finally block by the caller.
 */
public final class CallStack {

    private static final String TAG = "Interpreter";

    private final Deque<CallFrame> frames = new ArrayDeque<>();
    private final int maxDepth;

    CallStack(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int depth() {
        return frames.size();
    }

    /** True when one more frame would exceed the limit. */
    boolean isFull() {
        return frames.size() >= maxDepth;
    }

    void push(CallFrame frame) {
        frames.push(frame);
        if (Debug.get().isSilent()) return;
        Debug.get().t(TAG, "enter " + frame.functionName + " (depth " + frames.size() + ")");
    }

    void pop() {
        CallFrame f = frames.pop();
        if (!Debug.get().isSilent()) Debug.get().t(TAG, "leave " + f.functionName);
    }

    CallFrame current() {
        return frames.peek();
    }

    /** Innermost frame first. */
    public List<String> snapshot() {
        List<String> out = new ArrayList<>(frames.size());
        for (CallFrame f : frames) out.add(f.toString());
        return out;
    }
}
