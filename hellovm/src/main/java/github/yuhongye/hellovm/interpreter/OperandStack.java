package github.yuhongye.hellovm.interpreter;

import github.yuhongye.hellovm.exceptions.ErrorCode;
import github.yuhongye.hellovm.exceptions.VmException;

import java.util.ArrayDeque;
import java.util.Deque;

public class OperandStack {
    private final Deque<StackEntry> entries = new ArrayDeque<>();

    public void push(StackEntry entry) {
        entries.push(entry);
    }

    public StackEntry pop() {
        StackEntry entry = entries.poll();
        if (entry == null) {
            throw new VmException(ErrorCode.OPERAND_STACK_MISMATCH, "pop on empty operand stack");
        }
        return entry;
    }

    public StackEntry peek() {
        StackEntry entry = entries.peek();
        if (entry == null) {
            throw new VmException(ErrorCode.OPERAND_STACK_MISMATCH, "peek on empty operand stack");
        }
        return entry;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
