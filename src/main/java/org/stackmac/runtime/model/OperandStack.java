package org.stackmac.runtime.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * The operand stack of the virtual machine: a LIFO container of integers.
 * Depth is bounded only by available memory.
 */
public class OperandStack {

    private final Deque<Integer> values = new ArrayDeque<>();

    /**
     * Pushes a value onto the stack.
     * @param value The value to push.
     */
    public void push(int value) {
        values.push(value);
    }

    /**
     * Removes and returns the top value.
     * @return The top value.
     * @throws StackUnderflowException if the stack is empty.
     */
    public int pop() {
        if (values.isEmpty()) {
            throw new StackUnderflowException("Stack underflow: cannot pop from empty stack");
        }
        return values.pop();
    }

    /**
     * Returns the top value without removing it.
     * @return The top value.
     * @throws StackUnderflowException if the stack is empty.
     */
    public int peek() {
        if (values.isEmpty()) {
            throw new StackUnderflowException("Stack underflow: cannot peek into empty stack");
        }
        return values.peek();
    }

    /**
     * Fails unless at least {@code depth} values are on the stack. Instructions that consume
     * several values call this first so that an underflow leaves the stack untouched.
     *
     * @param depth The number of values the caller is about to consume.
     * @param opcode The instruction name, used in the error message.
     * @throws StackUnderflowException if fewer values are present.
     */
    public void requireDepth(int depth, String opcode) {
        if (values.size() < depth) {
            throw new StackUnderflowException(String.format(
                    "Stack underflow: %s requires %d item(s), stack holds %d", opcode, depth, values.size()));
        }
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public void clear() {
        values.clear();
    }

    /**
     * Returns the top {@code limit} values, ordered bottom to top (the top of the stack is last).
     * @param limit The maximum number of values to return.
     * @return An immutable snapshot.
     */
    public List<Integer> snapshotTop(int limit) {
        List<Integer> top = new ArrayList<>(Math.min(limit, values.size()));
        Iterator<Integer> it = values.iterator();
        while (it.hasNext() && top.size() < limit) {
            top.add(it.next());
        }
        Collections.reverse(top);
        return Collections.unmodifiableList(top);
    }

    /**
     * Returns all values, ordered bottom to top.
     * @return An immutable snapshot.
     */
    public List<Integer> toList() {
        return snapshotTop(values.size());
    }

    @Override
    public String toString() {
        return "Stack" + toList();
    }
}
