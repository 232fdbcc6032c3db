package github.yuhongye.hellovm.interpreter;

import github.yuhongye.hellovm.exceptions.ErrorCode;
import github.yuhongye.hellovm.exceptions.VmException;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class OperandStackTest {
    @Test
    public void testLifo() {
        OperandStack stack = new OperandStack();
        stack.push(StackEntry.instance("Ljava/io/PrintStream;"));
        stack.push(StackEntry.ofInt(1));
        stack.push(StackEntry.ofFloat(2.5f));
        stack.push(StackEntry.ofString("s"));
        assertEquals(4, stack.size());
        assertEquals("s", stack.peek().asString());
        assertEquals("s", stack.pop().asString());
        assertEquals(2.5f, stack.pop().asFloat(), 0f);
        assertEquals(1, stack.pop().asInt());
        assertEquals("Ljava/io/PrintStream;", stack.pop().instanceType());
        assertTrue(stack.isEmpty());
    }

    @Test
    public void testEmptyAndWrongKind() {
        OperandStack stack = new OperandStack();
        try {
            stack.pop();
            fail();
        } catch (VmException e) {
            assertEquals(ErrorCode.OPERAND_STACK_MISMATCH, e.getCode());
        }

        stack.push(StackEntry.ofInt(3));
        try {
            stack.pop().asString();
            fail();
        } catch (VmException e) {
            assertEquals(ErrorCode.OPERAND_STACK_MISMATCH, e.getCode());
        }
    }
}
