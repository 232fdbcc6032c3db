package github.yuhongye.hellovm.interpreter;

import github.yuhongye.hellovm.exceptions.ErrorCode;
import github.yuhongye.hellovm.exceptions.VmException;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 操作数栈上的值. 没有堆, getstatic 读出来的对象只是一个记录了类型的标记
 */
@AllArgsConstructor
@Getter
@EqualsAndHashCode
public class StackEntry {
    public enum Kind {
        CLASS_INSTANCE, INT, FLOAT, STRING
    }

    private final Kind kind;

    /**
     * CLASS_INSTANCE: 类型描述符, INT: Integer, FLOAT: Float, STRING: String
     */
    private final Object val;

    public static StackEntry instance(String typeDescriptor) {
        return new StackEntry(Kind.CLASS_INSTANCE, typeDescriptor);
    }

    public static StackEntry ofInt(int v) {
        return new StackEntry(Kind.INT, v);
    }

    public static StackEntry ofFloat(float v) {
        return new StackEntry(Kind.FLOAT, v);
    }

    public static StackEntry ofString(String v) {
        return new StackEntry(Kind.STRING, v);
    }

    public String asString() {
        check(Kind.STRING);
        return (String) val;
    }

    public int asInt() {
        check(Kind.INT);
        return ((Integer) val).intValue();
    }

    public float asFloat() {
        check(Kind.FLOAT);
        return ((Float) val).floatValue();
    }

    public String instanceType() {
        check(Kind.CLASS_INSTANCE);
        return (String) val;
    }

    private void check(Kind expected) {
        if (kind != expected) {
            throw VmException.of(ErrorCode.OPERAND_STACK_MISMATCH, "expected %s but found %s", expected, this);
        }
    }

    @Override
    public String toString() {
        return kind + "(" + val + ")";
    }
}
