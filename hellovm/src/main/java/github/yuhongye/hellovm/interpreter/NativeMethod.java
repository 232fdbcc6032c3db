package github.yuhongye.hellovm.interpreter;

import java.io.PrintStream;

/**
 * 由 Java 代码实现的方法, 自己负责从操作数栈上弹出参数和接收者
 */
@FunctionalInterface
public interface NativeMethod {
    void invoke(OperandStack stack, PrintStream out);
}
