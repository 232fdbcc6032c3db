package github.yuhongye.hellovm.interpreter;

import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * invokevirtual 能调用的方法表. 新增方法只需要 {@link #register}, 不用修改解释器.
 */
@Slf4j
public class NativeMethods {
    public static final NativeMethodKey PRINTLN_STRING =
            new NativeMethodKey("java/io/PrintStream", "println", "(Ljava/lang/String;)V");

    private final Map<NativeMethodKey, NativeMethod> methods = new HashMap<>();

    /**
     * @return 只包含 PrintStream.println(String) 的方法表
     */
    public static NativeMethods defaults() {
        NativeMethods natives = new NativeMethods();
        natives.register(PRINTLN_STRING, (stack, out) -> {
            String s = stack.pop().asString();
            // 接收者, 只有 System.out 一个
            stack.pop().instanceType();
            out.println(s);
        });
        return natives;
    }

    public NativeMethods register(NativeMethodKey key, NativeMethod method) {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkNotNull(method, "method");
        if (methods.put(key, method) != null) {
            log.warn("Native method {} is replaced", key);
        }
        return this;
    }

    public Optional<NativeMethod> lookup(NativeMethodKey key) {
        return Optional.ofNullable(methods.get(key));
    }
}
