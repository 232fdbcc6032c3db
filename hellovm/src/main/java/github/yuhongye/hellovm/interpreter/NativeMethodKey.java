package github.yuhongye.hellovm.interpreter;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 通过 (所属类, 方法名, 描述符) 确定一个方法, 类名使用内部形式, 如 java/io/PrintStream
 */
@AllArgsConstructor
@Getter
@EqualsAndHashCode
public class NativeMethodKey {
    private final String owner;
    private final String name;
    private final String descriptor;

    @Override
    public String toString() {
        return owner + "." + name + descriptor;
    }
}
