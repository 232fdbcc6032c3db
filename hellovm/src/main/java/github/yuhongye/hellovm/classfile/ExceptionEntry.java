package github.yuhongye.hellovm.classfile;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Code 属性中异常表的一行, [startPc, endPc) 范围内抛出 catchType 时跳转到 handlerPc.
 * catchType 为 0 表示 finally
 */
@AllArgsConstructor
@Getter
@EqualsAndHashCode
@ToString
public class ExceptionEntry {
    private final int startPc;
    private final int endPc;
    private final int handlerPc;
    private final int catchType;
}
