package github.yuhongye.hellovm.classfile;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@AllArgsConstructor
@Getter
@EqualsAndHashCode
@ToString
public class LineNumber {
    private final int startPc;
    private final int lineNumber;
}
