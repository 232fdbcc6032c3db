package github.yuhongye.hellovm.parser;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Constant_NameAndType_info 解析后的结果: 字段或方法的名字和描述符
 */
@AllArgsConstructor
@Getter
@EqualsAndHashCode
public class NameAndType {
    private final String name;
    private final String descriptor;

    @Override
    public String toString() {
        return name + ":" + descriptor;
    }
}
