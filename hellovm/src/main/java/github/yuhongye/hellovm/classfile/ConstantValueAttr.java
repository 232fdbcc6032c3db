package github.yuhongye.hellovm.classfile;

import lombok.Getter;

/**
 * ConstantValue_attribute {
 *     u2 attribute_name_index;
 *     u4 attribute_length; // 固定是2
 *     u2 constantvalue_index;
 * }
 */
@Getter
public class ConstantValueAttr extends AttributeInfo {
    private final int constantValueIndex;

    public ConstantValueAttr(int nameIndex, String name, int constantValueIndex) {
        super(nameIndex, name);
        this.constantValueIndex = constantValueIndex;
    }
}
