package github.yuhongye.hellovm.classfile;

import lombok.Getter;

import java.util.Optional;

/**
 * 属性在ClassFile, field_info, method_info, Code_attribute中都有使用.
 * 所有结构的通用格式如下:
 * attribute_info {
 *     u2 attribute_name_index; // 必须得是Constant_Utf8_info
 *     u4 attribute_length;
 *     u1 info[attribute_length];
 * }
 * info 的结构由属性名决定, 每种认识的属性对应一个子类.
 */
@Getter
public abstract class AttributeInfo {
    private final int nameIndex;
    private final String name;

    protected AttributeInfo(int nameIndex, String name) {
        this.nameIndex = nameIndex;
        this.name = name;
    }

    /**
     * @return 预定义的属性类型, 不认识的属性返回 empty
     */
    public Optional<AttributeType> getType() {
        return AttributeType.getByName(name);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + name + ")";
    }
}
