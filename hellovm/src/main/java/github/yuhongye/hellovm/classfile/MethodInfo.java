package github.yuhongye.hellovm.classfile;

import com.google.common.collect.ImmutableList;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 所有方法(包括实例初始化方法)都有method_info结构定义:
 * method_info {
 *     u2 access_flags;
 *     u2 name_index;
 *     u2 descriptor_index;
 *     u2 attributes_count;
 *     attribute_info attributes[attributes_count];
 * }
 */
@Getter
@ToString
public class MethodInfo {
    private final Set<MethodAcc> accessFlags;
    private final int nameIndex;
    private final String name;
    private final int descriptorIndex;
    private final String descriptor;
    private final List<AttributeInfo> attributes;

    public MethodInfo(Set<MethodAcc> accessFlags, int nameIndex, String name,
                      int descriptorIndex, String descriptor, List<AttributeInfo> attributes) {
        this.accessFlags = accessFlags;
        this.nameIndex = nameIndex;
        this.name = name;
        this.descriptorIndex = descriptorIndex;
        this.descriptor = descriptor;
        this.attributes = ImmutableList.copyOf(attributes);
    }

    /**
     * abstract 和 native 方法没有 Code 属性
     */
    public Optional<CodeAttr> getCode() {
        return attributes.stream()
                .filter(CodeAttr.class::isInstance)
                .map(CodeAttr.class::cast)
                .findFirst();
    }

    public boolean is(MethodAcc flag) {
        return accessFlags.contains(flag);
    }
}
