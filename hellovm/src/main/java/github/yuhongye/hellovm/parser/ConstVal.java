package github.yuhongye.hellovm.parser;

import github.yuhongye.hellovm.exceptions.ErrorCode;
import github.yuhongye.hellovm.exceptions.VmException;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 常量池中的一项.
 * 通过 tag 来标明是什么类型, val 的实际类型由 tag 决定:
 * <ul>
 *     <li>Utf8: String</li>
 *     <li>Integer, Float, Long, Double: 对应的包装类型</li>
 *     <li>Class, String: Integer, 指向 Utf8 的下标</li>
 *     <li>Fieldref, Methodref, InterfaceMethodref: {@link RefInfo}</li>
 *     <li>NameAndType: {@link NameAndTypeInfo}</li>
 *     <li>MethodHandle: {@link MethodHandleInfo}</li>
 *     <li>MethodType: {@link MethodTypeInfo}</li>
 *     <li>InvokeDynamic: {@link DynamicInfo}</li>
 * </ul>
 */
@AllArgsConstructor
@Getter
@EqualsAndHashCode
public class ConstVal {
    private final ConstantTag tag;
    private final Object val;

    public int asInt() {
        checkTag(ConstantTag.CONSTANT_INTEGER_INFO);
        return ((Integer) val).intValue();
    }

    public long asLong() {
        checkTag(ConstantTag.CONSTANT_LONG_INFO);
        return ((Long) val).longValue();
    }

    public float asFloat() {
        checkTag(ConstantTag.CONSTANT_FLOAT_INFO);
        return ((Float) val).floatValue();
    }

    public double asDouble() {
        checkTag(ConstantTag.CONSTANT_DOUBLE_INFO);
        return ((Double) val).doubleValue();
    }

    public String asUtf8() {
        checkTag(ConstantTag.CONSTANT_UTF8_INFO);
        return (String) val;
    }

    /**
     * @return Constant_Class_info 的 name_index
     */
    public int asClassNameIndex() {
        checkTag(ConstantTag.CONSTANT_CLASS_INFO);
        return ((Integer) val).intValue();
    }

    /**
     * @return Constant_String_info 的 string_index
     */
    public int asStringIndex() {
        checkTag(ConstantTag.CONSTANT_STRING_INFO);
        return ((Integer) val).intValue();
    }

    public NameAndTypeInfo asNameAndType() {
        checkTag(ConstantTag.CONSTANT_NAMEANDTYPE_INFO);
        return (NameAndTypeInfo) val;
    }

    public RefInfo asRef(ConstantTag expected) {
        checkTag(expected);
        return (RefInfo) val;
    }

    public boolean is(ConstantTag expected) {
        return tag == expected;
    }

    private void checkTag(ConstantTag expected) {
        if (tag != expected) {
            throw VmException.of(ErrorCode.CONSTANT_POOL_TYPE_MISMATCH, "expected %s but found %s", expected, tag);
        }
    }

    @Override
    public String toString() {
        switch (tag) {
            case CONSTANT_LONG_INFO: return val.toString() + "L";
            case CONSTANT_FLOAT_INFO: return val.toString() + "F";
            case CONSTANT_DOUBLE_INFO: return val.toString() + "D";
            case CONSTANT_STRING_INFO: return "#" + val.toString();
            case CONSTANT_CLASS_INFO: return "#" + val.toString();
            default:
                return val.toString();
        }
    }

    @AllArgsConstructor
    @EqualsAndHashCode
    public static class NameAndTypeInfo {
        // 字段或者方法名称在常量池的下标
        private final int nameIndex;

        // 字段或方法的描述在常量池的下标
        private final int descriptorIndex;

        public int getNameIndex() {
            return nameIndex;
        }

        public int getDescriptorIndex() {
            return descriptorIndex;
        }

        @Override
        public String toString() {
            return "#" + nameIndex + ":#" + descriptorIndex;
        }
    }

    /**
     * FieldRef_Info, MethodRef_Info, InterfaceMethodRef_info
     */
    @AllArgsConstructor
    @EqualsAndHashCode
    public static class RefInfo {
        // 所属的类信息在常量池中的下标
        private final int classIndex;

        /** 指向一个 {@link NameAndTypeInfo} 的下标 表示方法名、参数和返回值类型 */
        private final int nameAndTypeIndex;

        public int getClassIndex() {
            return classIndex;
        }

        public int getNameAndTypeIndex() {
            return nameAndTypeIndex;
        }

        @Override
        public String toString() {
            return "#" + classIndex + ".#" + nameAndTypeIndex;
        }
    }

    /**
     * Java 7 开始，为了更好的支持动态语言调用，新增了3种常量类型:
     *  - CONSTANT_MethodType_info
     *  - CONSTANT_MethodHandle_info
     *  - CONSTANT_InvokeDynamic_info
     * 解释器不执行它们, 只需要正确跳过对应的字节
     */
    @AllArgsConstructor
    @Getter
    @EqualsAndHashCode
    public static class MethodHandleInfo {
        /**
         * 方法句柄的类型，值范围必须是1-9
         */
        private final int referenceKind;

        private final int referenceIndex;

        @Override
        public String toString() {
            return referenceKind + ":#" + referenceIndex;
        }
    }

    @AllArgsConstructor
    @Getter
    @EqualsAndHashCode
    public static class DynamicInfo {
        /**
         * 指向引导方法表 bootstrap_methods[] 数组的索引
         */
        private final int bootstrapMethodAttrIndex;

        private final int nameAndTypeIndex;

        @Override
        public String toString() {
            return "#" + bootstrapMethodAttrIndex + ":#" + nameAndTypeIndex;
        }
    }

    @AllArgsConstructor
    @Getter
    @EqualsAndHashCode
    public static class MethodTypeInfo {
        /**
         * 必须对应常量池的Constant_Utf8_info
         */
        private final int descriptorIndex;

        @Override
        public String toString() {
            return "#" + descriptorIndex;
        }
    }
}
