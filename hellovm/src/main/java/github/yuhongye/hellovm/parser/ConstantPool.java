package github.yuhongye.hellovm.parser;

import com.google.common.base.Preconditions;
import github.yuhongye.hellovm.exceptions.ErrorCode;
import github.yuhongye.hellovm.exceptions.VmException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static github.yuhongye.hellovm.parser.ConstantTag.CONSTANT_FIELDREF_INFO;
import static github.yuhongye.hellovm.parser.ConstantTag.CONSTANT_METHODREF_INFO;

/**
 * 常量池, 提供按索引访问的能力: 从下标1开始, 0闲置不用.
 *
 * 内部存储仍然从0开始, 只在 {@link #get(int)} 处减一, 这样和 class 文件中的下标保持一致.
 * long 和 double 占两个位置, 第二个位置不能被访问.
 * 创建之后不再修改.
 */
public class ConstantPool {
    /**
     * slots[i] 对应 class 文件中的 #(i + 1), long/double 之后的位置为 null
     */
    private final List<ConstVal> slots;

    public ConstantPool(List<ConstVal> slots) {
        this.slots = Collections.unmodifiableList(new ArrayList<>(slots));
    }

    /**
     * 按照 class 文件中的顺序构建常量池, 会为 long/double 补上不可用的位置
     */
    public static ConstantPool of(ConstVal... vals) {
        List<ConstVal> slots = new ArrayList<>();
        for (ConstVal val : vals) {
            Preconditions.checkNotNull(val, "constant");
            slots.add(val);
            for (int i = 1; i < val.getTag().getSlotSize(); i++) {
                slots.add(null);
            }
        }
        return new ConstantPool(slots);
    }

    /**
     * @return 占用的位置数, 等于 constant_pool_count - 1
     */
    public int size() {
        return slots.size();
    }

    /**
     * @param index 从1开始
     * @return 常量池的第 index 个常量
     */
    public ConstVal get(int index) {
        if (index < 1 || index > slots.size()) {
            throw VmException.of(ErrorCode.CONSTANT_POOL_INDEX_OUT_OF_RANGE, "#%d, pool size is %d", index, slots.size());
        }
        ConstVal val = slots.get(index - 1);
        if (val == null) {
            throw VmException.of(ErrorCode.CONSTANT_POOL_INDEX_OUT_OF_RANGE,
                    "#%d is the second slot of a long or double constant", index);
        }
        return val;
    }

    public String resolveUtf8(int index) {
        return get(index).asUtf8();
    }

    /**
     * Constant_Class_info -> name_index -> Constant_Utf8_info
     */
    public String resolveClassName(int index) {
        return resolveUtf8(get(index).asClassNameIndex());
    }

    /**
     * Constant_String_info -> string_index -> Constant_Utf8_info
     */
    public String resolveString(int index) {
        return resolveUtf8(get(index).asStringIndex());
    }

    public NameAndType resolveNameAndType(int index) {
        ConstVal.NameAndTypeInfo info = get(index).asNameAndType();
        return new NameAndType(resolveUtf8(info.getNameIndex()), resolveUtf8(info.getDescriptorIndex()));
    }

    public ConstVal.RefInfo getFieldref(int index) {
        return get(index).asRef(CONSTANT_FIELDREF_INFO);
    }

    public ConstVal.RefInfo getMethodref(int index) {
        return get(index).asRef(CONSTANT_METHODREF_INFO);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Constant pool: \n");
        for (int i = 1; i <= slots.size(); i++) {
            ConstVal value = slots.get(i - 1);
            if (value != null) {
                const2String(value, i, sb);
            }
        }
        return sb.toString();
    }

    private void const2String(ConstVal value, int index, StringBuilder sb) {
        sb.append("#").append(index)
                .append(" = ")
                .append(value.getTag())
                .append("\t").append(value)
                .append("\n");
    }
}
