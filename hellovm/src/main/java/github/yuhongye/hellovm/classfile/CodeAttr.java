package github.yuhongye.hellovm.classfile;

import com.google.common.collect.ImmutableList;
import lombok.Getter;

import java.util.List;
import java.util.Optional;

/**
 * Code_attribute {
 *     u2 attribute_name_index;
 *     u4 attribute_length;
 *     u2 max_stack;
 *     u2 max_locals;
 *     u4 code_length;
 *     u1 code[code_length];
 *     u2 exception_table_length;
 *     {   u2 start_pc;
 *         u2 end_pc;
 *         u2 handler_pc;
 *         u2 catch_type;
 *     } exception_table[exception_table_length];
 *     u2 attributes_count;
 *     attribute_info attributes[attributes_count];
 * }
 */
@Getter
public class CodeAttr extends AttributeInfo {
    private final int maxStack;
    private final int maxLocals;
    private final byte[] code;
    private final List<ExceptionEntry> exceptionTable;
    private final List<AttributeInfo> attributes;

    public CodeAttr(int nameIndex, String name, int maxStack, int maxLocals, byte[] code,
                    List<ExceptionEntry> exceptionTable, List<AttributeInfo> attributes) {
        super(nameIndex, name);
        this.maxStack = maxStack;
        this.maxLocals = maxLocals;
        this.code = code.clone();
        this.exceptionTable = ImmutableList.copyOf(exceptionTable);
        this.attributes = ImmutableList.copyOf(attributes);
    }

    public byte[] getCode() {
        return code.clone();
    }

    public Optional<LineNumberTableAttr> getLineNumberTable() {
        return attributes.stream()
                .filter(LineNumberTableAttr.class::isInstance)
                .map(LineNumberTableAttr.class::cast)
                .findFirst();
    }

    @Override
    public String toString() {
        return "CodeAttr(maxStack=" + maxStack + ", maxLocals=" + maxLocals + ", codeLength=" + code.length
                + ", exceptionTable=" + exceptionTable + ", attributes=" + attributes + ")";
    }
}
