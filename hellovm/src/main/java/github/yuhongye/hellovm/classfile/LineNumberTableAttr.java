package github.yuhongye.hellovm.classfile;

import com.google.common.collect.ImmutableList;
import lombok.Getter;

import java.util.List;

/**
 * LineNumberTable_attribute {
 *     u2 attribute_name_index;
 *     u4 attribute_length;
 *     u2 line_number_table_length;
 *     {   u2 start_pc;
 *         u2 line_number;
 *     } line_number_table[line_number_table_length];
 * }
 */
@Getter
public class LineNumberTableAttr extends AttributeInfo {
    private final List<LineNumber> lineNumbers;

    public LineNumberTableAttr(int nameIndex, String name, List<LineNumber> lineNumbers) {
        super(nameIndex, name);
        this.lineNumbers = ImmutableList.copyOf(lineNumbers);
    }
}
