package github.yuhongye.hellovm.classfile;

import lombok.Getter;

/**
 * SourceFile_attribute {
 *     u2 attribute_name_index;
 *     u4 attribute_length; // 固定是2
 *     u2 sourcefile_index;
 * }
 * 解析时就把 sourcefile_index 解析成文件名.
 */
@Getter
public class SourceFileAttr extends AttributeInfo {
    private final int sourceFileIndex;
    private final String sourceFile;

    public SourceFileAttr(int nameIndex, String name, int sourceFileIndex, String sourceFile) {
        super(nameIndex, name);
        this.sourceFileIndex = sourceFileIndex;
        this.sourceFile = sourceFile;
    }

    @Override
    public String toString() {
        return "SourceFileAttr(" + sourceFile + ")";
    }
}
