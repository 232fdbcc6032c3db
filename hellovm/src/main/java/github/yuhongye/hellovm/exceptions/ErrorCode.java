package github.yuhongye.hellovm.exceptions;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 加载和执行 class 文件时可能出现的错误, 全部都是致命错误.
 * 无法识别的属性不算错误, 解析器会把它保存为原始字节并继续.
 */
@AllArgsConstructor
@Getter
public enum ErrorCode {
    IO_ERROR(                        1, "IO error: "),
    MALFORMED_CONSTANT_POOL_TAG(     2, "Unexpected constant pool type: "),
    CONSTANT_POOL_INDEX_OUT_OF_RANGE(3, "Illegal constant pool index: "),
    CONSTANT_POOL_TYPE_MISMATCH(     4, "Constant pool type mismatch: "),
    ATTRIBUTE_LENGTH_MISMATCH(       5, "Attribute length mismatch: "),
    UNSUPPORTED_FEATURE(             6, "Not supported: "),
    UNIMPLEMENTED_OPCODE(            7, "Instruction not implemented: "),
    MISSING_ENTRY_POINT(             8, "Missing entry point: "),
    OPERAND_STACK_MISMATCH(          9, "Operand stack mismatch: "),
    INVALID_CLASS_FILE(             10, "Invalid class file: "),
    ;

    private int code;
    private String comment;
}
